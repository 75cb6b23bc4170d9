package dtm.graph.exceptions;

/**
 * Classifica as falhas do grafo de objetos.
 *
 * Todas são locais, síncronas e não devem ser repetidas: indicam um erro de montagem
 * do grafo, não uma falha transitória.
 */
public enum GraphErrorType {
    MALFORMED_DIRECTIVE,
    DUPLICATE_TYPE,
    DUPLICATE_NAME,
    PRE_WIRED_OBJECT,
    SHAPE_VIOLATION,
    MISSING_NAMED,
    TYPE_MISMATCH,
    INLINE_MISUSE,
    INACCESSIBLE,
    UNSUPPORTED_FIELD,
    MAP_MISUSE,
    NO_IMPLEMENTATION,
    AMBIGUOUS_IMPLEMENTATION,
    SERVICE_NOT_FOUND,
    SERVICE_REGISTRATION,
    SERVICE_LIFECYCLE
}
