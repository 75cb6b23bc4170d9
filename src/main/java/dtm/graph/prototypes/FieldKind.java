package dtm.graph.prototypes;

/**
 * Forma de um campo do ponto de vista do resolvedor.
 */
public enum FieldKind {
    /** Referência a uma classe concreta comum: reutilizada ou criada. */
    POINTER,
    /** Valor {@code @Embeddable}: apenas percorrido com a diretiva inline. */
    RECORD,
    /** Interface ou classe abstrata: resolvida na segunda fase. */
    INTERFACE,
    /** {@code java.util.Map}: criado vazio, somente com a diretiva private. */
    MAP,
    UNSUPPORTED
}
