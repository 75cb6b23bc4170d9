package dtm.graph.exceptions;

import lombok.Getter;

/**
 * Rejeição de um objeto no momento em que é fornecido ao grafo.
 */
@Getter
public class InvalidObjectProvideException extends DependencyGraphException {
    private final Class<?> referenceClass;

    public InvalidObjectProvideException(GraphErrorType errorType, String message, Class<?> referenceClass){
        super(errorType, message);
        this.referenceClass = referenceClass;
    }
}
