package dtm.graph.exceptions;

import lombok.Getter;

/**
 * Falha ao satisfazer a diretiva de um campo durante o {@code populate()}.
 * Carrega o nome do campo e a classe que o declara para diagnóstico.
 */
@Getter
public class InjectionException extends DependencyGraphException {
    private final String fieldName;
    private final Class<?> declaringClass;

    public InjectionException(GraphErrorType errorType, String message, String fieldName, Class<?> declaringClass){
        super(errorType, message);
        this.fieldName = fieldName;
        this.declaringClass = declaringClass;
    }

    public InjectionException(GraphErrorType errorType, String message, String fieldName, Class<?> declaringClass, Throwable th){
        super(errorType, message, th);
        this.fieldName = fieldName;
        this.declaringClass = declaringClass;
    }
}
