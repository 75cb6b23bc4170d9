package dtm.graph.exceptions;

import lombok.Getter;

@Getter
public class DependencyGraphException extends RuntimeException {
    private final GraphErrorType errorType;

    public DependencyGraphException(GraphErrorType errorType, String message){
        super(message);
        this.errorType = errorType;
    }

    public DependencyGraphException(GraphErrorType errorType, String message, Throwable th){
        super(message, th);
        this.errorType = errorType;
    }

}
