package dtm.graph.exceptions;

import lombok.Getter;

@Getter
public class MalformedDirectiveException extends DependencyGraphException {
    private final String rawDirective;

    public MalformedDirectiveException(String message, String rawDirective){
        super(GraphErrorType.MALFORMED_DIRECTIVE, message);
        this.rawDirective = rawDirective;
    }
}
