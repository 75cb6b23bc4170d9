package dtm.graph.exceptions;

import lombok.Getter;

@Getter
public class ServiceLifecycleException extends DependencyGraphException {
    private final String serviceId;

    public ServiceLifecycleException(String message, String serviceId, Throwable th){
        super(GraphErrorType.SERVICE_LIFECYCLE, message, th);
        this.serviceId = serviceId;
    }

    public ServiceLifecycleException(String message, Throwable th){
        super(GraphErrorType.SERVICE_LIFECYCLE, message, th);
        this.serviceId = null;
    }
}
