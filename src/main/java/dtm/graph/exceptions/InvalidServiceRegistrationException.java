package dtm.graph.exceptions;

import lombok.Getter;

@Getter
public class InvalidServiceRegistrationException extends DependencyGraphException {
    private final String serviceId;

    public InvalidServiceRegistrationException(String serviceId, Throwable th){
        super(GraphErrorType.SERVICE_REGISTRATION, "Falha ao registrar o serviço " + serviceId + " ==> causa: " + th.getMessage(), th);
        this.serviceId = serviceId;
    }
}
