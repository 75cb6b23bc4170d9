package dtm.graph.exceptions;

import lombok.Getter;

@Getter
public class ServiceNotFoundException extends DependencyGraphException {
    private final String serviceId;

    public ServiceNotFoundException(String serviceId){
        super(GraphErrorType.SERVICE_NOT_FOUND, "Serviço não encontrado: " + serviceId);
        this.serviceId = serviceId;
    }
}
