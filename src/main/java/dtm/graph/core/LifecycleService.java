package dtm.graph.core;

/**
 * Capacidade opcional de um serviço registrado em um {@link ServiceContainer}.
 * Serviços que não a implementam são ignorados na inicialização e no encerramento.
 */
public interface LifecycleService {
    void startup() throws Exception;
    void shutdown() throws Exception;
}
