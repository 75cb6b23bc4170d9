package dtm.graph.core;

import dtm.graph.exceptions.CompositeShutdownException;
import dtm.graph.exceptions.InvalidServiceRegistrationException;
import dtm.graph.exceptions.ServiceLifecycleException;
import dtm.graph.exceptions.ServiceNotFoundException;

/**
 * Contêiner de serviços nomeados apoiado em um {@link ObjectGraph}.
 *
 * Os serviços são fornecidos ao grafo como objetos nomeados; {@link #ready()} liga o grafo
 * uma única vez e inicializa os serviços na ordem de registro.
 */
public interface ServiceContainer {

    /**
     * Liga o grafo e chama {@link LifecycleService#startup()} em cada serviço, na ordem
     * de registro. Chamadas posteriores a um sucesso não têm efeito.
     *
     * @throws ServiceLifecycleException se o grafo não puder ser ligado ou um serviço falhar ao iniciar
     */
    void ready() throws ServiceLifecycleException;

    boolean isReady();

    /**
     * Registra um serviço sob um identificador único.
     *
     * @throws InvalidServiceRegistrationException se o grafo rejeitar o serviço
     */
    void registerService(String id, Object service) throws InvalidServiceRegistrationException;

    /**
     * @throws ServiceNotFoundException se nenhum serviço foi registrado com o identificador
     */
    Object getService(String id) throws ServiceNotFoundException;

    <T> T getService(String id, Class<T> type) throws ServiceNotFoundException;

    /**
     * @return o serviço, ou {@code null} se nenhum foi registrado com o identificador
     */
    Object getServiceOrNull(String id);

    /**
     * Chama {@link LifecycleService#shutdown()} em todos os serviços, na ordem de registro.
     * Uma falha não impede o encerramento dos demais.
     *
     * @throws CompositeShutdownException com as falhas acumuladas, depois de todos os serviços
     */
    void shutdown() throws CompositeShutdownException;
}
