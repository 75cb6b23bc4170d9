package dtm.graph.storage.containers;

import dtm.graph.core.LifecycleService;
import dtm.graph.core.ObjectGraph;
import dtm.graph.core.ServiceContainer;
import dtm.graph.exceptions.CompositeShutdownException;
import dtm.graph.exceptions.DependencyGraphException;
import dtm.graph.exceptions.InvalidServiceRegistrationException;
import dtm.graph.exceptions.ServiceLifecycleException;
import dtm.graph.exceptions.ServiceNotFoundException;
import dtm.graph.storage.GraphObject;
import dtm.graph.storage.ObjectGraphStorage;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

@Slf4j
public class ServiceContainerStorage implements ServiceContainer {

    private final ReadWriteLock lock;
    private final ObjectGraph graph;
    private final List<String> order;
    private final Map<String, Object> services;
    private boolean ready;

    public ServiceContainerStorage(){
        this(new ObjectGraphStorage());
    }

    public ServiceContainerStorage(@NonNull ObjectGraph graph){
        this.lock = new ReentrantReadWriteLock();
        this.graph = graph;
        this.order = new ArrayList<>(16);
        this.services = new HashMap<>(16);
        this.ready = false;
    }

    @Override
    public void ready() throws ServiceLifecycleException {
        lock.readLock().lock();
        try {
            if (ready) return;
        } finally {
            lock.readLock().unlock();
        }

        lock.writeLock().lock();
        try {
            if (ready) return;

            try {
                graph.populate();
            } catch (DependencyGraphException e) {
                throw new ServiceLifecycleException("Falha ao popular o grafo ==> causa: " + e.getMessage(), e);
            }

            for (String id : order) {
                Object service = services.get(id);
                if (service instanceof LifecycleService) {
                    log.info("[iniciando] {}", id);
                    try {
                        ((LifecycleService) service).startup();
                    } catch (Exception e) {
                        throw new ServiceLifecycleException("Falha ao iniciar o serviço " + id + " ==> causa: " + e.getMessage(), id, e);
                    }
                }
            }
            ready = true;
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public boolean isReady() {
        lock.readLock().lock();
        try {
            return ready;
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public void registerService(@NonNull String id, @NonNull Object service) throws InvalidServiceRegistrationException {
        lock.writeLock().lock();
        try {
            if (ready) {
                log.warn("Registrando o serviço {} depois do contêiner estar pronto", id);
            }

            try {
                graph.provide(GraphObject.named(id, service));
            } catch (DependencyGraphException e) {
                log.error("Erro ao fornecer o serviço {}: {}", id, e.getMessage());
                throw new InvalidServiceRegistrationException(id, e);
            }
            order.add(id);
            services.put(id, service);
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public Object getService(String id) throws ServiceNotFoundException {
        Object service = getServiceOrNull(id);
        if (service == null) {
            throw new ServiceNotFoundException(id);
        }
        return service;
    }

    @Override
    public <T> T getService(String id, @NonNull Class<T> type) throws ServiceNotFoundException {
        return type.cast(getService(id));
    }

    @Override
    public Object getServiceOrNull(String id) {
        lock.readLock().lock();
        try {
            return services.get(id);
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public void shutdown() throws CompositeShutdownException {
        final CompositeShutdownException failures = new CompositeShutdownException();

        lock.writeLock().lock();
        try {
            for (String id : order) {
                Object service = services.get(id);
                if (service instanceof LifecycleService) {
                    log.info("[encerrando] {}", id);
                    try {
                        ((LifecycleService) service).shutdown();
                    } catch (Exception e) {
                        log.error("[encerrando] {}: {}", id, e.getMessage(), e);
                        failures.addError(new ServiceLifecycleException("Falha ao encerrar o serviço " + id, id, e));
                    }
                }
            }
            ready = false;
        } finally {
            lock.writeLock().unlock();
        }

        if (failures.hasErrors()) {
            throw failures;
        }
    }
}
