package dtm.graph.storage.containers;

import dtm.graph.annotations.Embeddable;
import dtm.graph.annotations.Inject;
import dtm.graph.core.LifecycleService;
import dtm.graph.exceptions.CompositeShutdownException;
import dtm.graph.exceptions.GraphErrorType;
import dtm.graph.exceptions.InjectionException;
import dtm.graph.exceptions.InvalidObjectProvideException;
import dtm.graph.exceptions.InvalidServiceRegistrationException;
import dtm.graph.exceptions.ServiceLifecycleException;
import dtm.graph.exceptions.ServiceNotFoundException;
import dtm.graph.storage.GraphObject;
import dtm.graph.storage.ObjectGraphStorage;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link ServiceContainerStorage}.
 */
class ServiceContainerStorageTest {

    @Test
    void readyStartsServicesInRegistrationOrderOnce() {
        List<String> events = new ArrayList<>();
        ServiceContainerStorage container = new ServiceContainerStorage();
        container.registerService("cache", new RecordingService("cache", events));
        container.registerService("plain", new Store());
        container.registerService("http", new RecordingService("http", events));

        container.ready();
        container.ready();

        assertThat(container.isReady()).isTrue();
        assertThat(events).containsExactly("start cache", "start http");
    }

    @Test
    void servicesAreWiredThroughNamedDirectives() {
        ServiceContainerStorage container = new ServiceContainerStorage();
        Store store = new Store();
        Api api = new Api();
        container.registerService("store", store);
        container.registerService("api", api);

        container.ready();

        assertThat(api.store).isSameAs(store);
        assertThat(container.getService("api", Api.class)).isSameAs(api);
    }

    @Test
    void dependenciesCreatedForServicesAreListedOnce() {
        ObjectGraphStorage graph = new ObjectGraphStorage();
        ServiceContainerStorage container = new ServiceContainerStorage(graph);
        Checkout checkout = new Checkout();
        container.registerService("checkout", checkout);

        container.ready();

        assertThat(checkout.payments).isNotNull();
        assertThat(checkout.payments.retry).isNotNull();
        assertThat(graph.getObjects()).extracting(GraphObject::getValue)
                .containsExactly(checkout.payments, checkout.payments.retry, checkout);
    }

    @Test
    void startupFailureAbortsReady() {
        List<String> events = new ArrayList<>();
        ServiceContainerStorage container = new ServiceContainerStorage();
        container.registerService("first", new RecordingService("first", events));
        container.registerService("broken", new RecordingService("broken", events, true, false));
        container.registerService("last", new RecordingService("last", events));

        assertThatThrownBy(container::ready)
                .isInstanceOf(ServiceLifecycleException.class)
                .hasMessageContaining("broken")
                .satisfies(e -> assertThat(((ServiceLifecycleException) e).getServiceId()).isEqualTo("broken"))
                .hasRootCauseInstanceOf(IllegalStateException.class);

        assertThat(container.isReady()).isFalse();
        assertThat(events).containsExactly("start first", "start broken");
    }

    @Test
    void graphFailureIsReportedAsLifecycleFailure() {
        ServiceContainerStorage container = new ServiceContainerStorage();
        container.registerService("api", new Api());

        assertThatThrownBy(container::ready)
                .isInstanceOf(ServiceLifecycleException.class)
                .hasCauseInstanceOf(InjectionException.class)
                .extracting("errorType").isEqualTo(GraphErrorType.SERVICE_LIFECYCLE);
        assertThat(container.isReady()).isFalse();
    }

    @Test
    void shutdownReachesEveryServiceAndCollectsFailures() {
        List<String> events = new ArrayList<>();
        ServiceContainerStorage container = new ServiceContainerStorage();
        container.registerService("first", new RecordingService("first", events));
        container.registerService("broken", new RecordingService("broken", events, false, true));
        container.registerService("last", new RecordingService("last", events));
        container.ready();
        events.clear();

        assertThatThrownBy(container::shutdown)
                .isInstanceOf(CompositeShutdownException.class)
                .satisfies(e -> {
                    CompositeShutdownException error = (CompositeShutdownException) e;
                    assertThat(error.getErrorsSize()).isEqualTo(1);
                    assertThat(error.hasError(ServiceLifecycleException.class)).isTrue();
                    assertThat(error.getFirstError()).hasMessageContaining("broken");
                });

        assertThat(events).containsExactly("stop first", "stop broken", "stop last");
        assertThat(container.isReady()).isFalse();
    }

    @Test
    void cleanShutdownDoesNotThrow() {
        List<String> events = new ArrayList<>();
        ServiceContainerStorage container = new ServiceContainerStorage();
        container.registerService("only", new RecordingService("only", events));
        container.ready();

        container.shutdown();

        assertThat(events).containsExactly("start only", "stop only");
        assertThat(container.isReady()).isFalse();
    }

    @Test
    void duplicateIdIsRejected() {
        ServiceContainerStorage container = new ServiceContainerStorage();
        container.registerService("store", new Store());

        assertThatThrownBy(() -> container.registerService("store", new Store()))
                .isInstanceOf(InvalidServiceRegistrationException.class)
                .hasCauseInstanceOf(InvalidObjectProvideException.class)
                .satisfies(e -> assertThat(((InvalidServiceRegistrationException) e).getServiceId()).isEqualTo("store"));
    }

    @Test
    void unknownServiceIsNotFound() {
        ServiceContainerStorage container = new ServiceContainerStorage();

        assertThatThrownBy(() -> container.getService("missing"))
                .isInstanceOf(ServiceNotFoundException.class)
                .extracting("serviceId").isEqualTo("missing");
        assertThat(container.getServiceOrNull("missing")).isNull();
    }

    @Test
    void lateRegistrationIsStillAvailable() {
        ServiceContainerStorage container = new ServiceContainerStorage();
        container.registerService("store", new Store());
        container.ready();

        Store late = new Store();
        container.registerService("late", late);

        assertThat(container.getService("late")).isSameAs(late);
        assertThat(container.isReady()).isTrue();
    }

    // Test fixtures

    static class Store {
    }

    static class Api {
        @Inject("store")
        public Store store;
    }

    @Embeddable
    static class RetryPolicy {
        public int attempts;
    }

    static class Payments {
        @Inject("inline")
        public RetryPolicy retry;
    }

    static class Checkout {
        @Inject
        public Payments payments;
    }

    static class RecordingService implements LifecycleService {
        private final String id;
        private final List<String> events;
        private final boolean failOnStartup;
        private final boolean failOnShutdown;

        RecordingService(String id, List<String> events) {
            this(id, events, false, false);
        }

        RecordingService(String id, List<String> events, boolean failOnStartup, boolean failOnShutdown) {
            this.id = id;
            this.events = events;
            this.failOnStartup = failOnStartup;
            this.failOnShutdown = failOnShutdown;
        }

        @Override
        public void startup() {
            events.add("start " + id);
            if (failOnStartup) {
                throw new IllegalStateException(id + " failed to start");
            }
        }

        @Override
        public void shutdown() {
            events.add("stop " + id);
            if (failOnShutdown) {
                throw new IllegalStateException(id + " failed to stop");
            }
        }
    }
}
