package io.streamgateway.server.core;

import io.streamgateway.core.CloseReason;
import io.streamgateway.core.GatewayException;
import io.streamgateway.server.spi.BackendRegistry;
import io.streamgateway.server.spi.CallOutcome;
import io.streamgateway.server.spi.InMemoryBackendRegistry;
import io.streamgateway.server.spi.Registration;
import io.streamgateway.server.spi.RegistryListener;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;

import static io.streamgateway.server.core.TestSupport.await;
import static io.streamgateway.server.core.TestSupport.utf8;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class GatewayTest {

    private static final URI MATH = URI.create("http://127.0.0.1:9001");

    private FakeBackendConnector connector;
    private InMemoryBackendRegistry registry;
    private Gateway gateway;

    @BeforeEach
    void setUp() {
        connector = new FakeBackendConnector();
        registry = new InMemoryBackendRegistry();
        registry.register("math1", MATH, Map.of());
        gateway = Gateway.builder(registry, connector).backendIdleTimeout(Duration.ZERO).build();
    }

    @AfterEach
    void tearDown() {
        gateway.close();
    }

    @Test
    void connectCopiesAddressFromRegistry() throws Exception {
        Session session = gateway.connect("math1");

        assertThat(session.backendName()).isEqualTo("math1");
        assertThat(session.backendAddress()).isEqualTo(MATH);
        assertThat(connector.lastStream().address).isEqualTo(MATH);
        await(() -> session.state() == SessionState.STREAMING);
    }

    @Test
    void connectToUnknownNameCreatesNothing() {
        assertThatThrownBy(() -> gateway.connect("nope"))
                .isInstanceOf(GatewayException.NameNotFound.class)
                .hasMessageContaining("nope");
        assertThat(gateway.sessions().size()).isZero();
        assertThat(connector.opened).isEmpty();
    }

    @Test
    void callOnUnknownSessionHasNoSideEffects() {
        gateway.connect("math1");

        assertThatThrownBy(() -> gateway.call("missing", "add", utf8("{}"), "application/json"))
                .isInstanceOf(GatewayException.SessionNotFound.class);
        assertThat(gateway.sessions().size()).isEqualTo(1);
        assertThat(connector.calls).hasValue(0);
    }

    @Test
    void callPassesBackendResultThrough() {
        connector.callHandler = (address, method, payload) ->
                CallOutcome.ok(200, utf8("{\"result\":15}"), "application/json");
        Session session = gateway.connect("math1");

        CallResult result = gateway.call(session.id(), "add", utf8("{\"a\":10,\"b\":5}"), "application/json");

        assertThat(result.status()).isEqualTo(200);
        assertThat(new String(result.body())).isEqualTo("{\"result\":15}");
        assertThat(result.contentType()).isEqualTo("application/json");
    }

    @Test
    void backendErrorSurfacesAsCallError() {
        connector.callHandler = (address, method, payload) ->
                CallOutcome.error(400, "http_400", "division by zero");
        Session session = gateway.connect("math1");

        assertThatThrownBy(() -> gateway.call(session.id(), "divide", utf8("{\"a\":1,\"b\":0}"), "application/json"))
                .isInstanceOfSatisfying(GatewayException.BackendCallError.class, e -> {
                    assertThat(e.status()).isEqualTo(400);
                    assertThat(e.backendCode()).isEqualTo("http_400");
                    assertThat(e.getMessage()).isEqualTo("division by zero");
                });
        assertThat(session.isCancelled()).isFalse();
    }

    @Test
    void callLeavesStreamUntouched() throws Exception {
        Session session = gateway.connect("math1");
        connector.lastStream().emit("a");
        await(() -> session.buffer().size() == 1);

        gateway.call(session.id(), "add", utf8("{}"), "application/json");

        assertThat(session.buffer().size()).isEqualTo(1);
        assertThat(session.state()).isEqualTo(SessionState.STREAMING);
    }

    @Test
    void rejectsMethodNamesWithPathSegments() {
        Session session = gateway.connect("math1");

        assertThatThrownBy(() -> gateway.call(session.id(), "../admin", utf8("{}"), "application/json"))
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(connector.calls).hasValue(0);
    }

    @Test
    void closingGatewayCancelsSessions() throws Exception {
        Session session = gateway.connect("math1");

        gateway.close();

        await(() -> session.state() == SessionState.CLOSED);
        assertThat(gateway.sessions().size()).isZero();
    }

    @Test
    void abandonedAttachReleasesSession() throws Exception {
        Session session = gateway.connect("math1");
        StreamPublisher publisher = gateway.attachStream(session.id());
        assertThat(session.isAttached()).isTrue();

        assertThat(publisher.abandon()).isTrue();

        await(() -> session.state() == SessionState.CLOSED);
        assertThat(session.closeReason()).contains(CloseReason.CLIENT_CANCEL);
        assertThat(gateway.sessions().lookup(session.id())).isEmpty();
        assertThat(connector.lastStream().closeCalls).hasValue(1);
        assertThat(publisher.abandon()).isFalse();
    }

    @Test
    void abandonAfterSubscribeIsIgnored() throws Exception {
        Session session = gateway.connect("math1");
        StreamPublisher publisher = gateway.attachStream(session.id());
        TestSupport.RecordingSubscriber subscriber = new TestSupport.RecordingSubscriber();
        publisher.subscribe(subscriber);

        assertThat(publisher.abandon()).isFalse();
        assertThat(session.isCancelled()).isFalse();
    }

    @Test
    void closeDetachesFromRegistry() {
        List<RegistryListener> live = new CopyOnWriteArrayList<>();
        BackendRegistry tracking = new BackendRegistry() {
            @Override
            public Optional<Registration> resolve(String name) {
                return registry.resolve(name);
            }

            @Override
            public void addListener(RegistryListener listener) {
                live.add(listener);
            }

            @Override
            public void removeListener(RegistryListener listener) {
                live.remove(listener);
            }
        };

        Gateway detached = Gateway.builder(tracking, connector).backendIdleTimeout(Duration.ZERO).build();
        assertThat(live).hasSize(1);

        detached.close();
        assertThat(live).isEmpty();
    }
}
