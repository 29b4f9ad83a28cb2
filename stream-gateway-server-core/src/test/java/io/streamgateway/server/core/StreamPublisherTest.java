package io.streamgateway.server.core;

import io.streamgateway.core.CloseReason;
import io.streamgateway.core.GatewayException;
import io.streamgateway.server.spi.InMemoryBackendRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.Flow;

import static io.streamgateway.server.core.TestSupport.RecordingSubscriber;
import static io.streamgateway.server.core.TestSupport.await;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class StreamPublisherTest {

    private FakeBackendConnector connector;
    private InMemoryBackendRegistry registry;
    private Gateway gateway;

    @BeforeEach
    void setUp() {
        connector = new FakeBackendConnector();
        registry = new InMemoryBackendRegistry();
        registry.register("math1", URI.create("http://127.0.0.1:9001"), Map.of());
        gateway = Gateway.builder(registry, connector)
                .heartbeatInterval(Duration.ofMillis(50))
                .bufferCapacity(2)
                .backendIdleTimeout(Duration.ZERO)
                .build();
    }

    @AfterEach
    void tearDown() {
        gateway.close();
    }

    @Test
    void relaysFramesInOrderThenEndFrame() throws Exception {
        Session session = gateway.connect("math1");
        RecordingSubscriber sub = new RecordingSubscriber();
        gateway.attachStream(session.id()).subscribe(sub);

        FakeBackendConnector.FakeStream stream = connector.lastStream();
        stream.emit("{\"step\":1}");
        await(() -> sub.data().size() == 1);
        stream.emit("{\"step\":2}");
        stream.complete();

        await(() -> sub.completed);
        assertThat(sub.data()).containsExactly("{\"step\":1}", "{\"step\":2}");
        SseFrame last = sub.frames.get(sub.frames.size() - 1);
        assertThat(last.kind()).isEqualTo(SseFrame.Kind.END);
        assertThat(last.render()).isEqualTo("event: end\ndata: {\"reason\":\"backend-complete\"}\n\n");
        await(() -> gateway.sessions().lookup(session.id()).isEmpty());
    }

    @Test
    void emitsHeartbeatWhileBackendIsQuiet() throws Exception {
        Session session = gateway.connect("math1");
        RecordingSubscriber sub = new RecordingSubscriber();
        gateway.attachStream(session.id()).subscribe(sub);

        await(() -> sub.has(SseFrame.Kind.HEARTBEAT));
        connector.lastStream().emit("late");
        await(() -> sub.data().contains("late"));

        assertThat(sub.frames.get(0).kind()).isEqualTo(SseFrame.Kind.HEARTBEAT);
        assertThat(sub.frames.get(0).render()).isEqualTo(":\n\n");
        assertThat(session.state()).isEqualTo(SessionState.STREAMING);
    }

    @Test
    void cancellingSubscriptionClosesSessionWithClientCancel() throws Exception {
        Session session = gateway.connect("math1");
        RecordingSubscriber sub = new RecordingSubscriber();
        gateway.attachStream(session.id()).subscribe(sub);
        await(() -> session.state() == SessionState.STREAMING);

        sub.subscription.cancel();

        await(() -> session.state() == SessionState.CLOSED);
        assertThat(session.closeReason()).contains(CloseReason.CLIENT_CANCEL);
        assertThat(gateway.sessions().lookup(session.id())).isEmpty();
        assertThat(connector.lastStream().closeCalls).hasValue(1);
    }

    @Test
    void failingConsumerCountsAsDisconnect() throws Exception {
        Session session = gateway.connect("math1");
        gateway.attachStream(session.id()).subscribe(new Flow.Subscriber<>() {
            @Override
            public void onSubscribe(Flow.Subscription subscription) {
                subscription.request(Long.MAX_VALUE);
            }

            @Override
            public void onNext(SseFrame item) {
                throw new IllegalStateException("broken pipe");
            }

            @Override
            public void onError(Throwable throwable) {
            }

            @Override
            public void onComplete() {
            }
        });

        connector.lastStream().emit("x");

        await(() -> session.state() == SessionState.CLOSED);
        assertThat(session.closeReason()).contains(CloseReason.CLIENT_CANCEL);
    }

    @Test
    void secondAttachIsRejected() {
        Session session = gateway.connect("math1");
        gateway.attachStream(session.id());

        assertThatThrownBy(() -> gateway.attachStream(session.id()))
                .isInstanceOf(GatewayException.SessionBusy.class);
        assertThat(session.isCancelled()).isFalse();
    }

    @Test
    void unregisterEndsStreamWithReason() throws Exception {
        Session session = gateway.connect("math1");
        RecordingSubscriber sub = new RecordingSubscriber();
        gateway.attachStream(session.id()).subscribe(sub);

        registry.unregister("math1");

        await(() -> sub.completed);
        SseFrame last = sub.frames.get(sub.frames.size() - 1);
        assertThat(last.data()).isEqualTo("{\"reason\":\"backend-unregistered\"}");
        await(() -> session.state() == SessionState.CLOSED);
    }

    @Test
    void slowConsumerSeesOnlyNewestFrames() throws Exception {
        Session session = gateway.connect("math1");
        connector.lastStream().emit("1", "2", "3", "4", "5");
        await(() -> session.buffer().dropCount() == 3);

        RecordingSubscriber sub = new RecordingSubscriber();
        gateway.attachStream(session.id()).subscribe(sub);

        await(() -> sub.data().size() == 2);
        assertThat(sub.data()).containsExactly("4", "5");
    }
}
