package io.streamgateway.server.core;

import io.streamgateway.core.CloseReason;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static io.streamgateway.server.core.TestSupport.utf8;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EventBufferTest {

    private static final Duration SHORT = Duration.ofMillis(20);

    @Test
    void deliversInOfferOrder() throws Exception {
        EventBuffer buffer = new EventBuffer(10);
        buffer.offer(utf8("a"));
        buffer.offer(utf8("b"));
        buffer.offer(utf8("c"));

        assertThat(drain(buffer)).containsExactly("a", "b", "c");
        assertThat(buffer.dropCount()).isZero();
    }

    @Test
    void overflowDropsOldestAndCountsEachDrop() throws Exception {
        EventBuffer buffer = new EventBuffer(3);
        for (int i = 1; i <= 10; i++) {
            assertThat(buffer.offer(utf8(Integer.toString(i)))).isTrue();
        }

        assertThat(buffer.size()).isEqualTo(3);
        assertThat(buffer.dropCount()).isEqualTo(7);
        assertThat(drain(buffer)).containsExactly("8", "9", "10");
    }

    @Test
    void pollReturnsIdleAfterTimeout() throws Exception {
        EventBuffer buffer = new EventBuffer(1);
        long start = System.nanoTime();

        assertThat(buffer.poll(SHORT)).isInstanceOf(EventBuffer.Read.Idle.class);
        assertThat(Duration.ofNanos(System.nanoTime() - start)).isGreaterThanOrEqualTo(SHORT);
    }

    @Test
    void closeDrainsBufferedFramesBeforeEnd() throws Exception {
        EventBuffer buffer = new EventBuffer(5);
        buffer.offer(utf8("a"));
        buffer.offer(utf8("b"));

        assertThat(buffer.close(CloseReason.BACKEND_COMPLETE)).isTrue();
        assertThat(buffer.close(CloseReason.BACKEND_ERROR)).isFalse();
        assertThat(buffer.offer(utf8("late"))).isFalse();

        assertThat(drain(buffer)).containsExactly("a", "b");
        EventBuffer.Read last = buffer.poll(SHORT);
        assertThat(last).isEqualTo(new EventBuffer.Read.End(CloseReason.BACKEND_COMPLETE));
    }

    @Test
    void blockedPollWakesOnOffer() throws Exception {
        EventBuffer buffer = new EventBuffer(5);
        Thread writer = new Thread(() -> {
            try {
                Thread.sleep(50);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            buffer.offer(utf8("x"));
        });
        writer.start();

        EventBuffer.Read read = buffer.poll(Duration.ofSeconds(5));
        writer.join();

        assertThat(read).isInstanceOf(EventBuffer.Read.Frame.class);
        assertThat(new String(((EventBuffer.Read.Frame) read).payload())).isEqualTo("x");
    }

    @Test
    void blockedPollWakesOnClose() throws Exception {
        EventBuffer buffer = new EventBuffer(5);
        Thread closer = new Thread(() -> buffer.close(CloseReason.CLIENT_CANCEL));
        closer.start();

        EventBuffer.Read read = buffer.poll(Duration.ofSeconds(5));
        closer.join();

        assertThat(read).isEqualTo(new EventBuffer.Read.End(CloseReason.CLIENT_CANCEL));
    }

    @Test
    void rejectsNonPositiveCapacity() {
        assertThatThrownBy(() -> new EventBuffer(0)).isInstanceOf(IllegalArgumentException.class);
    }

    private static List<String> drain(EventBuffer buffer) throws InterruptedException {
        List<String> out = new ArrayList<>();
        while (true) {
            EventBuffer.Read read = buffer.poll(Duration.ZERO);
            if (!(read instanceof EventBuffer.Read.Frame frame)) return out;
            out.add(new String(frame.payload()));
        }
    }
}
