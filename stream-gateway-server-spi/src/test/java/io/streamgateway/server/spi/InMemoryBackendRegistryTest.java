package io.streamgateway.server.spi;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryBackendRegistryTest {

    private static final Instant NOW = Instant.parse("2024-01-01T00:00:00Z");

    private InMemoryBackendRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new InMemoryBackendRegistry(Clock.fixed(NOW, ZoneId.of("UTC")));
    }

    @Test
    void testRegisterStripsTrailingSlash() {
        RegisterOutcome outcome = registry.register("math1", URI.create("http://127.0.0.1:9001/"), Map.of("kind", "math"));

        assertEquals(RegisterOutcome.Status.REGISTERED, outcome.status());
        Registration reg = registry.resolve("math1").orElseThrow();
        assertEquals(URI.create("http://127.0.0.1:9001"), reg.backendAddress());
        assertEquals("math", reg.meta().get("kind"));
        assertEquals(NOW, reg.registeredAt());
    }

    @Test
    void testDuplicateNameKeepsFirstRegistration() {
        registry.register("math1", URI.create("http://a:1"), null);
        RegisterOutcome second = registry.register("math1", URI.create("http://b:2"), null);

        assertEquals(RegisterOutcome.Status.NAME_TAKEN, second.status());
        assertEquals(URI.create("http://a:1"), registry.resolve("math1").orElseThrow().backendAddress());
    }

    @Test
    void testRejectsRelativeUrl() {
        assertThrows(IllegalArgumentException.class, () -> registry.register("x", URI.create("/math"), null));
        assertTrue(registry.list().isEmpty());
    }

    @Test
    void testUnregisterNotifiesListeners() {
        List<String> removed = new ArrayList<>();
        registry.addListener(r -> removed.add(r.name()));
        registry.register("math1", URI.create("http://a:1"), null);

        assertTrue(registry.unregister("math1").isPresent());
        assertFalse(registry.unregister("math1").isPresent());
        assertEquals(List.of("math1"), removed);
        assertTrue(registry.resolve("math1").isEmpty());
    }

    @Test
    void testRemovedListenerIsNotNotified() {
        List<String> removed = new ArrayList<>();
        RegistryListener listener = r -> removed.add(r.name());
        registry.addListener(listener);
        registry.register("math1", URI.create("http://a:1"), null);

        registry.removeListener(listener);
        registry.removeListener(listener);

        assertTrue(registry.unregister("math1").isPresent());
        assertTrue(removed.isEmpty());
    }

    @Test
    void testListIsSortedSnapshot() {
        registry.register("zeta", URI.create("http://z:1"), null);
        registry.register("alpha", URI.create("http://a:1"), null);

        Map<String, Registration> snapshot = registry.list();
        registry.unregister("zeta");

        assertEquals(List.of("alpha", "zeta"), new ArrayList<>(snapshot.keySet()));
        assertEquals(1, registry.list().size());
    }

    @Test
    void testResolveNullName() {
        assertTrue(registry.resolve(null).isEmpty());
    }
}
