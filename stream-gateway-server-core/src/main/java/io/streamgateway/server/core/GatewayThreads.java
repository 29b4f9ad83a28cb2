package io.streamgateway.server.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.reflect.Method;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Thread sources for bridges and stream publishers.
 *
 * <p>Uses virtual threads when the runtime offers them and a cached pool of named daemon threads
 * otherwise. Both tolerate thousands of mostly-blocked tasks.
 */
public final class GatewayThreads {

    private static final Logger log = LoggerFactory.getLogger(GatewayThreads.class);

    private GatewayThreads() {
    }

    public static ExecutorService newExecutor(String namePrefix) {
        Objects.requireNonNull(namePrefix, "namePrefix");
        try {
            Method method = Executors.class.getMethod("newVirtualThreadPerTaskExecutor");
            return (ExecutorService) method.invoke(null);
        } catch (ReflectiveOperationException | UnsupportedOperationException e) {
            log.debug("Virtual threads unavailable, using a cached pool for {}", namePrefix);
            return Executors.newCachedThreadPool(new NamedThreadFactory(namePrefix));
        }
    }

    static ScheduledExecutorService newScheduler(String namePrefix) {
        return Executors.newSingleThreadScheduledExecutor(new NamedThreadFactory(namePrefix));
    }

    private static final class NamedThreadFactory implements ThreadFactory {
        private final String prefix;
        private final AtomicInteger counter = new AtomicInteger();

        private NamedThreadFactory(String prefix) {
            this.prefix = prefix;
        }

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable);
            thread.setName(prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
