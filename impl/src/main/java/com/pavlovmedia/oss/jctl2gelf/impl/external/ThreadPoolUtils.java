package com.pavlovmedia.oss.jctl2gelf.impl.external;

import java.util.Objects;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BiConsumer;

/**
 * Note: This class was copy-pasta from a different pavlov project
 * Thread helpers
 */
public final class ThreadPoolUtils {
    private ThreadPoolUtils() { }

    /**
     * Builds daemon threads named <code>name-N</code> so background loops
     * never keep the JVM alive on their own.
     */
    public static ThreadFactory getDaemonThreadFactory(final String name, final AtomicInteger counter, 
            final BiConsumer<Thread, Throwable> uncaughtHandler) {
        Objects.requireNonNull(name, "name is Null");
        Objects.requireNonNull(counter, "counter is Null");
        Objects.requireNonNull(uncaughtHandler, "uncaughtHandler is Null");
        return r -> {
           Thread ret = new Thread(r);
           ret.setName(String.format("%s-%d", name, counter.incrementAndGet()));
           ret.setDaemon(true);
           ret.setUncaughtExceptionHandler(uncaughtHandler::accept);
           return ret;
        };
     }
}
