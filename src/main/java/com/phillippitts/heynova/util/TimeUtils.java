package com.phillippitts.heynova.util;

import java.util.concurrent.TimeUnit;

/** Millisecond views of {@link System#nanoTime()} intervals for logs and events. */
public final class TimeUtils {

    private TimeUtils() {}

    public static long nanosToMillis(long nanos) {
        return TimeUnit.NANOSECONDS.toMillis(nanos);
    }

    /**
     * @param startNanos a {@link System#nanoTime()} reading
     * @return whole milliseconds since {@code startNanos}, never negative
     */
    public static long elapsedMillis(long startNanos) {
        return Math.max(0L, nanosToMillis(System.nanoTime() - startNanos));
    }
}
