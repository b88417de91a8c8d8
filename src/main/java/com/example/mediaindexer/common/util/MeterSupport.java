package com.example.mediaindexer.common.util;

import io.micrometer.core.instrument.MeterRegistry;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Null-tolerant metric helpers. A missing registry or a failing meter never reaches the caller.
 */
public final class MeterSupport {

    private static final Logger log = LoggerFactory.getLogger(MeterSupport.class);

    private MeterSupport() {
    }

    public static void incrementCounter(MeterRegistry meterRegistry, String name, double value, String... tags) {
        if (meterRegistry == null || value <= 0) {
            return;
        }
        try {
            meterRegistry.counter(name, tags).increment(value);
        } catch (Exception e) {
            log.debug("Metric counter update failed, name={}", name, e);
        }
    }

    public static void recordDuration(MeterRegistry meterRegistry, String name, long nanos, String... tags) {
        if (meterRegistry == null || nanos <= 0) {
            return;
        }
        try {
            meterRegistry.timer(name, tags).record(nanos, TimeUnit.NANOSECONDS);
        } catch (Exception e) {
            log.debug("Metric timer update failed, name={}", name, e);
        }
    }
}
