package io.admission.metrics;

import com.codahale.metrics.Counter;
import com.codahale.metrics.Gauge;
import com.codahale.metrics.Meter;
import com.codahale.metrics.MetricRegistry;
import com.codahale.metrics.Timer;

import java.util.function.Supplier;

public class Metrics {
    private final MetricRegistry registry;

    public Metrics(MetricRegistry registry) {
        this.registry = registry == null ? new MetricRegistry() : registry;
    }

    public MetricRegistry registry() { return registry; }

    public Counter counter(String name) { return registry.counter(name); }
    public Meter meter(String name) { return registry.meter(name); }
    public Timer timer(String name) { return registry.timer(name); }

    /** Registers a gauge once; a second registration under the same name keeps the first. */
    public <T> void gauge(String name, Supplier<T> value) {
        Gauge<T> gauge = value::get;
        registry.gauge(name, () -> gauge);
    }
}
