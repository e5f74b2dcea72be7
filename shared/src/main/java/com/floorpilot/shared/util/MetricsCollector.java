package com.floorpilot.shared.util;

import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.DoubleAdder;

/**
 * Counters, cumulative gauges and timed spans for training runs.
 *
 * Tracks episode and step counts, illegal action substitutions, good and
 * defective parts and wall-clock time spent per phase. Thread-safe so that
 * independent environment workers may share one collector.
 */
public class MetricsCollector {

    private final Map<String, AtomicLong> counters = new ConcurrentHashMap<>();
    private final Map<String, DoubleAdder> gauges = new ConcurrentHashMap<>();

    /**
     * Starts a timed span. Use in try-with-resources; closing records
     * {@code <name>.duration_ms} and decrements {@code <name>.active}.
     *
     * @param name the span name (e.g. "train.episode")
     */
    public Span startSpan(String name) {
        long startTime = System.nanoTime();
        counter(name + ".active").incrementAndGet();
        counter(name + ".total").incrementAndGet();
        return () -> {
            long elapsed = System.nanoTime() - startTime;
            counter(name + ".active").decrementAndGet();
            gauge(name + ".duration_ms").add(elapsed / 1_000_000.0);
        };
    }

    public void incrementCounter(String name) {
        counter(name).incrementAndGet();
    }

    public void incrementCounter(String name, long delta) {
        counter(name).addAndGet(delta);
    }

    /**
     * Adds a value to a cumulative gauge.
     */
    public void recordGauge(String name, double value) {
        gauge(name).add(value);
    }

    /**
     * @return the counter value, or 0 if it was never incremented
     */
    public long getCounter(String name) {
        AtomicLong counter = counters.get(name);
        return counter != null ? counter.get() : 0;
    }

    /**
     * @return the gauge sum, or 0.0 if nothing was recorded
     */
    public double getGauge(String name) {
        DoubleAdder gauge = gauges.get(name);
        return gauge != null ? gauge.sum() : 0.0;
    }

    /**
     * Sorted snapshot of all counters.
     */
    public Map<String, Long> getAllCounters() {
        Map<String, Long> result = new TreeMap<>();
        counters.forEach((k, v) -> result.put(k, v.get()));
        return result;
    }

    /**
     * Sorted snapshot of all gauges.
     */
    public Map<String, Double> getAllGauges() {
        Map<String, Double> result = new TreeMap<>();
        gauges.forEach((k, v) -> result.put(k, v.sum()));
        return result;
    }

    public void reset() {
        counters.clear();
        gauges.clear();
    }

    private AtomicLong counter(String name) {
        return counters.computeIfAbsent(name, k -> new AtomicLong(0));
    }

    private DoubleAdder gauge(String name) {
        return gauges.computeIfAbsent(name, k -> new DoubleAdder());
    }

    /**
     * A span that records its duration when closed.
     */
    @FunctionalInterface
    public interface Span extends AutoCloseable {
        @Override
        void close();
    }
}
