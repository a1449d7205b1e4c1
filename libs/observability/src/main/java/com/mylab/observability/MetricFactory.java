package com.mylab.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;

import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Counters for the lab's state machines. Every meter is tagged with the owning service.
 *
 * <ul>
 *   <li>{@code lab.<machine>.transitions{to}}: one increment per committed state change</li>
 *   <li>{@code lab.analysis.supersessions{outcome}}: supersession attempts and how they ended</li>
 * </ul>
 */
public final class MetricFactory {

    public static final String TAG_SERVICE = "service";

    public static final String TAG_TARGET = "to";

    public static final String TAG_OUTCOME = "outcome";

    public static final String SUPERSESSIONS = "lab.analysis.supersessions";

    private final MeterRegistry registry;
    private final String serviceName;
    private final Map<String, Counter> counters = new ConcurrentHashMap<>();

    public MetricFactory(MeterRegistry registry, String serviceName) {
        if (registry == null) {
            throw new IllegalArgumentException("registry must not be null");
        }
        if (serviceName == null || serviceName.isBlank()) {
            throw new IllegalArgumentException("serviceName must not be null or blank");
        }
        this.registry = registry;
        this.serviceName = serviceName;
    }

    public static String transitionsMetric(String machine) {
        return "lab." + machine + ".transitions";
    }

    /**
     * Counts a committed move of {@code machine} (e.g. {@code batch}, {@code handoff}) into {@code target}.
     */
    public void stateTransition(String machine, String target) {
        counter(transitionsMetric(machine), "Committed " + machine + " state transitions", TAG_TARGET, target)
                .increment();
    }

    public void supersession(SupersessionOutcome outcome) {
        counter(SUPERSESSIONS, "Analysis supersession attempts", TAG_OUTCOME, outcome.tagValue()).increment();
    }

    private Counter counter(String name, String description, String tagKey, String tagValue) {
        return counters.computeIfAbsent(name + '|' + tagValue, key -> Counter.builder(name)
                .description(description)
                .tag(TAG_SERVICE, serviceName)
                .tag(tagKey, tagValue)
                .register(registry));
    }

    /**
     * How a request to replace the authoritative analysis ended.
     */
    public enum SupersessionOutcome {
        /** The predecessor was replaced. */
        SUPERSEDED,
        /** The predecessor had already lost authority. */
        STALE;

        public String tagValue() {
            return name().toLowerCase(Locale.ROOT);
        }
    }
}
