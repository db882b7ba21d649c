package fr.imt.distroforge.distroforge.business.service;

import fr.imt.distroforge.distroforge.business.model.BuildStatus;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Micrometer meters for pipeline executions: finished builds per status,
 * builds currently running and build duration.
 */
@Component
public class BuildMetrics {

    public static final String BUILDS = "distroforge.builds";
    public static final String BUILDS_IN_PROGRESS = "distroforge.builds.in.progress";
    public static final String BUILD_DURATION = "distroforge.build.duration";

    private final MeterRegistry registry;
    private final AtomicInteger inProgress = new AtomicInteger();
    private final Timer duration;
    private final Map<BuildStatus, Counter> finished = new ConcurrentHashMap<>();

    public BuildMetrics(MeterRegistry registry) {
        this.registry = registry;
        Gauge.builder(BUILDS_IN_PROGRESS, inProgress, AtomicInteger::get)
                .description("Builds currently in progress")
                .register(registry);
        this.duration = Timer.builder(BUILD_DURATION)
                .description("Duration of a build from its first stage to its terminal status")
                .register(registry);
    }

    public Timer.Sample buildStarted() {
        inProgress.incrementAndGet();
        return Timer.start(registry);
    }

    public void buildFinished(Timer.Sample sample, BuildStatus outcome) {
        inProgress.decrementAndGet();
        sample.stop(duration);
        finished.computeIfAbsent(outcome, status -> Counter.builder(BUILDS)
                        .description("Builds that reached a terminal status")
                        .tag("status", status.name().toLowerCase(Locale.ROOT))
                        .register(registry))
                .increment();
    }
}
