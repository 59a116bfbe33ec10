package com.homeservices.marketplace.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Micrometer metrics for provider matching.
 *
 * Metrics exposed at /actuator/prometheus:
 *
 *   marketplace_match_requests_total{result="matched|empty"}
 *   marketplace_match_latency_seconds{quantile="0.5|0.95|0.99"}
 *   marketplace_match_candidates    eligible providers scored per request
 */
@Component
public class MatchingMetrics {

    private final Counter matchedCounter;
    private final Counter emptyCounter;
    private final Timer   matchLatencyTimer;
    private final DistributionSummary candidatesSummary;

    public MatchingMetrics(MeterRegistry registry) {
        this.matchedCounter = Counter.builder("marketplace.match.requests")
                .tag("result", "matched")
                .description("Match requests that returned at least one provider")
                .register(registry);

        this.emptyCounter = Counter.builder("marketplace.match.requests")
                .tag("result", "empty")
                .description("Match requests with no eligible provider")
                .register(registry);

        this.matchLatencyTimer = Timer.builder("marketplace.match.latency")
                .description("Time to retrieve, score and rank providers for one request")
                .publishPercentiles(0.5, 0.95, 0.99)
                .minimumExpectedValue(Duration.ofMillis(1))
                .maximumExpectedValue(Duration.ofSeconds(2))
                .register(registry);

        this.candidatesSummary = DistributionSummary
                .builder("marketplace.match.candidates")
                .description("Eligible providers scored per match request")
                .register(registry);
    }

    public void recordMatched(int candidates) { matchedCounter.increment(); candidatesSummary.record(candidates); }
    public void recordEmpty()                 { emptyCounter.increment(); }
    public Timer getMatchLatencyTimer()       { return matchLatencyTimer; }
}
