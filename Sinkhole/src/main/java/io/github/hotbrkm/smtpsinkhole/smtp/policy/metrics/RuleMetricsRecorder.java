package io.github.hotbrkm.smtpsinkhole.smtp.policy.metrics;

import io.github.hotbrkm.smtpsinkhole.smtp.policy.model.RuleDecision;
import io.github.hotbrkm.smtpsinkhole.smtp.policy.model.SmtpPhase;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

public class RuleMetricsRecorder {

    private final MeterRegistry registry;

    public RuleMetricsRecorder(MeterRegistry registry) {
        this.registry = registry == null ? new SimpleMeterRegistry() : registry;
    }

    public void recordDecision(SmtpPhase phase, RuleDecision decision) {
        if (decision == null) {
            return;
        }

        registry.counter("sinkhole.smtp.rule.decision.total",
                "phase", safe(phase == null ? null : phase.keyword()),
                "action", decision.action().keyword(),
                "default", Boolean.toString(decision.ruleText() == null))
                .increment();
    }

    public void recordListHit(String listDomain) {
        registry.counter("sinkhole.smtp.rule.list.hit",
                "domain", safe(listDomain))
                .increment();
    }

    public void recordLoadFailure() {
        registry.counter("sinkhole.smtp.rule.load.failure").increment();
    }

    private String safe(String value) {
        return value == null || value.isBlank() ? "none" : value;
    }
}
