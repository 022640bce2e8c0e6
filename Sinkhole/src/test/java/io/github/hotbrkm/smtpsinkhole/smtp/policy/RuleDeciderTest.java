package io.github.hotbrkm.smtpsinkhole.smtp.policy;

import io.github.hotbrkm.smtpsinkhole.smtp.policy.dns.TestDnsResolver;
import io.github.hotbrkm.smtpsinkhole.smtp.policy.metrics.RuleMetricsRecorder;
import io.github.hotbrkm.smtpsinkhole.smtp.policy.model.RuleAction;
import io.github.hotbrkm.smtpsinkhole.smtp.policy.model.RuleContext;
import io.github.hotbrkm.smtpsinkhole.smtp.policy.model.RuleDecision;
import io.github.hotbrkm.smtpsinkhole.smtp.policy.model.SmtpPhase;
import io.github.hotbrkm.smtpsinkhole.smtp.policy.parse.RuleParseException;
import io.github.hotbrkm.smtpsinkhole.smtp.policy.parse.RuleParser;
import io.github.hotbrkm.smtpsinkhole.smtp.policy.rule.Ruleset;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("RuleDecider Test")
class RuleDeciderTest {

    private SimpleMeterRegistry meterRegistry;
    private RuleDecider decider;
    private RuleContext context;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        decider = new RuleDecider(new RuleMetricsRecorder(meterRegistry));
        context = TestRuleContexts.builder(new TestDnsResolver()).build();
    }

    @Test
    @DisplayName("Counts decisions by phase, action and whether a rule decided")
    void decide_recordsMetrics() throws RuleParseException {
        // given
        Ruleset ruleset = RuleParser.parse("test", "@connect stall ip 192.0.2.10");

        // when
        decider.decide(ruleset, SmtpPhase.CONNECT, context);
        decider.decide(ruleset, SmtpPhase.HELO, context);

        // then
        assertThat(meterRegistry.counter("sinkhole.smtp.rule.decision.total",
                "phase", "@connect", "action", "stall", "default", "false").count()).isEqualTo(1.0);
        assertThat(meterRegistry.counter("sinkhole.smtp.rule.decision.total",
                "phase", "@helo", "action", "accept", "default", "true").count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("DATA is decided once per recipient and the first refusal wins")
    void decideData_perRecipient() throws RuleParseException {
        // given
        Ruleset ruleset = RuleParser.parse("test", "@data stall to trap@\n@data reject to spam@");
        context.setCurrentRecipient("last@example.com");

        // when
        RuleDecision decision = decider.decideData(ruleset, context,
                List.of("ok@example.com", "trap@example.com", "spam@example.com"));

        // then
        assertThat(decision.action()).isEqualTo(RuleAction.STALL);
        assertThat(context.getCurrentRecipient()).isEqualTo("last@example.com");
    }

    @Test
    @DisplayName("DATA accepts when every recipient passes")
    void decideData_allPass() throws RuleParseException {
        // given
        Ruleset ruleset = RuleParser.parse("test", "@data reject to spam@");

        // when
        RuleDecision decision = decider.decideData(ruleset, context, List.of("a@example.com", "b@example.com"));

        // then
        assertThat(decision.isAccept()).isTrue();
    }

    @Test
    @DisplayName("DATA without recipients is still decided once")
    void decideData_noRecipients() throws RuleParseException {
        // given
        Ruleset ruleset = RuleParser.parse("test", "@data reject all");

        // when & then
        assertThat(decider.decideData(ruleset, context, List.of()).action()).isEqualTo(RuleAction.REJECT);
    }
}
