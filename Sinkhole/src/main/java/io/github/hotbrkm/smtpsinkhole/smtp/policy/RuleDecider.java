package io.github.hotbrkm.smtpsinkhole.smtp.policy;

import io.github.hotbrkm.smtpsinkhole.smtp.policy.metrics.RuleMetricsRecorder;
import io.github.hotbrkm.smtpsinkhole.smtp.policy.model.RuleContext;
import io.github.hotbrkm.smtpsinkhole.smtp.policy.model.RuleDecision;
import io.github.hotbrkm.smtpsinkhole.smtp.policy.model.SmtpPhase;
import io.github.hotbrkm.smtpsinkhole.smtp.policy.rule.Ruleset;
import lombok.extern.slf4j.Slf4j;

import java.util.List;

/**
 * Runs ruleset scans for the SMTP layer and records their outcome.
 *
 * @author hotbrkm
 * @since 1.0.0
 */
@Slf4j
public class RuleDecider {

    private final RuleMetricsRecorder metricsRecorder;

    public RuleDecider(RuleMetricsRecorder metricsRecorder) {
        this.metricsRecorder = metricsRecorder;
    }

    public RuleDecision decide(Ruleset ruleset, SmtpPhase phase, RuleContext context) {
        RuleDecision decision = ruleset.scan(phase, context);
        record(phase, context, decision);
        return decision;
    }

    /**
     * Decides DATA by scanning once per accepted recipient, with each one in
     * turn as the current recipient. The first decision that is not accept wins.
     *
     * @param ruleset    rules of the connection
     * @param context    connection state
     * @param recipients accepted RCPT TO addresses
     * @return the decision
     */
    public RuleDecision decideData(Ruleset ruleset, RuleContext context, List<String> recipients) {
        if (recipients.isEmpty()) {
            return decide(ruleset, SmtpPhase.DATA, context);
        }
        String current = context.getCurrentRecipient();
        RuleDecision decision = null;
        try {
            for (String recipient : recipients) {
                context.setCurrentRecipient(recipient);
                decision = ruleset.scan(SmtpPhase.DATA, context);
                if (!decision.isAccept()) {
                    break;
                }
            }
        } finally {
            context.setCurrentRecipient(current);
        }
        record(SmtpPhase.DATA, context, decision);
        return decision;
    }

    private void record(SmtpPhase phase, RuleContext context, RuleDecision decision) {
        metricsRecorder.recordDecision(phase, decision);
        if (decision.isAccept()) {
            log.debug("rule-decision sessionId={} phase={} action={}", context.getSessionId(), phase, decision.action());
            return;
        }
        log.info("rule-decision sessionId={} phase={} action={} rule=[{}] with={} remote={} mailFrom={} rcpt={}",
                context.getSessionId(),
                phase,
                decision.action(),
                decision.ruleText(),
                decision.withOptions(),
                context.getRemoteIp(),
                context.getMailFrom(),
                context.getCurrentRecipient());
    }
}
