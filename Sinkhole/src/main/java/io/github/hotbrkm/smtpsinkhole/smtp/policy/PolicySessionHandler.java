package io.github.hotbrkm.smtpsinkhole.smtp.policy;

import io.github.hotbrkm.smtpsinkhole.smtp.handler.SmtpSessionRegistry;
import io.github.hotbrkm.smtpsinkhole.smtp.handler.SmtpSessionState;
import io.github.hotbrkm.smtpsinkhole.smtp.policy.metrics.RuleMetricsRecorder;
import io.github.hotbrkm.smtpsinkhole.smtp.policy.model.RuleAction;
import io.github.hotbrkm.smtpsinkhole.smtp.policy.model.RuleContext;
import io.github.hotbrkm.smtpsinkhole.smtp.policy.model.RuleDecision;
import io.github.hotbrkm.smtpsinkhole.smtp.policy.model.SmtpPhase;
import lombok.extern.slf4j.Slf4j;
import org.subethamail.smtp.MessageContext;
import org.subethamail.smtp.server.Session;
import org.subethamail.smtp.server.SessionHandler;

/**
 * Opens the per-connection rule state and runs the {@code @connect} rules.
 */
@Slf4j
public class PolicySessionHandler implements SessionHandler {

    private static final int REJECT_CODE = 554;
    private static final int STALL_CODE = 421;

    private final SmtpSessionRegistry sessionRegistry;
    private final RuleDecider ruleDecider;
    private final RuleMetricsRecorder metricsRecorder;

    public PolicySessionHandler(SmtpSessionRegistry sessionRegistry,
                                RuleDecider ruleDecider,
                                RuleMetricsRecorder metricsRecorder) {
        this.sessionRegistry = sessionRegistry;
        this.ruleDecider = ruleDecider;
        this.metricsRecorder = metricsRecorder;
    }

    @Override
    public SessionAcceptance accept(Session session) {
        return admit(session);
    }

    public SessionAcceptance admit(MessageContext context) {
        SmtpSessionState state = sessionRegistry.open(context);
        RuleDecision decision = ruleDecider.decide(state.getRuleset(), SmtpPhase.CONNECT, state.getRuleContext());

        if (decision.tlsOpt() != null || decision.makeYakker()) {
            log.info("Connection options set but not applied - sessionId={}, tls-opt={}, make-yakker={}",
                    context.getSessionId(), decision.tlsOpt(), decision.makeYakker());
        }
        if (decision.isAccept()) {
            return SessionAcceptance.success();
        }

        end(context.getSessionId());
        if (decision.action() == RuleAction.REJECT) {
            return SessionAcceptance.failure(REJECT_CODE, decision.replyText("5.7.1 Connection rejected by policy"));
        }
        return SessionAcceptance.failure(STALL_CODE, decision.replyText("4.7.1 Connection refused by policy, try again later"));
    }

    @Override
    public void onSessionEnd(Session session) {
        end(session.getSessionId());
    }

    public void end(String sessionId) {
        sessionRegistry.close(sessionId).ifPresent(state -> {
            RuleContext ruleContext = state.getRuleContext();
            ruleContext.getDnsblHits().forEach(metricsRecorder::recordListHit);
            log.debug("SMTP session closed - sessionId={}, dnsblHits={}", sessionId, ruleContext.getDnsblHits());
        });
    }
}
