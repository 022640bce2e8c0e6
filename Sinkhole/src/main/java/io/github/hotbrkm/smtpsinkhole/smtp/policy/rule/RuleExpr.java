package io.github.hotbrkm.smtpsinkhole.smtp.policy.rule;

import io.github.hotbrkm.smtpsinkhole.smtp.policy.model.RuleContext;
import io.github.hotbrkm.smtpsinkhole.smtp.policy.model.SmtpPhase;

/**
 * A node of a parsed match expression.
 * <p>
 * Nodes are immutable. Matchers that need pattern data they cannot get mark
 * the context data-unavailable and evaluate to false; see {@link Rule#check}.
 * </p>
 */
public sealed interface RuleExpr
        permits AllExpr, TlsExpr, DnsblExpr, DblExpr, MatchExpr, SourceExpr, AttributeExpr,
        AndExpr, OrExpr, NotExpr {

    boolean evaluate(RuleContext context);

    /**
     * @return canonical rule text that parses back to an equal node
     */
    String render();

    /**
     * @return the earliest phase at which all data this node reads exists
     */
    SmtpPhase requires();
}
