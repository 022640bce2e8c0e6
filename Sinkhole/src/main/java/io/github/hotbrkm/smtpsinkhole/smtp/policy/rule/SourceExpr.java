package io.github.hotbrkm.smtpsinkhole.smtp.policy.rule;

import io.github.hotbrkm.smtpsinkhole.smtp.policy.model.RuleContext;
import io.github.hotbrkm.smtpsinkhole.smtp.policy.model.SmtpPhase;
import io.github.hotbrkm.smtpsinkhole.smtp.util.EmailUtil;

import java.util.List;

/**
 * {@code source HPAT}: the same as {@code (host HPAT or helo HPAT or from @HPAT)},
 * with HPAT resolved once so it can be a pattern file.
 */
public record SourceExpr(String argument) implements RuleExpr {

    @Override
    public boolean evaluate(RuleContext context) {
        List<String> patterns = context.patterns(argument);
        if (patterns.isEmpty()) {
            context.markDataUnavailable();
            return false;
        }
        for (String pattern : patterns) {
            for (String host : context.getRemoteDns().verified()) {
                if (EmailUtil.matchHost(host, pattern)) {
                    return true;
                }
            }
            if (EmailUtil.matchHost(context.getHeloName(), pattern)
                    || EmailUtil.matchAddress(context.getMailFrom(), "@" + pattern)) {
                return true;
            }
        }
        return false;
    }

    @Override
    public String render() {
        return "source " + RuleKeywords.renderArgument(argument);
    }

    @Override
    public SmtpPhase requires() {
        return SmtpPhase.MAIL_FROM;
    }
}
