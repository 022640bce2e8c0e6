package io.github.hotbrkm.smtpsinkhole.smtp.policy.model;

import org.subethamail.smtp.RejectException;

import java.util.Map;

/**
 * The result of scanning a ruleset at one phase.
 * <p>
 * Carries the deciding action, the with options accumulated up to that point
 * and the canonical text of the deciding rule (null when nothing decided and
 * the default accept applies).
 * </p>
 *
 * @author hotbrkm
 * @since 1.0.0
 */
public record RuleDecision(RuleAction action, Map<String, String> withOptions, String ruleText) {

    public RuleDecision {
        withOptions = withOptions == null ? Map.of() : Map.copyOf(withOptions);
    }

    /**
     * Creates the default outcome of a scan that no rule decided.
     * @param withOptions options set by matching set-with rules
     * @return accepting decision
     */
    public static RuleDecision defaultAccept(Map<String, String> withOptions) {
        return new RuleDecision(RuleAction.ACCEPT, withOptions, null);
    }

    public boolean isAccept() {
        return action == RuleAction.ACCEPT;
    }

    public String option(WithOption option) {
        return withOptions.get(option.keyword());
    }

    public String message() {
        return option(WithOption.MESSAGE);
    }

    public String note() {
        return option(WithOption.NOTE);
    }

    public String savedir() {
        return option(WithOption.SAVEDIR);
    }

    public String tlsOpt() {
        return option(WithOption.TLS_OPT);
    }

    public boolean makeYakker() {
        return withOptions.containsKey(WithOption.MAKE_YAKKER.keyword());
    }

    /**
     * Returns the SMTP reply text, falling back to a default when no
     * {@code message} option is set.
     * @param defaultMessage text to use without a message option
     * @return reply text
     */
    public String replyText(String defaultMessage) {
        String message = message();
        return message == null || message.isEmpty() ? defaultMessage : message;
    }

    /**
     * Converts a reject or stall into the RejectException SubEtha turns into a reply.
     * @param rejectCode 5xx code to use for reject
     * @param stallCode  4xx code to use for stall
     * @return RejectException, or null for any other action
     */
    public RejectException toRejectException(int rejectCode, int stallCode) {
        return switch (action) {
            case REJECT -> new RejectException(rejectCode, replyText("5.7.1 Rejected by policy"));
            case STALL -> new RejectException(stallCode, replyText("4.7.1 Temporarily refused by policy"));
            default -> null;
        };
    }
}
