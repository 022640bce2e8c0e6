package io.github.hotbrkm.smtpsinkhole.smtp.policy.model;

/**
 * The result a matching rule produces.
 * <p>
 * Constants are declared from weakest to strongest. {@link #SET_WITH} is the
 * no-verdict action of a rule that only sets with options.
 * </p>
 */
public enum RuleAction {
    ERROR("ERROR"),
    SET_WITH("set-with"),
    ACCEPT("accept"),
    STALL("stall"),
    REJECT("reject");

    private final String keyword;

    RuleAction(String keyword) {
        this.keyword = keyword;
    }

    public String keyword() {
        return keyword;
    }

    public boolean isStrongerThan(RuleAction other) {
        return compareTo(other) > 0;
    }

    /**
     * @param value rule file keyword
     * @return the action, or null for anything that is not a rule action keyword
     */
    public static RuleAction fromKeyword(String value) {
        for (RuleAction action : values()) {
            if (action != ERROR && action.keyword.equals(value)) {
                return action;
            }
        }
        return null;
    }

    @Override
    public String toString() {
        return keyword;
    }
}
