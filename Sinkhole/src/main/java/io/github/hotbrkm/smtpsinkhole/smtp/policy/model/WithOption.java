package io.github.hotbrkm.smtpsinkhole.smtp.policy.model;

/**
 * Options a rule clause can set with {@code with ...}.
 */
public enum WithOption {
    /** Reply text for rejections and stalls. */
    MESSAGE("message", true),
    /** Text written to the SMTP log when the rule matches. */
    NOTE("note", true),
    /** Directory to save the message in. */
    SAVEDIR("savedir", true),
    /** {@code off} or {@code no-client}. */
    TLS_OPT("tls-opt", true),
    /** Treat the client as a do-nothing client. */
    MAKE_YAKKER("make-yakker", false);

    private final String keyword;
    private final boolean takesValue;

    WithOption(String keyword, boolean takesValue) {
        this.keyword = keyword;
        this.takesValue = takesValue;
    }

    public String keyword() {
        return keyword;
    }

    public boolean takesValue() {
        return takesValue;
    }

    public static WithOption fromKeyword(String value) {
        for (WithOption option : values()) {
            if (option.keyword.equals(value)) {
                return option;
            }
        }
        return null;
    }
}
