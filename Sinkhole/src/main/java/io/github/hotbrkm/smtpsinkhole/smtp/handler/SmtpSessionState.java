package io.github.hotbrkm.smtpsinkhole.smtp.handler;

import io.github.hotbrkm.smtpsinkhole.smtp.policy.model.RuleContext;
import io.github.hotbrkm.smtpsinkhole.smtp.policy.model.RuleDecision;
import io.github.hotbrkm.smtpsinkhole.smtp.policy.rule.Ruleset;
import lombok.Getter;
import lombok.Setter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Manages the SMTP session state.
 * <p>
 * One instance lives for the whole connection and holds the connection's
 * ruleset and rule context. Sender and recipients are reset for every mail
 * transaction.
 */
public class SmtpSessionState {

    @Getter
    private final Ruleset ruleset;

    @Getter
    private final RuleContext ruleContext;

    private final List<String> acceptedRecipients = new ArrayList<>();

    @Getter
    private String from;

    /**
     * A reject or stall of the null sender, answered at RCPT TO instead.
     */
    @Getter
    @Setter
    private RuleDecision deferredDecision;

    @Getter
    private boolean heloChecked;

    public SmtpSessionState(Ruleset ruleset, RuleContext ruleContext) {
        this.ruleset = ruleset;
        this.ruleContext = ruleContext;
    }

    /**
     * Starts a new mail transaction, forgetting the previous one.
     *
     * @param from MAIL FROM address, empty for the null sender
     */
    public void startTransaction(String from) {
        this.from = from;
        this.deferredDecision = null;
        acceptedRecipients.clear();
    }

    public void markHeloChecked() {
        heloChecked = true;
    }

    /**
     * Adds a recipient to the list of accepted recipients.
     *
     * @param recipient Recipient email address
     */
    public void addRecipient(String recipient) {
        acceptedRecipients.add(recipient);
    }

    /**
     * Returns the accepted recipient list (immutable).
     *
     * @return Recipient list
     */
    public List<String> getAcceptedRecipients() {
        return Collections.unmodifiableList(acceptedRecipients);
    }

    public int getAcceptedRecipientCount() {
        return acceptedRecipients.size();
    }

    public boolean hasAcceptedRecipients() {
        return !acceptedRecipients.isEmpty();
    }

    public boolean hasDeferredDecision() {
        return deferredDecision != null;
    }
}
