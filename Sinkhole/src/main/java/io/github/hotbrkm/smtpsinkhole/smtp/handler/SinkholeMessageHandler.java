package io.github.hotbrkm.smtpsinkhole.smtp.handler;

import io.github.hotbrkm.smtpsinkhole.smtp.policy.RuleDecider;
import io.github.hotbrkm.smtpsinkhole.smtp.policy.model.RuleContext;
import io.github.hotbrkm.smtpsinkhole.smtp.policy.model.RuleDecision;
import io.github.hotbrkm.smtpsinkhole.smtp.policy.model.SmtpPhase;
import io.github.hotbrkm.smtpsinkhole.smtp.properties.SinkholeSmtpProperties;
import io.github.hotbrkm.smtpsinkhole.smtp.service.SmtpMessageStore;
import io.github.hotbrkm.smtpsinkhole.smtp.util.IpAddressUtil;
import lombok.extern.slf4j.Slf4j;
import org.subethamail.smtp.MessageContext;
import org.subethamail.smtp.MessageHandler;
import org.subethamail.smtp.RejectException;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;

/**
 * Handles one SMTP mail transaction for the sinkhole.
 * <p>
 * Each command runs the connection's rules for its phase. SubEtha has no
 * EHLO/HELO callback, so the {@code @helo} rules run at the first MAIL FROM.
 * It does not report which of the two verbs was used either, so the greeting
 * verb stays {@link io.github.hotbrkm.smtpsinkhole.smtp.policy.model.GreetingVerb#UNKNOWN}
 * and {@code helo-has helo} or {@code helo-has ehlo} never match.
 * A reject or stall of the null sender is held back and given to every RCPT TO
 * instead.
 * </p>
 *
 * @author hotbrkm
 * @since 1.0.0
 */
@Slf4j
public class SinkholeMessageHandler implements MessageHandler {

    private static final int REJECT_CODE = 550;
    private static final int DATA_REJECT_CODE = 554;
    private static final int STALL_CODE = 451;

    private final MessageContext context;
    private final SinkholeSmtpProperties properties;
    private final SmtpMessageStore messageStore;
    private final RuleDecider ruleDecider;
    private final SmtpSessionState sessionState;

    public SinkholeMessageHandler(MessageContext context,
                                  SinkholeSmtpProperties properties,
                                  SmtpMessageStore messageStore,
                                  RuleDecider ruleDecider,
                                  SmtpSessionState sessionState) {
        this.context = context;
        this.properties = properties;
        this.messageStore = messageStore;
        this.ruleDecider = ruleDecider;
        this.sessionState = sessionState;
    }

    @Override
    public void from(String from) throws RejectException {
        String sender = from == null || from.equals("<>") ? "" : from;
        sessionState.startTransaction(sender);

        RuleContext ruleContext = sessionState.getRuleContext();
        String helo = context.getHelo().orElse("");
        ruleContext.setHeloName(helo);
        ruleContext.setTlsOn(IpAddressUtil.isTlsStarted(context));
        ruleContext.setMailFrom(sender);
        ruleContext.setCurrentRecipient("");
        log.debug("SMTP transaction started - remote={}, helo={}, from={}", context.getRemoteAddress(), helo, sender);

        RuleDecision decision = RuleDecision.defaultAccept(null);
        if (!sessionState.isHeloChecked()) {
            sessionState.markHeloChecked();
            decision = decide(SmtpPhase.HELO);
        }
        if (decision.isAccept()) {
            decision = decide(SmtpPhase.MAIL_FROM);
        }
        if (decision.isAccept()) {
            return;
        }

        if (sender.isEmpty()) {
            log.info("Deferring {} of null sender to RCPT TO - sessionId={}", decision.action(), context.getSessionId());
            sessionState.setDeferredDecision(decision);
            return;
        }
        throw decision.toRejectException(REJECT_CODE, STALL_CODE);
    }

    @Override
    public void recipient(String recipient) throws RejectException {
        log.debug("Processing SMTP recipient - from={}, recipient={}", sessionState.getFrom(), recipient);
        if (sessionState.hasDeferredDecision()) {
            throw sessionState.getDeferredDecision().toRejectException(REJECT_CODE, STALL_CODE);
        }

        sessionState.getRuleContext().setCurrentRecipient(recipient);
        handleDecision(decide(SmtpPhase.RCPT_TO), REJECT_CODE);

        sessionState.addRecipient(recipient);
    }

    @Override
    public String data(InputStream data) throws RejectException {
        log.debug("Processing SMTP DATA - from={}, recipients={}", sessionState.getFrom(), sessionState.getAcceptedRecipientCount());

        try {
            byte[] payload = data.readAllBytes();

            RuleDecision dataDecision = ruleDecider.decideData(sessionState.getRuleset(),
                    sessionState.getRuleContext(), sessionState.getAcceptedRecipients());
            handleDecision(dataDecision, DATA_REJECT_CODE);

            RuleDecision messageDecision = decide(SmtpPhase.MESSAGE);
            boolean stored = store(payload, messageDecision.savedir());
            handleDecision(messageDecision, DATA_REJECT_CODE);

            if (!stored && !properties.isForceReceive()) {
                throw new RejectException(DATA_REJECT_CODE, "5.3.0 Messages are not being accepted");
            }
            return "OK";
        } catch (IOException e) {
            throw new UncheckedIOException("I/O error occurred while processing SMTP data.", e);
        }
    }

    @Override
    public void done() {
        log.debug("SMTP transaction ended - from={}, successful recipients={}", sessionState.getFrom(), sessionState.getAcceptedRecipientCount());
    }

    private RuleDecision decide(SmtpPhase phase) {
        return ruleDecider.decide(sessionState.getRuleset(), phase, sessionState.getRuleContext());
    }

    private boolean store(byte[] payload, String savedir) throws IOException {
        if (!messageStore.isStoring(savedir) || !sessionState.hasAcceptedRecipients()) {
            return messageStore.isStoring(savedir);
        }
        for (String recipient : sessionState.getAcceptedRecipients()) {
            try (InputStream payloadStream = new ByteArrayInputStream(payload)) {
                messageStore.store(sessionState.getFrom(), recipient, payloadStream, savedir);
            }
        }
        return true;
    }

    private void handleDecision(RuleDecision decision, int rejectCode) throws RejectException {
        RejectException exception = decision.toRejectException(rejectCode, STALL_CODE);
        if (exception != null) {
            throw exception;
        }
    }
}
