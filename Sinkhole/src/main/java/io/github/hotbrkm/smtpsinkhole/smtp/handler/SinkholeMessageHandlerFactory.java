package io.github.hotbrkm.smtpsinkhole.smtp.handler;

import io.github.hotbrkm.smtpsinkhole.smtp.policy.RuleDecider;
import io.github.hotbrkm.smtpsinkhole.smtp.properties.SinkholeSmtpProperties;
import io.github.hotbrkm.smtpsinkhole.smtp.service.SmtpMessageStore;
import lombok.RequiredArgsConstructor;
import org.subethamail.smtp.MessageContext;
import org.subethamail.smtp.MessageHandler;
import org.subethamail.smtp.MessageHandlerFactory;

@RequiredArgsConstructor
public class SinkholeMessageHandlerFactory implements MessageHandlerFactory {

    private final SinkholeSmtpProperties properties;
    private final SmtpMessageStore messageStore;
    private final RuleDecider ruleDecider;
    private final SmtpSessionRegistry sessionRegistry;

    @Override
    public MessageHandler create(MessageContext context) {
        SmtpSessionState state = sessionRegistry.find(context.getSessionId())
                .orElseGet(() -> sessionRegistry.open(context));
        return new SinkholeMessageHandler(context, properties, messageStore, ruleDecider, state);
    }
}
