package io.github.hotbrkm.smtpsinkhole.smtp.handler;

import io.github.hotbrkm.smtpsinkhole.smtp.policy.RulesetLoader;
import io.github.hotbrkm.smtpsinkhole.smtp.policy.dns.DnsResolver;
import io.github.hotbrkm.smtpsinkhole.smtp.policy.dns.DomainValidator;
import io.github.hotbrkm.smtpsinkhole.smtp.policy.dns.ReverseDnsLookup;
import io.github.hotbrkm.smtpsinkhole.smtp.policy.model.RuleContext;
import io.github.hotbrkm.smtpsinkhole.smtp.policy.support.PatternSource;
import io.github.hotbrkm.smtpsinkhole.smtp.util.IpAddressUtil;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.subethamail.smtp.MessageContext;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Keeps the state of every open SMTP connection, keyed by session id.
 * <p>
 * Opening a session loads a fresh ruleset and looks up the client's reverse DNS.
 * </p>
 */
@Slf4j
@RequiredArgsConstructor
public class SmtpSessionRegistry {

    private final ConcurrentHashMap<String, SmtpSessionState> sessions = new ConcurrentHashMap<>();

    private final RulesetLoader rulesetLoader;
    private final DnsResolver dnsResolver;
    private final DomainValidator domainValidator;
    private final ReverseDnsLookup reverseDnsLookup;

    public SmtpSessionState open(MessageContext context) {
        String remoteIp = IpAddressUtil.getRemoteIp(context);
        String localIp = IpAddressUtil.getLocalIp(context);
        RuleContext ruleContext = RuleContext.builder()
                .sessionId(context.getSessionId())
                .patternSource(new PatternSource())
                .dnsResolver(dnsResolver)
                .domainValidator(domainValidator)
                .remoteIp(remoteIp == null ? "" : remoteIp)
                .localIp(localIp == null ? "" : localIp)
                .remoteDns(reverseDnsLookup.lookup(remoteIp))
                .build();

        SmtpSessionState state = new SmtpSessionState(rulesetLoader.load(), ruleContext);
        sessions.put(context.getSessionId(), state);
        log.debug("SMTP session opened - sessionId={}, remote={}, rules={}",
                context.getSessionId(), remoteIp, state.getRuleset().size());
        return state;
    }

    public Optional<SmtpSessionState> find(String sessionId) {
        return sessionId == null ? Optional.empty() : Optional.ofNullable(sessions.get(sessionId));
    }

    public Optional<SmtpSessionState> close(String sessionId) {
        return sessionId == null ? Optional.empty() : Optional.ofNullable(sessions.remove(sessionId));
    }

    public int size() {
        return sessions.size();
    }
}
