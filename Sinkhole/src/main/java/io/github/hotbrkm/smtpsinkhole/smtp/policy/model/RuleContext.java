package io.github.hotbrkm.smtpsinkhole.smtp.policy.model;

import io.github.hotbrkm.smtpsinkhole.smtp.policy.dns.DnsResolver;
import io.github.hotbrkm.smtpsinkhole.smtp.policy.dns.DomainValidator;
import io.github.hotbrkm.smtpsinkhole.smtp.policy.support.PatternSource;
import lombok.AccessLevel;
import lombok.Builder;
import lombok.Getter;
import lombok.Setter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Per-connection state that rules are evaluated against.
 * <p>
 * Fields are filled in as the SMTP conversation advances. One instance belongs
 * to one connection and is never shared, so nothing here is synchronized.
 * DNS list probes and domain validity results are remembered for the life of
 * the connection.
 * </p>
 */
@Getter
@Builder
public class RuleContext {

    private final String sessionId;
    private final PatternSource patternSource;
    private final DnsResolver dnsResolver;
    private final DomainValidator domainValidator;

    @Builder.Default
    private final String remoteIp = "";
    @Builder.Default
    private final String localIp = "";
    @Builder.Default
    private final RemoteDns remoteDns = RemoteDns.empty();

    @Setter
    private boolean tlsOn;
    @Setter
    @Builder.Default
    private GreetingVerb greetingVerb = GreetingVerb.UNKNOWN;
    @Setter
    @Builder.Default
    private String heloName = "";
    @Setter
    @Builder.Default
    private String mailFrom = "";
    @Setter
    @Builder.Default
    private String currentRecipient = "";

    private boolean dataUnavailable;

    @Getter(AccessLevel.NONE)
    @Builder.Default
    private final Map<String, String> withProperties = new LinkedHashMap<>();
    @Getter(AccessLevel.NONE)
    @Builder.Default
    private final Set<String> dnsblHits = new LinkedHashSet<>();
    @Getter(AccessLevel.NONE)
    @Builder.Default
    private final Map<String, Boolean> listedCache = new HashMap<>();
    @Getter(AccessLevel.NONE)
    @Builder.Default
    private final Map<String, DomainValidity> validityCache = new HashMap<>();

    /**
     * Signals that a matcher could not be evaluated for lack of patterns.
     */
    public void markDataUnavailable() {
        dataUnavailable = true;
    }

    public void resetDataUnavailable() {
        dataUnavailable = false;
    }

    public List<String> patterns(String argument) {
        return patternSource.resolve(argument);
    }

    public boolean isListed(String name) {
        return listedCache.computeIfAbsent(name, dnsResolver::isListed);
    }

    public DnsResult domainValidity(String domain) {
        return validityCache.computeIfAbsent(domain, domainValidator::validate).result();
    }

    /**
     * Records a DNS blocklist hit; each list domain is kept once, in first-hit order.
     */
    public void recordDnsblHit(String listDomain) {
        dnsblHits.add(listDomain);
    }

    public List<String> getDnsblHits() {
        return Collections.unmodifiableList(new ArrayList<>(dnsblHits));
    }

    public void mergeWithProperties(Map<String, String> options) {
        withProperties.putAll(options);
    }

    public Map<String, String> snapshotWithProperties() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(withProperties));
    }
}
