package io.github.hotbrkm.smtpsinkhole.smtp.policy.dns;

import io.github.hotbrkm.smtpsinkhole.smtp.policy.model.DnsResult;
import io.github.hotbrkm.smtpsinkhole.smtp.policy.model.DomainValidity;
import io.github.hotbrkm.smtpsinkhole.smtp.util.IpAddressUtil;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.net.InetAddress;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Decides whether a domain can plausibly receive mail.
 * <p>
 * A domain is good if one of its MX hosts (or, with no MX, the domain itself)
 * resolves only to global unicast addresses outside private space. Any MX of
 * {@code .} or {@code localhost.} makes the whole domain bad. Resolver
 * trouble gives {@link DnsResult#TEMPFAIL} rather than an error.
 * </p>
 *
 * @author hotbrkm
 * @since 1.0.0
 */
@Slf4j
@RequiredArgsConstructor
public class DomainValidator {

    private final DnsResolver dnsResolver;

    public DomainValidity validate(String domain) {
        String name = absolute(domain);
        DnsResolver.QueryResult mxResult = dnsResolver.mxLookup(name);
        if (mxResult.status() == DnsResolver.QueryStatus.TEMP_ERROR) {
            log.debug("MX lookup tempfail: domain={}, detail={}", domain, mxResult.detail());
            return DomainValidity.tempfail("MX tempfail: " + mxResult.detail());
        }
        List<DnsResolver.MxHost> mxHosts = mxResult.mxHosts();
        if (mxHosts.isEmpty()) {
            return checkAddresses(name);
        }

        DnsResult best = DnsResult.UNDEFINED;
        String detail = null;
        // every MX is visited so that a null MX anywhere still disqualifies the domain
        for (DnsResolver.MxHost mx : mxHosts) {
            if (".".equals(mx.target()) && mx.preference() == 0) {
                return DomainValidity.bad(domain + ": RFC 7505 null MX");
            }
            String target = mx.target().toLowerCase(Locale.ROOT);
            if (".".equals(target) || "localhost.".equals(target)) {
                return DomainValidity.bad("rejecting bogus MX " + mx.preference() + " " + mx.target());
            }

            DomainValidity validity = checkAddresses(mx.target());
            if (validity.result().isBetterThan(best)) {
                best = validity.result();
                detail = validity.detail();
            }
        }
        return new DomainValidity(best, detail);
    }

    /**
     * Checks that a host has addresses and that all of them are usable mail targets.
     */
    DomainValidity checkAddresses(String host) {
        DnsResolver.QueryResult aResult = dnsResolver.aLookup(host);
        DnsResolver.QueryResult aaaaResult = dnsResolver.aaaaLookup(host);

        List<InetAddress> addresses = new ArrayList<>(aResult.addresses());
        addresses.addAll(aaaaResult.addresses());
        if (addresses.isEmpty()) {
            if (aResult.status() == DnsResolver.QueryStatus.TEMP_ERROR
                    || aaaaResult.status() == DnsResolver.QueryStatus.TEMP_ERROR) {
                return DomainValidity.tempfail(host + ": address lookup tempfail");
            }
            return DomainValidity.bad(host + ": no IPs");
        }

        for (InetAddress address : addresses) {
            if (!IpAddressUtil.isGlobalUnicast(address)) {
                return DomainValidity.bad("host " + host + " IP " + address.getHostAddress() + " not global unicast");
            }
            if (IpAddressUtil.isReservedRange(address)) {
                return DomainValidity.bad("host " + host + " IP " + address.getHostAddress() + " is in bad address space");
            }
        }
        return DomainValidity.good();
    }

    private static String absolute(String domain) {
        return domain.endsWith(".") ? domain : domain + ".";
    }
}
