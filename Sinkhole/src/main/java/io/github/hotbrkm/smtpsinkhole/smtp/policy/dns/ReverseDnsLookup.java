package io.github.hotbrkm.smtpsinkhole.smtp.policy.dns;

import io.github.hotbrkm.smtpsinkhole.smtp.policy.model.RemoteDns;
import io.github.hotbrkm.smtpsinkhole.smtp.util.IpAddressUtil;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.net.InetAddress;
import java.util.ArrayList;
import java.util.List;

/**
 * Looks up PTR names for a remote IP and sorts them by forward confirmation.
 */
@Slf4j
@RequiredArgsConstructor
public class ReverseDnsLookup {

    private final DnsResolver dnsResolver;

    public RemoteDns lookup(String remoteIp) {
        InetAddress address = IpAddressUtil.parseLiteral(remoteIp);
        if (address == null) {
            return RemoteDns.empty();
        }

        List<String> verified = new ArrayList<>();
        List<String> noForward = new ArrayList<>();
        List<String> inconsistent = new ArrayList<>();
        for (String name : dnsResolver.ptr(address)) {
            List<InetAddress> forward = new ArrayList<>(dnsResolver.a(name));
            forward.addAll(dnsResolver.aaaa(name));
            if (forward.isEmpty()) {
                noForward.add(name);
            } else if (forward.contains(address)) {
                verified.add(name);
            } else {
                inconsistent.add(name);
            }
        }
        log.debug("Reverse DNS for {}: verified={}, noForward={}, inconsistent={}",
                remoteIp, verified, noForward, inconsistent);
        return new RemoteDns(verified, noForward, inconsistent);
    }
}
