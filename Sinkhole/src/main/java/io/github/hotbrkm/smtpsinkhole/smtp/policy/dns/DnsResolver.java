package io.github.hotbrkm.smtpsinkhole.smtp.policy.dns;

import lombok.extern.slf4j.Slf4j;
import org.xbill.DNS.AAAARecord;
import org.xbill.DNS.ARecord;
import org.xbill.DNS.ExtendedResolver;
import org.xbill.DNS.Lookup;
import org.xbill.DNS.MXRecord;
import org.xbill.DNS.Name;
import org.xbill.DNS.PTRRecord;
import org.xbill.DNS.Record;
import org.xbill.DNS.Resolver;
import org.xbill.DNS.ReverseMap;
import org.xbill.DNS.TextParseException;
import org.xbill.DNS.Type;

import java.net.InetAddress;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Thin dnsjava wrapper used by the rule engine.
 * <p>
 * Every lookup reports a {@link QueryStatus} instead of throwing; transient
 * failures (timeouts, SERVFAIL) come back as {@link QueryStatus#TEMP_ERROR}.
 * Results go through dnsjava's default cache, which honours record TTLs.
 * </p>
 */
@Slf4j
public class DnsResolver {

    private final Resolver resolver;

    public DnsResolver() {
        this.resolver = null;
    }

    /**
     * @param timeout per-query timeout, or null for the dnsjava default
     */
    public DnsResolver(Duration timeout) {
        if (timeout == null) {
            this.resolver = null;
            return;
        }
        ExtendedResolver extended = new ExtendedResolver();
        extended.setTimeout(timeout);
        this.resolver = extended;
    }

    public QueryResult aLookup(String name) {
        return lookup(name, Type.A);
    }

    public QueryResult aaaaLookup(String name) {
        return lookup(name, Type.AAAA);
    }

    public QueryResult mxLookup(String name) {
        return lookup(name, Type.MX);
    }

    public QueryResult ptrLookup(InetAddress address) {
        return lookup(ReverseMap.fromAddress(address), Type.PTR);
    }

    /**
     * Probes a DNS list: a name is listed when it has at least one A record.
     * @param name fully qualified query name, e.g. {@code 2.0.0.127.zen.example.org}
     * @return true if listed
     */
    public boolean isListed(String name) {
        String absolute = name.endsWith(".") ? name : name + ".";
        return aLookup(absolute).status() == QueryStatus.SUCCESS;
    }

    public List<InetAddress> a(String name) {
        return aLookup(name).addresses();
    }

    public List<InetAddress> aaaa(String name) {
        return aaaaLookup(name).addresses();
    }

    /**
     * @param domain absolute domain name
     * @return MX hosts with absolute target names, in answer order
     */
    public List<MxHost> mx(String domain) {
        return mxLookup(domain).mxHosts();
    }

    /**
     * @param address address to reverse
     * @return PTR names with their trailing root dot
     */
    public List<String> ptr(InetAddress address) {
        return ptrLookup(address).names();
    }

    private QueryResult lookup(String name, int type) {
        try {
            return lookup(Name.fromString(name), type);
        } catch (TextParseException e) {
            log.debug("DNS lookup parse error: name={}, type={}, message={}", name, type, e.getMessage());
            return new QueryResult(QueryStatus.PERM_ERROR, Collections.emptyList(), e.getMessage());
        }
    }

    private QueryResult lookup(Name name, int type) {
        try {
            Lookup lookup = new Lookup(name, type);
            if (resolver != null) {
                lookup.setResolver(resolver);
            }
            Record[] records = lookup.run();
            QueryStatus status = mapStatus(lookup.getResult());
            if (records == null) {
                records = new Record[0];
            }
            return new QueryResult(status, List.of(records), lookup.getErrorString());
        } catch (RuntimeException e) {
            log.debug("DNS lookup runtime error: name={}, type={}, message={}", name, type, e.getMessage());
            return new QueryResult(QueryStatus.TEMP_ERROR, Collections.emptyList(), e.getMessage());
        }
    }

    private QueryStatus mapStatus(int result) {
        return switch (result) {
            case Lookup.SUCCESSFUL -> QueryStatus.SUCCESS;
            case Lookup.HOST_NOT_FOUND, Lookup.TYPE_NOT_FOUND -> QueryStatus.NOT_FOUND;
            case Lookup.TRY_AGAIN -> QueryStatus.TEMP_ERROR;
            case Lookup.UNRECOVERABLE -> QueryStatus.PERM_ERROR;
            default -> QueryStatus.PERM_ERROR;
        };
    }

    public enum QueryStatus {
        SUCCESS,
        NOT_FOUND,
        TEMP_ERROR,
        PERM_ERROR
    }

    /**
     * One DNS answer. The value accessors read the records of this answer only
     * and are empty unless the lookup succeeded.
     */
    public record QueryResult(QueryStatus status, List<Record> records, String detail) {

        public QueryResult {
            records = records == null ? List.of() : List.copyOf(records);
        }

        public List<InetAddress> addresses() {
            List<InetAddress> values = new ArrayList<>();
            for (Record record : successfulRecords()) {
                if (record instanceof ARecord a) {
                    values.add(a.getAddress());
                } else if (record instanceof AAAARecord aaaa) {
                    values.add(aaaa.getAddress());
                }
            }
            return values;
        }

        public List<MxHost> mxHosts() {
            List<MxHost> values = new ArrayList<>();
            for (Record record : successfulRecords()) {
                if (record instanceof MXRecord mx) {
                    values.add(new MxHost(mx.getPriority(), mx.getTarget().toString()));
                }
            }
            return values;
        }

        public List<String> names() {
            List<String> values = new ArrayList<>();
            for (Record record : successfulRecords()) {
                if (record instanceof PTRRecord ptr) {
                    values.add(ptr.getTarget().toString());
                }
            }
            return values;
        }

        private List<Record> successfulRecords() {
            return status == QueryStatus.SUCCESS ? records : Collections.emptyList();
        }
    }

    public record MxHost(int preference, String target) {
    }
}
