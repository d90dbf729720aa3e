package com.subsort.core.scanner.modules;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.xbill.DNS.ARecord;
import org.xbill.DNS.CNAMERecord;
import org.xbill.DNS.ExtendedResolver;
import org.xbill.DNS.Lookup;
import org.xbill.DNS.Name;
import org.xbill.DNS.Record;
import org.xbill.DNS.Resolver;
import org.xbill.DNS.TextParseException;
import org.xbill.DNS.Type;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/** dnsjava Lookup 기반 기본 구현(시스템 리졸버) */
public final class DnsjavaCnameResolver implements CnameResolver {

    private static final Logger LOG = LoggerFactory.getLogger(DnsjavaCnameResolver.class);

    @Override
    public Answer cname(String name, Duration timeout) {
        try {
            Lookup l = lookup(name, Type.CNAME, timeout);
            Record[] recs = l.run();
            switch (l.getResult()) {
                case Lookup.SUCCESSFUL -> {
                    for (Record r : recs) {
                        if (r instanceof CNAMERecord c) return Answer.cname(stripDot(c.getTarget().toString()));
                    }
                    return Answer.of(Status.NO_CNAME);
                }
                case Lookup.TYPE_NOT_FOUND -> { return Answer.of(Status.NO_CNAME); }
                case Lookup.HOST_NOT_FOUND -> { return Answer.of(Status.NXDOMAIN); }
                default -> {
                    LOG.debug("CNAME lookup for {} failed: {}", name, l.getErrorString());
                    return Answer.of(Status.ERROR);
                }
            }
        } catch (TextParseException e) {
            LOG.debug("bad DNS name {}: {}", name, e.getMessage());
            return Answer.of(Status.ERROR);
        }
    }

    @Override
    public List<String> addresses(String name, Duration timeout) {
        List<String> out = new ArrayList<>();
        try {
            Lookup l = lookup(name, Type.A, timeout);
            Record[] recs = l.run();
            if (l.getResult() == Lookup.SUCCESSFUL && recs != null) {
                for (Record r : recs) {
                    if (r instanceof ARecord a) out.add(a.getAddress().getHostAddress());
                }
            }
        } catch (TextParseException e) {
            LOG.debug("bad DNS name {}: {}", name, e.getMessage());
        }
        return out;
    }

    private static Lookup lookup(String name, int type, Duration timeout) throws TextParseException {
        Lookup l = new Lookup(Name.fromString(name.endsWith(".") ? name : name + "."), type);
        Resolver resolver = new ExtendedResolver();
        resolver.setTimeout(timeout);
        l.setResolver(resolver);
        return l;
    }

    private static String stripDot(String s) {
        return s.endsWith(".") ? s.substring(0, s.length() - 1) : s;
    }
}
