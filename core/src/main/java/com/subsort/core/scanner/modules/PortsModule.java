package com.subsort.core.scanner.modules;

import com.subsort.core.api.IAnalysisModule;
import com.subsort.core.model.HttpResponseData;
import com.subsort.core.model.PartialRecord;
import com.subsort.core.scanner.ModuleContext;
import com.subsort.core.scanner.ModuleException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.util.ArrayList;
import java.util.List;

/** TCP connect 포트 점검(ScanConfig.ports). 포트당 min(timeout, 남은 예산) */
public final class PortsModule implements IAnalysisModule {

    private static final Logger LOG = LoggerFactory.getLogger(PortsModule.class);

    public static final String NAME = "ports";

    private static final List<String> FIELDS = List.of("open_ports", "ports_scanned");

    @Override public String name() { return NAME; }
    @Override public List<String> fields() { return FIELDS; }

    @Override
    public PartialRecord analyze(HttpResponseData resp, ModuleContext ctx) throws ModuleException {
        String hostname = ctx.host().getHostname();
        List<Integer> open = new ArrayList<>();
        List<Integer> scanned = new ArrayList<>();
        for (int port : ctx.config().getPorts()) {
            if (ctx.expired()) {
                throw new ModuleException("module budget exhausted after " + scanned.size() + " ports");
            }
            long left = ctx.remaining().toMillis();
            int timeoutMs = (int) Math.max(1, Math.min(ctx.config().getTimeoutMs(), left));
            if (isOpen(hostname, port, timeoutMs)) open.add(port);
            scanned.add(port);
        }
        return PartialRecord.of(NAME)
                .put("open_ports", open)
                .put("ports_scanned", scanned);
    }

    static boolean isOpen(String host, int port, int timeoutMs) {
        try (Socket s = new Socket()) {
            s.connect(new InetSocketAddress(host, port), timeoutMs);
            return true;
        } catch (IOException e) {
            LOG.debug("port {}:{} closed: {}", host, port, e.getMessage());
            return false;
        }
    }
}
