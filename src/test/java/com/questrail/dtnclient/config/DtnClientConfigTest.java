package com.questrail.dtnclient.config;

import com.questrail.dtnclient.observability.NullObservabilitySink;
import com.questrail.dtnclient.observability.Slf4jDtnClientObservabilitySink;
import org.junit.jupiter.api.Test;

import java.net.InetSocketAddress;
import java.net.UnixDomainSocketAddress;
import java.nio.file.Path;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class DtnClientConfigTest
{
    @Test
    void defaultsApplyWhenOnlySocketIsGiven() {
        DtnClientConfig config = DtnClientConfig.builder()
                .withSocketPath(Path.of("/run/dtnd.sock"))
                .build();

        assertEquals(UnixDomainSocketAddress.of("/run/dtnd.sock"), config.daemonAddress());
        assertEquals(Duration.ZERO, config.timeout());
        assertEquals(Path.of(System.getProperty("java.io.tmpdir")), config.diagnosticsDirectory());
        assertInstanceOf(Slf4jDtnClientObservabilitySink.class, config.observabilitySink());
    }

    @Test
    void explicitValuesAreKept() {
        InetSocketAddress address = new InetSocketAddress("127.0.0.1", 35039);
        DtnClientConfig config = DtnClientConfig.builder()
                .withDaemonAddress(address)
                .withTimeout(Duration.ofSeconds(3))
                .withDiagnosticsDirectory(Path.of("/var/tmp/dtn"))
                .withObservabilitySink(NullObservabilitySink.INSTANCE)
                .build();

        assertEquals(address, config.daemonAddress());
        assertEquals(Duration.ofSeconds(3), config.timeout());
        assertEquals(Path.of("/var/tmp/dtn"), config.diagnosticsDirectory());
        assertSame(NullObservabilitySink.INSTANCE, config.observabilitySink());
    }

    @Test
    void daemonAddressIsRequired() {
        assertThrows(IllegalStateException.class, () -> DtnClientConfig.builder().build());
    }

    @Test
    void negativeTimeoutIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> DtnClientConfig.builder()
                .withSocketPath(Path.of("/run/dtnd.sock"))
                .withTimeout(Duration.ofSeconds(-1))
                .build());
    }
}
