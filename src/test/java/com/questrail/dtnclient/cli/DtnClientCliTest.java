package com.questrail.dtnclient.cli;

import com.questrail.dtnclient.client.DtnClient;
import com.questrail.dtnclient.client.FramedCall;
import com.questrail.dtnclient.client.LengthPrefixFraming;
import com.questrail.dtnclient.config.DtnClientConfig;
import com.questrail.dtnclient.eid.EndpointId;
import com.questrail.dtnclient.observability.NullObservabilitySink;
import com.questrail.dtnclient.protocol.codec.impl.MsgpackMessageCodec;
import com.questrail.dtnclient.protocol.model.DtnMessage;
import com.questrail.dtnclient.protocol.model.RegisterUnregister;
import com.questrail.dtnclient.protocol.model.Response;
import com.questrail.dtnclient.transport.FakeConnection;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.function.Function;

import static org.junit.jupiter.api.Assertions.*;

class DtnClientCliTest
{
    private final MsgpackMessageCodec codec = new MsgpackMessageCodec();
    private final ByteArrayOutputStream errBytes = new ByteArrayOutputStream();
    private final PrintStream err = new PrintStream(errBytes, true, StandardCharsets.UTF_8);
    private final List<FakeConnection> connections = new ArrayList<>();

    @TempDir
    Path dir;

    @Test
    void noCommandIsAFailure() {
        assertEquals(DtnClientCli.EXIT_FAILURE, DtnClientCli.run(new String[0], err));
        assertTrue(stderr().contains("Must choose a command"));
    }

    @Test
    void helpExitsCleanly() {
        assertEquals(DtnClientCli.EXIT_OK, DtnClientCli.run(new String[] { "-h" }, err));
        assertTrue(stderr().startsWith("usage: dtnclient"));
    }

    @Test
    void missingEndpointIsAUsageError() {
        int exit = DtnClientCli.run(new String[] { "-s", "/run/dtnd.sock", "register" }, err);

        assertEquals(DtnClientCli.EXIT_USAGE, exit);
        assertTrue(stderr().contains("EndpointID"));
    }

    @Test
    void invalidEndpointIsAUsageError() {
        int exit = DtnClientCli.run(new String[] { "-s", "/run/dtnd.sock", "register", "dtn://none" }, err);

        assertEquals(DtnClientCli.EXIT_USAGE, exit);
        assertTrue(stderr().contains("invalid EID value"));
    }

    @Test
    void missingSocketIsAUsageError() {
        assertEquals(DtnClientCli.EXIT_USAGE,
                DtnClientCli.run(new String[] { "register", "dtn://node1/app" }, err));
    }

    @Test
    void unknownOptionIsAUsageError() {
        assertEquals(DtnClientCli.EXIT_USAGE,
                DtnClientCli.run(new String[] { "--bogus", "register", "dtn://node1/app" }, err));
        assertEquals(DtnClientCli.EXIT_USAGE,
                DtnClientCli.run(new String[] { "-s", "x", "list" }, err));
    }

    @Test
    void argumentsAreParsed() throws Exception {
        DtnClientCli.Arguments parsed = DtnClientCli.Arguments.parse(
                new String[] { "-v", "--socket", "/run/dtnd.sock", "register", "-u", "ipn:3.1" });

        assertTrue(parsed.verbose);
        assertTrue(parsed.unregister);
        assertEquals(Path.of("/run/dtnd.sock"), parsed.socket);
        assertEquals("register", parsed.command);
        assertEquals(EndpointId.ipn(3, 1), parsed.endpoint);
    }

    @Test
    void registersThroughTheDaemon() {
        int exit = DtnClientCli.run(
                new String[] { "-s", "/run/dtnd.sock", "register", "dtn://node1/app" },
                err, replying(Response.ok()));

        assertEquals(DtnClientCli.EXIT_OK, exit);
        assertRequest(RegisterUnregister.register(EndpointId.dtn("node1", "app")));
    }

    @Test
    void unregisterFlagSelectsUnregistration() {
        int exit = DtnClientCli.run(
                new String[] { "-s", "/run/dtnd.sock", "register", "--unregister", "dtn://node1/app" },
                err, replying(Response.ok()));

        assertEquals(DtnClientCli.EXIT_OK, exit);
        assertRequest(RegisterUnregister.unregister(EndpointId.dtn("node1", "app")));
    }

    @Test
    void verboseFlagRaisesLogLevel() {
        DtnClientCli.run(new String[] { "-v", "-s", "/run/dtnd.sock", "register", "dtn://node1/app" },
                err, replying(Response.ok()));

        assertEquals("DEBUG", System.getProperty(DtnClientCli.LOG_LEVEL_PROPERTY));
    }

    @Test
    void daemonErrorIsAFailure() {
        int exit = DtnClientCli.run(
                new String[] { "-s", "/run/dtnd.sock", "register", "dtn://node1/app" },
                err, replying(Response.failure("already registered")));

        assertEquals(DtnClientCli.EXIT_FAILURE, exit);
    }

    @Test
    void truncatedReplyIsAFailure() {
        Function<DtnClientConfig, DtnClient> factory = config -> new DtnClient(
                () -> connect(new byte[] { 0, 0, 0 }),
                new FramedCall(codec, NullObservabilitySink.INSTANCE));

        int exit = DtnClientCli.run(
                new String[] { "-s", "/run/dtnd.sock", "register", "dtn://node1/app" }, err, factory);

        assertEquals(DtnClientCli.EXIT_FAILURE, exit);
    }

    @Test
    void absentSocketIsAFailure() {
        Path socket = dir.resolve("dtnd.sock");

        int exit = DtnClientCli.run(new String[] { "-s", socket.toString(), "register", "dtn://node1/app" }, err);

        assertEquals(DtnClientCli.EXIT_FAILURE, exit);
    }

    // ---------------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------------

    private Function<DtnClientConfig, DtnClient> replying(DtnMessage reply) {
        byte[] body = codec.encode(reply);
        byte[] framed = new byte[LengthPrefixFraming.PREFIX_LENGTH + body.length];
        System.arraycopy(LengthPrefixFraming.prefix(body.length), 0, framed, 0, LengthPrefixFraming.PREFIX_LENGTH);
        System.arraycopy(body, 0, framed, LengthPrefixFraming.PREFIX_LENGTH, body.length);
        return config -> new DtnClient(() -> connect(framed), new FramedCall(codec, NullObservabilitySink.INSTANCE));
    }

    private FakeConnection connect(byte[] inbound) {
        FakeConnection connection = new FakeConnection(inbound);
        connections.add(connection);
        return connection;
    }

    private void assertRequest(DtnMessage expected) {
        assertEquals(1, connections.size());
        byte[] written = connections.get(0).written();
        byte[] body = Arrays.copyOfRange(written, LengthPrefixFraming.PREFIX_LENGTH, written.length);
        assertEquals(expected, codec.decode(body));
    }

    private String stderr() {
        return errBytes.toString(StandardCharsets.UTF_8);
    }
}
