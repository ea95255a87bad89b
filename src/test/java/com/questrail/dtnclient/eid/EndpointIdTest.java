package com.questrail.dtnclient.eid;

import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class EndpointIdTest
{
    // ---------------------------------------------------------------------
    // dtn scheme
    // ---------------------------------------------------------------------

    /**
     * Verifies that a dtn EID without a service is normalized to carry a
     * trailing slash, whether or not the input had one.
     */
    @Test
    void dtnNodeWithoutServiceGetsTrailingSlash() {
        assertEquals("dtn://node1/", EndpointId.parse("dtn://node1").toString());
        assertEquals("dtn://node1/", EndpointId.parse("dtn://node1/").toString());
    }

    /**
     * Verifies that everything after the first slash is the service, kept
     * verbatim, and that the scheme predicates report a dtn EID.
     */
    @Test
    void dtnServiceIsKeptVerbatim() {
        EndpointId eid = EndpointId.parse("dtn://node1/inbox/sub");
        assertEquals("dtn://node1/inbox/sub", eid.toString());
        assertEquals(Optional.of("node1"), eid.node());
        assertEquals(Optional.of("inbox/sub"), eid.service());
        assertTrue(eid.isDtn());
        assertFalse(eid.isIpn());
        assertFalse(eid.isNone());
    }

    /**
     * Verifies that the dtn factory builds the same value as parsing the
     * equivalent text, with an empty service treated as absent.
     */
    @Test
    void dtnFactoryMatchesParsedText() {
        assertEquals(EndpointId.parse("dtn://a.b/svc"), EndpointId.dtn("a.b", "svc"));
        assertEquals(EndpointId.parse("dtn://a.b/"), EndpointId.dtn("a.b", ""));
        assertEquals(EndpointId.parse("dtn://a.b/"), EndpointId.dtn("a.b"));
    }

    /**
     * Verifies that reparsing the canonical text of any valid dtn EID yields
     * an equal value.
     */
    @Test
    void dtnCanonicalTextParsesBackToEqualValue() {
        List<String> texts = List.of(
                "dtn://node1/",
                "dtn://node1/svc",
                "dtn://rec.all/~",
                "dtn://a-b_c.d~e/x/y/z",
                "dtn://n!$&'()*+,;=/s?q=1#f",
                "dtn:///svc",
                "dtn://42/ ");

        for (String text : texts) {
            EndpointId eid = EndpointId.parse(text);
            assertEquals(eid, EndpointId.parse(eid.toString()), text);
            assertEquals(text, eid.toString());
        }
        EndpointId built = EndpointId.dtn("node2", "inbox");
        assertEquals(built, EndpointId.parse(built.toString()));
    }

    /**
     * Verifies that a node with characters outside the allowed set is
     * rejected, as is a dtn EID with nothing after the scheme.
     */
    @Test
    void dtnRejectsInvalidNodes() {
        assertThrows(EidException.class, () -> EndpointId.parse("dtn://"));
        assertThrows(EidException.class, () -> EndpointId.parse("dtn://no de/"));
        assertThrows(EidException.class, () -> EndpointId.dtn("bad/node", "svc"));
    }

    /**
     * Verifies that an empty node is accepted when a service follows.
     */
    @Test
    void dtnAcceptsEmptyNodeWithService() {
        EndpointId eid = EndpointId.parse("dtn:///svc");
        assertEquals(Optional.of(""), eid.node());
        assertEquals(Optional.of("svc"), eid.service());
    }

    /**
     * Verifies that {@code dtn://none} is not a spelling of the null
     * endpoint, with or without a service.
     */
    @Test
    void dtnNoneMustUseTheNullLiteral() {
        EidException e = assertThrows(EidException.class, () -> EndpointId.parse("dtn://none"));
        assertTrue(e.getMessage().contains("dtn:none"));
        assertThrows(EidException.class, () -> EndpointId.parse("dtn://none/svc"));
    }

    @Test
    void dtnRejectsNonAsciiService() {
        assertThrows(EidException.class, () -> EndpointId.parse("dtn://node/ü"));
        assertThrows(EidException.class, () -> EndpointId.dtn("node", "é"));
    }

    // ---------------------------------------------------------------------
    // ipn scheme
    // ---------------------------------------------------------------------

    /**
     * Verifies that signs, leading zeros and surrounding whitespace are
     * normalized away and that numbers beyond 64 bits are kept exactly.
     */
    @Test
    void ipnNumbersAreNormalized() {
        assertEquals("ipn:1.0", EndpointId.parse("ipn:1.0").toString());
        assertEquals("ipn:42.7", EndpointId.parse("ipn:+042. 007").toString());
        assertEquals("ipn:18446744073709551616.1",
                EndpointId.parse("ipn:18446744073709551616.1").toString());
    }

    /**
     * Verifies that single underscores between digits are accepted as digit
     * separators, and that misplaced or doubled underscores are not.
     */
    @Test
    void ipnAcceptsUnderscoreDigitSeparators() {
        assertEquals("ipn:1000.1", EndpointId.parse("ipn:1_000.1").toString());
        assertEquals("ipn:12.3456", EndpointId.parse("ipn:1_2.3_4_5_6").toString());

        assertThrows(EidException.class, () -> EndpointId.parse("ipn:1__000.1"));
        assertThrows(EidException.class, () -> EndpointId.parse("ipn:_1.1"));
        assertThrows(EidException.class, () -> EndpointId.parse("ipn:1_.1"));
        assertThrows(EidException.class, () -> EndpointId.parse("ipn:1._1"));
    }

    @Test
    void ipnFactoryAndAccessors() {
        EndpointId eid = EndpointId.ipn(23, 5);
        assertEquals("ipn:23.5", eid.toString());
        assertEquals(Optional.of("23"), eid.node());
        assertEquals(Optional.of("5"), eid.service());
        assertTrue(eid.isIpn());
    }

    /**
     * Verifies that the arbitrary-precision factory covers the same range as
     * the parser, including numbers above {@link Long#MAX_VALUE}.
     */
    @Test
    void ipnFactoryAcceptsNumbersBeyondLongRange() {
        BigInteger node = new BigInteger("18446744073709551616");
        BigInteger service = new BigInteger("9223372036854775808");

        EndpointId eid = EndpointId.ipn(node, service);

        assertEquals("ipn:18446744073709551616.9223372036854775808", eid.toString());
        assertEquals(EndpointId.parse(eid.toString()), eid);
        assertEquals(EndpointId.ipn(7, 3), EndpointId.ipn(BigInteger.valueOf(7), BigInteger.valueOf(3)));
        assertThrows(EidException.class, () -> EndpointId.ipn(BigInteger.ZERO, BigInteger.ONE));
        assertThrows(EidException.class, () -> EndpointId.ipn(BigInteger.ONE, BigInteger.valueOf(-1)));
    }

    /**
     * Verifies the range checks: node numbers start at 1, service numbers
     * at 0.
     */
    @Test
    void ipnRejectsOutOfRangeNumbers() {
        assertThrows(EidException.class, () -> EndpointId.parse("ipn:0.1"));
        assertThrows(EidException.class, () -> EndpointId.parse("ipn:1.-1"));
        assertThrows(EidException.class, () -> EndpointId.ipn(0, 1));
        assertThrows(EidException.class, () -> EndpointId.ipn(1, -1));
    }

    @Test
    void ipnRejectsMalformedText() {
        assertThrows(EidException.class, () -> EndpointId.parse("ipn://1.2"));
        assertThrows(EidException.class, () -> EndpointId.parse("ipn:1"));
        assertThrows(EidException.class, () -> EndpointId.parse("ipn:1.2.3"));
        assertThrows(EidException.class, () -> EndpointId.parse("ipn:a.b"));
        assertThrows(EidException.class, () -> EndpointId.parse("ipn:.1"));
    }

    // ---------------------------------------------------------------------
    // Null endpoint and unknown schemes
    // ---------------------------------------------------------------------

    /**
     * Verifies that {@code dtn:none} always yields the same instance and
     * has neither node nor service.
     */
    @Test
    void noneIsASingleton() {
        assertSame(EndpointId.none(), EndpointId.parse("dtn:none"));
        assertTrue(EndpointId.none().isNone());
        assertFalse(EndpointId.none().isDtn());
        assertEquals(Optional.empty(), EndpointId.none().node());
        assertEquals(Optional.empty(), EndpointId.none().service());
    }

    @Test
    void unknownSchemeIsRejected() {
        EidException e = assertThrows(EidException.class, () -> EndpointId.parse("http://node/"));
        assertTrue(e.getMessage().contains("unknown scheme"));
        assertThrows(EidException.class, () -> EndpointId.parse(""));
    }

    @Test
    void eidExceptionIsAnIllegalArgument() {
        assertInstanceOf(IllegalArgumentException.class,
                assertThrows(EidException.class, () -> EndpointId.parse("foo")));
    }

    /**
     * Verifies that equality and hashing follow the canonical text, so
     * different spellings of one endpoint are interchangeable.
     */
    @Test
    void equalityFollowsCanonicalText() {
        assertEquals(EndpointId.parse("ipn:01.02"), EndpointId.ipn(1, 2));
        assertEquals(EndpointId.parse("ipn:01.02").hashCode(), EndpointId.ipn(1, 2).hashCode());
        assertNotEquals(EndpointId.dtn("a", "x"), EndpointId.dtn("a", "y"));
    }

    // ---------------------------------------------------------------------
    // Well-known endpoints
    // ---------------------------------------------------------------------

    /**
     * Verifies the reserved broadcast and multicast endpoints.
     */
    @Test
    void wellKnownEndpointsUseReservedNodes() {
        assertEquals("dtn://rec.all/~", WellKnownEndpoints.BROADCAST_ADDRESS.toString());
        assertEquals("dtn://rec.broker/~", WellKnownEndpoints.BROKER_MULTICAST_ADDRESS.toString());
        assertEquals("dtn://rec.store/~", WellKnownEndpoints.DATASTORE_MULTICAST_ADDRESS.toString());
        assertEquals("dtn://rec.executor/~", WellKnownEndpoints.EXECUTOR_MULTICAST_ADDRESS.toString());
        assertEquals("dtn://rec.client/~", WellKnownEndpoints.CLIENT_MULTICAST_ADDRESS.toString());
    }
}
