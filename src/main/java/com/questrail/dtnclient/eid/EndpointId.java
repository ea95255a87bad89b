package com.questrail.dtnclient.eid;

import java.math.BigInteger;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Strongly typed, normalized bundle-protocol endpoint identifier (EID).
 *
 * <h2>Accepted forms</h2>
 * <ul>
 *   <li>{@code dtn:none}: the null endpoint; only this exact literal</li>
 *   <li>{@code dtn://<node>/<service>}: {@code node} is an RFC 3986
 *       {@code reg-name} built from unreserved and sub-delim characters
 *       (RFC 9171 §4.2.5.1.1), {@code service} is any ASCII text</li>
 *   <li>{@code ipn:<node>.<service>}: decimal node number {@code >= 1},
 *       decimal service number {@code >= 0}, of any size. Surrounding
 *       whitespace, a sign, leading zeros and single underscores between
 *       digits are accepted and normalized away.</li>
 * </ul>
 *
 * <p>Every instance holds exactly one canonical textual form. Equality and
 * hashing are defined on that text, so two identifiers parsed from different
 * spellings of the same endpoint (e.g. {@code dtn://node} and
 * {@code dtn://node/}) are equal.</p>
 *
 * <h2>Null endpoint</h2>
 * <p>{@code dtn:none} is a valid value, not an absence. Callers that use it as
 * a "no destination" / "no report-to" marker test for it with
 * {@link #isNone()}.</p>
 *
 * <h2>Layering note</h2>
 * <p>This type has no knowledge of wire encoding. Message mappings convert it
 * to and from its canonical text explicitly at the serialization boundary.</p>
 */
public final class EndpointId
{
    private static final String DTN_NONE = "dtn:none";
    private static final String DTN_PREFIX = "dtn://";
    private static final String IPN_PREFIX = "ipn:";

    // Empty node is accepted as a degenerate reg-name.
    private static final Pattern NODE_PATTERN =
            Pattern.compile("^$|^[A-Za-z0-9\\-._~!$&'()*+,;=]+$");

    // Optional sign, digits, single underscores only between digits.
    private static final Pattern IPN_NUMBER_PATTERN =
            Pattern.compile("^[+-]?\\p{Nd}+(_\\p{Nd}+)*$");

    private static final EndpointId NONE = new EndpointId(DTN_NONE);

    private final String canonical;

    private EndpointId(String canonical) {
        this.canonical = canonical;
    }

    /**
     * Parses and normalizes arbitrary endpoint text.
     *
     * @param text endpoint identifier text
     * @return the normalized identifier
     * @throws EidException if the text is not a valid {@code dtn:} or {@code ipn:} EID
     */
    public static EndpointId parse(String text) {
        Objects.requireNonNull(text, "text");
        if (DTN_NONE.equals(text)) {
            return NONE;
        }
        return new EndpointId(normalize(text));
    }

    /**
     * Creates a {@code dtn://node/service} identifier.
     *
     * <p>An empty or {@code null} service yields {@code dtn://node/}. Use
     * {@link #none()} for the null endpoint.</p>
     *
     * @throws EidException if node or service are invalid
     */
    public static EndpointId dtn(String node, String service) {
        Objects.requireNonNull(node, "node");
        if (service != null && service.isEmpty()) {
            service = null;
        }

        if (!NODE_PATTERN.matcher(node).matches()) {
            throw new EidException("invalid DTN node '" + node + "'");
        }
        if (service == null) {
            return parse(DTN_PREFIX + node + "/");
        }
        if (!isAscii(service)) {
            throw new EidException("invalid DTN service '" + service + "'");
        }
        return parse(DTN_PREFIX + node + "/" + service);
    }

    /**
     * Creates a {@code dtn://node/} identifier with an empty service.
     */
    public static EndpointId dtn(String node) {
        return dtn(node, null);
    }

    /**
     * Creates an {@code ipn:node.service} identifier.
     *
     * @param nodeNumber    node number (must be {@code >= 1})
     * @param serviceNumber service number (must be {@code >= 0})
     * @throws EidException if either number is out of range
     */
    public static EndpointId ipn(long nodeNumber, long serviceNumber) {
        return ipn(BigInteger.valueOf(nodeNumber), BigInteger.valueOf(serviceNumber));
    }

    /**
     * Creates an {@code ipn:node.service} identifier from numbers of any size.
     *
     * @param nodeNumber    node number (must be {@code >= 1})
     * @param serviceNumber service number (must be {@code >= 0})
     * @throws EidException if either number is out of range
     */
    public static EndpointId ipn(BigInteger nodeNumber, BigInteger serviceNumber) {
        Objects.requireNonNull(nodeNumber, "nodeNumber");
        Objects.requireNonNull(serviceNumber, "serviceNumber");
        if (nodeNumber.signum() < 1) {
            throw new EidException("IPN node must be >= 1");
        }
        if (serviceNumber.signum() < 0) {
            throw new EidException("IPN service must be >= 0");
        }
        return parse(IPN_PREFIX + nodeNumber + "." + serviceNumber);
    }

    /**
     * Returns the {@code dtn:none} endpoint.
     */
    public static EndpointId none() {
        return NONE;
    }

    /**
     * Returns {@code true} only for {@code dtn:none}.
     */
    public boolean isNone() {
        return DTN_NONE.equals(canonical);
    }

    public boolean isDtn() {
        return canonical.startsWith(DTN_PREFIX);
    }

    public boolean isIpn() {
        return canonical.startsWith(IPN_PREFIX);
    }

    /**
     * Returns the node part, or empty for {@code dtn:none}.
     *
     * <p>For {@code dtn:} identifiers this is the text between {@code dtn://}
     * and the first {@code /}; for {@code ipn:} identifiers it is the decimal
     * node number.</p>
     */
    public Optional<String> node() {
        if (isNone()) {
            return Optional.empty();
        }
        if (isDtn()) {
            String ssp = canonical.substring(DTN_PREFIX.length());
            return Optional.of(ssp.substring(0, ssp.indexOf('/')));
        }
        String ssp = canonical.substring(IPN_PREFIX.length());
        return Optional.of(ssp.substring(0, ssp.indexOf('.')));
    }

    /**
     * Returns the service part, or empty for {@code dtn:none}.
     *
     * <p>A {@code dtn:} identifier without a service returns an empty string.</p>
     */
    public Optional<String> service() {
        if (isNone()) {
            return Optional.empty();
        }
        if (isDtn()) {
            String ssp = canonical.substring(DTN_PREFIX.length());
            return Optional.of(ssp.substring(ssp.indexOf('/') + 1));
        }
        String ssp = canonical.substring(IPN_PREFIX.length());
        return Optional.of(ssp.substring(ssp.indexOf('.') + 1));
    }

    private static String normalize(String eid) {
        if (eid.startsWith(DTN_PREFIX)) {
            return normalizeDtn(eid.substring(DTN_PREFIX.length()));
        }
        if (eid.startsWith(IPN_PREFIX)) {
            return normalizeIpn(eid.substring(IPN_PREFIX.length()));
        }
        throw new EidException("unknown scheme (expected 'dtn:' or 'ipn:')");
    }

    private static String normalizeDtn(String ssp) {
        if ("none".equals(ssp)) {
            throw new EidException("invalid DTN host: use 'dtn:none', not 'dtn://none'");
        }
        if (ssp.isEmpty()) {
            throw new EidException("invalid DTN EID: missing node");
        }

        String node;
        String service;
        int slash = ssp.indexOf('/');
        if (slash >= 0) {
            node = ssp.substring(0, slash);
            service = ssp.substring(slash + 1);
        } else {
            node = ssp;
            service = "";
        }

        if ("none".equals(node)) {
            throw new EidException("invalid DTN host: use 'dtn:none', not 'dtn://none'");
        }
        if (!NODE_PATTERN.matcher(node).matches()) {
            throw new EidException("invalid DTN node '" + node + "'");
        }
        if (service.isEmpty()) {
            return DTN_PREFIX + node + "/";
        }
        if (!isAscii(service)) {
            throw new EidException("invalid DTN service '" + service + "'");
        }
        return DTN_PREFIX + node + "/" + service;
    }

    private static String normalizeIpn(String ssp) {
        if (ssp.startsWith("//")) {
            throw new EidException("invalid IPN EID: must be 'ipn:N.S', not 'ipn://N.S'");
        }
        String[] parts = ssp.split("\\.", -1);
        if (parts.length != 2) {
            throw new EidException("invalid IPN EID: need exactly one dot (node.service)");
        }

        BigInteger node = parseIpnNumber(parts[0], ssp);
        BigInteger service = parseIpnNumber(parts[1], ssp);
        if (node.signum() < 1) {
            throw new EidException("IPN node must be >= 1");
        }
        if (service.signum() < 0) {
            throw new EidException("IPN service must be >= 0");
        }
        return IPN_PREFIX + node + "." + service;
    }

    private static BigInteger parseIpnNumber(String text, String ssp) {
        String digits = text.strip();
        if (!IPN_NUMBER_PATTERN.matcher(digits).matches()) {
            throw new EidException("invalid IPN numbers: " + ssp);
        }
        try {
            return new BigInteger(digits.replace("_", ""), 10);
        } catch (NumberFormatException e) {
            throw new EidException("invalid IPN numbers: " + ssp, e);
        }
    }

    private static boolean isAscii(String s) {
        for (int i = 0; i < s.length(); i++) {
            if (s.charAt(i) > 0x7F) {
                return false;
            }
        }
        return true;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof EndpointId that)) return false;
        return canonical.equals(that.canonical);
    }

    @Override
    public int hashCode() {
        return canonical.hashCode();
    }

    /**
     * Returns the canonical text of this identifier.
     */
    @Override
    public String toString() {
        return canonical;
    }
}
