package tollgate.core.service.common;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.Optional;

/**
 * Utility for extracting the originating client IP address of a request.
 *
 * <p>Checks in the following order:
 * <ol>
 *   <li>RFC 7239 {@code Forwarded} header's {@code for} parameter</li>
 *   <li>Legacy {@code X-Forwarded-For} header (first IP in chain)</li>
 *   <li>Socket connection's remote address</li>
 * </ol>
 *
 * <p>Header values are client controlled. Only IP address literals are accepted from
 * them; ports and IPv6 brackets are removed. Anything else (obfuscated identifiers,
 * hostnames, injected text) is skipped and the next source is used.
 */
public final class ClientIpExtractor {

    public static final String FORWARDED = "Forwarded";
    public static final String X_FORWARDED_FOR = "X-Forwarded-For";

    private ClientIpExtractor() {}

    /**
     * Extract the original client IP address.
     *
     * @param forwarded     value of the {@code Forwarded} header, may be null
     * @param xForwardedFor value of the {@code X-Forwarded-For} header, may be null
     * @param remoteAddress address of the socket peer, may be null
     * @return the client IP address, or empty if not available
     */
    public static Optional<String> extract(String forwarded, String xForwardedFor, String remoteAddress) {
        if (forwarded != null && !forwarded.isBlank()) {
            var forValue = normalize(extractForwardedParam(forwarded, "for"));
            if (forValue != null) {
                return Optional.of(forValue);
            }
        }

        if (xForwardedFor != null && !xForwardedFor.isBlank()) {
            var first = normalize(xForwardedFor.split(",", -1)[0]);
            if (first != null) {
                return Optional.of(first);
            }
        }

        if (remoteAddress == null || remoteAddress.isBlank()) {
            return Optional.empty();
        }
        return Optional.of(remoteAddress);
    }

    /**
     * Reduce a forwarded node to a bare IP address.
     *
     * <p>Accepts {@code 192.0.2.1}, {@code 192.0.2.1:8080}, {@code 2001:db8::1} and
     * {@code [2001:db8::1]:8080}.
     *
     * @param node the node value, may be null
     * @return the IP address, or null if the value is not an IP address literal
     */
    static String normalize(String node) {
        if (node == null) {
            return null;
        }
        var value = node.trim();
        if (value.isEmpty()) {
            return null;
        }

        if (value.charAt(0) == '[') {
            var end = value.indexOf(']');
            if (end < 0 || !isPortSuffix(value.substring(end + 1))) {
                return null;
            }
            var address = value.substring(1, end);
            return isIpv6Literal(address) ? address : null;
        }

        var firstColon = value.indexOf(':');
        if (firstColon >= 0 && firstColon == value.lastIndexOf(':')) {
            var host = value.substring(0, firstColon);
            return isPortSuffix(value.substring(firstColon)) && isIpv4Literal(host) ? host : null;
        }
        if (firstColon >= 0) {
            return isIpv6Literal(value) ? value : null;
        }
        return isIpv4Literal(value) ? value : null;
    }

    private static boolean isPortSuffix(String suffix) {
        if (suffix.isEmpty()) {
            return true;
        }
        if (suffix.charAt(0) != ':' || suffix.length() < 2 || suffix.length() > 6) {
            return false;
        }
        for (var i = 1; i < suffix.length(); i++) {
            if (!Character.isDigit(suffix.charAt(i))) {
                return false;
            }
        }
        return true;
    }

    private static boolean isIpv4Literal(String input) {
        var octets = input.split("\\.", -1);
        if (octets.length != 4) {
            return false;
        }
        for (var octet : octets) {
            if (octet.isEmpty() || octet.length() > 3) {
                return false;
            }
            for (var i = 0; i < octet.length(); i++) {
                if (!Character.isDigit(octet.charAt(i))) {
                    return false;
                }
            }
            if (Integer.parseInt(octet) > 255) {
                return false;
            }
        }
        return true;
    }

    private static boolean isIpv6Literal(String input) {
        if (input.isEmpty() || input.length() > 45 || input.indexOf(':') < 0) {
            return false;
        }
        for (var i = 0; i < input.length(); i++) {
            final var c = input.charAt(i);
            if (c != ':' && c != '.' && Character.digit(c, 16) < 0) {
                return false;
            }
        }
        try {
            // Contains a colon and only hex digits, so this parses a literal and never resolves a hostname
            InetAddress.getByName(input);
            return true;
        } catch (UnknownHostException e) {
            return false;
        }
    }

    /**
     * Extract a parameter value from the first entry of an RFC 7239 Forwarded header.
     *
     * <p>The first entry was added by the proxy closest to the client.
     *
     * @param forwarded the Forwarded header value
     * @param param     the parameter name to extract (e.g., "for", "proto", "host")
     * @return the parameter value, or null if not found
     */
    public static String extractForwardedParam(String forwarded, String param) {
        var entries = forwarded.split(",");
        if (entries.length == 0) {
            return null;
        }

        for (var part : entries[0].trim().split(";")) {
            var keyValue = part.trim().split("=", 2);
            if (keyValue.length == 2 && keyValue[0].trim().equalsIgnoreCase(param)) {
                var value = keyValue[1].trim();
                if (value.length() >= 2 && value.startsWith("\"") && value.endsWith("\"")) {
                    value = value.substring(1, value.length() - 1);
                }
                return value;
            }
        }

        return null;
    }
}
