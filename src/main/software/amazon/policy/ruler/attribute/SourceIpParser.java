package software.amazon.policy.ruler.attribute;

/**
 * The address the request originates from. Proxy headers take precedence over the peer address, in this order:
 * x-client-ip, X-Real-IP, then the first hop listed in X-Forwarded-For. The IPv6 loopback is reported as 127.0.0.1.
 */
public class SourceIpParser implements AttributeParser {

    public static final String X_CLIENT_IP = "x-client-ip";
    public static final String X_REAL_IP = "X-Real-IP";
    public static final String X_FORWARDED_FOR = "X-Forwarded-For";

    private static final String IPV6_LOOPBACK = "::1";
    private static final String IPV4_LOOPBACK = "127.0.0.1";

    @Override
    public Object parse(final RequestAttributes request) {
        String address = firstNonEmpty(request.header(X_CLIENT_IP), request.header(X_REAL_IP),
                firstHop(request.header(X_FORWARDED_FOR)));
        if (address == null) {
            address = hostOf(request.remoteAddress());
        }
        return IPV6_LOOPBACK.equals(address) ? IPV4_LOOPBACK : address;
    }

    private static String firstHop(final String forwardedFor) {
        if (forwardedFor == null) {
            return null;
        }
        final int comma = forwardedFor.indexOf(',');
        return (comma < 0 ? forwardedFor : forwardedFor.substring(0, comma)).trim();
    }

    private static String firstNonEmpty(final String... values) {
        for (String value : values) {
            if (value != null && !value.isEmpty()) {
                return value;
            }
        }
        return null;
    }

    /**
     * Strips the port from "host:port" and the brackets from "[v6]:port". A bare host, including an unbracketed
     * IPv6 literal, is returned unchanged.
     */
    static String hostOf(final String remoteAddress) {
        if (remoteAddress == null) {
            return null;
        }
        if (remoteAddress.startsWith("[")) {
            final int close = remoteAddress.indexOf(']');
            return close < 0 ? remoteAddress : remoteAddress.substring(1, close);
        }
        final int colon = remoteAddress.indexOf(':');
        if (colon >= 0 && colon == remoteAddress.lastIndexOf(':')) {
            return remoteAddress.substring(0, colon);
        }
        return remoteAddress;
    }
}
