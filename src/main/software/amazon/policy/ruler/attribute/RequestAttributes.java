package software.amazon.policy.ruler.attribute;

import javax.annotation.Nullable;

/**
 * The parts of an incoming request that attribute parsers read. Implemented by whatever HTTP layer hosts the
 * authorization check.
 */
public interface RequestAttributes {

    /**
     * @param name header name, matched case-insensitively by implementations
     * @return the first value of the header, or null if the request does not carry it
     */
    @Nullable
    String header(String name);

    /**
     * @return the address of the peer as "host:port", "[v6-host]:port" or a bare host
     */
    String remoteAddress();
}
