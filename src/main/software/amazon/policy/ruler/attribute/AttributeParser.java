package software.amazon.policy.ruler.attribute;

import javax.annotation.Nullable;

/**
 * Produces the value of one condition attribute from a request. The value is a single scalar: a String, a Number or
 * a Boolean.
 */
@FunctionalInterface
public interface AttributeParser {

    /**
     * @return the attribute value, or null if the request does not provide one
     */
    @Nullable
    Object parse(RequestAttributes request);
}
