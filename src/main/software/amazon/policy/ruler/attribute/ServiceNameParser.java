package software.amazon.policy.ruler.attribute;

/**
 * Name of the calling service, taken from the X-Service-Name header.
 */
public class ServiceNameParser implements AttributeParser {

    public static final String X_SERVICE_NAME = "X-Service-Name";

    @Override
    public Object parse(final RequestAttributes request) {
        return request.header(X_SERVICE_NAME);
    }
}
