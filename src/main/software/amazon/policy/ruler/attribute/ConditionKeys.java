package software.amazon.policy.ruler.attribute;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.policy.ruler.ConditionContext;

import javax.annotation.concurrent.Immutable;
import javax.annotation.concurrent.ThreadSafe;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Registry of the condition keys a host can resolve from a request, each with the parser that produces its value.
 * Used to build the ConditionContext a request is evaluated against.
 */
@Immutable
@ThreadSafe
public final class ConditionKeys {

    private static final Logger LOG = LoggerFactory.getLogger(ConditionKeys.class);

    public static final String SOURCE_IP = "inf:SourceIP";
    public static final String CURRENT_TIME = "inf:CurrentTime";
    public static final String SERVICE_NAME = "iam:ServiceName";

    private static final ConditionKeys DEFAULTS = builder()
            .withKey(SOURCE_IP, new SourceIpParser())
            .withKey(CURRENT_TIME, new CurrentTimeParser())
            .withKey(SERVICE_NAME, new ServiceNameParser())
            .build();

    private final Map<String, AttributeParser> parsers;

    private ConditionKeys(final Map<String, AttributeParser> parsers) {
        this.parsers = Collections.unmodifiableMap(new LinkedHashMap<>(parsers));
    }

    /**
     * @return the source IP, current time and service name keys
     */
    public static ConditionKeys defaults() {
        return DEFAULTS;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Map<String, AttributeParser> parsers() {
        return parsers;
    }

    /**
     * Runs every parser against the request. Keys whose parser yields no value are left out of the context, so
     * conditions on them fail closed.
     */
    public ConditionContext contextFor(final RequestAttributes request) {
        final ConditionContext.Builder context = ConditionContext.builder();
        for (Map.Entry<String, AttributeParser> entry : parsers.entrySet()) {
            final Object value = entry.getValue().parse(request);
            if (value == null) {
                LOG.debug("No value for condition key {}", entry.getKey());
                continue;
            }
            context.putScalar(entry.getKey(), value);
        }
        return context.build();
    }

    public static class Builder {

        private final Map<String, AttributeParser> parsers = new LinkedHashMap<>();

        public Builder withDefaults() {
            parsers.putAll(DEFAULTS.parsers);
            return this;
        }

        public Builder withKey(final String key, final AttributeParser parser) {
            parsers.put(key, parser);
            return this;
        }

        public ConditionKeys build() {
            return new ConditionKeys(parsers);
        }
    }
}
