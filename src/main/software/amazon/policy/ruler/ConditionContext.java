package software.amazon.policy.ruler;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;

import javax.annotation.Nullable;
import javax.annotation.concurrent.Immutable;
import javax.annotation.concurrent.ThreadSafe;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Facts about the current request, one scalar per attribute name, e.g. {"acs:SourceIp": "10.0.0.1"}. Values are kept
 * as JSON scalars (string, number or boolean) and converted by each operator to the type it compares.
 */
@Immutable
@ThreadSafe
public final class ConditionContext {

    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    private final Map<String, JsonNode> attributes;

    ConditionContext(final Map<String, JsonNode> attributes) {
        this.attributes = Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * @return the value of the attribute, or null if the context does not contain it
     */
    @Nullable
    public JsonNode get(final String attribute) {
        return attributes.get(attribute);
    }

    public boolean contains(final String attribute) {
        return attributes.containsKey(attribute);
    }

    public Map<String, JsonNode> asMap() {
        return attributes;
    }

    @Override
    public boolean equals(final Object o) {
        return this == o || (o instanceof ConditionContext && attributes.equals(((ConditionContext) o).attributes));
    }

    @Override
    public int hashCode() {
        return attributes.hashCode();
    }

    @Override
    public String toString() {
        return attributes.toString();
    }

    public static class Builder {

        private final Map<String, JsonNode> attributes = new LinkedHashMap<>();

        public Builder put(final String attribute, final String value) {
            return putNode(attribute, NODES.textNode(value));
        }

        public Builder put(final String attribute, final long value) {
            return putNode(attribute, NODES.numberNode(value));
        }

        public Builder put(final String attribute, final boolean value) {
            return putNode(attribute, NODES.booleanNode(value));
        }

        /**
         * Adds a value produced by an attribute parser. Strings, integral numbers and booleans keep their type, any
         * other object is stored as its string form.
         */
        public Builder putScalar(final String attribute, final Object value) {
            if (value instanceof Boolean) {
                return put(attribute, (boolean) (Boolean) value);
            }
            if (value instanceof Long || value instanceof Integer || value instanceof Short || value instanceof Byte) {
                return put(attribute, ((Number) value).longValue());
            }
            return put(attribute, String.valueOf(value));
        }

        Builder putNode(final String attribute, final JsonNode value) {
            if (value == null || !value.isValueNode() || value.isNull()) {
                throw new IllegalArgumentException("Context value of \"" + attribute + "\" must be a scalar");
            }
            attributes.put(attribute, value);
            return this;
        }

        public ConditionContext build() {
            return new ConditionContext(attributes);
        }
    }
}
