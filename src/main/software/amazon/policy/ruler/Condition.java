package software.amazon.policy.ruler;

import com.fasterxml.jackson.databind.JsonNode;

import javax.annotation.concurrent.Immutable;
import javax.annotation.concurrent.ThreadSafe;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Predicate;

/**
 * The conditions of a policy statement: operator names mapped to their blocks, e.g.
 * <pre>
 *   {
 *     "IPAddress": { "acs:SourceIp": ["203.0.113.0/24"] },
 *     "Bool":      { "acs:MFAPresent": ["true"] }
 *   }
 * </pre>
 * A condition holds when every attribute entry of every block holds. Operator names are resolved to
 * ConditionOperators when the condition is built; names that are not known operators are remembered so that
 * evaluation can fail closed on them.
 */
@Immutable
@ThreadSafe
public final class Condition {

    private final Map<String, ConditionValue> blocks;
    private final List<Clause> clauses;
    private final Set<String> unknownOperators;

    public Condition(final Map<String, ConditionValue> blocks) {
        this.blocks = Collections.unmodifiableMap(new LinkedHashMap<>(blocks));

        final List<Clause> resolved = new ArrayList<>();
        final Set<String> unknown = new LinkedHashSet<>();
        for (Map.Entry<String, ConditionValue> block : this.blocks.entrySet()) {
            final ConditionOperator operator = ConditionOperator.forName(block.getKey());
            if (operator == null) {
                unknown.add(block.getKey());
                continue;
            }
            for (Map.Entry<String, List<String>> entry : block.getValue().asMap().entrySet()) {
                resolved.add(new Clause(operator, entry.getKey(), entry.getValue()));
            }
        }
        this.clauses = Collections.unmodifiableList(resolved);
        this.unknownOperators = Collections.unmodifiableSet(unknown);
    }

    public static Builder builder() {
        return new Builder();
    }

    public Map<String, ConditionValue> blocks() {
        return blocks;
    }

    /**
     * @return operator names present in this condition that are not known operators, in document order
     */
    public Set<String> unknownOperators() {
        return unknownOperators;
    }

    List<Clause> clauses() {
        return clauses;
    }

    @Override
    public boolean equals(final Object o) {
        return this == o || (o instanceof Condition && blocks.equals(((Condition) o).blocks));
    }

    @Override
    public int hashCode() {
        return blocks.hashCode();
    }

    @Override
    public String toString() {
        return blocks.toString();
    }

    /**
     * One attribute entry of one operator block, with its acceptable values already converted for the operator.
     */
    static final class Clause {

        private final ConditionOperator operator;
        private final String attribute;
        private final Predicate<JsonNode> test;

        Clause(final ConditionOperator operator, final String attribute, final List<String> acceptableValues) {
            this.operator = operator;
            this.attribute = attribute;
            this.test = operator.bind(acceptableValues);
        }

        ConditionOperator operator() {
            return operator;
        }

        String attribute() {
            return attribute;
        }

        boolean test(final JsonNode contextValue) {
            return test.test(contextValue);
        }
    }

    public static class Builder {

        private final Map<String, Map<String, List<String>>> blocks = new LinkedHashMap<>();

        public Builder add(final ConditionOperator operator, final String attribute, final String... acceptableValues) {
            return add(operator.operatorName(), attribute, acceptableValues);
        }

        /**
         * Adds acceptable values for an attribute under an operator given by name. Unknown names are allowed and make
         * the resulting condition evaluate to false.
         */
        public Builder add(final String operatorName, final String attribute, final String... acceptableValues) {
            blocks.computeIfAbsent(operatorName, k -> new LinkedHashMap<>())
                    .computeIfAbsent(attribute, k -> new ArrayList<>())
                    .addAll(Arrays.asList(acceptableValues));
            return this;
        }

        public Condition build() {
            final Map<String, ConditionValue> values = new LinkedHashMap<>();
            for (Map.Entry<String, Map<String, List<String>>> block : blocks.entrySet()) {
                values.put(block.getKey(), new ConditionValue(block.getValue()));
            }
            return new Condition(values);
        }
    }
}
