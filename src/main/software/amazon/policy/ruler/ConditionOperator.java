package software.amazon.policy.ruler;

import com.fasterxml.jackson.databind.JsonNode;
import software.amazon.policy.ruler.ConditionComparator.BooleanComparator;
import software.amazon.policy.ruler.ConditionComparator.DateComparator;
import software.amazon.policy.ruler.ConditionComparator.IpComparator;
import software.amazon.policy.ruler.ConditionComparator.NumericComparator;
import software.amazon.policy.ruler.ConditionComparator.StringComparator;

import javax.annotation.Nullable;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Predicate;

/**
 * The condition operators a policy may use, each bound to the typed comparison it performs. Negated operators follow
 * the same any-of rule as the others, e.g. StringNotEquals holds when the context value differs from at least one
 * listed value.
 */
public enum ConditionOperator {
    STRING_EQUALS(Constants.STRING_EQUALS, new StringComparator(String::equals)),
    STRING_NOT_EQUALS(Constants.STRING_NOT_EQUALS, new StringComparator((a, b) -> !a.equals(b))),
    STRING_EQUALS_IGNORE_CASE(Constants.STRING_EQUALS_IGNORE_CASE, new StringComparator(String::equalsIgnoreCase)),
    STRING_NOT_EQUALS_IGNORE_CASE(Constants.STRING_NOT_EQUALS_IGNORE_CASE,
            new StringComparator((a, b) -> !a.equalsIgnoreCase(b))),
    STRING_LIKE(Constants.STRING_LIKE, new StringComparator(String::contains)),     // substring, not a wildcard
    STRING_NOT_LIKE(Constants.STRING_NOT_LIKE, new StringComparator((a, b) -> !a.contains(b))),

    NUMERIC_EQUALS(Constants.NUMERIC_EQUALS, new NumericComparator(c -> c == 0)),
    NUMERIC_NOT_EQUALS(Constants.NUMERIC_NOT_EQUALS, new NumericComparator(c -> c != 0)),
    NUMERIC_LESS_THAN(Constants.NUMERIC_LESS_THAN, new NumericComparator(c -> c < 0)),
    NUMERIC_LESS_THAN_EQUALS(Constants.NUMERIC_LESS_THAN_EQUALS, new NumericComparator(c -> c <= 0)),
    NUMERIC_GREATER_THAN(Constants.NUMERIC_GREATER_THAN, new NumericComparator(c -> c > 0)),
    NUMERIC_GREATER_THAN_EQUALS(Constants.NUMERIC_GREATER_THAN_EQUALS, new NumericComparator(c -> c >= 0)),

    DATE_EQUALS(Constants.DATE_EQUALS, new DateComparator(c -> c == 0)),
    DATE_NOT_EQUALS(Constants.DATE_NOT_EQUALS, new DateComparator(c -> c != 0, true)),
    DATE_LESS_THAN(Constants.DATE_LESS_THAN, new DateComparator(c -> c < 0)),
    DATE_LESS_THAN_EQUALS(Constants.DATE_LESS_THAN_EQUALS, new DateComparator(c -> c <= 0)),
    DATE_GREATER_THAN(Constants.DATE_GREATER_THAN, new DateComparator(c -> c > 0)),
    DATE_GREATER_THAN_EQUALS(Constants.DATE_GREATER_THAN_EQUALS, new DateComparator(c -> c >= 0)),

    BOOL(Constants.BOOL, new BooleanComparator()),

    IP_ADDRESS(Constants.IP_ADDRESS, new IpComparator(true)),
    NOT_IP_ADDRESS(Constants.NOT_IP_ADDRESS, new IpComparator(false));

    private static final Map<String, ConditionOperator> BY_NAME;

    static {
        final Map<String, ConditionOperator> byName = new HashMap<>();
        for (ConditionOperator operator : values()) {
            byName.put(operator.operatorName, operator);
        }
        BY_NAME = Collections.unmodifiableMap(byName);
    }

    private final String operatorName;
    private final ConditionComparator<?, ?> comparator;

    ConditionOperator(final String operatorName, final ConditionComparator<?, ?> comparator) {
        this.operatorName = operatorName;
        this.comparator = comparator;
    }

    /**
     * @return the exact name used for this operator in condition documents, e.g. "StringEquals"
     */
    public String operatorName() {
        return operatorName;
    }

    /**
     * @param operatorName case-sensitive operator name
     * @return the operator, or null if the name is not a known operator
     */
    @Nullable
    public static ConditionOperator forName(final String operatorName) {
        return BY_NAME.get(operatorName);
    }

    Predicate<JsonNode> bind(final List<String> acceptableValues) {
        return comparator.bind(acceptableValues);
    }
}
