package software.amazon.policy.ruler;

import com.fasterxml.jackson.databind.JsonNode;

import javax.annotation.Nullable;
import javax.annotation.concurrent.Immutable;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.BiPredicate;
import java.util.function.IntPredicate;
import java.util.function.Predicate;

/**
 * A strongly typed comparison between one context value and the acceptable values a condition lists for it. The
 * context side is converted to C, each acceptable value to A; a conversion that fails yields null. A pair with a
 * null side satisfies the comparison only if {@link #unconvertedSatisfies()} says so. Within one list the comparison
 * is a disjunction: any acceptable value satisfying it is enough.
 *
 * @param <C> type of the context value
 * @param <A> type of an acceptable value
 */
@Immutable
abstract class ConditionComparator<C, A> {

    @Nullable
    abstract C contextValue(JsonNode value);

    @Nullable
    abstract A acceptableValue(String value);

    abstract boolean test(C contextValue, A acceptableValue);

    /**
     * @return whether a pair in which either side failed to convert satisfies the comparison
     */
    boolean unconvertedSatisfies() {
        return false;
    }

    /**
     * Converts the acceptable values once and returns a predicate over context values.
     */
    final Predicate<JsonNode> bind(final List<String> acceptableValues) {
        final List<A> converted = new ArrayList<>(acceptableValues.size());
        for (String value : acceptableValues) {
            final A acceptable = acceptableValue(value);
            if (acceptable != null) {
                converted.add(acceptable);
            }
        }
        final List<A> candidates = Collections.unmodifiableList(converted);
        if (!unconvertedSatisfies()) {
            return node -> anyMatch(contextValue(node), candidates);
        }
        if (candidates.size() < acceptableValues.size()) {
            // an unconverted acceptable value pairs successfully with any context value
            return node -> true;
        }
        return node -> {
            final C value = contextValue(node);
            return value == null ? !candidates.isEmpty() : anyMatch(value, candidates);
        };
    }

    private boolean anyMatch(@Nullable final C value, final List<A> acceptableValues) {
        if (value == null) {
            return false;
        }
        for (A acceptable : acceptableValues) {
            if (test(value, acceptable)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Strings compared as-is. Numbers and booleans in the context are compared by their JSON text.
     */
    static final class StringComparator extends ConditionComparator<String, String> {

        private final BiPredicate<String, String> comparison;

        StringComparator(final BiPredicate<String, String> comparison) {
            this.comparison = comparison;
        }

        @Override
        String contextValue(final JsonNode value) {
            return value.isTextual() ? value.textValue() : value.asText();
        }

        @Override
        String acceptableValue(final String value) {
            return value;
        }

        @Override
        boolean test(final String contextValue, final String acceptableValue) {
            return comparison.test(contextValue, acceptableValue);
        }
    }

    /**
     * Integer comparison; the predicate receives the result of Long.compare(context, acceptable).
     */
    static final class NumericComparator extends ConditionComparator<Long, Long> {

        private final IntPredicate onCompare;

        NumericComparator(final IntPredicate onCompare) {
            this.onCompare = onCompare;
        }

        @Override
        Long contextValue(final JsonNode value) {
            if (value.isIntegralNumber()) {
                return value.canConvertToLong() ? value.longValue() : null;
            }
            return value.isTextual() ? parseLong(value.textValue()) : null;
        }

        @Override
        Long acceptableValue(final String value) {
            return parseLong(value);
        }

        @Override
        boolean test(final Long contextValue, final Long acceptableValue) {
            return onCompare.test(Long.compare(contextValue, acceptableValue));
        }

        @Nullable
        private static Long parseLong(final String value) {
            try {
                return Long.parseLong(value);
            } catch (NumberFormatException e) {
                return null;
            }
        }
    }

    /**
     * Chronological comparison of RFC3339 timestamps; the predicate receives the result of comparing context to
     * acceptable. An unparsable timestamp on either side makes the pair unequal and neither before nor after, so only
     * the inequality operator is satisfied by it.
     */
    static final class DateComparator extends ConditionComparator<Instant, Instant> {

        private final IntPredicate onCompare;
        private final boolean unparsableIsUnequal;

        DateComparator(final IntPredicate onCompare) {
            this(onCompare, false);
        }

        DateComparator(final IntPredicate onCompare, final boolean unparsableIsUnequal) {
            this.onCompare = onCompare;
            this.unparsableIsUnequal = unparsableIsUnequal;
        }

        @Override
        boolean unconvertedSatisfies() {
            return unparsableIsUnequal;
        }

        @Override
        Instant contextValue(final JsonNode value) {
            return value.isTextual() ? parseInstant(value.textValue()) : null;
        }

        @Override
        Instant acceptableValue(final String value) {
            return parseInstant(value);
        }

        @Override
        boolean test(final Instant contextValue, final Instant acceptableValue) {
            return onCompare.test(contextValue.compareTo(acceptableValue));
        }

        @Nullable
        static Instant parseInstant(final String value) {
            try {
                return OffsetDateTime.parse(value, DateTimeFormatter.ISO_OFFSET_DATE_TIME).toInstant();
            } catch (DateTimeParseException e) {
                return null;
            }
        }
    }

    /**
     * Boolean equality. Accepts JSON booleans and the strings "true" and "false" in any case.
     */
    static final class BooleanComparator extends ConditionComparator<Boolean, Boolean> {

        @Override
        Boolean contextValue(final JsonNode value) {
            if (value.isBoolean()) {
                return value.booleanValue();
            }
            return value.isTextual() ? parseBoolean(value.textValue()) : null;
        }

        @Override
        Boolean acceptableValue(final String value) {
            return parseBoolean(value);
        }

        @Override
        boolean test(final Boolean contextValue, final Boolean acceptableValue) {
            return contextValue.equals(acceptableValue);
        }

        @Nullable
        private static Boolean parseBoolean(final String value) {
            if ("true".equalsIgnoreCase(value)) {
                return Boolean.TRUE;
            }
            if ("false".equalsIgnoreCase(value)) {
                return Boolean.FALSE;
            }
            return null;
        }
    }

    /**
     * Address membership. The context value must be an IP literal; each acceptable value is read as a literal first
     * and as a CIDR block second. Values that are neither never match, for the negated form too.
     */
    static final class IpComparator extends ConditionComparator<byte[], CIDR.Block> {

        private final boolean inside;

        IpComparator(final boolean inside) {
            this.inside = inside;
        }

        @Override
        byte[] contextValue(final JsonNode value) {
            return value.isTextual() ? CIDR.ipToBytesIfPossible(value.textValue()) : null;
        }

        @Override
        CIDR.Block acceptableValue(final String value) {
            return CIDR.ipOrCidrIfPossible(value);
        }

        @Override
        boolean test(final byte[] contextValue, final CIDR.Block acceptableValue) {
            return acceptableValue.contains(contextValue) == inside;
        }
    }
}
