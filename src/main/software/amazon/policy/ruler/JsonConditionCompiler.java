package software.amazon.policy.ruler;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonParseException;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.core.StreamReadFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Decodes the JSON forms of conditions and condition contexts.
 *
 * A condition is an object of operator blocks, each an object mapping attribute names to arrays of strings:
 *   {
 *     "StringEquals": { "acs:UserRole": [ "admin", "superuser" ] },
 *     "DateLessThan": { "acs:CurrentTime": [ "2024-01-12T06:59:00Z" ] }
 *   }
 * A context is an object mapping attribute names to single scalars:
 *   { "acs:UserRole": "admin", "acs:CurrentTime": "2024-01-10T00:00:00Z", "acs:Age": 42, "acs:MFAPresent": true }
 *
 * Anything else is rejected with a JsonParseException. Operator names are not checked here; unknown operators are a
 * matter for evaluation, not for decoding. When a key repeats, its last occurrence wins.
 */
public class JsonConditionCompiler {

    private static final JsonFactory JSON_FACTORY = JsonFactory.builder()
            .configure(StreamReadFeature.INCLUDE_SOURCE_IN_LOCATION, true)
            .build();

    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    private JsonConditionCompiler() { }

    /**
     * Verify the syntax of a condition
     * @param source condition, as a String
     * @return null if the condition is valid, otherwise an error message
     */
    public static String check(final String source) {
        try {
            compileCondition(source);
            return null;
        } catch (Exception e) {
            return e.getLocalizedMessage();
        }
    }

    /**
     * @param source condition, in JSON form
     * @return the decoded condition
     * @throws IOException if the condition isn't syntactically valid
     */
    public static Condition compileCondition(final String source) throws IOException {
        try (JsonParser parser = JSON_FACTORY.createParser(source)) {
            return parseCondition(parser);
        }
    }

    public static Condition compileCondition(final byte[] source) throws IOException {
        try (JsonParser parser = JSON_FACTORY.createParser(source)) {
            return parseCondition(parser);
        }
    }

    /**
     * @param source context, in JSON form
     * @return the decoded context
     * @throws IOException if the context isn't syntactically valid
     */
    public static ConditionContext compileContext(final String source) throws IOException {
        try (JsonParser parser = JSON_FACTORY.createParser(source)) {
            return parseContext(parser);
        }
    }

    public static ConditionContext compileContext(final byte[] source) throws IOException {
        try (JsonParser parser = JSON_FACTORY.createParser(source)) {
            return parseContext(parser);
        }
    }

    private static Condition parseCondition(final JsonParser parser) throws IOException {
        if (parser.nextToken() != JsonToken.START_OBJECT) {
            barf(parser, "Condition is not an object");
        }
        final Map<String, ConditionValue> blocks = new LinkedHashMap<>();
        while (parser.nextToken() != JsonToken.END_OBJECT) {
            final String operatorName = parser.getCurrentName();
            if (parser.nextToken() != JsonToken.START_OBJECT) {
                barf(parser, "Value of operator \"" + operatorName + "\" must be an object");
            }
            blocks.put(operatorName, parseConditionValue(parser));
        }
        expectEnd(parser);
        return new Condition(blocks);
    }

    private static ConditionValue parseConditionValue(final JsonParser parser) throws IOException {
        final Map<String, List<String>> values = new LinkedHashMap<>();
        while (parser.nextToken() != JsonToken.END_OBJECT) {
            final String attribute = parser.getCurrentName();
            if (parser.nextToken() != JsonToken.START_ARRAY) {
                barf(parser, "Values of attribute \"" + attribute + "\" must be an array");
            }
            final List<String> acceptable = new ArrayList<>();
            JsonToken token;
            while ((token = parser.nextToken()) != JsonToken.END_ARRAY) {
                if (token != JsonToken.VALUE_STRING) {
                    barf(parser, "Values of attribute \"" + attribute + "\" must be strings");
                }
                acceptable.add(parser.getText());
            }
            values.put(attribute, acceptable);
        }
        return new ConditionValue(values);
    }

    private static ConditionContext parseContext(final JsonParser parser) throws IOException {
        if (parser.nextToken() != JsonToken.START_OBJECT) {
            barf(parser, "Context is not an object");
        }
        final ConditionContext.Builder builder = ConditionContext.builder();
        while (parser.nextToken() != JsonToken.END_OBJECT) {
            final String attribute = parser.getCurrentName();
            builder.putNode(attribute, parseScalar(parser, attribute));
        }
        expectEnd(parser);
        return builder.build();
    }

    private static JsonNode parseScalar(final JsonParser parser, final String attribute) throws IOException {
        final JsonToken token = parser.nextToken();
        if (token == null) {
            barf(parser, "Unexpected end of context");
        }
        switch (token) {
        case VALUE_STRING:
            return NODES.textNode(parser.getText());
        case VALUE_NUMBER_INT:
            if (parser.getNumberType() == JsonParser.NumberType.BIG_INTEGER) {
                return NODES.numberNode(parser.getBigIntegerValue());
            }
            return NODES.numberNode(parser.getLongValue());
        case VALUE_NUMBER_FLOAT:
            return NODES.numberNode(parser.getDecimalValue());
        case VALUE_TRUE:
        case VALUE_FALSE:
            return NODES.booleanNode(token == JsonToken.VALUE_TRUE);
        default:
            barf(parser, "Value of attribute \"" + attribute + "\" must be a string, number or boolean");
            return null;
        }
    }

    private static void expectEnd(final JsonParser parser) throws IOException {
        if (parser.nextToken() != null) {
            barf(parser, "Unexpected content after the closing brace");
        }
    }

    private static void barf(final JsonParser parser, final String message) throws JsonParseException {
        throw new JsonParseException(parser, message, parser.getCurrentLocation());
    }
}
