package software.amazon.policy.ruler;

import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import javax.annotation.concurrent.Immutable;
import javax.annotation.concurrent.ThreadSafe;
import java.io.IOException;

/**
 * Decides whether the facts about a request satisfy the conditions of a policy statement.
 *
 * Evaluation fails closed: an unknown operator, an attribute missing from the context, or an attribute whose value
 * satisfies none of the listed values all make the result false, never an exception. Only malformed input documents
 * are reported as errors, so a caller can tell "denied" from "could not decide".
 */
@ThreadSafe
@Immutable
public class ConditionEvaluator {

    private static final Logger LOG = LoggerFactory.getLogger(ConditionEvaluator.class);

    /**
     * Decodes both documents and evaluates the condition against the context.
     *
     * @param contextJson the context, e.g. {"acs:SourceIp": "10.0.0.1"}
     * @param conditionJson the condition, e.g. {"IPAddress": {"acs:SourceIp": ["10.0.0.0/8"]}}
     * @return true if every declared condition holds
     * @throws IOException if either document is malformed
     */
    public boolean evaluate(@Nonnull final String contextJson, @Nonnull final String conditionJson)
            throws IOException {
        final Condition condition = JsonConditionCompiler.compileCondition(conditionJson);
        final ConditionContext context = JsonConditionCompiler.compileContext(contextJson);
        return evaluate(context, condition);
    }

    /**
     * @return true if every attribute entry of every operator block holds in the context
     */
    public boolean evaluate(@Nonnull final ConditionContext context, @Nonnull final Condition condition) {
        if (!condition.unknownOperators().isEmpty()) {
            LOG.debug("Condition uses unknown operators {}", condition.unknownOperators());
            return false;
        }

        for (Condition.Clause clause : condition.clauses()) {
            final JsonNode value = context.get(clause.attribute());
            if (value == null) {
                LOG.debug("Attribute {} required by {} is absent from the context", clause.attribute(),
                        clause.operator().operatorName());
                return false;
            }
            if (!clause.test(value)) {
                LOG.debug("Attribute {} = {} does not satisfy {}", clause.attribute(), value,
                        clause.operator().operatorName());
                return false;
            }
        }
        return true;
    }
}
