package software.amazon.policy.ruler;

import java.time.Duration;

/**
 * Thrown when evaluating a compiled pattern takes longer than its time budget. This signals a matcher malfunction
 * (typically catastrophic backtracking), never a plain non-match.
 */
public class MatchTimeoutException extends RuntimeException {

    private final String pattern;
    private final Duration budget;

    public MatchTimeoutException(final String pattern, final Duration budget) {
        super("Match against \"" + pattern + "\" exceeded its " + budget.toMillis() + " ms budget");
        this.pattern = pattern;
        this.budget = budget;
    }

    public String getPattern() {
        return pattern;
    }

    public Duration getBudget() {
        return budget;
    }
}
