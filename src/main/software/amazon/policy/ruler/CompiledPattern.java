package software.amazon.policy.ruler;

import javax.annotation.Nonnull;
import javax.annotation.concurrent.Immutable;
import javax.annotation.concurrent.ThreadSafe;
import java.time.Duration;
import java.util.regex.Pattern;

/**
 * An anchored regular expression together with the time budget its evaluation must respect. Instances are produced
 * by the PatternMatcher (for wildcards) or the TemplateCompiler (for delimiter templates) and may be shared freely.
 */
@Immutable
@ThreadSafe
public final class CompiledPattern {

    private final String source;
    private final Pattern regex;
    private final Duration timeout;

    CompiledPattern(final String source, final Pattern regex, final Duration timeout) {
        this.source = source;
        this.regex = regex;
        this.timeout = timeout;
    }

    /**
     * @return the wildcard or template this pattern was compiled from
     */
    public String source() {
        return source;
    }

    /**
     * @return the anchored regular expression
     */
    public String pattern() {
        return regex.pattern();
    }

    public Duration timeout() {
        return timeout;
    }

    /**
     * Evaluates the whole candidate against this pattern.
     *
     * @param candidate value to test
     * @return true if the candidate matches
     * @throws MatchTimeoutException if evaluation runs past the time budget
     */
    public boolean matches(@Nonnull final CharSequence candidate) {
        final long deadline = System.nanoTime() + timeout.toNanos();
        return regex.matcher(new DeadlineCharSequence(candidate, deadline, this)).matches();
    }

    @Override
    public String toString() {
        return "CompiledPattern{source=" + source + ", pattern=" + regex.pattern() + ", timeout=" + timeout + '}';
    }
}
