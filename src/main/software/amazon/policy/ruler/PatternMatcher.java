package software.amazon.policy.ruler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.policy.ruler.input.WildcardParser;

import javax.annotation.Nonnull;
import javax.annotation.concurrent.ThreadSafe;
import java.util.regex.Pattern;

import static software.amazon.policy.ruler.Constants.PATTERN_LIST_SEPARATOR;
import static software.amazon.policy.ruler.Constants.WILDCARD_CHAR;

/**
 * Matches identifiers taken from a request (resource names, action names) against the patterns declared in a policy.
 * A pattern is either a literal, which must equal the candidate exactly, or a wildcard expression in which '*' stands
 * for zero or more arbitrary characters, e.g. "ecs:Describe*". Policies may list several patterns separated by commas;
 * the candidate matches the list if it matches any element.
 *
 * Wildcards are compiled into anchored regular expressions on first use and kept in a bounded LRU cache owned by this
 * instance. The cache only saves compilation time; a matcher with an empty cache gives the same answers. Each
 * evaluation is bounded by the configured time budget, and running out of time is reported as a
 * MatchTimeoutException rather than as a non-match so callers can tell "denied" from "matcher malfunction".
 *
 * Instances are safe for concurrent use without external locking.
 */
@ThreadSafe
public class PatternMatcher {

    private static final Logger LOG = LoggerFactory.getLogger(PatternMatcher.class);

    private final MatcherConfiguration configuration;
    private final PatternCache cache;

    public PatternMatcher() {
        this(MatcherConfiguration.defaults());
    }

    public PatternMatcher(@Nonnull final MatcherConfiguration configuration) {
        this.configuration = configuration;
        this.cache = new PatternCache(configuration.getCacheCapacity());
    }

    /**
     * Checks a candidate against a comma-separated list of patterns.
     *
     * @param candidate value from the request, e.g. "ecs:DescribeInstances"
     * @param patternList value from the policy, e.g. "ecs:Describe*,ecs:ListTags"
     * @return true if any element of the list matches the candidate
     * @throws MatchTimeoutException if evaluating a wildcard exceeds the time budget
     * @throws java.util.regex.PatternSyntaxException if a wildcard cannot be compiled, which indicates a bug
     */
    public boolean matches(@Nonnull final String candidate, @Nonnull final String patternList) {
        if (candidate == null || patternList == null) {
            throw new NullPointerException("candidate and patternList must not be null");
        }
        // -1 keeps trailing empty elements, they are compared literally like any other element.
        for (String element : patternList.split(PATTERN_LIST_SEPARATOR, -1)) {
            if (matchesElement(candidate, element)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Same as {@link #matches(String, String)}, except that any failure is logged and resolved to false.
     */
    public boolean mustMatch(final String candidate, final String patternList) {
        try {
            return matches(candidate, patternList);
        } catch (RuntimeException e) {
            LOG.warn("Treating \"{}\" as not matching \"{}\" after matcher failure", candidate, patternList, e);
            return false;
        }
    }

    /**
     * Returns the compiled form of a single wildcard pattern, compiling and caching it if needed.
     *
     * @param wildcard a single pattern, commas are not treated as separators here
     */
    public CompiledPattern compile(@Nonnull final String wildcard) {
        final CompiledPattern cached = cache.get(wildcard);
        if (cached != null) {
            return cached;
        }

        // Compile outside the cache lock so other lookups are not held up by this one.
        final String regex = WildcardParser.getParser().parse(wildcard);
        final CompiledPattern compiled = new CompiledPattern(wildcard, Pattern.compile(regex, Pattern.DOTALL),
                configuration.getMatchTimeout());
        LOG.debug("Compiled wildcard \"{}\" into {}", wildcard, regex);
        return cache.putIfAbsent(wildcard, compiled);
    }

    public MatcherConfiguration getConfiguration() {
        return configuration;
    }

    /**
     * @return number of compiled wildcards currently cached
     */
    public int cacheSize() {
        return cache.size();
    }

    boolean isCached(final String wildcard) {
        return cache.contains(wildcard);
    }

    private boolean matchesElement(final String candidate, final String element) {
        if (element.indexOf(WILDCARD_CHAR) < 0) {
            return element.equals(candidate);
        }
        return compile(element).matches(candidate);
    }
}
