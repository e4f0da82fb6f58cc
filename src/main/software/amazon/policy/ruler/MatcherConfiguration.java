package software.amazon.policy.ruler;

import javax.annotation.concurrent.Immutable;
import java.time.Duration;

/**
 * Configuration for a PatternMatcher.
 */
@Immutable
public class MatcherConfiguration {

    /**
     * Maximum number of compiled wildcard patterns kept by the matcher. Once full, adding a new pattern evicts the
     * least recently used one. Non-positive values fall back to the default of 512.
     */
    private final int cacheCapacity;

    /**
     * Time budget for evaluating one candidate against one compiled pattern. Exceeding it raises a
     * MatchTimeoutException.
     */
    private final Duration matchTimeout;

    private MatcherConfiguration(int cacheCapacity, Duration matchTimeout) {
        this.cacheCapacity = cacheCapacity;
        this.matchTimeout = matchTimeout;
    }

    public int getCacheCapacity() {
        return cacheCapacity;
    }

    public Duration getMatchTimeout() {
        return matchTimeout;
    }

    public static MatcherConfiguration defaults() {
        return new Builder().build();
    }

    public static class Builder {

        private int cacheCapacity = Constants.DEFAULT_CACHE_CAPACITY;
        private Duration matchTimeout = Constants.DEFAULT_MATCH_TIMEOUT;

        public Builder withCacheCapacity(int cacheCapacity) {
            this.cacheCapacity = cacheCapacity;
            return this;
        }

        public Builder withMatchTimeout(Duration matchTimeout) {
            if (matchTimeout == null || matchTimeout.isNegative() || matchTimeout.isZero()) {
                throw new IllegalArgumentException("Match timeout must be positive, got " + matchTimeout);
            }
            this.matchTimeout = matchTimeout;
            return this;
        }

        public MatcherConfiguration build() {
            return new MatcherConfiguration(cacheCapacity <= 0 ? Constants.DEFAULT_CACHE_CAPACITY : cacheCapacity,
                    matchTimeout);
        }
    }
}
