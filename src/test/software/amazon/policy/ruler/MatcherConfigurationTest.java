package software.amazon.policy.ruler;

import org.junit.Test;

import java.time.Duration;

import static org.junit.Assert.assertEquals;

public class MatcherConfigurationTest {

    @Test
    public void testDefaults() {
        MatcherConfiguration configuration = MatcherConfiguration.defaults();
        assertEquals(512, configuration.getCacheCapacity());
        assertEquals(Duration.ofMillis(250), configuration.getMatchTimeout());
    }

    @Test
    public void testCustomValues() {
        MatcherConfiguration configuration = new MatcherConfiguration.Builder()
                .withCacheCapacity(16)
                .withMatchTimeout(Duration.ofSeconds(1))
                .build();
        assertEquals(16, configuration.getCacheCapacity());
        assertEquals(Duration.ofSeconds(1), configuration.getMatchTimeout());
    }

    @Test
    public void testNonPositiveCapacityFallsBackToDefault() {
        assertEquals(512, new MatcherConfiguration.Builder().withCacheCapacity(0).build().getCacheCapacity());
        assertEquals(512, new MatcherConfiguration.Builder().withCacheCapacity(-3).build().getCacheCapacity());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testZeroTimeoutIsRejected() {
        new MatcherConfiguration.Builder().withMatchTimeout(Duration.ZERO);
    }

    @Test
    public void testMatcherUsesConfiguredTimeout() {
        PatternMatcher matcher = new PatternMatcher(new MatcherConfiguration.Builder()
                .withMatchTimeout(Duration.ofMillis(100))
                .build());
        assertEquals(Duration.ofMillis(100), matcher.compile("a*").timeout());
        assertEquals(Duration.ofMillis(100), matcher.getConfiguration().getMatchTimeout());
        assertEquals(512, matcher.getConfiguration().getCacheCapacity());
    }
}
