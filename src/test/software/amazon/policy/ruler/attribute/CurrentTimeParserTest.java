package software.amazon.policy.ruler.attribute;

import org.junit.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;

import static org.junit.Assert.assertEquals;

public class CurrentTimeParserTest {

    @Test
    public void testSecondPrecisionUtc() {
        Clock clock = Clock.fixed(Instant.parse("2024-01-10T08:15:30.987654Z"), ZoneId.of("Asia/Shanghai"));
        assertEquals("2024-01-10T08:15:30Z", new CurrentTimeParser(clock).parse(new StubRequest("10.0.0.1:80")));
    }

    @Test
    public void testWholeSecondsHaveNoFraction() {
        Clock clock = Clock.fixed(Instant.parse("2024-01-10T00:00:00Z"), ZoneId.of("UTC"));
        assertEquals("2024-01-10T00:00:00Z", new CurrentTimeParser(clock).parse(new StubRequest("10.0.0.1:80")));
    }
}
