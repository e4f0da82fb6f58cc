package software.amazon.policy.ruler.attribute;

import java.time.Clock;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;

/**
 * The time of the request in UTC, as an RFC3339 timestamp with second precision, e.g. "2024-01-10T00:00:00Z".
 */
public class CurrentTimeParser implements AttributeParser {

    private final Clock clock;

    public CurrentTimeParser() {
        this(Clock.systemUTC());
    }

    public CurrentTimeParser(final Clock clock) {
        this.clock = clock;
    }

    @Override
    public Object parse(final RequestAttributes request) {
        return DateTimeFormatter.ISO_OFFSET_DATE_TIME.format(
                clock.instant().truncatedTo(ChronoUnit.SECONDS).atOffset(ZoneOffset.UTC));
    }
}
