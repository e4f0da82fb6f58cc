package software.amazon.policy.ruler;

import javax.annotation.concurrent.Immutable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The body of one operator block: attribute names mapped to the ordered list of values acceptable for them, e.g.
 * {"acs:SourceIp": ["10.0.0.1", "192.168.1.0/24"]}.
 */
@Immutable
public final class ConditionValue {

    private final Map<String, List<String>> values;

    public ConditionValue(final Map<String, List<String>> values) {
        final Map<String, List<String>> copy = new LinkedHashMap<>();
        for (Map.Entry<String, List<String>> entry : values.entrySet()) {
            copy.put(entry.getKey(), Collections.unmodifiableList(new ArrayList<>(entry.getValue())));
        }
        this.values = Collections.unmodifiableMap(copy);
    }

    public Map<String, List<String>> asMap() {
        return values;
    }

    @Override
    public boolean equals(final Object o) {
        return this == o || (o instanceof ConditionValue && values.equals(((ConditionValue) o).values));
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return values.toString();
    }
}
