package ptpconf;

import org.apache.commons.lang3.StringUtils;

import java.util.Optional;
import java.util.Set;

public final class EventSources {

    private static final Set<String> TRUE_VALUES = Set.of("1", "t", "T", "TRUE", "true", "True");
    private static final Set<String> FALSE_VALUES = Set.of("0", "f", "F", "FALSE", "false", "False");

    private EventSources() {
    }

    public static EventSource resolveSource(String flag) {
        return parseBoolean(flag).orElse(false) ? EventSource.GNSS : EventSource.PPS;
    }

    public static boolean parseFlag(String flag) {
        return parseBoolean(flag).orElse(false);
    }

    static Optional<Boolean> parseBoolean(String value) {
        String v = StringUtils.trimToEmpty(value);
        if (TRUE_VALUES.contains(v)) {
            return Optional.of(Boolean.TRUE);
        }
        if (FALSE_VALUES.contains(v)) {
            return Optional.of(Boolean.FALSE);
        }
        return Optional.empty();
    }
}
