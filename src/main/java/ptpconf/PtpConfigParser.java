package ptpconf;

import org.apache.commons.lang3.StringUtils;

import java.util.AbstractMap.SimpleEntry;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

public class PtpConfigParser {

    private static final String LINE_SEPARATOR = "\n";
    private static final String COMMENT_PREFIX = "#";
    private static final Set<String> SLAVE_OPTIONS = Set.of(
            "masterOnly 0",
            "serverOnly 0",
            "slaveOnly 1",
            "clientOnly 1");

    public PtpConfig parse(String data) {
        return parse(null, data);
    }

    public PtpConfig parse(String profileName, String data) {
        ParseContext ctx = new ParseContext();
        if (data != null) {
            for (String rawLine : data.split(LINE_SEPARATOR)) {
                processRawLine(ctx, rawLine);
            }
        }
        return ctx.toResult(profileName);
    }

    private static void processRawLine(ParseContext ctx, String rawLine) {
        String line = rawLine.trim();
        if (line.isEmpty() || line.startsWith(COMMENT_PREFIX)) {
            return;
        }
        if (line.startsWith("[")) {
            ctx.onSectionHeader(line);
            return;
        }
        ctx.onOptionLine(line);
    }

    private static final class ParseContext {
        private final List<SimpleEntry<String, Map<String, String>>> pending = new ArrayList<>();
        private String currentHeader;
        private Map<String, String> currentOptions;
        private Map<String, String> globalOptions;
        private boolean slavePortDefined;

        void onSectionHeader(String line) {
            int close = line.indexOf(']');
            if (close < 0) {
                throw new ConfigParseException(ConfigParseException.Reason.MALFORMED_SECTION, line);
            }
            currentHeader = line.substring(0, close + 1);
            boolean global = Section.GLOBAL.equals(currentHeader);
            if (global && globalOptions != null) {
                // repeated [global] continues the first one
                currentOptions = globalOptions;
                return;
            }
            currentOptions = new LinkedHashMap<>();
            pending.add(new SimpleEntry<>(currentHeader, currentOptions));
            if (global) {
                globalOptions = currentOptions;
            }
        }

        void onOptionLine(String line) {
            if (currentHeader == null) {
                throw new ConfigParseException(ConfigParseException.Reason.OPTION_OUTSIDE_SECTION, line);
            }
            int split = line.indexOf(' ');
            if (split <= 0) {
                return;
            }
            String key = line.substring(0, split);
            String value = line.substring(split + 1);
            currentOptions.put(key, value);
            if (SLAVE_OPTIONS.contains(key + " " + value)) {
                slavePortDefined = true;
            }
        }

        PtpConfig toResult(String profileName) {
            List<Section> sections = new ArrayList<>(pending.size() + 1);
            for (SimpleEntry<String, Map<String, String>> entry : pending) {
                sections.add(new Section(entry.getKey(), entry.getValue()));
            }
            if (globalOptions == null) {
                sections.add(Section.empty(Section.GLOBAL));
            }
            ClockRole role = ClockRole.classify(slavePortDefined, sections.size());
            return new PtpConfig(StringUtils.defaultString(profileName), sections, role);
        }
    }
}
