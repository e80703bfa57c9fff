package ptpconf.render;

import ptpconf.Section;

import java.util.Map;
import java.util.StringJoiner;

final class ConfigWriter {

    private static final String LINE_SEPARATOR = "\n";

    private final StringJoiner out = new StringJoiner(LINE_SEPARATOR);

    ConfigWriter(String profileName) {
        out.add("#profile: " + profileName);
        out.add("");
    }

    ConfigWriter section(Section section) {
        out.add(section.getHeader());
        for (Map.Entry<String, String> option : section.getOptions().entrySet()) {
            option(option.getKey(), option.getValue());
        }
        return this;
    }

    ConfigWriter option(String key, String value) {
        out.add(key + " " + value);
        return this;
    }

    String build() {
        return out.toString();
    }
}
