package ptpconf;

import lombok.Value;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Pattern;

@Value
public class Section {

    public static final String GLOBAL = "[global]";
    public static final String NMEA = "[nmea]";

    private static final Pattern DELIMITERS = Pattern.compile("[{}<>\\[\\] ]+");

    String header;
    SectionKind kind;
    String name;
    Map<String, String> options;

    public Section(String header, Map<String, String> options) {
        this.header = header;
        this.kind = SectionKind.of(header);
        this.name = stripDelimiters(header);
        this.options = Collections.unmodifiableMap(new LinkedHashMap<>(options));
    }

    public static Section empty(String header) {
        return new Section(header, Collections.emptyMap());
    }

    public boolean isGlobal() {
        return GLOBAL.equals(header);
    }

    public boolean isNmea() {
        return NMEA.equals(header);
    }

    public String option(String key) {
        return options.get(key);
    }

    public boolean hasOption(String key) {
        return options.containsKey(key);
    }

    static String stripDelimiters(String header) {
        return DELIMITERS.matcher(header).replaceAll("");
    }
}
