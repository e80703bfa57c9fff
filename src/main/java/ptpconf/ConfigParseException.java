package ptpconf;

import lombok.Getter;

@Getter
public class ConfigParseException extends RuntimeException {

    public enum Reason {
        MALFORMED_SECTION,
        OPTION_OUTSIDE_SECTION
    }

    private final Reason reason;
    private final String line;

    public ConfigParseException(Reason reason, String line) {
        super(describe(reason) + line);
        this.reason = reason;
        this.line = line;
    }

    private static String describe(Reason reason) {
        switch (reason) {
            case MALFORMED_SECTION:
                return "Section missing closing ']': ";
            case OPTION_OUTSIDE_SECTION:
                return "Config option not in section: ";
            default:
                throw new IllegalArgumentException("Unknown reason " + reason);
        }
    }
}
