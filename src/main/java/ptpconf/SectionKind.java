package ptpconf;

/**
 * Shape of a section header.
 * <ul>
 *   <li>{@code PLAIN} - {@code [eth0]}, {@code [global]}, {@code [nmea]}</li>
 *   <li>{@code DEVICE} - {@code [<synce1>]}, opens a SyncE device</li>
 *   <li>{@code EXTERNAL_SOURCE} - {@code [{gnss}]}, external frequency source of the open device</li>
 * </ul>
 */
public enum SectionKind {
    PLAIN,
    DEVICE,
    EXTERNAL_SOURCE;

    public static SectionKind of(String header) {
        if (header.startsWith("[<")) {
            return DEVICE;
        }
        if (header.startsWith("[{")) {
            return EXTERNAL_SOURCE;
        }
        return PLAIN;
    }
}
