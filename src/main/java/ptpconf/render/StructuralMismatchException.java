package ptpconf.render;

import lombok.Getter;

@Getter
public class StructuralMismatchException extends RuntimeException {

    private final long deviceSections;
    private final int devices;

    public StructuralMismatchException(long deviceSections, int devices) {
        super("Found " + deviceSections + " device sections but extracted " + devices + " SyncE devices");
        this.deviceSections = deviceSections;
        this.devices = devices;
    }
}
