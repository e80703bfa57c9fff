package ptpconf;

public enum ClockRole {
    GRAND_MASTER,
    BOUNDARY_CLOCK,
    ORDINARY_CLOCK;

    static ClockRole classify(boolean hasSlavePort, int sectionCount) {
        if (!hasSlavePort) {
            return GRAND_MASTER;
        }
        if (sectionCount > 2) {
            return BOUNDARY_CLOCK;
        }
        return ORDINARY_CLOCK;
    }
}
