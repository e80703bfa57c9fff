package ptpconf;

public enum EventSource {
    GNSS,
    PPS
}
