package ptpconf.synce;

import java.util.Map;

public interface ClockIdAssigner {

    void assignClockIds(SynceRelations relations, Map<String, String> settings);
}
