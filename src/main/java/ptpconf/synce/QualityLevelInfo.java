package ptpconf.synce;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Builder
@AllArgsConstructor
@NoArgsConstructor
@Data
public class QualityLevelInfo {
    private int ssm;
    private int extendedSsm;
    private int priority;
}
