package ptpconf.synce;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

@Builder
@AllArgsConstructor
@NoArgsConstructor
@Data
public class SynceDeviceConfig {

    public static final int NETWORK_OPTION_1 = 1;
    public static final int NETWORK_OPTION_2 = 2;
    public static final int EXTENDED_TLV_DISABLED = 0;
    public static final int EXTENDED_TLV_ENABLED = 1;

    private String name;
    @Builder.Default
    private List<String> ifaces = new ArrayList<>();
    private String clockId;
    @Builder.Default
    private int networkOption = NETWORK_OPTION_1;
    @Builder.Default
    private int extendedTlv = EXTENDED_TLV_DISABLED;
    private String externalSource;
    @Builder.Default
    private Map<String, QualityLevelInfo> lastQlState = new HashMap<>();
    private String lastClockState;
}
