package ptpconf.settings;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

@Builder
@AllArgsConstructor
@NoArgsConstructor
@Data
public class DaemonSettings {

    public static final String DEFAULT_PROFILE_NAME = "default";
    public static final String DEFAULT_CONFIG_PATH = "/etc/ptp4l.conf";

    @Builder.Default
    private String profileName = DEFAULT_PROFILE_NAME;
    @Builder.Default
    private String defaultConfigPath = DEFAULT_CONFIG_PATH;
    @Builder.Default
    private Map<String, String> settings = new LinkedHashMap<>();
}
