package ptpconf.settings;

import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Loads {@link DaemonSettings} from YAML:
 * <pre>
 * profileName: grandmaster
 * defaultConfigPath: /etc/ptp4l.conf
 * settings:
 *   clockId[ens1f0]: "5799633565432596414"
 * </pre>
 * Absent keys keep their defaults.
 */
public class DaemonSettingsLoader {

    private static final String PROFILE_NAME = "profileName";
    private static final String DEFAULT_CONFIG_PATH = "defaultConfigPath";
    private static final String SETTINGS = "settings";

    private final Yaml yaml = new Yaml();

    public DaemonSettings load(Path path) {
        try {
            return load(Files.readString(path, StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new ConfigLoadException("Failed to read " + path + ": " + e.getMessage(), e);
        }
    }

    public DaemonSettings load(String data) {
        DaemonSettings result = DaemonSettings.builder().build();
        if (data == null || data.isBlank()) {
            return result;
        }

        Object root;
        try {
            root = yaml.load(data);
        } catch (YAMLException e) {
            throw new ConfigLoadException("Invalid daemon settings: " + e.getMessage(), e);
        }
        if (root == null) {
            return result;
        }
        if (!(root instanceof Map)) {
            throw new ConfigLoadException("Daemon settings must be a mapping, got " + root.getClass().getSimpleName());
        }

        Map<?, ?> map = (Map<?, ?>) root;
        if (map.get(PROFILE_NAME) != null) {
            result.setProfileName(map.get(PROFILE_NAME).toString());
        }
        if (map.get(DEFAULT_CONFIG_PATH) != null) {
            result.setDefaultConfigPath(map.get(DEFAULT_CONFIG_PATH).toString());
        }
        result.setSettings(toSettings(map.get(SETTINGS)));
        return result;
    }

    private static Map<String, String> toSettings(Object raw) {
        Map<String, String> settings = new LinkedHashMap<>();
        if (raw == null) {
            return settings;
        }
        if (!(raw instanceof Map)) {
            throw new ConfigLoadException("`" + SETTINGS + "` must be a mapping");
        }
        for (Map.Entry<?, ?> entry : ((Map<?, ?>) raw).entrySet()) {
            String value = entry.getValue() == null ? "" : entry.getValue().toString();
            settings.put(entry.getKey().toString(), value);
        }
        return settings;
    }
}
