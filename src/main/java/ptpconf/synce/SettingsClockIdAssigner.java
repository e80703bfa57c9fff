package ptpconf.synce;

import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

public class SettingsClockIdAssigner implements ClockIdAssigner {

    private static final Logger log = LoggerFactory.getLogger(SettingsClockIdAssigner.class);

    static String settingKey(String iface) {
        return "clockId[" + iface + "]";
    }

    @Override
    public void assignClockIds(SynceRelations relations, Map<String, String> settings) {
        if (settings == null || settings.isEmpty()) {
            return;
        }
        for (SynceDeviceConfig device : relations.getDevices()) {
            for (String iface : device.getIfaces()) {
                String clockId = settings.get(settingKey(iface));
                if (StringUtils.isNotBlank(clockId)) {
                    device.setClockId(clockId.trim());
                    log.debug("Device {} clock id {} from {}", device.getName(), device.getClockId(), iface);
                    break;
                }
            }
        }
    }
}
