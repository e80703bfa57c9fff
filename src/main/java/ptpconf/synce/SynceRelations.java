package ptpconf.synce;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

public class SynceRelations {

    private final List<SynceDeviceConfig> devices = new ArrayList<>();

    public void addDeviceConfig(SynceDeviceConfig config) {
        devices.add(config);
    }

    public List<SynceDeviceConfig> getDevices() {
        return Collections.unmodifiableList(devices);
    }

    public int size() {
        return devices.size();
    }

    public SynceDeviceConfig get(int index) {
        return devices.get(index);
    }

    public Optional<SynceDeviceConfig> findByName(String name) {
        return devices.stream()
                .filter(x -> x.getName().equals(name))
                .findFirst();
    }

    public Optional<SynceDeviceConfig> findByIface(String iface) {
        return devices.stream()
                .filter(x -> x.getIfaces().contains(iface))
                .findFirst();
    }
}
