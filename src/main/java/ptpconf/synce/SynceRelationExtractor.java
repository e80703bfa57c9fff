package ptpconf.synce;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ptpconf.PtpConfig;
import ptpconf.Section;

import java.util.ArrayList;
import java.util.List;

public class SynceRelationExtractor {

    private static final Logger log = LoggerFactory.getLogger(SynceRelationExtractor.class);

    static final String NETWORK_OPTION = "network_option";
    static final String EXTENDED_TLV = "extended_tlv";

    public SynceRelations extractRelations(PtpConfig config) {
        SynceRelations relations = new SynceRelations();
        DeviceAccumulator acc = DeviceAccumulator.none();
        for (Section section : config.getSections()) {
            acc = step(relations, acc, section);
        }
        acc.flushInto(relations);
        return relations;
    }

    private static DeviceAccumulator step(SynceRelations relations, DeviceAccumulator acc, Section section) {
        switch (section.getKind()) {
            case DEVICE:
                acc.flushInto(relations);
                return DeviceAccumulator.open(section);
            case EXTERNAL_SOURCE:
                acc.setExternalSource(section.getName());
                return acc;
            case PLAIN:
            default:
                if (!section.isGlobal()) {
                    acc.addIface(section.getName());
                }
                return acc;
        }
    }

    private static int intOption(Section section, String key, int defaultValue) {
        String raw = section.option(key);
        if (raw == null) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            log.warn("Error parsing `{}` of {}, setting {} to default {}: {}",
                    key, section.getHeader(), key, defaultValue, e.getMessage());
            return defaultValue;
        }
    }

    private static final class DeviceAccumulator {
        private final SynceDeviceConfig device;
        private final List<String> ifaces = new ArrayList<>();

        private DeviceAccumulator(SynceDeviceConfig device) {
            this.device = device;
        }

        static DeviceAccumulator none() {
            return new DeviceAccumulator(null);
        }

        static DeviceAccumulator open(Section section) {
            SynceDeviceConfig device = SynceDeviceConfig.builder()
                    .name(section.getName())
                    .clockId("")
                    .externalSource("")
                    .lastClockState("")
                    .networkOption(intOption(section, NETWORK_OPTION, SynceDeviceConfig.NETWORK_OPTION_1))
                    .extendedTlv(intOption(section, EXTENDED_TLV, SynceDeviceConfig.EXTENDED_TLV_DISABLED))
                    .build();
            return new DeviceAccumulator(device);
        }

        void addIface(String iface) {
            if (device == null) {
                log.debug("Port {} precedes any device section, skipped", iface);
                return;
            }
            ifaces.add(iface);
        }

        void setExternalSource(String source) {
            if (device == null) {
                log.debug("External source {} precedes any device section, skipped", source);
                return;
            }
            device.setExternalSource(source);
        }

        void flushInto(SynceRelations relations) {
            if (device == null || device.getName().isEmpty()) {
                return;
            }
            device.setIfaces(new ArrayList<>(ifaces));
            relations.addDeviceConfig(device);
        }
    }
}
