package ptpconf.render;

import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ptpconf.PtpConfig;
import ptpconf.Section;
import ptpconf.SectionKind;
import ptpconf.synce.ClockIdAssigner;
import ptpconf.synce.SettingsClockIdAssigner;
import ptpconf.synce.SynceDeviceConfig;
import ptpconf.synce.SynceRelationExtractor;
import ptpconf.synce.SynceRelations;

import java.util.Map;

public class SynceConfigRenderer {

    private static final Logger log = LoggerFactory.getLogger(SynceConfigRenderer.class);

    static final String CLOCK_ID = "clock_id";

    private final SynceRelationExtractor extractor;
    private final ClockIdAssigner clockIdAssigner;

    public SynceConfigRenderer() {
        this(new SynceRelationExtractor(), new SettingsClockIdAssigner());
    }

    public SynceConfigRenderer(SynceRelationExtractor extractor, ClockIdAssigner clockIdAssigner) {
        this.extractor = extractor;
        this.clockIdAssigner = clockIdAssigner;
    }

    public RenderedSynceConfig renderSynce(PtpConfig config, Map<String, String> settings) {
        SynceRelations relations = extractor.extractRelations(config);
        clockIdAssigner.assignClockIds(relations, settings);

        long deviceSections = config.countOf(SectionKind.DEVICE);
        if (deviceSections != relations.size()) {
            throw new StructuralMismatchException(deviceSections, relations.size());
        }

        ConfigWriter writer = new ConfigWriter(config.getProfileName());
        // n-th device section pairs with the n-th extracted device
        int deviceIdx = 0;
        for (Section section : config.getSections()) {
            writer.section(section);
            if (section.getKind() == SectionKind.DEVICE) {
                applyClockId(writer, section, relations.get(deviceIdx++));
            }
        }
        return new RenderedSynceConfig(writer.build(), relations);
    }

    private static void applyClockId(ConfigWriter writer, Section section, SynceDeviceConfig device) {
        if (section.hasOption(CLOCK_ID)) {
            device.setClockId(section.option(CLOCK_ID).trim());
            return;
        }
        if (StringUtils.isBlank(device.getClockId())) {
            log.warn("No clock id assigned to SyncE device {}, {} left unset", device.getName(), CLOCK_ID);
            return;
        }
        writer.option(CLOCK_ID, device.getClockId());
    }
}
