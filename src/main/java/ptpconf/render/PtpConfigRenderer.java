package ptpconf.render;

import ptpconf.EventSource;
import ptpconf.EventSources;
import ptpconf.PtpConfig;
import ptpconf.Section;

import java.util.ArrayList;
import java.util.List;

public class PtpConfigRenderer {

    static final String TS2PHC_MASTER = "ts2phc.master";
    static final String MASTER_ONLY = "masterOnly";

    public RenderedConfig render(PtpConfig config) {
        ConfigWriter writer = new ConfigWriter(config.getProfileName());
        List<String> mapping = new ArrayList<>();
        List<Iface> ifaces = new ArrayList<>();
        EventSource nmeaSource = EventSource.PPS;

        for (Section section : config.getSections()) {
            writer.section(section);

            if (section.isNmea() && section.hasOption(TS2PHC_MASTER)) {
                nmeaSource = EventSources.resolveSource(section.option(TS2PHC_MASTER));
            }
            if (section.isGlobal() || section.isNmea()) {
                continue;
            }
            mapping.add(section.getName());
            ifaces.add(toIface(section, nmeaSource));
        }
        return new RenderedConfig(writer.build(), mapping, ifaces);
    }

    private static Iface toIface(Section section, EventSource nmeaSource) {
        EventSource source = section.hasOption(TS2PHC_MASTER)
                ? EventSources.resolveSource(section.option(TS2PHC_MASTER))
                : nmeaSource;
        return Iface.builder()
                .name(section.getName())
                .source(source)
                .master(EventSources.parseFlag(section.option(MASTER_ONLY)))
                .build();
    }
}
