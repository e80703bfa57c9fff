package ptpconf.synce;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

class SettingsClockIdAssignerTest {

    private final SettingsClockIdAssigner assigner = new SettingsClockIdAssigner();

    @Test
    void assignClockIds_usesFirstPort() {
        var relations = new SynceRelations();
        relations.addDeviceConfig(SynceDeviceConfig.builder().name("synce1").ifaces(List.of("ens4f0", "ens4f1")).build());
        relations.addDeviceConfig(SynceDeviceConfig.builder().name("synce2").ifaces(List.of("ens5f0")).build());
        relations.addDeviceConfig(SynceDeviceConfig.builder().name("synce3").build());

        assigner.assignClockIds(relations, Map.of(
                "clockId[ens4f0]", " 5799633565432596414 ",
                "clockId[ens4f1]", "1"));

        assertEquals("5799633565432596414", relations.get(0).getClockId());
        assertNull(relations.get(1).getClockId());
        assertNull(relations.get(2).getClockId());
    }

    @Test
    void assignClockIds_fallsBackToLaterPort() {
        var relations = new SynceRelations();
        relations.addDeviceConfig(SynceDeviceConfig.builder().name("synce1").ifaces(List.of("ens4f0", "ens4f1")).build());

        assigner.assignClockIds(relations, Map.of("clockId[ens4f1]", "42"));

        assertEquals("42", relations.get(0).getClockId());
    }

    @Test
    void assignClockIds_withoutSettings() {
        var relations = new SynceRelations();
        relations.addDeviceConfig(SynceDeviceConfig.builder().name("synce1").ifaces(List.of("ens4f0")).clockId("7").build());

        assigner.assignClockIds(relations, null);

        assertEquals("7", relations.get(0).getClockId());
    }
}
