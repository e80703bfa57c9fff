package ptpconf.render;

import org.junit.jupiter.api.Test;
import ptpconf.PtpConfigParser;
import ptpconf.synce.SynceRelationExtractor;

import java.nio.file.Files;
import java.nio.file.Paths;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SynceConfigRendererTest {

    private static final String SYNCE4L = "src/test/resources/ptp_conf/synce/synce4l.conf";
    private static final String EXPECTED_SYNCE4L = "src/test/resources/ptp_conf/synce/expected_synce4l.conf";

    private static final Map<String, String> SETTINGS = Map.of(
            "clockId[ens4f0]", "5799633565432596414",
            "clockId[ens5f0]", "999");

    private final PtpConfigParser parser = new PtpConfigParser();
    private final SynceConfigRenderer renderer = new SynceConfigRenderer();

    @Test
    void renderSynce_injectsClockIds() throws Exception {
        var config = parser.parse("synce", Files.readString(Paths.get(SYNCE4L)));

        var actual = renderer.renderSynce(config, SETTINGS);

        var expected = Files.readString(Paths.get(EXPECTED_SYNCE4L));
        assertEquals(expected, actual.getText());
    }

    @Test
    void renderSynce_keepsExistingClockId() throws Exception {
        var config = parser.parse("synce", Files.readString(Paths.get(SYNCE4L)));

        var relations = renderer.renderSynce(config, SETTINGS).getRelations();

        assertEquals(2, relations.size());
        assertEquals("5799633565432596414", relations.get(0).getClockId());
        assertEquals("1122334455", relations.get(1).getClockId());
        assertFalse(renderer.renderSynce(config, SETTINGS).getText().contains("clock_id 999"));
    }

    @Test
    void renderSynce_doesNotModifyDocument() throws Exception {
        var config = parser.parse("synce", Files.readString(Paths.get(SYNCE4L)));

        renderer.renderSynce(config, SETTINGS);

        assertFalse(config.getSections().get(1).hasOption("clock_id"));
    }

    @Test
    void renderSynce_usesGivenAssigner() {
        var config = parser.parse("[<dev1>]\n[eth0]\n[<dev2>]\n[eth1]");
        var custom = new SynceConfigRenderer(new SynceRelationExtractor(),
                (relations, settings) -> relations.getDevices()
                        .forEach(x -> x.setClockId(settings.get("prefix") + x.getName())));

        var actual = custom.renderSynce(config, Map.of("prefix", "id-"));

        assertEquals("#profile: \n\n[<dev1>]\nclock_id id-dev1\n[eth0]\n[<dev2>]\nclock_id id-dev2\n[eth1]\n[global]",
                actual.getText());
    }

    @Test
    void renderSynce_skipsUnassignedClockId() {
        var config = parser.parse("[global]\n[<dev1>]\n[eth0]");

        var actual = renderer.renderSynce(config, Map.of());

        assertFalse(actual.getText().contains("clock_id"));
        assertEquals("", actual.getRelations().get(0).getClockId());
    }

    @Test
    void renderSynce_noDevices() {
        var config = parser.parse("[global]\nlogging_level 7\n[ens1f0]");

        var actual = renderer.renderSynce(config, SETTINGS);

        assertEquals("#profile: \n\n[global]\nlogging_level 7\n[ens1f0]", actual.getText());
        assertTrue(actual.getRelations().getDevices().isEmpty());
    }

    @Test
    void renderSynce_failsWhenDevicesDoNotLineUp() {
        var config = parser.parse("[global]\n[<>]\n[eth0]");

        var ex = assertThrows(StructuralMismatchException.class, () -> renderer.renderSynce(config, SETTINGS));
        assertEquals(1, ex.getDeviceSections());
        assertEquals(0, ex.getDevices());
    }
}
