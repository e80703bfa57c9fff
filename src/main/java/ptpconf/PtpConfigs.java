package ptpconf;

import ptpconf.render.PtpConfigRenderer;
import ptpconf.render.RenderedConfig;
import ptpconf.render.RenderedSynceConfig;
import ptpconf.render.SynceConfigRenderer;
import ptpconf.settings.DaemonSettings;
import ptpconf.settings.DefaultConfigLoader;
import ptpconf.synce.SynceRelationExtractor;
import ptpconf.synce.SynceRelations;

import java.nio.file.Paths;
import java.util.Map;

public final class PtpConfigs {

    private static final PtpConfigParser PARSER = new PtpConfigParser();
    private static final PtpConfigRenderer RENDERER = new PtpConfigRenderer();
    private static final SynceConfigRenderer SYNCE_RENDERER = new SynceConfigRenderer();
    private static final SynceRelationExtractor EXTRACTOR = new SynceRelationExtractor();

    private PtpConfigs() {
    }

    public static PtpConfig parse(String text) {
        return PARSER.parse(text);
    }

    public static PtpConfig parse(String profileName, String text) {
        return PARSER.parse(profileName, text);
    }

    public static RenderedConfig render(PtpConfig config) {
        return RENDERER.render(config);
    }

    public static RenderedSynceConfig renderSynce(PtpConfig config, Map<String, String> settings) {
        return SYNCE_RENDERER.renderSynce(config, settings);
    }

    public static SynceRelations extractRelations(PtpConfig config) {
        return EXTRACTOR.extractRelations(config);
    }

    public static PtpConfig loadDefault(DaemonSettings settings) {
        String text = new DefaultConfigLoader().load(Paths.get(settings.getDefaultConfigPath()));
        return parse(settings.getProfileName(), text);
    }
}
