package ptpconf.render;

import lombok.Value;
import ptpconf.synce.SynceRelations;

@Value
public class RenderedSynceConfig {
    String text;
    SynceRelations relations;
}
