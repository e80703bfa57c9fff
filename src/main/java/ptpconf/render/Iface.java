package ptpconf.render;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import ptpconf.EventSource;

@Builder
@AllArgsConstructor
@NoArgsConstructor
@Data
public class Iface {
    private String name;
    private EventSource source;
    private boolean master;
    private String phcId;
}
