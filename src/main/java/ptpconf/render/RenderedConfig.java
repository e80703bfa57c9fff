package ptpconf.render;

import lombok.Value;

import java.util.List;

@Value
public class RenderedConfig {
    String text;
    List<String> mapping;
    List<Iface> ifaces;

    public RenderedConfig(String text, List<String> mapping, List<Iface> ifaces) {
        this.text = text;
        this.mapping = List.copyOf(mapping);
        this.ifaces = List.copyOf(ifaces);
    }
}
