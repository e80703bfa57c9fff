package ptpconf;

import lombok.Value;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

@Value
public class PtpConfig {
    String profileName;
    List<Section> sections;
    ClockRole clockRole;

    public PtpConfig(String profileName, List<Section> sections, ClockRole clockRole) {
        this.profileName = profileName;
        this.sections = Collections.unmodifiableList(new ArrayList<>(sections));
        this.clockRole = clockRole;
    }

    public Section global() {
        return sections.stream()
                .filter(Section::isGlobal)
                .findFirst()
                .orElseThrow(() -> new IllegalStateException("No [global] section"));
    }

    public long countOf(SectionKind kind) {
        return sections.stream()
                .filter(x -> x.getKind() == kind)
                .count();
    }
}
