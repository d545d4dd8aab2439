package analysis.check;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Raw findings for one entry point, before merging
 */
public final class CheckInfo {

    private final List<UafInfo> uafInfos;
    private final List<DfInfo> dfInfos;

    public CheckInfo(List<UafInfo> uafInfos, List<DfInfo> dfInfos) {
        this.uafInfos = Collections.unmodifiableList(new ArrayList<>(uafInfos));
        this.dfInfos = Collections.unmodifiableList(new ArrayList<>(dfInfos));
    }

    public List<UafInfo> getUafInfos() {
        return uafInfos;
    }

    public List<DfInfo> getDfInfos() {
        return dfInfos;
    }

    public boolean isEmpty() {
        return uafInfos.isEmpty() && dfInfos.isEmpty();
    }
}
