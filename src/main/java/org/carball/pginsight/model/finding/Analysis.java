package org.carball.pginsight.model.finding;

import lombok.Data;

import java.util.ArrayList;
import java.util.List;

@Data
public class Analysis {
    private List<Finding> recommendations = new ArrayList<>();
    private List<Finding> warnings = new ArrayList<>();
    private List<Finding> infos = new ArrayList<>();

    public void add(Finding finding) {
        switch (finding.getSeverity()) {
            case RECOMMENDATION -> recommendations.add(finding);
            case WARNING -> warnings.add(finding);
            default -> infos.add(finding);
        }
    }

    public int size() {
        return recommendations.size() + warnings.size() + infos.size();
    }
}
