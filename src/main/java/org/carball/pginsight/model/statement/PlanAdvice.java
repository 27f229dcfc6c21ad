package org.carball.pginsight.model.statement;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * Structured reading of one EXPLAIN plan: raw text, flagged highlights and suggestions.
 */
@Data
public class PlanAdvice {
    private String plan = "";
    private List<String> highlights = new ArrayList<>();
    private List<String> suggestions = new ArrayList<>();
    private boolean canBeIndexed;
    private boolean canBeRefactored;

    public void addHighlight(String highlight) {
        highlights.add(highlight);
    }

    public void addSuggestion(String suggestion) {
        suggestions.add(suggestion);
    }

    @JsonIgnore
    public boolean isEmpty() {
        return (plan == null || plan.isEmpty()) && highlights.isEmpty() && suggestions.isEmpty();
    }
}
