package org.iceforge.olap.api;

import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;

import java.util.List;

public class GroupingSetsRequest extends SubtotalRequest {

    /**
     * Explicit subsets of {@link #getDimensions()}, e.g. [["region","product"],["region"],[]].
     */
    @NotEmpty
    private List<@NotNull List<String>> groupingSets;

    public List<List<String>> getGroupingSets() {
        return groupingSets;
    }

    public void setGroupingSets(List<List<String>> groupingSets) {
        this.groupingSets = groupingSets;
    }
}
