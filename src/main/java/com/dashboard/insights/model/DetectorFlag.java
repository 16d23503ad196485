package com.dashboard.insights.model;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * One detector's verdict for one row. Rows a detector cannot judge (missing value, zero
 * variance, incomplete window) are not applicable and never vote.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record DetectorFlag(boolean applicable, boolean flagged, Double score) {

    private static final DetectorFlag NOT_APPLICABLE = new DetectorFlag(false, false, null);

    public DetectorFlag {
        if (flagged && !applicable) {
            throw new IllegalArgumentException("A non-applicable row cannot be flagged");
        }
    }

    public static DetectorFlag notApplicable() {
        return NOT_APPLICABLE;
    }

    public static DetectorFlag of(boolean flagged, double score) {
        return new DetectorFlag(true, flagged, score);
    }
}
