package com.dashboard.insights.model;

import java.util.List;

/**
 * Flags produced by a single detector run, one per dataset row.
 *
 * @param bounds IQR bounds for explainability, null for other detectors
 */
public record DetectorOutput(DetectorId id, List<DetectorFlag> flags, IqrBounds bounds) {

    public DetectorOutput {
        flags = List.copyOf(flags);
    }

    public DetectorOutput(DetectorId id, List<DetectorFlag> flags) {
        this(id, flags, null);
    }

    public long flaggedCount() {
        return flags.stream().filter(DetectorFlag::flagged).count();
    }
}
