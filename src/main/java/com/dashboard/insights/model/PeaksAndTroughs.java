package com.dashboard.insights.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
@Schema(description = "Prominent local maxima and minima of the raw series")
public class PeaksAndTroughs {

    @Schema(description = "Minimum prominence used", example = "4000.0")
    double minProminence;

    List<Extremum> peaks;

    List<Extremum> troughs;

    public int getPeakCount() { return peaks.size(); }

    public int getTroughCount() { return troughs.size(); }
}
