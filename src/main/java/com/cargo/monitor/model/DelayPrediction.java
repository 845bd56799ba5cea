package com.cargo.monitor.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Classifier output for a single shipment")
public class DelayPrediction {

    @Schema(example = "true")
    private boolean willDelay;

    @Schema(description = "Probability of delay in [0,1]", example = "0.82")
    private double confidence;

    @Schema(description = "Feature attributions, most influential first")
    @Builder.Default
    private List<String> riskFactors = new ArrayList<>();

    @Schema(example = "36")
    private double predictedDelayHours;
}
