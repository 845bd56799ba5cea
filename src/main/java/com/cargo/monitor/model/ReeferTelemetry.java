package com.cargo.monitor.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
@Schema(description = "Latest refrigerated container reading")
public class ReeferTelemetry {

    @Schema(description = "Reefer container number", example = "MSCU1234567")
    String containerId;

    @Schema(description = "Measured cargo temperature", example = "-12.5")
    double temperatureCelsius;

    @Schema(description = "Configured setpoint", example = "-18.0")
    double setpointCelsius;

    public double deviationCelsius() {
        return Math.abs(temperatureCelsius - setpointCelsius);
    }
}
