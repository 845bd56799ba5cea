package com.cargo.monitor.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "On-demand delay warning check for one shipment")
public class ProactiveWarningRequest {

    @Schema(example = "SHP-2024-001")
    private String shipmentId;

    @Schema(example = "ops@example.com")
    private String recipientEmail;

    @Schema(example = "+15550100")
    private String recipientPhone;

    @Schema(example = "en")
    @Builder.Default
    private String language = "en";

    @Schema(description = "Pre-computed prediction. When absent the configured classifier is asked.")
    private DelayPrediction prediction;
}
