package com.cargo.monitor.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.HashMap;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Customer status update request")
public class StatusUpdateRequest {

    @Schema(example = "SHP-2024-001")
    private String shipmentId;

    @Schema(example = "departed")
    private String notificationType;

    private String recipientEmail;

    private String recipientPhone;

    @Schema(example = "en")
    @Builder.Default
    private String language = "en";

    private String trackingUrl;

    @Schema(description = "Extra template values such as delay_reason or exception_details")
    @Builder.Default
    private Map<String, String> additionalData = new HashMap<>();
}
