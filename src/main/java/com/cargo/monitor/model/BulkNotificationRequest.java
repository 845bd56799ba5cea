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
@Schema(description = "Same notification type sent to several shipments")
public class BulkNotificationRequest {

    @Builder.Default
    private List<String> shipmentIds = new ArrayList<>();

    @Schema(example = "in_transit")
    private String notificationType;

    @Schema(example = "en")
    @Builder.Default
    private String language = "en";
}
