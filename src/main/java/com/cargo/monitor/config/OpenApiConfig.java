package com.cargo.monitor.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI exceptionMonitorOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Shipment Exception Monitor API")
                        .version("1.0.0")
                        .description(
                                "Background monitor that detects operational exceptions on in-flight shipments.\n\n" +
                                "**Cycle:**\n" +
                                "1. Snapshot all active shipments at a single instant\n" +
                                "2. Evaluate the five exception rules against every shipment\n" +
                                "3. Deduplicate by (shipment, type) and sort by severity\n" +
                                "4. Dispatch each finding to the exception handler via `message:send`\n" +
                                "5. Append one run record to the history\n\n" +
                                "**Rules:**\n" +
                                "- `delay`: ETA slipped more than 24h (high above 48h)\n" +
                                "- `ml_prediction`: delay confidence above 0.70 (high above 0.85)\n" +
                                "- `temperature_deviation`: reefer off setpoint by more than 5°C (high above 10°C)\n" +
                                "- `geofence_violation`: position outside the route corridor (always high)\n" +
                                "- `missing_milestone`: no milestone for more than 72h (low)")
                        .contact(new Contact().name("Logistics Operations Team")));
    }
}
