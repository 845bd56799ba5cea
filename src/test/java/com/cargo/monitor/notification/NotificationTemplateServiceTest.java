package com.cargo.monitor.notification;

import com.cargo.monitor.model.ExceptionType;
import com.cargo.monitor.model.Language;
import com.cargo.monitor.model.NotificationKind;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class NotificationTemplateServiceTest {

    private final NotificationTemplateService service = new NotificationTemplateService();

    @Test
    void everyKindAndExceptionType_hasAllLanguages() {
        for (Language language : Language.values()) {
            for (NotificationKind kind : NotificationKind.values()) {
                assertThat(service.hasTemplate(NotificationTemplateService.keyFor(kind), language))
                        .as("%s/%s", kind, language).isTrue();
            }
            for (ExceptionType type : ExceptionType.values()) {
                assertThat(service.hasTemplate(NotificationTemplateService.keyFor(type), language))
                        .as("%s/%s", type, language).isTrue();
            }
        }
    }

    @Test
    void render_substitutesPlaceholders() {
        RenderedMessage message = service.render("departed", Language.EN, Map.of(
                "shipment_id", "SHP-001",
                "origin", "Shanghai",
                "destination", "Rotterdam",
                "container", "MSCU1234567",
                "tracking_url", "https://track.cwlogistics.com/SHP-001"));

        assertThat(message.subject()).isEqualTo("Your shipment SHP-001 has departed");
        assertThat(message.body())
                .contains("departed from Shanghai")
                .contains("Rotterdam")
                .contains("Container: MSCU1234567")
                .endsWith("Best regards,\nCW Logistics Team");
    }

    @Test
    void render_unknownKey_fallsBackToInTransit() {
        RenderedMessage message = service.render("teleported", Language.EN, Map.of("shipment_id", "SHP-9"));

        assertThat(message.subject()).isEqualTo("Shipment SHP-9 is in transit");
    }

    @Test
    void render_exceptionTemplate_noCustomerSignature() {
        RenderedMessage message = service.render(NotificationTemplateService.keyFor(ExceptionType.GEOFENCE_VIOLATION),
                Language.EN, Map.of("shipment_id", "S1", "severity", "HIGH", "message", "Off route"));

        assertThat(message.subject()).isEqualTo("[HIGH] Route deviation on shipment S1");
        assertThat(message.body()).isEqualTo("Off route");
    }

    @Test
    void substitute_leavesUnknownPlaceholders() {
        assertThat(NotificationTemplateService.substitute("{a} and {b}", Map.of("a", "x")))
                .isEqualTo("x and {b}");
    }

    @Test
    void substitute_valuesAreNotExpandedAgain() {
        String rendered = NotificationTemplateService.substitute(
                "Reason: {delay_reason}\nTrack: {tracking_url}",
                Map.of("delay_reason", "see {tracking_url}", "tracking_url", "https://track.cwlogistics.com/S1"));

        assertThat(rendered).isEqualTo("Reason: see {tracking_url}\nTrack: https://track.cwlogistics.com/S1");
    }

    @Test
    void substitute_valueWithRegexCharacters_keptLiterally() {
        assertThat(NotificationTemplateService.substitute("Cost: {amount}", Map.of("amount", "$5 \\ 2")))
                .isEqualTo("Cost: $5 \\ 2");
    }

    @Test
    void render_exceptionTemplate_localisedBodyEmbedsEvidence() {
        Map<String, String> context = Map.of("shipment_id", "S1", "severity", "HIGH",
                "message", "Position outside route corridor");

        RenderedMessage spanish = service.render(
                NotificationTemplateService.keyFor(ExceptionType.GEOFENCE_VIOLATION), Language.ES, context);
        RenderedMessage chinese = service.render(
                NotificationTemplateService.keyFor(ExceptionType.GEOFENCE_VIOLATION), Language.ZH, context);

        assertThat(spanish.body()).isEqualTo(
                "El envío S1 está fuera del corredor de ruta previsto.\nDetalle técnico: Position outside route corridor");
        assertThat(chinese.body()).startsWith("货件 S1 已偏离预定航线走廊。")
                .endsWith("技术详情：Position outside route corridor");
    }
}
