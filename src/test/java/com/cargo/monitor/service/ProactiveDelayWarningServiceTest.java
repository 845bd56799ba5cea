package com.cargo.monitor.service;

import com.cargo.monitor.engine.rules.MlConfidenceRule;
import com.cargo.monitor.ml.DelayClassifier;
import com.cargo.monitor.model.DelayPrediction;
import com.cargo.monitor.model.ProactiveWarningRequest;
import com.cargo.monitor.model.ProactiveWarningResult;
import com.cargo.monitor.model.StatusUpdateRequest;
import com.cargo.monitor.notification.CustomerNotificationService;
import com.cargo.monitor.notification.NotificationIdGenerator;
import com.cargo.monitor.notification.NotificationTemplateService;
import com.cargo.monitor.notification.NotificationTransport;
import com.cargo.monitor.notification.TransportResult;
import com.cargo.monitor.testutil.TestDataFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anySet;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ProactiveDelayWarningServiceTest {

    @Mock
    private DelayClassifier classifier;

    @Mock
    private CustomerNotificationService notificationService;

    @Mock
    private NotificationTransport transport;

    private MlConfidenceRule rule;
    private ProactiveDelayWarningService service;

    @BeforeEach
    void setUp() {
        rule = new MlConfidenceRule(TestDataFactory.defaultConfig());
        service = new ProactiveDelayWarningService(classifier, rule, notificationService);
    }

    private ProactiveDelayWarningService withRealNotifications() {
        Clock clock = Clock.fixed(TestDataFactory.NOW, ZoneOffset.UTC);
        CustomerNotificationService realNotifications = new CustomerNotificationService(
                transport, new NotificationTemplateService(), new NotificationIdGenerator(clock), clock);
        return new ProactiveDelayWarningService(classifier, rule, realNotifications);
    }

    private ProactiveWarningRequest request(DelayPrediction prediction) {
        return ProactiveWarningRequest.builder()
                .shipmentId("SHP-001")
                .recipientEmail("customer@example.com")
                .prediction(prediction)
                .build();
    }

    private DelayPrediction prediction(double confidence) {
        return DelayPrediction.builder()
                .willDelay(true)
                .confidence(confidence)
                .riskFactors(List.of("port_congestion", "weather"))
                .predictedDelayHours(36.0)
                .build();
    }

    @Test
    void warn_atThreshold_noWarning() {
        ProactiveWarningResult result = service.warn(request(prediction(0.70)));

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.isWarningSent()).isFalse();
        assertThat(result.getThreshold()).isEqualTo(0.70);
        assertThat(result.getReason()).isEqualTo("Confidence 70.0% not above threshold 70%");
        verifyNoInteractions(notificationService);
    }

    @Test
    void warn_aboveThreshold_sendsDelayedNotification() {
        when(notificationService.sendStatusUpdate(any()))
                .thenReturn(TestDataFactory.createNotificationRecord("NOTIF-20240315-12345678", "SHP-001", "delayed"));
        ArgumentCaptor<StatusUpdateRequest> captor = ArgumentCaptor.forClass(StatusUpdateRequest.class);

        ProactiveWarningResult result = service.warn(request(prediction(0.82)));

        assertThat(result.isWarningSent()).isTrue();
        assertThat(result.getNotificationId()).isEqualTo("NOTIF-20240315-12345678");
        assertThat(result.getRiskFactors()).containsExactly("port_congestion", "weather");

        verify(notificationService).sendStatusUpdate(captor.capture());
        StatusUpdateRequest sent = captor.getValue();
        assertThat(sent.getNotificationType()).isEqualTo("delayed");
        assertThat(sent.getAdditionalData())
                .containsEntry("ml_confidence", "82.0%")
                .containsEntry("risk_factors", "port_congestion, weather")
                .containsEntry("predicted_delay", "36 hours");
    }

    @Test
    void warn_noPredictionAnywhere_reportsMissingData() {
        when(classifier.predict("SHP-001")).thenReturn(Optional.empty());

        ProactiveWarningResult result = service.warn(request(null));

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.isWarningSent()).isFalse();
        assertThat(result.getReason()).isEqualTo("No ML prediction data available");
    }

    @Test
    void warn_usesClassifierWhenRequestHasNoPrediction() {
        when(classifier.predict("SHP-001")).thenReturn(Optional.of(DelayPrediction.builder()
                .willDelay(true).confidence(0.91).predictedDelayHours(0).build()));
        when(notificationService.sendStatusUpdate(any()))
                .thenReturn(TestDataFactory.createNotificationRecord("NOTIF-1", "SHP-001", "delayed"));
        ArgumentCaptor<StatusUpdateRequest> captor = ArgumentCaptor.forClass(StatusUpdateRequest.class);

        ProactiveWarningResult result = service.warn(request(null));

        assertThat(result.isWarningSent()).isTrue();
        verify(notificationService).sendStatusUpdate(captor.capture());
        assertThat(captor.getValue().getAdditionalData())
                .containsEntry("risk_factors", "Multiple factors")
                .containsEntry("predicted_delay", "significant delay");
    }

    @Test
    void warn_classifierSaysOnTime_noWarning() {
        DelayPrediction onTime = DelayPrediction.builder().willDelay(false).confidence(0.95).build();

        ProactiveWarningResult result = service.warn(request(onTime));

        assertThat(result.isWarningSent()).isFalse();
        verifyNoInteractions(notificationService);
    }

    @Test
    void warn_sendFails_reportedAsError() {
        when(notificationService.sendStatusUpdate(any())).thenThrow(new IllegalStateException("smtp down"));

        ProactiveWarningResult result = service.warn(request(prediction(0.9)));

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getError()).isEqualTo("smtp down");
    }

    @Test
    void warn_blankShipment_rejected() {
        assertThatThrownBy(() -> service.warn(ProactiveWarningRequest.builder().shipmentId("").build()))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void warn_transportFails_notReportedAsSent() {
        when(transport.send(anySet(), any(), any(), anyString(), anyMap()))
                .thenReturn(new TransportResult(false, "ignored"));

        ProactiveWarningResult result = withRealNotifications().warn(request(prediction(0.82)));

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.isWarningSent()).isFalse();
        assertThat(result.getMlConfidence()).isEqualTo(0.82);
        assertThat(result.getThreshold()).isEqualTo(0.70);
        assertThat(result.getReason()).isEqualTo("Notification transport did not deliver the warning");
        assertThat(result.getNotificationId()).matches("NOTIF-20240315-[0-9a-f]{8}");
    }

    @Test
    void warn_noRecipient_notReportedAsSent() {
        ProactiveWarningRequest noRecipient = ProactiveWarningRequest.builder()
                .shipmentId("SHP-001")
                .prediction(prediction(0.82))
                .build();

        ProactiveWarningResult result = withRealNotifications().warn(noRecipient);

        assertThat(result.isWarningSent()).isFalse();
        assertThat(result.getReason()).isEqualTo("No recipient email or phone provided");
        verifyNoInteractions(transport);
    }

    @Test
    void warn_transportDelivers_reportedAsSent() {
        when(transport.send(anySet(), any(), any(), anyString(), anyMap()))
                .thenReturn(new TransportResult(true, "ignored"));

        ProactiveWarningResult result = withRealNotifications().warn(request(prediction(0.82)));

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.isWarningSent()).isTrue();
    }
}
