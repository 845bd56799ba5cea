package com.cargo.monitor.service;

import com.cargo.monitor.client.ExceptionHandlerClient;
import com.cargo.monitor.client.HandleExceptionMessage;
import com.cargo.monitor.config.MetricsConfig;
import com.cargo.monitor.config.MonitorConfig;
import com.cargo.monitor.exception.DispatchTransportException;
import com.cargo.monitor.model.DispatchOutcome;
import com.cargo.monitor.model.DispatchStatus;
import com.cargo.monitor.model.ExceptionFinding;
import com.cargo.monitor.model.ExceptionType;
import com.cargo.monitor.model.Severity;
import com.cargo.monitor.notification.NotificationIdGenerator;
import com.cargo.monitor.notification.NotificationTemplateService;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static com.cargo.monitor.testutil.TestDataFactory.NOW;
import static com.cargo.monitor.testutil.TestDataFactory.createFinding;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class NotificationDispatcherTest {

    @Mock
    private ExceptionHandlerClient client;

    private NotificationDispatcher dispatcher;
    private SimpleMeterRegistry registry;
    private final Instant deadline = NOW.plus(Duration.ofMinutes(4));

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
        registry = new SimpleMeterRegistry();
        dispatcher = new NotificationDispatcher(client, new NotificationTemplateService(),
                new NotificationIdGenerator(clock), new MonitorConfig(), new MetricsConfig(registry), clock);
    }

    private ExceptionFinding delayFinding() {
        return createFinding("SHP-001", ExceptionType.DELAY, Severity.MEDIUM);
    }

    @Test
    void dispatch_accepted_sentOnFirstAttempt() {
        when(client.send(any())).thenReturn(200);

        DispatchOutcome outcome = dispatcher.dispatch(delayFinding(), deadline, CancellationToken.none());

        assertThat(outcome.getStatus()).isEqualTo(DispatchStatus.SENT);
        assertThat(outcome.getAttempts()).isEqualTo(1);
        assertThat(outcome.getHttpStatus()).isEqualTo(200);
        assertThat(outcome.getNotificationId()).matches("NOTIF-20240315-[0-9a-f]{8}");
    }

    @Test
    void dispatch_serverErrorThenSuccess_retriedOnce() {
        when(client.send(any()))
                .thenThrow(DispatchTransportException.serverError(503, null))
                .thenReturn(200);

        DispatchOutcome outcome = dispatcher.dispatch(delayFinding(), deadline, CancellationToken.none());

        assertThat(outcome.getStatus()).isEqualTo(DispatchStatus.SENT);
        assertThat(outcome.getAttempts()).isEqualTo(2);
        verify(client, times(2)).send(any());
    }

    @Test
    void dispatch_persistentServerError_failedAfterTwoAttempts() {
        when(client.send(any())).thenThrow(DispatchTransportException.io(new IOException("connection reset")));

        DispatchOutcome outcome = dispatcher.dispatch(delayFinding(), deadline, CancellationToken.none());

        assertThat(outcome.getStatus()).isEqualTo(DispatchStatus.FAILED);
        assertThat(outcome.getAttempts()).isEqualTo(2);
        verify(client, times(2)).send(any());
    }

    @Test
    void dispatch_clientError_notRetried() {
        when(client.send(any())).thenThrow(DispatchTransportException.rejected(422, "unknown skill"));

        DispatchOutcome outcome = dispatcher.dispatch(delayFinding(), deadline, CancellationToken.none());

        assertThat(outcome.getStatus()).isEqualTo(DispatchStatus.REJECTED);
        assertThat(outcome.getHttpStatus()).isEqualTo(422);
        verify(client, times(1)).send(any());
    }

    @Test
    void dispatch_deadlinePassed_abandonedWithoutAttempt() {
        DispatchOutcome outcome = dispatcher.dispatch(delayFinding(), NOW, CancellationToken.none());

        assertThat(outcome.getStatus()).isEqualTo(DispatchStatus.ABANDONED);
        assertThat(outcome.getAttempts()).isZero();
        assertThat(outcome.getNotificationId()).startsWith("NOTIF-");
        verify(client, never()).send(any());
    }

    @Test
    void dispatch_cancelled_skipped() {
        CancellationToken token = new CancellationToken();
        token.cancel();

        DispatchOutcome outcome = dispatcher.dispatch(delayFinding(), deadline, token);

        assertThat(outcome.getStatus()).isEqualTo(DispatchStatus.SKIPPED);
        verify(client, never()).send(any());
    }

    @Test
    void dispatchAll_oneFailureDoesNotStopOthers() {
        when(client.send(any()))
                .thenThrow(DispatchTransportException.rejected(400, "bad"))
                .thenReturn(202);
        List<ExceptionFinding> findings = List.of(
                createFinding("S1", ExceptionType.GEOFENCE_VIOLATION, Severity.HIGH),
                createFinding("S2", ExceptionType.DELAY, Severity.MEDIUM));

        List<DispatchOutcome> outcomes = dispatcher.dispatchAll(findings, deadline, CancellationToken.none());

        assertThat(outcomes).extracting(DispatchOutcome::getStatus)
                .containsExactly(DispatchStatus.REJECTED, DispatchStatus.SENT);
        assertThat(outcomes).extracting(DispatchOutcome::getNotificationId).doesNotHaveDuplicates();
        assertThat(registry.get("monitor.dispatch.count").tag("status", "SENT").counter().count()).isEqualTo(1.0);
    }

    @Test
    void dispatch_messageCarriesRenderedTemplateAndDetails() {
        when(client.send(any())).thenReturn(200);
        ArgumentCaptor<HandleExceptionMessage> captor = ArgumentCaptor.forClass(HandleExceptionMessage.class);

        dispatcher.dispatch(delayFinding(), deadline, CancellationToken.none());

        verify(client).send(captor.capture());
        HandleExceptionMessage sent = captor.getValue();
        assertThat(sent.skill()).isEqualTo("handle-exception");
        assertThat(sent.crew()).isEqualTo("exception");
        assertThat(sent.subject()).isEqualTo("[MEDIUM] Delay on shipment SHP-001");
        assertThat(sent.message()).isEqualTo("Test delay for SHP-001");
        assertThat(sent.details()).isEqualTo(delayFinding().getDetails());
    }

    @Test
    void buildMessage_spanishLanguage_rendersSpanishSubjectAndBody() {
        MonitorConfig config = new MonitorConfig();
        config.getDispatch().setLanguage("es");
        Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
        NotificationDispatcher spanish = new NotificationDispatcher(client, new NotificationTemplateService(),
                new NotificationIdGenerator(clock), config, new MetricsConfig(registry), clock);

        HandleExceptionMessage message = spanish.buildMessage(delayFinding(), "NOTIF-1");

        assertThat(message.subject()).isEqualTo("[MEDIUM] Retraso en el envío SHP-001");
        assertThat(message.message())
                .startsWith("El envío SHP-001 acumula retraso sobre su ETA programada.")
                .endsWith("Detalle técnico: Test delay for SHP-001");
    }
}
