package com.cargo.monitor.service;

import com.cargo.monitor.config.MetricsConfig;
import com.cargo.monitor.exception.PersistenceException;
import com.cargo.monitor.model.MonitorRunRecord;
import com.cargo.monitor.repository.MonitorRunRepository;
import com.cargo.monitor.testutil.TestDataFactory;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static com.cargo.monitor.testutil.TestDataFactory.NOW;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class MonitorRunRecorderTest {

    @Mock
    private MonitorRunRepository repository;

    private final SimpleMeterRegistry registry = new SimpleMeterRegistry();

    @Test
    void record_success_saved() {
        MonitorRunRecorder recorder = new MonitorRunRecorder(repository, new MetricsConfig(registry));
        MonitorRunRecord run = TestDataFactory.createRunRecord("RUN-1", NOW, 4, 1, 1);

        recorder.record(run);

        verify(repository).save(run);
    }

    @Test
    void record_persistenceFailure_swallowedAndCounted() {
        doThrow(new PersistenceException("write failed", null)).when(repository).save(any());
        MonitorRunRecorder recorder = new MonitorRunRecorder(repository, new MetricsConfig(registry));

        assertThatCode(() -> recorder.record(TestDataFactory.createRunRecord("RUN-1", NOW, 4, 1, 1)))
                .doesNotThrowAnyException();
        assertThat(registry.get("monitor.history.write.failure.count").counter().count()).isEqualTo(1.0);
    }
}
