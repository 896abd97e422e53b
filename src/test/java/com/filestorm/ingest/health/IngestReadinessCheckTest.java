package com.filestorm.ingest.health;

import com.filestorm.ingest.consumer.ConsumerState;
import com.filestorm.ingest.consumer.IngestionConsumerLoop;
import com.filestorm.ingest.store.RecordStorePool;
import com.filestorm.ingest.stream.EventLogFacade;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class IngestReadinessCheckTest {

    @Mock
    EventLogFacade eventLog;

    @Mock
    RecordStorePool pool;

    @Mock
    IngestionConsumerLoop consumerLoop;

    private IngestReadinessCheck check;

    @BeforeEach
    void setUp() {
        check = new IngestReadinessCheck();
        check.eventLog = eventLog;
        check.pool = pool;
        check.consumerLoop = consumerLoop;
        when(consumerLoop.getState()).thenReturn(ConsumerState.RUNNING);
    }

    @Test
    void upWhenStreamAndStoreAnswer() {
        when(eventLog.ping()).thenReturn(true);
        when(pool.isReady()).thenReturn(true);

        HealthCheckResponse response = check.call();

        assertThat(response.getName()).isEqualTo("ingestion-consumer");
        assertThat(response.getStatus()).isEqualTo(HealthCheckResponse.Status.UP);
        assertThat(response.getData()).hasValueSatisfying(data -> assertThat(data)
                .containsEntry("redis", "connected")
                .containsEntry("database", "connected")
                .containsEntry("consumer_state", "RUNNING"));
    }

    @Test
    void downWhenStoreIsUnreachable() {
        when(eventLog.ping()).thenReturn(true);
        when(pool.isReady()).thenReturn(false);

        HealthCheckResponse response = check.call();

        assertThat(response.getStatus()).isEqualTo(HealthCheckResponse.Status.DOWN);
        assertThat(response.getData()).hasValueSatisfying(data -> assertThat(data)
                .containsEntry("database", "disconnected"));
    }

    @Test
    void downWhenStreamIsUnreachable() {
        when(eventLog.ping()).thenReturn(false);
        when(pool.isReady()).thenReturn(true);

        assertThat(check.call().getStatus()).isEqualTo(HealthCheckResponse.Status.DOWN);
    }
}
