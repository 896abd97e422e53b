package com.filestorm.ingest.health;

import com.filestorm.ingest.consumer.IngestionConsumerLoop;
import com.filestorm.ingest.store.RecordStorePool;
import com.filestorm.ingest.stream.EventLogFacade;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.health.HealthCheck;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.eclipse.microprofile.health.HealthCheckResponseBuilder;
import org.eclipse.microprofile.health.Readiness;

/**
 * Ready when both the upload stream and the record store answer.
 */
@Readiness
@ApplicationScoped
public class IngestReadinessCheck implements HealthCheck {

    @Inject
    EventLogFacade eventLog;

    @Inject
    RecordStorePool pool;

    @Inject
    IngestionConsumerLoop consumerLoop;

    @Override
    public HealthCheckResponse call() {
        boolean redis = eventLog.ping();
        boolean database = pool.isReady();

        HealthCheckResponseBuilder builder = HealthCheckResponse.named("ingestion-consumer")
                .withData("redis", redis ? "connected" : "disconnected")
                .withData("database", database ? "connected" : "disconnected")
                .withData("consumer_state", consumerLoop.getState().name());
        return redis && database ? builder.up().build() : builder.down().build();
    }
}
