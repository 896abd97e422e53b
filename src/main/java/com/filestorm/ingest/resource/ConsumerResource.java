package com.filestorm.ingest.resource;

import com.filestorm.ingest.consumer.IngestionConsumerLoop;
import com.filestorm.ingest.consumer.IngestionConsumerLoop.CycleResult;
import com.filestorm.ingest.resource.dto.CountsResponse;
import com.filestorm.ingest.resource.dto.ErrorResponse;
import com.filestorm.ingest.resource.dto.HealthResponse;
import com.filestorm.ingest.resource.dto.MetricsResponse;
import com.filestorm.ingest.resource.dto.TriggerResponse;
import com.filestorm.ingest.store.FileEventRepository;
import com.filestorm.ingest.store.RecordStorePool;
import com.filestorm.ingest.stream.EventLogFacade;
import com.filestorm.ingest.util.IngestMetrics;
import jakarta.inject.Inject;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponse;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponses;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;
import org.jboss.logging.Logger;

import java.lang.management.ManagementFactory;
import java.sql.SQLException;
import java.time.Instant;

/**
 * Operational endpoints of the ingestion consumer.
 *
 * <p>Used by operators and deployment probes for:
 * <ul>
 *   <li>health of the stream and record store connections</li>
 *   <li>manually running one consumer cycle while debugging</li>
 *   <li>comparing queue depth with stored rows</li>
 * </ul>
 */
@Path("/v1/consumer")
@Produces(MediaType.APPLICATION_JSON)
@Tag(name = "Consumer", description = "Ingestion consumer operations")
public class ConsumerResource {

    private static final Logger LOG = Logger.getLogger(ConsumerResource.class);

    @Inject
    IngestionConsumerLoop consumerLoop;

    @Inject
    EventLogFacade eventLog;

    @Inject
    RecordStorePool pool;

    @Inject
    FileEventRepository repository;

    @Inject
    IngestMetrics metrics;

    @GET
    @Path("/health")
    @Operation(summary = "Consumer health", description = "Stream and record store connectivity plus queue depth")
    @APIResponses({
            @APIResponse(responseCode = "200", description = "Consumer healthy"),
            @APIResponse(responseCode = "503", description = "Stream or record store unreachable")
    })
    public Response health() {
        HealthResponse health = new HealthResponse();
        health.consumer = consumerLoop.consumerName();
        health.consumerEnabled = consumerLoop.isConsumerEnabled();
        health.consumerRunning = consumerLoop.isRunning();
        health.consumerState = consumerLoop.getState().name();
        health.redisConnected = eventLog.ping();
        health.databaseConnected = pool.isReady();

        if (health.redisConnected) {
            try {
                health.queueLength = eventLog.streamLength();
            } catch (RuntimeException e) {
                LOG.warnf("Could not read queue length: %s", e.getMessage());
                health.error = e.getMessage();
            }
        }

        if (health.redisConnected && health.databaseConnected) {
            health.status = "healthy";
            return Response.ok(health).build();
        }
        health.status = "unhealthy";
        if (health.error == null) {
            health.error = !health.redisConnected ? "redis unreachable" : "database unreachable";
        }
        return Response.status(Response.Status.SERVICE_UNAVAILABLE).entity(health).build();
    }

    @POST
    @Path("/trigger")
    @Operation(summary = "Run one consumer cycle", description = "Claims pending entries and reads new ones once, now")
    @APIResponses({
            @APIResponse(responseCode = "200", description = "Cycle completed"),
            @APIResponse(responseCode = "400", description = "Consumer disabled"),
            @APIResponse(responseCode = "500", description = "Cycle failed")
    })
    public Response trigger() {
        if (!consumerLoop.isConsumerEnabled()) {
            return Response.status(Response.Status.BAD_REQUEST)
                    .entity(new ErrorResponse("CONSUMER_DISABLED", "Consumer is disabled"))
                    .build();
        }
        try {
            CycleResult result = consumerLoop.runOnce();
            TriggerResponse response = new TriggerResponse();
            response.status = result.isEmpty() ? "idle" : "processed";
            response.claimed = result.getClaimed();
            response.read = result.getRead();
            response.persisted = result.getPersisted();
            response.skipped = result.getOutcome().getSkipped();
            response.errored = result.getOutcome().getErrored();
            LOG.infof("Manual trigger: %d claimed, %d read, %d persisted",
                    response.claimed, response.read, response.persisted);
            return Response.ok(response).build();
        } catch (RuntimeException e) {
            LOG.errorf(e, "Manually triggered cycle failed");
            return Response.status(Response.Status.INTERNAL_SERVER_ERROR)
                    .entity(new ErrorResponse("CYCLE_FAILED", e.getMessage()))
                    .build();
        }
    }

    @GET
    @Path("/counts")
    @Operation(summary = "Stream and store counts")
    @APIResponses({
            @APIResponse(responseCode = "200", description = "Counts retrieved"),
            @APIResponse(responseCode = "503", description = "Stream or record store unreachable")
    })
    public Response counts() {
        try {
            long streamLength = eventLog.streamLength();
            long rows = repository.count();
            return Response.ok(new CountsResponse(streamLength, rows, Instant.now())).build();
        } catch (SQLException | RuntimeException e) {
            LOG.warnf("Could not read counts: %s", e.getMessage());
            return Response.status(Response.Status.SERVICE_UNAVAILABLE)
                    .entity(new ErrorResponse("COUNTS_UNAVAILABLE", e.getMessage()))
                    .build();
        }
    }

    @GET
    @Path("/metrics")
    @Operation(summary = "Consumer metrics", description = "In-process consumer counters")
    @APIResponse(responseCode = "200", description = "Metrics retrieved")
    public Response metrics() {
        MetricsResponse response = new MetricsResponse();
        response.consumerState = consumerLoop.getState().name();
        response.jvmUptime = ManagementFactory.getRuntimeMXBean().getUptime();
        response.jvmMemory = Runtime.getRuntime().totalMemory() - Runtime.getRuntime().freeMemory();
        response.counters = metrics.snapshot();
        return Response.ok(response).build();
    }
}
