package com.filestorm.ingest;

import com.filestorm.ingest.consumer.IngestionConsumerLoop;
import io.quarkus.runtime.Quarkus;
import io.quarkus.runtime.QuarkusApplication;
import io.quarkus.runtime.ShutdownEvent;
import io.quarkus.runtime.StartupEvent;
import io.quarkus.runtime.annotations.QuarkusMain;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

/**
 * Main application class of the upload ingestion consumer.
 */
@QuarkusMain
public class FileStormIngestApplication implements QuarkusApplication {

    private static final Logger LOG = Logger.getLogger(FileStormIngestApplication.class);

    public static void main(String[] args) {
        Quarkus.run(FileStormIngestApplication.class, args);
    }

    @Override
    public int run(String... args) throws Exception {
        LOG.info("FileStorm ingestion consumer starting...");
        Quarkus.waitForExit();
        return 0;
    }
}

/**
 * Starts the consumer loop with the application and joins it on shutdown.
 */
@ApplicationScoped
class ApplicationLifecycleObserver {

    private static final Logger LOG = Logger.getLogger(ApplicationLifecycleObserver.class);

    @Inject
    IngestionConsumerLoop consumerLoop;

    void onStart(@Observes StartupEvent event) {
        if (!consumerLoop.isConsumerEnabled()) {
            LOG.info("Consumer disabled via app.consumer.enabled, not starting loop");
            return;
        }
        consumerLoop.start();
        LOG.info("FileStorm ingestion consumer started");
    }

    /**
     * Stops the loop cooperatively; the in-flight cycle finishes or is interrupted after
     * {@code app.consumer.shutdown-timeout-seconds}, then the store pool is closed.
     */
    void onShutdown(@Observes ShutdownEvent event) {
        LOG.info("Shutdown signal received, stopping consumer...");
        consumerLoop.stop();
        LOG.info("Graceful shutdown complete");
    }
}
