package com.ivamare.connect.maintenance;

import com.ivamare.connect.ConnectAutoConfiguration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.annotation.Scheduled;

/**
 * Runs cleanup and schema refresh on a schedule.
 *
 * <p>Enable with:
 * <pre>
 * connect.maintenance.enabled=true
 * </pre>
 */
@AutoConfiguration(after = ConnectAutoConfiguration.class)
@EnableScheduling
@ConditionalOnProperty(prefix = "connect.maintenance", name = "enabled", havingValue = "true")
@ConditionalOnBean({MessageLogCleanup.class, SchemaRefreshTask.class})
public class MaintenanceConfiguration {

    private static final Logger log = LoggerFactory.getLogger(MaintenanceConfiguration.class);

    private final MessageLogCleanup cleanup;
    private final SchemaRefreshTask schemaRefresh;

    public MaintenanceConfiguration(MessageLogCleanup cleanup, SchemaRefreshTask schemaRefresh) {
        this.cleanup = cleanup;
        this.schemaRefresh = schemaRefresh;
    }

    @Scheduled(
        fixedDelayString = "${connect.maintenance.cleanup-interval:1d}",
        initialDelayString = "${connect.maintenance.cleanup-interval:1d}"
    )
    public void cleanupMessageLog() {
        try {
            cleanup.run();
        } catch (RuntimeException e) {
            log.error("Message log cleanup failed: {}", e.getMessage(), e);
        }
    }

    @Scheduled(
        fixedDelayString = "${connect.schema.refresh-interval:6h}",
        initialDelayString = "${connect.schema.refresh-interval:6h}"
    )
    public void refreshSchemas() {
        schemaRefresh.run();
    }
}
