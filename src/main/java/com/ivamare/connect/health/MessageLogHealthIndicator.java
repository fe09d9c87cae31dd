package com.ivamare.connect.health;

import com.ivamare.connect.log.MessageLogRepository;
import com.ivamare.connect.log.StatusCount;
import com.zaxxer.hikari.HikariDataSource;
import com.zaxxer.hikari.HikariPoolMXBean;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;

import javax.sql.DataSource;
import java.time.Clock;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Health indicator for the message log.
 *
 * <p>Reports entry counts of the last 24 hours per direction and status, and HikariCP
 * pool statistics when available.
 */
public class MessageLogHealthIndicator implements HealthIndicator {

    private static final Duration WINDOW = Duration.ofHours(24);

    private final MessageLogRepository messageLog;
    private final DataSource dataSource;
    private final Clock clock;

    public MessageLogHealthIndicator(MessageLogRepository messageLog, DataSource dataSource, Clock clock) {
        this.messageLog = messageLog;
        this.dataSource = dataSource;
        this.clock = clock;
    }

    @Override
    public Health health() {
        try {
            List<StatusCount> counts = messageLog.countByDirectionAndStatus(clock.instant().minus(WINDOW));

            Map<String, Long> last24h = new LinkedHashMap<>();
            for (StatusCount count : counts) {
                last24h.put(count.direction().getValue() + "." + count.status().getValue(), count.count());
            }

            Health.Builder builder = Health.up().withDetail("last24h", last24h);
            addPoolStats(builder);
            return builder.build();

        } catch (Exception e) {
            return Health.down()
                .withDetail("error", e.getMessage())
                .build();
        }
    }

    private void addPoolStats(Health.Builder builder) {
        if (dataSource instanceof HikariDataSource hikari) {
            HikariPoolMXBean pool = hikari.getHikariPoolMXBean();
            if (pool != null) {
                builder.withDetail("pool.active", pool.getActiveConnections());
                builder.withDetail("pool.idle", pool.getIdleConnections());
                builder.withDetail("pool.total", pool.getTotalConnections());
            }
        }
    }
}
