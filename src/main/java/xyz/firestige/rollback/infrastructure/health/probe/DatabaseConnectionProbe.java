package xyz.firestige.rollback.infrastructure.health.probe;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;
import xyz.firestige.rollback.domain.health.CheckType;
import xyz.firestige.rollback.domain.health.HealthCheckDefinition;
import xyz.firestige.rollback.domain.health.HealthCheckResult;
import xyz.firestige.rollback.domain.health.HealthStatus;

import javax.sql.DataSource;
import java.time.Clock;
import java.time.LocalDateTime;

/**
 * database_connection：执行 query（带超时），失败为 critical；value 为耗时毫秒
 */
public class DatabaseConnectionProbe implements HealthProbe {

    private static final Logger log = LoggerFactory.getLogger(DatabaseConnectionProbe.class);

    private final DataSource dataSource;
    private final Clock clock;

    public DatabaseConnectionProbe(DataSource dataSource, Clock clock) {
        this.dataSource = dataSource;
        this.clock = clock;
    }

    @Override
    public CheckType getType() {
        return CheckType.DATABASE_CONNECTION;
    }

    @Override
    public HealthCheckResult probe(HealthCheckDefinition check) {
        JdbcTemplate jdbcTemplate = new JdbcTemplate(dataSource);
        jdbcTemplate.setQueryTimeout(check.getTimeoutSeconds());
        long start = System.nanoTime();
        try {
            jdbcTemplate.execute(check.getQuery());
            long elapsedMs = (System.nanoTime() - start) / 1_000_000;
            return HealthCheckResult.of(check, HealthStatus.HEALTHY, elapsedMs, LocalDateTime.now(clock), "OK");
        } catch (Exception e) {
            log.debug("数据库探测失败: {}", check.getCheckId(), e);
            return HealthCheckResult.of(check, HealthStatus.CRITICAL, -1, LocalDateTime.now(clock),
                    "数据库检查失败: " + e.getMessage());
        }
    }
}
