package xyz.firestige.rollback.infrastructure.external.jdbc;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.ConnectionCallback;
import org.springframework.jdbc.core.JdbcTemplate;
import xyz.firestige.rollback.infrastructure.external.DatabaseTooling;
import xyz.firestige.rollback.infrastructure.external.SnapshotHandle;

import java.sql.DatabaseMetaData;
import java.sql.ResultSet;
import java.sql.Timestamp;
import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;
import java.util.function.Function;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * 基于 JdbcTemplate 的数据库工具
 * <p>
 * 快照：CREATE TABLE backup_{snapshotId}_{table} AS SELECT * FROM {table}，并登记到 rollback_snapshot 表；
 * 未指定表时从 JDBC 元数据读取全部业务表（排除快照表和元数据表）。
 * 迁移：rollback_schema_version 记录已应用的版本；回退时按版本倒序执行配置的 downSql。
 * 回退只触碰迁移脚本涉及的对象，其他表的数据保持不变。
 */
public class JdbcDatabaseTooling implements DatabaseTooling {

    private static final Logger log = LoggerFactory.getLogger(JdbcDatabaseTooling.class);

    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");
    private static final DateTimeFormatter SNAPSHOT_TIME = DateTimeFormatter.ofPattern("yyyyMMddHHmmss");

    static final String VERSION_TABLE = "rollback_schema_version";
    static final String SNAPSHOT_TABLE = "rollback_snapshot";
    static final String BACKUP_PREFIX = "backup_";

    private final JdbcTemplate jdbcTemplate;
    private final Map<String, MigrationDefinition> catalog;
    private final String baselineVersion;
    private final Clock clock;

    public JdbcDatabaseTooling(JdbcTemplate jdbcTemplate, List<MigrationDefinition> migrations,
                               String baselineVersion, Clock clock) {
        this.jdbcTemplate = jdbcTemplate;
        this.catalog = migrations.stream()
                .collect(Collectors.toMap(MigrationDefinition::getVersion, Function.identity(),
                        (a, b) -> b, LinkedHashMap::new));
        this.baselineVersion = baselineVersion != null ? baselineVersion : "0";
        this.clock = clock;
        ensureMetadataTables();
    }

    private void ensureMetadataTables() {
        jdbcTemplate.execute("CREATE TABLE IF NOT EXISTS " + VERSION_TABLE + " ("
                + "version VARCHAR(64) NOT NULL PRIMARY KEY, "
                + "description VARCHAR(255), "
                + "applied_at TIMESTAMP)");
        jdbcTemplate.execute("CREATE TABLE IF NOT EXISTS " + SNAPSHOT_TABLE + " ("
                + "snapshot_id VARCHAR(64) NOT NULL, "
                + "label VARCHAR(255), "
                + "source_table VARCHAR(128) NOT NULL, "
                + "backup_table VARCHAR(160) NOT NULL, "
                + "record_count BIGINT, "
                + "created_at TIMESTAMP NOT NULL)");
    }

    // ========== 快照 ==========

    @Override
    public SnapshotHandle dumpSnapshot(String label, List<String> tables) {
        LocalDateTime now = LocalDateTime.now(clock);
        String snapshotId = now.format(SNAPSHOT_TIME) + "_" + UUID.randomUUID().toString().substring(0, 4);
        Map<String, String> backupTables = new LinkedHashMap<>();
        Map<String, Long> counts = new LinkedHashMap<>();
        List<String> sources = tables == null || tables.isEmpty() ? userTables() : tables;
        if (sources.isEmpty()) {
            log.warn("[DB] 没有可快照的业务表, label: {}", label);
        }

        for (String table : sources) {
            requireIdentifier(table);
            String backupTable = BACKUP_PREFIX + snapshotId + "_" + table;
            jdbcTemplate.execute("CREATE TABLE " + backupTable + " AS SELECT * FROM " + table);
            Long count = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM " + backupTable, Long.class);
            long recordCount = count != null ? count : 0L;
            jdbcTemplate.update("INSERT INTO " + SNAPSHOT_TABLE
                            + " (snapshot_id, label, source_table, backup_table, record_count, created_at) VALUES (?, ?, ?, ?, ?, ?)",
                    snapshotId, label, table, backupTable, recordCount, Timestamp.valueOf(now));
            backupTables.put(table, backupTable);
            counts.put(table, recordCount);
            log.info("[DB] 快照表已创建: {} ({} 行)", backupTable, recordCount);
        }
        return new SnapshotHandle(snapshotId, label, backupTables, counts, now);
    }

    /**
     * 当前 schema 下的业务表
     */
    List<String> userTables() {
        List<String> tables = jdbcTemplate.execute((ConnectionCallback<List<String>>) connection -> {
            DatabaseMetaData metaData = connection.getMetaData();
            List<String> names = new ArrayList<>();
            try (ResultSet rs = metaData.getTables(connection.getCatalog(), connection.getSchema(), "%",
                    new String[]{"TABLE"})) {
                while (rs.next()) {
                    names.add(rs.getString("TABLE_NAME"));
                }
            }
            return names;
        });
        if (tables == null) {
            return List.of();
        }
        return tables.stream().filter(JdbcDatabaseTooling::isUserTable).toList();
    }

    private static boolean isUserTable(String table) {
        String lower = table.toLowerCase(Locale.ROOT);
        return !lower.startsWith(BACKUP_PREFIX)
                && !lower.equals(SNAPSHOT_TABLE)
                && !lower.equals(VERSION_TABLE);
    }

    @Override
    public void restoreSnapshot(SnapshotHandle handle) {
        restoreTables(handle.snapshotId(), handle.backupTables());
    }

    @Override
    public void restoreSnapshot(String snapshotId) {
        Map<String, String> backupTables = new LinkedHashMap<>();
        for (Map<String, Object> row : jdbcTemplate.queryForList(
                "SELECT source_table, backup_table FROM " + SNAPSHOT_TABLE + " WHERE snapshot_id = ?", snapshotId)) {
            backupTables.put(String.valueOf(row.get("source_table")), String.valueOf(row.get("backup_table")));
        }
        if (backupTables.isEmpty()) {
            throw new IllegalArgumentException("快照不存在: " + snapshotId);
        }
        restoreTables(snapshotId, backupTables);
    }

    private void restoreTables(String snapshotId, Map<String, String> backupTables) {
        log.info("[DB] 从快照恢复: {}, 表: {}", snapshotId, backupTables.keySet());
        backupTables.forEach((table, backupTable) -> {
            requireIdentifier(table);
            requireIdentifier(backupTable);
            jdbcTemplate.execute("DELETE FROM " + table);
            jdbcTemplate.execute("INSERT INTO " + table + " SELECT * FROM " + backupTable);
            log.info("[DB] 已从快照恢复: {} ← {}", table, backupTable);
        });
    }

    @Override
    public int cleanupSnapshots(Duration olderThan) {
        LocalDateTime cutoff = LocalDateTime.now(clock).minus(olderThan);
        List<String> backupTables = jdbcTemplate.queryForList(
                "SELECT backup_table FROM " + SNAPSHOT_TABLE + " WHERE created_at < ?",
                String.class, Timestamp.valueOf(cutoff));
        for (String backupTable : backupTables) {
            requireIdentifier(backupTable);
            jdbcTemplate.execute("DROP TABLE IF EXISTS " + backupTable);
        }
        jdbcTemplate.update("DELETE FROM " + SNAPSHOT_TABLE + " WHERE created_at < ?", Timestamp.valueOf(cutoff));
        if (!backupTables.isEmpty()) {
            log.info("[DB] 清理过期快照表 {} 个（早于 {}）", backupTables.size(), cutoff);
        }
        return backupTables.size();
    }

    // ========== 迁移 ==========

    @Override
    public String currentMigration() {
        List<String> applied = appliedVersions();
        return applied.stream().max(MigrationVersions.ORDER).orElse(baselineVersion);
    }

    @Override
    public boolean migrationExists(String version) {
        return version != null && (version.equals(baselineVersion) || catalog.containsKey(version));
    }

    @Override
    public void applyMigration(String targetVersion) {
        if (!migrationExists(targetVersion)) {
            throw new IllegalArgumentException("目标迁移版本不存在: " + targetVersion);
        }
        List<String> toRevert = appliedVersions().stream()
                .filter(v -> MigrationVersions.compare(v, targetVersion) > 0)
                .sorted(Comparator.comparing(Function.<String>identity(), MigrationVersions.ORDER).reversed())
                .toList();
        if (toRevert.isEmpty()) {
            log.info("[DB] 当前版本已不高于目标版本, target: {}, current: {}", targetVersion, currentMigration());
            return;
        }
        for (String version : toRevert) {
            MigrationDefinition migration = catalog.get(version);
            if (migration == null || migration.getDownSql() == null || migration.getDownSql().isEmpty()) {
                throw new IllegalStateException("迁移版本没有逆向脚本: " + version);
            }
            log.info("[DB] 回退迁移 {} ({})", version, migration.getDescription());
            for (String sql : migration.getDownSql()) {
                jdbcTemplate.execute(sql);
            }
            jdbcTemplate.update("DELETE FROM " + VERSION_TABLE + " WHERE version = ?", version);
        }
        log.info("[DB] 迁移回退完成, 当前版本: {}", currentMigration());
    }

    /**
     * 记录一个已应用的迁移版本（部署流程或测试准备数据时使用）
     */
    public void recordApplied(String version, String description) {
        jdbcTemplate.update("INSERT INTO " + VERSION_TABLE + " (version, description, applied_at) VALUES (?, ?, ?)",
                version, description, Timestamp.valueOf(LocalDateTime.now(clock)));
    }

    private List<String> appliedVersions() {
        return jdbcTemplate.queryForList("SELECT version FROM " + VERSION_TABLE, String.class);
    }

    private static void requireIdentifier(String name) {
        if (name == null || !IDENTIFIER.matcher(name).matches()) {
            throw new IllegalArgumentException("非法的表名: " + name);
        }
    }
}
