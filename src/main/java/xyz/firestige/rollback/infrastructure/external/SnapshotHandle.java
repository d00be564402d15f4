package xyz.firestige.rollback.infrastructure.external;

import java.time.LocalDateTime;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 数据库快照句柄
 *
 * @param backupTables 原表 → 快照表
 * @param recordCounts 原表 → 快照时的行数
 */
public record SnapshotHandle(
        String snapshotId,
        String label,
        Map<String, String> backupTables,
        Map<String, Long> recordCounts,
        LocalDateTime createdAt) {

    public SnapshotHandle {
        backupTables = Collections.unmodifiableMap(new LinkedHashMap<>(backupTables));
        recordCounts = Collections.unmodifiableMap(new LinkedHashMap<>(recordCounts));
    }

    public String describe() {
        return snapshotId + backupTables.values();
    }
}
