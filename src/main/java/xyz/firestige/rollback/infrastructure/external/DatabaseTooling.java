package xyz.firestige.rollback.infrastructure.external;

import java.time.Duration;
import java.util.List;

/**
 * 数据库工具：快照与迁移
 */
public interface DatabaseTooling {

    /**
     * 对指定表做时间点快照，并登记快照记录
     *
     * @param label  快照标签（用于人工恢复时识别）
     * @param tables 需要快照的表；为空时快照全部业务表
     * @return 快照句柄
     */
    SnapshotHandle dumpSnapshot(String label, List<String> tables);

    /**
     * 应用逆向迁移，回退到 targetVersion
     */
    void applyMigration(String targetVersion);

    /**
     * 当前迁移版本
     */
    String currentMigration();

    /**
     * 迁移版本是否存在（已知的版本或基线版本）
     */
    boolean migrationExists(String version);

    /**
     * 从快照恢复表数据
     */
    void restoreSnapshot(SnapshotHandle handle);

    /**
     * 按快照 ID 从快照记录恢复表数据（进程重启后的人工恢复入口）
     *
     * @throws IllegalArgumentException 快照不存在
     */
    void restoreSnapshot(String snapshotId);

    /**
     * 清理早于 olderThan 的快照
     *
     * @return 清理的快照表数量
     */
    int cleanupSnapshots(Duration olderThan);
}
