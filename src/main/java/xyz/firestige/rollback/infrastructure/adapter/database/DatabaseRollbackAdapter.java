package xyz.firestige.rollback.infrastructure.adapter.database;

import xyz.firestige.rollback.domain.execution.RollbackStrategy;
import xyz.firestige.rollback.domain.execution.RollbackTarget;
import xyz.firestige.rollback.domain.execution.ServiceType;
import xyz.firestige.rollback.domain.shared.exception.ErrorType;
import xyz.firestige.rollback.infrastructure.adapter.AbstractTargetAdapter;
import xyz.firestige.rollback.infrastructure.adapter.AdapterContext;
import xyz.firestige.rollback.infrastructure.adapter.AdapterError;
import xyz.firestige.rollback.infrastructure.adapter.HealthSignal;
import xyz.firestige.rollback.infrastructure.adapter.PlannedStep;
import xyz.firestige.rollback.infrastructure.adapter.PlannedSteps;
import xyz.firestige.rollback.infrastructure.adapter.StepResult;
import xyz.firestige.rollback.infrastructure.external.DatabaseTooling;
import xyz.firestige.rollback.infrastructure.external.SnapshotHandle;

import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * 数据库回滚适配器
 * <p>
 * 步骤：create-snapshot（preserve_data，默认开启）→ check-migration → apply-migration → verify-migration。
 * 未配置 snapshot_tables 时快照全部业务表。
 * 迁移失败时已创建的快照不会删除，失败信息中带有 snapshot_id，可通过 {@link #restoreSnapshot(String)} 人工恢复。
 */
public class DatabaseRollbackAdapter extends AbstractTargetAdapter {

    public static final String OPT_TARGET_MIGRATION = "target_migration";
    public static final String OPT_PRESERVE_DATA = "preserve_data";
    public static final String OPT_SNAPSHOT_TABLES = "snapshot_tables";
    public static final String OPT_SNAPSHOT_LABEL = "snapshot_label";

    static final String CREATE_SNAPSHOT = "create-snapshot";
    static final String CHECK_MIGRATION = "check-migration";
    static final String APPLY_MIGRATION = "apply-migration";
    static final String VERIFY_MIGRATION = "verify-migration";

    static final String SNAPSHOT_ATTRIBUTE = "database.snapshot";

    private final DatabaseTooling tooling;

    public DatabaseRollbackAdapter(DatabaseTooling tooling) {
        this.tooling = tooling;
    }

    @Override
    public ServiceType getServiceType() {
        return ServiceType.DATABASE;
    }

    @Override
    public Set<RollbackStrategy> supportedStrategies() {
        return EnumSet.of(RollbackStrategy.DATABASE_MIGRATION);
    }

    @Override
    public List<String> validate(RollbackTarget target) {
        List<String> errors = new ArrayList<>();
        requireOption(target, OPT_TARGET_MIGRATION, errors);
        return errors;
    }

    @Override
    public PlannedSteps plan(RollbackTarget target) {
        String targetMigration = target.getString(OPT_TARGET_MIGRATION);
        List<PlannedStep> steps = new ArrayList<>();
        List<String> tables = target.getStringList(OPT_SNAPSHOT_TABLES);
        if (target.getBoolean(OPT_PRESERVE_DATA, true)) {
            String label = target.getString(OPT_SNAPSHOT_LABEL, "pre_rollback_" + targetMigration);
            steps.add(PlannedStep.of(CREATE_SNAPSHOT, CREATE_SNAPSHOT, Map.of("label", label, "tables", tables)));
        }
        Map<String, Object> params = Map.of("targetMigration", targetMigration);
        steps.add(PlannedStep.of(CHECK_MIGRATION, CHECK_MIGRATION, params));
        steps.add(PlannedStep.of(APPLY_MIGRATION, APPLY_MIGRATION, params));
        steps.add(PlannedStep.of(VERIFY_MIGRATION, VERIFY_MIGRATION, params));
        return PlannedSteps.of(steps);
    }

    @Override
    protected StepResult doExecute(PlannedStep step, AdapterContext context) {
        RollbackTarget target = context.getTarget();
        String targetMigration = step.param("targetMigration");
        return switch (step.action()) {
            case CREATE_SNAPSHOT -> {
                SnapshotHandle handle = tooling.dumpSnapshot(step.param("label"), step.param("tables"));
                context.put(SNAPSHOT_ATTRIBUTE, handle);
                yield StepResult.success("快照已创建: " + handle.describe());
            }
            case CHECK_MIGRATION -> {
                if (!tooling.migrationExists(targetMigration)) {
                    yield StepResult.failure(AdapterError.fatal(target.name(),
                            withSnapshotHint("目标迁移版本不存在: " + targetMigration, context),
                            ErrorType.VALIDATION_ERROR));
                }
                yield StepResult.success("目标迁移版本存在，当前版本: " + tooling.currentMigration());
            }
            case APPLY_MIGRATION -> applyMigration(target, targetMigration, context);
            case VERIFY_MIGRATION -> {
                String current = tooling.currentMigration();
                if (!targetMigration.equals(current)) {
                    yield StepResult.failure(AdapterError.fatal(target.name(),
                            withSnapshotHint(String.format("迁移版本校验失败，期望 %s，实际 %s", targetMigration, current), context),
                            ErrorType.VERIFICATION_ERROR));
                }
                yield StepResult.success("当前迁移版本: " + current);
            }
            default -> unknownAction(step, context);
        };
    }

    private StepResult applyMigration(RollbackTarget target, String targetMigration, AdapterContext context) {
        try {
            tooling.applyMigration(targetMigration);
            return StepResult.success("已回退到迁移版本 " + targetMigration);
        } catch (RuntimeException e) {
            AdapterError classified = AdapterError.fromException(target.name(), APPLY_MIGRATION, e);
            log.error("应用逆向迁移失败: {}, target: {}", targetMigration, target.name(), e);
            return StepResult.failure(new AdapterError(classified.target(),
                    withSnapshotHint(classified.reason(), context), classified.retryable(), classified.errorType()));
        }
    }

    private static String withSnapshotHint(String reason, AdapterContext context) {
        Optional<SnapshotHandle> snapshot = context.get(SNAPSHOT_ATTRIBUTE, SnapshotHandle.class);
        return snapshot.map(h -> reason + "；快照已保留，可用于人工恢复: snapshot_id=" + h.snapshotId()
                + " " + h.backupTables().values()).orElse(reason);
    }

    @Override
    public HealthSignal verify(RollbackTarget target) {
        String expected = target.getString(OPT_TARGET_MIGRATION);
        try {
            String current = tooling.currentMigration();
            return expected.equals(current)
                    ? HealthSignal.healthy(target.name(), "迁移版本 " + current)
                    : HealthSignal.critical(target.name(), String.format("迁移版本 %s，期望 %s", current, expected));
        } catch (RuntimeException e) {
            log.warn("读取迁移版本失败, target: {}", target.name(), e);
            return HealthSignal.critical(target.name(), "读取迁移版本失败: " + e.getMessage());
        }
    }

    /**
     * 从快照恢复数据（人工恢复入口）
     */
    public void restoreSnapshot(SnapshotHandle handle) {
        log.info("从快照恢复: {}", handle.describe());
        tooling.restoreSnapshot(handle);
    }

    /**
     * 按失败信息中的 snapshot_id 恢复数据
     */
    public void restoreSnapshot(String snapshotId) {
        log.info("从快照恢复: snapshot_id={}", snapshotId);
        tooling.restoreSnapshot(snapshotId);
    }

    /**
     * 清理过期快照
     */
    public int cleanupSnapshots(Duration olderThan) {
        int removed = tooling.cleanupSnapshots(olderThan);
        log.info("清理过期快照: {} 个, olderThan: {}", removed, olderThan);
        return removed;
    }
}
