package xyz.firestige.rollback.infrastructure.adapter.database;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DataAccessResourceFailureException;
import xyz.firestige.rollback.domain.execution.RollbackStrategy;
import xyz.firestige.rollback.domain.execution.RollbackTarget;
import xyz.firestige.rollback.domain.execution.ServiceType;
import xyz.firestige.rollback.domain.health.HealthStatus;
import xyz.firestige.rollback.domain.shared.exception.ErrorType;
import xyz.firestige.rollback.domain.shared.vo.ExecutionId;
import xyz.firestige.rollback.infrastructure.adapter.AdapterContext;
import xyz.firestige.rollback.infrastructure.adapter.PlannedStep;
import xyz.firestige.rollback.infrastructure.adapter.StepResult;
import xyz.firestige.rollback.infrastructure.external.DatabaseTooling;
import xyz.firestige.rollback.infrastructure.external.SnapshotHandle;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class DatabaseRollbackAdapterTest {

    private DatabaseTooling tooling;
    private DatabaseRollbackAdapter adapter;

    @BeforeEach
    void setUp() {
        tooling = mock(DatabaseTooling.class);
        adapter = new DatabaseRollbackAdapter(tooling);
    }

    private static RollbackTarget target(Map<String, Object> options) {
        return RollbackTarget.of("orders-db", ServiceType.DATABASE, "production",
                RollbackStrategy.DATABASE_MIGRATION, options);
    }

    private static SnapshotHandle snapshot() {
        return new SnapshotHandle("snap1", "pre_rollback_20250801", Map.of("orders", "backup_snap1_orders"),
                Map.of("orders", 100L), LocalDateTime.of(2025, 8, 5, 10, 0));
    }

    private PlannedStep step(RollbackTarget target, String name) {
        return adapter.plan(target).steps().stream()
                .filter(s -> s.name().equals(name))
                .findFirst()
                .orElseThrow();
    }

    @Test
    void plan_withSnapshotTables_snapshotsFirst() {
        RollbackTarget target = target(Map.of("target_migration", "20250801", "snapshot_tables", "orders,users"));

        List<PlannedStep> steps = adapter.plan(target).steps();

        assertThat(steps).extracting(PlannedStep::name)
                .containsExactly("create-snapshot", "check-migration", "apply-migration", "verify-migration");
        String label = steps.get(0).param("label");
        assertThat(label).isEqualTo("pre_rollback_20250801");
    }

    @Test
    void plan_preserveDataDisabled_skipsSnapshot() {
        RollbackTarget target = target(Map.of("target_migration", "20250801",
                "snapshot_tables", "orders", "preserve_data", false));

        assertThat(adapter.plan(target).steps()).extracting(PlannedStep::name)
                .containsExactly("check-migration", "apply-migration", "verify-migration");
    }

    @Test
    void happyPath_runsAllSteps() {
        RollbackTarget target = target(Map.of("target_migration", "20250801", "snapshot_tables", "orders"));
        when(tooling.dumpSnapshot("pre_rollback_20250801", List.of("orders"))).thenReturn(snapshot());
        when(tooling.migrationExists("20250801")).thenReturn(true);
        when(tooling.currentMigration()).thenReturn("20250805", "20250801");
        AdapterContext ctx = new AdapterContext(ExecutionId.ofTrusted("exec-test"), target);

        List<StepResult> results = adapter.plan(target).steps().stream()
                .map(step -> adapter.execute(step, ctx))
                .toList();

        assertThat(results).allMatch(StepResult::isSuccess);
        verify(tooling).applyMigration("20250801");
        assertThat(ctx.get("database.snapshot", SnapshotHandle.class)).isPresent();
    }

    @Test
    void unknownMigration_failsWithoutApplying() {
        RollbackTarget target = target(Map.of("target_migration", "19990101"));
        when(tooling.migrationExists("19990101")).thenReturn(false);
        AdapterContext ctx = new AdapterContext(ExecutionId.ofTrusted("exec-test"), target);

        StepResult result = adapter.execute(step(target, "check-migration"), ctx);

        assertThat(result.isFailure()).isTrue();
        assertThat(result.error().errorType()).isEqualTo(ErrorType.VALIDATION_ERROR);
        verify(tooling, never()).applyMigration(anyString());
    }

    @Test
    void failedMigration_keepsSnapshotInMessage() {
        RollbackTarget target = target(Map.of("target_migration", "20250801", "snapshot_tables", "orders"));
        when(tooling.dumpSnapshot(anyString(), anyList())).thenReturn(snapshot());
        doThrow(new DataAccessResourceFailureException("connection lost")).when(tooling).applyMigration("20250801");
        AdapterContext ctx = new AdapterContext(ExecutionId.ofTrusted("exec-test"), target);
        List<PlannedStep> steps = adapter.plan(target).steps();

        adapter.execute(steps.get(0), ctx);
        StepResult result = adapter.execute(steps.get(2), ctx);

        assertThat(result.isFailure()).isTrue();
        assertThat(result.isRetryable()).isTrue();
        assertThat(result.message()).contains("connection lost").contains("快照已保留")
                .contains("snapshot_id=snap1").contains("backup_snap1_orders");
    }

    @Test
    void plan_withoutSnapshotTables_stillSnapshotsAllTables() {
        RollbackTarget target = target(Map.of("target_migration", "20250801"));

        List<PlannedStep> steps = adapter.plan(target).steps();

        assertThat(steps).extracting(PlannedStep::name)
                .containsExactly("create-snapshot", "check-migration", "apply-migration", "verify-migration");
        List<String> tables = steps.get(0).param("tables");
        assertThat(tables).isEmpty();

        when(tooling.dumpSnapshot("pre_rollback_20250801", List.of())).thenReturn(snapshot());
        StepResult result = adapter.execute(steps.get(0),
                new AdapterContext(ExecutionId.ofTrusted("exec-test"), target));
        assertThat(result.isSuccess()).isTrue();
        verify(tooling).dumpSnapshot("pre_rollback_20250801", List.of());
    }

    @Test
    void restoreSnapshot_bySnapshotId_delegatesToTooling() {
        adapter.restoreSnapshot("snap1");

        verify(tooling).restoreSnapshot("snap1");
    }

    @Test
    void verifyMigration_mismatchIsFatal() {
        RollbackTarget target = target(Map.of("target_migration", "20250801"));
        when(tooling.currentMigration()).thenReturn("20250805");

        StepResult result = adapter.execute(step(target, "verify-migration"),
                new AdapterContext(ExecutionId.ofTrusted("exec-test"), target));

        assertThat(result.isFailure()).isTrue();
        assertThat(result.isRetryable()).isFalse();
        assertThat(result.message()).contains("期望 20250801").contains("实际 20250805");
        assertThat(adapter.verify(target).status()).isEqualTo(HealthStatus.CRITICAL);
    }

    @Test
    void validate_requiresTargetMigration() {
        assertThat(adapter.validate(target(Map.of()))).containsExactly("缺少必填参数 target_migration");
    }
}
