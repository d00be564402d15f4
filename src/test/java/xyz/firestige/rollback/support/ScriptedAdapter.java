package xyz.firestige.rollback.support;

import xyz.firestige.rollback.domain.execution.RollbackStrategy;
import xyz.firestige.rollback.domain.execution.RollbackTarget;
import xyz.firestige.rollback.domain.execution.ServiceType;
import xyz.firestige.rollback.domain.health.HealthStatus;
import xyz.firestige.rollback.domain.shared.exception.ErrorType;
import xyz.firestige.rollback.infrastructure.adapter.AdapterContext;
import xyz.firestige.rollback.infrastructure.adapter.AdapterError;
import xyz.firestige.rollback.infrastructure.adapter.HealthSignal;
import xyz.firestige.rollback.infrastructure.adapter.PlannedStep;
import xyz.firestige.rollback.infrastructure.adapter.PlannedSteps;
import xyz.firestige.rollback.infrastructure.adapter.StepResult;
import xyz.firestige.rollback.infrastructure.adapter.TargetAdapter;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * 按脚本返回结果的适配器，用于驱动器和编排器测试
 * <p>
 * 未配置脚本的步骤默认成功；脚本用尽后重复最后一个结果
 */
public class ScriptedAdapter implements TargetAdapter {

    private final ServiceType serviceType;
    private final List<String> stepNames;
    private final Map<String, Deque<Supplier<StepResult>>> scripts = new ConcurrentHashMap<>();
    private final Map<String, CountDownLatch> gates = new ConcurrentHashMap<>();
    private final Set<String> invalidTargets = ConcurrentHashMap.newKeySet();
    private final Set<String> failingPlans = ConcurrentHashMap.newKeySet();
    private final List<String> executed = new CopyOnWriteArrayList<>();
    private final CountDownLatch anyStepStarted = new CountDownLatch(1);
    private volatile HealthStatus verifyStatus = HealthStatus.HEALTHY;

    public ScriptedAdapter(ServiceType serviceType, String... stepNames) {
        this.serviceType = serviceType;
        this.stepNames = List.of(stepNames);
    }

    public static StepResult retryableFailure(String reason) {
        return StepResult.failure(AdapterError.retryable("scripted", reason, ErrorType.NETWORK_ERROR));
    }

    public static StepResult fatalFailure(String reason) {
        return StepResult.failure(AdapterError.fatal("scripted", reason, ErrorType.BUSINESS_ERROR));
    }

    /**
     * 为 target/step 配置依次返回的结果
     */
    public ScriptedAdapter script(String targetName, String stepName, StepResult... results) {
        Deque<Supplier<StepResult>> queue = scripts.computeIfAbsent(key(targetName, stepName), k -> new ArrayDeque<>());
        for (StepResult result : results) {
            queue.add(() -> result);
        }
        return this;
    }

    public ScriptedAdapter scriptSupplier(String targetName, String stepName, Supplier<StepResult> supplier) {
        scripts.computeIfAbsent(key(targetName, stepName), k -> new ArrayDeque<>()).add(supplier);
        return this;
    }

    /**
     * 步骤执行到 target/step 时阻塞，直到返回的 latch 被释放
     */
    public CountDownLatch gate(String targetName, String stepName) {
        CountDownLatch latch = new CountDownLatch(1);
        gates.put(key(targetName, stepName), latch);
        return latch;
    }

    public ScriptedAdapter rejectTarget(String targetName) {
        invalidTargets.add(targetName);
        return this;
    }

    public ScriptedAdapter failPlan(String targetName) {
        failingPlans.add(targetName);
        return this;
    }

    public ScriptedAdapter verifyAs(HealthStatus status) {
        this.verifyStatus = status;
        return this;
    }

    public List<String> executed() {
        return List.copyOf(executed);
    }

    public boolean awaitFirstStep(long timeout, TimeUnit unit) throws InterruptedException {
        return anyStepStarted.await(timeout, unit);
    }

    @Override
    public ServiceType getServiceType() {
        return serviceType;
    }

    @Override
    public Set<RollbackStrategy> supportedStrategies() {
        return EnumSet.allOf(RollbackStrategy.class);
    }

    @Override
    public List<String> validate(RollbackTarget target) {
        return invalidTargets.contains(target.name()) ? List.of("脚本拒绝的目标") : List.of();
    }

    @Override
    public PlannedSteps plan(RollbackTarget target) {
        if (failingPlans.contains(target.name())) {
            return PlannedSteps.failed(AdapterError.fatal(target.name(), "计划失败", ErrorType.BUSINESS_ERROR));
        }
        return PlannedSteps.of(stepNames.stream().map(PlannedStep::of).toList());
    }

    @Override
    public StepResult execute(PlannedStep step, AdapterContext context) {
        String key = key(context.getTarget().name(), step.name());
        executed.add(key);
        anyStepStarted.countDown();
        CountDownLatch gate = gates.get(key);
        if (gate != null) {
            try {
                gate.await(10, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        Deque<Supplier<StepResult>> queue = scripts.get(key);
        if (queue == null || queue.isEmpty()) {
            return StepResult.success(step.name() + " ok");
        }
        synchronized (queue) {
            Supplier<StepResult> next = queue.size() > 1 ? queue.poll() : queue.peek();
            return next.get();
        }
    }

    @Override
    public HealthSignal verify(RollbackTarget target) {
        return new HealthSignal(target.name(), verifyStatus, "scripted " + verifyStatus.getCode());
    }

    private static String key(String targetName, String stepName) {
        return targetName + "/" + stepName;
    }
}
