package xyz.firestige.rollback.infrastructure.adapter.backend;

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
import xyz.firestige.rollback.infrastructure.external.DeploymentPlatformClient;
import xyz.firestige.rollback.infrastructure.external.HttpHealthClient;
import xyz.firestige.rollback.infrastructure.external.HttpProbeResponse;

import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.TimeUnit;

/**
 * 后端服务回滚适配器
 * <p>
 * blue_green：切换流量到稳定环境 → 校验健康 →（可选）下线失败环境。
 * 健康校验不通过时步骤失败，失败环境保留用于排查。
 * <p>
 * rolling：按 batch_size 分批替换实例，每批之后等待 batch_delay_seconds 并做健康检查；
 * 任一批次健康检查失败即终止剩余批次。
 * <p>
 * immediate：一次性替换全部实例。
 */
public class BackendRollbackAdapter extends AbstractTargetAdapter {

    public static final String OPT_TARGET_ENVIRONMENT = "target_environment";
    public static final String OPT_FAILED_ENVIRONMENT = "failed_environment";
    public static final String OPT_TARGET_VERSION = "target_version";
    public static final String OPT_SERVICE_NAME = "service_name";
    public static final String OPT_HEALTH_CHECK_URL = "health_check_url";
    public static final String OPT_EXPECTED_STATUS = "expected_status";
    public static final String OPT_HEALTH_CHECK_TIMEOUT = "health_check_timeout_seconds";
    public static final String OPT_PRESERVE_FAILED_ENVIRONMENT = "preserve_failed_environment";
    public static final String OPT_BATCH_SIZE = "batch_size";
    public static final String OPT_BATCH_DELAY = "batch_delay_seconds";

    static final String SWITCH_TRAFFIC = "switch-traffic";
    static final String VALIDATE_HEALTH = "validate-health";
    static final String TEARDOWN_ENVIRONMENT = "teardown-environment";
    static final String REPLACE_BATCH = "replace-batch";
    static final String HEALTH_CHECK_BATCH = "health-check-batch";

    private static final int DEFAULT_BATCH_SIZE = 2;
    private static final int DEFAULT_BATCH_DELAY_SECONDS = 30;

    private final DeploymentPlatformClient platform;
    private final HttpHealthClient healthClient;

    public BackendRollbackAdapter(DeploymentPlatformClient platform, HttpHealthClient healthClient) {
        this.platform = platform;
        this.healthClient = healthClient;
    }

    @Override
    public ServiceType getServiceType() {
        return ServiceType.BACKEND;
    }

    @Override
    public Set<RollbackStrategy> supportedStrategies() {
        return EnumSet.of(RollbackStrategy.BLUE_GREEN, RollbackStrategy.ROLLING, RollbackStrategy.IMMEDIATE);
    }

    @Override
    public List<String> validate(RollbackTarget target) {
        List<String> errors = new ArrayList<>();
        switch (target.strategy()) {
            case BLUE_GREEN -> {
                requireOption(target, OPT_TARGET_ENVIRONMENT, errors);
                requireOption(target, OPT_HEALTH_CHECK_URL, errors);
            }
            case ROLLING -> {
                requireOption(target, OPT_TARGET_VERSION, errors);
                requireOption(target, OPT_HEALTH_CHECK_URL, errors);
                requirePositiveInt(target, OPT_BATCH_SIZE, errors);
                requireNonNegativeInt(target, OPT_BATCH_DELAY, errors);
            }
            case IMMEDIATE -> requireOption(target, OPT_TARGET_VERSION, errors);
            default -> errors.add("不支持的策略 " + target.strategy().getCode());
        }
        requirePositiveInt(target, OPT_EXPECTED_STATUS, errors);
        requirePositiveInt(target, OPT_HEALTH_CHECK_TIMEOUT, errors);
        return errors;
    }

    @Override
    public PlannedSteps plan(RollbackTarget target) {
        return switch (target.strategy()) {
            case BLUE_GREEN -> planBlueGreen(target);
            case ROLLING, IMMEDIATE -> planInstanceReplacement(target);
            default -> PlannedSteps.failed(AdapterError.fatal(target.name(),
                    "不支持的策略 " + target.strategy().getCode(), ErrorType.VALIDATION_ERROR));
        };
    }

    private PlannedSteps planBlueGreen(RollbackTarget target) {
        List<PlannedStep> steps = new ArrayList<>();
        steps.add(PlannedStep.of(SWITCH_TRAFFIC, SWITCH_TRAFFIC, Map.of(
                "environment", target.getString(OPT_TARGET_ENVIRONMENT),
                "version", target.getString(OPT_TARGET_VERSION, ""))));
        steps.add(PlannedStep.of(VALIDATE_HEALTH, VALIDATE_HEALTH, Map.of(
                "url", target.getString(OPT_HEALTH_CHECK_URL))));
        boolean preserve = target.getBoolean(OPT_PRESERVE_FAILED_ENVIRONMENT, true);
        if (!preserve && target.hasOption(OPT_FAILED_ENVIRONMENT)) {
            steps.add(PlannedStep.of(TEARDOWN_ENVIRONMENT, TEARDOWN_ENVIRONMENT, Map.of(
                    "environment", target.getString(OPT_FAILED_ENVIRONMENT))));
        }
        return PlannedSteps.of(steps);
    }

    private PlannedSteps planInstanceReplacement(RollbackTarget target) {
        String serviceName = target.getString(OPT_SERVICE_NAME, target.name());
        List<String> instances;
        try {
            instances = platform.listInstances(serviceName);
        } catch (Exception e) {
            log.warn("列出实例失败: {}, target: {}", serviceName, target.name(), e);
            return PlannedSteps.failed(AdapterError.fromException(target.name(), "list-instances", e));
        }
        if (instances == null || instances.isEmpty()) {
            return PlannedSteps.failed(AdapterError.fatal(target.name(),
                    "服务没有可替换的实例: " + serviceName, ErrorType.BUSINESS_ERROR));
        }

        String version = target.getString(OPT_TARGET_VERSION);
        int batchSize = target.strategy() == RollbackStrategy.IMMEDIATE
                ? instances.size()
                : target.getInt(OPT_BATCH_SIZE, DEFAULT_BATCH_SIZE);
        int delaySeconds = target.strategy() == RollbackStrategy.IMMEDIATE
                ? 0
                : target.getInt(OPT_BATCH_DELAY, DEFAULT_BATCH_DELAY_SECONDS);
        String url = target.getString(OPT_HEALTH_CHECK_URL);

        List<PlannedStep> steps = new ArrayList<>();
        int batch = 0;
        for (int from = 0; from < instances.size(); from += batchSize) {
            batch++;
            List<String> batchInstances = List.copyOf(instances.subList(from, Math.min(from + batchSize, instances.size())));
            steps.add(PlannedStep.of(REPLACE_BATCH + "-" + batch, REPLACE_BATCH, Map.of(
                    "batch", batch, "instances", batchInstances, "version", version)));
            if (url != null && !url.isBlank()) {
                steps.add(PlannedStep.of(HEALTH_CHECK_BATCH + "-" + batch, HEALTH_CHECK_BATCH, Map.of(
                        "batch", batch, "url", url, "delaySeconds", delaySeconds)));
            }
        }
        log.info("滚动回滚计划: target: {}, 实例数: {}, 批次数: {}", target.name(), instances.size(), batch);
        return PlannedSteps.of(steps);
    }

    @Override
    protected StepResult doExecute(PlannedStep step, AdapterContext context) throws Exception {
        RollbackTarget target = context.getTarget();
        return switch (step.action()) {
            case SWITCH_TRAFFIC -> {
                String environment = step.param("environment");
                platform.switchTraffic(environment, step.param("version"));
                yield StepResult.success("流量已切换到 " + environment);
            }
            case VALIDATE_HEALTH -> validateAfterSwitch(step, target);
            case TEARDOWN_ENVIRONMENT -> {
                String environment = step.param("environment");
                platform.teardownEnvironment(environment);
                yield StepResult.success("已下线环境 " + environment);
            }
            case REPLACE_BATCH -> {
                List<String> instances = step.param("instances");
                int batch = step.param("batch");
                for (String instance : instances) {
                    platform.replaceInstance(instance, step.param("version"));
                }
                yield StepResult.success(String.format("第 %d 批实例已替换: %s", batch, instances));
            }
            case HEALTH_CHECK_BATCH -> checkBatch(step, target);
            default -> unknownAction(step, context);
        };
    }

    private StepResult validateAfterSwitch(PlannedStep step, RollbackTarget target) {
        String url = step.param("url");
        String failure = probe(target, url);
        if (failure == null) {
            return StepResult.success("切换后健康校验通过: " + url);
        }
        String failedEnv = target.getString(OPT_FAILED_ENVIRONMENT, "unknown");
        return StepResult.failure(AdapterError.fatal(target.name(),
                String.format("切换后健康校验失败: %s，失败环境 %s 已保留", failure, failedEnv),
                ErrorType.VERIFICATION_ERROR));
    }

    private StepResult checkBatch(PlannedStep step, RollbackTarget target) throws InterruptedException {
        int delaySeconds = step.param("delaySeconds");
        int batch = step.param("batch");
        if (delaySeconds > 0) {
            TimeUnit.SECONDS.sleep(delaySeconds);
        }
        String failure = probe(target, step.param("url"));
        if (failure == null) {
            return StepResult.success(String.format("第 %d 批健康检查通过", batch));
        }
        return StepResult.failure(AdapterError.fatal(target.name(),
                String.format("第 %d 批健康检查失败，终止剩余批次: %s", batch, failure),
                ErrorType.VERIFICATION_ERROR));
    }

    /**
     * @return null 表示健康，否则为失败描述
     */
    private String probe(RollbackTarget target, String url) {
        int expected = target.getInt(OPT_EXPECTED_STATUS, 200);
        Duration timeout = Duration.ofSeconds(target.getInt(OPT_HEALTH_CHECK_TIMEOUT, 10));
        try {
            HttpProbeResponse response = healthClient.check(url, timeout);
            if (response.hasStatus(expected)) {
                return null;
            }
            return String.format("%s 返回 %d（期望 %d）", url, response.statusCode(), expected);
        } catch (Exception e) {
            return url + " 请求失败: " + e.getMessage();
        }
    }

    @Override
    public HealthSignal verify(RollbackTarget target) {
        String url = target.getString(OPT_HEALTH_CHECK_URL);
        if (url == null || url.isBlank()) {
            return HealthSignal.healthy(target.name(), "未配置健康检查地址，跳过自检");
        }
        String failure = probe(target, url);
        return failure == null
                ? HealthSignal.healthy(target.name(), "健康检查通过")
                : HealthSignal.critical(target.name(), failure);
    }
}
