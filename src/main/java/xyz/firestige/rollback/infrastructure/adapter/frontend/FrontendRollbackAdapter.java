package xyz.firestige.rollback.infrastructure.adapter.frontend;

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
import xyz.firestige.rollback.infrastructure.external.AppReleaseClient;
import xyz.firestige.rollback.infrastructure.external.CdnClient;
import xyz.firestige.rollback.infrastructure.external.HttpHealthClient;
import xyz.firestige.rollback.infrastructure.external.HttpProbeResponse;
import xyz.firestige.rollback.infrastructure.external.VersionRegistry;

import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * 前端多平台回滚适配器
 * <p>
 * 每个平台先从版本登记查询上一个稳定版本：
 * - web：将 releases/{version}/ 同步到 current/，再刷新 CDN 缓存
 * - android / ios：更新应用商店回滚元数据；生产环境需要人工操作，步骤以不可重试错误失败
 * 最后依次校验 health_check_urls
 */
public class FrontendRollbackAdapter extends AbstractTargetAdapter {

    public static final String OPT_PLATFORMS = "platforms";
    public static final String OPT_SERVICE_NAME = "service_name";
    public static final String OPT_CDN_PATHS = "cdn_paths";
    public static final String OPT_HEALTH_CHECK_URLS = "health_check_urls";
    public static final String OPT_RELEASE_PREFIX = "release_prefix";
    public static final String OPT_CURRENT_PREFIX = "current_prefix";

    static final String PLATFORM_WEB = "web";
    static final Set<String> MOBILE_PLATFORMS = Set.of("android", "ios");

    static final String RESTORE_WEB_ASSETS = "restore-web-assets";
    static final String INVALIDATE_CDN = "invalidate-cdn";
    static final String UPDATE_APP_RELEASE = "update-app-release";
    static final String VALIDATE_HEALTH_URLS = "validate-health-urls";

    private static final Duration HEALTH_TIMEOUT = Duration.ofSeconds(10);

    private final VersionRegistry versionRegistry;
    private final CdnClient cdnClient;
    private final AppReleaseClient appReleaseClient;
    private final HttpHealthClient healthClient;
    private final String productionEnvironment;

    public FrontendRollbackAdapter(VersionRegistry versionRegistry, CdnClient cdnClient,
                                   AppReleaseClient appReleaseClient, HttpHealthClient healthClient,
                                   String productionEnvironment) {
        this.versionRegistry = versionRegistry;
        this.cdnClient = cdnClient;
        this.appReleaseClient = appReleaseClient;
        this.healthClient = healthClient;
        this.productionEnvironment = productionEnvironment;
    }

    @Override
    public ServiceType getServiceType() {
        return ServiceType.FRONTEND;
    }

    @Override
    public Set<RollbackStrategy> supportedStrategies() {
        return EnumSet.of(RollbackStrategy.FRONTEND_MULTI_PLATFORM, RollbackStrategy.IMMEDIATE);
    }

    @Override
    public List<String> validate(RollbackTarget target) {
        List<String> errors = new ArrayList<>();
        for (String platform : platforms(target)) {
            if (!PLATFORM_WEB.equals(platform) && !MOBILE_PLATFORMS.contains(platform)) {
                errors.add("不支持的平台 " + platform);
            }
        }
        return errors;
    }

    private static List<String> platforms(RollbackTarget target) {
        List<String> platforms = target.getStringList(OPT_PLATFORMS);
        return platforms.isEmpty() ? List.of(PLATFORM_WEB) : platforms;
    }

    @Override
    public PlannedSteps plan(RollbackTarget target) {
        List<PlannedStep> steps = new ArrayList<>();
        for (String platform : platforms(target)) {
            if (PLATFORM_WEB.equals(platform)) {
                steps.add(PlannedStep.of(RESTORE_WEB_ASSETS, RESTORE_WEB_ASSETS, Map.of("platform", platform)));
                List<String> paths = target.getStringList(OPT_CDN_PATHS);
                steps.add(PlannedStep.of(INVALIDATE_CDN, INVALIDATE_CDN,
                        Map.of("paths", paths.isEmpty() ? List.of("/*") : paths)));
            } else {
                steps.add(PlannedStep.of(UPDATE_APP_RELEASE + "-" + platform, UPDATE_APP_RELEASE,
                        Map.of("platform", platform)));
            }
        }
        List<String> urls = target.getStringList(OPT_HEALTH_CHECK_URLS);
        if (!urls.isEmpty()) {
            steps.add(PlannedStep.of(VALIDATE_HEALTH_URLS, VALIDATE_HEALTH_URLS, Map.of("urls", urls)));
        }
        return PlannedSteps.of(steps);
    }

    @Override
    protected StepResult doExecute(PlannedStep step, AdapterContext context) {
        RollbackTarget target = context.getTarget();
        return switch (step.action()) {
            case RESTORE_WEB_ASSETS -> restoreWeb(target, context);
            case INVALIDATE_CDN -> {
                List<String> paths = step.param("paths");
                cdnClient.invalidate(paths);
                yield StepResult.success("CDN 缓存已刷新: " + paths);
            }
            case UPDATE_APP_RELEASE -> updateAppRelease(target, step.param("platform"));
            case VALIDATE_HEALTH_URLS -> validateUrls(target, step.param("urls"));
            default -> unknownAction(step, context);
        };
    }

    private StepResult restoreWeb(RollbackTarget target, AdapterContext context) {
        Optional<String> version = resolveVersion(target, PLATFORM_WEB);
        if (version.isEmpty()) {
            return missingVersion(target, PLATFORM_WEB);
        }
        String releasePrefix = target.getString(OPT_RELEASE_PREFIX, "releases/");
        String currentPrefix = target.getString(OPT_CURRENT_PREFIX, "current/");
        cdnClient.sync(releasePrefix + version.get() + "/", currentPrefix);
        context.put("web.version", version.get());
        return StepResult.success("web 已恢复到版本 " + version.get());
    }

    private StepResult updateAppRelease(RollbackTarget target, String platform) {
        Optional<String> version = resolveVersion(target, platform);
        if (version.isEmpty()) {
            return missingVersion(target, platform);
        }
        if (productionEnvironment != null && productionEnvironment.equals(target.environment())) {
            return StepResult.failure(AdapterError.fatal(target.name(),
                    String.format("%s 生产环境回滚需要在应用商店人工操作，目标版本 %s", platform, version.get()),
                    ErrorType.BUSINESS_ERROR));
        }
        appReleaseClient.updateRollbackMetadata(platform, version.get(), target.environment());
        return StepResult.success(platform + " 回滚元数据已更新，版本 " + version.get());
    }

    private StepResult validateUrls(RollbackTarget target, List<String> urls) {
        List<String> failures = probeAll(urls);
        if (failures.isEmpty()) {
            return StepResult.success("健康检查地址全部通过: " + urls.size());
        }
        return StepResult.failure(AdapterError.fatal(target.name(),
                "前端健康检查失败: " + String.join("; ", failures), ErrorType.VERIFICATION_ERROR));
    }

    private List<String> probeAll(List<String> urls) {
        List<String> failures = new ArrayList<>();
        for (String url : urls) {
            try {
                HttpProbeResponse response = healthClient.check(url, HEALTH_TIMEOUT);
                if (response.statusCode() < 200 || response.statusCode() >= 300) {
                    failures.add(url + " 返回 " + response.statusCode());
                }
            } catch (Exception e) {
                failures.add(url + " 请求失败: " + e.getMessage());
            }
        }
        return failures;
    }

    private Optional<String> resolveVersion(RollbackTarget target, String platform) {
        return versionRegistry.previousStableVersion(target.getString(OPT_SERVICE_NAME, target.name()), platform);
    }

    private static StepResult missingVersion(RollbackTarget target, String platform) {
        return StepResult.failure(AdapterError.fatal(target.name(),
                "找不到 " + platform + " 平台的上一个稳定版本", ErrorType.BUSINESS_ERROR));
    }

    @Override
    public HealthSignal verify(RollbackTarget target) {
        List<String> urls = target.getStringList(OPT_HEALTH_CHECK_URLS);
        if (urls.isEmpty()) {
            return HealthSignal.healthy(target.name(), "未配置健康检查地址，跳过自检");
        }
        List<String> failures = probeAll(urls);
        return failures.isEmpty()
                ? HealthSignal.healthy(target.name(), "健康检查通过")
                : HealthSignal.critical(target.name(), String.join("; ", failures));
    }
}
