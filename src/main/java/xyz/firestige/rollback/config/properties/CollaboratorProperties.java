package xyz.firestige.rollback.config.properties;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;
import xyz.firestige.rollback.infrastructure.external.jdbc.MigrationDefinition;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 外部协作方配置属性
 * prefix: rollback.collaborators
 * 包含 部署平台 / CDN / 应用商店 / 通知 / 日志保全 / 数据库迁移 / 版本登记
 */
@ConfigurationProperties(prefix = "rollback.collaborators")
@Validated
public class CollaboratorProperties {

    /** 部署平台 API 地址 */
    private String platformBaseUrl = "http://localhost:8081";
    /** CDN / 静态资源存储 API 地址 */
    private String cdnBaseUrl = "http://localhost:8082";
    /** 应用商店发布元数据 API 地址 */
    private String appReleaseBaseUrl = "http://localhost:8083";

    /** 外部调用的连接/读取超时 */
    @NotNull
    private Duration requestTimeout = Duration.ofSeconds(10);

    /** 通知渠道 → webhook 地址 */
    private Map<String, String> notificationWebhooks = new HashMap<>();

    @NotBlank
    private String logSourceDir = "logs";
    @NotBlank
    private String logArchiveDir = "preserved_logs";

    /** 基线迁移版本（没有任何已应用版本时的当前版本） */
    @NotBlank
    private String baselineMigration = "0";
    /** 迁移目录：版本 → 逆向脚本 */
    private List<MigrationDefinition> migrations = new ArrayList<>();
    /** 快照保留时间 */
    @NotNull
    private Duration snapshotRetention = Duration.ofDays(7);

    /** 版本登记初始数据 "service.platform" → version */
    private Map<String, String> stableVersions = new HashMap<>();

    /** 生产环境名称（移动端商店回滚在生产环境需人工操作） */
    @NotBlank
    private String productionEnvironment = "production";

    public String getPlatformBaseUrl() { return platformBaseUrl; }
    public void setPlatformBaseUrl(String platformBaseUrl) { this.platformBaseUrl = platformBaseUrl; }

    public String getCdnBaseUrl() { return cdnBaseUrl; }
    public void setCdnBaseUrl(String cdnBaseUrl) { this.cdnBaseUrl = cdnBaseUrl; }

    public String getAppReleaseBaseUrl() { return appReleaseBaseUrl; }
    public void setAppReleaseBaseUrl(String appReleaseBaseUrl) { this.appReleaseBaseUrl = appReleaseBaseUrl; }

    public Duration getRequestTimeout() { return requestTimeout; }
    public void setRequestTimeout(Duration requestTimeout) { this.requestTimeout = requestTimeout; }

    public Map<String, String> getNotificationWebhooks() { return notificationWebhooks; }
    public void setNotificationWebhooks(Map<String, String> notificationWebhooks) { this.notificationWebhooks = notificationWebhooks; }

    public String getLogSourceDir() { return logSourceDir; }
    public void setLogSourceDir(String logSourceDir) { this.logSourceDir = logSourceDir; }

    public String getLogArchiveDir() { return logArchiveDir; }
    public void setLogArchiveDir(String logArchiveDir) { this.logArchiveDir = logArchiveDir; }

    public String getBaselineMigration() { return baselineMigration; }
    public void setBaselineMigration(String baselineMigration) { this.baselineMigration = baselineMigration; }

    public List<MigrationDefinition> getMigrations() { return migrations; }
    public void setMigrations(List<MigrationDefinition> migrations) { this.migrations = migrations; }

    public Duration getSnapshotRetention() { return snapshotRetention; }
    public void setSnapshotRetention(Duration snapshotRetention) { this.snapshotRetention = snapshotRetention; }

    public Map<String, String> getStableVersions() { return stableVersions; }
    public void setStableVersions(Map<String, String> stableVersions) { this.stableVersions = stableVersions; }

    public String getProductionEnvironment() { return productionEnvironment; }
    public void setProductionEnvironment(String productionEnvironment) { this.productionEnvironment = productionEnvironment; }
}
