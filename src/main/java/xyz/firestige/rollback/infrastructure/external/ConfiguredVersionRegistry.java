package xyz.firestige.rollback.infrastructure.external;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 基于配置的版本登记（内存）
 * <p>
 * key 格式：{service}.{platform}，例如 frontend.web
 */
public class ConfiguredVersionRegistry implements VersionRegistry {

    private final Map<String, String> versions = new ConcurrentHashMap<>();

    public ConfiguredVersionRegistry(Map<String, String> seed) {
        if (seed != null) {
            versions.putAll(seed);
        }
    }

    @Override
    public Optional<String> previousStableVersion(String service, String platform) {
        return Optional.ofNullable(versions.get(key(service, platform)));
    }

    /**
     * 登记稳定版本（部署成功后由外部调用）
     */
    public void register(String service, String platform, String version) {
        versions.put(key(service, platform), version);
    }

    private static String key(String service, String platform) {
        return service + "." + platform;
    }
}
