package xyz.firestige.rollback.infrastructure.external;

import java.util.Optional;

/**
 * 版本登记：查询服务在某平台上的上一个稳定版本
 */
public interface VersionRegistry {

    Optional<String> previousStableVersion(String service, String platform);
}
