package xyz.firestige.rollback.infrastructure.external;

import java.util.List;

/**
 * CDN / 静态资源存储客户端
 */
public interface CdnClient {

    void invalidate(List<String> paths);

    /**
     * 将 sourcePrefix 下的资源同步到 destPrefix
     */
    void sync(String sourcePrefix, String destPrefix);
}
