package xyz.firestige.rollback.infrastructure.external;

/**
 * 应用商店发布元数据客户端（android / ios）
 */
public interface AppReleaseClient {

    /**
     * 更新回滚元数据（例如暂停分阶段发布、标记回退版本）
     */
    void updateRollbackMetadata(String platform, String version, String environment);
}
