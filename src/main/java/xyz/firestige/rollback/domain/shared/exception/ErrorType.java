package xyz.firestige.rollback.domain.shared.exception;

/**
 * 错误类型枚举
 * 用于分类回滚步骤、健康检查和引擎内部的错误，便于错误处理和监控
 */
public enum ErrorType {

    /**
     * 数据校验错误（目标/策略组合不合法、参数缺失）
     */
    VALIDATION_ERROR("校验错误", false),

    /**
     * 网络错误
     */
    NETWORK_ERROR("网络错误", true),

    /**
     * 超时错误
     */
    TIMEOUT_ERROR("超时错误", true),

    /**
     * 服务不可用
     */
    SERVICE_UNAVAILABLE("服务不可用", true),

    /**
     * 业务错误（目标迁移版本不存在、找不到上一个稳定版本等）
     */
    BUSINESS_ERROR("业务错误", false),

    /**
     * 健康校验失败
     */
    VERIFICATION_ERROR("健康校验失败", false),

    /**
     * 系统错误
     */
    SYSTEM_ERROR("系统错误", false),

    /**
     * 未知错误
     */
    UNKNOWN_ERROR("未知错误", false);

    private final String description;
    private final boolean retryableByDefault;

    ErrorType(String description, boolean retryableByDefault) {
        this.description = description;
        this.retryableByDefault = retryableByDefault;
    }

    public String getDescription() {
        return description;
    }

    public boolean isRetryableByDefault() {
        return retryableByDefault;
    }
}
