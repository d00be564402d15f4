package xyz.firestige.rollback.domain.shared.vo;

import java.util.Objects;
import java.util.UUID;

/**
 * ExecutionId 值对象
 * <p>
 * 格式规则：rb-{deploymentId}-{timestamp}-{random}
 * 示例：rb-deploy-123-1700000000000-3f9a1c
 */
public final class ExecutionId {

    private static final String PREFIX = "rb-";

    private final String value;

    private ExecutionId(String value) {
        this.value = value;
    }

    /**
     * 为指定部署生成新的 ExecutionId
     */
    public static ExecutionId generate(DeploymentId deploymentId) {
        String random = UUID.randomUUID().toString().replace("-", "").substring(0, 6);
        return new ExecutionId(PREFIX + deploymentId.getValue() + "-" + System.currentTimeMillis() + "-" + random);
    }

    /**
     * 创建 ExecutionId（带验证）
     *
     * @throws IllegalArgumentException 如果格式无效
     */
    public static ExecutionId of(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Execution ID 不能为空");
        }
        if (!value.startsWith(PREFIX)) {
            throw new IllegalArgumentException(
                String.format("Execution ID 格式无效，必须以 '%s' 开头: %s", PREFIX, value)
            );
        }
        return new ExecutionId(value);
    }

    public static ExecutionId ofTrusted(String value) {
        return new ExecutionId(value);
    }

    public String getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ExecutionId that = (ExecutionId) o;
        return Objects.equals(value, that.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(value);
    }

    @Override
    public String toString() {
        return value;
    }
}
