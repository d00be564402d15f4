package xyz.firestige.rollback.domain.shared.vo;

import java.util.Objects;

/**
 * DeploymentId 值对象
 * <p>
 * 回滚互斥的粒度：同一 deploymentId 任意时刻只允许一个非终态的回滚执行
 */
public final class DeploymentId {

    private final String value;

    private DeploymentId(String value) {
        this.value = value;
    }

    /**
     * 创建 DeploymentId（带验证）
     *
     * @throws IllegalArgumentException 如果为空
     */
    public static DeploymentId of(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Deployment ID 不能为空");
        }
        return new DeploymentId(value.trim());
    }

    /**
     * 创建 DeploymentId（不验证，用于已知合法的场景，例如反序列化）
     */
    public static DeploymentId ofTrusted(String value) {
        return new DeploymentId(value);
    }

    public String getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        DeploymentId that = (DeploymentId) o;
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
