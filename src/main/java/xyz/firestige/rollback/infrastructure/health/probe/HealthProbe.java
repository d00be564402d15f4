package xyz.firestige.rollback.infrastructure.health.probe;

import xyz.firestige.rollback.domain.health.CheckType;
import xyz.firestige.rollback.domain.health.HealthCheckDefinition;
import xyz.firestige.rollback.domain.health.HealthCheckResult;

/**
 * 健康探测器
 * <p>
 * 探测失败是数据而不是异常：连接失败、超时都转换为 critical 结果返回
 */
public interface HealthProbe {

    CheckType getType();

    HealthCheckResult probe(HealthCheckDefinition check);
}
