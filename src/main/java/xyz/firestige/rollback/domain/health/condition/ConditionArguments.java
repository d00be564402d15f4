package xyz.firestige.rollback.domain.health.condition;

import xyz.firestige.rollback.domain.health.CheckType;

import java.util.List;

/**
 * 条件函数参数
 *
 * @param service   目标服务（failure_count / latest_value 必填）
 * @param checkType latest_value 可选的检查类型过滤
 * @param window    failure_count 的样本窗口；failing_services 判定失败所看的样本数
 * @param services  failing_services 可选的服务范围，为空表示全部服务
 */
public record ConditionArguments(String service, CheckType checkType, int window, List<String> services) {

    public static final int DEFAULT_WINDOW = 5;

    public ConditionArguments {
        window = window > 0 ? window : DEFAULT_WINDOW;
        services = services == null ? List.of() : List.copyOf(services);
    }

    public static ConditionArguments forService(String service, int window) {
        return new ConditionArguments(service, null, window, List.of());
    }
}
