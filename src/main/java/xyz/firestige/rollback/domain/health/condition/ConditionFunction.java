package xyz.firestige.rollback.domain.health.condition;

import java.util.Arrays;
import java.util.Collection;

/**
 * 条件函数注册表（封闭集合）
 * <p>
 * 规则条件只能引用这里列出的函数，不支持任意表达式求值
 */
public enum ConditionFunction {

    /**
     * service 最近 window 个样本中的失败数
     */
    FAILURE_COUNT("failure_count") {
        @Override
        public double apply(MetricQuery query, ConditionArguments args) {
            return query.getFailureCount(args.service(), args.window());
        }

        @Override
        public void validate(ConditionArguments args) {
            requireService(args);
        }
    },

    /**
     * service 最近一次检查的数值（无样本时为 NaN，任何比较都不成立）
     */
    LATEST_VALUE("latest_value") {
        @Override
        public double apply(MetricQuery query, ConditionArguments args) {
            return query.getLatestValue(args.service(), args.checkType()).orElse(Double.NaN);
        }

        @Override
        public void validate(ConditionArguments args) {
            requireService(args);
        }
    },

    /**
     * 最近 window 个样本中存在失败的服务数量
     */
    FAILING_SERVICES("failing_services") {
        @Override
        public double apply(MetricQuery query, ConditionArguments args) {
            Collection<String> scope = args.services().isEmpty() ? query.getServices() : args.services();
            return scope.stream()
                    .filter(service -> query.getFailureCount(service, args.window()) > 0)
                    .count();
        }
    };

    private final String code;

    ConditionFunction(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    public abstract double apply(MetricQuery query, ConditionArguments args);

    /**
     * 配置加载时校验参数
     *
     * @throws IllegalArgumentException 参数缺失
     */
    public void validate(ConditionArguments args) {
    }

    private static void requireService(ConditionArguments args) {
        if (args.service() == null || args.service().isBlank()) {
            throw new IllegalArgumentException("条件函数缺少 service 参数");
        }
    }

    public static ConditionFunction fromCode(String code) {
        return Arrays.stream(values())
                .filter(f -> f.code.equalsIgnoreCase(code) || f.name().equalsIgnoreCase(code))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("未注册的条件函数: " + code));
    }
}
