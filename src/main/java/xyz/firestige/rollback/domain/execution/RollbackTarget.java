package xyz.firestige.rollback.domain.execution;

import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * 回滚目标：(service, environment, strategy, options)
 * <p>
 * options 为策略相关配置，由对应的 TargetAdapter 校验。
 * name 用于在步骤记录和日志中区分同类型的多个目标，缺省为服务类型 code。
 */
public record RollbackTarget(
        String name,
        ServiceType service,
        String environment,
        RollbackStrategy strategy,
        Map<String, Object> options) {

    public RollbackTarget {
        Objects.requireNonNull(service, "service cannot be null");
        Objects.requireNonNull(strategy, "strategy cannot be null");
        if (name == null || name.isBlank()) {
            name = service.getCode();
        }
        options = options == null
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(options));
    }

    public static RollbackTarget of(ServiceType service, String environment, RollbackStrategy strategy,
                                    Map<String, Object> options) {
        return new RollbackTarget(null, service, environment, strategy, options);
    }

    public static RollbackTarget of(String name, ServiceType service, String environment, RollbackStrategy strategy,
                                    Map<String, Object> options) {
        return new RollbackTarget(name, service, environment, strategy, options);
    }

    // ========== options 读取 ==========

    public boolean hasOption(String key) {
        Object v = options.get(key);
        return v != null && !(v instanceof String s && s.isBlank());
    }

    public String getString(String key) {
        Object v = options.get(key);
        return v != null ? v.toString() : null;
    }

    public String getString(String key, String defaultValue) {
        String v = getString(key);
        return v != null && !v.isBlank() ? v : defaultValue;
    }

    public int getInt(String key, int defaultValue) {
        Object v = options.get(key);
        if (v instanceof Number n) {
            return n.intValue();
        }
        if (v instanceof String s && !s.isBlank()) {
            return Integer.parseInt(s.trim());
        }
        return defaultValue;
    }

    public boolean getBoolean(String key, boolean defaultValue) {
        Object v = options.get(key);
        if (v instanceof Boolean b) {
            return b;
        }
        if (v instanceof String s && !s.isBlank()) {
            return Boolean.parseBoolean(s.trim());
        }
        return defaultValue;
    }

    /**
     * 读取列表配置，兼容逗号分隔的字符串和 Spring 绑定出的 index map
     */
    public List<String> getStringList(String key) {
        Object v = options.get(key);
        if (v == null) {
            return List.of();
        }
        if (v instanceof Collection<?> c) {
            return c.stream().map(Object::toString).toList();
        }
        if (v instanceof Map<?, ?> m) {
            return m.values().stream().map(Object::toString).toList();
        }
        return Arrays.stream(v.toString().split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .toList();
    }

    @Override
    public String toString() {
        return name + "[" + service.getCode() + "/" + strategy.getCode()
                + (environment != null ? "@" + environment : "") + "]";
    }
}
