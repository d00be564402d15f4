package xyz.firestige.rollback.infrastructure.adapter;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import xyz.firestige.rollback.domain.execution.RollbackTarget;
import xyz.firestige.rollback.domain.execution.ServiceType;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 适配器注册表：ServiceType → TargetAdapter
 */
public class AdapterRegistry {

    private static final Logger log = LoggerFactory.getLogger(AdapterRegistry.class);

    private final Map<ServiceType, TargetAdapter> adapters = new EnumMap<>(ServiceType.class);

    public AdapterRegistry(List<TargetAdapter> adapters) {
        for (TargetAdapter adapter : adapters) {
            TargetAdapter previous = this.adapters.put(adapter.getServiceType(), adapter);
            if (previous != null) {
                log.warn("服务类型 {} 的适配器被覆盖: {} -> {}", adapter.getServiceType(),
                        previous.getClass().getSimpleName(), adapter.getClass().getSimpleName());
            }
        }
        log.info("已注册回滚适配器: {}", this.adapters.keySet());
    }

    public Optional<TargetAdapter> find(ServiceType service) {
        return Optional.ofNullable(adapters.get(service));
    }

    public TargetAdapter require(ServiceType service) {
        return find(service).orElseThrow(() ->
                new IllegalStateException("没有注册服务类型的适配器: " + service.getCode()));
    }

    /**
     * 校验目标：适配器存在、策略受支持、options 合法
     *
     * @return 错误列表，为空表示通过
     */
    public List<String> validate(RollbackTarget target) {
        List<String> errors = new ArrayList<>();
        TargetAdapter adapter = adapters.get(target.service());
        if (adapter == null) {
            errors.add(String.format("目标 %s: 不支持的服务类型 %s", target.name(), target.service().getCode()));
            return errors;
        }
        if (!adapter.supports(target.strategy())) {
            errors.add(String.format("目标 %s: 服务 %s 不支持策略 %s，支持的策略: %s",
                    target.name(), target.service().getCode(), target.strategy().getCode(),
                    adapter.supportedStrategies()));
            return errors;
        }
        for (String error : adapter.validate(target)) {
            errors.add("目标 " + target.name() + ": " + error);
        }
        return errors;
    }
}
