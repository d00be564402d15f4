package xyz.firestige.rollback.infrastructure.resolver;

import xyz.firestige.rollback.domain.execution.RollbackTarget;
import xyz.firestige.rollback.domain.execution.ServiceType;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * 依赖解析器：计算安全的回滚执行顺序
 * <p>
 * 默认策略：database → backend → frontend → custom。
 * 同一服务类型之间没有顺序约束（可并发执行），按输入顺序稳定排序。
 * 纯函数，不修改输入。
 */
public class DependencyResolver {

    private final Map<ServiceType, Integer> tierOverrides;

    public DependencyResolver() {
        this(Map.of());
    }

    /**
     * @param tierOverrides 覆盖默认的服务类型 tier（数值越小越先执行）
     */
    public DependencyResolver(Map<ServiceType, Integer> tierOverrides) {
        this.tierOverrides = tierOverrides.isEmpty()
                ? Map.of()
                : new EnumMap<>(tierOverrides);
    }

    /**
     * 计算回滚顺序
     *
     * @param targets 请求的目标（按提交顺序）
     * @return 新的有序列表
     */
    public List<RollbackTarget> resolveOrder(Collection<RollbackTarget> targets) {
        if (targets == null || targets.isEmpty()) {
            return List.of();
        }
        List<RollbackTarget> ordered = new ArrayList<>(targets);
        ordered.removeIf(Objects::isNull);
        // List.sort 是稳定排序，同 tier 保持输入顺序
        ordered.sort(Comparator.comparingInt(this::tierOf));
        return List.copyOf(ordered);
    }

    /**
     * 按 tier 分组（保持顺序），同组目标可以并发执行
     */
    public List<List<RollbackTarget>> groupByTier(List<RollbackTarget> orderedTargets) {
        Map<Integer, List<RollbackTarget>> groups = new LinkedHashMap<>();
        for (RollbackTarget target : orderedTargets) {
            groups.computeIfAbsent(tierOf(target), k -> new ArrayList<>()).add(target);
        }
        return groups.values().stream().map(List::copyOf).toList();
    }

    public int tierOf(RollbackTarget target) {
        return tierOverrides.getOrDefault(target.service(), target.service().getDependencyTier());
    }
}
