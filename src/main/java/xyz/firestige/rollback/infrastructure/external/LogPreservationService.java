package xyz.firestige.rollback.infrastructure.external;

import xyz.firestige.rollback.domain.shared.vo.DeploymentId;

import java.util.List;

/**
 * 日志保全服务
 */
public interface LogPreservationService {

    /**
     * 保全指定服务的日志
     *
     * @return 归档位置
     */
    String preserve(DeploymentId deploymentId, List<String> services);
}
