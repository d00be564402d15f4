package xyz.firestige.rollback.infrastructure.health.probe;

/**
 * 系统资源采样
 */
@FunctionalInterface
public interface ResourceSampler {

    /**
     * @param resource cpu / memory / disk
     * @param path     disk 时的挂载路径
     * @return 使用率百分比（0-100），无法采样时为 NaN
     */
    double sample(String resource, String path);
}
