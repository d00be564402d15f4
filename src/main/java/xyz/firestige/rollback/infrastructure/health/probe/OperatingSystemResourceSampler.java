package xyz.firestige.rollback.infrastructure.health.probe;

import com.sun.management.OperatingSystemMXBean;

import java.io.File;
import java.lang.management.ManagementFactory;

/**
 * 基于 JMX OperatingSystemMXBean 的资源采样
 */
public class OperatingSystemResourceSampler implements ResourceSampler {

    private final OperatingSystemMXBean os =
            (OperatingSystemMXBean) ManagementFactory.getOperatingSystemMXBean();

    @Override
    public double sample(String resource, String path) {
        switch (resource == null ? "" : resource.toLowerCase()) {
            case "cpu": {
                double load = os.getCpuLoad();
                return load < 0 ? Double.NaN : load * 100.0;
            }
            case "memory": {
                long total = os.getTotalMemorySize();
                if (total <= 0) {
                    return Double.NaN;
                }
                return (total - os.getFreeMemorySize()) * 100.0 / total;
            }
            case "disk": {
                File root = new File(path != null ? path : "/");
                long total = root.getTotalSpace();
                if (total <= 0) {
                    return Double.NaN;
                }
                return (total - root.getUsableSpace()) * 100.0 / total;
            }
            default:
                throw new IllegalArgumentException("未知的资源类型: " + resource);
        }
    }
}
