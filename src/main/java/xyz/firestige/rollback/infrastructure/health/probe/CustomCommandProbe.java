package xyz.firestige.rollback.infrastructure.health.probe;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import xyz.firestige.rollback.domain.health.CheckType;
import xyz.firestige.rollback.domain.health.HealthCheckDefinition;
import xyz.firestige.rollback.domain.health.HealthCheckResult;
import xyz.firestige.rollback.domain.health.HealthStatus;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.concurrent.TimeUnit;

/**
 * custom：执行外部命令，将标准输出的第一行解析为数值，与阈值比较
 * <p>
 * 退出码非 0、超时或输出不是数值均为 critical
 */
public class CustomCommandProbe implements HealthProbe {

    private static final Logger log = LoggerFactory.getLogger(CustomCommandProbe.class);

    private final Clock clock;

    public CustomCommandProbe(Clock clock) {
        this.clock = clock;
    }

    @Override
    public CheckType getType() {
        return CheckType.CUSTOM;
    }

    @Override
    public HealthCheckResult probe(HealthCheckDefinition check) {
        Process process = null;
        Path output = null;
        try {
            // 输出写入临时文件，命令输出超过管道缓冲区时不会阻塞
            output = Files.createTempFile("rollback-probe-", ".out");
            process = new ProcessBuilder("sh", "-c", check.getCommand())
                    .redirectErrorStream(true)
                    .redirectOutput(output.toFile())
                    .start();
            if (!process.waitFor(check.getTimeoutSeconds(), TimeUnit.SECONDS)) {
                return critical(check, "命令执行超时（" + check.getTimeoutSeconds() + "s）");
            }
            if (process.exitValue() != 0) {
                return critical(check, "命令退出码 " + process.exitValue());
            }
            String firstLine;
            try (BufferedReader reader = Files.newBufferedReader(output, StandardCharsets.UTF_8)) {
                firstLine = reader.readLine();
            }
            return evaluate(check, firstLine);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return critical(check, "命令执行被中断");
        } catch (Exception e) {
            log.debug("自定义探测失败: {}", check.getCheckId(), e);
            return critical(check, "命令执行失败: " + e.getMessage());
        } finally {
            if (process != null && process.isAlive()) {
                process.destroyForcibly();
            }
            deleteQuietly(output);
        }
    }

    private static void deleteQuietly(Path output) {
        if (output == null) {
            return;
        }
        try {
            Files.deleteIfExists(output);
        } catch (IOException e) {
            log.warn("删除探测输出文件失败: {}", output, e);
        }
    }

    HealthCheckResult evaluate(HealthCheckDefinition check, String output) {
        LocalDateTime now = LocalDateTime.now(clock);
        double value;
        try {
            value = Double.parseDouble(output == null ? "" : output.trim());
        } catch (NumberFormatException e) {
            return HealthCheckResult.of(check, HealthStatus.CRITICAL, -1, now, "输出不是数值: " + output);
        }
        if (check.getThresholdCritical() != null && value >= check.getThresholdCritical()) {
            return HealthCheckResult.of(check, HealthStatus.CRITICAL, value, now,
                    String.format("输出 %s 达到严重阈值 %s", value, check.getThresholdCritical()));
        }
        if (check.getThresholdWarning() != null && value >= check.getThresholdWarning()) {
            return HealthCheckResult.of(check, HealthStatus.WARNING, value, now,
                    String.format("输出 %s 达到告警阈值 %s", value, check.getThresholdWarning()));
        }
        return HealthCheckResult.of(check, HealthStatus.HEALTHY, value, now, "输出 " + value);
    }

    private HealthCheckResult critical(HealthCheckDefinition check, String message) {
        return HealthCheckResult.of(check, HealthStatus.CRITICAL, -1, LocalDateTime.now(clock), message);
    }
}
