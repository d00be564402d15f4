package xyz.firestige.rollback.infrastructure.external.fs;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import xyz.firestige.rollback.domain.shared.vo.DeploymentId;
import xyz.firestige.rollback.infrastructure.external.LogPreservationService;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

/**
 * 基于本地文件系统的日志保全
 * <p>
 * 目录布局：
 * <pre>
 * {archiveDir}/{deploymentId}_{yyyyMMdd_HHmmss}/{service}/...
 * {archiveDir}/preserved_logs_index.json
 * </pre>
 * 日志来源为 sourceDir 下以 service 名称开头的文件
 */
public class FileSystemLogPreservationService implements LogPreservationService {

    private static final Logger log = LoggerFactory.getLogger(FileSystemLogPreservationService.class);

    static final String INDEX_FILE = "preserved_logs_index.json";
    private static final DateTimeFormatter DIR_TIME = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

    private final Path sourceDir;
    private final Path archiveDir;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public FileSystemLogPreservationService(Path sourceDir, Path archiveDir, ObjectMapper objectMapper, Clock clock) {
        this.sourceDir = sourceDir;
        this.archiveDir = archiveDir;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    @Override
    public synchronized String preserve(DeploymentId deploymentId, List<String> services) {
        LocalDateTime now = LocalDateTime.now(clock);
        Path target = archiveDir.resolve(deploymentId.getValue() + "_" + now.format(DIR_TIME));
        Map<String, Integer> copied = new LinkedHashMap<>();
        try {
            Files.createDirectories(target);
            for (String service : services) {
                copied.put(service, copyServiceLogs(service, target.resolve(service)));
            }
            appendIndex(deploymentId, target, services, copied, now);
        } catch (IOException e) {
            throw new UncheckedIOException("日志保全失败: " + deploymentId, e);
        }
        log.info("[LogPreservation] 日志已保全: {}, files: {}", target, copied);
        return target.toString();
    }

    private int copyServiceLogs(String service, Path destination) throws IOException {
        Files.createDirectories(destination);
        if (!Files.isDirectory(sourceDir)) {
            log.warn("[LogPreservation] 日志目录不存在: {}", sourceDir);
            return 0;
        }
        List<Path> files;
        try (Stream<Path> stream = Files.list(sourceDir)) {
            files = stream
                    .filter(Files::isRegularFile)
                    .filter(p -> p.getFileName().toString().startsWith(service))
                    .toList();
        }
        for (Path file : files) {
            Files.copy(file, destination.resolve(file.getFileName()), StandardCopyOption.REPLACE_EXISTING);
        }
        return files.size();
    }

    private void appendIndex(DeploymentId deploymentId, Path location, List<String> services,
                             Map<String, Integer> copied, LocalDateTime preservedAt) throws IOException {
        Path indexFile = archiveDir.resolve(INDEX_FILE);
        List<Map<String, Object>> entries = readIndex(indexFile);

        Map<String, Object> entry = new LinkedHashMap<>();
        entry.put("deployment_id", deploymentId.getValue());
        entry.put("location", location.toString());
        entry.put("services", services);
        entry.put("file_counts", copied);
        entry.put("preserved_at", preservedAt.toString());
        entries.add(entry);

        objectMapper.writerWithDefaultPrettyPrinter().writeValue(indexFile.toFile(), entries);
    }

    List<Map<String, Object>> readIndex(Path indexFile) throws IOException {
        if (!Files.exists(indexFile)) {
            return new ArrayList<>();
        }
        return new ArrayList<>(objectMapper.readValue(indexFile.toFile(),
                new TypeReference<List<Map<String, Object>>>() {}));
    }

    public Path getArchiveDir() {
        return archiveDir;
    }
}
