package com.fxtrader.backup;

import com.fxtrader.metrics.MetricsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Stream;

/**
 * Snapshots the config file, the trade plan and the results directory into
 * {@code <backupDir>/backup_yyyyMMdd_HHmmss}, then deletes snapshots older than the retention
 * period judged by the timestamp in their name.
 */
public final class BackupService {
    private static final Logger logger = LoggerFactory.getLogger(BackupService.class);

    static final String PREFIX = "backup_";
    static final DateTimeFormatter STAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");
    public static final Duration RETENTION = Duration.ofDays(30);

    private final Path backupDir;
    private final List<Path> files;
    private final Path resultsDir;
    private final Clock clock;

    public BackupService(Path backupDir, List<Path> files, Path resultsDir, Clock clock) {
        this.backupDir = backupDir;
        this.files = List.copyOf(files);
        this.resultsDir = resultsDir;
        this.clock = clock;
    }

    /**
     * Take one snapshot and prune old ones.
     *
     * @return the snapshot directory
     */
    public Path backup() throws IOException {
        LocalDateTime now = LocalDateTime.now(clock);
        Path target = backupDir.resolve(PREFIX + now.format(STAMP));
        try {
            Files.createDirectories(target);
            for (Path file : files) {
                if (Files.isRegularFile(file)) {
                    Files.copy(file, target.resolve(file.getFileName()),
                        StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.COPY_ATTRIBUTES);
                } else {
                    logger.debug("Backup: {} not found, skipped", file);
                }
            }
            if (Files.isDirectory(resultsDir)) {
                copyTree(resultsDir, target.resolve(resultsDir.getFileName()));
            }
            MetricsService.getInstance().recordBackup(true);
        } catch (IOException e) {
            MetricsService.getInstance().recordBackup(false);
            throw e;
        }
        logger.info("🗄️ Backup written to {}", target);

        cleanup(now);
        return target;
    }

    /**
     * Delete {@code backup_*} directories whose timestamp is older than the retention period.
     * Directories whose name does not parse are left alone.
     */
    public List<Path> cleanup(LocalDateTime now) throws IOException {
        var removed = new ArrayList<Path>();
        if (!Files.isDirectory(backupDir)) {
            return removed;
        }
        LocalDateTime cutoff = now.minus(RETENTION);
        List<Path> candidates;
        try (Stream<Path> listing = Files.list(backupDir)) {
            candidates = listing
                .filter(Files::isDirectory)
                .filter(p -> p.getFileName().toString().startsWith(PREFIX))
                .toList();
        }
        for (Path dir : candidates) {
            String stamp = dir.getFileName().toString().substring(PREFIX.length());
            LocalDateTime taken;
            try {
                taken = LocalDateTime.parse(stamp, STAMP);
            } catch (DateTimeParseException e) {
                logger.debug("Backup cleanup: {} has no timestamp, kept", dir);
                continue;
            }
            if (taken.isBefore(cutoff)) {
                deleteTree(dir);
                removed.add(dir);
                logger.info("🧹 Old backup removed: {}", dir.getFileName());
            }
        }
        return removed;
    }

    private static void copyTree(Path source, Path target) throws IOException {
        List<Path> paths;
        try (Stream<Path> walk = Files.walk(source)) {
            paths = walk.toList();
        }
        for (Path path : paths) {
            Path dest = target.resolve(source.relativize(path).toString());
            if (Files.isDirectory(path)) {
                Files.createDirectories(dest);
            } else {
                Files.copy(path, dest, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.COPY_ATTRIBUTES);
            }
        }
    }

    private static void deleteTree(Path root) throws IOException {
        List<Path> paths;
        try (Stream<Path> walk = Files.walk(root)) {
            paths = walk.sorted(Comparator.reverseOrder()).toList();
        }
        for (Path path : paths) {
            Files.delete(path);
        }
    }
}
