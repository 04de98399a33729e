package com.dicalc.adapter.out.report;

import com.dicalc.application.port.out.ReportSection;
import com.dicalc.application.port.out.ReportSink;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import lombok.extern.slf4j.Slf4j;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Writes report sections into one .xlsx workbook per report under a directory.
 * Implements ReportSink output port.
 * <p>
 * Appends to the same workbook are serialised by a per-file lock. The whole workbook is written to a
 * temporary file in the same directory, which then atomically replaces the target, so readers only
 * ever see the workbook before or after a complete section.
 * <p>
 * A file's lock is kept only while appends to it are running or waiting, so the lock map stays as
 * small as the number of reports being written at once.
 */
@Slf4j
public class ExcelReportSink implements ReportSink {

    private final Vertx vertx;
    private final Path directory;
    private final AuditSheetWriter sheetWriter = new AuditSheetWriter();
    private final Map<Path, FileLock> locks = new ConcurrentHashMap<>();

    public ExcelReportSink(Vertx vertx, Path directory) {
        this.vertx = vertx;
        this.directory = directory.toAbsolutePath().normalize();
    }

    @Override
    public Future<String> appendSection(String reportName, ReportSection section) {
        Path target = reportPath(reportName);

        return vertx.executeBlocking(() -> {
            ReentrantLock lock = acquire(target);
            lock.lock();
            try {
                return writeSection(target, section);
            } finally {
                lock.unlock();
                release(target);
            }
        }, false);
    }

    /**
     * Number of files that currently have a lock
     */
    int lockedFiles() {
        return locks.size();
    }

    private ReentrantLock acquire(Path target) {
        return locks.compute(target, (path, held) -> {
            FileLock lock = held == null ? new FileLock() : held;
            lock.users++;
            return lock;
        }).lock;
    }

    private void release(Path target) {
        locks.computeIfPresent(target, (path, held) -> --held.users == 0 ? null : held);
    }

    public Path reportPath(String reportName) {
        return directory.resolve(reportName + ".xlsx");
    }

    private String writeSection(Path target, ReportSection section) throws IOException {
        Files.createDirectories(directory);

        try (XSSFWorkbook workbook = openOrCreate(target)) {
            String sheetName = sheetWriter.write(workbook, section);

            Path temp = Files.createTempFile(directory, target.getFileName().toString(), ".tmp");
            try {
                try (OutputStream out = Files.newOutputStream(temp)) {
                    workbook.write(out);
                }
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } finally {
                Files.deleteIfExists(temp);
            }

            log.info("Appended sheet '{}' ({} rows) to {}", sheetName, section.getRows().size(), target.getFileName());
            return sheetName;
        }
    }

    private XSSFWorkbook openOrCreate(Path target) throws IOException {
        if (!Files.exists(target)) {
            return new XSSFWorkbook();
        }
        try (InputStream in = Files.newInputStream(target)) {
            return new XSSFWorkbook(in);
        }
    }

    /**
     * Lock of one file and the number of appends holding or waiting for it; only changed inside map compute calls
     */
    private static final class FileLock {
        private final ReentrantLock lock = new ReentrantLock();
        private int users;
    }
}
