package org.calista.branchgraph.io;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.channels.OverlappingFileLockException;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.time.Duration;
import java.util.Objects;
import java.util.stream.Stream;

/**
 * FileIO: единая точка I/O: конфиг и JSONL журнал событий.
 *
 * <ul>
 *   <li>атомарная запись через tmp + move (опционально fsync)</li>
 *   <li>append для JSONL с опциональной файловой блокировкой</li>
 *   <li>стриминг JSONL без загрузки в память</li>
 *   <li>resolve внутри baseDir с защитой от выхода через ".."</li>
 * </ul>
 */
public final class FileIO {
    private static final Logger log = LogManager.getLogger(FileIO.class);

    // ----------------------------
    // Options / Builder
    // ----------------------------

    public static final class Options {
        public final Charset charset;
        public final boolean atomicWrites;
        public final boolean fsyncOnCommit;
        public final boolean lockWrites;
        public final Duration lockTimeout;

        private Options(Builder b) {
            this.charset = b.charset;
            this.atomicWrites = b.atomicWrites;
            this.fsyncOnCommit = b.fsyncOnCommit;
            this.lockWrites = b.lockWrites;
            this.lockTimeout = b.lockTimeout;
        }

        public static Builder builder() {
            return new Builder();
        }

        public static final class Builder {
            private Charset charset = StandardCharsets.UTF_8;
            private boolean atomicWrites = true;
            private boolean fsyncOnCommit = false;
            private boolean lockWrites = false; // включай, если журнал пишут несколько процессов
            private Duration lockTimeout = Duration.ofSeconds(3);

            public Builder charset(Charset v) {
                this.charset = Objects.requireNonNull(v);
                return this;
            }

            public Builder atomicWrites(boolean v) {
                this.atomicWrites = v;
                return this;
            }

            public Builder fsyncOnCommit(boolean v) {
                this.fsyncOnCommit = v;
                return this;
            }

            public Builder lockWrites(boolean v) {
                this.lockWrites = v;
                return this;
            }

            public Builder lockTimeout(Duration v) {
                this.lockTimeout = Objects.requireNonNull(v);
                return this;
            }

            public Options build() {
                return new Options(this);
            }
        }
    }

    private final Path baseDir;
    private final Options opt;

    public FileIO(Path baseDir) {
        this(baseDir, Options.builder().build());
    }

    public FileIO(Path baseDir, Options options) {
        this.baseDir = Objects.requireNonNull(baseDir, "baseDir").toAbsolutePath().normalize();
        this.opt = Objects.requireNonNull(options, "options");
        log.debug("FileIO init: baseDir={}, charset={}, atomicWrites={}, fsyncOnCommit={}, lockWrites={}",
                this.baseDir, opt.charset, opt.atomicWrites, opt.fsyncOnCommit, opt.lockWrites);
        try {
            ensureBaseDir();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to ensure base directory exists", e);
        }
    }

    // ----------------------------
    // Base dir / Resolve
    // ----------------------------

    public Path baseDir() {
        return baseDir;
    }

    public Options options() {
        return opt;
    }

    public void ensureBaseDir() throws IOException {
        Files.createDirectories(baseDir);
    }

    /**
     * Резолвит относительный путь внутри baseDir. Абсолютные пути и выход через ".." запрещены.
     */
    public Path resolve(String relative) {
        Objects.requireNonNull(relative, "relative");
        Path rel = Paths.get(relative.replace('\\', '/'));
        if (rel.isAbsolute()) throw new IllegalArgumentException("resolve(relative) does not accept absolute paths: " + relative);

        Path p = baseDir.resolve(rel).normalize().toAbsolutePath();
        if (!p.startsWith(baseDir)) throw new IllegalArgumentException("Path traversal detected: " + relative);
        return p;
    }

    public void ensureParentDir(Path file) throws IOException {
        Objects.requireNonNull(file, "file");
        Path parent = file.getParent();
        if (parent != null) Files.createDirectories(parent);
    }

    public boolean exists(Path file) {
        Objects.requireNonNull(file, "file");
        return Files.exists(file);
    }

    public void deleteIfExists(Path file) throws IOException {
        Objects.requireNonNull(file, "file");
        boolean deleted = Files.deleteIfExists(file);
        log.debug("deleteIfExists: {} -> {}", file, deleted);
    }

    // ----------------------------
    // Text
    // ----------------------------

    public String readString(Path file) throws IOException {
        Objects.requireNonNull(file, "file");
        return Files.readString(file, opt.charset);
    }

    public void writeString(Path file, String content) throws IOException {
        Objects.requireNonNull(file, "file");
        Objects.requireNonNull(content, "content");
        ensureParentDir(file);

        if (!opt.atomicWrites) {
            writeStringDirect(file, content);
            return;
        }

        Path tmp = file.resolveSibling(file.getFileName() + ".tmp");
        writeStringDirect(tmp, content);
        atomicCommit(tmp, file);
    }

    public void appendLine(Path file, String line) throws IOException {
        Objects.requireNonNull(file, "file");
        Objects.requireNonNull(line, "line");
        ensureParentDir(file);

        if (!opt.lockWrites) {
            appendDirect(file, line);
            if (opt.fsyncOnCommit) fsync(file);
            return;
        }
        withWriteLock(file, () -> appendDirect(file, line));
    }

    // ----------------------------
    // JSONL
    // ----------------------------

    public void appendJsonl(Path file, String jsonLine) throws IOException {
        Objects.requireNonNull(jsonLine, "jsonLine");
        String s = jsonLine.trim();
        if (s.isEmpty()) return;
        if (s.indexOf('\n') >= 0 || s.indexOf('\r') >= 0) {
            throw new IllegalArgumentException("JSONL record must be a single line");
        }
        appendLine(file, s);
    }

    /**
     * Стрим JSONL записей (trim + skip empty). Stream надо закрыть.
     */
    public Stream<String> jsonlStream(Path file) throws IOException {
        Objects.requireNonNull(file, "file");
        return Files.lines(file, opt.charset)
                .map(x -> x == null ? "" : x.trim())
                .filter(x -> !x.isEmpty());
    }

    // ----------------------------
    // Internals
    // ----------------------------

    private void appendDirect(Path file, String line) throws IOException {
        Files.writeString(file, line + System.lineSeparator(), opt.charset,
                StandardOpenOption.CREATE, StandardOpenOption.WRITE, StandardOpenOption.APPEND);
    }

    private void writeStringDirect(Path file, String content) throws IOException {
        if (!opt.lockWrites) {
            Files.writeString(file, content, opt.charset,
                    StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE);
            return;
        }
        withWriteLock(file, () -> Files.writeString(file, content, opt.charset,
                StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE));
    }

    private void atomicCommit(Path tmp, Path target) throws IOException {
        if (opt.fsyncOnCommit) fsync(tmp);

        try {
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            log.trace("atomicCommit: {} -> {} (ATOMIC)", tmp, target);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
            log.trace("atomicCommit: {} -> {} (NON-ATOMIC fallback)", tmp, target);
        } finally {
            // если move не удался, tmp мог остаться
            try {
                Files.deleteIfExists(tmp);
            } catch (IOException e) {
                log.debug("tmp cleanup failed for {}: {}", tmp, e.toString());
            }
        }
    }

    private void fsync(Path file) {
        try (FileChannel ch = FileChannel.open(file, StandardOpenOption.READ)) {
            ch.force(true);
        } catch (IOException e) {
            log.debug("fsync ignored for {}: {}", file, e.toString());
        }
    }

    private void withWriteLock(Path file, IoRunnable action) throws IOException {
        ensureParentDir(file);
        if (!Files.exists(file)) {
            try {
                Files.createFile(file);
            } catch (FileAlreadyExistsException ignored) {
                // another writer created it first
            }
        }

        long deadlineNs = System.nanoTime() + opt.lockTimeout.toNanos();

        try (FileChannel ch = FileChannel.open(file, StandardOpenOption.WRITE)) {
            while (true) {
                try {
                    FileLock lock = ch.tryLock();
                    if (lock != null) {
                        try (lock) {
                            action.run();
                            if (opt.fsyncOnCommit) ch.force(true);
                            return;
                        }
                    }
                } catch (OverlappingFileLockException ignored) {
                    // тот же процесс держит lock, ждём
                }

                if (System.nanoTime() >= deadlineNs) {
                    throw new IOException("Write lock timeout for " + file);
                }
                try {
                    Thread.sleep(10);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    throw new IOException("Interrupted while waiting for write lock on " + file, ie);
                }
            }
        }
    }

    @FunctionalInterface
    private interface IoRunnable {
        void run() throws IOException;
    }
}
