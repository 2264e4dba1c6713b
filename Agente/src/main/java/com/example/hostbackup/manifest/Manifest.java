package com.example.hostbackup.manifest;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Registro append-only dos arquivos produzidos por agendamento, consumido pela poda de retenção.
 *
 * Layout: {dir}/{scheduleId}.jsonl, uma entrada JSON por linha. Jobs manuais usam {@link #MANUAL_ID}.
 * Toda escrita passa por um lock em memória e por um FileLock em {dir}/.manifest.lock, de modo que
 * jobs concorrentes (inclusive em outros processos) nunca intercalam linhas.
 */
public final class Manifest {

    private Manifest() {}

    /** Identificador reservado para jobs sem agendamento. */
    public static final String MANUAL_ID = "manual";

    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static final class ManifestEntry {
        @JsonProperty("schedule_id")
        private final String scheduleId;
        @JsonProperty("account")
        private final String account;
        @JsonProperty("file")
        private final String file;
        @JsonProperty("db_file")
        private final String dbFile;
        @JsonProperty("size")
        private final long size;
        @JsonProperty("destination")
        private final String destination;
        @JsonProperty("retention")
        private final int retention;
        @JsonProperty("created_at")
        private final long createdAt;

        @JsonCreator
        public ManifestEntry(@JsonProperty("schedule_id") String scheduleId,
                             @JsonProperty("account") String account,
                             @JsonProperty("file") String file,
                             @JsonProperty("db_file") String dbFile,
                             @JsonProperty("size") long size,
                             @JsonProperty("destination") String destination,
                             @JsonProperty("retention") int retention,
                             @JsonProperty("created_at") long createdAt) {
            this.scheduleId = scheduleId != null && !scheduleId.isBlank() ? scheduleId : MANUAL_ID;
            this.account = Objects.requireNonNull(account, "account");
            this.file = Objects.requireNonNull(file, "file");
            this.dbFile = dbFile;
            this.size = size;
            this.destination = destination;
            this.retention = retention;
            this.createdAt = createdAt;
        }

        public String scheduleId() { return scheduleId; }
        public String account() { return account; }
        public String file() { return file; }
        public String dbFile() { return dbFile; }
        public long size() { return size; }
        public String destination() { return destination; }
        public int retention() { return retention; }
        /** Epoch em segundos. */
        public long createdAt() { return createdAt; }

        boolean sameArtifact(ManifestEntry other) {
            return account.equals(other.account) && file.equals(other.file);
        }
    }

    /** Persistência do manifest. */
    public interface ManifestTracker {
        void append(ManifestEntry entry) throws IOException;

        List<ManifestEntry> entries(String scheduleId) throws IOException;

        /**
         * Entradas da conta além das {@code retention} mais novas. Retenção <= 0 significa ilimitada.
         */
        default List<ManifestEntry> expired(String scheduleId, String account, int retention) throws IOException {
            if (retention <= 0) {
                return List.of();
            }
            List<ManifestEntry> forAccount = new ArrayList<>();
            for (ManifestEntry e : entries(scheduleId)) {
                if (e.account().equals(account)) {
                    forAccount.add(e);
                }
            }
            forAccount.sort(Comparator.comparingLong(ManifestEntry::createdAt).reversed());
            return forAccount.size() > retention
                    ? List.copyOf(forAccount.subList(retention, forAccount.size()))
                    : List.of();
        }

        void remove(String scheduleId, List<ManifestEntry> entries) throws IOException;
    }

    public static final class JsonLinesManifestTracker implements ManifestTracker {
        private static final Logger log = LoggerFactory.getLogger(JsonLinesManifestTracker.class);
        private final Path dir;
        private final ObjectMapper mapper = new ObjectMapper();
        private final ReentrantLock lock = new ReentrantLock();

        public JsonLinesManifestTracker(Path dir) {
            this.dir = Objects.requireNonNull(dir, "dir");
        }

        @Override
        public void append(ManifestEntry entry) throws IOException {
            byte[] line = (mapper.writeValueAsString(entry) + "\n").getBytes(StandardCharsets.UTF_8);
            withLock(() -> {
                try (FileChannel channel = FileChannel.open(file(entry.scheduleId()),
                        StandardOpenOption.CREATE, StandardOpenOption.WRITE, StandardOpenOption.APPEND)) {
                    ByteBuffer buffer = ByteBuffer.wrap(line);
                    while (buffer.hasRemaining()) {
                        channel.write(buffer);
                    }
                }
                return null;
            });
            log.debug("Manifest {}: +{}", entry.scheduleId(), entry.file());
        }

        @Override
        public List<ManifestEntry> entries(String scheduleId) throws IOException {
            return withLock(() -> read(file(scheduleId)));
        }

        @Override
        public void remove(String scheduleId, List<ManifestEntry> toRemove) throws IOException {
            if (toRemove.isEmpty()) {
                return;
            }
            withLock(() -> {
                Path file = file(scheduleId);
                List<ManifestEntry> kept = new ArrayList<>();
                Set<ManifestEntry> matched = new HashSet<>();
                for (ManifestEntry e : read(file)) {
                    boolean drop = toRemove.stream().anyMatch(r -> r.sameArtifact(e));
                    if (drop) {
                        matched.add(e);
                    } else {
                        kept.add(e);
                    }
                }
                Path tmp = file.resolveSibling(file.getFileName() + ".tmp");
                StringBuilder sb = new StringBuilder();
                for (ManifestEntry e : kept) {
                    sb.append(mapper.writeValueAsString(e)).append('\n');
                }
                Files.writeString(tmp, sb.toString(), StandardCharsets.UTF_8);
                Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
                log.info("Manifest {}: {} entradas removidas", scheduleId, matched.size());
                return null;
            });
        }

        private List<ManifestEntry> read(Path file) throws IOException {
            if (!Files.isRegularFile(file)) {
                return List.of();
            }
            List<ManifestEntry> out = new ArrayList<>();
            for (String line : Files.readAllLines(file, StandardCharsets.UTF_8)) {
                if (line.isBlank()) continue;
                try {
                    out.add(mapper.readValue(line, ManifestEntry.class));
                } catch (IOException e) {
                    log.warn("Linha inválida ignorada em {}: {}", file, e.getMessage());
                }
            }
            return out;
        }

        private Path file(String scheduleId) {
            String id = scheduleId == null || scheduleId.isBlank() ? MANUAL_ID : scheduleId;
            if (!id.matches("[A-Za-z0-9_.-]+")) {
                throw new IllegalArgumentException("scheduleId inválido: " + id);
            }
            return dir.resolve(id + ".jsonl");
        }

        private <T> T withLock(IoAction<T> action) throws IOException {
            Files.createDirectories(dir);
            lock.lock();
            try (FileChannel lockChannel = FileChannel.open(dir.resolve(".manifest.lock"),
                    StandardOpenOption.CREATE, StandardOpenOption.WRITE);
                 FileLock ignored = lockChannel.lock()) {
                return action.run();
            } finally {
                lock.unlock();
            }
        }
    }

    @FunctionalInterface
    private interface IoAction<T> {
        T run() throws IOException;
    }
}
