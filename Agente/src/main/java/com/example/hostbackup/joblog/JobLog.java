package com.example.hostbackup.joblog;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Locale;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Log de progresso de um job: um arquivo por job, somente append, legível enquanto o job roda.
 *
 * Cada escrita abre o arquivo em APPEND, adquire um FileLock exclusivo e fecha em seguida; o arquivo
 * nunca é truncado. Dentro do processo as escritas são serializadas pelo monitor da instância.
 */
public final class JobLog {

    private static final Logger log = LoggerFactory.getLogger(JobLog.class);

    /** Prefixo curto usado nos logs de backup. */
    public static final DateTimeFormatter TIME_ONLY = DateTimeFormatter.ofPattern("HH:mm:ss", Locale.ROOT);
    /** Prefixo completo usado nos logs de restore. */
    public static final DateTimeFormatter DATE_TIME = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss", Locale.ROOT);

    private final String jobId;
    private final Path file;
    private final DateTimeFormatter stampFormat;
    private final Clock clock;

    private JobLog(String jobId, Path file, DateTimeFormatter stampFormat, Clock clock) {
        this.jobId = jobId;
        this.file = file;
        this.stampFormat = stampFormat;
        this.clock = clock;
    }

    /**
     * Cria (ou reabre) {dir}/{jobId}.log. O diretório é criado se preciso.
     */
    public static JobLog open(Path dir, String jobId, DateTimeFormatter stampFormat, Clock clock) throws IOException {
        Objects.requireNonNull(dir, "dir");
        Objects.requireNonNull(jobId, "jobId");
        if (!jobId.matches("[A-Za-z0-9_.-]+")) {
            throw new IllegalArgumentException("jobId inválido: " + jobId);
        }
        Files.createDirectories(dir);
        return new JobLog(jobId, dir.resolve(jobId + ".log"), Objects.requireNonNull(stampFormat), Objects.requireNonNull(clock));
    }

    public String jobId() { return jobId; }
    public Path file() { return file; }

    /** "[stamp] message" */
    public void line(String message) {
        raw("[" + stampFormat.format(LocalDateTime.now(clock)) + "] " + message);
    }

    public void separator(char c) {
        raw(String.valueOf(c).repeat(60));
    }

    /**
     * Linha sem prefixo (saída de subprocesso). Falhas de escrita não derrubam o job: são logadas
     * no stream de diagnóstico e a linha se perde.
     */
    public synchronized void raw(String text) {
        byte[] bytes = (text + "\n").getBytes(StandardCharsets.UTF_8);
        try (FileChannel channel = FileChannel.open(file,
                StandardOpenOption.CREATE, StandardOpenOption.WRITE, StandardOpenOption.APPEND);
             FileLock ignored = channel.lock()) {
            ByteBuffer buffer = ByteBuffer.wrap(bytes);
            while (buffer.hasRemaining()) {
                channel.write(buffer);
            }
        } catch (IOException e) {
            log.warn("Falha ao escrever no log do job {}: {}", jobId, e.getMessage());
        }
    }

    // ---- leitura incremental ----------------------------------------------

    /**
     * Lê a partir de {@code offset} até o fim atual. Pensado para um consumidor que acompanha o job.
     */
    public static Chunk readFrom(Path dir, String jobId, long offset) {
        if (jobId == null || !jobId.matches("[A-Za-z0-9_.-]+")) {
            throw new IllegalArgumentException("jobId inválido: " + jobId);
        }
        Path file = dir.resolve(jobId + ".log");
        if (!Files.isRegularFile(file)) {
            return new Chunk("", Math.max(offset, 0), false);
        }
        try (InputStream in = Files.newInputStream(file)) {
            long start = Math.max(offset, 0);
            long skipped = in.skip(start);
            byte[] rest = in.readAllBytes();
            return new Chunk(new String(rest, StandardCharsets.UTF_8), skipped + rest.length, true);
        } catch (IOException e) {
            throw new UncheckedIOException("Falha ao ler log " + file, e);
        }
    }

    /** Trecho lido e o offset para a próxima leitura. */
    public static final class Chunk {
        private final String content;
        private final long nextOffset;
        private final boolean exists;

        public Chunk(String content, long nextOffset, boolean exists) {
            this.content = content;
            this.nextOffset = nextOffset;
            this.exists = exists;
        }

        public String content() { return content; }
        public long nextOffset() { return nextOffset; }
        public boolean exists() { return exists; }
    }
}
