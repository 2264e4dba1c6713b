package com.example.hostbackup.tasks;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

import com.example.hostbackup.backup.Backup.BackupCoordinator;
import com.example.hostbackup.backup.Backup.BackupJobResult;
import com.example.hostbackup.backup.Backup.BackupRequest;
import com.example.hostbackup.manifest.RetentionPruner;
import com.example.hostbackup.manifest.RetentionPruner.PruneResult;
import com.example.hostbackup.restore.Restore.RestoreJobResult;
import com.example.hostbackup.restore.Restore.RestoreRequest;
import com.example.hostbackup.restore.Restore.RestoreService;
import com.example.hostbackup.tools.ToolAdapters.RestoreOptions;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Consome a fila em disco, um job por vez.
 * Layout: {queueDir}/queued/*.json -> running/ -> completed/. O arquivo do job em running/ é
 * regravado a cada conta concluída para que um leitor externo acompanhe accounts_completed.
 */
public final class QueueTaskPoller implements AutoCloseable {

    private static final Logger LOGGER = Logger.getLogger(QueueTaskPoller.class.getName());

    public static final String STATUS_QUEUED = "queued";
    public static final String STATUS_RUNNING = "running";
    public static final String STATUS_COMPLETED = "completed";
    public static final String STATUS_FAILED = "failed";
    public static final String STATUS_CANCELLED = "cancelled";

    /** Requestor quando o job não informa ninguém (execução agendada). */
    public static final String DEFAULT_REQUESTOR = "cron";

    private final Path queuedDir;
    private final Path runningDir;
    private final Path completedDir;
    private final BackupCoordinator backupCoordinator;
    private final RestoreService restoreService;
    private final RetentionPruner pruner;
    private final Duration interval;
    private final Clock clock;
    private final ObjectMapper mapper = new ObjectMapper();
    private final ScheduledExecutorService scheduler;

    // Job em execução, só para diagnóstico
    private volatile String currentJobId = null;

    public QueueTaskPoller(Path queueDir,
                           BackupCoordinator backupCoordinator,
                           RestoreService restoreService,
                           RetentionPruner pruner,
                           Duration interval,
                           Clock clock) {
        Objects.requireNonNull(queueDir, "queueDir");
        this.queuedDir = queueDir.resolve(STATUS_QUEUED);
        this.runningDir = queueDir.resolve(STATUS_RUNNING);
        this.completedDir = queueDir.resolve(STATUS_COMPLETED);
        this.backupCoordinator = Objects.requireNonNull(backupCoordinator, "backupCoordinator");
        this.restoreService = Objects.requireNonNull(restoreService, "restoreService");
        this.pruner = pruner;
        this.interval = interval != null ? interval : Duration.ofSeconds(60);
        this.clock = clock != null ? clock : Clock.systemDefaultZone();
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "queue-poller");
            t.setDaemon(true);
            return t;
        });
    }

    public void start() {
        scheduler.scheduleWithFixedDelay(this::runOnce, 2, interval.toSeconds(), TimeUnit.SECONDS);
        LOGGER.info("Queue poller iniciado. Intervalo: " + interval.toSeconds() + "s");
    }

    private void runOnce() {
        try {
            int processed = processOnce();
            if (processed > 0) {
                LOGGER.info("[QUEUE] Ciclo concluído: " + processed + " job(s) processado(s)");
            }
        } catch (Exception e) {
            // Nunca deixa a exceção matar o agendamento
            LOGGER.log(Level.WARNING, "Erro no ciclo da fila: " + e.getMessage(), e);
        }
    }

    /**
     * Drena a fila: processa todos os jobs presentes em queued/ no momento da chamada, em ordem de nome.
     *
     * @return quantidade de jobs executados
     */
    public int processOnce() throws IOException {
        Files.createDirectories(queuedDir);
        Files.createDirectories(runningDir);
        Files.createDirectories(completedDir);

        int processed = 0;
        for (Path queued : listQueued()) {
            Optional<Path> claimed = claim(queued);
            if (claimed.isEmpty()) {
                continue;
            }
            processFile(claimed.get());
            processed++;
        }
        return processed;
    }

    private List<Path> listQueued() throws IOException {
        List<Path> files = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(queuedDir, "*.json")) {
            for (Path p : stream) {
                if (Files.isRegularFile(p)) {
                    files.add(p);
                }
            }
        }
        files.sort(null);
        return files;
    }

    /** Move queued/ -> running/. Vazio se outro processo pegou o arquivo antes. */
    private Optional<Path> claim(Path queued) throws IOException {
        Path target = runningDir.resolve(queued.getFileName());
        try {
            move(queued, target);
            return Optional.of(target);
        } catch (NoSuchFileException e) {
            LOGGER.fine("Job já reivindicado: " + queued.getFileName());
            return Optional.empty();
        }
    }

    private void processFile(Path running) throws IOException {
        String jobId = stem(running);
        ObjectNode job;
        try {
            JsonNode parsed = mapper.readTree(Files.readString(running, StandardCharsets.UTF_8));
            if (parsed == null || !parsed.isObject()) {
                throw new IOException("conteúdo não é um objeto JSON");
            }
            job = (ObjectNode) parsed;
        } catch (IOException e) {
            LOGGER.warning("[QUEUE] Job ilegível " + running.getFileName() + ": " + e.getMessage());
            ObjectNode broken = mapper.createObjectNode();
            broken.put("id", jobId);
            broken.put("error", "Unreadable job file: " + e.getMessage());
            finish(running, broken, STATUS_FAILED);
            return;
        }

        if (!job.hasNonNull("id") || job.path("id").asText("").isBlank()) {
            job.put("id", jobId);
        }
        jobId = job.path("id").asText();
        job.put("status", STATUS_RUNNING);
        job.put("started_at", clock.instant().getEpochSecond());
        write(running, job);

        String type = job.path("type").asText("");
        LOGGER.info("[QUEUE] Recebido: tipo=" + type + " id=" + jobId);
        currentJobId = jobId;
        long start = System.currentTimeMillis();
        String status;
        try {
            if ("backup".equalsIgnoreCase(type)) {
                status = executeBackup(running, job);
            } else if ("restore".equalsIgnoreCase(type)) {
                status = executeRestore(running, job);
            } else {
                job.put("error", "Unsupported job type: " + type);
                status = STATUS_FAILED;
            }
        } catch (IllegalArgumentException | NullPointerException e) {
            // pedido malformado (conta inválida, campo obrigatório ausente)
            LOGGER.warning("[QUEUE] Job " + jobId + " inválido: " + e.getMessage());
            job.put("error", "Invalid job: " + e.getMessage());
            status = STATUS_FAILED;
        } catch (RuntimeException e) {
            LOGGER.log(Level.SEVERE, "Falha durante execução do job " + jobId, e);
            job.put("error", "Unexpected error: " + e.getMessage());
            status = STATUS_FAILED;
        } finally {
            currentJobId = null;
        }
        finish(running, job, status);
        LOGGER.info("[QUEUE] Concluído: id=" + jobId + " status=" + status
                + " duracao=" + (System.currentTimeMillis() - start) + "ms");
    }

    // =====================
    // BACKUP
    // =====================

    private String executeBackup(Path running, ObjectNode job) throws IOException {
        List<String> accounts = new ArrayList<>();
        job.path("accounts").forEach(a -> accounts.add(a.asText()));
        String scheduleId = textOrNull(job, "schedule_id");
        int retention = job.path("retention").asInt(30);
        String requestor = Optional.ofNullable(textOrNull(job, "requestor")).orElse(DEFAULT_REQUESTOR);

        BackupRequest request = BackupRequest.builder()
                .accounts(accounts)
                .destinationId(textOrNull(job, "destination"))
                .user(textOrNull(job, "user"))
                .jobId(job.path("id").asText())
                .scheduleId(scheduleId)
                .retention(retention)
                .requestor(requestor)
                .build();

        job.put("accounts_total", accounts.size());
        job.put("accounts_completed", 0);
        write(running, job);

        BackupJobResult result = backupCoordinator.run(request, (completed, total) -> {
            job.put("accounts_completed", completed);
            try {
                write(running, job);
            } catch (IOException e) {
                LOGGER.warning("Falha ao atualizar progresso de " + running.getFileName() + ": " + e.getMessage());
            }
        });
        job.set("result", mapper.valueToTree(result));

        if (result.success() && request.scheduleId().isPresent() && pruner != null) {
            PruneResult pruned = pruner.prune(request.scheduleId().get(), accounts, request.retention(),
                    request.user(), requestor);
            ObjectNode prune = job.putObject("prune");
            prune.put("deleted", pruned.deleted().size());
            prune.set("errors", mapper.valueToTree(pruned.errors()));
        }

        if (result.cancelled()) {
            return STATUS_CANCELLED;
        }
        return result.success() ? STATUS_COMPLETED : STATUS_FAILED;
    }

    // =====================
    // RESTORE
    // =====================

    private String executeRestore(Path running, ObjectNode job) throws IOException {
        RestoreOptions options = job.hasNonNull("options")
                ? mapper.treeToValue(job.get("options"), RestoreOptions.class)
                : RestoreOptions.all();
        RestoreRequest request = RestoreRequest.builder()
                .archiveRef(textOrNull(job, "backup_file"))
                .destinationId(textOrNull(job, "destination"))
                .user(textOrNull(job, "user"))
                .options(options)
                .restoreId(textOrNull(job, "restore_id"))
                .requestor(Optional.ofNullable(textOrNull(job, "requestor")).orElse(DEFAULT_REQUESTOR))
                .build();

        job.put("accounts_total", 1);
        job.put("accounts_completed", 0);
        write(running, job);

        RestoreJobResult result = restoreService.run(request);
        job.put("accounts_completed", 1);
        job.set("result", mapper.valueToTree(result));
        return result.success() ? STATUS_COMPLETED : STATUS_FAILED;
    }

    // ---- arquivos ----

    private void finish(Path running, ObjectNode job, String status) throws IOException {
        job.put("status", status);
        job.put("completed_at", clock.instant().getEpochSecond());
        write(running, job);
        move(running, completedDir.resolve(running.getFileName()));
    }

    private void write(Path file, ObjectNode job) throws IOException {
        Path tmp = file.resolveSibling(file.getFileName() + ".tmp");
        Files.writeString(tmp, mapper.writerWithDefaultPrettyPrinter().writeValueAsString(job), StandardCharsets.UTF_8);
        move(tmp, file);
    }

    private static void move(Path from, Path to) throws IOException {
        try {
            Files.move(from, to, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(from, to, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static String textOrNull(JsonNode node, String field) {
        JsonNode v = node.get(field);
        if (v == null || v.isNull()) {
            return null;
        }
        String text = v.asText("");
        return text.isBlank() ? null : text;
    }

    private static String stem(Path file) {
        String name = file.getFileName().toString();
        return name.endsWith(".json") ? name.substring(0, name.length() - 5) : name;
    }

    /** Id do job em execução, ou null. */
    public String currentJobId() {
        return currentJobId;
    }

    @Override
    public void close() {
        scheduler.shutdownNow();
        try {
            if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                LOGGER.warning("Queue poller não terminou em 5s");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
