package com.example.hostbackup.backup;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermissions;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.example.hostbackup.cancel.Cancellation.CancellationRegistry;
import com.example.hostbackup.config.UserSettings;
import com.example.hostbackup.jobs.JobFailure;
import com.example.hostbackup.joblog.JobLog;
import com.example.hostbackup.manifest.Manifest;
import com.example.hostbackup.manifest.Manifest.ManifestEntry;
import com.example.hostbackup.manifest.Manifest.ManifestTracker;
import com.example.hostbackup.notify.Notifications.EventKind;
import com.example.hostbackup.notify.Notifications.NotificationDispatcher;
import com.example.hostbackup.oplog.OperationLog.OperationLogger;
import com.example.hostbackup.storage.Destinations;
import com.example.hostbackup.storage.Destinations.Destination;
import com.example.hostbackup.storage.Destinations.DestinationRegistry;
import com.example.hostbackup.storage.Storage;
import com.example.hostbackup.storage.Storage.Transport;
import com.example.hostbackup.storage.Storage.TransportRegistry;
import com.example.hostbackup.storage.Storage.TransportResult;
import com.example.hostbackup.tools.HotDatabase;
import com.example.hostbackup.tools.HotDatabase.HotDatabaseTool;
import com.example.hostbackup.tools.ToolAdapters;
import com.example.hostbackup.tools.ToolAdapters.ArchiveResult;
import com.example.hostbackup.tools.ToolAdapters.ArchiveTool;
import com.example.hostbackup.util.ArchiveNames;
import com.example.hostbackup.util.Formats;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Agrega serviços e modelos relacionados ao fluxo de backup de contas.
 */
public final class Backup {

    private Backup() {}

    /**
     * Orquestrador do backup. Para cada conta, em sequência: pkgacct -> renomeia -> banco a quente
     * (opcional) -> upload e limpeza (remoto) -> manifest. Cancelamento só é observado entre contas.
     */
    public static final class BackupCoordinator {
        private static final Logger log = LoggerFactory.getLogger(BackupCoordinator.class);
        private static final String RULE = "========================================";

        private final DestinationRegistry destinations;
        private final TransportRegistry transports;
        private final ArchiveTool archiveTool;
        private final HotDatabaseTool hotDatabase;
        private final ManifestTracker manifest;
        private final OperationLogger operations;
        private final CancellationRegistry cancellation;
        private final NotificationDispatcher notifications;
        private final UserSettings.Store settingsStore;
        private final Path logDir;
        private final Path tempDir;
        private final Clock clock;

        private BackupCoordinator(Builder b) {
            this.destinations = Objects.requireNonNull(b.destinations, "destinations");
            this.transports = Objects.requireNonNull(b.transports, "transports");
            this.archiveTool = Objects.requireNonNull(b.archiveTool, "archiveTool");
            this.hotDatabase = Objects.requireNonNull(b.hotDatabase, "hotDatabase");
            this.manifest = Objects.requireNonNull(b.manifest, "manifest");
            this.operations = b.operations != null ? b.operations : OperationLogger.noOp();
            this.cancellation = b.cancellation != null ? b.cancellation : CancellationRegistry.none();
            this.notifications = b.notifications != null ? b.notifications : NotificationDispatcher.noOp();
            this.settingsStore = b.settingsStore != null ? b.settingsStore : user -> UserSettings.defaults();
            this.logDir = Objects.requireNonNull(b.logDir, "logDir");
            this.tempDir = Objects.requireNonNull(b.tempDir, "tempDir");
            this.clock = b.clock != null ? b.clock : Clock.systemDefaultZone();
        }

        public static Builder builder() { return new Builder(); }

        public static final class Builder {
            private DestinationRegistry destinations;
            private TransportRegistry transports;
            private ArchiveTool archiveTool;
            private HotDatabaseTool hotDatabase;
            private ManifestTracker manifest;
            private OperationLogger operations;
            private CancellationRegistry cancellation;
            private NotificationDispatcher notifications;
            private UserSettings.Store settingsStore;
            private Path logDir;
            private Path tempDir;
            private Clock clock;

            private Builder() {}

            public Builder destinations(DestinationRegistry v) { destinations = v; return this; }
            public Builder transports(TransportRegistry v) { transports = v; return this; }
            public Builder archiveTool(ArchiveTool v) { archiveTool = v; return this; }
            public Builder hotDatabase(HotDatabaseTool v) { hotDatabase = v; return this; }
            public Builder manifest(ManifestTracker v) { manifest = v; return this; }
            public Builder operations(OperationLogger v) { operations = v; return this; }
            public Builder cancellation(CancellationRegistry v) { cancellation = v; return this; }
            public Builder notifications(NotificationDispatcher v) { notifications = v; return this; }
            public Builder settingsStore(UserSettings.Store v) { settingsStore = v; return this; }
            public Builder logDir(Path v) { logDir = v; return this; }
            public Builder tempDir(Path v) { tempDir = v; return this; }
            public Builder clock(Clock v) { clock = v; return this; }

            public BackupCoordinator build() { return new BackupCoordinator(this); }
        }

        // =====================
        // API PÚBLICA PRINCIPAL
        // =====================

        public BackupJobResult run(BackupRequest request) {
            return run(request, null);
        }

        /**
         * Executa o job inteiro. Nenhuma exceção atravessa este método: todo caminho devolve um
         * {@link BackupJobResult}.
         */
        public BackupJobResult run(BackupRequest request, BackupProgressListener listener) {
            Objects.requireNonNull(request, "request");
            String backupId = newBackupId();
            JobLog jobLog;
            try {
                jobLog = JobLog.open(logDir, backupId, JobLog.TIME_ONLY, clock);
            } catch (IOException | RuntimeException e) {
                log.error("Não foi possível abrir o log do job {} em {}: {}", backupId, logDir, e.getMessage());
                return BackupJobResult.preflight(backupId, null, JobFailure.DIRECTORY_CREATE_FAILED,
                        "Failed to create log file: " + e.getMessage());
            }
            try {
                return execute(request, backupId, jobLog, listener);
            } catch (RuntimeException e) {
                log.error("Erro inesperado no job {}", backupId, e);
                jobLog.line("[ERROR] Unexpected error: " + e.getMessage());
                jobLog.line("BACKUP FAILED");
                return BackupJobResult.preflight(backupId, jobLog.file(), JobFailure.UNEXPECTED_ERROR,
                        "Unexpected error: " + e.getMessage());
            }
        }

        private BackupJobResult execute(BackupRequest request, String backupId, JobLog jobLog,
                                        BackupProgressListener listener) {
            List<String> accounts = request.accounts();
            jobLog.line(RULE);
            jobLog.line("HOSTBACKUP BACKUP OPERATION");
            jobLog.line(RULE);
            jobLog.line("Backup ID: " + backupId);
            jobLog.line("Started: " + LocalDateTime.now(clock).format(JobLog.DATE_TIME));
            jobLog.line("User: " + request.user());
            jobLog.line("Accounts: " + String.join(", ", accounts));
            jobLog.line("");

            // 1. destino: inexistente ou desabilitado encerra antes de qualquer efeito colateral
            Destinations.Resolution resolution = Destinations.resolve(destinations, request.destinationId());
            if (!resolution.ok()) {
                if (resolution.failure() == JobFailure.INVALID_DESTINATION) {
                    jobLog.line("[ERROR] Invalid destination ID: " + request.destinationId());
                } else {
                    jobLog.line("[ERROR] Destination is disabled: " + resolution.destination().name());
                }
                jobLog.line("");
                jobLog.line("BACKUP FAILED");
                log.warn("Backup {} recusado: {}", backupId, resolution.message());
                // sem destino resolvido não há sufixo _local/_remote
                operations.logEvent(request.user(), "backup", accounts, false, resolution.message(),
                        request.requestor(), backupId);
                return BackupJobResult.preflight(backupId, jobLog.file(), resolution.failure(), resolution.message());
            }
            Destination destination = resolution.destination();
            UserSettings settings = settingsStore.load(request.user());

            jobLog.line("[STEP 1/5] Validating destination...");
            jobLog.line("  → Destination: " + destination.name());
            jobLog.line("  → Type: " + destination.type());
            jobLog.line("  → Path: " + (destination.path().isEmpty() ? "/" : destination.path()));
            jobLog.line("");

            // 2. notificação de início
            if (settings.notifyBackupStart()) {
                jobLog.line("[STEP 2/5] Sending start notification...");
                notifications.dispatch(EventKind.BACKUP_START, context(request, destination), settings);
                jobLog.line("  → Notification sent");
            } else {
                jobLog.line("[STEP 2/5] Start notification skipped (not enabled)");
            }
            jobLog.line("");

            // 3. contas, estritamente em sequência
            Map<String, AccountBackupResult> results = new LinkedHashMap<>();
            List<String> errors = new ArrayList<>();
            List<String> logMessages = new ArrayList<>();
            List<String> accountsWithDuration = new ArrayList<>();
            int total = accounts.size();
            int processed = 0;
            boolean cancelled = false;

            for (String account : accounts) {
                processed++;
                jobLog.line("[STEP 3/5] Processing account " + processed + "/" + total + ": " + account);
                jobLog.line("-".repeat(40));

                Instant started = clock.instant();
                AccountOutcome outcome;
                try {
                    outcome = backupSingleAccount(account, destination, settings, backupId, jobLog);
                } catch (RuntimeException e) {
                    log.error("Erro inesperado no backup da conta {}", account, e);
                    outcome = AccountOutcome.failed(JobFailure.UNEXPECTED_ERROR, "Unexpected error: " + e.getMessage());
                }
                Duration elapsed = Duration.between(started, clock.instant());
                String durationStr = Formats.duration(elapsed);
                accountsWithDuration.add(account + " (" + durationStr + ")");

                AccountBackupResult result = outcome.toResult(account, elapsed);
                results.put(account, result);

                if (!result.success()) {
                    errors.add(account + ": " + result.message());
                    jobLog.line("  ✗ FAILED: " + result.message() + " (" + durationStr + ")");
                } else {
                    jobLog.line("  ✓ SUCCESS: " + result.message() + " (" + durationStr + ")");
                    appendManifest(request, result, jobLog);
                }
                logMessages.add("[" + account + "] " + (result.success() ? "SUCCESS" : "FAILED") + ": " + result.message());
                jobLog.line("");

                if (listener != null) {
                    try {
                        listener.onProgress(processed, total);
                    } catch (RuntimeException e) {
                        log.warn("Listener de progresso falhou: {}", e.getMessage());
                    }
                }

                if (request.jobId().isPresent() && cancellation.isCancelRequested(request.jobId().get())) {
                    jobLog.line("");
                    jobLog.line("⚠️ CANCELLATION REQUESTED");
                    jobLog.line("Job cancelled by user after completing " + processed + "/" + total + " accounts");
                    List<String> remaining = accounts.subList(processed, total);
                    jobLog.line("Remaining accounts skipped: " + String.join(", ", remaining));
                    jobLog.line("");
                    cancellation.clear(request.jobId().get());
                    logMessages.add("[CANCELLED] Remaining accounts skipped: " + String.join(", ", remaining));
                    cancelled = true;
                    break;
                }
            }

            boolean success = errors.isEmpty() && !cancelled;

            jobLog.line("[STEP 4/5] Backup processing complete");
            jobLog.line("  → Completed: " + processed + "/" + total);
            jobLog.line("  → Successful: " + (processed - errors.size()) + "/" + processed);
            jobLog.line("  → Failed: " + errors.size() + "/" + processed);
            if (cancelled) {
                jobLog.line("  → Status: CANCELLED");
            }
            jobLog.line("");

            // 5. evento de auditoria único para o job
            String type = destination.isLocal() ? "backup_local" : "backup_remote";
            String opMessage = destination.describe() + "\n" + String.join("\n", logMessages);
            operations.logEvent(request.user(), type, accountsWithDuration, success, opMessage,
                    request.requestor(), backupId);

            // 6. no máximo uma notificação de término; cancelado não notifica
            jobLog.line("[STEP 5/5] Sending completion notification...");
            if (!cancelled && success && settings.notifyBackupSuccess()) {
                jobLog.line("  → Sending success notification");
                Map<String, Object> ctx = context(request, destination);
                Map<String, String> summary = new LinkedHashMap<>();
                results.forEach((acct, r) -> summary.put(acct, r.message()));
                ctx.put("results", summary);
                notifications.dispatch(EventKind.BACKUP_SUCCESS, ctx, settings);
            } else if (!cancelled && !success && settings.notifyBackupFailure()) {
                jobLog.line("  → Sending failure notification");
                Map<String, Object> ctx = context(request, destination);
                ctx.put("errors", List.copyOf(errors));
                notifications.dispatch(EventKind.BACKUP_FAILURE, ctx, settings);
            } else {
                jobLog.line("  → No notification configured for this outcome");
            }

            jobLog.line("");
            jobLog.line(RULE);
            if (cancelled) {
                jobLog.line("BACKUP CANCELLED");
                jobLog.line("Completed " + processed + "/" + total + " accounts before cancellation");
            } else if (success) {
                jobLog.line("BACKUP COMPLETED SUCCESSFULLY");
            } else {
                jobLog.line("BACKUP FAILED");
                jobLog.line("Errors: " + String.join("; ", errors));
            }
            jobLog.line("Finished: " + LocalDateTime.now(clock).format(JobLog.DATE_TIME));
            jobLog.line(RULE);

            String message = success
                    ? "All backups completed successfully"
                    : cancelled
                        ? "Cancelled after " + processed + "/" + total + " accounts"
                        : "Some backups failed";
            log.info("Backup {} encerrado: {}", backupId, message);
            return new BackupJobResult(success, cancelled, message, results, errors,
                    String.join("\n", logMessages), backupId, jobLog.file(),
                    cancelled ? JobFailure.CANCELLED : null);
        }

        // =====================
        // Conta individual
        // =====================

        private AccountOutcome backupSingleAccount(String account, Destination destination, UserSettings settings,
                                                   String backupId, JobLog jobLog) {
            boolean local = destination.isLocal();
            Path workDir = local
                    ? Path.of(Storage.resolvePath(account, destination))
                    : settings.tempDirectory(tempDir).resolve(backupId);
            try {
                createPrivateDirectory(workDir);
            } catch (IOException e) {
                log.warn("Falha ao criar {}: {}", workDir, e.getMessage());
                return AccountOutcome.failed(JobFailure.DIRECTORY_CREATE_FAILED,
                        (local ? "Failed to create backup directory: " : "Failed to create temp directory: ") + workDir);
            }

            jobLog.line("  [3a] Preparing backup environment...");
            jobLog.line("      → Destination type: " + destination.type());
            jobLog.line("      → Working directory: " + workDir);

            // pkgacct
            jobLog.line("  [3b] Running pkgacct for " + account + "...");
            jobLog.line("      " + "─".repeat(56));
            ArchiveResult archive = archiveTool.archive(account, workDir, settings, jobLog);
            jobLog.line("      " + "─".repeat(56));
            if (!archive.success()) {
                jobLog.line("      ✗ pkgacct failed: " + archive.message());
                cleanupStagingDir(local, workDir);
                return AccountOutcome.failed(archive.failure(), archive.message());
            }
            jobLog.line("      ✓ pkgacct completed successfully");

            Path created = archive.output();
            if (created == null || !Files.isRegularFile(created)) {
                jobLog.line("      ✗ pkgacct did not create expected file: " + created);
                if (created != null && Files.isDirectory(created)) {
                    ToolAdapters.deleteRecursively(created);
                }
                cleanupStagingDir(local, workDir);
                return AccountOutcome.failed(JobFailure.ARTIFACT_MISSING, "pkgacct did not create a valid archive file");
            }

            // nome canônico e permissão restrita antes de qualquer transporte
            LocalDateTime stamp = LocalDateTime.now(clock);
            String backupFile = ArchiveNames.backupFileName(account, stamp);
            Path finalFile = workDir.resolve(backupFile);
            jobLog.line("      → Renaming to: " + backupFile);
            try {
                Files.move(created, finalFile);
            } catch (IOException e) {
                jobLog.line("      ✗ Failed to rename backup file");
                deleteQuietly(created);
                cleanupStagingDir(local, workDir);
                return AccountOutcome.failed(JobFailure.RENAME_FAILED, "Failed to rename backup file");
            }
            restrictPermissions(finalFile, "rw-------");
            long size = sizeOf(finalFile);
            jobLog.line("      → Archive size: " + Formats.size(size));

            try (StagedFiles staged = new StagedFiles(local ? null : workDir)) {
                staged.add(finalFile);

                // banco a quente
                String dbFile = null;
                if (settings.usesHotDatabaseBackup()) {
                    String method = settings.dbBackupMethod();
                    jobLog.line("  [3c] Running hot database backup (" + method + ")...");
                    Path dbOutput = workDir.resolve(ArchiveNames.databaseFileName(account, stamp));
                    HotDatabase.Result db = hotDatabase.backup(account, method, dbOutput, jobLog);
                    if (!db.success() && !db.skipped()) {
                        jobLog.line("      ✗ Database backup failed: " + db.message());
                        // compensação: nenhum backup parcial fica no lugar
                        deleteQuietly(finalFile);
                        return AccountOutcome.failed(JobFailure.DATABASE_BACKUP_FAILED,
                                "Database backup failed: " + db.message());
                    }
                    Optional<Path> dbArchive = db.archive().filter(Files::isRegularFile);
                    if (dbArchive.isPresent()) {
                        dbFile = dbArchive.get().getFileName().toString();
                        staged.add(dbArchive.get());
                        jobLog.line("      ✓ Database backup created: " + dbFile + " (" + Formats.size(sizeOf(dbArchive.get())) + ")");
                    } else {
                        jobLog.line("      → No databases to backup (skipped)");
                    }
                } else {
                    jobLog.line("  [3c] Database backup method: pkgacct (included in archive)");
                }

                if (local) {
                    jobLog.line("  [3d] Local backup complete - files in place");
                    return AccountOutcome.ok(backupFile, dbFile, size);
                }

                // remoto: upload de tudo, limpeza garantida pelo StagedFiles
                jobLog.line("  [3d] Uploading to remote destination...");
                Transport transport = transports.forDestination(destination);
                List<String> failures = new ArrayList<>();
                for (Path file : staged.files()) {
                    String filename = file.getFileName().toString();
                    jobLog.line("      → Uploading: " + filename);
                    TransportResult uploaded = transport.upload(file, account + "/" + filename, destination);
                    if (uploaded.success()) {
                        jobLog.line("        ✓ Upload successful");
                    } else {
                        String msg = uploaded.message().isEmpty() ? "Upload failed" : uploaded.message();
                        failures.add(filename + ": " + msg);
                        jobLog.line("        ✗ Upload failed: " + msg);
                    }
                }
                jobLog.line("  [3e] Cleaning up temporary files...");
                staged.close(jobLog);
                jobLog.line("      ✓ Cleanup complete");
                if (!failures.isEmpty()) {
                    return AccountOutcome.failed(JobFailure.TRANSPORT_FAILED, String.join("; ", failures),
                            backupFile, dbFile, size);
                }
                return AccountOutcome.ok(backupFile, dbFile, size);
            }
        }

        private void appendManifest(BackupRequest request, AccountBackupResult result, JobLog jobLog) {
            ManifestEntry entry = new ManifestEntry(
                    request.scheduleId().orElse(Manifest.MANUAL_ID),
                    result.account(), result.file(), result.dbFile(), result.size(),
                    request.destinationId(), request.retention(), clock.instant().getEpochSecond());
            try {
                manifest.append(entry);
            } catch (IOException | RuntimeException e) {
                // a conta já está no destino; perder a entrada só afeta a poda
                log.error("Falha ao gravar manifest de {}: {}", result.account(), e.getMessage());
                jobLog.line("  [WARN] Manifest entry not recorded: " + e.getMessage());
            }
        }

        private static Map<String, Object> context(BackupRequest request, Destination destination) {
            Map<String, Object> ctx = new LinkedHashMap<>();
            ctx.put("accounts", request.accounts());
            ctx.put("destination", destination.name());
            ctx.put("user", request.user());
            ctx.put("requestor", request.requestor());
            return ctx;
        }

        private void cleanupStagingDir(boolean local, Path workDir) {
            if (!local) {
                deleteEmptyDir(workDir);
            }
        }

        private String newBackupId() {
            return "backup_" + clock.instant().getEpochSecond() + "_"
                    + UUID.randomUUID().toString().replace("-", "").substring(0, 8);
        }
    }

    // ==================================================================================
    // Staging
    // ==================================================================================

    /**
     * Conjunto de arquivos em staging de uma conta remota. close() apaga todos, em qualquer caminho de
     * saída, e remove o diretório privado do job se ficar vazio. Com stagingDir nulo (destino local)
     * nada é apagado: os arquivos já estão na posição final.
     */
    private static final class StagedFiles implements AutoCloseable {
        private final Path stagingDir;
        private final List<Path> files = new ArrayList<>();
        private boolean closed;

        StagedFiles(Path stagingDir) {
            this.stagingDir = stagingDir;
        }

        void add(Path file) { files.add(file); }

        List<Path> files() { return Collections.unmodifiableList(files); }

        void close(JobLog jobLog) {
            if (closed || stagingDir == null) {
                closed = true;
                return;
            }
            closed = true;
            for (Path file : files) {
                if (Files.exists(file)) {
                    if (jobLog != null) {
                        jobLog.line("      → Removing: " + file.getFileName());
                    }
                    deleteQuietly(file);
                }
            }
            deleteEmptyDir(stagingDir);
        }

        @Override
        public void close() {
            close(null);
        }
    }

    // ==================================================================================
    // Helpers de filesystem
    // ==================================================================================

    private static void createPrivateDirectory(Path dir) throws IOException {
        if (Files.isDirectory(dir)) {
            return;
        }
        Files.createDirectories(dir);
        restrictPermissions(dir, "rwx------");
    }

    private static void restrictPermissions(Path path, String perms) {
        try {
            Files.setPosixFilePermissions(path, PosixFilePermissions.fromString(perms));
        } catch (UnsupportedOperationException | IOException e) {
            LoggerFactory.getLogger(Backup.class).debug("Permissões não aplicadas em {}: {}", path, e.getMessage());
        }
    }

    private static void deleteQuietly(Path file) {
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            LoggerFactory.getLogger(Backup.class).warn("Falha ao remover {}: {}", file, e.getMessage());
        }
    }

    private static void deleteEmptyDir(Path dir) {
        try (java.util.stream.Stream<Path> children = Files.list(dir)) {
            if (children.findAny().isEmpty()) {
                Files.deleteIfExists(dir);
            }
        } catch (IOException e) {
            LoggerFactory.getLogger(Backup.class).debug("Diretório de staging {} mantido: {}", dir, e.getMessage());
        }
    }

    private static long sizeOf(Path file) {
        try {
            return Files.size(file);
        } catch (IOException e) {
            return 0;
        }
    }

    // ==================================================================================
    // Classes de Dados
    // ==================================================================================

    /** Pedido imutável de backup. */
    public static final class BackupRequest {
        private final List<String> accounts;
        private final String destinationId;
        private final String user;
        private final String jobId;
        private final String scheduleId;
        private final int retention;
        private final String requestor;

        private BackupRequest(Builder b) {
            this.accounts = List.copyOf(b.accounts);
            this.destinationId = b.destinationId;
            this.user = b.user;
            this.jobId = b.jobId;
            this.scheduleId = b.scheduleId;
            this.retention = Math.max(0, b.retention);
            this.requestor = b.requestor != null && !b.requestor.isBlank() ? b.requestor : b.user;
        }

        public List<String> accounts() { return accounts; }
        public String destinationId() { return destinationId; }
        public String user() { return user; }
        /** Id do job na fila, usado só para cancelamento. */
        public Optional<String> jobId() { return Optional.ofNullable(jobId).filter(s -> !s.isBlank()); }
        /** Vazio em backups manuais. */
        public Optional<String> scheduleId() { return Optional.ofNullable(scheduleId).filter(s -> !s.isBlank()); }
        /** 0 = ilimitado. */
        public int retention() { return retention; }
        public String requestor() { return requestor; }

        public static Builder builder() { return new Builder(); }

        public static final class Builder {
            private final List<String> accounts = new ArrayList<>();
            private String destinationId;
            private String user;
            private String jobId;
            private String scheduleId;
            private int retention = 30;
            private String requestor;

            public Builder account(String account) { accounts.add(account); return this; }
            public Builder accounts(List<String> values) { accounts.addAll(values); return this; }
            public Builder destinationId(String v) { destinationId = v; return this; }
            public Builder user(String v) { user = v; return this; }
            public Builder jobId(String v) { jobId = v; return this; }
            public Builder scheduleId(String v) { scheduleId = v; return this; }
            public Builder retention(int v) { retention = v; return this; }
            public Builder requestor(String v) { requestor = v; return this; }

            public BackupRequest build() {
                if (accounts.isEmpty()) {
                    throw new IllegalArgumentException("Nenhuma conta informada");
                }
                for (String account : accounts) {
                    if (account == null || !account.matches("[a-z0-9_]+")) {
                        throw new IllegalArgumentException("Conta inválida: " + account);
                    }
                }
                Objects.requireNonNull(destinationId, "destinationId");
                Objects.requireNonNull(user, "user");
                return new BackupRequest(this);
            }
        }
    }

    /** Resultado de uma conta, criado uma única vez. */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static final class AccountBackupResult {
        @JsonIgnore
        private final String account;
        @JsonProperty("success")
        private final boolean success;
        @JsonProperty("message")
        private final String message;
        @JsonProperty("file")
        private final String file;
        @JsonProperty("db_file")
        private final String dbFile;
        @JsonProperty("size")
        private final long size;
        @JsonIgnore
        private final Duration elapsed;
        @JsonProperty("failure")
        private final JobFailure failure;

        public AccountBackupResult(String account, boolean success, String message, String file, String dbFile,
                                   long size, Duration elapsed, JobFailure failure) {
            this.account = account;
            this.success = success;
            this.message = message;
            this.file = file;
            this.dbFile = dbFile;
            this.size = size;
            this.elapsed = elapsed;
            this.failure = failure;
        }

        public String account() { return account; }
        public boolean success() { return success; }
        public String message() { return message; }
        public String file() { return file; }
        public String dbFile() { return dbFile; }
        public long size() { return size; }
        public Duration elapsed() { return elapsed; }
        public JobFailure failure() { return failure; }

        @JsonProperty("duration")
        public String durationFormatted() { return elapsed == null ? null : Formats.duration(elapsed); }
    }

    /** Resultado interno de backupSingleAccount, antes de saber a duração. */
    private static final class AccountOutcome {
        private final boolean success;
        private final String message;
        private final String file;
        private final String dbFile;
        private final long size;
        private final JobFailure failure;

        private AccountOutcome(boolean success, String message, String file, String dbFile, long size, JobFailure failure) {
            this.success = success;
            this.message = message;
            this.file = file;
            this.dbFile = dbFile;
            this.size = size;
            this.failure = failure;
        }

        static AccountOutcome ok(String file, String dbFile, long size) {
            return new AccountOutcome(true, "Backup completed successfully", file, dbFile, size, null);
        }

        static AccountOutcome failed(JobFailure failure, String message) {
            return new AccountOutcome(false, message, null, null, 0, failure);
        }

        static AccountOutcome failed(JobFailure failure, String message, String file, String dbFile, long size) {
            return new AccountOutcome(false, message, file, dbFile, size, failure);
        }

        AccountBackupResult toResult(String account, Duration elapsed) {
            return new AccountBackupResult(account, success, message, file, dbFile, size, elapsed, failure);
        }
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static final class BackupJobResult {
        @JsonProperty("success")
        private final boolean success;
        @JsonProperty("cancelled")
        private final boolean cancelled;
        @JsonProperty("message")
        private final String message;
        @JsonProperty("results")
        private final Map<String, AccountBackupResult> results;
        @JsonProperty("errors")
        private final List<String> errors;
        @JsonProperty("log")
        private final String log;
        @JsonProperty("backup_id")
        private final String backupId;
        @JsonIgnore
        private final Path logFile;
        @JsonProperty("failure")
        private final JobFailure failure;

        public BackupJobResult(boolean success, boolean cancelled, String message,
                               Map<String, AccountBackupResult> results, List<String> errors, String log,
                               String backupId, Path logFile, JobFailure failure) {
            this.success = success;
            this.cancelled = cancelled;
            this.message = message;
            this.results = Collections.unmodifiableMap(new LinkedHashMap<>(results));
            this.errors = List.copyOf(errors);
            this.log = log;
            this.backupId = backupId;
            this.logFile = logFile;
            this.failure = failure;
        }

        static BackupJobResult preflight(String backupId, Path logFile, JobFailure failure, String message) {
            return new BackupJobResult(false, false, message, Map.of(), List.of(message), "", backupId, logFile, failure);
        }

        public boolean success() { return success; }
        public boolean cancelled() { return cancelled; }
        public String message() { return message; }
        public Map<String, AccountBackupResult> results() { return results; }
        public List<String> errors() { return errors; }
        public String log() { return log; }
        public String backupId() { return backupId; }
        public Path logFile() { return logFile; }
        /** Falha de pré-validação ou CANCELLED; nulo quando o job rodou (falhas por conta ficam em results). */
        public JobFailure failure() { return failure; }
    }

    @FunctionalInterface
    public interface BackupProgressListener {
        void onProgress(int completed, int total);
    }
}
