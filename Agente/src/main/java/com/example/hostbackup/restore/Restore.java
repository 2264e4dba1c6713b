package com.example.hostbackup.restore;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.example.hostbackup.config.UserSettings;
import com.example.hostbackup.jobs.JobFailure;
import com.example.hostbackup.joblog.JobLog;
import com.example.hostbackup.notify.Notifications.EventKind;
import com.example.hostbackup.notify.Notifications.NotificationDispatcher;
import com.example.hostbackup.oplog.OperationLog.OperationLogger;
import com.example.hostbackup.storage.Destinations;
import com.example.hostbackup.storage.Destinations.Destination;
import com.example.hostbackup.storage.Destinations.DestinationRegistry;
import com.example.hostbackup.storage.Storage.Retrieval;
import com.example.hostbackup.storage.Storage.Transport;
import com.example.hostbackup.storage.Storage.TransportRegistry;
import com.example.hostbackup.tools.ArchiveInspector;
import com.example.hostbackup.tools.HotDatabase;
import com.example.hostbackup.tools.HotDatabase.HotDatabaseTool;
import com.example.hostbackup.tools.ToolAdapters.RestoreOptions;
import com.example.hostbackup.tools.ToolAdapters.RestoreTool;
import com.example.hostbackup.tools.ToolAdapters.RestoreToolResult;
import com.example.hostbackup.util.ArchiveNames;
import com.example.hostbackup.util.Formats;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Agrupa os modelos e o serviço de restauração de uma conta a partir de um arquivo canônico.
 */
public final class Restore {

    private Restore() {}

    // ==================================================================================
    // Modelos
    // ==================================================================================

    public static final class RestoreRequest {
        private final String archiveRef;
        private final String destinationId;
        private final RestoreOptions options;
        private final String user;
        private final String restoreId;
        private final String requestor;

        private RestoreRequest(Builder b) {
            this.archiveRef = b.archiveRef.trim();
            this.destinationId = b.destinationId;
            this.options = b.options != null ? b.options : RestoreOptions.all();
            this.user = b.user;
            this.restoreId = b.restoreId;
            this.requestor = b.requestor != null && !b.requestor.isBlank() ? b.requestor : b.user;
        }

        /** Caminho local ou chave remota do arquivo principal. */
        public String archiveRef() { return archiveRef; }
        public String destinationId() { return destinationId; }
        public RestoreOptions options() { return options; }
        public String user() { return user; }
        /** Id gerado antes pelo chamador (para devolver ao cliente antes do restore começar). */
        public Optional<String> restoreId() { return Optional.ofNullable(restoreId).filter(s -> !s.isBlank()); }
        public String requestor() { return requestor; }

        public static Builder builder() { return new Builder(); }

        public static final class Builder {
            private String archiveRef;
            private String destinationId;
            private RestoreOptions options;
            private String user;
            private String restoreId;
            private String requestor;

            public Builder archiveRef(String v) { archiveRef = v; return this; }
            public Builder destinationId(String v) { destinationId = v; return this; }
            public Builder options(RestoreOptions v) { options = v; return this; }
            public Builder user(String v) { user = v; return this; }
            public Builder restoreId(String v) { restoreId = v; return this; }
            public Builder requestor(String v) { requestor = v; return this; }

            public RestoreRequest build() {
                Objects.requireNonNull(archiveRef, "archiveRef");
                Objects.requireNonNull(destinationId, "destinationId");
                Objects.requireNonNull(user, "user");
                return new RestoreRequest(this);
            }
        }
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static final class RestoreJobResult {
        @JsonProperty("success")
        private final boolean success;
        @JsonProperty("message")
        private final String message;
        @JsonProperty("restore_id")
        private final String restoreId;
        @JsonIgnore
        private final Path logFile;
        @JsonProperty("account")
        private final String account;
        @JsonProperty("failure")
        private final JobFailure failure;
        @JsonProperty("exit_code")
        private final Integer exitCode;
        @JsonProperty("db_restore_failed")
        private final boolean dbRestoreFailed;

        RestoreJobResult(boolean success, String message, String restoreId, Path logFile, String account,
                         JobFailure failure, Integer exitCode, boolean dbRestoreFailed) {
            this.success = success;
            this.message = message;
            this.restoreId = restoreId;
            this.logFile = logFile;
            this.account = account;
            this.failure = failure;
            this.exitCode = exitCode;
            this.dbRestoreFailed = dbRestoreFailed;
        }

        static RestoreJobResult failed(String restoreId, Path logFile, String account, JobFailure failure, String message) {
            return new RestoreJobResult(false, message, restoreId, logFile, account, failure, null, false);
        }

        public boolean success() { return success; }
        public String message() { return message; }
        public String restoreId() { return restoreId; }
        public Path logFile() { return logFile; }
        public String account() { return account; }
        public JobFailure failure() { return failure; }
        /** Exit code do restorepkg quando ele rodou e falhou. */
        public Optional<Integer> exitCode() { return Optional.ofNullable(exitCode); }
        /** Restore principal ok, mas o banco a quente falhou: sucesso com aviso. */
        public boolean dbRestoreFailed() { return dbRestoreFailed; }

        @JsonProperty("log_file")
        String logFileName() { return logFile == null ? null : logFile.toString(); }
    }

    // ==================================================================================
    // Serviço
    // ==================================================================================

    /**
     * Orquestrador do restore: valida destino, extrai a conta do nome canônico, obtém e verifica o
     * arquivo, procura o backup de banco companheiro, roda o restorepkg e, se houver, o restore do banco.
     * Arquivos em staging são apagados no fim, mas só os que estão sob a raiz temporária.
     */
    public static final class RestoreService {
        private static final Logger log = LoggerFactory.getLogger(RestoreService.class);
        private static final String DASHES = "-".repeat(60);

        private final DestinationRegistry destinations;
        private final TransportRegistry transports;
        private final RestoreTool restoreTool;
        private final HotDatabaseTool hotDatabase;
        private final OperationLogger operations;
        private final NotificationDispatcher notifications;
        private final UserSettings.Store settingsStore;
        private final Path logDir;
        private final Path tempDir;
        private final Clock clock;

        public RestoreService(DestinationRegistry destinations, TransportRegistry transports, RestoreTool restoreTool,
                              HotDatabaseTool hotDatabase, OperationLogger operations,
                              NotificationDispatcher notifications, UserSettings.Store settingsStore,
                              Path logDir, Path tempDir, Clock clock) {
            this.destinations = Objects.requireNonNull(destinations);
            this.transports = Objects.requireNonNull(transports);
            this.restoreTool = Objects.requireNonNull(restoreTool);
            this.hotDatabase = Objects.requireNonNull(hotDatabase);
            this.operations = operations != null ? operations : OperationLogger.noOp();
            this.notifications = notifications != null ? notifications : NotificationDispatcher.noOp();
            this.settingsStore = settingsStore != null ? settingsStore : user -> UserSettings.defaults();
            this.logDir = Objects.requireNonNull(logDir);
            this.tempDir = Objects.requireNonNull(tempDir);
            this.clock = clock != null ? clock : Clock.systemDefaultZone();
        }

        /** restore_{epoch}_{8 primeiros hex do md5 da referência}. */
        public String newRestoreId(String archiveRef) {
            return "restore_" + clock.instant().getEpochSecond() + "_" + md5Hex(archiveRef).substring(0, 8);
        }

        public RestoreJobResult run(RestoreRequest request) {
            Objects.requireNonNull(request, "request");
            String restoreId = request.restoreId().orElseGet(() -> newRestoreId(request.archiveRef()));
            JobLog jobLog;
            try {
                jobLog = JobLog.open(logDir, restoreId, JobLog.DATE_TIME, clock);
            } catch (IOException | RuntimeException e) {
                log.error("Não foi possível abrir o log do restore {}: {}", restoreId, e.getMessage());
                return RestoreJobResult.failed(restoreId, null, null, JobFailure.DIRECTORY_CREATE_FAILED,
                        "Failed to create log file: " + e.getMessage());
            }
            StagingArea staged = new StagingArea();
            try {
                return execute(request, restoreId, jobLog, staged);
            } catch (RuntimeException e) {
                log.error("Erro inesperado no restore {}", restoreId, e);
                jobLog.line("ERROR: Unexpected error - " + e.getMessage());
                return RestoreJobResult.failed(restoreId, jobLog.file(), null, JobFailure.UNEXPECTED_ERROR,
                        "Unexpected error: " + e.getMessage());
            } finally {
                // idempotente: execute() já limpa nos caminhos normais
                cleanup(staged, jobLog);
            }
        }

        private RestoreJobResult execute(RestoreRequest request, String restoreId, JobLog jobLog, StagingArea staged) {
            Instant started = clock.instant();
            String ref = request.archiveRef();
            String fileName = ArchiveNames.baseName(ref);

            Destinations.Resolution resolution = Destinations.resolve(destinations, request.destinationId());
            if (!resolution.ok()) {
                jobLog.line("ERROR: " + resolution.message() + " (" + request.destinationId() + ")");
                operations.logEvent(request.user(), "restore", List.of(fileName), false, resolution.message(),
                        request.requestor(), restoreId);
                return RestoreJobResult.failed(restoreId, jobLog.file(), null, resolution.failure(), resolution.message());
            }
            Destination destination = resolution.destination();
            boolean remote = !destination.isLocal();
            String type = remote ? "restore_remote" : "restore_local";

            Optional<String> parsedAccount = ArchiveNames.accountOf(ref);
            if (parsedAccount.isEmpty()) {
                String msg = "Could not extract account name from backup filename";
                jobLog.line("ERROR: " + msg + ": " + fileName);
                operations.logEvent(request.user(), type, List.of(fileName), false,
                        destination.describe() + "\n" + msg, request.requestor(), restoreId);
                return RestoreJobResult.failed(restoreId, jobLog.file(), null, JobFailure.UNPARSABLE_FILENAME, msg);
            }
            String account = parsedAccount.get();
            UserSettings settings = settingsStore.load(request.user());
            Transport transport = transports.forDestination(destination);
            staged.root = settings.tempDirectory(tempDir);
            Path stagingDir = staged.root.resolve(restoreId);

            jobLog.line("=== HOSTBACKUP RESTORE OPERATION ===");
            jobLog.line("Account: " + account);
            jobLog.line("Backup file: " + fileName);
            jobLog.line("Source: " + destination.name() + " (" + destination.type() + ")");
            jobLog.raw(DASHES);

            // 1. obter o arquivo
            if (remote) {
                jobLog.line("Downloading backup from remote destination...");
                jobLog.line("Remote path: " + ref);
            } else {
                jobLog.line("Locating backup file on local storage...");
            }
            Retrieval retrieval = transport.retrieve(ref, destination, stagingDir);
            if (!retrieval.success()) {
                jobLog.line("ERROR: Retrieval failed - " + retrieval.message());
                String msg = "Retrieval failed: " + retrieval.message();
                logOperation(request, type, account, started, false, destination.describe() + "\n" + msg, restoreId);
                notifyEnd(false, request, account, settings, msg, jobLog);
                return RestoreJobResult.failed(restoreId, jobLog.file(), account, JobFailure.RETRIEVAL_FAILED, msg);
            }
            Path localPath = retrieval.localPath();
            track(staged, retrieval);
            if (remote) {
                jobLog.line("Download complete! Size: " + Formats.size(retrieval.size()));
                jobLog.line("Local path: " + localPath);
            } else {
                jobLog.line("Backup file located: " + localPath + " (" + Formats.size(retrieval.size()) + ")");
            }
            jobLog.raw(DASHES);

            // 2. verificação estrutural
            jobLog.line("Verifying backup file integrity...");
            ArchiveInspector.Verification verification = ArchiveInspector.verify(localPath);
            if (!verification.valid()) {
                jobLog.line("ERROR: Invalid backup file - " + verification.message());
                cleanup(staged, jobLog);
                String msg = "Invalid backup file: " + verification.message();
                logOperation(request, type, account, started, false, destination.describe() + "\n" + msg, restoreId);
                notifyEnd(false, request, account, settings, msg, jobLog);
                return RestoreJobResult.failed(restoreId, jobLog.file(), account, JobFailure.VERIFICATION_FAILED, msg);
            }
            jobLog.line("Backup file verified successfully.");
            jobLog.raw(DASHES);

            // 3. banco companheiro (melhor esforço)
            Path dbLocalPath = null;
            Optional<String> dbRef = ArchiveNames.companionDatabaseRef(ref)
                    .filter(candidate -> transport.exists(candidate, destination));
            if (dbRef.isPresent()) {
                jobLog.line("Found accompanying database backup: " + ArchiveNames.baseName(dbRef.get()));
                if (remote) {
                    jobLog.line("Downloading database backup...");
                }
                Retrieval db = transport.retrieve(dbRef.get(), destination, stagingDir);
                if (db.success()) {
                    dbLocalPath = db.localPath();
                    track(staged, db);
                    jobLog.line("Database backup ready (" + Formats.size(db.size()) + ")");
                } else {
                    jobLog.line("Warning: Could not retrieve database backup - " + db.message());
                }
                jobLog.raw(DASHES);
            }

            // 4. início
            if (settings.notifyRestoreStart()) {
                jobLog.line("Sending restore start notification...");
                Map<String, Object> ctx = context(request, account, destination.id());
                notifications.dispatch(EventKind.RESTORE_START, ctx, settings);
            }

            // 5. restorepkg
            jobLog.line("Restoring account using restorepkg...");
            jobLog.line("Source: " + localPath.getFileName());
            RestoreToolResult tool = restoreTool.restore(localPath, request.options(), jobLog);
            if (!tool.success()) {
                jobLog.line("ERROR: Restore failed - " + tool.message());
                cleanup(staged, jobLog);
                logOperation(request, type, account, started, false, destination.describe() + "\n" + tool.message(), restoreId);
                notifyEnd(false, request, account, settings, tool.message(), jobLog);
                Integer exit = tool.failure() == JobFailure.RESTORE_TOOL_FAILED ? tool.exitCode() : null;
                return new RestoreJobResult(false, tool.message(), restoreId, jobLog.file(), account,
                        tool.failure(), exit, false);
            }
            jobLog.line("Account restore completed successfully.");
            jobLog.raw(DASHES);

            // 6. dados do banco: falha rebaixa a mensagem, não o sucesso
            String message = tool.message();
            boolean dbFailed = false;
            if (dbLocalPath != null && Files.isRegularFile(dbLocalPath)) {
                jobLog.line("Restoring database data from hot backup...");
                // sem método a quente configurado, o companheiro veio de um backup mariadb-backup
                String method = settings.usesHotDatabaseBackup() ? settings.dbBackupMethod() : UserSettings.DB_METHOD_MARIADB;
                HotDatabase.Result db = hotDatabase.restore(account, method, dbLocalPath, jobLog);
                if (!db.success()) {
                    jobLog.line("WARNING: Database data restore failed - " + db.message());
                    message = message + " (Warning: DB data restore failed: " + db.message() + ")";
                    dbFailed = true;
                } else {
                    jobLog.line("Database data restored successfully.");
                    message = message + " (DB data restored)";
                }
                jobLog.raw(DASHES);
            }

            // 7. limpeza, auditoria, notificação
            cleanup(staged, jobLog);
            logOperation(request, type, account, started, true, destination.describe() + "\n" + message, restoreId);
            notifyEnd(true, request, account, settings, message, jobLog);

            jobLog.raw("=".repeat(60));
            jobLog.line("RESTORE COMPLETED SUCCESSFULLY");
            jobLog.raw("=".repeat(60));
            log.info("Restore {} da conta {} concluído", restoreId, account);
            return new RestoreJobResult(true, message, restoreId, jobLog.file(), account,
                    dbFailed ? JobFailure.DATABASE_RESTORE_FAILED : null, null, dbFailed);
        }

        // ---- helpers ------------------------------------------------------------

        private static void track(StagingArea staged, Retrieval retrieval) {
            if (retrieval.staged() && staged.contains(retrieval.localPath())) {
                staged.files.add(retrieval.localPath());
            }
        }

        /** Apaga somente arquivos sob a raiz temporária; arquivos locais em posição final nunca. */
        private void cleanup(StagingArea staged, JobLog jobLog) {
            if (staged.files.isEmpty()) {
                return;
            }
            jobLog.line("Cleaning up temporary files...");
            Path parent = null;
            for (Path file : staged.files) {
                if (!staged.contains(file)) {
                    continue;
                }
                try {
                    if (Files.deleteIfExists(file)) {
                        jobLog.line("Removed temporary file: " + file.getFileName());
                    }
                } catch (IOException e) {
                    log.warn("Falha ao remover temporário {}: {}", file, e.getMessage());
                }
                parent = file.getParent();
            }
            staged.files.clear();
            if (parent != null && staged.contains(parent)) {
                try {
                    Files.deleteIfExists(parent);
                } catch (IOException e) {
                    log.debug("Diretório de staging {} mantido: {}", parent, e.getMessage());
                }
            }
            jobLog.line("Cleanup complete.");
            jobLog.raw(DASHES);
        }

        private void logOperation(RestoreRequest request, String type, String account, Instant started,
                                  boolean success, String message, String restoreId) {
            String duration = Formats.duration(Duration.between(started, clock.instant()));
            operations.logEvent(request.user(), type, List.of(account + " (" + duration + ")"), success, message,
                    request.requestor(), restoreId);
        }

        private void notifyEnd(boolean success, RestoreRequest request, String account, UserSettings settings,
                               String message, JobLog jobLog) {
            if (success && settings.notifyRestoreSuccess()) {
                jobLog.line("Sending restore success notification...");
                notifications.dispatch(EventKind.RESTORE_SUCCESS, context(request, account, null), settings);
            } else if (!success && settings.notifyRestoreFailure()) {
                jobLog.line("Sending restore failure notification...");
                Map<String, Object> ctx = context(request, account, null);
                ctx.put("error", message);
                notifications.dispatch(EventKind.RESTORE_FAILURE, ctx, settings);
            }
        }

        private static Map<String, Object> context(RestoreRequest request, String account, String destinationId) {
            Map<String, Object> ctx = new LinkedHashMap<>();
            ctx.put("account", account);
            ctx.put("backup_file", request.archiveRef());
            if (destinationId != null) {
                ctx.put("destination", destinationId);
            }
            ctx.put("user", request.user());
            ctx.put("requestor", request.requestor());
            return ctx;
        }

        private static String md5Hex(String value) {
            try {
                MessageDigest md = MessageDigest.getInstance("MD5");
                return HexFormat.of().formatHex(md.digest(value.getBytes(StandardCharsets.UTF_8)));
            } catch (NoSuchAlgorithmException e) {
                throw new IllegalStateException("MD5 indisponível", e);
            }
        }
    }

    /** Arquivos baixados para um restore e a raiz temporária que delimita o que pode ser apagado. */
    private static final class StagingArea {
        private Path root;
        private final List<Path> files = new ArrayList<>();

        boolean contains(Path path) {
            if (root == null) {
                return false;
            }
            Path r = root.toAbsolutePath().normalize();
            Path p = path.toAbsolutePath().normalize();
            return p.startsWith(r) && !p.equals(r);
        }
    }
}
