package com.example.hostbackup.tools;

import com.example.hostbackup.config.UserSettings;
import com.example.hostbackup.jobs.JobFailure;
import com.example.hostbackup.joblog.JobLog;
import com.example.hostbackup.process.ProcessRunner;
import com.example.hostbackup.process.ProcessRunner.Outcome;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Adaptadores das ferramentas externas de arquivamento (pkgacct) e restauração (restorepkg).
 * Ambas rodam como subprocesso com a saída transmitida linha a linha para o log do job.
 */
public final class ToolAdapters {

    private ToolAdapters() {}

    // ==================================================================================
    // Arquivamento
    // ==================================================================================

    public interface ArchiveTool {
        /**
         * Gera o arquivo da conta dentro de {@code workDir}. Sucesso não garante arquivo regular:
         * o chamador confere.
         */
        ArchiveResult archive(String account, Path workDir, UserSettings settings, JobLog jobLog);
    }

    public static final class ArchiveResult {
        private final boolean success;
        private final String message;
        private final Path output;
        private final JobFailure failure;

        private ArchiveResult(boolean success, String message, Path output, JobFailure failure) {
            this.success = success;
            this.message = message;
            this.output = output;
            this.failure = failure;
        }

        public static ArchiveResult produced(Path output) {
            return new ArchiveResult(true, "Archive created", output, null);
        }

        public static ArchiveResult failed(JobFailure failure, String message) {
            return new ArchiveResult(false, message, null, failure);
        }

        public boolean success() { return success; }
        public String message() { return message; }
        public Path output() { return output; }
        public JobFailure failure() { return failure; }
    }

    /**
     * pkgacct [--skipX ...] [--nocompress] [--dbbackup=TIPO] conta diretório
     * Produz cpmove-{conta}.tar.gz no diretório indicado.
     */
    public static final class PkgacctArchiveTool implements ArchiveTool {
        private static final Logger log = LoggerFactory.getLogger(PkgacctArchiveTool.class);
        private final String bin;
        private final ProcessRunner runner;

        public PkgacctArchiveTool(String bin, ProcessRunner runner) {
            this.bin = Objects.requireNonNull(bin, "bin");
            this.runner = Objects.requireNonNull(runner, "runner");
        }

        @Override
        public ArchiveResult archive(String account, Path workDir, UserSettings settings, JobLog jobLog) {
            List<String> command = buildCommand(bin, account, workDir, settings);
            log.info("pkgacct para {} em {}", account, workDir);
            Outcome outcome;
            try {
                outcome = runner.run(command, ProcessRunner.jobLogSink(jobLog));
            } catch (ProcessRunner.SpawnException e) {
                return ArchiveResult.failed(JobFailure.PROCESS_SPAWN_FAILED, "Failed to start pkgacct: " + e.getMessage());
            } catch (IOException e) {
                return ArchiveResult.failed(JobFailure.ARCHIVE_TOOL_FAILED, "pkgacct failed: " + e.getMessage());
            }

            Path directoryOutput = workDir.resolve("cpmove-" + account);
            if (!outcome.succeeded()) {
                if (Files.isDirectory(directoryOutput)) {
                    deleteRecursively(directoryOutput);
                }
                return ArchiveResult.failed(JobFailure.ARCHIVE_TOOL_FAILED,
                        "pkgacct failed (exit code " + outcome.exitCode() + ")");
            }
            return ArchiveResult.produced(locateOutput(workDir, account));
        }

        static List<String> buildCommand(String bin, String account, Path workDir, UserSettings settings) {
            List<String> command = new ArrayList<>();
            command.add(bin);
            for (Map.Entry<String, Boolean> skip : settings.skipFlags().entrySet()) {
                if (Boolean.TRUE.equals(skip.getValue())) {
                    command.add("--skip" + skip.getKey());
                }
            }
            if ("uncompressed".equalsIgnoreCase(settings.compressionOption())) {
                command.add("--nocompress");
            }
            // Com backup quente o arquivo leva apenas o schema; os dados vão no arquivo de banco
            String dbType = settings.usesHotDatabaseBackup() ? "schema" : settings.dbBackupType();
            if (dbType != null && !dbType.isBlank() && !"all".equalsIgnoreCase(dbType)) {
                command.add("--dbbackup=" + dbType);
            }
            command.add(account);
            command.add(workDir.toString());
            return command;
        }

        private static Path locateOutput(Path workDir, String account) {
            Path gz = workDir.resolve("cpmove-" + account + ".tar.gz");
            if (Files.exists(gz)) return gz;
            Path tar = workDir.resolve("cpmove-" + account + ".tar");
            if (Files.exists(tar)) return tar;
            Path dir = workDir.resolve("cpmove-" + account);
            if (Files.exists(dir)) return dir;
            return gz;
        }
    }

    /** Remove diretório de saída parcial. Falhas são logadas; não há o que compensar além disso. */
    public static void deleteRecursively(Path dir) {
        try (Stream<Path> walk = Files.walk(dir)) {
            walk.sorted(Comparator.reverseOrder()).forEach(p -> {
                try {
                    Files.deleteIfExists(p);
                } catch (IOException e) {
                    LoggerFactory.getLogger(ToolAdapters.class).warn("Falha ao remover {}: {}", p, e.getMessage());
                }
            });
        } catch (IOException e) {
            LoggerFactory.getLogger(ToolAdapters.class).warn("Falha ao percorrer {}: {}", dir, e.getMessage());
        }
    }

    // ==================================================================================
    // Restauração
    // ==================================================================================

    /** Módulos que a ferramenta de restore aceita desabilitar. */
    public enum DisabledModule {
        Homedir, Mysql, Mail, MailRouting, SSL, Cron, ZoneFile, Domains
    }

    /**
     * Opções de restore. Toggles ausentes valem true (restaura tudo).
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class RestoreOptions {
        @JsonProperty("homedir") private boolean homedir = true;
        @JsonProperty("mysql") private boolean mysql = true;
        @JsonProperty("mail") private boolean mail = true;
        @JsonProperty("ssl") private boolean ssl = true;
        @JsonProperty("cron") private boolean cron = true;
        @JsonProperty("dns") private boolean dns = true;
        @JsonProperty("subdomains") private boolean subdomains = true;
        @JsonProperty("addon_domains") private boolean addonDomains = true;
        @JsonProperty("force") private boolean force = false;
        @JsonProperty("newuser") private String newUser = "";
        @JsonProperty("ip") private String ip = "";

        public RestoreOptions() {
            // Jackson
        }

        public static RestoreOptions all() { return new RestoreOptions(); }

        public boolean homedir() { return homedir; }
        public boolean mysql() { return mysql; }
        public boolean mail() { return mail; }
        public boolean ssl() { return ssl; }
        public boolean cron() { return cron; }
        public boolean dns() { return dns; }
        public boolean subdomains() { return subdomains; }
        public boolean addonDomains() { return addonDomains; }
        public boolean force() { return force; }
        public String newUser() { return newUser == null ? "" : newUser.trim(); }
        public String ip() { return ip == null ? "" : ip.trim(); }

        public RestoreOptions homedir(boolean v) { homedir = v; return this; }
        public RestoreOptions mysql(boolean v) { mysql = v; return this; }
        public RestoreOptions mail(boolean v) { mail = v; return this; }
        public RestoreOptions ssl(boolean v) { ssl = v; return this; }
        public RestoreOptions cron(boolean v) { cron = v; return this; }
        public RestoreOptions dns(boolean v) { dns = v; return this; }
        public RestoreOptions subdomains(boolean v) { subdomains = v; return this; }
        public RestoreOptions addonDomains(boolean v) { addonDomains = v; return this; }
        public RestoreOptions force(boolean v) { force = v; return this; }
        public RestoreOptions newUser(String v) { newUser = v; return this; }
        public RestoreOptions ip(String v) { ip = v; return this; }

        public List<DisabledModule> disabledModules() {
            List<DisabledModule> out = new ArrayList<>();
            if (!homedir) out.add(DisabledModule.Homedir);
            if (!mysql) out.add(DisabledModule.Mysql);
            if (!mail) {
                out.add(DisabledModule.Mail);
                out.add(DisabledModule.MailRouting);
            }
            if (!ssl) out.add(DisabledModule.SSL);
            if (!cron) out.add(DisabledModule.Cron);
            if (!dns) out.add(DisabledModule.ZoneFile);
            // Domains cobre subdomínios, parked e addon juntos: só desabilita se ambos estiverem off
            if (!subdomains && !addonDomains) out.add(DisabledModule.Domains);
            return out;
        }
    }

    public interface RestoreTool {
        RestoreToolResult restore(Path archive, RestoreOptions options, JobLog jobLog);
    }

    public static final class RestoreToolResult {
        private final boolean success;
        private final int exitCode;
        private final String message;
        private final JobFailure failure;

        private RestoreToolResult(boolean success, int exitCode, String message, JobFailure failure) {
            this.success = success;
            this.exitCode = exitCode;
            this.message = message;
            this.failure = failure;
        }

        public static RestoreToolResult completed() {
            return new RestoreToolResult(true, 0, "Restore completed successfully", null);
        }

        public static RestoreToolResult exited(int exitCode) {
            return new RestoreToolResult(false, exitCode, "Restore failed (exit code " + exitCode + ")", JobFailure.RESTORE_TOOL_FAILED);
        }

        public static RestoreToolResult notStarted(String message) {
            return new RestoreToolResult(false, -1, message, JobFailure.PROCESS_SPAWN_FAILED);
        }

        public boolean success() { return success; }
        public int exitCode() { return exitCode; }
        public String message() { return message; }
        public JobFailure failure() { return failure; }
    }

    /**
     * restorepkg [--force] [--newuser=N] [--ip=IP] [--disable=A,B] --skipaccount arquivo
     * O caminho do arquivo é sempre o último argumento; stdin é fechado logo após o start.
     */
    public static final class RestorepkgTool implements RestoreTool {
        private static final Logger log = LoggerFactory.getLogger(RestorepkgTool.class);
        private final String bin;
        private final ProcessRunner runner;

        public RestorepkgTool(String bin, ProcessRunner runner) {
            this.bin = Objects.requireNonNull(bin, "bin");
            this.runner = Objects.requireNonNull(runner, "runner");
        }

        @Override
        public RestoreToolResult restore(Path archive, RestoreOptions options, JobLog jobLog) {
            List<DisabledModule> disabled = options.disabledModules();
            if (!disabled.isEmpty()) {
                jobLog.line("Disabled modules: " + join(disabled, ", "));
            }
            List<String> command = buildCommand(bin, archive, options);
            log.debug("restorepkg: {}", command);
            Outcome outcome;
            try {
                outcome = runner.run(command, ProcessRunner.jobLogSink(jobLog));
            } catch (IOException e) {
                jobLog.line("ERROR: Failed to start restore process");
                return RestoreToolResult.notStarted("Failed to start restore process");
            }
            jobLog.separator('-');
            if (!outcome.succeeded()) {
                jobLog.line("restorepkg FAILED (exit code: " + outcome.exitCode() + ")");
                return RestoreToolResult.exited(outcome.exitCode());
            }
            jobLog.line("restorepkg completed successfully.");
            return RestoreToolResult.completed();
        }

        static List<String> buildCommand(String bin, Path archive, RestoreOptions options) {
            List<String> command = new ArrayList<>();
            command.add(bin);
            if (options.force()) {
                command.add("--force");
            }
            if (!options.newUser().isEmpty()) {
                command.add("--newuser=" + options.newUser());
            }
            if (!options.ip().isEmpty()) {
                command.add("--ip=" + options.ip());
            }
            List<DisabledModule> disabled = options.disabledModules();
            if (!disabled.isEmpty()) {
                command.add("--disable=" + join(disabled, ","));
            }
            command.add("--skipaccount");
            command.add(archive.toString());
            return command;
        }

        private static String join(List<DisabledModule> modules, String sep) {
            List<String> names = new ArrayList<>();
            modules.forEach(m -> names.add(m.name()));
            return String.join(sep, names);
        }
    }
}
