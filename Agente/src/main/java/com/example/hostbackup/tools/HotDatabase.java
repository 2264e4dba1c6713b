package com.example.hostbackup.tools;

import com.example.hostbackup.joblog.JobLog;
import com.example.hostbackup.process.ProcessRunner;
import com.example.hostbackup.process.ProcessRunner.Outcome;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Backup/restore quente (sem lock exclusivo) dos bancos de uma conta, separado do arquivo principal.
 *
 * O trabalho real fica num helper externo por método (mariadb-backup, mysqlbackup):
 * <pre>
 *   backup : {bin} --method=M --account=A --output=CAMINHO
 *   restore: {bin} --method=M --account=A --archive=CAMINHO
 * </pre>
 * No backup, exit 0 com arquivo criado = sucesso; exit 0 sem arquivo = conta sem bancos (skipped).
 */
public final class HotDatabase {

    private HotDatabase() {}

    public interface HotDatabaseTool {
        Result backup(String account, String method, Path output, JobLog jobLog);

        Result restore(String account, String method, Path archive, JobLog jobLog);
    }

    public static final class Result {
        private final boolean success;
        private final boolean skipped;
        private final Path archive;
        private final String message;

        private Result(boolean success, boolean skipped, Path archive, String message) {
            this.success = success;
            this.skipped = skipped;
            this.archive = archive;
            this.message = message;
        }

        public static Result produced(Path archive) { return new Result(true, false, archive, "Database backup created"); }
        public static Result skipped(String message) { return new Result(false, true, null, message); }
        public static Result restored() { return new Result(true, false, null, "Database data restored"); }
        public static Result failed(String message) { return new Result(false, false, null, message); }

        public boolean success() { return success; }
        /** Nada a fazer (ex.: conta sem bancos). Não é falha. */
        public boolean skipped() { return skipped; }
        public Optional<Path> archive() { return Optional.ofNullable(archive); }
        public String message() { return message; }
    }

    public static final class ScriptedHotDatabaseTool implements HotDatabaseTool {
        private static final Logger log = LoggerFactory.getLogger(ScriptedHotDatabaseTool.class);
        private final String backupBin;
        private final String restoreBin;
        private final ProcessRunner runner;

        public ScriptedHotDatabaseTool(Optional<String> backupBin, Optional<String> restoreBin, ProcessRunner runner) {
            this.backupBin = backupBin.orElse(null);
            this.restoreBin = restoreBin.orElse(null);
            this.runner = Objects.requireNonNull(runner, "runner");
        }

        @Override
        public Result backup(String account, String method, Path output, JobLog jobLog) {
            if (backupBin == null) {
                return Result.failed("Hot database backup helper not configured");
            }
            Outcome outcome;
            try {
                outcome = runner.run(List.of(backupBin, "--method=" + method, "--account=" + account, "--output=" + output),
                        ProcessRunner.jobLogSink(jobLog));
            } catch (IOException e) {
                return Result.failed("Failed to start " + method + ": " + e.getMessage());
            }
            if (!outcome.succeeded()) {
                try {
                    Files.deleteIfExists(output);
                } catch (IOException e) {
                    log.warn("Falha ao remover backup de banco parcial {}: {}", output, e.getMessage());
                }
                return Result.failed(method + " exited with code " + outcome.exitCode());
            }
            if (!Files.isRegularFile(output)) {
                return Result.skipped("No databases to backup");
            }
            return Result.produced(output);
        }

        @Override
        public Result restore(String account, String method, Path archive, JobLog jobLog) {
            if (restoreBin == null) {
                return Result.failed("Hot database restore helper not configured");
            }
            Outcome outcome;
            try {
                outcome = runner.run(List.of(restoreBin, "--method=" + method, "--account=" + account, "--archive=" + archive),
                        ProcessRunner.jobLogSink(jobLog));
            } catch (IOException e) {
                return Result.failed("Failed to start database restore: " + e.getMessage());
            }
            if (!outcome.succeeded()) {
                return Result.failed("database restore exited with code " + outcome.exitCode());
            }
            return Result.restored();
        }
    }
}
