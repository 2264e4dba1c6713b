package com.example.hostbackup.tools;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.example.hostbackup.ArchiveFixtures;
import com.example.hostbackup.config.UserSettings;
import com.example.hostbackup.jobs.JobFailure;
import com.example.hostbackup.joblog.JobLog;
import com.example.hostbackup.process.ProcessRunner;
import com.example.hostbackup.tools.ToolAdapters.ArchiveResult;
import com.example.hostbackup.tools.ToolAdapters.DisabledModule;
import com.example.hostbackup.tools.ToolAdapters.PkgacctArchiveTool;
import com.example.hostbackup.tools.ToolAdapters.RestoreOptions;
import com.example.hostbackup.tools.ToolAdapters.RestoreToolResult;
import com.example.hostbackup.tools.ToolAdapters.RestorepkgTool;
import com.fasterxml.jackson.databind.ObjectMapper;

class ToolAdaptersTest {

    @TempDir
    Path dir;

    private final ProcessRunner runner = new ProcessRunner(Duration.ofMillis(20));
    private JobLog jobLog;

    @BeforeEach
    void openLog() throws Exception {
        jobLog = JobLog.open(dir.resolve("logs"), "job", JobLog.TIME_ONLY, Clock.systemUTC());
    }

    // ---- pkgacct ----

    @Test
    void pkgacctCommandCarriesSkipsCompressionAndSchemaOnlyForHotDatabases() {
        UserSettings settings = UserSettings.defaults()
                .withSkip("logs", true)
                .withSkip("bwdata", false)
                .withDbBackupMethod(UserSettings.DB_METHOD_MARIADB);

        List<String> command = PkgacctArchiveTool.buildCommand("/bin/pkgacct", "alice", Path.of("/w"), settings);

        assertEquals(List.of("/bin/pkgacct", "--skiplogs", "--dbbackup=schema", "alice", "/w"), command);
    }

    @Test
    void pkgacctDefaultCommandIsAccountAndDirectory() {
        assertEquals(List.of("pkgacct", "bob", "/w"),
                PkgacctArchiveTool.buildCommand("pkgacct", "bob", Path.of("/w"), UserSettings.defaults()));
    }

    @Test
    void pkgacctProducesArchiveInWorkDir() throws Exception {
        Path bin = ArchiveFixtures.script(dir, "pkgacct.sh", String.join("\n",
                "for a; do acct=$out; out=$a; done",
                "echo \"packing $acct\"",
                "printf data > \"$out/cpmove-$acct.tar.gz\""));
        Path work = Files.createDirectories(dir.resolve("work"));

        ArchiveResult result = new PkgacctArchiveTool(bin.toString(), runner)
                .archive("alice", work, UserSettings.defaults(), jobLog);

        assertTrue(result.success());
        assertEquals(work.resolve("cpmove-alice.tar.gz"), result.output());
        assertTrue(Files.readString(jobLog.file()).contains("packing alice"));
    }

    @Test
    void pkgacctFailureRemovesDirectoryOutput() throws Exception {
        Path bin = ArchiveFixtures.script(dir, "pkgacct.sh", String.join("\n",
                "for a; do acct=$out; out=$a; done",
                "mkdir -p \"$out/cpmove-$acct/homedir\"",
                "exit 4"));
        Path work = Files.createDirectories(dir.resolve("work"));

        ArchiveResult result = new PkgacctArchiveTool(bin.toString(), runner)
                .archive("alice", work, UserSettings.defaults(), jobLog);

        assertFalse(result.success());
        assertEquals(JobFailure.ARCHIVE_TOOL_FAILED, result.failure());
        assertEquals("pkgacct failed (exit code 4)", result.message());
        assertFalse(Files.exists(work.resolve("cpmove-alice")));
    }

    @Test
    void missingPkgacctIsSpawnFailure() {
        ArchiveResult result = new PkgacctArchiveTool(dir.resolve("absent").toString(), runner)
                .archive("alice", dir, UserSettings.defaults(), jobLog);
        assertEquals(JobFailure.PROCESS_SPAWN_FAILED, result.failure());
    }

    // ---- restorepkg ----

    @Test
    void disabledModulesFollowToggles() {
        RestoreOptions options = RestoreOptions.all().mail(false).dns(false).subdomains(false);
        assertEquals(List.of(DisabledModule.Mail, DisabledModule.MailRouting, DisabledModule.ZoneFile),
                options.disabledModules());

        options.addonDomains(false);
        assertTrue(options.disabledModules().contains(DisabledModule.Domains));
        assertTrue(RestoreOptions.all().disabledModules().isEmpty());
    }

    @Test
    void restoreCommandPutsArchiveLast() {
        RestoreOptions options = RestoreOptions.all().force(true).newUser(" bob2 ").ip("10.0.0.5").homedir(false).cron(false);

        List<String> command = RestorepkgTool.buildCommand("/scripts/restorepkg", Path.of("/tmp/a.tar.gz"), options);

        assertEquals(List.of("/scripts/restorepkg", "--force", "--newuser=bob2", "--ip=10.0.0.5",
                "--disable=Homedir,Cron", "--skipaccount", "/tmp/a.tar.gz"), command);
    }

    @Test
    void optionsDeserialiseFromSnakeCaseWithTrueDefaults() throws Exception {
        RestoreOptions options = new ObjectMapper()
                .readValue("{\"mysql\":false,\"addon_domains\":false,\"unknown\":1}", RestoreOptions.class);
        assertFalse(options.mysql());
        assertFalse(options.addonDomains());
        assertTrue(options.homedir());
        assertFalse(options.force());
    }

    @Test
    void restorepkgExitCodeIsReported() throws Exception {
        Path bin = ArchiveFixtures.script(dir, "restorepkg.sh", "echo restoring; exit 7");

        RestoreToolResult result = new RestorepkgTool(bin.toString(), runner)
                .restore(dir.resolve("a.tar.gz"), RestoreOptions.all().ssl(false), jobLog);

        assertFalse(result.success());
        assertEquals(7, result.exitCode());
        assertEquals("Restore failed (exit code 7)", result.message());
        String log = Files.readString(jobLog.file());
        assertTrue(log.contains("Disabled modules: SSL"));
        assertTrue(log.contains("restoring"));
        assertTrue(log.contains("restorepkg FAILED (exit code: 7)"));
    }

    @Test
    void restorepkgSuccess() throws Exception {
        Path bin = ArchiveFixtures.script(dir, "restorepkg.sh", "exit 0");
        RestoreToolResult result = new RestorepkgTool(bin.toString(), runner)
                .restore(dir.resolve("a.tar.gz"), RestoreOptions.all(), jobLog);
        assertTrue(result.success());
        assertEquals("Restore completed successfully", result.message());
    }
}
