package com.example.hostbackup.tools;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.Optional;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.example.hostbackup.ArchiveFixtures;
import com.example.hostbackup.joblog.JobLog;
import com.example.hostbackup.process.ProcessRunner;
import com.example.hostbackup.tools.HotDatabase.Result;
import com.example.hostbackup.tools.HotDatabase.ScriptedHotDatabaseTool;

class HotDatabaseTest {

    @TempDir
    Path dir;

    private final ProcessRunner runner = new ProcessRunner(Duration.ofMillis(20));
    private JobLog jobLog;

    @BeforeEach
    void openLog() throws Exception {
        jobLog = JobLog.open(dir.resolve("logs"), "job", JobLog.TIME_ONLY, Clock.systemUTC());
    }

    private ScriptedHotDatabaseTool tool(String backupBody, String restoreBody) throws Exception {
        Path backup = ArchiveFixtures.script(dir, "hotdb-backup.sh", backupBody);
        Path restore = ArchiveFixtures.script(dir, "hotdb-restore.sh", restoreBody);
        return new ScriptedHotDatabaseTool(Optional.of(backup.toString()), Optional.of(restore.toString()), runner);
    }

    @Test
    void exitZeroWithFileIsProduced() throws Exception {
        ScriptedHotDatabaseTool tool = tool(
                "for a; do case $a in --output=*) printf db > \"${a#--output=}\";; esac; done", "exit 0");
        Path output = dir.resolve("db.tar.gz");

        Result result = tool.backup("alice", "mariadb-backup", output, jobLog);

        assertTrue(result.success());
        assertEquals(Optional.of(output), result.archive());
    }

    @Test
    void exitZeroWithoutFileIsSkipped() throws Exception {
        Result result = tool("exit 0", "exit 0").backup("alice", "mariadb-backup", dir.resolve("db.tar.gz"), jobLog);
        assertFalse(result.success());
        assertTrue(result.skipped());
    }

    @Test
    void nonZeroExitIsFailureAndPartialOutputRemoved() throws Exception {
        ScriptedHotDatabaseTool tool = tool(
                "for a; do case $a in --output=*) printf part > \"${a#--output=}\";; esac; done; exit 1", "exit 0");
        Path output = dir.resolve("db.tar.gz");

        Result result = tool.backup("alice", "mysqlbackup", output, jobLog);

        assertFalse(result.success());
        assertFalse(result.skipped());
        assertEquals("mysqlbackup exited with code 1", result.message());
        assertFalse(Files.exists(output));
    }

    @Test
    void restorePassesMethodAccountAndArchive() throws Exception {
        Path args = dir.resolve("args.txt");
        ScriptedHotDatabaseTool tool = tool("exit 0", "echo \"$@\" > \"" + args + "\"");

        Result result = tool.restore("alice", "mariadb-backup", Path.of("/tmp/db.tar.gz"), jobLog);

        assertTrue(result.success());
        assertEquals("--method=mariadb-backup --account=alice --archive=/tmp/db.tar.gz", Files.readString(args).trim());
    }

    @Test
    void unconfiguredHelperFails() {
        ScriptedHotDatabaseTool tool = new ScriptedHotDatabaseTool(Optional.empty(), Optional.empty(), runner);
        assertFalse(tool.backup("a", "mariadb-backup", dir.resolve("x"), jobLog).success());
        assertFalse(tool.restore("a", "mariadb-backup", dir.resolve("x"), jobLog).success());
    }
}
