package com.example.hostbackup;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.example.hostbackup.config.AppConfig;
import com.example.hostbackup.joblog.JobLog;

class MainTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-03-05T14:07:09Z"), ZoneOffset.UTC);

    @TempDir
    Path dir;

    private AppConfig config;
    private final ByteArrayOutputStream buffer = new ByteArrayOutputStream();
    private PrintStream out;

    @BeforeEach
    void setUp() {
        config = AppConfig.fromMap(Map.of(AppConfig.LOG_DIR, dir.resolve("logs").toString()));
        out = new PrintStream(buffer, true, StandardCharsets.UTF_8);
    }

    private String printed() {
        return buffer.toString(StandardCharsets.UTF_8);
    }

    @Test
    void tailPrintsTheWholeJobLog() throws Exception {
        JobLog jobLog = JobLog.open(config.logDir(), "job_7", JobLog.TIME_ONLY, CLOCK);
        jobLog.raw("[STEP 1/5] Validating");
        jobLog.raw("BACKUP COMPLETED SUCCESSFULLY");

        assertTrue(Main.inspect(List.of("--tail", "job_7"), config, out));

        assertEquals("[STEP 1/5] Validating\nBACKUP COMPLETED SUCCESSFULLY\n", printed());
    }

    @Test
    void tailOfUnknownJobSaysSo() throws Exception {
        assertTrue(Main.inspect(List.of("--tail", "job_missing"), config, out));
        assertTrue(printed().startsWith("No log found for job job_missing"));
    }

    @Test
    void tailRejectsPathsOutsideTheLogDirectory() {
        assertThrows(IllegalArgumentException.class, () -> Main.inspect(List.of("--tail", "../secret"), config, out));
        assertThrows(IllegalArgumentException.class, () -> Main.inspect(List.of("--tail"), config, out));
    }

    @Test
    void previewSummarisesAnAccountArchive() throws Exception {
        Path archive = ArchiveFixtures.accountArchive(
                dir.resolve("backup-03.05.2024_14-07-09_alice.tar.gz"), "alice");

        assertTrue(Main.inspect(List.of("--preview", archive.toString()), config, out));

        String text = printed();
        assertTrue(text.contains("Archive: backup-03.05.2024_14-07-09_alice.tar.gz\n"));
        assertTrue(text.contains("Account: alice\n"));
        assertTrue(text.contains("Files: 1\n"));
        assertTrue(text.contains("Home directory: yes\n"));
        assertTrue(text.contains("MySQL databases: no\n"));
        assertTrue(text.contains("  cpmove-alice/homedir/public_html/index.html"));
    }

    @Test
    void otherArgumentsAreLeftToTheAgent() throws Exception {
        assertFalse(Main.inspect(List.of("--once"), config, out));
        assertEquals("", printed());
    }
}
