package com.example.hostbackup.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;

import org.junit.jupiter.api.Test;

class AppConfigTest {

    @Test
    void derivedDirectoriesSitNextToLogDir() {
        AppConfig config = AppConfig.fromMap(Map.of(AppConfig.LOG_DIR, "/srv/hb/logs"));

        assertEquals(Path.of("/srv/hb/logs"), config.logDir());
        assertEquals(Path.of("/srv/hb/cancel"), config.cancelDir());
        assertEquals(Path.of("/srv/hb/manifests"), config.manifestDir());
        assertEquals(Path.of("/srv/hb/queue"), config.queueDir());
        assertEquals(Path.of("/srv/hb/users"), config.userConfigDir());
        assertEquals(Path.of("/srv/hb/destinations.json"), config.destinationsFile());
    }

    @Test
    void explicitDirectoriesWin() {
        AppConfig config = AppConfig.fromMap(Map.of(
                AppConfig.LOG_DIR, "/srv/hb/logs",
                AppConfig.QUEUE_DIR, "/var/spool/hb"));

        assertEquals(Path.of("/var/spool/hb"), config.queueDir());
    }

    @Test
    void durationsAreClamped() {
        AppConfig config = AppConfig.fromMap(Map.of(
                AppConfig.PROCESS_POLL_MILLIS, "1",
                AppConfig.QUEUE_POLL_SECONDS, "999999",
                AppConfig.NOTIFY_HTTP_TIMEOUT_SECONDS, "abc"));

        assertEquals(Duration.ofMillis(10), config.processPollInterval());
        assertEquals(Duration.ofSeconds(3600), config.queuePollInterval());
        assertEquals(Duration.ofSeconds(15), config.notifyHttpTimeout());
    }

    @Test
    void defaultsForToolsAndOptionalHotDatabaseHelpers() {
        AppConfig config = AppConfig.fromMap(Map.of());

        assertEquals("/usr/local/cpanel/scripts/pkgacct", config.pkgacctBin());
        assertEquals("/scripts/restorepkg", config.restorepkgBin());
        assertEquals("/usr/sbin/sendmail", config.sendmailBin());
        assertFalse(config.hotDbBackupBin().isPresent());
        assertEquals(Path.of(AppConfig.DEFAULT_TEMP_DIR), config.tempDir());
    }

    @Test
    void overrideTakesPrecedenceAndCanBeRemoved() {
        AppConfig config = AppConfig.fromMap(Map.of(AppConfig.PKGACCT_BIN, "/a/pkgacct"));
        config.override(AppConfig.PKGACCT_BIN, "/b/pkgacct");
        assertEquals("/b/pkgacct", config.pkgacctBin());

        config.override(AppConfig.PKGACCT_BIN, null);
        assertEquals("/a/pkgacct", config.pkgacctBin());
    }

    @Test
    void requireNamesTheMissingKey() {
        AppConfig config = AppConfig.fromMap(Map.of());
        IllegalStateException e = assertThrows(IllegalStateException.class, () -> config.require("HOT_DB_BACKUP_BIN"));
        assertTrue(e.getMessage().contains("HOT_DB_BACKUP_BIN"));
    }

    @Test
    void boolAcceptsCommonTruthyValues() {
        AppConfig config = AppConfig.fromMap(Map.of("A", "yes", "B", "0"));
        assertTrue(config.bool("A", false));
        assertFalse(config.bool("B", true));
        assertTrue(config.bool("C", true));
    }
}
