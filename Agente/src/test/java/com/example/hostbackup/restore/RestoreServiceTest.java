package com.example.hostbackup.restore;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.example.hostbackup.ArchiveFixtures;
import com.example.hostbackup.config.UserSettings;
import com.example.hostbackup.jobs.JobFailure;
import com.example.hostbackup.joblog.JobLog;
import com.example.hostbackup.notify.Notifications.EventKind;
import com.example.hostbackup.notify.Notifications.NotificationDispatcher;
import com.example.hostbackup.oplog.OperationLog.JsonLinesOperationLogger;
import com.example.hostbackup.oplog.OperationLog.LogView;
import com.example.hostbackup.restore.Restore.RestoreJobResult;
import com.example.hostbackup.restore.Restore.RestoreRequest;
import com.example.hostbackup.restore.Restore.RestoreService;
import com.example.hostbackup.storage.Destinations.Destination;
import com.example.hostbackup.storage.Destinations.DestinationRegistry;
import com.example.hostbackup.storage.Storage.LocalTransport;
import com.example.hostbackup.storage.Storage.RemoteEntry;
import com.example.hostbackup.storage.Storage.Transport;
import com.example.hostbackup.storage.Storage.TransportResult;
import com.example.hostbackup.tools.HotDatabase;
import com.example.hostbackup.tools.HotDatabase.HotDatabaseTool;
import com.example.hostbackup.tools.ToolAdapters.RestoreOptions;
import com.example.hostbackup.tools.ToolAdapters.RestoreTool;
import com.example.hostbackup.tools.ToolAdapters.RestoreToolResult;

class RestoreServiceTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-03-05T15:00:00Z"), ZoneOffset.UTC);
    private static final String FILE = "backup-03.05.2024_14-07-09_alice.tar.gz";
    private static final String DB_FILE = "db-backup-alice_2024-03-05_14-07-09.tar.gz";

    @TempDir
    Path dir;

    private Path store;
    private Path remoteRoot;
    private Path staging;
    private FakeRestoreTool restoreTool;
    private FakeHotDatabase hotDatabase;
    private DirectoryBackedRemote remote;
    private JsonLinesOperationLogger operations;
    private List<EventKind> notified;
    private UserSettings settings;
    private RestoreService service;

    @BeforeEach
    void setUp() throws Exception {
        store = Files.createDirectories(dir.resolve("store"));
        remoteRoot = Files.createDirectories(dir.resolve("remote"));
        staging = dir.resolve("staging");
        restoreTool = new FakeRestoreTool();
        hotDatabase = new FakeHotDatabase();
        remote = new DirectoryBackedRemote(remoteRoot);
        operations = new JsonLinesOperationLogger(dir.resolve("oplogs"), CLOCK);
        notified = new ArrayList<>();
        settings = UserSettings.defaults();

        LocalTransport local = new LocalTransport();
        DestinationRegistry destinations = DestinationRegistry.of(List.of(
                Destination.builder().id("local").name("Local disk").path(store.toString()).build(),
                Destination.builder().id("sftp").type("sftp").host("backup.example.net").path("/srv").build()));
        NotificationDispatcher notifications = (kind, context, s) -> notified.add(kind);
        service = new RestoreService(destinations, destination -> destination.isLocal() ? local : remote,
                restoreTool, hotDatabase, operations, notifications, user -> settings,
                dir.resolve("logs"), staging, CLOCK);
    }

    private static RestoreRequest request(String ref, String destination) {
        return RestoreRequest.builder().archiveRef(ref).destinationId(destination).user("root").build();
    }

    private LogView lastEvent() {
        return operations.getLogs("root", true, 1, 10, "all", "").logs().get(0);
    }

    @Test
    void localRestoreUsesFileInPlaceAndNeverDeletesIt() throws Exception {
        Path archive = ArchiveFixtures.accountArchive(store.resolve("alice").resolve(FILE), "alice");

        RestoreJobResult result = service.run(request(archive.toString(), "local"));

        assertTrue(result.success());
        assertEquals("alice", result.account());
        assertEquals("Restore completed successfully", result.message());
        assertEquals(List.of(archive), restoreTool.archives);
        assertTrue(Files.exists(archive));
        assertEquals("restore_local", lastEvent().type());
        assertTrue(lastEvent().account().startsWith("alice ("));
        assertEquals(List.of(EventKind.RESTORE_SUCCESS), notified);
        assertTrue(Files.readString(result.logFile()).contains("RESTORE COMPLETED SUCCESSFULLY"));
    }

    @Test
    void unparsableFilenameStopsBeforeRetrieval() {
        RestoreJobResult result = service.run(request("alice/random-file.tar.gz", "sftp"));

        assertFalse(result.success());
        assertEquals(JobFailure.UNPARSABLE_FILENAME, result.failure());
        assertTrue(remote.downloads.isEmpty());
        assertTrue(restoreTool.archives.isEmpty());
        assertEquals("restore_remote", lastEvent().type());
        assertEquals("random-file.tar.gz", lastEvent().account());
    }

    @Test
    void unknownDestinationIsRejected() {
        RestoreJobResult result = service.run(request("alice/" + FILE, "nope"));

        assertEquals(JobFailure.INVALID_DESTINATION, result.failure());
        assertEquals("restore", lastEvent().type());
        assertTrue(notified.isEmpty());
    }

    @Test
    void remoteRestoreDownloadsCompanionDatabaseAndCleansStaging() throws Exception {
        ArchiveFixtures.accountArchive(remoteRoot.resolve("alice").resolve(FILE), "alice");
        ArchiveFixtures.tarGz(remoteRoot.resolve("alice").resolve(DB_FILE), Map.of("alice_wp/ibdata1", "data"));

        RestoreJobResult result = service.run(request("alice/" + FILE, "sftp"));

        assertTrue(result.success());
        assertFalse(result.dbRestoreFailed());
        assertEquals("Restore completed successfully (DB data restored)", result.message());
        assertEquals(List.of("alice/" + FILE, "alice/" + DB_FILE), remote.downloads);
        assertEquals(List.of("alice:mariadb-backup:true"), hotDatabase.restores);
        assertFalse(Files.exists(staging.resolve(result.restoreId())));
        assertEquals("restore_remote", lastEvent().type());
        assertTrue(lastEvent().message().startsWith("Host: backup.example.net\n"));
    }

    @Test
    void configuredHotMethodIsUsedForDatabaseRestore() throws Exception {
        settings = settings.withDbBackupMethod(UserSettings.DB_METHOD_MYSQLBACKUP);
        ArchiveFixtures.accountArchive(remoteRoot.resolve("alice").resolve(FILE), "alice");
        ArchiveFixtures.tarGz(remoteRoot.resolve("alice").resolve(DB_FILE), Map.of("alice_wp/ibdata1", "data"));

        service.run(request("alice/" + FILE, "sftp"));

        assertEquals(List.of("alice:mysqlbackup:true"), hotDatabase.restores);
    }

    @Test
    void databaseRestoreFailureIsAWarning() throws Exception {
        hotDatabase.fail = true;
        ArchiveFixtures.accountArchive(store.resolve("alice").resolve(FILE), "alice");
        ArchiveFixtures.tarGz(store.resolve("alice").resolve(DB_FILE), Map.of("alice_wp/ibdata1", "data"));

        RestoreJobResult result = service.run(request(store.resolve("alice").resolve(FILE).toString(), "local"));

        assertTrue(result.success());
        assertTrue(result.dbRestoreFailed());
        assertEquals(JobFailure.DATABASE_RESTORE_FAILED, result.failure());
        assertEquals("Restore completed successfully (Warning: DB data restore failed: mariadb-backup crashed)",
                result.message());
        assertTrue(Files.exists(store.resolve("alice").resolve(DB_FILE)));
    }

    @Test
    void restoreToolExitCodePropagates() throws Exception {
        restoreTool.result = RestoreToolResult.exited(3);
        ArchiveFixtures.accountArchive(remoteRoot.resolve("alice").resolve(FILE), "alice");

        RestoreJobResult result = service.run(request("alice/" + FILE, "sftp"));

        assertFalse(result.success());
        assertEquals(JobFailure.RESTORE_TOOL_FAILED, result.failure());
        assertEquals(Optional.of(3), result.exitCode());
        assertEquals(List.of(EventKind.RESTORE_FAILURE), notified);
        assertFalse(Files.exists(staging.resolve(result.restoreId()).resolve(FILE)));
    }

    @Test
    void spawnFailureHasNoExitCode() throws Exception {
        restoreTool.result = RestoreToolResult.notStarted("Failed to start restorepkg");
        ArchiveFixtures.accountArchive(store.resolve("alice").resolve(FILE), "alice");

        RestoreJobResult result = service.run(request(store.resolve("alice").resolve(FILE).toString(), "local"));

        assertEquals(JobFailure.PROCESS_SPAWN_FAILED, result.failure());
        assertEquals(Optional.empty(), result.exitCode());
    }

    @Test
    void corruptArchiveIsNotHandedToTheTool() throws Exception {
        Files.createDirectories(remoteRoot.resolve("alice"));
        Files.writeString(remoteRoot.resolve("alice").resolve(FILE), "not an archive");

        RestoreJobResult result = service.run(request("alice/" + FILE, "sftp"));

        assertEquals(JobFailure.VERIFICATION_FAILED, result.failure());
        assertTrue(restoreTool.archives.isEmpty());
        assertFalse(Files.exists(staging.resolve(result.restoreId()).resolve(FILE)));
        assertEquals(List.of(EventKind.RESTORE_FAILURE), notified);
    }

    @Test
    void missingRemoteFileIsARetrievalFailure() {
        RestoreJobResult result = service.run(request("alice/" + FILE, "sftp"));

        assertEquals(JobFailure.RETRIEVAL_FAILED, result.failure());
        assertEquals("alice", result.account());
        assertTrue(restoreTool.archives.isEmpty());
    }

    @Test
    void interruptedDownloadDoesNotLeaveAPartialArchive() throws Exception {
        ArchiveFixtures.accountArchive(remoteRoot.resolve("alice").resolve(FILE), "alice");
        remote.dropConnectionMidway = true;

        RestoreJobResult result = service.run(request("alice/" + FILE, "sftp"));

        assertEquals(JobFailure.RETRIEVAL_FAILED, result.failure());
        assertTrue(restoreTool.archives.isEmpty());
        assertFalse(Files.exists(staging.resolve(result.restoreId()).resolve(FILE)));
        assertFalse(Files.exists(staging.resolve(result.restoreId())));
    }

    @Test
    void restoreIdIsDerivedFromTheReference() {
        assertEquals("restore_" + CLOCK.instant().getEpochSecond() + "_e2a8a5be",
                service.newRestoreId("alice/" + FILE));
    }

    @Test
    void callerSuppliedRestoreIdAndRequestorAreKept() throws Exception {
        Path archive = ArchiveFixtures.accountArchive(store.resolve("alice").resolve(FILE), "alice");
        RestoreRequest request = RestoreRequest.builder().archiveRef(archive.toString()).destinationId("local")
                .user("root").restoreId("restore_fixed").requestor("api").build();

        RestoreJobResult result = service.run(request);

        assertEquals("restore_fixed", result.restoreId());
        assertEquals("api", lastEvent().requestor());
        assertEquals("restore_fixed", lastEvent().jobId());
    }

    // ---- fakes ----

    private static final class FakeRestoreTool implements RestoreTool {
        final List<Path> archives = new ArrayList<>();
        RestoreToolResult result = RestoreToolResult.completed();

        @Override
        public RestoreToolResult restore(Path archive, RestoreOptions options, JobLog jobLog) {
            archives.add(archive);
            return result;
        }
    }

    private static final class FakeHotDatabase implements HotDatabaseTool {
        final List<String> restores = new ArrayList<>();
        boolean fail;

        @Override
        public HotDatabase.Result backup(String account, String method, Path output, JobLog jobLog) {
            return HotDatabase.Result.skipped("not used");
        }

        @Override
        public HotDatabase.Result restore(String account, String method, Path archive, JobLog jobLog) {
            restores.add(account + ":" + method + ":" + Files.isRegularFile(archive));
            return fail ? HotDatabase.Result.failed(method + " crashed") : HotDatabase.Result.restored();
        }
    }

    /** Destino remoto simulado por um diretório; chaves são relativas à raiz. */
    private static final class DirectoryBackedRemote implements Transport {
        private final Path root;
        final List<String> downloads = new ArrayList<>();
        boolean dropConnectionMidway;

        DirectoryBackedRemote(Path root) {
            this.root = root;
        }

        @Override
        public TransportResult upload(Path localFile, String remoteKey, Destination destination) {
            return TransportResult.failed("not used");
        }

        @Override
        public TransportResult download(String remoteKey, Path localFile, Destination destination) {
            downloads.add(remoteKey);
            Path source = root.resolve(remoteKey);
            if (!Files.isRegularFile(source)) {
                return TransportResult.failed("No such file: " + remoteKey);
            }
            try {
                if (dropConnectionMidway) {
                    Files.writeString(localFile, "truncated");
                    return TransportResult.failed("Connection reset by peer");
                }
                Files.copy(source, localFile, StandardCopyOption.REPLACE_EXISTING);
                return TransportResult.ok("Downloaded", localFile.toString(), Files.size(localFile));
            } catch (IOException e) {
                return TransportResult.failed(e.getMessage());
            }
        }

        @Override
        public List<RemoteEntry> list(String path, Destination destination) {
            return List.of();
        }

        @Override
        public TransportResult delete(String path, Destination destination) {
            return TransportResult.failed("not used");
        }

        @Override
        public boolean exists(String path, Destination destination) {
            return Files.isRegularFile(root.resolve(path));
        }

        @Override
        public TransportResult mkdir(String path, Destination destination) {
            return TransportResult.ok("Directory created", path, -1);
        }
    }
}
