package com.example.hostbackup.storage;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.example.hostbackup.process.ProcessRunner;
import com.example.hostbackup.storage.Destinations.Destination;
import com.example.hostbackup.storage.Storage.BridgeTransport;
import com.example.hostbackup.storage.Storage.LocalTransport;
import com.example.hostbackup.storage.Storage.RemoteEntry;
import com.example.hostbackup.storage.Storage.Retrieval;
import com.example.hostbackup.storage.Storage.TransportRegistry;
import com.example.hostbackup.storage.Storage.TransportResult;

class StorageTest {

    @TempDir
    Path dir;

    private static Destination local(Path base) {
        return Destination.builder().id("local").path(base.toString()).build();
    }

    private static Destination remote(String id) {
        return Destination.builder().id(id).type("sftp").path("/remote/").host("h").build();
    }

    // ---- resolução de caminhos ----

    @Test
    void resolvePathPrefixesBaseOnce() {
        Destination d = remote("r");
        assertEquals("/remote/alice/x.tar.gz", Storage.resolvePath("alice/x.tar.gz", d));
        assertEquals("/remote/alice/x.tar.gz", Storage.resolvePath("/alice/x.tar.gz", d));
        assertEquals("/remote/alice/x.tar.gz", Storage.resolvePath("/remote/alice/x.tar.gz", d));
        assertEquals("/remote", Storage.resolvePath("", d));
        assertEquals("alice", Storage.resolvePath("alice", Destination.builder().id("n").type("sftp").build()));
    }

    // ---- local ----

    @Test
    void localUploadDownloadListAndDelete() throws Exception {
        Path base = dir.resolve("dest");
        Destination d = local(base);
        Path source = Files.writeString(dir.resolve("src.tar.gz"), "payload");
        LocalTransport transport = new LocalTransport();

        TransportResult up = transport.upload(source, "alice/src.tar.gz", d);
        assertTrue(up.success());
        assertEquals(7, up.size());
        assertTrue(transport.exists("alice/src.tar.gz", d));

        List<RemoteEntry> entries = transport.list("alice", d);
        assertEquals(1, entries.size());
        assertEquals("src.tar.gz", entries.get(0).name());

        Path copy = dir.resolve("staging/copy.tar.gz");
        assertTrue(transport.download("alice/src.tar.gz", copy, d).success());
        assertEquals("payload", Files.readString(copy));

        assertTrue(transport.delete("alice/src.tar.gz", d).success());
        assertFalse(transport.delete("alice/src.tar.gz", d).success());
        assertFalse(transport.exists("alice/src.tar.gz", d));
    }

    @Test
    void localMkdirIsIdempotent() {
        Destination d = local(dir);
        LocalTransport transport = new LocalTransport();
        assertEquals("Directory created", transport.mkdir("a/b", d).message());
        TransportResult again = transport.mkdir("a/b", d);
        assertTrue(again.success());
        assertEquals("Directory already exists", again.message());
    }

    @Test
    void localRetrieveReturnsFileInPlace() throws Exception {
        Destination d = local(dir);
        Path archive = Files.writeString(dir.resolve("backup.tar.gz"), "x");

        Retrieval found = new LocalTransport().retrieve(archive.toString(), d, dir.resolve("staging"));
        assertTrue(found.success());
        assertFalse(found.staged());
        assertEquals(archive, found.localPath());
        assertFalse(Files.exists(dir.resolve("staging")));

        Retrieval missing = new LocalTransport().retrieve("nope.tar.gz", d, dir.resolve("staging"));
        assertFalse(missing.success());
        assertTrue(missing.message().startsWith("Backup file not found"));
    }

    // ---- ponte ----

    private BridgeTransport bridge() throws IOException {
        Path script = dir.resolve("bridge.sh");
        Files.writeString(script, String.join("\n",
                "#!/bin/sh",
                "echo \"$@\" >> \"" + dir.resolve("calls.log") + "\"",
                "action=''",
                "for a in \"$@\"; do case \"$a\" in --action=*) action=\"${a#--action=}\";; esac; done",
                "case \"$action\" in",
                "  ls) echo '{\"files\":[{\"file\":\"backup-a.tar.gz\",\"size\":10,\"type\":\"file\",\"mtime\":1},"
                        + "{\"file\":\"sub\",\"type\":\"dir\"}],\"path\":\"x\"}' ;;",
                "  upload) echo '{\"success\":true,\"message\":\"Uploaded\",\"remote_path\":\"/remote/a/x\",\"size\":5}' ;;",
                "  mkdir) echo '{\"success\":false,\"message\":\"Directory already exists\"}' ;;",
                "  delete) echo 'permission denied' >&2; exit 2 ;;",
                "  download) echo 'not json' ;;",
                "esac",
                ""));
        assertTrue(script.toFile().setExecutable(true));
        return new BridgeTransport(script.toString(), new ProcessRunner(Duration.ofMillis(20)));
    }

    @Test
    void bridgeParsesJsonReplies() throws Exception {
        BridgeTransport bridge = bridge();
        Destination d = remote("sftp1");

        TransportResult up = bridge.upload(dir.resolve("x"), "a/x", d);
        assertTrue(up.success());
        assertEquals("/remote/a/x", up.path());
        assertEquals(5, up.size());

        List<RemoteEntry> entries = bridge.list("a", d);
        assertEquals(2, entries.size());
        assertTrue(entries.get(1).directory());

        String calls = Files.readString(dir.resolve("calls.log"));
        assertTrue(calls.contains("--action=upload --transport=sftp1 --local=" + dir.resolve("x") + " --remote=/remote/a/x"));
        assertTrue(calls.contains("--action=ls --transport=sftp1 --path=/remote/a"));
    }

    @Test
    void bridgeExistsListsParentDirectory() throws Exception {
        BridgeTransport bridge = bridge();
        Destination d = remote("sftp1");
        assertTrue(bridge.exists("a/backup-a.tar.gz", d));
        assertFalse(bridge.exists("a/other.tar.gz", d));
    }

    @Test
    void bridgeFailuresBecomeTransportResults() throws Exception {
        BridgeTransport bridge = bridge();
        Destination d = remote("sftp1");

        TransportResult deleted = bridge.delete("a/x", d);
        assertFalse(deleted.success());
        assertEquals("Transport bridge exited with code 2: permission denied", deleted.message());

        TransportResult downloaded = bridge.download("a/x", dir.resolve("y"), d);
        assertFalse(downloaded.success());
        assertEquals("Malformed transport bridge response", downloaded.message());

        assertTrue(bridge.mkdir("a", d).success());
    }

    @Test
    void interruptedDownloadLeavesNothingInStaging() throws Exception {
        Path script = dir.resolve("flaky.sh");
        Files.writeString(script, String.join("\n",
                "#!/bin/sh",
                "for a in \"$@\"; do case \"$a\" in --local=*) printf 'half an archive' > \"${a#--local=}\";; esac; done",
                "echo 'connection reset' >&2",
                "exit 1",
                ""));
        assertTrue(script.toFile().setExecutable(true));
        BridgeTransport bridge = new BridgeTransport(script.toString(), new ProcessRunner(Duration.ofMillis(20)));
        Path stagingDir = dir.resolve("staging").resolve("restore_1");

        Retrieval retrieval = bridge.retrieve("alice/backup-03.05.2024_14-07-09_alice.tar.gz", remote("sftp1"), stagingDir);

        assertFalse(retrieval.success());
        assertEquals("Transport bridge exited with code 1: connection reset", retrieval.message());
        assertFalse(Files.exists(stagingDir.resolve("backup-03.05.2024_14-07-09_alice.tar.gz")));
        assertFalse(Files.exists(stagingDir));
    }

    @Test
    void missingBridgeBinaryFailsWithoutThrowing() {
        BridgeTransport bridge = new BridgeTransport(dir.resolve("absent").toString(), new ProcessRunner(Duration.ofMillis(20)));
        TransportResult result = bridge.upload(dir.resolve("x"), "a/x", remote("r"));
        assertFalse(result.success());
        assertTrue(result.message().startsWith("Transport bridge failed to start"));
        assertThrows(IOException.class, () -> bridge.list("a", remote("r")));
    }

    @Test
    void registryChoosesByDestinationType() {
        LocalTransport local = new LocalTransport();
        BridgeTransport bridge = new BridgeTransport("/bin/false", new ProcessRunner(Duration.ofMillis(20)));
        TransportRegistry registry = TransportRegistry.standard(local, bridge, null);

        assertSame(local, registry.forDestination(local(dir)));
        assertSame(bridge, registry.forDestination(remote("r")));
        assertSame(bridge, registry.forDestination(Destination.builder().id("s").type("s3").build()));
    }
}
