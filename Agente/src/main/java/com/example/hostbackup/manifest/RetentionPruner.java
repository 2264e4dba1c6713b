package com.example.hostbackup.manifest;

import com.example.hostbackup.manifest.Manifest.ManifestEntry;
import com.example.hostbackup.manifest.Manifest.ManifestTracker;
import com.example.hostbackup.oplog.OperationLog.OperationLogger;
import com.example.hostbackup.storage.Destinations;
import com.example.hostbackup.storage.Destinations.Destination;
import com.example.hostbackup.storage.Destinations.DestinationRegistry;
import com.example.hostbackup.storage.Storage.Transport;
import com.example.hostbackup.storage.Storage.TransportRegistry;
import com.example.hostbackup.storage.Storage.TransportResult;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Aplica a retenção de um agendamento: apaga no destino os arquivos além dos N mais novos por conta
 * e tira as entradas correspondentes do manifest.
 *
 * Roda fora dos orquestradores (o queue runner chama depois de um backup agendado bem-sucedido).
 */
public final class RetentionPruner {

    private static final Logger log = LoggerFactory.getLogger(RetentionPruner.class);

    private final ManifestTracker manifest;
    private final DestinationRegistry destinations;
    private final TransportRegistry transports;
    private final OperationLogger operations;

    public RetentionPruner(ManifestTracker manifest, DestinationRegistry destinations,
                           TransportRegistry transports, OperationLogger operations) {
        this.manifest = Objects.requireNonNull(manifest, "manifest");
        this.destinations = Objects.requireNonNull(destinations, "destinations");
        this.transports = Objects.requireNonNull(transports, "transports");
        this.operations = Objects.requireNonNull(operations, "operations");
    }

    /** Resumo de uma poda. */
    public static final class PruneResult {
        private final List<String> deleted;
        private final List<String> errors;

        PruneResult(List<String> deleted, List<String> errors) {
            this.deleted = List.copyOf(deleted);
            this.errors = List.copyOf(errors);
        }

        public List<String> deleted() { return deleted; }
        public List<String> errors() { return errors; }
        public boolean success() { return errors.isEmpty(); }
    }

    public PruneResult prune(String scheduleId, List<String> accounts, int retention, String user, String requestor) {
        List<String> deleted = new ArrayList<>();
        List<String> errors = new ArrayList<>();
        if (retention <= 0 || accounts == null || accounts.isEmpty()) {
            return new PruneResult(deleted, errors);
        }

        boolean anyRemote = false;
        for (String account : accounts) {
            List<ManifestEntry> expired;
            try {
                expired = manifest.expired(scheduleId, account, retention);
            } catch (IOException e) {
                errors.add(account + ": manifest unreadable (" + e.getMessage() + ")");
                continue;
            }
            List<ManifestEntry> removed = new ArrayList<>();
            for (ManifestEntry entry : expired) {
                Destinations.Resolution resolution = Destinations.resolve(destinations, entry.destination());
                if (!resolution.ok()) {
                    errors.add(entry.file() + ": " + resolution.message());
                    continue;
                }
                Destination destination = resolution.destination();
                anyRemote |= !destination.isLocal();
                Transport transport = transports.forDestination(destination);
                if (deleteArtifact(transport, destination, account, entry.file(), errors)) {
                    deleted.add(account + "/" + entry.file());
                    removed.add(entry);
                    if (entry.dbFile() != null && !entry.dbFile().isBlank()
                            && deleteArtifact(transport, destination, account, entry.dbFile(), errors)) {
                        deleted.add(account + "/" + entry.dbFile());
                    }
                }
            }
            try {
                manifest.remove(scheduleId, removed);
            } catch (IOException e) {
                errors.add(account + ": manifest update failed (" + e.getMessage() + ")");
            }
        }

        if (!deleted.isEmpty() || !errors.isEmpty()) {
            String message = errors.isEmpty()
                    ? "Pruned " + deleted.size() + " file(s) beyond retention " + retention
                    : "Pruned " + deleted.size() + " file(s); errors: " + String.join("; ", errors);
            operations.logEvent(user, anyRemote ? "prune_remote" : "prune_local", deleted,
                    errors.isEmpty(), message, requestor, null);
            log.info("Poda do agendamento {}: {} removidos, {} erros", scheduleId, deleted.size(), errors.size());
        }
        return new PruneResult(deleted, errors);
    }

    private static boolean deleteArtifact(Transport transport, Destination destination, String account,
                                          String file, List<String> errors) {
        String key = account + "/" + file;
        if (!transport.exists(key, destination)) {
            // já removido por fora: basta limpar o manifest
            return true;
        }
        TransportResult result = transport.delete(key, destination);
        if (!result.success()) {
            errors.add(key + ": " + result.message());
            return false;
        }
        return true;
    }
}
