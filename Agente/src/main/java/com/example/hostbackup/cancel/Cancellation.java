package com.example.hostbackup.cancel;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermissions;
import java.time.Clock;
import java.util.Objects;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Pedido de cancelamento cooperativo, indexado pelo id do job. O backup só consulta entre contas.
 */
public final class Cancellation {

    private Cancellation() {}

    private static final Pattern JOB_ID = Pattern.compile("[A-Za-z0-9_.-]+");

    public interface CancellationRegistry {
        void requestCancel(String jobId, String requestedBy) throws IOException;

        boolean isCancelRequested(String jobId);

        void clear(String jobId);

        static CancellationRegistry none() {
            return new CancellationRegistry() {
                @Override
                public void requestCancel(String jobId, String requestedBy) {
                    throw new UnsupportedOperationException("cancelamento desabilitado");
                }

                @Override
                public boolean isCancelRequested(String jobId) { return false; }

                @Override
                public void clear(String jobId) { }
            };
        }
    }

    /**
     * Marcador {cancelDir}/{jobId}.cancel com quem pediu e quando. Permissão 0600 onde o filesystem
     * suporta POSIX.
     */
    public static final class FileCancellationRegistry implements CancellationRegistry {
        private static final Logger log = LoggerFactory.getLogger(FileCancellationRegistry.class);
        private final Path dir;
        private final Clock clock;
        private final ObjectMapper mapper = new ObjectMapper();

        public FileCancellationRegistry(Path dir, Clock clock) {
            this.dir = Objects.requireNonNull(dir, "dir");
            this.clock = Objects.requireNonNull(clock, "clock");
        }

        @Override
        public void requestCancel(String jobId, String requestedBy) throws IOException {
            Path marker = marker(jobId);
            Files.createDirectories(dir);
            ObjectNode body = mapper.createObjectNode();
            body.put("job_id", jobId);
            body.put("requested_at", clock.instant().getEpochSecond());
            body.put("requested_by", requestedBy != null ? requestedBy : "");
            Files.writeString(marker, mapper.writeValueAsString(body), StandardCharsets.UTF_8);
            try {
                Files.setPosixFilePermissions(marker, PosixFilePermissions.fromString("rw-------"));
            } catch (UnsupportedOperationException e) {
                log.debug("Filesystem sem permissões POSIX para {}", marker);
            }
            log.info("Cancelamento solicitado para {} por {}", jobId, requestedBy);
        }

        @Override
        public boolean isCancelRequested(String jobId) {
            return valid(jobId) && Files.exists(dir.resolve(jobId + ".cancel"));
        }

        @Override
        public void clear(String jobId) {
            if (!valid(jobId)) {
                return;
            }
            try {
                Files.deleteIfExists(dir.resolve(jobId + ".cancel"));
            } catch (IOException e) {
                log.warn("Falha ao remover marcador de cancelamento de {}: {}", jobId, e.getMessage());
            }
        }

        private Path marker(String jobId) {
            if (!valid(jobId)) {
                throw new IllegalArgumentException("jobId inválido: " + jobId);
            }
            return dir.resolve(jobId + ".cancel");
        }

        private static boolean valid(String jobId) {
            return jobId != null && JOB_ID.matcher(jobId).matches();
        }
    }
}
