package com.example.hostbackup.storage;

import com.example.hostbackup.process.ProcessRunner;
import com.example.hostbackup.process.ProcessRunner.Outcome;
import com.example.hostbackup.storage.Destinations.Destination;
import com.example.hostbackup.util.ArchiveNames;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Abstração de transporte sobre os backends de destino (disco local, ponte para o subsistema de
 * transporte do host, S3 compatível).
 *
 * Todos os caminhos são resolvidos contra o path base do destino, exceto quando já começam com ele.
 */
public final class Storage {

    private Storage() {}

    // ==================================================================================
    // Contrato
    // ==================================================================================

    /** Operações uniformes de transporte. Falhas voltam como {@link TransportResult}, não como exceção. */
    public interface Transport extends AutoCloseable {

        TransportResult upload(Path localFile, String remoteKey, Destination destination);

        TransportResult download(String remoteKey, Path localFile, Destination destination);

        List<RemoteEntry> list(String path, Destination destination) throws IOException;

        TransportResult delete(String path, Destination destination);

        boolean exists(String path, Destination destination);

        /** Idempotente: "já existe" é sucesso. */
        TransportResult mkdir(String path, Destination destination);

        /**
         * Disponibiliza o arquivo localmente. Destinos remotos baixam para {@code stagingDir}; o arquivo
         * resultante é marcado como staged e pertence ao chamador.
         */
        default Retrieval retrieve(String ref, Destination destination, Path stagingDir) {
            try {
                Files.createDirectories(stagingDir);
            } catch (IOException e) {
                return Retrieval.failed("Failed to create temp directory: " + stagingDir);
            }
            Path target = stagingDir.resolve(ArchiveNames.baseName(ref));
            TransportResult result = download(ref, target, destination);
            if (!result.success()) {
                discardPartialDownload(target, stagingDir);
                return Retrieval.failed(result.message());
            }
            long size = result.size() >= 0 ? result.size() : sizeOrZero(target);
            return Retrieval.staged(target, size);
        }

        @Override
        default void close() throws Exception {
            // default no-op
        }
    }

    /** Escolhe a implementação de transporte pelo tipo do destino. */
    @FunctionalInterface
    public interface TransportRegistry {
        Transport forDestination(Destination destination);

        static TransportRegistry standard(LocalTransport local, BridgeTransport bridge, S3Transport s3) {
            Objects.requireNonNull(local, "local");
            Objects.requireNonNull(bridge, "bridge");
            return destination -> {
                if (destination.isLocal()) return local;
                if (Destinations.TYPE_S3.equals(destination.type()) && s3 != null) return s3;
                return bridge;
            };
        }
    }

    public static final class TransportResult {
        private final boolean success;
        private final String message;
        private final String path;
        private final long size;

        private TransportResult(boolean success, String message, String path, long size) {
            this.success = success;
            this.message = message != null ? message : "";
            this.path = path;
            this.size = size;
        }

        public static TransportResult ok(String message, String path, long size) {
            return new TransportResult(true, message, path, size);
        }

        public static TransportResult failed(String message) {
            return new TransportResult(false, message, null, -1);
        }

        public boolean success() { return success; }
        public String message() { return message; }
        public String path() { return path; }
        /** -1 quando desconhecido. */
        public long size() { return size; }
    }

    public static final class RemoteEntry {
        private final String name;
        private final long size;
        private final boolean directory;
        private final long mtime;

        public RemoteEntry(String name, long size, boolean directory, long mtime) {
            this.name = Objects.requireNonNull(name, "name");
            this.size = size;
            this.directory = directory;
            this.mtime = mtime;
        }

        public String name() { return name; }
        public long size() { return size; }
        public boolean directory() { return directory; }
        public long mtime() { return mtime; }
    }

    /** Arquivo disponível localmente para restore. */
    public static final class Retrieval {
        private final boolean success;
        private final String message;
        private final Path localPath;
        private final long size;
        private final boolean staged;

        private Retrieval(boolean success, String message, Path localPath, long size, boolean staged) {
            this.success = success;
            this.message = message;
            this.localPath = localPath;
            this.size = size;
            this.staged = staged;
        }

        public static Retrieval inPlace(Path path, long size) { return new Retrieval(true, "Located", path, size, false); }
        public static Retrieval staged(Path path, long size) { return new Retrieval(true, "Downloaded", path, size, true); }
        public static Retrieval failed(String message) { return new Retrieval(false, message, null, 0, false); }

        public boolean success() { return success; }
        public String message() { return message; }
        public Path localPath() { return localPath; }
        public long size() { return size; }
        /** Cópia temporária que o chamador deve apagar. */
        public boolean staged() { return staged; }
    }

    // ==================================================================================
    // Resolução de caminhos
    // ==================================================================================

    /**
     * Prefixa o path base do destino, exceto quando o caminho já o contém.
     */
    public static String resolvePath(String path, Destination destination) {
        String base = stripTrailingSlash(destination.path());
        String p = path == null ? "" : path.trim();
        if (base.isEmpty()) {
            return p;
        }
        if (p.equals(base) || p.startsWith(base + "/")) {
            return p;
        }
        while (p.startsWith("/")) {
            p = p.substring(1);
        }
        return p.isEmpty() ? base : base + "/" + p;
    }

    private static String stripTrailingSlash(String s) {
        String out = s == null ? "" : s.trim();
        while (out.length() > 1 && out.endsWith("/")) {
            out = out.substring(0, out.length() - 1);
        }
        return out;
    }

    /** Download interrompido: remove o arquivo parcial e o diretório de staging se ficou vazio. */
    private static void discardPartialDownload(Path target, Path stagingDir) {
        try {
            Files.deleteIfExists(target);
            try (DirectoryStream<Path> rest = Files.newDirectoryStream(stagingDir)) {
                if (!rest.iterator().hasNext()) {
                    Files.delete(stagingDir);
                }
            }
        } catch (IOException e) {
            LoggerFactory.getLogger(Storage.class).warn("Falha ao limpar download parcial {}: {}", target, e.getMessage());
        }
    }

    private static long sizeOrZero(Path p) {
        try {
            return Files.size(p);
        } catch (IOException e) {
            return 0;
        }
    }

    // ==================================================================================
    // Local
    // ==================================================================================

    /** Opera direto no filesystem; o path base do destino é um diretório local. */
    public static final class LocalTransport implements Transport {
        private static final Logger log = LoggerFactory.getLogger(LocalTransport.class);

        @Override
        public TransportResult upload(Path localFile, String remoteKey, Destination destination) {
            Path target = Path.of(resolvePath(remoteKey, destination));
            try {
                if (target.getParent() != null) {
                    Files.createDirectories(target.getParent());
                }
                if (!localFile.toAbsolutePath().normalize().equals(target.toAbsolutePath().normalize())) {
                    Files.copy(localFile, target, StandardCopyOption.REPLACE_EXISTING);
                }
                return TransportResult.ok("Uploaded", target.toString(), Files.size(target));
            } catch (IOException e) {
                log.warn("Cópia local {} -> {} falhou: {}", localFile, target, e.getMessage());
                return TransportResult.failed("Upload failed: " + e.getMessage());
            }
        }

        @Override
        public TransportResult download(String remoteKey, Path localFile, Destination destination) {
            Path source = Path.of(resolvePath(remoteKey, destination));
            if (!Files.isRegularFile(source)) {
                return TransportResult.failed("Backup file not found: " + source);
            }
            try {
                if (localFile.getParent() != null) {
                    Files.createDirectories(localFile.getParent());
                }
                Files.copy(source, localFile, StandardCopyOption.REPLACE_EXISTING);
                return TransportResult.ok("Downloaded", localFile.toString(), Files.size(localFile));
            } catch (IOException e) {
                return TransportResult.failed("Download failed: " + e.getMessage());
            }
        }

        @Override
        public List<RemoteEntry> list(String path, Destination destination) throws IOException {
            Path dir = Path.of(resolvePath(path, destination));
            if (!Files.isDirectory(dir)) {
                return List.of();
            }
            List<RemoteEntry> entries = new ArrayList<>();
            try (Stream<Path> children = Files.list(dir)) {
                for (Path child : (Iterable<Path>) children::iterator) {
                    boolean isDir = Files.isDirectory(child);
                    entries.add(new RemoteEntry(child.getFileName().toString(),
                            isDir ? 0 : Files.size(child), isDir,
                            Files.getLastModifiedTime(child).toInstant().getEpochSecond()));
                }
            }
            entries.sort(Comparator.comparing(RemoteEntry::name));
            return entries;
        }

        @Override
        public TransportResult delete(String path, Destination destination) {
            Path target = Path.of(resolvePath(path, destination));
            try {
                if (Files.isDirectory(target)) {
                    try (Stream<Path> walk = Files.walk(target)) {
                        for (Path p : (Iterable<Path>) walk.sorted(Comparator.reverseOrder())::iterator) {
                            Files.deleteIfExists(p);
                        }
                    }
                    return TransportResult.ok("Deleted", target.toString(), -1);
                }
                boolean deleted = Files.deleteIfExists(target);
                return deleted
                        ? TransportResult.ok("Deleted", target.toString(), -1)
                        : TransportResult.failed("File not found: " + target);
            } catch (IOException e) {
                return TransportResult.failed("Delete failed: " + e.getMessage());
            }
        }

        @Override
        public boolean exists(String path, Destination destination) {
            return Files.exists(Path.of(resolvePath(path, destination)));
        }

        @Override
        public TransportResult mkdir(String path, Destination destination) {
            Path dir = Path.of(resolvePath(path, destination));
            if (Files.isDirectory(dir)) {
                return TransportResult.ok("Directory already exists", dir.toString(), -1);
            }
            try {
                Files.createDirectories(dir);
                return TransportResult.ok("Directory created", dir.toString(), -1);
            } catch (IOException e) {
                return TransportResult.failed("Failed to create directory: " + e.getMessage());
            }
        }

        /** Local: o arquivo já está na posição final; nada é copiado e nada deve ser apagado depois. */
        @Override
        public Retrieval retrieve(String ref, Destination destination, Path stagingDir) {
            Path file = Path.of(resolvePath(ref, destination));
            if (!Files.isRegularFile(file)) {
                return Retrieval.failed("Backup file not found: " + file);
            }
            return Retrieval.inPlace(file, sizeOrZero(file));
        }
    }

    // ==================================================================================
    // Ponte (subprocesso)
    // ==================================================================================

    /**
     * Delega ao subsistema de transporte do host através de um processo por ação. O processo escreve um
     * objeto JSON em stdout e diagnósticos em stderr; exit code diferente de zero, stdout vazio ou JSON
     * malformado são falha de transporte.
     */
    public static final class BridgeTransport implements Transport {
        private static final Logger log = LoggerFactory.getLogger(BridgeTransport.class);
        private final String bridgeBin;
        private final ProcessRunner runner;
        private final ObjectMapper mapper = new ObjectMapper();

        public BridgeTransport(String bridgeBin, ProcessRunner runner) {
            this.bridgeBin = Objects.requireNonNull(bridgeBin, "bridgeBin");
            this.runner = Objects.requireNonNull(runner, "runner");
        }

        @Override
        public TransportResult upload(Path localFile, String remoteKey, Destination destination) {
            String remote = resolvePath(remoteKey, destination);
            return toResult(call(destination, "upload", List.of("--local=" + localFile, "--remote=" + remote)), remote);
        }

        @Override
        public TransportResult download(String remoteKey, Path localFile, Destination destination) {
            String remote = resolvePath(remoteKey, destination);
            return toResult(call(destination, "download", List.of("--remote=" + remote, "--local=" + localFile)),
                    localFile.toString());
        }

        @Override
        public List<RemoteEntry> list(String path, Destination destination) throws IOException {
            BridgeReply reply = call(destination, "ls", List.of("--path=" + resolvePath(path, destination)));
            if (!reply.ok()) {
                throw new IOException("Listagem falhou em " + destination.id() + ": " + reply.error());
            }
            JsonNode files = reply.json().path("files");
            List<RemoteEntry> entries = new ArrayList<>();
            if (files.isArray()) {
                for (JsonNode f : files) {
                    String name = f.path("file").asText("");
                    if (name.isEmpty()) continue;
                    entries.add(new RemoteEntry(name, f.path("size").asLong(0),
                            "dir".equalsIgnoreCase(f.path("type").asText("")) || "directory".equalsIgnoreCase(f.path("type").asText("")),
                            f.path("mtime").asLong(0)));
                }
            }
            return entries;
        }

        @Override
        public TransportResult delete(String path, Destination destination) {
            String remote = resolvePath(path, destination);
            return toResult(call(destination, "delete", List.of("--path=" + remote)), remote);
        }

        /**
         * A ponte não tem ação exists: lista o diretório pai e procura o nome.
         */
        @Override
        public boolean exists(String path, Destination destination) {
            String resolved = resolvePath(path, destination);
            int slash = resolved.lastIndexOf('/');
            String parent = slash > 0 ? resolved.substring(0, slash) : (slash == 0 ? "/" : "");
            String name = slash >= 0 ? resolved.substring(slash + 1) : resolved;
            try {
                return list(parent, destination).stream().anyMatch(e -> e.name().equals(name));
            } catch (IOException e) {
                log.debug("exists({}) falhou: {}", resolved, e.getMessage());
                return false;
            }
        }

        @Override
        public TransportResult mkdir(String path, Destination destination) {
            String remote = resolvePath(path, destination);
            TransportResult result = toResult(call(destination, "mkdir", List.of("--path=" + remote)), remote);
            if (!result.success() && result.message().toLowerCase(Locale.ROOT).contains("exist")) {
                return TransportResult.ok("Directory already exists", remote, -1);
            }
            return result;
        }

        private TransportResult toResult(BridgeReply reply, String fallbackPath) {
            if (!reply.ok()) {
                return TransportResult.failed(reply.error());
            }
            JsonNode json = reply.json();
            String message = json.path("message").asText("");
            if (!json.path("success").asBoolean(false)) {
                return TransportResult.failed(message.isEmpty() ? "Transport reported failure" : message);
            }
            String path = json.hasNonNull("remote_path") ? json.get("remote_path").asText()
                    : json.hasNonNull("local_path") ? json.get("local_path").asText() : fallbackPath;
            long size = json.hasNonNull("size") ? json.get("size").asLong(-1) : -1;
            return TransportResult.ok(message, path, size);
        }

        private BridgeReply call(Destination destination, String action, List<String> args) {
            List<String> command = new ArrayList<>();
            command.add(bridgeBin);
            command.add("--action=" + action);
            command.add("--transport=" + destination.id());
            command.addAll(args);
            Outcome outcome;
            try {
                outcome = runner.run(command, line -> {
                    if (line.stream() == ProcessRunner.Stream.STDERR) {
                        log.debug("[bridge {}] {}", action, line.text());
                    }
                });
            } catch (IOException e) {
                log.warn("Ponte de transporte indisponível ({}): {}", action, e.getMessage());
                return BridgeReply.error("Transport bridge failed to start: " + e.getMessage());
            }
            if (!outcome.succeeded()) {
                String detail = outcome.stderrText().isBlank() ? "" : ": " + lastLine(outcome.stderr());
                return BridgeReply.error("Transport bridge exited with code " + outcome.exitCode() + detail);
            }
            String stdout = outcome.stdoutText().trim();
            if (stdout.isEmpty()) {
                return BridgeReply.error("Transport bridge returned no output");
            }
            try {
                JsonNode json = mapper.readTree(stdout);
                if (json == null || !json.isObject()) {
                    return BridgeReply.error("Malformed transport bridge response");
                }
                return BridgeReply.of(json);
            } catch (IOException e) {
                return BridgeReply.error("Malformed transport bridge response");
            }
        }

        private static String lastLine(List<String> lines) {
            return lines.isEmpty() ? "" : lines.get(lines.size() - 1);
        }

        private static final class BridgeReply {
            private final JsonNode json;
            private final String error;

            private BridgeReply(JsonNode json, String error) {
                this.json = json;
                this.error = error;
            }

            static BridgeReply of(JsonNode json) { return new BridgeReply(json, null); }
            static BridgeReply error(String error) { return new BridgeReply(null, error); }

            boolean ok() { return error == null; }
            JsonNode json() { return json; }
            String error() { return error; }
        }
    }

    // ==================================================================================
    // S3 compatível
    // ==================================================================================

    /**
     * Destinos do tipo "s3" falam direto com o bucket via AWS SDK v2. Credenciais vêm do próprio destino
     * (bucket, region, access_key_id, secret_access_key, session_token, endpoint); sem chaves, usa a
     * cadeia padrão do SDK. Um cliente por destino, reaproveitado.
     */
    public static final class S3Transport implements Transport {
        private static final Logger log = LoggerFactory.getLogger(S3Transport.class);
        private final Map<String, software.amazon.awssdk.services.s3.S3Client> clients = new ConcurrentHashMap<>();

        @Override
        public TransportResult upload(Path localFile, String remoteKey, Destination destination) {
            String key = objectKey(remoteKey, destination);
            int maxAttempts = 3;
            long backoffMillis = 1000L;
            for (int attempt = 1; attempt <= maxAttempts; attempt++) {
                try {
                    long size = Files.size(localFile);
                    client(destination).putObject(software.amazon.awssdk.services.s3.model.PutObjectRequest.builder()
                                    .bucket(bucket(destination)).key(key).contentLength(size)
                                    .contentType("application/gzip").build(),
                            software.amazon.awssdk.core.sync.RequestBody.fromFile(localFile));
                    return TransportResult.ok("Uploaded", key, size);
                } catch (IOException e) {
                    return TransportResult.failed("Upload failed: " + e.getMessage());
                } catch (software.amazon.awssdk.core.exception.SdkException e) {
                    if (attempt >= maxAttempts) {
                        return TransportResult.failed("Upload failed: " + errorMessage(e));
                    }
                    log.warn("Upload para {} falhou (tentativa {}/{}): {}. Retentando em {} ms...",
                            key, attempt, maxAttempts, errorMessage(e), backoffMillis);
                    if (!sleepQuietly(backoffMillis)) {
                        return TransportResult.failed("Upload interrupted");
                    }
                    backoffMillis = Math.min(backoffMillis * 2, 8000L);
                } catch (IllegalStateException e) {
                    return TransportResult.failed(e.getMessage());
                }
            }
            return TransportResult.failed("Upload failed: attempts exhausted");
        }

        @Override
        public TransportResult download(String remoteKey, Path localFile, Destination destination) {
            String key = objectKey(remoteKey, destination);
            try {
                if (localFile.getParent() != null) {
                    Files.createDirectories(localFile.getParent());
                }
                Files.deleteIfExists(localFile);
                client(destination).getObject(software.amazon.awssdk.services.s3.model.GetObjectRequest.builder()
                                .bucket(bucket(destination)).key(key).build(),
                        software.amazon.awssdk.core.sync.ResponseTransformer.toFile(localFile));
                return TransportResult.ok("Downloaded", localFile.toString(), Files.size(localFile));
            } catch (software.amazon.awssdk.services.s3.model.NoSuchKeyException e) {
                return TransportResult.failed("Backup file not found: " + key);
            } catch (IOException | software.amazon.awssdk.core.exception.SdkException | IllegalStateException e) {
                return TransportResult.failed("Download failed: " + errorMessage(e));
            }
        }

        @Override
        public List<RemoteEntry> list(String path, Destination destination) throws IOException {
            String prefix = objectKey(path, destination);
            if (!prefix.isEmpty() && !prefix.endsWith("/")) {
                prefix = prefix + "/";
            }
            List<RemoteEntry> entries = new ArrayList<>();
            try {
                software.amazon.awssdk.services.s3.model.ListObjectsV2Request request =
                        software.amazon.awssdk.services.s3.model.ListObjectsV2Request.builder()
                                .bucket(bucket(destination)).prefix(prefix).delimiter("/").build();
                for (software.amazon.awssdk.services.s3.model.ListObjectsV2Response page
                        : client(destination).listObjectsV2Paginator(request)) {
                    for (software.amazon.awssdk.services.s3.model.CommonPrefix dir : page.commonPrefixes()) {
                        String name = dir.prefix().substring(prefix.length());
                        entries.add(new RemoteEntry(name.endsWith("/") ? name.substring(0, name.length() - 1) : name, 0, true, 0));
                    }
                    for (software.amazon.awssdk.services.s3.model.S3Object object : page.contents()) {
                        String name = object.key().substring(prefix.length());
                        if (name.isEmpty()) continue;
                        Instant modified = object.lastModified();
                        entries.add(new RemoteEntry(name, object.size() != null ? object.size() : 0, false,
                                modified != null ? modified.getEpochSecond() : 0));
                    }
                }
            } catch (software.amazon.awssdk.core.exception.SdkException | IllegalStateException e) {
                throw new IOException("Falha ao listar " + prefix + ": " + errorMessage(e), e);
            }
            return entries;
        }

        @Override
        public TransportResult delete(String path, Destination destination) {
            String key = objectKey(path, destination);
            try {
                client(destination).deleteObject(software.amazon.awssdk.services.s3.model.DeleteObjectRequest.builder()
                        .bucket(bucket(destination)).key(key).build());
                return TransportResult.ok("Deleted", key, -1);
            } catch (software.amazon.awssdk.core.exception.SdkException | IllegalStateException e) {
                return TransportResult.failed("Delete failed: " + errorMessage(e));
            }
        }

        @Override
        public boolean exists(String path, Destination destination) {
            String key = objectKey(path, destination);
            try {
                client(destination).headObject(software.amazon.awssdk.services.s3.model.HeadObjectRequest.builder()
                        .bucket(bucket(destination)).key(key).build());
                return true;
            } catch (software.amazon.awssdk.services.s3.model.NoSuchKeyException e) {
                return false;
            } catch (software.amazon.awssdk.services.s3.model.S3Exception e) {
                if (e.statusCode() != 404) {
                    log.warn("HEAD de {} falhou: {}", key, errorMessage(e));
                }
                return false;
            } catch (software.amazon.awssdk.core.exception.SdkException | IllegalStateException e) {
                log.warn("HEAD de {} falhou: {}", key, errorMessage(e));
                return false;
            }
        }

        /** Buckets não têm diretórios; prefixos passam a existir com o primeiro objeto. */
        @Override
        public TransportResult mkdir(String path, Destination destination) {
            return TransportResult.ok("Directory already exists", objectKey(path, destination), -1);
        }

        /** Chave do objeto: caminho resolvido sem "/" inicial. */
        static String objectKey(String path, Destination destination) {
            String key = resolvePath(path, destination);
            while (key.startsWith("/")) {
                key = key.substring(1);
            }
            return key;
        }

        private static String bucket(Destination destination) {
            String bucket = destination.credentials().get("bucket");
            if (bucket == null || bucket.isBlank()) {
                throw new IllegalStateException("Destino " + destination.id() + " sem bucket configurado");
            }
            return bucket;
        }

        private software.amazon.awssdk.services.s3.S3Client client(Destination destination) {
            return clients.computeIfAbsent(destination.id(), id -> createClient(destination));
        }

        static software.amazon.awssdk.services.s3.S3Client createClient(Destination destination) {
            Map<String, String> c = destination.credentials();
            software.amazon.awssdk.services.s3.S3ClientBuilder builder = software.amazon.awssdk.services.s3.S3Client.builder()
                    .region(software.amazon.awssdk.regions.Region.of(Optional.ofNullable(c.get("region")).filter(r -> !r.isBlank()).orElse("us-east-1")))
                    .credentialsProvider(credentialsProvider(c));
            Optional.ofNullable(c.get("endpoint")).filter(e -> !e.isBlank()).ifPresent(endpoint -> {
                builder.endpointOverride(java.net.URI.create(endpoint));
                builder.forcePathStyle(true);
            });
            return builder.build();
        }

        private static software.amazon.awssdk.auth.credentials.AwsCredentialsProvider credentialsProvider(Map<String, String> c) {
            String accessKey = c.get("access_key_id");
            String secretKey = c.get("secret_access_key");
            if (accessKey == null || accessKey.isBlank() || secretKey == null || secretKey.isBlank()) {
                return software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider.create();
            }
            String sessionToken = c.get("session_token");
            software.amazon.awssdk.auth.credentials.AwsCredentials credentials;
            if (sessionToken != null && !sessionToken.isBlank()) {
                credentials = software.amazon.awssdk.auth.credentials.AwsSessionCredentials.create(accessKey, secretKey, sessionToken);
            } else {
                credentials = software.amazon.awssdk.auth.credentials.AwsBasicCredentials.create(accessKey, secretKey);
            }
            return software.amazon.awssdk.auth.credentials.StaticCredentialsProvider.create(credentials);
        }

        private static boolean sleepQuietly(long millis) {
            try {
                Thread.sleep(millis);
                return true;
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
                return false;
            }
        }

        private static String errorMessage(Throwable e) {
            String msg = e.getMessage();
            return msg == null || msg.isBlank() ? e.getClass().getSimpleName() : msg;
        }

        @Override
        public void close() {
            clients.values().forEach(client -> {
                try {
                    client.close();
                } catch (RuntimeException e) {
                    log.warn("Falha ao fechar S3Client: {}", e.getMessage());
                }
            });
            clients.clear();
        }
    }
}
