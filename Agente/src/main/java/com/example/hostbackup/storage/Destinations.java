package com.example.hostbackup.storage;

import com.example.hostbackup.jobs.JobFailure;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Destinos de backup configurados e a validação feita antes de qualquer job.
 */
public final class Destinations {

    private Destinations() {}

    public static final String TYPE_LOCAL = "local";
    public static final String TYPE_S3 = "s3";
    /** Base de um destino local configurado sem path. */
    public static final String DEFAULT_LOCAL_PATH = "/backup";

    /**
     * Destino configurado. Imutável; credenciais nunca aparecem em toString().
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class Destination {
        private final String id;
        private final String name;
        private final String type;
        private final boolean enabled;
        private final String path;
        private final String host;
        private final Map<String, String> credentials;

        @JsonCreator
        public Destination(@JsonProperty("id") String id,
                           @JsonProperty("name") String name,
                           @JsonProperty("type") String type,
                           @JsonProperty("enabled") Boolean enabled,
                           @JsonProperty("path") String path,
                           @JsonProperty("host") String host,
                           @JsonProperty("credentials") Map<String, String> credentials) {
            this.id = Objects.requireNonNull(id, "id");
            this.name = name != null && !name.isBlank() ? name : id;
            this.type = type != null ? type.trim().toLowerCase(Locale.ROOT) : TYPE_LOCAL;
            this.enabled = enabled == null || enabled;
            if (path != null && !path.isBlank()) {
                this.path = path;
            } else {
                this.path = isLocal() ? DEFAULT_LOCAL_PATH : "";
            }
            this.host = host;
            this.credentials = credentials != null
                    ? Collections.unmodifiableMap(new LinkedHashMap<>(credentials))
                    : Map.of();
        }

        public String id() { return id; }
        public String name() { return name; }
        public String type() { return type; }
        public boolean enabled() { return enabled; }
        public String path() { return path; }
        public Optional<String> host() { return Optional.ofNullable(host).filter(h -> !h.isBlank()); }
        public Map<String, String> credentials() { return credentials; }

        public boolean isLocal() { return TYPE_LOCAL.equals(type); }

        /** Linha "Destination: nome" ou "Host: host" usada nos eventos de auditoria. */
        public String describe() {
            return isLocal() ? "Destination: " + name : "Host: " + host().orElse(name);
        }

        public static Builder builder() { return new Builder(); }

        public static final class Builder {
            private String id;
            private String name;
            private String type = TYPE_LOCAL;
            private boolean enabled = true;
            private String path = "";
            private String host;
            private final Map<String, String> credentials = new LinkedHashMap<>();

            public Builder id(String v) { id = v; return this; }
            public Builder name(String v) { name = v; return this; }
            public Builder type(String v) { type = v; return this; }
            public Builder enabled(boolean v) { enabled = v; return this; }
            public Builder path(String v) { path = v; return this; }
            public Builder host(String v) { host = v; return this; }
            public Builder credential(String k, String v) { credentials.put(k, v); return this; }
            public Destination build() { return new Destination(id, name, type, enabled, path, host, credentials); }
        }

        @Override
        public String toString() {
            return "Destination{id=" + id + ", type=" + type + ", enabled=" + enabled + "}";
        }
    }

    /** Fonte dos destinos configurados. */
    public interface DestinationRegistry {
        Optional<Destination> find(String id);

        static DestinationRegistry of(List<Destination> destinations) {
            Map<String, Destination> byId = new LinkedHashMap<>();
            destinations.forEach(d -> byId.put(d.id(), d));
            return id -> Optional.ofNullable(id).map(byId::get);
        }
    }

    /**
     * Lê um array JSON de destinos. O arquivo é relido a cada consulta para refletir edições feitas
     * por outro processo enquanto o agente roda.
     */
    public static final class JsonDestinationRegistry implements DestinationRegistry {
        private static final Logger log = LoggerFactory.getLogger(JsonDestinationRegistry.class);
        private final Path file;
        private final ObjectMapper mapper = new ObjectMapper();

        public JsonDestinationRegistry(Path file) {
            this.file = Objects.requireNonNull(file, "file");
        }

        @Override
        public Optional<Destination> find(String id) {
            if (id == null || id.isBlank()) {
                return Optional.empty();
            }
            return all().stream().filter(d -> d.id().equals(id)).findFirst();
        }

        public List<Destination> all() {
            if (!Files.isRegularFile(file)) {
                return List.of();
            }
            try {
                return mapper.readValue(file.toFile(), new TypeReference<List<Destination>>() { });
            } catch (IOException e) {
                log.error("Arquivo de destinos ilegível {}: {}", file, e.getMessage());
                return List.of();
            }
        }
    }

    /**
     * Resolve e valida um destino: inexistente ou desabilitado encerra o job antes de qualquer efeito.
     */
    public static Resolution resolve(DestinationRegistry registry, String destinationId) {
        Optional<Destination> found = registry.find(destinationId);
        if (found.isEmpty()) {
            return new Resolution(null, JobFailure.INVALID_DESTINATION, "Invalid destination");
        }
        if (!found.get().enabled()) {
            return new Resolution(found.get(), JobFailure.DESTINATION_DISABLED, "Destination is disabled");
        }
        return new Resolution(found.get(), null, null);
    }

    public static final class Resolution {
        private final Destination destination;
        private final JobFailure failure;
        private final String message;

        private Resolution(Destination destination, JobFailure failure, String message) {
            this.destination = destination;
            this.failure = failure;
            this.message = message;
        }

        public boolean ok() { return failure == null; }
        public Destination destination() { return destination; }
        public JobFailure failure() { return failure; }
        public String message() { return message; }
    }
}
