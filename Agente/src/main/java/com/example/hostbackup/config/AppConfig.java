package com.example.hostbackup.config;

import io.github.cdimascio.dotenv.Dotenv;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * AppConfig
 * ----------
 * Carrega e expõe as configurações do agente de backup/restore.
 *
 * PRINCÍPIOS:
 * - Precedência previsível: overrides > System properties > variáveis de ambiente > .env.
 * - Chaves centralizadas em constantes.
 * - Getters tipados com limites para evitar valores absurdos (poll de 0 ms, timeouts negativos).
 * - toString() sem segredos.
 *
 * NOTAS:
 * - Diretórios derivados (cancel, manifests, queue, users) ficam ao lado do diretório de logs
 *   quando não configurados explicitamente.
 * - Binários externos (pkgacct, restorepkg, bridge de transporte) são apenas caminhos; nada é validado
 *   aqui além de presença.
 */
public final class AppConfig {

    // ======= CHAVES DE CONFIGURAÇÃO =======

    /** Diretório dos logs por job e do operations.log. */
    public static final String LOG_DIR = "HOSTBACKUP_LOG_DIR";
    /** Diretório de staging para destinos remotos e downloads de restore. */
    public static final String TEMP_DIR = "HOSTBACKUP_TEMP_DIR";
    /** Diretório dos marcadores de cancelamento ({jobId}.cancel). */
    public static final String CANCEL_DIR = "HOSTBACKUP_CANCEL_DIR";
    /** Diretório dos manifests de retenção (um .jsonl por agendamento). */
    public static final String MANIFEST_DIR = "HOSTBACKUP_MANIFEST_DIR";
    /** Raiz da fila (queued/, running/, completed/). */
    public static final String QUEUE_DIR = "HOSTBACKUP_QUEUE_DIR";
    /** Diretório das preferências por usuário ({user}.json). */
    public static final String USER_CONFIG_DIR = "HOSTBACKUP_USER_CONFIG_DIR";
    /** Arquivo JSON com a lista de destinos configurados. */
    public static final String DESTINATIONS_FILE = "HOSTBACKUP_DESTINATIONS_FILE";

    /** Ferramenta de arquivamento por conta. */
    public static final String PKGACCT_BIN = "PKGACCT_BIN";
    /** Ferramenta de restauração por conta. */
    public static final String RESTOREPKG_BIN = "RESTOREPKG_BIN";
    /** Processo ponte para destinos remotos (JSON em stdout). */
    public static final String TRANSPORT_BRIDGE_BIN = "TRANSPORT_BRIDGE_BIN";
    /** Helper de backup quente de banco (mariadb-backup/mysqlbackup). */
    public static final String HOT_DB_BACKUP_BIN = "HOT_DB_BACKUP_BIN";
    /** Helper de restore quente de banco. */
    public static final String HOT_DB_RESTORE_BIN = "HOT_DB_RESTORE_BIN";
    /** Binário sendmail para o canal de e-mail. */
    public static final String SENDMAIL_BIN = "SENDMAIL_BIN";

    /** Intervalo (ms) de poll ao multiplexar stdout/stderr de subprocessos. */
    public static final String PROCESS_POLL_MILLIS = "PROCESS_POLL_MILLIS";
    /** Intervalo (s) entre varreduras da fila. */
    public static final String QUEUE_POLL_SECONDS = "QUEUE_POLL_SECONDS";
    /** Timeout (s) das chamadas HTTP de notificação. */
    public static final String NOTIFY_HTTP_TIMEOUT_SECONDS = "NOTIFY_HTTP_TIMEOUT_SECONDS";

    public static final String DEFAULT_LOG_DIR = "/usr/local/hostbackup/logs";
    public static final String DEFAULT_TEMP_DIR = "/home/hostbackup_tmp";

    // ======= ARMAZENAMENTO INTERNO =======

    private final ConcurrentHashMap<String, String> overrides = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, String> values;

    private AppConfig(Map<String, String> values) {
        this.values = new ConcurrentHashMap<>(values);
    }

    /**
     * Carrega configurações de três fontes, com a seguinte precedência:
     * 1) System properties (java -Dchave=valor)
     * 2) Variáveis de ambiente (System.getenv)
     * 3) Arquivo .env (se existir)
     */
    public static AppConfig load() {
        Dotenv dotenv = Dotenv.configure()
                .ignoreIfMissing()
                .load();

        Map<String, String> map = new ConcurrentHashMap<>();

        System.getProperties().forEach((k, v) -> {
            if (k != null && v != null) {
                map.put(String.valueOf(k), String.valueOf(v));
            }
        });

        System.getenv().forEach(map::putIfAbsent);

        // .env preenche apenas ausentes
        dotenv.entries().forEach(e -> map.putIfAbsent(e.getKey(), e.getValue()));

        return new AppConfig(map);
    }

    /**
     * Útil para testes: cria AppConfig a partir de um Map já resolvido.
     */
    public static AppConfig fromMap(Map<String, String> values) {
        return new AppConfig(values);
    }

    // ======= API BÁSICA DE ACESSO =======

    public Optional<String> find(String key) {
        Objects.requireNonNull(key, "key");
        String override = overrides.get(key);
        if (override != null) {
            return Optional.of(override);
        }
        String value = values.get(key);
        return value != null && !value.isBlank() ? Optional.of(value.trim()) : Optional.empty();
    }

    public String require(String key) {
        return find(key).orElseThrow(() -> new IllegalStateException("Configuração obrigatória ausente: " + key));
    }

    public String getOrDefault(String key, String defaultValue) {
        return find(key).orElse(defaultValue);
    }

    /**
     * Seta/remove override em runtime. Se value==null, remove o override.
     */
    public void override(String key, String value) {
        if (value == null) {
            overrides.remove(key);
        } else {
            overrides.put(key, value);
        }
    }

    // ======= DIRETÓRIOS =======

    public Path logDir() {
        return Path.of(getOrDefault(LOG_DIR, DEFAULT_LOG_DIR)).toAbsolutePath().normalize();
    }

    public Path tempDir() {
        return Path.of(getOrDefault(TEMP_DIR, DEFAULT_TEMP_DIR)).toAbsolutePath().normalize();
    }

    public Path cancelDir() {
        return siblingOfLogDir(CANCEL_DIR, "cancel");
    }

    public Path manifestDir() {
        return siblingOfLogDir(MANIFEST_DIR, "manifests");
    }

    public Path queueDir() {
        return siblingOfLogDir(QUEUE_DIR, "queue");
    }

    public Path userConfigDir() {
        return siblingOfLogDir(USER_CONFIG_DIR, "users");
    }

    public Path destinationsFile() {
        return siblingOfLogDir(DESTINATIONS_FILE, "destinations.json");
    }

    private Path siblingOfLogDir(String key, String name) {
        return find(key)
                .map(Path::of)
                .orElseGet(() -> {
                    Path parent = logDir().getParent();
                    return parent != null ? parent.resolve(name) : logDir().resolve(name);
                })
                .toAbsolutePath()
                .normalize();
    }

    // ======= FERRAMENTAS EXTERNAS =======

    public String pkgacctBin() {
        return getOrDefault(PKGACCT_BIN, "/usr/local/cpanel/scripts/pkgacct");
    }

    public String restorepkgBin() {
        return getOrDefault(RESTOREPKG_BIN, "/scripts/restorepkg");
    }

    public String transportBridgeBin() {
        return getOrDefault(TRANSPORT_BRIDGE_BIN, "/usr/local/hostbackup/bin/transport_bridge");
    }

    /** Helper de backup quente; obrigatório apenas quando algum usuário configura método quente. */
    public Optional<String> hotDbBackupBin() {
        return find(HOT_DB_BACKUP_BIN);
    }

    public Optional<String> hotDbRestoreBin() {
        return find(HOT_DB_RESTORE_BIN);
    }

    public String sendmailBin() {
        return getOrDefault(SENDMAIL_BIN, "/usr/sbin/sendmail");
    }

    // ======= TEMPOS =======

    /**
     * Poll de subprocessos. Limites: [10, 1000] ms. Padrão 50 ms.
     */
    public Duration processPollInterval() {
        return Duration.ofMillis(longConfig(PROCESS_POLL_MILLIS, 50, 10, 1000));
    }

    /**
     * Intervalo entre varreduras da fila. Limites: [5, 3600] s. Padrão 60 s.
     */
    public Duration queuePollInterval() {
        return Duration.ofSeconds(longConfig(QUEUE_POLL_SECONDS, 60, 5, 3600));
    }

    /**
     * Timeout HTTP das notificações. Limites: [1, 120] s. Padrão 15 s.
     */
    public Duration notifyHttpTimeout() {
        return Duration.ofSeconds(intConfig(NOTIFY_HTTP_TIMEOUT_SECONDS, 15, 1, 120));
    }

    // ======= HELPERS TIPADOS =======

    /**
     * "true/1/yes" (case-insensitive) → true; senão, false.
     */
    public boolean bool(String key, boolean def) {
        String raw = getOrDefault(key, Boolean.toString(def));
        return raw.equalsIgnoreCase("true")
                || raw.equalsIgnoreCase("1")
                || raw.equalsIgnoreCase("yes");
    }

    /** Parser long com faixa [min, max]; se inválido, retorna default. */
    private long longConfig(String key, long def, long min, long max) {
        String raw = getOrDefault(key, Long.toString(def));
        try {
            long v = Long.parseLong(raw.trim());
            if (v < min) return min;
            if (v > max) return max;
            return v;
        } catch (NumberFormatException e) {
            return def;
        }
    }

    /** Parser int com faixa [min, max]; se inválido, retorna default. */
    private int intConfig(String key, int def, int min, int max) {
        String raw = getOrDefault(key, Integer.toString(def));
        try {
            int v = Integer.parseInt(raw.trim());
            if (v < min) return min;
            if (v > max) return max;
            return v;
        } catch (NumberFormatException e) {
            return def;
        }
    }

    // ======= LOGGING SEGURO =======

    @Override
    public String toString() {
        return "AppConfig{" +
                "logDir=" + safe(() -> logDir().toString()) +
                ", tempDir=" + safe(() -> tempDir().toString()) +
                ", queueDir=" + safe(() -> queueDir().toString()) +
                ", pkgacct=" + pkgacctBin() +
                ", restorepkg=" + restorepkgBin() +
                ", bridge=" + transportBridgeBin() +
                ", hotDb=" + (hotDbBackupBin().isPresent() ? "set" : "unset") +
                ", pollMs=" + processPollInterval().toMillis() +
                "}";
    }

    private static String safe(SupplierLike supplier) {
        try { return supplier.get(); } catch (RuntimeException t) { return "error:" + t.getClass().getSimpleName(); }
    }

    @FunctionalInterface
    private interface SupplierLike { String get(); }
}
