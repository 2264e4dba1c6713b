package com.example.hostbackup.config;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Preferências por usuário: notificações, staging, retenção padrão e opções repassadas ao pkgacct.
 * Serializado em snake_case; campos ausentes assumem os padrões abaixo.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class UserSettings {

    public static final String DB_METHOD_PKGACCT = "pkgacct";
    public static final String DB_METHOD_MARIADB = "mariadb-backup";
    public static final String DB_METHOD_MYSQLBACKUP = "mysqlbackup";

    /** Flags skip_* aceitas pela ferramenta de arquivamento. */
    public static final List<String> SKIP_FLAGS = List.of(
            "homedir", "publichtml", "mysql", "pgsql", "logs", "mailconfig", "mailman", "dnszones",
            "ssl", "bwdata", "quota", "ftpusers", "domains", "acctdb", "apitokens", "authnlinks",
            "locale", "passwd", "shell", "resellerconfig", "userdata", "linkednodes", "integrationlinks");

    @JsonProperty("notify_email")
    private String notifyEmail = "";
    @JsonProperty("slack_webhook")
    private String slackWebhook = "";

    @JsonProperty("notify_backup_start")
    private boolean notifyBackupStart = false;
    @JsonProperty("notify_backup_success")
    private boolean notifyBackupSuccess = true;
    @JsonProperty("notify_backup_failure")
    private boolean notifyBackupFailure = true;
    @JsonProperty("notify_restore_start")
    private boolean notifyRestoreStart = false;
    @JsonProperty("notify_restore_success")
    private boolean notifyRestoreSuccess = true;
    @JsonProperty("notify_restore_failure")
    private boolean notifyRestoreFailure = true;

    @JsonProperty("temp_directory")
    private String tempDirectory;
    @JsonProperty("default_retention")
    private int defaultRetention = 30;
    @JsonProperty("db_backup_method")
    private String dbBackupMethod = DB_METHOD_PKGACCT;
    @JsonProperty("compression_option")
    private String compressionOption = "compress";
    @JsonProperty("dbbackup_type")
    private String dbBackupType = "all";

    private final Map<String, Boolean> skipFlags = new LinkedHashMap<>();

    public UserSettings() {
        // Jackson
    }

    public static UserSettings defaults() {
        return new UserSettings();
    }

    // Flags skip_* chegam como propriedades soltas no JSON
    @com.fasterxml.jackson.annotation.JsonAnySetter
    void putExtra(String key, Object value) {
        if (key.startsWith("skip_") && SKIP_FLAGS.contains(key.substring(5))) {
            skipFlags.put(key.substring(5), truthy(value));
        }
    }

    @com.fasterxml.jackson.annotation.JsonAnyGetter
    Map<String, Boolean> extras() {
        Map<String, Boolean> out = new LinkedHashMap<>();
        skipFlags.forEach((k, v) -> out.put("skip_" + k, v));
        return out;
    }

    private static boolean truthy(Object value) {
        if (value instanceof Boolean) return (Boolean) value;
        if (value instanceof Number) return ((Number) value).intValue() != 0;
        if (value == null) return false;
        String s = value.toString().trim();
        return s.equalsIgnoreCase("true") || s.equals("1") || s.equalsIgnoreCase("yes");
    }

    public String notifyEmail() { return notifyEmail == null ? "" : notifyEmail.trim(); }
    public String slackWebhook() { return slackWebhook == null ? "" : slackWebhook.trim(); }
    public boolean notifyBackupStart() { return notifyBackupStart; }
    public boolean notifyBackupSuccess() { return notifyBackupSuccess; }
    public boolean notifyBackupFailure() { return notifyBackupFailure; }
    public boolean notifyRestoreStart() { return notifyRestoreStart; }
    public boolean notifyRestoreSuccess() { return notifyRestoreSuccess; }
    public boolean notifyRestoreFailure() { return notifyRestoreFailure; }
    public int defaultRetention() { return defaultRetention; }
    public String dbBackupMethod() { return dbBackupMethod == null || dbBackupMethod.isBlank() ? DB_METHOD_PKGACCT : dbBackupMethod; }
    public String compressionOption() { return compressionOption; }
    public String dbBackupType() { return dbBackupType; }

    @JsonIgnore
    public Map<String, Boolean> skipFlags() { return Collections.unmodifiableMap(skipFlags); }

    @JsonIgnore
    public boolean usesHotDatabaseBackup() {
        String method = dbBackupMethod();
        return DB_METHOD_MARIADB.equals(method) || DB_METHOD_MYSQLBACKUP.equals(method);
    }

    /**
     * Diretório de staging sanitizado: apenas [A-Za-z0-9_/.-] e caminho absoluto; caso contrário o fallback.
     */
    public Path tempDirectory(Path fallback) {
        if (tempDirectory == null) return fallback;
        String cleaned = tempDirectory.replaceAll("[^a-zA-Z0-9_/.\\-]", "");
        if (!cleaned.startsWith("/")) return fallback;
        return Path.of(cleaned).normalize();
    }

    // ---- cópias modificadas ------------------------------------------------
    // A instância carregada pode ser compartilhada entre jobs; cada with* devolve uma cópia.

    public UserSettings withNotifications(boolean start, boolean success, boolean failure) {
        UserSettings copy = copy();
        copy.notifyBackupStart = start;
        copy.notifyBackupSuccess = success;
        copy.notifyBackupFailure = failure;
        copy.notifyRestoreStart = start;
        copy.notifyRestoreSuccess = success;
        copy.notifyRestoreFailure = failure;
        return copy;
    }

    public UserSettings withDbBackupMethod(String method) {
        UserSettings copy = copy();
        copy.dbBackupMethod = method;
        return copy;
    }

    public UserSettings withTempDirectory(String dir) {
        UserSettings copy = copy();
        copy.tempDirectory = dir;
        return copy;
    }

    public UserSettings withSlackWebhook(String url) {
        UserSettings copy = copy();
        copy.slackWebhook = url;
        return copy;
    }

    public UserSettings withNotifyEmail(String email) {
        UserSettings copy = copy();
        copy.notifyEmail = email;
        return copy;
    }

    public UserSettings withSkip(String flag, boolean value) {
        if (!SKIP_FLAGS.contains(flag)) {
            throw new IllegalArgumentException("Flag skip desconhecida: " + flag);
        }
        UserSettings copy = copy();
        copy.skipFlags.put(flag, value);
        return copy;
    }

    private UserSettings copy() {
        UserSettings copy = new UserSettings();
        copy.notifyEmail = notifyEmail;
        copy.slackWebhook = slackWebhook;
        copy.notifyBackupStart = notifyBackupStart;
        copy.notifyBackupSuccess = notifyBackupSuccess;
        copy.notifyBackupFailure = notifyBackupFailure;
        copy.notifyRestoreStart = notifyRestoreStart;
        copy.notifyRestoreSuccess = notifyRestoreSuccess;
        copy.notifyRestoreFailure = notifyRestoreFailure;
        copy.tempDirectory = tempDirectory;
        copy.defaultRetention = defaultRetention;
        copy.dbBackupMethod = dbBackupMethod;
        copy.compressionOption = compressionOption;
        copy.dbBackupType = dbBackupType;
        copy.skipFlags.putAll(skipFlags);
        return copy;
    }

    // ==== Persistência ====

    /** Fonte das preferências de um usuário. */
    public interface Store {
        UserSettings load(String user);
    }

    /**
     * Lê {dir}/{user}.json. Arquivo ausente ou ilegível resulta nos padrões; a falha é apenas logada
     * porque preferências nunca devem impedir um backup.
     */
    public static final class JsonStore implements Store {
        private static final Logger log = LoggerFactory.getLogger(JsonStore.class);
        private final Path dir;
        private final ObjectMapper mapper = new ObjectMapper();

        public JsonStore(Path dir) {
            this.dir = Objects.requireNonNull(dir, "dir");
        }

        @Override
        public UserSettings load(String user) {
            if (user == null || !user.matches("[A-Za-z0-9_.-]+")) {
                return defaults();
            }
            Path file = dir.resolve(user + ".json");
            if (!Files.isRegularFile(file)) {
                return defaults();
            }
            try {
                return mapper.readValue(file.toFile(), UserSettings.class);
            } catch (IOException e) {
                log.warn("Preferências de {} ilegíveis ({}); usando padrões", user, e.getMessage());
                return defaults();
            }
        }
    }
}
