package com.example.hostbackup.util;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Convenção de nomes dos artefatos:
 * <pre>
 *   backup-MM.dd.yyyy_HH-mm-ss_{conta}.tar.gz
 *   db-backup-{conta}_yyyy-MM-dd_HH-mm-ss.tar.gz
 * </pre>
 * Os metadados (conta e horário) são derivados do nome, sem índice auxiliar.
 */
public final class ArchiveNames {

    private static final DateTimeFormatter MAIN_STAMP = DateTimeFormatter.ofPattern("MM.dd.yyyy_HH-mm-ss", Locale.ROOT);
    private static final DateTimeFormatter DB_STAMP = DateTimeFormatter.ofPattern("yyyy-MM-dd_HH-mm-ss", Locale.ROOT);

    private static final Pattern MAIN = Pattern.compile(
            "^backup-(\\d{2}\\.\\d{2}\\.\\d{4}_\\d{2}-\\d{2}-\\d{2})_([a-z0-9_]+)\\.tar(\\.gz)?$",
            Pattern.CASE_INSENSITIVE);

    private ArchiveNames() {}

    public static String backupFileName(String account, LocalDateTime at) {
        return "backup-" + MAIN_STAMP.format(at) + "_" + account + ".tar.gz";
    }

    public static String databaseFileName(String account, LocalDateTime at) {
        return "db-backup-" + account + "_" + DB_STAMP.format(at) + ".tar.gz";
    }

    /**
     * Conta codificada no nome canônico; aceita caminho completo ou chave remota.
     */
    public static Optional<String> accountOf(String fileNameOrPath) {
        return match(fileNameOrPath).map(m -> m.group(2));
    }

    public static Optional<LocalDateTime> timestampOf(String fileNameOrPath) {
        return match(fileNameOrPath).flatMap(m -> {
            try {
                return Optional.of(LocalDateTime.parse(m.group(1), MAIN_STAMP));
            } catch (DateTimeParseException e) {
                return Optional.empty();
            }
        });
    }

    /**
     * Nome do arquivo de banco correspondente ao backup principal, no mesmo diretório da referência.
     */
    public static Optional<String> companionDatabaseRef(String backupRef) {
        Optional<String> account = accountOf(backupRef);
        Optional<LocalDateTime> at = timestampOf(backupRef);
        if (account.isEmpty() || at.isEmpty()) {
            return Optional.empty();
        }
        String name = databaseFileName(account.get(), at.get());
        int slash = backupRef.lastIndexOf('/');
        return Optional.of(slash >= 0 ? backupRef.substring(0, slash + 1) + name : name);
    }

    public static String baseName(String ref) {
        if (ref == null) return "";
        int slash = ref.lastIndexOf('/');
        return slash >= 0 ? ref.substring(slash + 1) : ref;
    }

    private static Optional<Matcher> match(String fileNameOrPath) {
        if (fileNameOrPath == null) return Optional.empty();
        Matcher m = MAIN.matcher(baseName(fileNameOrPath));
        return m.matches() ? Optional.of(m) : Optional.empty();
    }
}
