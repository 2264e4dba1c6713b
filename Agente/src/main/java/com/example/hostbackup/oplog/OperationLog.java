package com.example.hostbackup.oplog;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Trilha de auditoria durável: um evento por job de backup, restore ou poda.
 */
public final class OperationLog {

    private OperationLog() {}

    public static final String FILE_NAME = "operations.log";
    public static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    public static final String FILTER_ALL = "all";
    public static final String FILTER_ERROR = "error";
    public static final String FILTER_SUCCESS = "success";

    public interface OperationLogger {

        /**
         * Grava um evento. Falhas de escrita são registradas no log de diagnóstico e não sobem:
         * a auditoria nunca derruba um job.
         */
        void logEvent(String user, String type, List<String> items, boolean success,
                      String message, String requestor, String jobId);

        LogPage getLogs(String user, boolean isRoot, int page, int limit, String filter, String accountFilter);

        static OperationLogger noOp() {
            return new OperationLogger() {
                @Override
                public void logEvent(String user, String type, List<String> items, boolean success,
                                     String message, String requestor, String jobId) {
                    // sem trilha de auditoria
                }

                @Override
                public LogPage getLogs(String user, boolean isRoot, int page, int limit,
                                       String filter, String accountFilter) {
                    return new LogPage(List.of(), 0, 1, List.of());
                }
            };
        }
    }

    /** Linha de histórico já achatada para exibição. */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static final class LogView {
        @JsonProperty("timestamp")
        private final String timestamp;
        @JsonProperty("type")
        private final String type;
        @JsonProperty("account")
        private final String account;
        @JsonProperty("user")
        private final String user;
        @JsonProperty("requestor")
        private final String requestor;
        @JsonProperty("status")
        private final String status;
        @JsonProperty("message")
        private final String message;
        @JsonProperty("job_id")
        private final String jobId;

        public LogView(String timestamp, String type, String account, String user, String requestor,
                       String status, String message, String jobId) {
            this.timestamp = timestamp;
            this.type = type;
            this.account = account;
            this.user = user;
            this.requestor = requestor;
            this.status = status;
            this.message = message;
            this.jobId = jobId;
        }

        public String timestamp() { return timestamp; }
        public String type() { return type; }
        public String account() { return account; }
        public String user() { return user; }
        public String requestor() { return requestor; }
        public String status() { return status; }
        public String message() { return message; }
        public String jobId() { return jobId; }
    }

    public static final class LogPage {
        @JsonProperty("logs")
        private final List<LogView> logs;
        @JsonProperty("total_pages")
        private final int totalPages;
        @JsonProperty("current_page")
        private final int currentPage;
        @JsonProperty("accounts")
        private final List<String> accounts;

        public LogPage(List<LogView> logs, int totalPages, int currentPage, List<String> accounts) {
            this.logs = List.copyOf(logs);
            this.totalPages = totalPages;
            this.currentPage = currentPage;
            this.accounts = List.copyOf(accounts);
        }

        public List<LogView> logs() { return logs; }
        public int totalPages() { return totalPages; }
        public int currentPage() { return currentPage; }
        /** Contas distintas vistas pelo usuário, ordenadas, para o filtro da tela de histórico. */
        public List<String> accounts() { return accounts; }
    }

    // ==================================================================================
    // Implementação em arquivo
    // ==================================================================================

    /**
     * Um objeto JSON por linha em {logDir}/operations.log. Escritas serializadas por monitor e por
     * FileLock, já que jobs concorrentes (poller e chamadas diretas) compartilham o arquivo.
     */
    public static final class JsonLinesOperationLogger implements OperationLogger {
        private static final Logger log = LoggerFactory.getLogger(JsonLinesOperationLogger.class);
        /** Remove o sufixo " (2m 30s)" dos itens para obter o nome da conta. */
        private static final Pattern ITEM_SUFFIX = Pattern.compile("^(.*?)\\s*\\([^()]*\\)\\s*$");

        private final Path file;
        private final Clock clock;
        private final ObjectMapper mapper = new ObjectMapper();

        public JsonLinesOperationLogger(Path logDir, Clock clock) {
            this.file = Objects.requireNonNull(logDir, "logDir").resolve(FILE_NAME);
            this.clock = Objects.requireNonNull(clock, "clock");
        }

        public Path file() { return file; }

        @Override
        public void logEvent(String user, String type, List<String> items, boolean success,
                             String message, String requestor, String jobId) {
            ObjectNode node = mapper.createObjectNode();
            node.put("timestamp", LocalDateTime.now(clock).format(TIMESTAMP));
            node.put("user", user != null ? user : "");
            node.put("type", type);
            ArrayNode arr = node.putArray("items");
            if (items != null) {
                items.forEach(arr::add);
            }
            node.put("success", success);
            node.put("message", message != null ? message : "");
            node.put("requestor", requestor != null ? requestor : "");
            if (jobId != null && !jobId.isBlank()) {
                node.put("job_id", jobId);
            }
            try {
                byte[] line = (mapper.writeValueAsString(node) + "\n").getBytes(StandardCharsets.UTF_8);
                synchronized (this) {
                    if (file.getParent() != null) {
                        Files.createDirectories(file.getParent());
                    }
                    try (FileChannel channel = FileChannel.open(file, StandardOpenOption.CREATE,
                            StandardOpenOption.WRITE, StandardOpenOption.APPEND);
                         FileLock ignored = channel.lock()) {
                        ByteBuffer buffer = ByteBuffer.wrap(line);
                        while (buffer.hasRemaining()) {
                            channel.write(buffer);
                        }
                    }
                }
            } catch (IOException e) {
                log.error("Falha ao gravar evento {} em {}: {}", type, file, e.getMessage());
            }
        }

        @Override
        public LogPage getLogs(String user, boolean isRoot, int page, int limit, String filter, String accountFilter) {
            int pageSize = Math.max(1, limit);
            int current = Math.max(1, page);
            String f = filter == null || filter.isBlank() ? FILTER_ALL : filter.trim();
            String accountNeedle = accountFilter == null ? "" : accountFilter.trim().toLowerCase(Locale.ROOT);

            List<JsonNode> visible = new ArrayList<>();
            TreeSet<String> accounts = new TreeSet<>();
            for (JsonNode entry : readAll()) {
                if (!isRoot && !entry.path("user").asText("").equals(user)) {
                    continue;
                }
                List<String> names = accountNames(entry);
                accounts.addAll(names);
                if (!matchesFilter(entry, f)) {
                    continue;
                }
                if (!accountNeedle.isEmpty() && names.stream()
                        .noneMatch(n -> n.toLowerCase(Locale.ROOT).contains(accountNeedle))) {
                    continue;
                }
                visible.add(entry);
            }
            Collections.reverse(visible);

            int totalPages = (int) Math.ceil(visible.size() / (double) pageSize);
            int from = Math.min((current - 1) * pageSize, visible.size());
            int to = Math.min(from + pageSize, visible.size());
            List<LogView> views = new ArrayList<>();
            for (JsonNode entry : visible.subList(from, to)) {
                views.add(toView(entry));
            }
            return new LogPage(views, totalPages, current, new ArrayList<>(accounts));
        }

        private static boolean matchesFilter(JsonNode entry, String filter) {
            boolean success = entry.path("success").asBoolean(false);
            switch (filter) {
                case FILTER_ALL:
                    return true;
                case FILTER_ERROR:
                    return !success;
                case FILTER_SUCCESS:
                    return success;
                default:
                    return filter.equals(entry.path("type").asText(""));
            }
        }

        private static LogView toView(JsonNode entry) {
            List<String> items = new ArrayList<>();
            entry.path("items").forEach(i -> items.add(i.asText()));
            String requestor = entry.path("requestor").asText("");
            String jobId = entry.hasNonNull("job_id") ? entry.get("job_id").asText() : null;
            return new LogView(
                    entry.path("timestamp").asText(""),
                    entry.path("type").asText(""),
                    String.join(", ", items),
                    entry.path("user").asText(""),
                    requestor.isBlank() ? "N/A" : requestor,
                    entry.path("success").asBoolean(false) ? "success" : "error",
                    entry.path("message").asText(""),
                    jobId);
        }

        static List<String> accountNames(JsonNode entry) {
            List<String> names = new ArrayList<>();
            for (JsonNode item : entry.path("items")) {
                String text = item.asText("").trim();
                Matcher m = ITEM_SUFFIX.matcher(text);
                String name = m.matches() ? m.group(1).trim() : text;
                if (!name.isEmpty()) {
                    names.add(name);
                }
            }
            return names;
        }

        private List<JsonNode> readAll() {
            if (!Files.isRegularFile(file)) {
                return List.of();
            }
            List<String> lines;
            try {
                synchronized (this) {
                    lines = Files.readAllLines(file, StandardCharsets.UTF_8);
                }
            } catch (IOException e) {
                log.error("Falha ao ler {}: {}", file, e.getMessage());
                return List.of();
            }
            List<JsonNode> out = new ArrayList<>(lines.size());
            for (String line : lines) {
                if (line.isBlank()) continue;
                try {
                    JsonNode node = mapper.readTree(line);
                    if (node != null && node.isObject()) {
                        out.add(node);
                    }
                } catch (IOException e) {
                    log.debug("Linha inválida ignorada em {}", file);
                }
            }
            return out;
        }
    }
}
