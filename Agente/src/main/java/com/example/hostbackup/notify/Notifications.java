package com.example.hostbackup.notify;

import com.example.hostbackup.config.UserSettings;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Fan-out de eventos de job para os canais configurados por usuário (webhook estilo Slack, e-mail).
 *
 * O dispatcher não decide SE um evento deve sair: isso é responsabilidade dos orquestradores, que
 * consultam as preferências notify_* antes de chamar. Aqui só se entrega, e falha de entrega nunca
 * volta para o job.
 */
public final class Notifications {

    private Notifications() {}

    public enum EventKind {
        BACKUP_START("backup_start", "Backup started"),
        BACKUP_SUCCESS("backup_success", "Backup completed"),
        BACKUP_FAILURE("backup_failure", "Backup failed"),
        RESTORE_START("restore_start", "Restore started"),
        RESTORE_SUCCESS("restore_success", "Restore completed"),
        RESTORE_FAILURE("restore_failure", "Restore failed");

        private final String wireName;
        private final String title;

        EventKind(String wireName, String title) {
            this.wireName = wireName;
            this.title = title;
        }

        public String wireName() { return wireName; }
        public String title() { return title; }

        public boolean isFailure() {
            return this == BACKUP_FAILURE || this == RESTORE_FAILURE;
        }
    }

    public interface NotificationDispatcher {
        void dispatch(EventKind kind, Map<String, Object> context, UserSettings settings);

        static NotificationDispatcher noOp() {
            return (kind, context, settings) -> { };
        }
    }

    /** Um meio de entrega. */
    public interface Channel {
        String name();

        boolean configured(UserSettings settings);

        void send(EventKind kind, String subject, String body, UserSettings settings) throws IOException;
    }

    // ==================================================================================
    // Dispatcher
    // ==================================================================================

    public static final class ChannelDispatcher implements NotificationDispatcher {
        private static final Logger log = LoggerFactory.getLogger(ChannelDispatcher.class);
        private final List<Channel> channels;
        private final String hostname;

        public ChannelDispatcher(List<Channel> channels, String hostname) {
            this.channels = List.copyOf(channels);
            this.hostname = hostname != null && !hostname.isBlank() ? hostname : "localhost";
        }

        @Override
        public void dispatch(EventKind kind, Map<String, Object> context, UserSettings settings) {
            Objects.requireNonNull(kind, "kind");
            UserSettings s = settings != null ? settings : UserSettings.defaults();
            String subject = subject(kind, context, hostname);
            String body = body(kind, context, hostname);
            for (Channel channel : channels) {
                if (!channel.configured(s)) {
                    continue;
                }
                try {
                    channel.send(kind, subject, body, s);
                    log.info("Notificação {} enviada via {}", kind.wireName(), channel.name());
                } catch (IOException | RuntimeException e) {
                    log.warn("Notificação {} via {} falhou: {}", kind.wireName(), channel.name(), e.getMessage());
                }
            }
        }

        static String subject(EventKind kind, Map<String, Object> context, String hostname) {
            Object target = context.containsKey("account") ? context.get("account") : context.get("accounts");
            String who = render(target);
            return "[" + hostname + "] " + kind.title() + (who.isEmpty() ? "" : ": " + who);
        }

        static String body(EventKind kind, Map<String, Object> context, String hostname) {
            StringBuilder sb = new StringBuilder();
            sb.append(kind.title()).append(" on ").append(hostname).append('\n').append('\n');
            for (Map.Entry<String, Object> e : context.entrySet()) {
                String value = render(e.getValue());
                if (value.isEmpty()) continue;
                sb.append(label(e.getKey())).append(": ").append(value).append('\n');
            }
            return sb.toString();
        }

        private static String render(Object value) {
            if (value == null) {
                return "";
            }
            if (value instanceof Collection) {
                List<String> parts = new ArrayList<>();
                for (Object o : (Collection<?>) value) {
                    parts.add(String.valueOf(o));
                }
                return String.join(", ", parts);
            }
            if (value instanceof Map) {
                List<String> parts = new ArrayList<>();
                ((Map<?, ?>) value).forEach((k, v) -> parts.add(k + " = " + v));
                return String.join("; ", parts);
            }
            return String.valueOf(value);
        }

        private static String label(String key) {
            String spaced = key.replace('_', ' ');
            return spaced.isEmpty() ? spaced : Character.toUpperCase(spaced.charAt(0)) + spaced.substring(1);
        }
    }

    // ==================================================================================
    // Canais
    // ==================================================================================

    /** POST {"text": ...} no slack_webhook do usuário. */
    public static final class SlackWebhookChannel implements Channel {
        private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");
        private final OkHttpClient httpClient;
        private final ObjectMapper mapper = new ObjectMapper();

        public SlackWebhookChannel(Duration timeout) {
            this(new OkHttpClient.Builder()
                    .connectTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS)
                    .readTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS)
                    .callTimeout(timeout.toMillis() * 2, TimeUnit.MILLISECONDS)
                    .build());
        }

        public SlackWebhookChannel(OkHttpClient httpClient) {
            this.httpClient = Objects.requireNonNull(httpClient, "httpClient");
        }

        @Override
        public String name() { return "slack"; }

        @Override
        public boolean configured(UserSettings settings) {
            String url = settings.slackWebhook();
            return url.startsWith("https://") || url.startsWith("http://");
        }

        @Override
        public void send(EventKind kind, String subject, String body, UserSettings settings) throws IOException {
            ObjectNode payload = mapper.createObjectNode();
            String icon = kind.isFailure() ? ":x: " : ":white_check_mark: ";
            payload.put("text", icon + "*" + subject + "*\n" + body);
            Request request = new Request.Builder()
                    .url(settings.slackWebhook())
                    .post(RequestBody.create(mapper.writeValueAsString(payload), JSON))
                    .build();
            try (Response response = httpClient.newCall(request).execute()) {
                if (!response.isSuccessful()) {
                    throw new IOException("Webhook respondeu HTTP " + response.code());
                }
            }
        }
    }

    /** Entrega pelo sendmail local ({bin} -t), mensagem em texto puro via stdin. */
    public static final class SendmailChannel implements Channel {
        private static final long WAIT_SECONDS = 30;
        private final String bin;

        public SendmailChannel(String bin) {
            this.bin = Objects.requireNonNull(bin, "bin");
        }

        @Override
        public String name() { return "email"; }

        @Override
        public boolean configured(UserSettings settings) {
            String to = settings.notifyEmail();
            return !to.isEmpty() && to.contains("@") && to.indexOf('\n') < 0 && to.indexOf('\r') < 0;
        }

        @Override
        public void send(EventKind kind, String subject, String body, UserSettings settings) throws IOException {
            String message = "To: " + settings.notifyEmail() + "\n"
                    + "Subject: " + subject.replace('\n', ' ') + "\n"
                    + "Content-Type: text/plain; charset=UTF-8\n"
                    + "\n"
                    + body;
            ProcessBuilder builder = new ProcessBuilder(bin, "-t")
                    .redirectErrorStream(true)
                    .redirectOutput(ProcessBuilder.Redirect.DISCARD);
            Process process = builder.start();
            try (OutputStream stdin = process.getOutputStream()) {
                stdin.write(message.getBytes(StandardCharsets.UTF_8));
            }
            try {
                if (!process.waitFor(WAIT_SECONDS, TimeUnit.SECONDS)) {
                    process.destroyForcibly();
                    throw new IOException("sendmail não terminou em " + WAIT_SECONDS + "s");
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                process.destroy();
                throw new IOException("Interrompido aguardando sendmail", e);
            }
            if (process.exitValue() != 0) {
                throw new IOException("sendmail saiu com código " + process.exitValue());
            }
        }
    }
}
