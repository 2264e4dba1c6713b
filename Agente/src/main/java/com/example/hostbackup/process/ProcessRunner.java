package com.example.hostbackup.process;

import com.example.hostbackup.joblog.JobLog;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Executa um subprocesso drenando stdout e stderr em paralelo e entregando cada linha, já marcada
 * com a origem, a um {@link LineSink} assim que ela chega.
 *
 * Modelo:
 * - uma thread leitora por stream alimenta uma fila limitada;
 * - a thread chamadora consome a fila com poll limitado (padrão 50 ms), sem busy-spin;
 * - stdin é fechado logo após o start (nenhuma ferramenta é interativa);
 * - não há timeout: um subprocesso travado trava o job.
 */
public final class ProcessRunner {

    private static final Logger log = LoggerFactory.getLogger(ProcessRunner.class);

    /** Linhas mantidas em memória por stream no {@link Outcome}. */
    private static final int RETAINED_LINES = 2000;
    private static final int QUEUE_CAPACITY = 1024;

    private final Duration pollInterval;

    public ProcessRunner(Duration pollInterval) {
        this.pollInterval = Objects.requireNonNull(pollInterval, "pollInterval");
    }

    public enum Stream { STDOUT, STDERR }

    /** Linha de saída marcada com o stream de origem. */
    public static final class OutputLine {
        private final Stream stream;
        private final String text;

        public OutputLine(Stream stream, String text) {
            this.stream = stream;
            this.text = text;
        }

        public Stream stream() { return stream; }
        public String text() { return text; }
    }

    @FunctionalInterface
    public interface LineSink {
        void accept(OutputLine line);

        static LineSink discard() {
            return line -> { };
        }
    }

    /**
     * stdout literal, stderr com prefixo [STDERR].
     */
    public static LineSink jobLogSink(JobLog jobLog) {
        Objects.requireNonNull(jobLog, "jobLog");
        return line -> {
            if (line.stream() == Stream.STDERR) {
                jobLog.raw("[STDERR] " + line.text());
            } else {
                jobLog.raw(line.text());
            }
        };
    }

    /** Resultado do subprocesso. */
    public static final class Outcome {
        private final int exitCode;
        private final List<String> stdout;
        private final List<String> stderr;

        public Outcome(int exitCode, List<String> stdout, List<String> stderr) {
            this.exitCode = exitCode;
            this.stdout = List.copyOf(stdout);
            this.stderr = List.copyOf(stderr);
        }

        public int exitCode() { return exitCode; }
        public boolean succeeded() { return exitCode == 0; }
        public List<String> stdout() { return stdout; }
        public List<String> stderr() { return stderr; }
        public String stdoutText() { return String.join("\n", stdout); }
        public String stderrText() { return String.join("\n", stderr); }
    }

    /** O subprocesso nem chegou a iniciar. */
    public static final class SpawnException extends IOException {
        public SpawnException(String message, Throwable cause) {
            super(message, cause);
        }
    }

    public Outcome run(List<String> command, LineSink sink) throws IOException {
        return run(command, null, sink);
    }

    public Outcome run(List<String> command, Path workDir, LineSink sink) throws IOException {
        Objects.requireNonNull(command, "command");
        if (command.isEmpty()) {
            throw new IllegalArgumentException("command vazio");
        }
        LineSink target = sink != null ? sink : LineSink.discard();

        ProcessBuilder builder = new ProcessBuilder(command);
        if (workDir != null) {
            builder.directory(workDir.toFile());
        }

        Process process;
        try {
            process = builder.start();
        } catch (IOException e) {
            throw new SpawnException("Falha ao iniciar processo " + command.get(0) + ": " + e.getMessage(), e);
        }
        log.debug("Processo iniciado pid={} cmd={}", process.pid(), command.get(0));

        try {
            process.getOutputStream().close();
        } catch (IOException e) {
            log.debug("stdin já fechado para pid {}: {}", process.pid(), e.getMessage());
        }

        BlockingQueue<Object> queue = new ArrayBlockingQueue<>(QUEUE_CAPACITY);
        Thread out = startReader(process.getInputStream(), Stream.STDOUT, queue, process.pid());
        Thread err = startReader(process.getErrorStream(), Stream.STDERR, queue, process.pid());

        Deque<String> stdout = new ArrayDeque<>();
        Deque<String> stderr = new ArrayDeque<>();
        int openStreams = 2;
        try {
            while (openStreams > 0) {
                Object item = queue.poll(pollInterval.toMillis(), TimeUnit.MILLISECONDS);
                if (item == null) {
                    continue;
                }
                if (item instanceof EndOfStream) {
                    openStreams--;
                    continue;
                }
                OutputLine line = (OutputLine) item;
                retain(line.stream() == Stream.STDOUT ? stdout : stderr, line.text());
                try {
                    target.accept(line);
                } catch (RuntimeException e) {
                    log.warn("Sink rejeitou linha do pid {}: {}", process.pid(), e.getMessage());
                }
            }
            int exit = process.waitFor();
            out.join(pollInterval.toMillis());
            err.join(pollInterval.toMillis());
            return new Outcome(exit, new ArrayList<>(stdout), new ArrayList<>(stderr));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            process.destroy();
            throw new IOException("Interrompido aguardando " + command.get(0), e);
        }
    }

    private static void retain(Deque<String> lines, String text) {
        if (lines.size() >= RETAINED_LINES) {
            lines.removeFirst();
        }
        lines.addLast(text);
    }

    private static Thread startReader(InputStream stream, Stream kind, BlockingQueue<Object> queue, long pid) {
        Thread t = new Thread(() -> {
            try (BufferedReader reader = new BufferedReader(new InputStreamReader(stream, StandardCharsets.UTF_8))) {
                String raw;
                while ((raw = reader.readLine()) != null) {
                    String text = raw.trim();
                    if (!text.isEmpty()) {
                        queue.put(new OutputLine(kind, text));
                    }
                }
            } catch (IOException e) {
                log.debug("Leitura de {} encerrada para pid {}: {}", kind, pid, e.getMessage());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            } finally {
                try {
                    queue.put(EndOfStream.INSTANCE);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }
        }, "proc-" + kind.name().toLowerCase() + "-" + pid);
        t.setDaemon(true);
        t.start();
        return t;
    }

    private enum EndOfStream { INSTANCE }
}
