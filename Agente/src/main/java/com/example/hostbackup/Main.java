package com.example.hostbackup;

import com.example.hostbackup.backup.Backup.BackupCoordinator;
import com.example.hostbackup.cancel.Cancellation.CancellationRegistry;
import com.example.hostbackup.cancel.Cancellation.FileCancellationRegistry;
import com.example.hostbackup.config.AppConfig;
import com.example.hostbackup.config.UserSettings;
import com.example.hostbackup.joblog.JobLog;
import com.example.hostbackup.manifest.Manifest.JsonLinesManifestTracker;
import com.example.hostbackup.manifest.Manifest.ManifestTracker;
import com.example.hostbackup.manifest.RetentionPruner;
import com.example.hostbackup.notify.Notifications.ChannelDispatcher;
import com.example.hostbackup.notify.Notifications.NotificationDispatcher;
import com.example.hostbackup.notify.Notifications.SendmailChannel;
import com.example.hostbackup.notify.Notifications.SlackWebhookChannel;
import com.example.hostbackup.oplog.OperationLog.JsonLinesOperationLogger;
import com.example.hostbackup.oplog.OperationLog.OperationLogger;
import com.example.hostbackup.process.ProcessRunner;
import com.example.hostbackup.restore.Restore.RestoreService;
import com.example.hostbackup.storage.Destinations.DestinationRegistry;
import com.example.hostbackup.storage.Destinations.JsonDestinationRegistry;
import com.example.hostbackup.storage.Storage.BridgeTransport;
import com.example.hostbackup.storage.Storage.LocalTransport;
import com.example.hostbackup.storage.Storage.S3Transport;
import com.example.hostbackup.storage.Storage.TransportRegistry;
import com.example.hostbackup.tasks.QueueTaskPoller;
import com.example.hostbackup.tools.ArchiveInspector;
import com.example.hostbackup.tools.HotDatabase.HotDatabaseTool;
import com.example.hostbackup.tools.HotDatabase.ScriptedHotDatabaseTool;
import com.example.hostbackup.tools.ToolAdapters.PkgacctArchiveTool;
import com.example.hostbackup.tools.ToolAdapters.RestorepkgTool;
import java.io.IOException;
import java.io.PrintStream;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.time.Clock;
import java.util.Arrays;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.logging.Logger;

/**
 * Entrada headless do agente. Monta os componentes a partir do AppConfig e inicia o poller da fila.
 *
 * Argumentos:
 * <ul>
 *   <li>{@code --once} drena a fila uma vez e sai;</li>
 *   <li>{@code --cancel JOB_ID} registra um pedido de cancelamento e sai;</li>
 *   <li>{@code --tail JOB_ID} imprime o log do job e sai;</li>
 *   <li>{@code --preview FILE} imprime o resumo do conteúdo de um arquivo de backup e sai.</li>
 * </ul>
 */
public final class Main {

    private static final Logger LOGGER = Logger.getLogger(Main.class.getName());

    public static void main(String[] args) throws Exception {
        new Main().run(args);
    }

    public void run(String[] args) throws Exception {
        AppConfig config = AppConfig.load();
        LOGGER.info("Configuração carregada: " + config);
        Clock clock = Clock.systemDefaultZone();

        List<String> argList = Arrays.asList(args);
        CancellationRegistry cancellation = new FileCancellationRegistry(config.cancelDir(), clock);
        int cancelIdx = argList.indexOf("--cancel");
        if (cancelIdx >= 0) {
            if (cancelIdx + 1 >= argList.size()) {
                throw new IllegalArgumentException("--cancel exige o id do job");
            }
            cancellation.requestCancel(argList.get(cancelIdx + 1), System.getProperty("user.name", "root"));
            return;
        }
        if (inspect(argList, config, System.out)) {
            return;
        }

        ProcessRunner runner = new ProcessRunner(config.processPollInterval());
        DestinationRegistry destinations = new JsonDestinationRegistry(config.destinationsFile());
        LocalTransport localTransport = new LocalTransport();
        BridgeTransport bridgeTransport = new BridgeTransport(config.transportBridgeBin(), runner);
        S3Transport s3Transport = new S3Transport();
        TransportRegistry transports = TransportRegistry.standard(localTransport, bridgeTransport, s3Transport);

        HotDatabaseTool hotDatabase = new ScriptedHotDatabaseTool(config.hotDbBackupBin(), config.hotDbRestoreBin(), runner);
        OperationLogger operations = new JsonLinesOperationLogger(config.logDir(), clock);
        ManifestTracker manifest = new JsonLinesManifestTracker(config.manifestDir());
        UserSettings.Store settingsStore = new UserSettings.JsonStore(config.userConfigDir());
        NotificationDispatcher notifications = new ChannelDispatcher(List.of(
                new SlackWebhookChannel(config.notifyHttpTimeout()),
                new SendmailChannel(config.sendmailBin())), hostname());

        BackupCoordinator backupCoordinator = BackupCoordinator.builder()
                .destinations(destinations)
                .transports(transports)
                .archiveTool(new PkgacctArchiveTool(config.pkgacctBin(), runner))
                .hotDatabase(hotDatabase)
                .manifest(manifest)
                .operations(operations)
                .cancellation(cancellation)
                .notifications(notifications)
                .settingsStore(settingsStore)
                .logDir(config.logDir())
                .tempDir(config.tempDir())
                .clock(clock)
                .build();
        RestoreService restoreService = new RestoreService(destinations, transports,
                new RestorepkgTool(config.restorepkgBin(), runner), hotDatabase, operations, notifications,
                settingsStore, config.logDir(), config.tempDir(), clock);
        RetentionPruner pruner = new RetentionPruner(manifest, destinations, transports, operations);

        QueueTaskPoller poller = new QueueTaskPoller(config.queueDir(), backupCoordinator, restoreService, pruner,
                config.queuePollInterval(), clock);

        if (argList.contains("--once")) {
            int processed = poller.processOnce();
            LOGGER.info("Fila processada uma vez: " + processed + " job(s).");
            poller.close();
            shutdown(s3Transport);
            return;
        }

        poller.start();

        CountDownLatch latch = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            poller.close();
            shutdown(s3Transport);
            latch.countDown();
        }));

        LOGGER.info("Agente headless iniciado. Fila em " + config.queueDir());
        latch.await();
    }

    /**
     * Trata {@code --tail} e {@code --preview}. Devolve false quando nenhum dos dois foi pedido.
     */
    static boolean inspect(List<String> args, AppConfig config, PrintStream out) throws IOException {
        int tailIdx = args.indexOf("--tail");
        if (tailIdx >= 0) {
            String jobId = argumentAfter(args, tailIdx, "--tail exige o id do job");
            JobLog.Chunk chunk = JobLog.readFrom(config.logDir(), jobId, 0);
            if (!chunk.exists()) {
                out.println("No log found for job " + jobId);
            } else {
                out.print(chunk.content());
            }
            return true;
        }
        int previewIdx = args.indexOf("--preview");
        if (previewIdx >= 0) {
            Path archive = Path.of(argumentAfter(args, previewIdx, "--preview exige o caminho do arquivo"));
            ArchiveInspector.Preview preview = ArchiveInspector.preview(archive);
            out.println("Archive: " + archive.getFileName());
            out.println("Account: " + (preview.account() != null ? preview.account() : "unknown"));
            out.println("Size: " + preview.sizeFormatted());
            out.println("Files: " + preview.totalFiles());
            out.println("Home directory: " + yesNo(preview.hasHomedir()));
            out.println("MySQL databases: " + yesNo(preview.hasMysql()));
            out.println("PostgreSQL databases: " + yesNo(preview.hasPgsql()));
            out.println("Email: " + yesNo(preview.hasEmail()));
            out.println("SSL: " + yesNo(preview.hasSsl()));
            out.println("DNS zones: " + yesNo(preview.hasDnsZones()));
            for (String file : preview.sampleFiles()) {
                out.println("  " + file);
            }
            return true;
        }
        return false;
    }

    private static String argumentAfter(List<String> args, int idx, String error) {
        if (idx + 1 >= args.size()) {
            throw new IllegalArgumentException(error);
        }
        return args.get(idx + 1);
    }

    private static String yesNo(boolean value) {
        return value ? "yes" : "no";
    }

    private void shutdown(AutoCloseable... closeables) {
        for (AutoCloseable closeable : closeables) {
            if (closeable == null) continue;
            try {
                closeable.close();
            } catch (Exception e) {
                LOGGER.warning("Falha ao fechar recurso: " + e.getMessage());
            }
        }
    }

    private static String hostname() {
        try {
            return InetAddress.getLocalHost().getHostName();
        } catch (UnknownHostException e) {
            return "localhost";
        }
    }
}
