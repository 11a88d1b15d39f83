package ca.purps.offlinestorage.worker;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;

import com.fasterxml.jackson.databind.JsonNode;

import ca.purps.offlinestorage.cleanup.CleanupResult;
import ca.purps.offlinestorage.cleanup.StorageSettings;
import ca.purps.offlinestorage.config.IpcTimeouts;
import ca.purps.offlinestorage.config.SupervisorOptions;
import ca.purps.offlinestorage.event.EventEmitter;
import ca.purps.offlinestorage.event.OfflineStorageEventListener;
import ca.purps.offlinestorage.exception.ProtocolException;
import ca.purps.offlinestorage.exception.RestartBudgetExhaustedException;
import ca.purps.offlinestorage.exception.WorkerCommandException;
import ca.purps.offlinestorage.exception.WorkerCrashedException;
import ca.purps.offlinestorage.exception.WorkerDestroyedException;
import ca.purps.offlinestorage.exception.WorkerException;
import ca.purps.offlinestorage.exception.WorkerInitializationException;
import ca.purps.offlinestorage.exception.WorkerTimeoutException;
import ca.purps.offlinestorage.metrics.PerformanceMetrics;
import ca.purps.offlinestorage.model.ChapterCountValidation;
import ca.purps.offlinestorage.model.DownloadHistoryItem;
import ca.purps.offlinestorage.model.DownloadProgress;
import ca.purps.offlinestorage.model.OfflineChapterMetadata;
import ca.purps.offlinestorage.model.OfflineChapterPages;
import ca.purps.offlinestorage.model.OfflineMangaMetadata;
import ca.purps.offlinestorage.model.QueuedDownload;
import ca.purps.offlinestorage.model.StorageStats;
import ca.purps.offlinestorage.protocol.CommandType;
import ca.purps.offlinestorage.protocol.InitMessage;
import ca.purps.offlinestorage.protocol.MessageCodec;
import ca.purps.offlinestorage.protocol.WorkerInitConfig;
import ca.purps.offlinestorage.protocol.WorkerMessage;
import ca.purps.offlinestorage.protocol.payload.BackgroundSyncPayload;
import ca.purps.offlinestorage.protocol.payload.ChapterRef;
import ca.purps.offlinestorage.protocol.payload.HistoryIdPayload;
import ca.purps.offlinestorage.protocol.payload.HistoryQuery;
import ca.purps.offlinestorage.protocol.payload.MangaRef;
import ca.purps.offlinestorage.protocol.payload.PagePathPayload;
import ca.purps.offlinestorage.protocol.payload.PingResult;
import ca.purps.offlinestorage.protocol.payload.QueueChapterPayload;
import ca.purps.offlinestorage.protocol.payload.QueueIdPayload;
import ca.purps.offlinestorage.protocol.payload.QueueMangaPayload;
import lombok.Builder;
import lombok.Getter;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import lombok.Setter;
import lombok.extern.slf4j.Slf4j;

/**
 * Supervisor of the one background worker. Every operation becomes a {@link CommandType} request
 * correlated by request id; each returned future settles exactly once, by the worker's answer, by
 * the local timeout, or by the worker going away.
 */
@Slf4j
public class DownloadWorkerHost implements AutoCloseable {

    private final WorkerInitConfig initConfig;
    private final SupervisorOptions options;
    private final IpcTimeouts timeouts;
    private final WorkerLauncher launcher;
    private final ScheduledExecutorService scheduler;
    private final boolean ownsScheduler;
    private final RestartTracker restarts;

    private final EventEmitter events = new EventEmitter();
    private final Map<Long, PendingRequest> pending = new ConcurrentHashMap<>();
    private final AtomicLong nextRequestId = new AtomicLong(1);

    @Getter
    private volatile HostState state = HostState.UNINITIALIZED;
    private volatile WorkerChannel channel;
    private ChannelListener channelListener;
    private volatile int generation;
    private CompletableFuture<Void> initialization;
    private CompletableFuture<Void> ready;
    /** Queue processing was asked for; restored after a crash restart. */
    private volatile boolean startRequested;
    private volatile boolean restartBudgetExhausted;

    @Builder
    private DownloadWorkerHost(
            @NonNull WorkerInitConfig initConfig,
            SupervisorOptions options,
            WorkerLauncher launcher,
            ScheduledExecutorService scheduler,
            Clock clock) {
        this.initConfig = initConfig;
        this.options = options != null ? options : SupervisorOptions.defaults();
        this.timeouts = this.options.getTimeouts();
        this.launcher = launcher != null ? launcher : new ProcessWorkerLauncher(this.options);
        this.ownsScheduler = scheduler == null;
        this.scheduler = scheduler != null ? scheduler : Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "worker-host-timers");
            thread.setDaemon(true);
            return thread;
        });
        this.restarts = new RestartTracker(this.options.getMaxRestarts(), this.options.getRestartWindowMs(),
                clock != null ? clock : Clock.systemUTC());
    }

    @RequiredArgsConstructor
    private static class PendingRequest {
        private final CommandType command;
        private final CompletableFuture<JsonNode> future = new CompletableFuture<>();
        @Setter
        private volatile ScheduledFuture<?> timer;

        void cancelTimer() {
            ScheduledFuture<?> scheduled = timer;
            if (scheduled != null) {
                scheduled.cancel(false);
            }
        }
    }

    /**
     * Callbacks of one spawned worker. Callbacks of a worker that has since been replaced are
     * ignored.
     */
    @RequiredArgsConstructor
    private class ChannelListener implements WorkerChannel.Listener {
        private final int generation;
        private volatile boolean expectedExit;

        @Override
        public void onLine(String line) {
            handleLine(this, line);
        }

        @Override
        public void onExit(Integer exitCode) {
            handleExit(this, exitCode);
        }
    }

    // Lifecycle

    public Runnable on(OfflineStorageEventListener listener) {
        return events.on(listener);
    }

    /**
     * Spawns and initializes the worker when needed, then starts processing the queue. Concurrent
     * callers share one initialization.
     */
    public CompletableFuture<Void> start() {
        if (state == HostState.STARTED) {
            DownloadWorkerHost.log.warn("Worker already started");
            return CompletableFuture.completedFuture(null);
        }
        startRequested = true;
        return ensureInitialized()
                .thenCompose(v -> this.<Void>send(CommandType.START, null, timeouts.getStartTimeoutMs()))
                .thenRun(() -> {
                    transition(HostState.STARTED);
                    DownloadWorkerHost.log.info("Worker started");
                });
    }

    /**
     * Best-effort stop command followed by terminating the worker process. Never fails.
     */
    public CompletableFuture<Void> stop() {
        startRequested = false;
        WorkerChannel current;
        ChannelListener listener;
        HostState previous;
        synchronized (this) {
            current = channel;
            listener = channelListener;
            previous = state;
        }
        if (current == null) {
            transition(HostState.STOPPED);
            return CompletableFuture.completedFuture(null);
        }

        CompletableFuture<Void> stopCommand = previous == HostState.STARTED
                ? this.<Void>send(CommandType.STOP, null, timeouts.getStopTimeoutMs())
                : CompletableFuture.completedFuture(null);

        return stopCommand
                .exceptionally(e -> {
                    DownloadWorkerHost.log.error("Error stopping worker", e);
                    return null;
                })
                .thenRunAsync(() -> killWorker(current, listener))
                .thenRun(() -> {
                    transition(HostState.STOPPED);
                    DownloadWorkerHost.log.info("Worker stopped");
                });
    }

    /**
     * Rejects every pending request, stops the worker and drops all listeners. Calling it again
     * does nothing.
     */
    public CompletableFuture<Void> destroy() {
        WorkerChannel current;
        ChannelListener listener;
        HostState previous;
        CompletableFuture<Void> readyFuture;
        synchronized (this) {
            if (state == HostState.DESTROYED) {
                return CompletableFuture.completedFuture(null);
            }
            DownloadWorkerHost.log.info("Destroying worker host");
            previous = state;
            state = HostState.DESTROYED;
            current = channel;
            listener = channelListener;
            readyFuture = ready;
            channel = null;
            initialization = null;
        }
        startRequested = false;

        rejectAll(() -> new WorkerDestroyedException("Worker host destroyed"));
        if (readyFuture != null) {
            readyFuture.completeExceptionally(new WorkerDestroyedException("Worker host destroyed"));
        }

        CompletableFuture<Void> shutdown;
        if (current == null) {
            shutdown = CompletableFuture.completedFuture(null);
        } else {
            CompletableFuture<Void> stopCommand = previous == HostState.STARTED
                    ? this.<Void>send(current, CommandType.STOP, null, timeouts.getStopTimeoutMs())
                    : CompletableFuture.completedFuture(null);
            shutdown = stopCommand
                    .exceptionally(e -> {
                        DownloadWorkerHost.log.error("Error stopping worker", e);
                        return null;
                    })
                    .thenRunAsync(() -> killWorker(current, listener));
        }

        return shutdown.whenComplete((v, e) -> {
            events.clear();
            if (ownsScheduler) {
                scheduler.shutdownNow();
            }
        });
    }

    @Override
    public void close() {
        destroy().join();
    }

    public int getPendingRequestCount() {
        return pending.size();
    }

    public boolean isRestartBudgetExhausted() {
        return restartBudgetExhausted;
    }

    // Requests

    /**
     * Sends one command with the timeout of its class.
     */
    public <T> CompletableFuture<T> request(CommandType command, Object payload) {
        return request(command, payload, timeoutFor(command));
    }

    /**
     * Sends one command, spawning the worker first when it is not running.
     *
     * @param payload the payload object of the command, or null for commands without one
     */
    public <T> CompletableFuture<T> request(CommandType command, Object payload, long timeoutMs) {
        return ensureInitialized().thenCompose(v -> this.<T>send(command, payload, timeoutMs));
    }

    long timeoutFor(CommandType command) {
        return switch (command) {
            case START -> timeouts.getStartTimeoutMs();
            case STOP -> timeouts.getStopTimeoutMs();
            default -> timeouts.getQueryTimeoutMs();
        };
    }

    public CompletableFuture<Boolean> isActive() {
        if (!isRunning()) {
            return CompletableFuture.completedFuture(false);
        }
        return this.<Boolean>request(CommandType.IS_ACTIVE, null)
                .exceptionally(e -> {
                    DownloadWorkerHost.log.warn("is-active failed: {}", e.getMessage());
                    return false;
                });
    }

    public CompletableFuture<List<Long>> getActiveDownloads() {
        if (!isRunning()) {
            return CompletableFuture.completedFuture(List.of());
        }
        return this.<List<Long>>request(CommandType.GET_ACTIVE_DOWNLOADS, null)
                .exceptionally(e -> {
                    DownloadWorkerHost.log.warn("get-active-downloads failed: {}", e.getMessage());
                    return List.of();
                });
    }

    public CompletableFuture<Long> queueChapter(String extensionId, String mangaId, String chapterId) {
        return queueChapter(extensionId, mangaId, chapterId, 0);
    }

    public CompletableFuture<Long> queueChapter(String extensionId, String mangaId, String chapterId, int priority) {
        return request(CommandType.QUEUE_CHAPTER, QueueChapterPayload.builder()
                .extensionId(extensionId)
                .mangaId(mangaId)
                .chapterId(chapterId)
                .priority(priority)
                .build());
    }

    /**
     * @param chapterIds only these chapters, or every chapter of the manga when null
     */
    public CompletableFuture<List<Long>> queueManga(String extensionId, String mangaId, List<String> chapterIds, int priority) {
        return request(CommandType.QUEUE_MANGA, QueueMangaPayload.builder()
                .extensionId(extensionId)
                .mangaId(mangaId)
                .chapterIds(chapterIds)
                .priority(priority)
                .build());
    }

    public CompletableFuture<Void> cancelDownload(long queueId) {
        return request(CommandType.CANCEL_DOWNLOAD, new QueueIdPayload(queueId));
    }

    public CompletableFuture<Void> retryDownload(long queueId) {
        return request(CommandType.RETRY_DOWNLOAD, new QueueIdPayload(queueId));
    }

    public CompletableFuture<List<Long>> retryFrozenDownloads() {
        return request(CommandType.RETRY_FROZEN_DOWNLOADS, null);
    }

    public CompletableFuture<List<QueuedDownload>> getQueuedDownloads() {
        return request(CommandType.GET_QUEUED_DOWNLOADS, null);
    }

    public CompletableFuture<Optional<DownloadProgress>> getDownloadProgress(long queueId) {
        return this.<DownloadProgress>request(CommandType.GET_DOWNLOAD_PROGRESS, new QueueIdPayload(queueId))
                .thenApply(Optional::ofNullable);
    }

    public CompletableFuture<StorageStats> getStorageStats() {
        return request(CommandType.GET_STORAGE_STATS, null);
    }

    public CompletableFuture<List<OfflineMangaMetadata>> getDownloadedManga() {
        return request(CommandType.GET_DOWNLOADED_MANGA, null);
    }

    public CompletableFuture<Optional<OfflineMangaMetadata>> getMangaMetadata(String extensionId, String mangaId) {
        return this.<OfflineMangaMetadata>request(CommandType.GET_MANGA_METADATA, new MangaRef(extensionId, mangaId))
                .thenApply(Optional::ofNullable);
    }

    public CompletableFuture<List<OfflineChapterMetadata>> getDownloadedChapters(String extensionId, String mangaId) {
        return request(CommandType.GET_DOWNLOADED_CHAPTERS, new MangaRef(extensionId, mangaId));
    }

    public CompletableFuture<Optional<OfflineChapterPages>> getChapterPages(String extensionId, String mangaId, String chapterId) {
        return this.<OfflineChapterPages>request(CommandType.GET_CHAPTER_PAGES, new ChapterRef(extensionId, mangaId, chapterId))
                .thenApply(Optional::ofNullable);
    }

    public CompletableFuture<Boolean> isChapterDownloaded(String extensionId, String mangaId, String chapterId) {
        return request(CommandType.IS_CHAPTER_DOWNLOADED, new ChapterRef(extensionId, mangaId, chapterId));
    }

    public CompletableFuture<Void> deleteChapter(String extensionId, String mangaId, String chapterId) {
        return request(CommandType.DELETE_CHAPTER, new ChapterRef(extensionId, mangaId, chapterId));
    }

    public CompletableFuture<Void> deleteManga(String extensionId, String mangaId) {
        return request(CommandType.DELETE_MANGA, new MangaRef(extensionId, mangaId));
    }

    public CompletableFuture<Void> nukeOfflineData() {
        return request(CommandType.NUKE_OFFLINE_DATA, null);
    }

    /**
     * @param limit newest {@code limit} items, or all of them when null
     */
    public CompletableFuture<List<DownloadHistoryItem>> getDownloadHistory(Integer limit) {
        return request(CommandType.GET_DOWNLOAD_HISTORY, new HistoryQuery(limit));
    }

    public CompletableFuture<Void> deleteHistoryItem(long historyId) {
        return request(CommandType.DELETE_HISTORY_ITEM, new HistoryIdPayload(historyId));
    }

    public CompletableFuture<Void> clearDownloadHistory() {
        return request(CommandType.CLEAR_DOWNLOAD_HISTORY, null);
    }

    public CompletableFuture<ChapterCountValidation> validateMangaChapterCount(String extensionId, String mangaId) {
        return request(CommandType.VALIDATE_MANGA_CHAPTER_COUNT, new MangaRef(extensionId, mangaId));
    }

    /**
     * Returns once the worker accepted the sync; the sync itself keeps running in the worker.
     */
    public CompletableFuture<Void> startBackgroundSync(long ttlMs, int concurrency, long delayMs) {
        return request(CommandType.START_BACKGROUND_SYNC, BackgroundSyncPayload.builder()
                .ttlMs(ttlMs)
                .concurrency(concurrency)
                .delayMs(delayMs)
                .build());
    }

    public CompletableFuture<Optional<Path>> getPagePath(String extensionId, String mangaId, String chapterId, String filename) {
        return this.<String>request(CommandType.GET_PAGE_PATH, PagePathPayload.builder()
                .extensionId(extensionId)
                .mangaId(mangaId)
                .chapterId(chapterId)
                .filename(filename)
                .build())
                .thenApply(path -> Optional.ofNullable(path).map(Path::of));
    }

    /**
     * Empty when the worker is not running or did not answer.
     */
    public CompletableFuture<Optional<PerformanceMetrics>> getMetrics() {
        if (!isRunning()) {
            return CompletableFuture.completedFuture(Optional.empty());
        }
        return this.<PerformanceMetrics>request(CommandType.GET_METRICS, null)
                .thenApply(Optional::ofNullable)
                .exceptionally(e -> {
                    DownloadWorkerHost.log.warn("get-metrics failed: {}", e.getMessage());
                    return Optional.empty();
                });
    }

    public CompletableFuture<Void> resetMetrics() {
        return request(CommandType.RESET_METRICS, null);
    }

    public CompletableFuture<CleanupResult> performCleanup(StorageSettings settings) {
        return request(CommandType.PERFORM_CLEANUP, settings);
    }

    public CompletableFuture<PingResult> ping() {
        return request(CommandType.PING, null);
    }

    // Internals

    private boolean isRunning() {
        HostState current = state;
        return channel != null
                && (current == HostState.READY || current == HostState.STARTED || current == HostState.STOPPED);
    }

    private synchronized void transition(HostState next) {
        if (state != HostState.DESTROYED) {
            state = next;
        }
    }

    private synchronized CompletableFuture<Void> ensureInitialized() {
        if (state == HostState.DESTROYED) {
            return CompletableFuture.failedFuture(new WorkerDestroyedException("Worker host destroyed"));
        }
        if (restartBudgetExhausted) {
            return CompletableFuture.failedFuture(new RestartBudgetExhaustedException(String.format(
                    "Worker restarted %d times within %d ms; create a new host", restarts.getMaxRestarts(),
                    options.getRestartWindowMs())));
        }
        if (initialization == null || initialization.isCompletedExceptionally()) {
            DownloadWorkerHost.log.debug("ensureInitialized triggered");
            initialization = initialize();
        }
        return initialization;
    }

    // called with the lock held
    private CompletableFuture<Void> initialize() {
        DownloadWorkerHost.log.info("Initialising worker process...");
        state = HostState.INITIALIZING;
        ChannelListener listener = new ChannelListener(++generation);
        CompletableFuture<Void> readyFuture = new CompletableFuture<>();
        ready = readyFuture;

        WorkerChannel spawned = null;
        try {
            spawned = launcher.launch(listener);
            channel = spawned;
            channelListener = listener;
            spawned.send(MessageCodec.encode(new InitMessage(initConfig)));
        } catch (IOException | RuntimeException e) {
            state = HostState.UNINITIALIZED;
            channel = null;
            if (spawned != null) {
                WorkerChannel failed = spawned;
                CompletableFuture.runAsync(() -> killWorker(failed, listener));
            }
            return CompletableFuture.failedFuture(new WorkerInitializationException("Failed to launch worker", e));
        }

        long readyTimeoutMs = timeouts.getReadyTimeoutMs();
        ScheduledFuture<?> timer = scheduler.schedule(
                () -> readyFuture.completeExceptionally(new WorkerInitializationException(
                        String.format("Worker initialization timeout (no ready within %d ms)", readyTimeoutMs))),
                readyTimeoutMs, TimeUnit.MILLISECONDS);

        WorkerChannel initialized = spawned;
        return readyFuture.whenComplete((v, e) -> {
            timer.cancel(false);
            onInitialized(listener, initialized, e);
        });
    }

    private synchronized void onInitialized(ChannelListener listener, WorkerChannel initialized, Throwable error) {
        if (listener.generation != generation || state == HostState.DESTROYED) {
            return;
        }
        if (error == null) {
            state = HostState.READY;
            DownloadWorkerHost.log.info("Worker initialised");
            return;
        }

        DownloadWorkerHost.log.error("Worker initialization failed: {}", error.getMessage());
        state = HostState.UNINITIALIZED;
        channel = null;
        if (initialized.isAlive()) {
            listener.expectedExit = true;
            CompletableFuture.runAsync(() -> killWorker(initialized, listener));
        }
    }

    private void killWorker(WorkerChannel target, ChannelListener listener) {
        if (listener != null) {
            listener.expectedExit = true;
        }
        if (target.isAlive()) {
            target.terminate(options.getKillGraceMs());
        }
        synchronized (this) {
            if (channel == target) {
                channel = null;
                initialization = null;
            }
        }
    }

    private <T> CompletableFuture<T> send(CommandType command, Object payload, long timeoutMs) {
        WorkerChannel current = channel;
        if (current == null) {
            return CompletableFuture.failedFuture(new WorkerException("Worker process not available"));
        }
        return send(current, command, payload, timeoutMs);
    }

    private <T> CompletableFuture<T> send(WorkerChannel target, CommandType command, Object payload, long timeoutMs) {
        long requestId = nextRequestId.getAndIncrement();
        PendingRequest request = new PendingRequest(command);
        pending.put(requestId, request);
        request.setTimer(scheduler.schedule(() -> timeout(requestId, timeoutMs), timeoutMs, TimeUnit.MILLISECONDS));

        try {
            String line = MessageCodec.encode(MessageCodec.command(command, requestId, payload));
            DownloadWorkerHost.log.debug("-> {} (requestId={})", command.getWireName(), requestId);
            target.send(line);
        } catch (IOException | RuntimeException e) {
            fail(requestId, new WorkerException("Failed to send " + command.getWireName(), e));
        }
        return request.future.thenApply(result -> MessageCodec.<T>result(command, result));
    }

    private void timeout(long requestId, long timeoutMs) {
        PendingRequest request = pending.remove(requestId);
        if (request == null) {
            return;
        }
        DownloadWorkerHost.log.error("Command {} timed out (requestId={})", request.command.getWireName(), requestId);
        request.future.completeExceptionally(new WorkerTimeoutException(request.command.getWireName(), timeoutMs));
    }

    private void succeed(long requestId, JsonNode result) {
        PendingRequest request = pending.remove(requestId);
        if (request == null) {
            DownloadWorkerHost.log.debug("Ignoring result for settled request {}", requestId);
            return;
        }
        request.cancelTimer();
        DownloadWorkerHost.log.debug("<- {} (requestId={})", request.command.getWireName(), requestId);
        request.future.complete(result);
    }

    private boolean fail(long requestId, Throwable error) {
        PendingRequest request = pending.remove(requestId);
        if (request == null) {
            return false;
        }
        request.cancelTimer();
        request.future.completeExceptionally(error);
        return true;
    }

    private void rejectAll(Supplier<? extends Throwable> error) {
        for (Long requestId : List.copyOf(pending.keySet())) {
            fail(requestId, error.get());
        }
    }

    private void handleLine(ChannelListener listener, String line) {
        if (listener.generation != generation) {
            return;
        }

        WorkerMessage message;
        try {
            message = MessageCodec.decodeWorkerMessage(line);
        } catch (ProtocolException e) {
            DownloadWorkerHost.log.warn("Received invalid worker message: {}", e.getMessage());
            return;
        }

        if (message instanceof WorkerMessage.Event event) {
            events.emit(event.getEvent());
        } else if (message instanceof WorkerMessage.Result result) {
            succeed(result.getRequestId(), result.getResult());
        } else if (message instanceof WorkerMessage.Error error) {
            PendingRequest request = error.getRequestId() != null ? pending.get(error.getRequestId()) : null;
            String command = request != null ? request.command.getWireName() : null;
            if (error.getRequestId() == null || !fail(error.getRequestId(),
                    new WorkerCommandException(command, error.getError(), error.getStack()))) {
                DownloadWorkerHost.log.error("Worker error: {}{}", error.getError(),
                        error.getStack() != null ? System.lineSeparator() + error.getStack() : "");
            }
        } else if (message instanceof WorkerMessage.FatalError fatal) {
            DownloadWorkerHost.log.error("Worker fatal error: {}{}", fatal.getError(),
                    fatal.getStack() != null ? System.lineSeparator() + fatal.getStack() : "");
            CompletableFuture<Void> readyFuture = ready;
            if (readyFuture != null) {
                readyFuture.completeExceptionally(
                        new WorkerInitializationException("Worker fatal error: " + fatal.getError()));
            }
        } else if (message instanceof WorkerMessage.Ready) {
            CompletableFuture<Void> readyFuture = ready;
            if (readyFuture != null) {
                readyFuture.complete(null);
            }
        } else if (message instanceof WorkerMessage.Started) {
            DownloadWorkerHost.log.info("Worker signalled started");
        } else if (message instanceof WorkerMessage.Stopped) {
            DownloadWorkerHost.log.info("Worker signalled stopped");
        }
    }

    private void handleExit(ChannelListener listener, Integer exitCode) {
        boolean restart;
        synchronized (this) {
            if (listener.generation != generation) {
                return;
            }
            boolean expected = listener.expectedExit;
            HostState previous = state;
            channel = null;
            initialization = null;

            if (previous == HostState.DESTROYED) {
                restart = false;
            } else if (expected) {
                DownloadWorkerHost.log.info("Worker exited with code {}", exitCode);
                if (previous == HostState.READY || previous == HostState.STARTED) {
                    state = HostState.STOPPED;
                }
                restart = false;
            } else {
                DownloadWorkerHost.log.warn("Worker exited unexpectedly with code {}", exitCode);
                state = HostState.UNINITIALIZED;
                // a worker dying before ready fails its initialization instead
                restart = previous != HostState.INITIALIZING && previous != HostState.UNINITIALIZED
                        && options.isAutoRestart() && (exitCode == null || exitCode != 0);
            }

            if (ready != null) {
                ready.completeExceptionally(new WorkerInitializationException("Worker exited before ready",
                        new WorkerCrashedException(exitCode)));
            }
        }

        rejectAll(() -> new WorkerCrashedException(exitCode));

        if (restart) {
            scheduleRestart();
        }
    }

    private void scheduleRestart() {
        if (!restarts.tryAcquire()) {
            restartBudgetExhausted = true;
            DownloadWorkerHost.log.error("Max restart attempts ({}) exceeded within {} ms, auto-restart halted",
                    restarts.getMaxRestarts(), options.getRestartWindowMs());
            return;
        }

        DownloadWorkerHost.log.info("Attempting worker restart ({}/{})...", restarts.attemptsInWindow(),
                restarts.getMaxRestarts());
        scheduler.schedule(this::restart, options.getRestartDelayMs(), TimeUnit.MILLISECONDS);
    }

    private void restart() {
        if (state == HostState.DESTROYED) {
            return;
        }
        CompletableFuture<Void> restarted = startRequested ? start() : ensureInitialized();
        restarted.whenComplete((v, e) -> {
            if (e != null) {
                DownloadWorkerHost.log.error("Failed to restart worker", e);
            } else {
                DownloadWorkerHost.log.info("Worker restarted successfully");
            }
        });
    }

}
