package fun.fengwk.mss.core.service.browser.runtime;

import com.microsoft.playwright.Browser;
import com.microsoft.playwright.BrowserType;
import com.microsoft.playwright.Playwright;
import com.microsoft.playwright.PlaywrightException;
import fun.fengwk.mss.core.service.browser.BrowserProperties;
import fun.fengwk.mss.core.service.scrape.error.ScrapeStageException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.StringUtils;

import java.nio.file.Paths;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Bounded pool of browser workers, each checked out by exactly one task at a time.
 *
 * <p>Lifecycle model:
 * <ul>
 *     <li>Create worker lazily (except preheated min workers).</li>
 *     <li>Borrow worker from queue -> execute task -> return worker to queue.</li>
 *     <li>A worker whose task failed unexpectedly, or whose browser disconnected, is closed instead of returned.</li>
 *     <li>Track all workers in {@code allWorkers} so shutdown can close both idle and in-flight workers.</li>
 * </ul>
 *
 * @author fengwk
 */
public class BrowserWorkerPool {

    private static final Logger log = LoggerFactory.getLogger(BrowserWorkerPool.class);

    protected final String poolName;
    protected final WorkerPoolConfig config;
    protected final BrowserProperties browserProperties;

    /**
     * Idle worker queue.
     */
    private final BlockingQueue<BrowserWorker> availableWorkers;

    /**
     * Global worker registry for deterministic shutdown.
     */
    private final Set<BrowserWorker> allWorkers = ConcurrentHashMap.newKeySet();

    /**
     * Number of created workers (idle + busy).
     */
    private final AtomicInteger activeWorkerCount = new AtomicInteger(0);

    private final AtomicInteger workerIdGen = new AtomicInteger(1);

    /**
     * Pool shutdown flag.
     */
    private final AtomicBoolean shutdown = new AtomicBoolean(false);

    public BrowserWorkerPool(String poolName, WorkerPoolConfig config, BrowserProperties browserProperties) {
        this.poolName = poolName;
        this.config = normalizeConfig(config);
        this.browserProperties = browserProperties;
        this.availableWorkers = new LinkedBlockingQueue<>(this.config.getMaxWorkers());
    }

    /**
     * Initialize minimum workers. Must be called after construction.
     */
    public void initializeMinWorkers() {
        for (int i = 0; i < config.getMinWorkers(); i++) {
            BrowserWorker worker = tryCreateWorker();
            if (worker == null || !availableWorkers.offer(worker)) {
                if (worker != null) {
                    closeWorkerAndReleaseSlot(worker);
                }
                throw new IllegalStateException("failed to initialize " + poolName + " worker pool");
            }
        }
    }

    public <T> T execute(BrowserTask<T> task) {
        if (shutdown.get()) {
            throw new IllegalStateException(poolName + " worker pool is shutdown");
        }

        String taskName = task == null ? "null" : task.getClass().getSimpleName();
        BrowserWorker worker = null;
        boolean discard = false;
        try {
            worker = acquireWorker();
            return worker.execute(task);
        } catch (RuntimeException ex) {
            if (isExpectedRuntimeException(ex)) {
                log.info(
                    "browser task expected failure, pool={}, task={}, worker={}, error={}",
                    poolName,
                    taskName,
                    worker == null ? "" : worker.getWorkerId(),
                    ex.getMessage()
                );
            } else {
                log.warn(
                    "browser task runtime failure, pool={}, task={}, worker={}, error={}",
                    poolName,
                    taskName,
                    worker == null ? "" : worker.getWorkerId(),
                    ex.getMessage(),
                    ex
                );
                discard = true;
            }
            throw ex;
        } catch (Exception ex) {
            log.warn(
                "browser task checked failure, pool={}, task={}, worker={}, error={}",
                poolName,
                taskName,
                worker == null ? "" : worker.getWorkerId(),
                ex.getMessage(),
                ex
            );
            discard = true;
            throw new IllegalStateException("browser worker execution failed: " + ex.getMessage(), ex);
        } finally {
            if (worker != null) {
                releaseWorker(worker, discard);
            }
        }
    }

    public void shutdown() {
        if (shutdown.compareAndSet(false, true)) {
            log.info("shutting down {} worker pool", poolName);

            // First close all idle workers already in queue.
            BrowserWorker worker;
            while ((worker = availableWorkers.poll()) != null) {
                closeWorkerAndReleaseSlot(worker);
            }

            // Then close remaining workers that may still be in-flight.
            List<BrowserWorker> remainingWorkers = List.copyOf(allWorkers);
            for (BrowserWorker remainingWorker : remainingWorkers) {
                closeWorkerAndReleaseSlot(remainingWorker);
            }

            log.info("{} worker pool shutdown completed", poolName);
        }
    }

    public int getActiveWorkerCount() {
        return activeWorkerCount.get();
    }

    public int getIdleWorkerCount() {
        return availableWorkers.size();
    }

    /**
     * Launch the browser of a new worker.
     */
    protected BrowserWorker createWorker(String workerId) {
        Playwright playwright = null;
        try {
            playwright = Playwright.create();
            Browser browser = playwright.chromium().launch(buildLaunchOptions());
            return new BrowserWorker(workerId, playwright, browser, buildContextOptions());
        } catch (RuntimeException ex) {
            // Creation failure must release all partially initialized resources.
            closeQuietly(playwright);
            throw ex;
        }
    }

    private BrowserWorker acquireWorker() {
        // Fast path: reuse an idle worker.
        BrowserWorker worker = availableWorkers.poll();
        if (worker != null) {
            return worker;
        }

        // Try to scale out if capacity allows.
        worker = tryCreateWorker();
        if (worker != null) {
            return worker;
        }

        // Capacity reached: wait for a returned worker.
        try {
            worker = availableWorkers.poll(config.getQueueTimeoutMs(), TimeUnit.MILLISECONDS);
            if (worker == null) {
                log.info(
                    "worker acquire timeout, pool={}, timeoutMs={}, activeWorkers={}, idleWorkers={}",
                    poolName,
                    config.getQueueTimeoutMs(),
                    activeWorkerCount.get(),
                    availableWorkers.size()
                );
                throw new BrowserWorkerBusyException(poolName + " browser worker pool is busy");
            }
            return worker;
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            log.warn("worker acquire interrupted, pool={}", poolName, ex);
            throw new IllegalStateException("interrupted while waiting for worker", ex);
        }
    }

    private void releaseWorker(BrowserWorker worker, boolean discard) {
        // During shutdown, worker should be closed instead of returning to queue.
        if (shutdown.get()) {
            closeWorkerAndReleaseSlot(worker);
            return;
        }

        if (discard || !worker.isHealthy()) {
            log.info("discard browser worker, pool={}, worker={}", poolName, worker.getWorkerId());
            closeWorkerAndReleaseSlot(worker);
            return;
        }

        if (!availableWorkers.offer(worker)) {
            closeWorkerAndReleaseSlot(worker);
        }
    }

    private BrowserWorker tryCreateWorker() {
        // Reserve slot first to guarantee maxWorkers boundary under concurrency.
        if (!reserveWorkerSlot()) {
            return null;
        }
        String workerId = poolName + "-" + workerIdGen.getAndIncrement();
        try {
            BrowserWorker worker = createWorker(workerId);
            allWorkers.add(worker);
            log.debug("created {} worker: {}", poolName, workerId);
            return worker;
        } catch (RuntimeException ex) {
            log.warn("create worker failed, pool={}, worker={}, error={}", poolName, workerId, ex.getMessage(), ex);
            releaseWorkerSlot();
            throw ex;
        }
    }

    private WorkerPoolConfig normalizeConfig(WorkerPoolConfig rawConfig) {
        int normalizedMinWorkers = Math.max(0, rawConfig.getMinWorkers());
        int normalizedMaxWorkers = Math.max(1, rawConfig.getMaxWorkers());
        if (normalizedMaxWorkers < normalizedMinWorkers) {
            normalizedMaxWorkers = normalizedMinWorkers;
        }
        long normalizedQueueTimeoutMs = Math.max(1L, rawConfig.getQueueTimeoutMs());

        return WorkerPoolConfig.builder()
            .minWorkers(normalizedMinWorkers)
            .maxWorkers(normalizedMaxWorkers)
            .queueTimeoutMs(normalizedQueueTimeoutMs)
            .build();
    }

    private boolean reserveWorkerSlot() {
        // Lock-free CAS loop to enforce global max worker count.
        while (true) {
            int currentCount = activeWorkerCount.get();
            if (currentCount >= config.getMaxWorkers()) {
                return false;
            }
            if (activeWorkerCount.compareAndSet(currentCount, currentCount + 1)) {
                return true;
            }
        }
    }

    private void releaseWorkerSlot() {
        activeWorkerCount.decrementAndGet();
    }

    private boolean isExpectedRuntimeException(RuntimeException ex) {
        return ex instanceof BrowserWorkerBusyException
            || ex instanceof ScrapeStageException;
    }

    private BrowserType.LaunchOptions buildLaunchOptions() {
        BrowserType.LaunchOptions options = new BrowserType.LaunchOptions()
            .setHeadless(browserProperties.isHeadless());

        if (browserProperties.getIgnoreDefaultArgs() != null && !browserProperties.getIgnoreDefaultArgs().isEmpty()) {
            options.setIgnoreDefaultArgs(browserProperties.getIgnoreDefaultArgs());
        }
        if (browserProperties.getLaunchArgs() != null && !browserProperties.getLaunchArgs().isEmpty()) {
            options.setArgs(browserProperties.getLaunchArgs());
        }
        if (StringUtils.hasText(browserProperties.getBrowserChannel())) {
            options.setChannel(browserProperties.getBrowserChannel());
        }
        if (StringUtils.hasText(browserProperties.getExecutablePath())) {
            options.setExecutablePath(Paths.get(browserProperties.getExecutablePath()));
        }
        return options;
    }

    private Browser.NewContextOptions buildContextOptions() {
        Browser.NewContextOptions options = new Browser.NewContextOptions()
            .setViewportSize(browserProperties.getViewportWidth(), browserProperties.getViewportHeight());

        if (StringUtils.hasText(browserProperties.getUserAgent())) {
            options.setUserAgent(browserProperties.getUserAgent());
        }
        if (StringUtils.hasText(browserProperties.getLocale())) {
            options.setLocale(browserProperties.getLocale());
        }

        Map<String, String> headers = new HashMap<>();
        if (browserProperties.getExtraHeaders() != null) {
            browserProperties.getExtraHeaders().forEach((key, value) -> {
                if (StringUtils.hasText(key) && StringUtils.hasText(value)) {
                    headers.put(key, value);
                }
            });
        }
        if (!headers.isEmpty()) {
            options.setExtraHTTPHeaders(headers);
        }
        return options;
    }

    private void closeWorkerAndReleaseSlot(BrowserWorker worker) {
        // Idempotent close guard: only first caller removes and closes the worker.
        if (!allWorkers.remove(worker)) {
            return;
        }
        try {
            worker.close();
        } finally {
            releaseWorkerSlot();
        }
    }

    private void closeQuietly(AutoCloseable closeable) {
        if (closeable == null) {
            return;
        }
        try {
            closeable.close();
        } catch (Exception ex) {
            log.debug("close resource failed, pool={}", poolName, ex);
        }
    }

}
