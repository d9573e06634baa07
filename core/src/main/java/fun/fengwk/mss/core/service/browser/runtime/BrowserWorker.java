package fun.fengwk.mss.core.service.browser.runtime;

import com.microsoft.playwright.Browser;
import com.microsoft.playwright.BrowserContext;
import com.microsoft.playwright.Page;
import com.microsoft.playwright.Playwright;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Browser worker that owns one launched browser and executes tasks sequentially.
 *
 * <p>Every task runs in a fresh browser context so cookies and storage never leak between requests.
 * Close is idempotent and releases resources in strict order.
 *
 * @author fengwk
 */
public class BrowserWorker {

    private static final Logger log = LoggerFactory.getLogger(BrowserWorker.class);

    private final String workerId;
    private final Playwright playwright;
    private final Browser browser;
    private final Browser.NewContextOptions contextOptions;
    private volatile boolean closed = false;

    public BrowserWorker(
        String workerId,
        Playwright playwright,
        Browser browser,
        Browser.NewContextOptions contextOptions
    ) {
        this.workerId = workerId;
        this.playwright = playwright;
        this.browser = browser;
        this.contextOptions = contextOptions;
    }

    public String getWorkerId() {
        return workerId;
    }

    public boolean isClosed() {
        return closed;
    }

    /**
     * Whether the worker can be handed to another task.
     */
    public boolean isHealthy() {
        if (closed) {
            return false;
        }
        try {
            return browser.isConnected();
        } catch (Exception ex) {
            log.debug("browser connectivity check failed, worker={}, error={}", workerId, ex.getMessage());
            return false;
        }
    }

    public <T> T execute(BrowserTask<T> task) throws Exception {
        if (closed) {
            throw new IllegalStateException("worker is closed");
        }

        try (BrowserContext browserContext = browser.newContext(contextOptions)) {
            Page page = browserContext.newPage();
            BrowserRuntimeContext runtimeContext = BrowserRuntimeContext.builder()
                .workerId(workerId)
                .browserContext(browserContext)
                .page(page)
                .build();
            return task.execute(runtimeContext);
        }
    }

    public void close() {
        // Idempotent close to handle concurrent shutdown/release paths safely.
        if (closed) {
            return;
        }
        closed = true;

        try {
            if (browser != null) {
                browser.close();
            }
        } catch (Exception ex) {
            if (isExpectedCloseException(ex)) {
                log.debug("browser already closed for worker {}, skip close", workerId);
            } else {
                log.warn("failed to close browser for worker {}", workerId, ex);
            }
        }

        try {
            if (playwright != null) {
                playwright.close();
            }
        } catch (Exception ex) {
            if (isExpectedCloseException(ex)) {
                log.debug("playwright already closed for worker {}, skip close", workerId);
            } else {
                log.warn("failed to close playwright for worker {}", workerId, ex);
            }
        }
    }

    private boolean isExpectedCloseException(Exception ex) {
        String message = ex.getMessage() == null ? "" : ex.getMessage().toLowerCase();
        String exceptionName = ex.getClass().getSimpleName();
        return "TargetClosedError".equals(exceptionName)
            || message.contains("target page, context or browser has been closed")
            || message.contains("channel has been closed")
            || message.contains("connection closed");
    }

}
