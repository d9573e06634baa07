package fun.fengwk.mss.core.service.browser.runtime;

/**
 * Exception thrown when no browser worker became available in time.
 */
public class BrowserWorkerBusyException extends RuntimeException {

    public BrowserWorkerBusyException(String message) {
        super(message);
    }

}
