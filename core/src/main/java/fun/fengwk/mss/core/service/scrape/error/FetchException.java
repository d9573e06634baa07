package fun.fengwk.mss.core.service.scrape.error;

import fun.fengwk.mss.core.service.scrape.model.ScrapeStage;

/**
 * Static fetch failure: network error, timeout or non-2xx status.
 */
public class FetchException extends ScrapeStageException {

    public FetchException(String message) {
        super(ScrapeStage.FETCH, message);
    }

    public FetchException(String message, Throwable cause) {
        super(ScrapeStage.FETCH, message, cause);
    }

}
