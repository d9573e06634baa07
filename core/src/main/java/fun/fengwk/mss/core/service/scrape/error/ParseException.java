package fun.fengwk.mss.core.service.scrape.error;

import fun.fengwk.mss.core.service.scrape.model.ScrapeStage;

/**
 * Failure to parse or segment a page document.
 */
public class ParseException extends ScrapeStageException {

    public ParseException(String message) {
        super(ScrapeStage.PARSE, message);
    }

    public ParseException(String message, Throwable cause) {
        super(ScrapeStage.PARSE, message, cause);
    }

}
