package fun.fengwk.mss.core.service.scrape.model;

import fun.fengwk.mss.core.service.scrape.error.ScrapeStageException;
import lombok.Value;

/**
 * Non-fatal failure recorded while scraping.
 *
 * @author fengwk
 */
@Value
public class ErrorRecord {

    ScrapeStage stage;
    String message;

    public static ErrorRecord of(ScrapeStage stage, String message) {
        return new ErrorRecord(stage, message == null ? "" : message);
    }

    public static ErrorRecord from(ScrapeStageException ex) {
        return of(ex.getStage(), ex.getMessage());
    }

}
