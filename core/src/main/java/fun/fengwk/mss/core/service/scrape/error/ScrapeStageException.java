package fun.fengwk.mss.core.service.scrape.error;

import fun.fengwk.mss.core.service.scrape.model.ScrapeStage;

/**
 * Failure of a single pipeline stage. Always caught at the stage and turned into an error record.
 *
 * @author fengwk
 */
public class ScrapeStageException extends RuntimeException {

    private final ScrapeStage stage;

    public ScrapeStageException(ScrapeStage stage, String message) {
        super(message);
        this.stage = stage;
    }

    public ScrapeStageException(ScrapeStage stage, String message, Throwable cause) {
        super(message, cause);
        this.stage = stage;
    }

    public ScrapeStage getStage() {
        return stage;
    }

}
