package fun.fengwk.mss.core.service.scrape.error;

import fun.fengwk.mss.core.service.scrape.model.ScrapeStage;

/**
 * Browser rendering failure: navigation timeout or engine failure.
 */
public class RenderException extends ScrapeStageException {

    public RenderException(String message) {
        super(ScrapeStage.RENDER, message);
    }

    public RenderException(String message, Throwable cause) {
        super(ScrapeStage.RENDER, message, cause);
    }

}
