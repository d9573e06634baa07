package fun.fengwk.mss.core.service.scrape.error;

import fun.fengwk.mss.core.service.scrape.model.ScrapeStage;

/**
 * Failure of a single click, scroll or pagination step.
 */
public class InteractionException extends ScrapeStageException {

    public InteractionException(String message) {
        super(ScrapeStage.INTERACTION, message);
    }

    public InteractionException(String message, Throwable cause) {
        super(ScrapeStage.INTERACTION, message, cause);
    }

}
