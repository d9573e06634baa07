package fun.fengwk.mss.core.service.scrape.runtime;

import fun.fengwk.mss.core.service.browser.runtime.BrowserTaskExecutor;
import fun.fengwk.mss.core.service.browser.runtime.BrowserWorkerBusyException;
import fun.fengwk.mss.core.service.scrape.ScrapeProperties;
import fun.fengwk.mss.core.service.scrape.error.ScrapeStageException;
import fun.fengwk.mss.core.service.scrape.model.ErrorRecord;
import fun.fengwk.mss.core.service.scrape.model.ScrapeStage;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Renders a page in a pooled headless browser and explores it.
 *
 * <p>Never throws: every failure becomes a failed {@link RenderOutcome}.
 *
 * @author fengwk
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RenderEngine {

    private final BrowserTaskExecutor browserTaskExecutor;
    private final ScrapeProperties scrapeProperties;
    private final InteractionController interactionController;

    public RenderOutcome render(String url) {
        long startAt = System.currentTimeMillis();
        try {
            RenderOutcome outcome = browserTaskExecutor.execute(new RenderBrowserTask(url, scrapeProperties, interactionController));
            log.info("render done, url={}, status={}, pages={}, elapsedMs={}",
                url, outcome.getStatus(), outcome.getCaptures().size(), System.currentTimeMillis() - startAt);
            return outcome;
        } catch (BrowserWorkerBusyException ex) {
            return RenderOutcome.failed(url, ErrorRecord.of(ScrapeStage.RENDER, ex.getMessage()));
        } catch (ScrapeStageException ex) {
            return RenderOutcome.failed(url, ErrorRecord.from(ex));
        } catch (RuntimeException ex) {
            log.warn("render failed, url={}, error={}", url, ex.getMessage(), ex);
            return RenderOutcome.failed(url, ErrorRecord.of(ScrapeStage.RENDER, "render failed: " + ex.getMessage()));
        }
    }

}
