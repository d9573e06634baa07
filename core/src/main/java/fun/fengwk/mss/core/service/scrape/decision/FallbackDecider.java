package fun.fengwk.mss.core.service.scrape.decision;

import fun.fengwk.mss.core.service.scrape.ScrapeProperties;
import fun.fengwk.mss.core.service.scrape.model.PageSnapshot;
import fun.fengwk.mss.core.service.scrape.parser.SegmentationResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.nodes.Document;
import org.springframework.stereotype.Component;

/**
 * Decides, once per request, whether the static html is good enough or the page has to be rendered.
 *
 * @author fengwk
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class FallbackDecider {

    static final String MAIN_CONTENT_SELECTOR = String.join(", ",
        "main",
        "article",
        "section",
        "[role=main]",
        "#main",
        "#main-content",
        "#content",
        ".main-content",
        ".content",
        ".article-content",
        ".post-content",
        ".entry-content"
    );

    private final ScrapeProperties scrapeProperties;

    /**
     * @param staticSnapshot static fetch output, may be null when no fetch happened
     * @param cleanedDocument noise-filtered static document, null when the fetch failed
     * @param preliminary    segmentation of {@code cleanedDocument}, null when the fetch failed
     */
    public FallbackDecision decide(PageSnapshot staticSnapshot, Document cleanedDocument, SegmentationResult preliminary) {
        if (staticSnapshot == null || !staticSnapshot.isSuccess() || cleanedDocument == null || preliminary == null) {
            return report(staticSnapshot, new FallbackDecision(true, FallbackReason.STATIC_FETCH_FAILED, 0));
        }
        int textLength = preliminary.totalTextLength();
        if (textLength < scrapeProperties.getMinStaticTextLength()) {
            return report(staticSnapshot, new FallbackDecision(true, FallbackReason.INSUFFICIENT_TEXT, textLength));
        }
        if (cleanedDocument.selectFirst(MAIN_CONTENT_SELECTOR) == null) {
            return report(staticSnapshot, new FallbackDecision(true, FallbackReason.NO_MAIN_CONTENT, textLength));
        }
        return report(staticSnapshot, new FallbackDecision(false, FallbackReason.STATIC_SUFFICIENT, textLength));
    }

    private FallbackDecision report(PageSnapshot staticSnapshot, FallbackDecision decision) {
        log.info("fallback decided, url={}, render={}, reason={}, staticTextLength={}",
            staticSnapshot == null ? "" : staticSnapshot.getUrl(),
            decision.renderRequired(),
            decision.reason(),
            decision.staticTextLength());
        return decision;
    }

}
