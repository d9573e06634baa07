package fun.fengwk.mss.core.service.scrape.decision;

/**
 * Why the browser renderer is, or is not, needed for a page.
 *
 * @author fengwk
 */
public enum FallbackReason {

    STATIC_SUFFICIENT,
    STATIC_FETCH_FAILED,
    INSUFFICIENT_TEXT,
    NO_MAIN_CONTENT

}
