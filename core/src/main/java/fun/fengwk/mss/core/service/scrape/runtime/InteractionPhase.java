package fun.fengwk.mss.core.service.scrape.runtime;

/**
 * Phases of the interactive crawl.
 *
 * @author fengwk
 */
public enum InteractionPhase {

    IDLE,
    CLICK_TABS,
    CLICK_LOAD_MORE,
    SCROLL,
    PAGINATE,
    DONE

}
