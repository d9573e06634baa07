package fun.fengwk.mss.core.service.scrape.runtime;

import fun.fengwk.mss.core.service.scrape.support.ScrapeUrlUtils;

import java.util.HashSet;
import java.util.Set;

/**
 * Immutable crawl state handed from one step of the interaction loop to the next.
 *
 * @param phase          current phase
 * @param pageCount      pages visited so far, including the first one
 * @param scrollCount    scroll operations across the whole crawl
 * @param tabClicks      tab clicks on the current page
 * @param loadMoreClicks load-more clicks on the current page
 * @param visitedUrls    normalized urls of visited pages
 * @param clickedKeys    targets already clicked on the current page
 * @param contentGrew    whether the last scroll grew the page
 * @author fengwk
 */
public record CrawlState(
    InteractionPhase phase,
    int pageCount,
    int scrollCount,
    int tabClicks,
    int loadMoreClicks,
    Set<String> visitedUrls,
    Set<String> clickedKeys,
    boolean contentGrew
) {

    public CrawlState {
        visitedUrls = Set.copyOf(visitedUrls);
        clickedKeys = Set.copyOf(clickedKeys);
    }

    public static CrawlState start(String url) {
        return new CrawlState(
            InteractionPhase.IDLE, 1, 0, 0, 0,
            Set.of(ScrapeUrlUtils.normalizeForVisit(url)), Set.of(), false
        );
    }

    public boolean isTerminal() {
        return phase == InteractionPhase.DONE;
    }

    public boolean isVisited(String url) {
        return visitedUrls.contains(ScrapeUrlUtils.normalizeForVisit(url));
    }

    public boolean isClicked(PageTarget target) {
        return clickedKeys.contains(target.key());
    }

    public CrawlState withPhase(InteractionPhase next) {
        return new CrawlState(next, pageCount, scrollCount, tabClicks, loadMoreClicks, visitedUrls, clickedKeys, contentGrew);
    }

    public CrawlState withClick(PageTarget target) {
        Set<String> keys = new HashSet<>(clickedKeys);
        keys.add(target.key());
        int tabs = target.kind() == TargetKind.TAB ? tabClicks + 1 : tabClicks;
        int loadMores = target.kind() == TargetKind.LOAD_MORE ? loadMoreClicks + 1 : loadMoreClicks;
        return new CrawlState(phase, pageCount, scrollCount, tabs, loadMores, visitedUrls, keys, contentGrew);
    }

    public CrawlState withScroll(boolean grew) {
        return new CrawlState(phase, pageCount, scrollCount + 1, tabClicks, loadMoreClicks, visitedUrls, clickedKeys, grew);
    }

    /**
     * State after navigating to the next page: page counters reset, scroll count kept.
     */
    public CrawlState withPage(String url) {
        Set<String> visited = new HashSet<>(visitedUrls);
        visited.add(ScrapeUrlUtils.normalizeForVisit(url));
        return new CrawlState(InteractionPhase.CLICK_TABS, pageCount + 1, scrollCount, 0, 0, visited, Set.of(), false);
    }

}
