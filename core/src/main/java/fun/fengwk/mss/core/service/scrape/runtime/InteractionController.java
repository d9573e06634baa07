package fun.fengwk.mss.core.service.scrape.runtime;

import fun.fengwk.mss.core.service.scrape.ScrapeProperties;
import fun.fengwk.mss.core.service.scrape.error.ScrapeStageException;
import fun.fengwk.mss.core.service.scrape.model.ErrorRecord;
import fun.fengwk.mss.core.service.scrape.model.InteractionSummary;
import fun.fengwk.mss.core.service.scrape.model.PageSnapshot;
import fun.fengwk.mss.core.service.scrape.model.ScrapeStage;
import fun.fengwk.mss.core.service.scrape.support.ScrapeUrlUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Bounded exploration of a rendered page: tabs, load-more buttons, scrolling and same-origin pagination.
 *
 * <p>The crawl is an explicit loop over {@link CrawlState}. Every step either advances the phase or
 * increments a capped counter, so {@link InteractionPhase#DONE} is always reached. A failed interaction
 * is recorded and the loop moves on to the next phase.
 *
 * @author fengwk
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class InteractionController {

    private final ScrapeProperties scrapeProperties;

    public CrawlOutcome crawl(PageDriver driver) {
        String startUrl = driver.url();
        CrawlSession session = new CrawlSession(startUrl);
        CrawlState state = CrawlState.start(startUrl);

        int maxSteps = maxSteps();
        int steps = 0;
        while (!state.isTerminal()) {
            if (++steps > maxSteps) {
                log.warn("interaction step guard reached, url={}, steps={}, phase={}", startUrl, maxSteps, state.phase());
                break;
            }
            state = switch (state.phase()) {
                case IDLE -> state.withPhase(InteractionPhase.CLICK_TABS);
                case CLICK_TABS -> clickNext(driver, state, session, TargetKind.TAB, InteractionPhase.CLICK_LOAD_MORE);
                case CLICK_LOAD_MORE -> clickNext(driver, state, session, TargetKind.LOAD_MORE, InteractionPhase.SCROLL);
                case SCROLL -> scroll(driver, state, session);
                case PAGINATE -> paginate(driver, state, session, startUrl);
                case DONE -> state;
            };
        }

        // The page the crawl stopped on has not been captured yet.
        if (session.captures.size() < state.pageCount()) {
            session.captures.add(capture(driver, session));
        }

        InteractionSummary summary = InteractionSummary.builder()
            .clicks(List.copyOf(session.clicks))
            .scrolls(state.scrollCount())
            .pages(List.copyOf(session.pages))
            .build();
        log.info(
            "interactive crawl finished, url={}, pages={}, scrolls={}, clicks={}, issues={}",
            startUrl,
            state.pageCount(),
            state.scrollCount(),
            session.clicks.size(),
            session.issues.size()
        );
        return new CrawlOutcome(session.captures, summary, session.issues);
    }

    private CrawlState clickNext(
        PageDriver driver,
        CrawlState state,
        CrawlSession session,
        TargetKind kind,
        InteractionPhase nextPhase
    ) {
        int clicks = kind == TargetKind.TAB ? state.tabClicks() : state.loadMoreClicks();
        int maxClicks = kind == TargetKind.TAB ? scrapeProperties.getMaxTabClicks() : scrapeProperties.getMaxLoadMoreClicks();
        if (clicks >= maxClicks) {
            return state.withPhase(nextPhase);
        }

        PageTarget target;
        try {
            // Re-evaluated before every click, earlier clicks may have changed the page.
            target = driver.findTargets(kind).stream()
                .filter(candidate -> !state.isClicked(candidate))
                .findFirst()
                .orElse(null);
        } catch (ScrapeStageException ex) {
            session.record(ex);
            return state.withPhase(nextPhase);
        }
        if (target == null) {
            return state.withPhase(nextPhase);
        }

        try {
            driver.click(target);
            session.clicks.add(target.describe());
            log.debug("clicked target, url={}, target={}", session.startUrl, target.describe());
            driver.awaitSettled(kind == TargetKind.TAB ? scrapeProperties.getTabSettleMs() : scrapeProperties.getLoadMoreSettleMs());
            return state.withClick(target);
        } catch (ScrapeStageException ex) {
            session.record(ex);
            return state.withClick(target).withPhase(nextPhase);
        }
    }

    private CrawlState scroll(PageDriver driver, CrawlState state, CrawlSession session) {
        if (state.scrollCount() >= scrapeProperties.getMaxScrolls()) {
            return state.withPhase(InteractionPhase.PAGINATE);
        }
        try {
            long before = driver.scrollHeight();
            driver.scrollToBottom();
            driver.pause(scrapeProperties.getScrollWaitMs());
            long after = driver.scrollHeight();
            boolean grew = after > before;
            log.debug("scrolled to bottom, url={}, before={}, after={}", session.startUrl, before, after);
            CrawlState scrolled = state.withScroll(grew);
            return grew ? scrolled : scrolled.withPhase(InteractionPhase.PAGINATE);
        } catch (ScrapeStageException ex) {
            session.record(ex);
            return state.withScroll(false).withPhase(InteractionPhase.PAGINATE);
        }
    }

    private CrawlState paginate(PageDriver driver, CrawlState state, CrawlSession session, String startUrl) {
        // An infinite-scroll page still growing has no next page worth following.
        if (state.contentGrew() || state.pageCount() >= scrapeProperties.getMaxPages()) {
            return state.withPhase(InteractionPhase.DONE);
        }

        String nextUrl;
        try {
            String currentUrl = driver.url();
            nextUrl = driver.findTargets(TargetKind.NEXT_PAGE).stream()
                .map(target -> ScrapeUrlUtils.toAbsolute(currentUrl, target.href()))
                .filter(url -> url != null && ScrapeUrlUtils.isSameOrigin(startUrl, url) && !state.isVisited(url))
                .findFirst()
                .orElse(null);
        } catch (ScrapeStageException ex) {
            session.record(ex);
            return state.withPhase(InteractionPhase.DONE);
        }
        if (nextUrl == null) {
            return state.withPhase(InteractionPhase.DONE);
        }

        session.captures.add(capture(driver, session));
        try {
            driver.navigate(nextUrl);
            driver.awaitSettled(scrapeProperties.getSettleDelayMs());
        } catch (ScrapeStageException ex) {
            session.record(ex);
            return state.withPhase(InteractionPhase.DONE);
        }
        session.pages.add(nextUrl);
        log.debug("followed next page, url={}, next={}", startUrl, nextUrl);
        return state.withPage(nextUrl);
    }

    private PageSnapshot capture(PageDriver driver, CrawlSession session) {
        String url = session.pages.get(session.pages.size() - 1);
        try {
            return PageSnapshot.success(url, driver.content());
        } catch (ScrapeStageException ex) {
            ErrorRecord issue = ErrorRecord.from(ex);
            session.issues.add(issue);
            return PageSnapshot.failed(url, issue);
        }
    }

    private int maxSteps() {
        int perPage = Math.max(0, scrapeProperties.getMaxTabClicks())
            + Math.max(0, scrapeProperties.getMaxLoadMoreClicks())
            + Math.max(0, scrapeProperties.getMaxScrolls())
            + InteractionPhase.values().length;
        return Math.max(1, scrapeProperties.getMaxPages()) * perPage + InteractionPhase.values().length;
    }

    private static class CrawlSession {

        private final String startUrl;
        private final List<PageSnapshot> captures = new ArrayList<>();
        private final List<String> clicks = new ArrayList<>();
        private final List<String> pages = new ArrayList<>();
        private final List<ErrorRecord> issues = new ArrayList<>();

        private CrawlSession(String startUrl) {
            this.startUrl = startUrl;
            this.pages.add(startUrl);
        }

        private void record(ScrapeStageException ex) {
            log.debug("interaction abandoned, url={}, stage={}, error={}", startUrl, ex.getStage(), ex.getMessage());
            issues.add(ex.getStage() == null
                ? ErrorRecord.of(ScrapeStage.INTERACTION, ex.getMessage())
                : ErrorRecord.from(ex));
        }

    }

}
