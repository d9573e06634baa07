package fun.fengwk.mss.core.service.scrape.runtime;

import fun.fengwk.mss.core.service.scrape.model.ErrorRecord;
import fun.fengwk.mss.core.service.scrape.model.InteractionSummary;
import fun.fengwk.mss.core.service.scrape.model.PageSnapshot;

import java.util.List;

/**
 * Result of the interactive crawl.
 *
 * @param captures DOM snapshot of every visited page, in visit order
 * @param summary  interactions performed
 * @param issues   abandoned interactions
 * @author fengwk
 */
public record CrawlOutcome(List<PageSnapshot> captures, InteractionSummary summary, List<ErrorRecord> issues) {

    public CrawlOutcome {
        captures = List.copyOf(captures);
        issues = List.copyOf(issues);
    }

}
