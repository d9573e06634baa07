package fun.fengwk.mss.core.service.scrape;

import fun.fengwk.mss.core.service.scrape.model.ScrapeRequest;
import fun.fengwk.mss.core.service.scrape.model.ScrapeResult;

/**
 * Scrape service entry.
 *
 * @author fengwk
 */
public interface PageScrapeService {

    /**
     * Scrape one page into sections. Always returns a best-effort result.
     *
     * @throws IllegalArgumentException when the request url is blank, relative or not http(s)
     */
    ScrapeResult scrape(ScrapeRequest request);

}
