package fun.fengwk.mss.core.service.scrape;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Timeouts, stop conditions and size caps of the scraping pipeline.
 *
 * @author fengwk
 */
@Data
@Component
@ConfigurationProperties(prefix = "mss.scrape")
public class ScrapeProperties {

    /**
     * Timeout of the single static GET in milliseconds.
     */
    private int staticFetchTimeoutMs = 10000;

    /**
     * Static pages with less visible section text than this are rendered in a browser.
     */
    private int minStaticTextLength = 500;

    /**
     * User agent of the static fetcher.
     */
    private String userAgent =
        "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/120.0.0.0 Safari/537.36";

    /**
     * Page navigate timeout in milliseconds, applied to every page of the interactive crawl.
     */
    private int navigateTimeoutMs = 30000;

    /**
     * How to wait for rendered content after navigation and clicks.
     */
    private SettleMode settleMode = SettleMode.CONTENT_STABILITY;

    /**
     * Settle delay after navigation. Fixed sleep in {@link SettleMode#FIXED_DELAY}, upper bound otherwise.
     */
    private int settleDelayMs = 2000;

    /**
     * Polling interval of {@link SettleMode#CONTENT_STABILITY}.
     */
    private int stabilityCheckIntervalMs = 250;

    /**
     * Consecutive unchanged polls required to treat content as settled.
     */
    private int stabilityThreshold = 2;

    /**
     * Timeout of one click, scroll or lookup in milliseconds.
     */
    private int interactionTimeoutMs = 5000;

    /**
     * Settle time after a tab click.
     */
    private int tabSettleMs = 1000;

    /**
     * Settle time after a load-more click.
     */
    private int loadMoreSettleMs = 2000;

    /**
     * Wait after each scroll to the bottom.
     */
    private int scrollWaitMs = 2000;

    /**
     * Maximum pages visited by the interactive crawl, including the first one.
     */
    private int maxPages = 3;

    /**
     * Maximum scroll operations across the whole crawl.
     */
    private int maxScrolls = 3;

    /**
     * Maximum tab clicks per page.
     */
    private int maxTabClicks = 10;

    /**
     * Maximum load-more clicks per page.
     */
    private int maxLoadMoreClicks = 5;

    private int maxTextLength = 5000;

    private int maxRawHtmlLength = 5000;

    private int maxLinks = 50;

    private int maxImages = 20;

    private int maxLists = 10;

    private int maxTables = 5;

    private int maxHeadings = 10;

    private int maxLabelLength = 100;

    /**
     * Words taken from section text when no heading gives a label.
     */
    private int labelWordCount = 7;

    public enum SettleMode {

        /**
         * Sleep for the whole settle delay.
         */
        FIXED_DELAY,

        /**
         * Poll page text until it stops changing, bounded by the settle delay.
         */
        CONTENT_STABILITY

    }

}
