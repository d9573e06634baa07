package fun.fengwk.mss.core.service.scrape.runtime;

import fun.fengwk.mss.core.service.scrape.ScrapeProperties;
import fun.fengwk.mss.core.service.scrape.model.ErrorRecord;
import fun.fengwk.mss.core.service.scrape.model.PageSnapshot;
import fun.fengwk.mss.core.service.scrape.model.ScrapeStage;
import fun.fengwk.mss.core.service.scrape.parser.NoiseFilter;
import fun.fengwk.mss.core.service.scrape.parser.SectionDraft;
import fun.fengwk.mss.core.service.scrape.parser.SectionSegmenter;
import org.jsoup.Jsoup;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * @author fengwk
 */
public class InteractionControllerTest {

    private static final String PAGE_1 = "https://example.com/list/1";
    private static final String PAGE_2 = "https://example.com/list/2";
    private static final String PAGE_3 = "https://example.com/list/3";
    private static final String PAGE_4 = "https://example.com/list/4";

    private final ScrapeProperties scrapeProperties = new ScrapeProperties();
    private final InteractionController controller = new InteractionController(scrapeProperties);

    @Test
    public void shouldReflectLoadMoreInCapturedDom() {
        FakePageDriver driver = new FakePageDriver()
            .page(PAGE_1, """
                <html><body>
                  <section><h2>Intro</h2><p>first part</p></section>
                  <button class="btn">Load more</button>
                </body></html>
                """)
            .onClick("Load more", document -> {
                document.body().appendElement("section").html("<h2>More</h2><p>second part</p>");
                document.select("button").remove();
            })
            .open(PAGE_1);

        CrawlOutcome outcome = controller.crawl(driver);

        assertThat(outcome.captures()).hasSize(1);
        assertThat(outcome.summary().getClicks()).containsExactly("load-more: Load more");
        assertThat(outcome.issues()).isEmpty();
        assertThat(driver.getSettleWaits()).contains((long) scrapeProperties.getLoadMoreSettleMs());

        SectionSegmenter segmenter = new SectionSegmenter(scrapeProperties);
        PageSnapshot capture = outcome.captures().get(0);
        List<SectionDraft> before = segmenter.segment(Jsoup.parse(driver.getPageHtml(PAGE_1), PAGE_1), PAGE_1).sections();
        List<SectionDraft> after = segmenter.segment(
            new NoiseFilter().filter(Jsoup.parse(capture.getHtml(), capture.getUrl())), capture.getUrl()).sections();
        assertThat(before).hasSize(1);
        assertThat(after).extracting(SectionDraft::getLabel).containsExactly("Intro", "More");
    }

    @Test
    public void shouldClickEachTabOnce() {
        FakePageDriver driver = new FakePageDriver()
            .page(PAGE_1, """
                <html><body>
                  <ul class="tabs"><li>Overview</li><li>Specs</li></ul>
                  <button role="tab">Reviews</button>
                </body></html>
                """)
            .open(PAGE_1);

        CrawlOutcome outcome = controller.crawl(driver);

        assertThat(outcome.summary().getClicks()).containsExactly("tab: Overview", "tab: Specs", "tab: Reviews");
        assertThat(driver.getSettleWaits()).containsOnly((long) scrapeProperties.getTabSettleMs());
    }

    @Test
    public void shouldCapLoadMoreClicksPerPage() {
        StringBuilder html = new StringBuilder("<html><body><section><p>items</p></section>");
        for (int i = 0; i < 10; i++) {
            html.append("<a href=\"#\" class=\"show-more\">Show more</a>");
        }
        html.append("</body></html>");
        FakePageDriver driver = new FakePageDriver().page(PAGE_1, html.toString()).open(PAGE_1);

        CrawlOutcome outcome = controller.crawl(driver);

        assertThat(outcome.summary().getClicks()).hasSize(scrapeProperties.getMaxLoadMoreClicks());
    }

    @Test
    public void shouldStopScrollingAtCapEvenWhenContentKeepsGrowing() {
        FakePageDriver driver = new FakePageDriver()
            .page(PAGE_1, "<html><body><section><p>feed</p></section><a rel=\"next\" href=\"/list/2\">Next</a></body></html>")
            .page(PAGE_2, "<html><body><p>two</p></body></html>")
            .scrollGrowth(100)
            .open(PAGE_1);

        CrawlOutcome outcome = controller.crawl(driver);

        assertThat(driver.getScrollOperations()).isEqualTo(3);
        assertThat(outcome.summary().getScrolls()).isEqualTo(3);
        // Still growing after the last scroll, so the next-page link is not followed.
        assertThat(driver.getNavigations()).isEmpty();
        assertThat(outcome.captures()).hasSize(1);
    }

    @Test
    public void shouldNeverVisitMoreThanMaxPages() {
        FakePageDriver driver = new FakePageDriver()
            .page(PAGE_1, chainedPage("one", "/list/2"))
            .page(PAGE_2, chainedPage("two", "/list/3"))
            .page(PAGE_3, chainedPage("three", "/list/4"))
            .page(PAGE_4, chainedPage("four", "/list/5"))
            .open(PAGE_1);

        CrawlOutcome outcome = controller.crawl(driver);

        assertThat(outcome.summary().getPages()).containsExactly(PAGE_1, PAGE_2, PAGE_3);
        assertThat(outcome.captures()).extracting(PageSnapshot::getUrl).containsExactly(PAGE_1, PAGE_2, PAGE_3);
        assertThat(outcome.captures().get(1).getHtml()).contains("two");
        assertThat(outcome.summary().getScrolls()).isLessThanOrEqualTo(scrapeProperties.getMaxScrolls());
        assertThat(driver.getNavigations()).containsExactly(PAGE_2, PAGE_3);
    }

    @Test
    public void shouldShareScrollBudgetAcrossPages() {
        scrapeProperties.setMaxScrolls(1);
        FakePageDriver driver = new FakePageDriver()
            .page(PAGE_1, chainedPage("one", "/list/2"))
            .page(PAGE_2, chainedPage("two", "/list/3"))
            .page(PAGE_3, chainedPage("three", "/list/4"))
            .open(PAGE_1);

        CrawlOutcome outcome = controller.crawl(driver);

        assertThat(driver.getScrollOperations()).isEqualTo(1);
        assertThat(outcome.summary().getPages()).hasSize(3);
    }

    @Test
    public void shouldOnlyFollowSameOriginUnvisitedPages() {
        FakePageDriver driver = new FakePageDriver()
            .page(PAGE_1, """
                <html><body>
                  <a class="next" href="https://other.example.org/list/2">Next</a>
                  <a rel="next" href="/list/2#top">Next page</a>
                </body></html>
                """)
            .page(PAGE_2, chainedPage("two", "/list/1"))
            .open(PAGE_1);

        CrawlOutcome outcome = controller.crawl(driver);

        assertThat(driver.getNavigations()).containsExactly("https://example.com/list/2#top");
        assertThat(outcome.summary().getPages()).hasSize(2);
        assertThat(outcome.captures()).hasSize(2);
    }

    @Test
    public void shouldRecordFailedInteractionAndMoveOn() {
        FakePageDriver driver = new FakePageDriver()
            .page(PAGE_1, """
                <html><body>
                  <button role="tab">Broken</button>
                  <button role="tab">Fine</button>
                  <button>Load more</button>
                </body></html>
                """)
            .failClick("Broken")
            .open(PAGE_1);

        CrawlOutcome outcome = controller.crawl(driver);

        assertThat(outcome.issues()).singleElement().satisfies(issue -> {
            assertThat(issue.getStage()).isEqualTo(ScrapeStage.INTERACTION);
            assertThat(issue.getMessage()).contains("timed out");
        });
        // The tab phase is abandoned, the crawl continues with load-more.
        assertThat(outcome.summary().getClicks()).containsExactly("load-more: Load more");
    }

    @Test
    public void shouldRecordFailedNavigationWithoutDuplicateCapture() {
        FakePageDriver driver = new FakePageDriver()
            .page(PAGE_1, chainedPage("one", "/missing"))
            .open(PAGE_1);

        CrawlOutcome outcome = controller.crawl(driver);

        assertThat(outcome.captures()).hasSize(1);
        assertThat(outcome.summary().getPages()).containsExactly(PAGE_1);
        assertThat(outcome.issues()).extracting(ErrorRecord::getStage).containsExactly(ScrapeStage.INTERACTION);
    }

    @Test
    public void shouldFinishOnEmptyPage() {
        FakePageDriver driver = new FakePageDriver().page(PAGE_1, "<html><body></body></html>").open(PAGE_1);

        CrawlOutcome outcome = controller.crawl(driver);

        assertThat(outcome.captures()).hasSize(1);
        assertThat(outcome.summary().getClicks()).isEmpty();
        assertThat(outcome.summary().getScrolls()).isEqualTo(1);
        assertThat(outcome.issues()).isEmpty();
    }

    private String chainedPage(String text, String nextHref) {
        return "<html><body><section><p>" + text + "</p></section><a rel=\"next\" href=\"" + nextHref + "\">Next</a></body></html>";
    }

}
