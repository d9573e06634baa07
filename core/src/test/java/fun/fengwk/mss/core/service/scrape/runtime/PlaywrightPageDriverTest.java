package fun.fengwk.mss.core.service.scrape.runtime;

import com.microsoft.playwright.JSHandle;
import com.microsoft.playwright.Locator;
import com.microsoft.playwright.Page;
import com.microsoft.playwright.PlaywrightException;
import com.microsoft.playwright.Response;
import com.microsoft.playwright.TimeoutError;
import fun.fengwk.mss.core.service.scrape.ScrapeProperties;
import fun.fengwk.mss.core.service.scrape.error.InteractionException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * @author fengwk
 */
@ExtendWith(MockitoExtension.class)
public class PlaywrightPageDriverTest {

    private static final String URL = "https://example.com/list";

    @Mock
    private Page page;

    @Mock
    private Locator locator;

    @Mock
    private Locator item;

    @Mock
    private Response response;

    @Mock
    private JSHandle handle;

    private final ScrapeProperties scrapeProperties = new ScrapeProperties();

    @Test
    public void shouldReturnOnceContentIsStable() {
        when(page.content()).thenReturn("<html><body>stable text</body></html>");

        driver().awaitSettled(2000);

        verify(page, times(3)).content();
        verify(page, times(2)).waitForTimeout(250d);
    }

    @Test
    public void shouldCapSettleWaitAtDeadline() {
        scrapeProperties.setStabilityCheckIntervalMs(100);
        AtomicInteger counter = new AtomicInteger();
        when(page.content()).thenAnswer(invocation -> "<html><body>tick-" + counter.incrementAndGet() + "</body></html>");
        doAnswer(invocation -> {
            Thread.sleep(((Double) invocation.getArgument(0)).longValue());
            return null;
        }).when(page).waitForTimeout(anyDouble());

        long startAt = System.currentTimeMillis();
        driver().awaitSettled(300);
        long elapsedMs = System.currentTimeMillis() - startAt;

        assertThat(elapsedMs).isLessThan(1500);
        assertThat(counter.get()).isBetween(1, 5);
    }

    @Test
    public void shouldSleepInFixedDelayMode() {
        scrapeProperties.setSettleMode(ScrapeProperties.SettleMode.FIXED_DELAY);

        driver().awaitSettled(2000);

        verify(page).waitForTimeout(2000d);
        verify(page, never()).content();
    }

    @Test
    public void shouldClickWithInteractionTimeout() {
        when(page.locator(TargetKind.TAB.getSelector())).thenReturn(locator);
        when(locator.nth(1)).thenReturn(item);

        driver().click(new PageTarget(TargetKind.TAB, 1, "Specs", null));

        ArgumentCaptor<Locator.ClickOptions> options = ArgumentCaptor.forClass(Locator.ClickOptions.class);
        verify(item).click(options.capture());
        assertThat(options.getValue().timeout).isEqualTo(5000d);
    }

    @Test
    public void shouldTranslateClickTimeout() {
        when(page.locator(TargetKind.TAB.getSelector())).thenReturn(locator);
        when(locator.nth(0)).thenReturn(item);
        doAnswer(invocation -> {
            throw new TimeoutError("Timeout 5000ms exceeded.");
        }).when(item).click(any(Locator.ClickOptions.class));

        assertThatThrownBy(() -> driver().click(new PageTarget(TargetKind.TAB, 0, "Specs", null)))
            .isInstanceOf(InteractionException.class)
            .hasMessage("click tab: Specs timed out: Timeout 5000ms exceeded.");
    }

    @Test
    public void shouldTranslatePlaywrightFailure() {
        when(page.content()).thenThrow(new PlaywrightException("Target closed"));

        assertThatThrownBy(() -> driver().content())
            .isInstanceOf(InteractionException.class)
            .hasMessage("read page content failed: Target closed");
    }

    @Test
    public void shouldFindVisibleTargetsByCssOrText() {
        Locator textLocator = mock(Locator.class);
        Locator filtered = mock(Locator.class);
        Locator hidden = mock(Locator.class);
        when(page.locator(TargetKind.LOAD_MORE.getSelector())).thenReturn(locator);
        when(page.locator(TargetKind.LOAD_MORE.getTextSelector())).thenReturn(textLocator);
        when(textLocator.filter(any(Locator.FilterOptions.class))).thenReturn(filtered);
        Locator combined = mock(Locator.class);
        when(locator.or(filtered)).thenReturn(combined);
        when(combined.count()).thenReturn(2);
        when(combined.nth(0)).thenReturn(hidden);
        when(combined.nth(1)).thenReturn(item);
        when(hidden.isVisible()).thenReturn(false);
        when(item.isVisible()).thenReturn(true);
        when(item.innerText(any(Locator.InnerTextOptions.class))).thenReturn("  Load\n  more ");
        when(item.getAttribute(eq("href"), any(Locator.GetAttributeOptions.class))).thenReturn(null);

        List<PageTarget> targets = driver().findTargets(TargetKind.LOAD_MORE);

        assertThat(targets).containsExactly(new PageTarget(TargetKind.LOAD_MORE, 1, "Load more", null));
        ArgumentCaptor<Locator.FilterOptions> filter = ArgumentCaptor.forClass(Locator.FilterOptions.class);
        verify(textLocator).filter(filter.capture());
        assertThat(filter.getValue().hasText).isSameAs(TargetKind.LOAD_MORE.getTextPattern());
    }

    @Test
    public void shouldReadScrollHeightWithinInteractionTimeout() {
        when(page.waitForFunction(eq(PlaywrightPageDriver.SCROLL_HEIGHT_SCRIPT), isNull(), any(Page.WaitForFunctionOptions.class)))
            .thenReturn(handle);
        when(handle.jsonValue()).thenReturn("1280");

        long height = driver().scrollHeight();

        assertThat(height).isEqualTo(1280L);
        ArgumentCaptor<Page.WaitForFunctionOptions> options = ArgumentCaptor.forClass(Page.WaitForFunctionOptions.class);
        verify(page).waitForFunction(eq(PlaywrightPageDriver.SCROLL_HEIGHT_SCRIPT), isNull(), options.capture());
        assertThat(options.getValue().timeout).isEqualTo(5000d);
        verify(handle).dispose();
    }

    @Test
    public void shouldTranslateHungScroll() {
        when(page.waitForFunction(eq(PlaywrightPageDriver.SCROLL_TO_BOTTOM_SCRIPT), isNull(), any(Page.WaitForFunctionOptions.class)))
            .thenThrow(new TimeoutError("Timeout 5000ms exceeded."));

        assertThatThrownBy(() -> driver().scrollToBottom())
            .isInstanceOf(InteractionException.class)
            .hasMessageStartingWith("scroll to bottom timed out");
    }

    @Test
    public void shouldFailNavigationToErrorPage() {
        String next = URL + "?page=2";
        when(page.navigate(eq(next), any(Page.NavigateOptions.class))).thenReturn(response);
        when(response.status()).thenReturn(404);

        assertThatThrownBy(() -> driver().navigate(next))
            .isInstanceOf(InteractionException.class)
            .hasMessage("navigate to " + next + " failed: http status 404");
    }

    @Test
    public void shouldAcceptSuccessfulNavigation() {
        when(page.navigate(eq(URL), any(Page.NavigateOptions.class))).thenReturn(response);
        when(response.status()).thenReturn(200);

        driver().navigate(URL);

        verify(response).status();
    }

    private PlaywrightPageDriver driver() {
        return new PlaywrightPageDriver(page, scrapeProperties);
    }

}
