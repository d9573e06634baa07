package fun.fengwk.mss.core.service.browser.runtime;

import com.microsoft.playwright.Browser;
import com.microsoft.playwright.BrowserContext;
import com.microsoft.playwright.Page;
import com.microsoft.playwright.Playwright;
import com.microsoft.playwright.PlaywrightException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * @author fengwk
 */
public class BrowserWorkerTest {

    @Test
    public void shouldRunTaskInOwnContextAndCloseIt() throws Exception {
        Browser browser = mock(Browser.class);
        BrowserContext browserContext = mock(BrowserContext.class);
        Page page = mock(Page.class);
        when(browser.newContext(any(Browser.NewContextOptions.class))).thenReturn(browserContext);
        when(browserContext.newPage()).thenReturn(page);
        BrowserWorker worker = new BrowserWorker("render-1", mock(Playwright.class), browser, new Browser.NewContextOptions());

        Page seen = worker.execute(context -> {
            assertThat(context.getWorkerId()).isEqualTo("render-1");
            assertThat(context.getBrowserContext()).isSameAs(browserContext);
            return context.getPage();
        });

        assertThat(seen).isSameAs(page);
        verify(browserContext).close();
    }

    @Test
    public void shouldCloseContextWhenTaskFails() {
        Browser browser = mock(Browser.class);
        BrowserContext browserContext = mock(BrowserContext.class);
        when(browser.newContext(any(Browser.NewContextOptions.class))).thenReturn(browserContext);
        BrowserWorker worker = new BrowserWorker("render-1", mock(Playwright.class), browser, new Browser.NewContextOptions());

        assertThatThrownBy(() -> worker.execute(context -> {
            throw new IllegalStateException("boom");
        })).isInstanceOf(IllegalStateException.class);

        verify(browserContext).close();
    }

    @Test
    public void shouldCloseOnceInOrder() {
        Browser browser = mock(Browser.class);
        Playwright playwright = mock(Playwright.class);
        BrowserWorker worker = new BrowserWorker("render-1", playwright, browser, new Browser.NewContextOptions());

        worker.close();
        worker.close();

        verify(browser, times(1)).close();
        verify(playwright, times(1)).close();
        assertThat(worker.isClosed()).isTrue();
        assertThat(worker.isHealthy()).isFalse();
        assertThatThrownBy(() -> worker.execute(context -> null)).isInstanceOf(IllegalStateException.class);
    }

    @Test
    public void shouldStillClosePlaywrightWhenBrowserAlreadyClosed() {
        Browser browser = mock(Browser.class);
        Playwright playwright = mock(Playwright.class);
        doThrow(new PlaywrightException("Target page, context or browser has been closed")).when(browser).close();
        BrowserWorker worker = new BrowserWorker("render-1", playwright, browser, new Browser.NewContextOptions());

        worker.close();

        verify(playwright).close();
    }

    @Test
    public void shouldReportUnhealthyWhenBrowserDisconnected() {
        Browser browser = mock(Browser.class);
        when(browser.isConnected()).thenReturn(false);
        BrowserWorker worker = new BrowserWorker("render-1", mock(Playwright.class), browser, new Browser.NewContextOptions());

        assertThat(worker.isHealthy()).isFalse();
    }

}
