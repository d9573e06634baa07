package fun.fengwk.mss.core.service.scrape.runtime;

import com.microsoft.playwright.JSHandle;
import com.microsoft.playwright.Locator;
import com.microsoft.playwright.Page;
import com.microsoft.playwright.PlaywrightException;
import com.microsoft.playwright.Response;
import com.microsoft.playwright.TimeoutError;
import com.microsoft.playwright.options.WaitUntilState;
import fun.fengwk.mss.core.service.scrape.ScrapeProperties;
import fun.fengwk.mss.core.service.scrape.error.InteractionException;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.Jsoup;
import org.springframework.util.StringUtils;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Supplier;
import java.util.zip.CRC32;

/**
 * {@link PageDriver} backed by a Playwright page.
 *
 * @author fengwk
 */
@Slf4j
public class PlaywrightPageDriver implements PageDriver {

    // Scripts run through waitForFunction and must return a truthy value.
    static final String SCROLL_TO_BOTTOM_SCRIPT =
        "() => { window.scrollTo(0, document.body ? document.body.scrollHeight : 0); return true; }";

    static final String SCROLL_HEIGHT_SCRIPT =
        "() => String(document.body ? document.body.scrollHeight : 0)";

    private final Page page;
    private final ScrapeProperties scrapeProperties;

    public PlaywrightPageDriver(Page page, ScrapeProperties scrapeProperties) {
        this.page = page;
        this.scrapeProperties = scrapeProperties;
    }

    @Override
    public String url() {
        return call("read page url", page::url);
    }

    @Override
    public String content() {
        return call("read page content", page::content);
    }

    @Override
    public List<PageTarget> findTargets(TargetKind kind) {
        return call("find " + kind.getValue() + " targets", () -> {
            Locator locator = locate(kind);
            int count = locator.count();
            List<PageTarget> targets = new ArrayList<>(count);
            for (int i = 0; i < count; i++) {
                Locator item = locator.nth(i);
                if (!item.isVisible()) {
                    continue;
                }
                String text = item.innerText(new Locator.InnerTextOptions().setTimeout(interactionTimeout()));
                String href = item.getAttribute("href", new Locator.GetAttributeOptions().setTimeout(interactionTimeout()));
                targets.add(new PageTarget(kind, i, normalizeText(text), href));
            }
            return targets;
        });
    }

    @Override
    public void click(PageTarget target) {
        run("click " + target.describe(), () -> locate(target.kind())
            .nth(target.index())
            .click(new Locator.ClickOptions().setTimeout(interactionTimeout())));
    }

    @Override
    public void scrollToBottom() {
        run("scroll to bottom", () -> evaluate(SCROLL_TO_BOTTOM_SCRIPT));
    }

    @Override
    public long scrollHeight() {
        Object height = call("read scroll height", () -> evaluate(SCROLL_HEIGHT_SCRIPT));
        if (height instanceof Number number) {
            return number.longValue();
        }
        if (height instanceof String text && text.matches("\\d{1,18}")) {
            return Long.parseLong(text);
        }
        return 0L;
    }

    @Override
    public void navigate(String url) {
        String action = "navigate to " + url;
        Response response = call(action, () -> page.navigate(url,
            new Page.NavigateOptions()
                .setWaitUntil(WaitUntilState.NETWORKIDLE)
                .setTimeout((double) scrapeProperties.getNavigateTimeoutMs())
        ));
        if (response != null && !isSuccessStatus(response.status())) {
            throw new InteractionException(action + " failed: http status " + response.status());
        }
    }

    @Override
    public void pause(long millis) {
        if (millis > 0) {
            run("wait", () -> page.waitForTimeout(millis));
        }
    }

    @Override
    public void awaitSettled(long maxWaitMs) {
        if (maxWaitMs <= 0) {
            return;
        }
        if (scrapeProperties.getSettleMode() == ScrapeProperties.SettleMode.FIXED_DELAY) {
            pause(maxWaitMs);
        } else {
            run("wait for content to settle", () -> waitForContentStable(maxWaitMs));
        }
    }

    static boolean isSuccessStatus(int status) {
        return status >= 200 && status < 300;
    }

    /**
     * Evaluate {@code script} bounded by the interaction timeout, {@link Page#evaluate} has no timeout of its own.
     */
    private Object evaluate(String script) {
        JSHandle handle = page.waitForFunction(script, null,
            new Page.WaitForFunctionOptions().setTimeout(interactionTimeout()));
        try {
            return handle.jsonValue();
        } finally {
            handle.dispose();
        }
    }

    private Locator locate(TargetKind kind) {
        Locator locator = page.locator(kind.getSelector());
        if (kind.hasTextRule()) {
            locator = locator.or(page.locator(kind.getTextSelector())
                .filter(new Locator.FilterOptions().setHasText(kind.getTextPattern())));
        }
        return locator;
    }

    private void waitForContentStable(long maxWaitMs) {
        int checkIntervalMs = (int) Math.max(50, Math.min(maxWaitMs, scrapeProperties.getStabilityCheckIntervalMs()));
        int stableThreshold = Math.max(1, scrapeProperties.getStabilityThreshold());

        long deadlineAt = System.currentTimeMillis() + maxWaitMs;
        int stableRounds = 0;
        int lastTextLength = -1;
        long lastFingerprint = -1L;

        while (System.currentTimeMillis() < deadlineAt) {
            String text = extractNormalizedText(page.content());
            long fingerprint = fingerprint(text);
            if (text.length() > 0 && text.length() == lastTextLength && fingerprint == lastFingerprint) {
                stableRounds++;
                if (stableRounds >= stableThreshold) {
                    return;
                }
            } else {
                stableRounds = 0;
            }
            lastTextLength = text.length();
            lastFingerprint = fingerprint;
            page.waitForTimeout(checkIntervalMs);
        }

        log.debug(
            "content settle timeout, url={}, maxWaitMs={}, stableThreshold={}, checkIntervalMs={}",
            page.url(),
            maxWaitMs,
            stableThreshold,
            checkIntervalMs
        );
    }

    private String extractNormalizedText(String html) {
        if (!StringUtils.hasText(html)) {
            return "";
        }
        return Jsoup.parse(html).text().replaceAll("\\s+", " ").trim();
    }

    private long fingerprint(String value) {
        CRC32 crc32 = new CRC32();
        byte[] bytes = value.getBytes(StandardCharsets.UTF_8);
        crc32.update(bytes, 0, bytes.length);
        return crc32.getValue();
    }

    private String normalizeText(String text) {
        return text == null ? "" : text.replaceAll("\\s+", " ").trim();
    }

    private double interactionTimeout() {
        return scrapeProperties.getInteractionTimeoutMs();
    }

    private void run(String action, Runnable runnable) {
        call(action, () -> {
            runnable.run();
            return null;
        });
    }

    private <T> T call(String action, Supplier<T> supplier) {
        try {
            return supplier.get();
        } catch (TimeoutError ex) {
            throw new InteractionException(action + " timed out: " + ex.getMessage(), ex);
        } catch (PlaywrightException ex) {
            throw new InteractionException(action + " failed: " + ex.getMessage(), ex);
        }
    }

}
