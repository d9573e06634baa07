package fun.fengwk.mss.core.service.scrape.runtime;

import fun.fengwk.mss.core.service.scrape.error.InteractionException;

import java.util.List;

/**
 * Live page handle driven by the interactive crawl.
 *
 * <p>Every operation is bounded by a timeout. Failures are reported as {@link InteractionException}.
 *
 * @author fengwk
 */
public interface PageDriver {

    /**
     * Current page url.
     */
    String url();

    /**
     * Current serialized DOM.
     */
    String content();

    /**
     * Visible targets of the given kind in document order.
     */
    List<PageTarget> findTargets(TargetKind kind);

    void click(PageTarget target);

    void scrollToBottom();

    long scrollHeight();

    void navigate(String url);

    void pause(long millis);

    /**
     * Wait for content to settle, never longer than {@code maxWaitMs}.
     */
    void awaitSettled(long maxWaitMs);

}
