package fun.fengwk.mss.core.service.scrape.runtime;

import java.util.regex.Pattern;

/**
 * Kinds of page elements the interactive crawl acts on.
 *
 * <p>An element is a target when it matches {@link #getSelector()}, or when it matches
 * {@link #getTextSelector()} and its visible text matches {@link #getTextPattern()}.
 * Selectors stay within the css subset understood by both jsoup and the browser.
 *
 * @author fengwk
 */
public enum TargetKind {

    TAB(
        "tab",
        "[role=tab], [data-toggle=tab], [data-bs-toggle=tab], .tab, .tabs > li, [class*=tab-item], [class*=tab-button]",
        null,
        null
    ),

    LOAD_MORE(
        "load-more",
        "[class*=load-more], [class*=loadmore], [class*=show-more], [class*=showmore]",
        "button, a, [role=button]",
        Pattern.compile("\\b(load|show)\\s+more\\b", Pattern.CASE_INSENSITIVE)
    ),

    NEXT_PAGE(
        "next-page",
        "a[rel=next], a[class*=next], a[aria-label*=Next], a[aria-label*=next]",
        "a",
        Pattern.compile("^\\s*(next(\\s+page)?\\s*[›»>]?|[›»])\\s*$", Pattern.CASE_INSENSITIVE)
    ),
    ;

    private final String value;
    private final String selector;
    private final String textSelector;
    private final Pattern textPattern;

    TargetKind(String value, String selector, String textSelector, Pattern textPattern) {
        this.value = value;
        this.selector = selector;
        this.textSelector = textSelector;
        this.textPattern = textPattern;
    }

    public String getValue() {
        return value;
    }

    public String getSelector() {
        return selector;
    }

    public String getTextSelector() {
        return textSelector;
    }

    public Pattern getTextPattern() {
        return textPattern;
    }

    public boolean hasTextRule() {
        return textSelector != null && textPattern != null;
    }

    public boolean matchesText(String text) {
        return hasTextRule() && text != null && textPattern.matcher(text).find();
    }

}
