package fun.fengwk.mss.core.service.scrape.parser;

import fun.fengwk.mss.core.service.scrape.model.MetaInfo;
import fun.fengwk.mss.core.service.scrape.support.ScrapeUrlUtils;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.util.Locale;

/**
 * Reads title, description, language and canonical url, preferring Open Graph tags.
 *
 * @author fengwk
 */
@Component
public class MetaExtractor {

    public MetaInfo extract(Document document, String pageUrl) {
        String title = firstNonBlank(
            metaContent(document, "meta[property=og:title]"),
            document.title()
        );
        String description = firstNonBlank(
            metaContent(document, "meta[property=og:description]"),
            metaContent(document, "meta[name=description]")
        );
        String canonical = firstNonBlank(
            attr(document.selectFirst("link[rel=canonical][href]"), "href"),
            metaContent(document, "meta[property=og:url]")
        );

        return MetaInfo.builder()
            .title(title)
            .description(description)
            .language(resolveLanguage(document))
            .canonical(StringUtils.hasText(canonical) ? ScrapeUrlUtils.toAbsolute(pageUrl, canonical) : null)
            .build();
    }

    private String resolveLanguage(Document document) {
        Element html = document.selectFirst("html");
        String lang = html == null ? "" : html.attr("lang").trim();
        if (lang.length() < 2) {
            return MetaInfo.DEFAULT_LANGUAGE;
        }
        return lang.substring(0, 2).toLowerCase(Locale.ROOT);
    }

    private String metaContent(Document document, String selector) {
        return attr(document.selectFirst(selector), "content");
    }

    private String attr(Element element, String name) {
        return element == null ? "" : element.attr(name).trim();
    }

    private String firstNonBlank(String... values) {
        for (String value : values) {
            if (StringUtils.hasText(value)) {
                return value.trim();
            }
        }
        return "";
    }

}
