package fun.fengwk.mss.core.service.scrape.parser;

import fun.fengwk.mss.core.service.scrape.ScrapeProperties;
import fun.fengwk.mss.core.service.scrape.model.Section;
import fun.fengwk.mss.core.service.scrape.model.SectionType;
import fun.fengwk.mss.core.service.scrape.support.ScrapeUrlUtils;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Applies per-section size caps. Sequences keep their first entries in discovery order.
 *
 * @author fengwk
 */
@Component
@RequiredArgsConstructor
public class ContentLimiter {

    public static final String TRUNCATION_MARKER = "...";

    private final ScrapeProperties scrapeProperties;

    public Section limit(SectionDraft draft, int index) {
        SectionType type = draft.getType() == null ? SectionType.UNKNOWN : draft.getType();
        String rawHtml = draft.getRawHtml() == null ? "" : draft.getRawHtml();
        int maxRawHtmlLength = Math.max(0, scrapeProperties.getMaxRawHtmlLength());
        boolean truncated = rawHtml.length() > maxRawHtmlLength;
        if (truncated) {
            rawHtml = rawHtml.substring(0, maxRawHtmlLength) + TRUNCATION_MARKER;
        }

        String label = StringUtils.hasText(draft.getLabel()) ? draft.getLabel().trim() : SectionSegmenter.DEFAULT_LABEL;

        return Section.builder()
            .id(type.getValue() + "-" + index)
            .type(type)
            .label(cut(label, scrapeProperties.getMaxLabelLength()))
            .sourceUrl(draft.getSourceUrl())
            .headings(first(draft.getHeadings(), scrapeProperties.getMaxHeadings()))
            .text(cut(draft.getText() == null ? "" : draft.getText(), scrapeProperties.getMaxTextLength()))
            .rawHtml(rawHtml)
            .truncated(truncated)
            .links(first(absolutize(draft.getLinks(), draft.getSourceUrl()), scrapeProperties.getMaxLinks()))
            .images(first(absolutize(draft.getImages(), draft.getSourceUrl()), scrapeProperties.getMaxImages()))
            .lists(copyLists(first(draft.getLists(), scrapeProperties.getMaxLists())))
            .tables(copyTables(first(draft.getTables(), scrapeProperties.getMaxTables())))
            .build();
    }

    private List<String> absolutize(List<String> urls, String baseUrl) {
        if (urls == null || urls.isEmpty()) {
            return List.of();
        }
        Set<String> resolved = new LinkedHashSet<>();
        for (String url : urls) {
            String absolute = ScrapeUrlUtils.toAbsolute(baseUrl, url);
            if (absolute != null) {
                resolved.add(absolute);
            }
        }
        return new ArrayList<>(resolved);
    }

    private <T> List<T> first(List<T> values, int max) {
        if (values == null || values.isEmpty()) {
            return List.of();
        }
        int limit = Math.max(0, max);
        return List.copyOf(values.size() <= limit ? values : values.subList(0, limit));
    }

    private List<List<String>> copyLists(List<List<String>> lists) {
        List<List<String>> copies = new ArrayList<>(lists.size());
        for (List<String> items : lists) {
            copies.add(items == null ? List.of() : List.copyOf(items));
        }
        return List.copyOf(copies);
    }

    private List<List<List<String>>> copyTables(List<List<List<String>>> tables) {
        List<List<List<String>>> copies = new ArrayList<>(tables.size());
        for (List<List<String>> rows : tables) {
            copies.add(rows == null ? List.of() : copyLists(rows));
        }
        return List.copyOf(copies);
    }

    private String cut(String value, int max) {
        int limit = Math.max(0, max);
        return value.length() <= limit ? value : value.substring(0, limit);
    }

}
