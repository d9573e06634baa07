package fun.fengwk.mss.core.service.scrape.parser;

import fun.fengwk.mss.core.service.scrape.ScrapeProperties;
import fun.fengwk.mss.core.service.scrape.model.SectionType;
import lombok.RequiredArgsConstructor;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.Node;
import org.jsoup.nodes.TextNode;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Partitions a cleaned document into sections.
 *
 * <p>Tiers, first applicable wins:
 * <ol>
 *     <li>landmark elements (header, nav, main, section, footer, article);</li>
 *     <li>headings h1-h6, content up to the next heading belongs to the previous one;</li>
 *     <li>the whole body as a single section.</li>
 * </ol>
 * A main, section or article that wraps further landmarks is expanded into them. Its own content outside
 * those landmarks becomes one more section, placed where that content starts. Header, nav and footer are
 * always kept whole.
 *
 * @author fengwk
 */
@Component
@RequiredArgsConstructor
public class SectionSegmenter {

    public static final String DEFAULT_LABEL = "Section";

    static final String LANDMARK_SELECTOR = "header, nav, main, section, footer, article";

    static final String HEADING_SELECTOR = "h1, h2, h3, h4, h5, h6";

    private static final Set<String> LANDMARK_TAGS = Set.of("header", "nav", "main", "section", "footer", "article");

    private static final Set<String> EXPANDABLE_TAGS = Set.of("main", "section", "article");

    private static final Set<String> HEADING_TAGS = Set.of("h1", "h2", "h3", "h4", "h5", "h6");

    private static final Map<String, SectionType> TAG_TYPES = Map.of(
        "header", SectionType.NAV,
        "nav", SectionType.NAV,
        "footer", SectionType.FOOTER
    );

    static final List<MarkerRule<SectionType>> TYPE_HINT_RULES = List.of(
        new MarkerRule<>("hero", SectionType.HERO),
        new MarkerRule<>("faq", SectionType.FAQ),
        new MarkerRule<>("pricing", SectionType.PRICING)
    );

    private final ScrapeProperties scrapeProperties;

    public SegmentationResult segment(Document document, String sourceUrl) {
        Element body = document.body();
        if (body == null) {
            return new SegmentationResult(SegmentationTier.EMPTY, List.of());
        }

        List<LandmarkPiece> pieces = new ArrayList<>();
        collectLandmarks(body, pieces);
        if (!pieces.isEmpty()) {
            List<SectionDraft> sections = new ArrayList<>(pieces.size());
            for (LandmarkPiece piece : pieces) {
                if (piece.landmark != null) {
                    Element landmark = piece.landmark;
                    sections.add(buildSection(landmark, landmark.outerHtml(), classifyLandmark(landmark), sourceUrl));
                } else {
                    SectionDraft leftover = buildLeftoverSection(piece, sourceUrl);
                    if (leftover != null) {
                        sections.add(leftover);
                    }
                }
            }
            return new SegmentationResult(SegmentationTier.LANDMARK, sections);
        }

        if (!body.select(HEADING_SELECTOR).isEmpty()) {
            return new SegmentationResult(SegmentationTier.HEADING, segmentByHeadings(body, sourceUrl));
        }

        if (!hasContent(body)) {
            return new SegmentationResult(SegmentationTier.EMPTY, List.of());
        }
        SectionType bodyType = MarkerRule.firstMatch(TYPE_HINT_RULES, body);
        SectionDraft section = buildSection(body, body.outerHtml(), bodyType == null ? SectionType.UNKNOWN : bodyType, sourceUrl);
        // The body is an undelimited fallback region, its text does not caption it.
        section.setLabel(DEFAULT_LABEL);
        return new SegmentationResult(SegmentationTier.WHOLE_BODY, List.of(section));
    }

    private void collectLandmarks(Element parent, List<LandmarkPiece> out) {
        for (Element child : parent.children()) {
            if (!LANDMARK_TAGS.contains(child.normalName())) {
                collectLandmarks(child, out);
            } else if (EXPANDABLE_TAGS.contains(child.normalName()) && containsNestedLandmark(child)) {
                expandContainer(child, child, out, new LandmarkPiece[1]);
            } else {
                out.add(LandmarkPiece.of(child));
            }
        }
    }

    /**
     * Walks the child nodes of an expanded container. Nested landmarks are collected as usual, everything else
     * goes into a single leftover piece that is added to {@code out} on its first node.
     */
    private void expandContainer(Element container, Element parent, List<LandmarkPiece> out, LandmarkPiece[] leftover) {
        for (Node node : parent.childNodes()) {
            if (node instanceof Element element) {
                if (LANDMARK_TAGS.contains(element.normalName())) {
                    if (EXPANDABLE_TAGS.contains(element.normalName()) && containsNestedLandmark(element)) {
                        expandContainer(element, element, out, new LandmarkPiece[1]);
                    } else {
                        out.add(LandmarkPiece.of(element));
                    }
                } else if (!element.select(LANDMARK_SELECTOR).isEmpty()) {
                    expandContainer(container, element, out, leftover);
                } else {
                    addLeftover(container, element, out, leftover);
                }
            } else if (node instanceof TextNode textNode && !textNode.isBlank()) {
                addLeftover(container, textNode, out, leftover);
            }
        }
    }

    private void addLeftover(Element container, Node node, List<LandmarkPiece> out, LandmarkPiece[] leftover) {
        if (leftover[0] == null) {
            leftover[0] = LandmarkPiece.leftoverOf(container);
            out.add(leftover[0]);
        }
        leftover[0].nodes.add(node);
    }

    private SectionDraft buildLeftoverSection(LandmarkPiece piece, String sourceUrl) {
        Document shell = Document.createShell(sourceUrl == null ? "" : sourceUrl);
        Element region = shell.body().appendElement("div");
        StringBuilder rawHtml = new StringBuilder();
        for (Node node : piece.nodes) {
            rawHtml.append(node.outerHtml());
            region.appendChild(node.clone());
        }
        if (!hasContent(region)) {
            return null;
        }
        SectionType type = classifyLeftover(piece);
        if (type == null) {
            type = StringUtils.hasText(region.text()) ? SectionType.SECTION : SectionType.UNKNOWN;
        }
        return buildSection(region, rawHtml.toString(), type, sourceUrl);
    }

    private SectionType classifyLeftover(LandmarkPiece piece) {
        SectionType hinted = MarkerRule.firstMatch(TYPE_HINT_RULES, piece.container);
        if (hinted != null) {
            return hinted;
        }
        for (Node node : piece.nodes) {
            if (node instanceof Element element) {
                hinted = MarkerRule.firstMatch(TYPE_HINT_RULES, element);
                if (hinted != null) {
                    return hinted;
                }
            }
        }
        return null;
    }

    private boolean containsNestedLandmark(Element element) {
        for (Element candidate : element.select(LANDMARK_SELECTOR)) {
            if (candidate != element) {
                return true;
            }
        }
        return false;
    }

    private List<SectionDraft> segmentByHeadings(Element body, String sourceUrl) {
        List<HeadingBucket> buckets = new ArrayList<>();
        // Content before the first heading.
        buckets.add(new HeadingBucket(null));
        collectHeadingBuckets(body, buckets);

        List<SectionDraft> sections = new ArrayList<>();
        for (HeadingBucket bucket : buckets) {
            if (bucket.nodes.isEmpty()) {
                continue;
            }
            Document shell = Document.createShell(sourceUrl == null ? "" : sourceUrl);
            Element region = shell.body().appendElement("div");
            StringBuilder rawHtml = new StringBuilder();
            for (Node node : bucket.nodes) {
                rawHtml.append(node.outerHtml());
                region.appendChild(node.clone());
            }
            if (bucket.heading == null && !hasContent(region)) {
                continue;
            }
            SectionType type = classifyHeadingRegion(bucket.heading, region);
            sections.add(buildSection(region, rawHtml.toString(), type, sourceUrl));
        }
        return sections;
    }

    private void collectHeadingBuckets(Element parent, List<HeadingBucket> buckets) {
        for (Node node : parent.childNodes()) {
            if (node instanceof Element element) {
                if (HEADING_TAGS.contains(element.normalName())) {
                    HeadingBucket bucket = new HeadingBucket(element);
                    bucket.nodes.add(element);
                    buckets.add(bucket);
                } else if (!element.select(HEADING_SELECTOR).isEmpty()) {
                    collectHeadingBuckets(element, buckets);
                } else {
                    buckets.get(buckets.size() - 1).nodes.add(element);
                }
            } else if (node instanceof TextNode textNode && !textNode.isBlank()) {
                buckets.get(buckets.size() - 1).nodes.add(textNode);
            }
        }
    }

    private SectionType classifyLandmark(Element landmark) {
        SectionType tagType = TAG_TYPES.get(landmark.normalName());
        if (tagType != null) {
            return tagType;
        }
        return classifyByHintOrText(landmark, landmark);
    }

    private SectionType classifyHeadingRegion(Element heading, Element region) {
        if (heading != null) {
            SectionType hinted = MarkerRule.firstMatch(TYPE_HINT_RULES, heading);
            if (hinted == null && heading.parent() != null && !"body".equals(heading.parent().normalName())) {
                hinted = MarkerRule.firstMatch(TYPE_HINT_RULES, heading.parent());
            }
            if (hinted != null) {
                return hinted;
            }
        }
        return classifyByHintOrText(region, region);
    }

    private SectionType classifyByHintOrText(Element hintSource, Element content) {
        SectionType hinted = MarkerRule.firstMatch(TYPE_HINT_RULES, hintSource);
        if (hinted != null) {
            return hinted;
        }
        return StringUtils.hasText(content.text()) ? SectionType.SECTION : SectionType.UNKNOWN;
    }

    private SectionDraft buildSection(Element root, String rawHtml, SectionType type, String sourceUrl) {
        List<String> headings = extractHeadings(root);
        String text = root.text();
        return SectionDraft.builder()
            .type(type)
            .label(deriveLabel(headings, text))
            .sourceUrl(sourceUrl)
            .text(text)
            .rawHtml(rawHtml)
            .headings(headings)
            .links(extractLinks(root))
            .images(extractImages(root))
            .lists(extractLists(root))
            .tables(extractTables(root))
            .build();
    }

    private String deriveLabel(List<String> headings, String text) {
        if (!headings.isEmpty()) {
            return headings.get(0);
        }
        if (!StringUtils.hasText(text)) {
            return DEFAULT_LABEL;
        }
        String[] words = text.trim().split("\\s+");
        int wordCount = Math.min(words.length, Math.max(1, scrapeProperties.getLabelWordCount()));
        return String.join(" ", List.of(words).subList(0, wordCount));
    }

    private List<String> extractHeadings(Element root) {
        List<String> headings = new ArrayList<>();
        for (Element heading : root.select(HEADING_SELECTOR)) {
            String text = heading.text();
            if (StringUtils.hasText(text)) {
                headings.add(text);
            }
        }
        return headings;
    }

    private List<String> extractLinks(Element root) {
        Set<String> links = new LinkedHashSet<>();
        for (Element anchor : root.select("a[href]")) {
            String href = anchor.absUrl("href");
            if (isHttpUrl(href)) {
                links.add(href);
            }
        }
        return new ArrayList<>(links);
    }

    private List<String> extractImages(Element root) {
        Set<String> images = new LinkedHashSet<>();
        for (Element image : root.select("img[src], img[data-src]")) {
            String src = image.absUrl("src");
            if (!isHttpUrl(src)) {
                // Lazy-loaded images keep a placeholder or nothing in src.
                src = image.absUrl("data-src");
            }
            if (isHttpUrl(src)) {
                images.add(src);
            }
        }
        return new ArrayList<>(images);
    }

    private List<List<String>> extractLists(Element root) {
        List<List<String>> lists = new ArrayList<>();
        for (Element list : root.select("ul, ol")) {
            List<String> items = new ArrayList<>();
            for (Element item : list.children()) {
                if ("li".equals(item.normalName()) && StringUtils.hasText(item.text())) {
                    items.add(item.text());
                }
            }
            if (!items.isEmpty()) {
                lists.add(items);
            }
        }
        return lists;
    }

    private List<List<List<String>>> extractTables(Element root) {
        List<List<List<String>>> tables = new ArrayList<>();
        for (Element table : root.select("table")) {
            List<List<String>> rows = new ArrayList<>();
            for (Element row : table.select("tr")) {
                List<String> cells = new ArrayList<>();
                for (Element cell : row.children()) {
                    if ("td".equals(cell.normalName()) || "th".equals(cell.normalName())) {
                        cells.add(cell.text());
                    }
                }
                if (!cells.isEmpty()) {
                    rows.add(cells);
                }
            }
            if (!rows.isEmpty()) {
                tables.add(rows);
            }
        }
        return tables;
    }

    private boolean hasContent(Element element) {
        return StringUtils.hasText(element.text()) || !element.select("img, a[href]").isEmpty();
    }

    private boolean isHttpUrl(String url) {
        if (!StringUtils.hasText(url)) {
            return false;
        }
        String lowerCase = url.toLowerCase(Locale.ROOT);
        return lowerCase.startsWith("http://") || lowerCase.startsWith("https://");
    }

    private static class LandmarkPiece {

        private final Element landmark;
        private final Element container;
        private final List<Node> nodes = new ArrayList<>();

        private LandmarkPiece(Element landmark, Element container) {
            this.landmark = landmark;
            this.container = container;
        }

        private static LandmarkPiece of(Element landmark) {
            return new LandmarkPiece(landmark, null);
        }

        private static LandmarkPiece leftoverOf(Element container) {
            return new LandmarkPiece(null, container);
        }

    }

    private static class HeadingBucket {

        private final Element heading;
        private final List<Node> nodes = new ArrayList<>();

        private HeadingBucket(Element heading) {
            this.heading = heading;
        }

    }

}
