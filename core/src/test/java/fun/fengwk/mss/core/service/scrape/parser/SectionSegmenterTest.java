package fun.fengwk.mss.core.service.scrape.parser;

import fun.fengwk.mss.core.service.scrape.ScrapeProperties;
import fun.fengwk.mss.core.service.scrape.model.SectionType;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * @author fengwk
 */
public class SectionSegmenterTest {

    private static final String PAGE_URL = "https://example.com/docs/page";

    private final SectionSegmenter segmenter = new SectionSegmenter(new ScrapeProperties());

    @Test
    public void shouldSplitOnLandmarks() {
        SegmentationResult result = segment("""
            <body>
              <section><h2>Alpha</h2><p>first</p></section>
              <section><h2>Beta</h2><p>second</p></section>
              <section><h2>Gamma</h2><p>third</p></section>
            </body>
            """);

        assertThat(result.tier()).isEqualTo(SegmentationTier.LANDMARK);
        assertThat(result.sections()).extracting(SectionDraft::getLabel).containsExactly("Alpha", "Beta", "Gamma");
        assertThat(result.sections()).extracting(SectionDraft::getType).containsOnly(SectionType.SECTION);
        assertThat(result.sections().get(0).getText()).isEqualTo("Alpha first");
        assertThat(result.sections().get(0).getRawHtml()).startsWith("<section>");
        assertThat(result.sections().get(0).getSourceUrl()).isEqualTo(PAGE_URL);
    }

    @Test
    public void shouldTypeLandmarksByTag() {
        SegmentationResult result = segment("""
            <body>
              <header><a href="/">Home</a></header>
              <nav><a href="/docs">Docs</a></nav>
              <article><p>Body text</p></article>
              <footer><p>Copyright</p></footer>
            </body>
            """);

        assertThat(result.sections()).extracting(SectionDraft::getType)
            .containsExactly(SectionType.NAV, SectionType.NAV, SectionType.SECTION, SectionType.FOOTER);
    }

    @Test
    public void shouldExpandContainerLandmarksIntoNestedOnes() {
        SegmentationResult result = segment("""
            <body>
              <main>
                <section><h2>One</h2></section>
                <section><h2>Two</h2></section>
              </main>
              <footer>bye</footer>
            </body>
            """);

        assertThat(result.sections()).extracting(SectionDraft::getLabel).containsExactly("One", "Two", "bye");
    }

    @Test
    public void shouldKeepContainerContentOutsideNestedLandmarks() {
        SegmentationResult result = segment("""
            <body>
              <main>
                <div class="hero"><h1>Welcome Hero</h1><p>intro copy</p></div>
                <section><h2>A</h2><p>alpha</p></section>
                <p>between</p>
                <section><h2>B</h2><p>beta</p></section>
              </main>
            </body>
            """);

        assertThat(result.tier()).isEqualTo(SegmentationTier.LANDMARK);
        assertThat(result.sections()).extracting(SectionDraft::getLabel).containsExactly("Welcome Hero", "A", "B");
        SectionDraft hero = result.sections().get(0);
        assertThat(hero.getType()).isEqualTo(SectionType.HERO);
        assertThat(hero.getText()).isEqualTo("Welcome Hero intro copy between");
        assertThat(hero.getRawHtml()).startsWith("<div class=\"hero\">").doesNotContain("alpha");
        assertThat(result.sections().get(1).getText()).isEqualTo("A alpha");
    }

    @Test
    public void shouldKeepLeadingTextOfExpandedSection() {
        SegmentationResult result = segment("""
            <body>
              <section>
                plain lead
                <div><article><p>inner story</p></article></div>
              </section>
            </body>
            """);

        assertThat(result.sections()).extracting(SectionDraft::getText).containsExactly("plain lead", "inner story");
        assertThat(result.sections()).extracting(SectionDraft::getType).containsOnly(SectionType.SECTION);
    }

    @Test
    public void shouldTypeByClassHint() {
        SegmentationResult result = segment("""
            <body>
              <section class="Hero-Block"><h1>Welcome</h1></section>
              <section id="faq"><h2>Questions</h2></section>
              <section class="pricing-table"><h2>Plans</h2></section>
              <section></section>
            </body>
            """);

        assertThat(result.sections()).extracting(SectionDraft::getType)
            .containsExactly(SectionType.HERO, SectionType.FAQ, SectionType.PRICING, SectionType.UNKNOWN);
        assertThat(result.sections().get(3).getLabel()).isEqualTo(SectionSegmenter.DEFAULT_LABEL);
    }

    @Test
    public void shouldLabelWithLeadingWordsWhenNoHeading() {
        SegmentationResult result = segment("<body><section><p>one two three four five six seven eight nine</p></section></body>");

        assertThat(result.sections().get(0).getLabel()).isEqualTo("one two three four five six seven");
    }

    @Test
    public void shouldSplitAtHeadingsWithoutLandmarks() {
        SegmentationResult result = segment("""
            <body>
              <p>intro words</p>
              <h2>First</h2><p>one</p>
              <div class="pricing"><h2>Plans</h2><p>cheap</p></div>
              <h3>Second</h3><p>two</p><p>more</p>
            </body>
            """);

        assertThat(result.tier()).isEqualTo(SegmentationTier.HEADING);
        assertThat(result.sections()).extracting(SectionDraft::getLabel)
            .containsExactly("intro words", "First", "Plans", "Second");
        assertThat(result.sections()).extracting(SectionDraft::getType)
            .containsExactly(SectionType.SECTION, SectionType.SECTION, SectionType.PRICING, SectionType.SECTION);
        assertThat(result.sections().get(3).getText()).isEqualTo("Second two more");
        assertThat(result.sections().get(3).getRawHtml())
            .startsWith("<h3>Second</h3>")
            .contains("<p>two</p>", "<p>more</p>")
            .doesNotContain("First");
    }

    @Test
    public void shouldFallBackToWholeBody() {
        String text = "word ".repeat(40).trim();

        SegmentationResult result = segment("<body><div><p>" + text + "</p></div></body>");

        assertThat(result.tier()).isEqualTo(SegmentationTier.WHOLE_BODY);
        assertThat(result.sections()).hasSize(1);
        SectionDraft section = result.sections().get(0);
        assertThat(section.getType()).isEqualTo(SectionType.UNKNOWN);
        assertThat(section.getLabel()).isEqualTo("Section");
        assertThat(section.getText()).isEqualTo(text);
    }

    @Test
    public void shouldProduceNothingForEmptyBody() {
        SegmentationResult result = segment("<body>   </body>");

        assertThat(result.tier()).isEqualTo(SegmentationTier.EMPTY);
        assertThat(result.sections()).isEmpty();
    }

    @Test
    public void shouldExtractAbsoluteLinksAndImages() {
        SegmentationResult result = segment("""
            <body><section>
              <a href="/a">A</a><a href="/a">A again</a><a href="mailto:x@example.com">mail</a><a href="b">B</a>
              <img src="/logo.png"><img src="data:image/png;base64,AAAA" data-src="/lazy.png"><img data-src="https://cdn.example.com/c.png">
            </section></body>
            """);

        SectionDraft section = result.sections().get(0);
        assertThat(section.getLinks()).containsExactly("https://example.com/a", "https://example.com/docs/b");
        assertThat(section.getImages()).containsExactly(
            "https://example.com/logo.png",
            "https://example.com/lazy.png",
            "https://cdn.example.com/c.png"
        );
    }

    @Test
    public void shouldExtractListsAndTables() {
        SegmentationResult result = segment("""
            <body><section>
              <ul><li>red</li><li>green</li></ul>
              <ol><li>first</li></ol>
              <table><tr><th>Plan</th><th>Price</th></tr><tr><td>Basic</td><td>$5</td></tr></table>
            </section></body>
            """);

        SectionDraft section = result.sections().get(0);
        assertThat(section.getLists()).containsExactly(List.of("red", "green"), List.of("first"));
        assertThat(section.getTables()).containsExactly(List.of(List.of("Plan", "Price"), List.of("Basic", "$5")));
    }

    private SegmentationResult segment(String html) {
        Document document = Jsoup.parse(html, PAGE_URL);
        return segmenter.segment(document, PAGE_URL);
    }

}
