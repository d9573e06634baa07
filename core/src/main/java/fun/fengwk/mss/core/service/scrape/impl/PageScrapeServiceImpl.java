package fun.fengwk.mss.core.service.scrape.impl;

import fun.fengwk.mss.core.service.scrape.PageScrapeService;
import fun.fengwk.mss.core.service.scrape.assemble.ResultAssembler;
import fun.fengwk.mss.core.service.scrape.decision.FallbackDecider;
import fun.fengwk.mss.core.service.scrape.decision.FallbackDecision;
import fun.fengwk.mss.core.service.scrape.error.ParseException;
import fun.fengwk.mss.core.service.scrape.fetch.StaticFetcher;
import fun.fengwk.mss.core.service.scrape.model.InteractionSummary;
import fun.fengwk.mss.core.service.scrape.model.MetaInfo;
import fun.fengwk.mss.core.service.scrape.model.PageSnapshot;
import fun.fengwk.mss.core.service.scrape.model.ScrapeRequest;
import fun.fengwk.mss.core.service.scrape.model.ScrapeResult;
import fun.fengwk.mss.core.service.scrape.model.ScrapeStage;
import fun.fengwk.mss.core.service.scrape.model.Section;
import fun.fengwk.mss.core.service.scrape.parser.ContentLimiter;
import fun.fengwk.mss.core.service.scrape.parser.MetaExtractor;
import fun.fengwk.mss.core.service.scrape.parser.NoiseFilter;
import fun.fengwk.mss.core.service.scrape.parser.SectionDraft;
import fun.fengwk.mss.core.service.scrape.parser.SectionSegmenter;
import fun.fengwk.mss.core.service.scrape.parser.SegmentationResult;
import fun.fengwk.mss.core.service.scrape.runtime.RenderEngine;
import fun.fengwk.mss.core.service.scrape.runtime.RenderOutcome;
import fun.fengwk.mss.core.service.scrape.support.ErrorCollector;
import fun.fengwk.mss.core.service.scrape.support.ScrapeUrlUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Scrape pipeline: static fetch, fallback decision, optional render and crawl, then extraction.
 *
 * @author fengwk
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PageScrapeServiceImpl implements PageScrapeService {

    private final StaticFetcher staticFetcher;
    private final FallbackDecider fallbackDecider;
    private final RenderEngine renderEngine;
    private final MetaExtractor metaExtractor;
    private final NoiseFilter noiseFilter;
    private final SectionSegmenter sectionSegmenter;
    private final ContentLimiter contentLimiter;
    private final ResultAssembler resultAssembler;

    @Override
    public ScrapeResult scrape(ScrapeRequest request) {
        long startAt = System.currentTimeMillis();
        String url = validateRequest(request);
        ErrorCollector errorCollector = new ErrorCollector(url);

        PageSnapshot staticSnapshot = staticFetcher.fetch(url);
        errorCollector.addAll(staticSnapshot.getIssues());
        Extraction staticExtraction = staticSnapshot.isSuccess() ? extract(staticSnapshot, errorCollector) : null;

        FallbackDecision decision = fallbackDecider.decide(
            staticSnapshot,
            staticExtraction == null ? null : staticExtraction.cleanedDocument(),
            staticExtraction == null ? null : staticExtraction.segmentation()
        );

        MetaInfo meta = staticExtraction == null ? null : staticExtraction.meta();
        List<SectionDraft> drafts = staticExtraction == null ? List.of() : staticExtraction.segmentation().sections();
        InteractionSummary interactions = InteractionSummary.empty();

        if (decision.renderRequired()) {
            RenderOutcome rendered = renderEngine.render(url);
            if (rendered == null) {
                errorCollector.record(ScrapeStage.RENDER, "render produced no outcome");
            } else {
                errorCollector.addAll(rendered.getIssues());
                interactions = rendered.getInteractions();

                MetaInfo renderedMeta = null;
                List<SectionDraft> renderedDrafts = new ArrayList<>();
                for (PageSnapshot capture : rendered.getCaptures()) {
                    if (capture == null || !capture.isSuccess()) {
                        continue;
                    }
                    Extraction extraction = extract(capture, errorCollector);
                    if (extraction == null) {
                        continue;
                    }
                    if (renderedMeta == null) {
                        renderedMeta = extraction.meta();
                    }
                    renderedDrafts.addAll(extraction.segmentation().sections());
                }

                if (renderedMeta != null) {
                    meta = renderedMeta;
                }
                // Static sections stay when the rendered pages produced nothing better.
                if (!renderedDrafts.isEmpty()) {
                    drafts = renderedDrafts;
                }
            }
        }

        List<Section> sections = new ArrayList<>(drafts.size());
        for (int i = 0; i < drafts.size(); i++) {
            sections.add(contentLimiter.limit(drafts.get(i), i));
        }

        ScrapeResult result = resultAssembler.assemble(url, meta, sections, interactions, errorCollector);
        log.info("scrape done, url={}, rendered={}, sections={}, errors={}, elapsedMs={}",
            url,
            decision.renderRequired(),
            result.getSections().size(),
            result.getErrors().size(),
            System.currentTimeMillis() - startAt);
        return result;
    }

    private String validateRequest(ScrapeRequest request) {
        if (request == null) {
            throw new IllegalArgumentException("request is null");
        }
        if (!StringUtils.hasText(request.getUrl())) {
            throw new IllegalArgumentException("url is blank");
        }
        String normalizedUrl = request.getUrl().trim();

        String lowerCaseUrl = normalizedUrl.toLowerCase(Locale.ROOT);
        if (!lowerCaseUrl.startsWith("http://") && !lowerCaseUrl.startsWith("https://")) {
            throw new IllegalArgumentException("unsupported url protocol");
        }
        if (!ScrapeUrlUtils.isAbsoluteHttpUrl(normalizedUrl)) {
            throw new IllegalArgumentException("url is not a valid absolute url");
        }
        return normalizedUrl;
    }

    private Extraction extract(PageSnapshot snapshot, ErrorCollector errorCollector) {
        try {
            Document document = Jsoup.parse(snapshot.getHtml(), snapshot.getUrl());
            MetaInfo meta = metaExtractor.extract(document, snapshot.getUrl());
            Document cleaned = noiseFilter.filter(document);
            SegmentationResult segmentation = sectionSegmenter.segment(cleaned, snapshot.getUrl());
            return new Extraction(meta, cleaned, segmentation);
        } catch (ParseException ex) {
            errorCollector.record(ex);
            return null;
        } catch (RuntimeException ex) {
            log.debug("extraction failed, url={}", snapshot.getUrl(), ex);
            errorCollector.record(new ParseException("parse failed: " + ex.getMessage(), ex));
            return null;
        }
    }

    private record Extraction(MetaInfo meta, Document cleanedDocument, SegmentationResult segmentation) {
    }

}
