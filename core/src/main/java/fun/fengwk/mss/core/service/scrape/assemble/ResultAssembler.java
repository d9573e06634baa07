package fun.fengwk.mss.core.service.scrape.assemble;

import fun.fengwk.mss.core.service.scrape.model.InteractionSummary;
import fun.fengwk.mss.core.service.scrape.model.MetaInfo;
import fun.fengwk.mss.core.service.scrape.model.ScrapeResult;
import fun.fengwk.mss.core.service.scrape.model.Section;
import fun.fengwk.mss.core.service.scrape.support.ErrorCollector;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Merges meta info, sections and collected errors into the final result. Never fails.
 *
 * @author fengwk
 */
@Component
public class ResultAssembler {

    private final Clock clock;

    public ResultAssembler() {
        this(Clock.systemUTC());
    }

    ResultAssembler(Clock clock) {
        this.clock = clock;
    }

    public ScrapeResult assemble(
        String url,
        MetaInfo meta,
        List<Section> sections,
        InteractionSummary interactions,
        ErrorCollector errorCollector
    ) {
        return ScrapeResult.builder()
            .url(url == null ? "" : url)
            .scrapedAt(Instant.now(clock).toString())
            .meta(meta == null ? MetaInfo.empty() : meta)
            .sections(sections == null ? List.of() : sections.stream().filter(Objects::nonNull).toList())
            .interactions(interactions == null ? InteractionSummary.empty() : interactions)
            .errors(errorCollector == null ? List.of() : errorCollector.getRecords())
            .build();
    }

}
