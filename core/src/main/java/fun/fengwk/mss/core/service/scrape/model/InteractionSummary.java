package fun.fengwk.mss.core.service.scrape.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * What the interactive crawl did on the rendered page.
 *
 * @author fengwk
 */
@Value
@Builder
public class InteractionSummary {

    @Builder.Default
    List<String> clicks = List.of();

    int scrolls;

    @Builder.Default
    List<String> pages = List.of();

    public static InteractionSummary empty() {
        return InteractionSummary.builder().build();
    }

}
