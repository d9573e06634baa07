package fun.fengwk.mss.core.service.scrape.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Final, immutable outcome of one scrape request.
 *
 * <p>An empty {@code sections} list together with a non-empty {@code errors} list signals total failure,
 * populated sections with errors signal partial success.
 *
 * @author fengwk
 */
@Value
@Builder
public class ScrapeResult {

    String url;
    String scrapedAt;
    MetaInfo meta;
    List<Section> sections;
    InteractionSummary interactions;
    List<ErrorRecord> errors;

}
