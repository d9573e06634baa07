package fun.fengwk.mss.core.service.scrape.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Scrape request model.
 *
 * @author fengwk
 */
@Value
@Builder
@Jacksonized
public class ScrapeRequest {

    String url;

}
