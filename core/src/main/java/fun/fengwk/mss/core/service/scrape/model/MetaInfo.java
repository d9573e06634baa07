package fun.fengwk.mss.core.service.scrape.model;

import lombok.Builder;
import lombok.Value;

/**
 * Document level metadata.
 *
 * @author fengwk
 */
@Value
@Builder
public class MetaInfo {

    public static final String DEFAULT_LANGUAGE = "en";

    @Builder.Default
    String title = "";

    @Builder.Default
    String description = "";

    @Builder.Default
    String language = DEFAULT_LANGUAGE;

    /**
     * Absolute canonical url, null when the page declares none.
     */
    String canonical;

    public static MetaInfo empty() {
        return MetaInfo.builder().build();
    }

}
