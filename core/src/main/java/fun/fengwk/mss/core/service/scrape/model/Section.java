package fun.fengwk.mss.core.service.scrape.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * One size-limited content block of a scraped page.
 *
 * @author fengwk
 */
@Value
@Builder
public class Section {

    String id;
    SectionType type;
    String label;
    String sourceUrl;
    List<String> headings;
    String text;
    String rawHtml;
    boolean truncated;
    List<String> links;
    List<String> images;
    List<List<String>> lists;
    List<List<List<String>>> tables;

}
