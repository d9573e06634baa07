package fun.fengwk.mss.core.service.scrape.parser;

import fun.fengwk.mss.core.service.scrape.model.SectionType;
import lombok.Builder;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * Section as found in the document, before size limits are applied.
 *
 * @author fengwk
 */
@Data
@Builder
public class SectionDraft {

    private SectionType type;
    private String label;
    private String sourceUrl;
    private String text;
    private String rawHtml;

    @Builder.Default
    private List<String> headings = new ArrayList<>();

    @Builder.Default
    private List<String> links = new ArrayList<>();

    @Builder.Default
    private List<String> images = new ArrayList<>();

    @Builder.Default
    private List<List<String>> lists = new ArrayList<>();

    @Builder.Default
    private List<List<List<String>>> tables = new ArrayList<>();

}
