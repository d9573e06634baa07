package fun.fengwk.mss.core.service.scrape.parser;

import java.util.List;

/**
 * Sections of one page together with the tier that produced them.
 *
 * @author fengwk
 */
public record SegmentationResult(SegmentationTier tier, List<SectionDraft> sections) {

    public int totalTextLength() {
        int total = 0;
        for (SectionDraft section : sections) {
            total += section.getText() == null ? 0 : section.getText().length();
        }
        return total;
    }

}
