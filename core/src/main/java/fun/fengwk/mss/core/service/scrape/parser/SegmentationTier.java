package fun.fengwk.mss.core.service.scrape.parser;

/**
 * Segmentation strategy that produced a page's sections, in priority order.
 *
 * @author fengwk
 */
public enum SegmentationTier {

    LANDMARK,
    HEADING,
    WHOLE_BODY,
    EMPTY

}
