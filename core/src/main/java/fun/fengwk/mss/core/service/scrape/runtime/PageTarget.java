package fun.fengwk.mss.core.service.scrape.runtime;

/**
 * A clickable element found on the current page.
 *
 * @param kind  target kind
 * @param index position among the targets of the same kind, in document order
 * @param text  normalized visible text, may be empty
 * @param href  raw href attribute, null when absent
 * @author fengwk
 */
public record PageTarget(TargetKind kind, int index, String text, String href) {

    /**
     * Identity used to click every target at most once per page.
     */
    public String key() {
        return kind.getValue() + "|" + index + "|" + text;
    }

    public String describe() {
        return text == null || text.isEmpty()
            ? kind.getValue() + "#" + index
            : kind.getValue() + ": " + text;
    }

}
