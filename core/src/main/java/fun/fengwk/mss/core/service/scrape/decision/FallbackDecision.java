package fun.fengwk.mss.core.service.scrape.decision;

/**
 * Result of inspecting the static fetch.
 *
 * @param renderRequired  whether the page must be rendered in a browser
 * @param reason          first rule that decided
 * @param staticTextLength total section text length of the static page
 * @author fengwk
 */
public record FallbackDecision(boolean renderRequired, FallbackReason reason, int staticTextLength) {

}
