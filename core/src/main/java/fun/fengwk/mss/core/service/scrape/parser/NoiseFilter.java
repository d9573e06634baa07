package fun.fengwk.mss.core.service.scrape.parser;

import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Prunes non-content nodes from a document before segmentation.
 *
 * @author fengwk
 */
@Component
public class NoiseFilter {

    private static final String ALWAYS_REMOVED = "script, style, noscript, template";

    private static final Set<String> PROTECTED_TAGS = Set.of("html", "head", "body");

    static final List<MarkerRule<NoiseCategory>> NOISE_RULES = List.of(
        new MarkerRule<>("cookie", NoiseCategory.COOKIE_NOTICE),
        new MarkerRule<>("modal", NoiseCategory.MODAL),
        new MarkerRule<>("popup", NoiseCategory.POPUP),
        new MarkerRule<>("overlay", NoiseCategory.OVERLAY),
        new MarkerRule<>("banner", NoiseCategory.BANNER)
    );

    /**
     * Returns a cleaned copy, the input document is left untouched.
     */
    public Document filter(Document document) {
        Document cleaned = document.clone();
        cleaned.select(ALWAYS_REMOVED).remove();

        List<Element> noise = new ArrayList<>();
        for (Element element : cleaned.select("[class], [id]")) {
            if (PROTECTED_TAGS.contains(element.normalName())) {
                continue;
            }
            if (classify(element) != null) {
                noise.add(element);
            }
        }
        for (Element element : noise) {
            // Descendants of an already removed element are detached together with it.
            if (element.parent() != null) {
                element.remove();
            }
        }
        return cleaned;
    }

    /**
     * @return noise category of the element, null when it is content
     */
    public NoiseCategory classify(Element element) {
        return MarkerRule.firstMatch(NOISE_RULES, element);
    }

    public enum NoiseCategory {

        COOKIE_NOTICE,
        MODAL,
        POPUP,
        OVERLAY,
        BANNER

    }

}
