package fun.fengwk.mss.core.service.scrape.parser;

import org.jsoup.nodes.Element;

import java.util.List;
import java.util.Locale;

/**
 * Case-insensitive substring rule over an element's class and id.
 *
 * @param pattern  lower-case substring to look for
 * @param category value the rule maps a matching element to
 * @param <C>      category type
 * @author fengwk
 */
public record MarkerRule<C>(String pattern, C category) {

    public boolean matches(String marker) {
        return marker != null && marker.contains(pattern);
    }

    /**
     * First matching category of {@code rules} in table order, or null.
     */
    public static <C> C firstMatch(List<MarkerRule<C>> rules, Element element) {
        if (element == null) {
            return null;
        }
        String marker = buildMarker(element);
        if (marker.isBlank()) {
            return null;
        }
        for (MarkerRule<C> rule : rules) {
            if (rule.matches(marker)) {
                return rule.category();
            }
        }
        return null;
    }

    static String buildMarker(Element element) {
        return (element.className() + " " + element.id()).toLowerCase(Locale.ROOT);
    }

}
