package fun.fengwk.mss.core.service.scrape.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Semantic classification of an extracted section.
 *
 * @author fengwk
 */
public enum SectionType {

    NAV("nav"),
    HEADER("header"),
    FOOTER("footer"),
    HERO("hero"),
    FAQ("faq"),
    PRICING("pricing"),
    SECTION("section"),
    UNKNOWN("unknown");

    private final String value;

    SectionType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

}
