package fun.fengwk.mss.core.service.scrape.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Pipeline stage an error originated from.
 *
 * @author fengwk
 */
public enum ScrapeStage {

    FETCH("fetch"),
    RENDER("render"),
    INTERACTION("interaction"),
    PARSE("parse");

    private final String value;

    ScrapeStage(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

}
