package fun.fengwk.mss.cli.web.controller;

import fun.fengwk.mss.core.service.scrape.PageScrapeService;
import fun.fengwk.mss.core.service.scrape.model.ScrapeRequest;
import fun.fengwk.mss.core.service.scrape.model.ScrapeResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * Http surface of the section scraper.
 *
 * @author fengwk
 */
@Slf4j
@RestController
@RequiredArgsConstructor
public class ScrapeController {

    private final PageScrapeService pageScrapeService;

    @PostMapping("/scrape")
    public ResponseEntity<Map<String, ScrapeResult>> scrape(@RequestBody(required = false) ScrapeRequest request) {
        ScrapeResult result = pageScrapeService.scrape(request);
        return ResponseEntity.ok(Map.of("result", result));
    }

    @GetMapping("/healthz")
    public Map<String, String> healthz() {
        return Map.of("status", "ok");
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, String>> handleInvalidRequest(IllegalArgumentException ex) {
        log.warn("scrape request invalid, error={}", ex.getMessage());
        String message = ex.getMessage() == null ? "invalid request" : ex.getMessage();
        return ResponseEntity.badRequest().body(Map.of("error", message));
    }

}
