package fun.fengwk.mss.core.service.scrape.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Raw html of one page as produced by the static fetcher or the browser.
 *
 * @author fengwk
 */
@Value
@Builder
public class PageSnapshot {

    String url;
    String html;
    SnapshotStatus status;

    @Builder.Default
    List<ErrorRecord> issues = List.of();

    public boolean isSuccess() {
        return status == SnapshotStatus.SUCCESS;
    }

    public static PageSnapshot success(String url, String html) {
        return PageSnapshot.builder()
            .url(url)
            .html(html == null ? "" : html)
            .status(SnapshotStatus.SUCCESS)
            .build();
    }

    public static PageSnapshot failed(String url, ErrorRecord issue) {
        return PageSnapshot.builder()
            .url(url)
            .html("")
            .status(SnapshotStatus.FAILED)
            .issues(List.of(issue))
            .build();
    }

}
