package fun.fengwk.mss.core.service.scrape.runtime;

import fun.fengwk.mss.core.service.scrape.model.ErrorRecord;
import fun.fengwk.mss.core.service.scrape.model.InteractionSummary;
import fun.fengwk.mss.core.service.scrape.model.PageSnapshot;
import fun.fengwk.mss.core.service.scrape.model.SnapshotStatus;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Output of the render stage.
 *
 * @author fengwk
 */
@Value
@Builder
public class RenderOutcome {

    String url;

    SnapshotStatus status;

    @Builder.Default
    List<PageSnapshot> captures = List.of();

    @Builder.Default
    InteractionSummary interactions = InteractionSummary.empty();

    @Builder.Default
    List<ErrorRecord> issues = List.of();

    public boolean isFailed() {
        return status == SnapshotStatus.FAILED;
    }

    public static RenderOutcome failed(String url, ErrorRecord issue) {
        return RenderOutcome.builder()
            .url(url)
            .status(SnapshotStatus.FAILED)
            .issues(List.of(issue))
            .build();
    }

}
