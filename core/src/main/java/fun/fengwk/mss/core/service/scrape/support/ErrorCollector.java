package fun.fengwk.mss.core.service.scrape.support;

import fun.fengwk.mss.core.service.scrape.error.ScrapeStageException;
import fun.fengwk.mss.core.service.scrape.model.ErrorRecord;
import fun.fengwk.mss.core.service.scrape.model.ScrapeStage;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

/**
 * Per-request accumulator of non-fatal failures.
 *
 * @author fengwk
 */
@Slf4j
public class ErrorCollector {

    private final String url;
    private final List<ErrorRecord> records = new ArrayList<>();

    public ErrorCollector(String url) {
        this.url = url;
    }

    public synchronized void record(ScrapeStage stage, String message) {
        add(ErrorRecord.of(stage, message));
    }

    public synchronized void record(ScrapeStageException ex) {
        add(ErrorRecord.from(ex));
    }

    public synchronized void addAll(List<ErrorRecord> errorRecords) {
        if (errorRecords == null) {
            return;
        }
        for (ErrorRecord errorRecord : errorRecords) {
            if (errorRecord != null) {
                add(errorRecord);
            }
        }
    }

    public synchronized List<ErrorRecord> getRecords() {
        return List.copyOf(records);
    }

    public synchronized int size() {
        return records.size();
    }

    private void add(ErrorRecord errorRecord) {
        log.warn("scrape stage failed, url={}, stage={}, error={}",
            url, errorRecord.getStage().getValue(), errorRecord.getMessage());
        records.add(errorRecord);
    }

}
