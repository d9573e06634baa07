package fun.fengwk.mss.core.service.scrape.model;

/**
 * Outcome of producing a page snapshot.
 *
 * @author fengwk
 */
public enum SnapshotStatus {

    SUCCESS,
    PARTIAL,
    FAILED

}
