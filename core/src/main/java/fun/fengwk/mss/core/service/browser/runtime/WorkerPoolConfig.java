package fun.fengwk.mss.core.service.browser.runtime;

import fun.fengwk.mss.core.service.browser.BrowserProperties;
import lombok.Builder;
import lombok.Data;

/**
 * Configuration for a worker pool.
 *
 * @author fengwk
 */
@Data
@Builder
public class WorkerPoolConfig {

    /**
     * Minimum worker count (0 means scale to zero when idle).
     */
    @Builder.Default
    private int minWorkers = 0;

    /**
     * Maximum worker count.
     */
    @Builder.Default
    private int maxWorkers = 2;

    /**
     * Timeout when waiting for an available worker.
     */
    @Builder.Default
    private long queueTimeoutMs = 15000;

    public static WorkerPoolConfig from(BrowserProperties browserProperties) {
        return WorkerPoolConfig.builder()
            .minWorkers(browserProperties.getWorkerPoolMinSize())
            .maxWorkers(browserProperties.getWorkerPoolMaxSize())
            .queueTimeoutMs(browserProperties.getCheckoutTimeoutMs())
            .build();
    }

}
