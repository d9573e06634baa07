package fun.fengwk.mss.core.service.browser.runtime;

import fun.fengwk.mss.core.service.browser.BrowserProperties;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Executes browser tasks on an exclusively checked out worker of the shared pool.
 *
 * @author fengwk
 */
@Slf4j
@Component
public class BrowserTaskExecutor {

    private final BrowserWorkerPool workerPool;

    @Autowired
    public BrowserTaskExecutor(BrowserProperties browserProperties) {
        this(new BrowserWorkerPool("render", WorkerPoolConfig.from(browserProperties), browserProperties));
    }

    BrowserTaskExecutor(BrowserWorkerPool workerPool) {
        this.workerPool = workerPool;
        workerPool.initializeMinWorkers();
    }

    public <T> T execute(BrowserTask<T> task) {
        return workerPool.execute(task);
    }

    @PreDestroy
    public void shutdown() {
        workerPool.shutdown();
    }

}
