package fun.fengwk.mss.core.service.browser.runtime;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * @author fengwk
 */
public class BrowserTaskExecutorTest {

    @Test
    public void shouldPreheatPoolAndDelegateTasks() {
        BrowserWorkerPool workerPool = mock(BrowserWorkerPool.class);
        when(workerPool.execute(any())).thenReturn("ok");

        BrowserTaskExecutor executor = new BrowserTaskExecutor(workerPool);
        Object result = executor.execute(context -> "ignored");

        assertThat(result).isEqualTo("ok");
        verify(workerPool).initializeMinWorkers();
    }

    @Test
    public void shouldShutdownPool() {
        BrowserWorkerPool workerPool = mock(BrowserWorkerPool.class);
        BrowserTaskExecutor executor = new BrowserTaskExecutor(workerPool);

        executor.shutdown();

        verify(workerPool).shutdown();
    }

}
