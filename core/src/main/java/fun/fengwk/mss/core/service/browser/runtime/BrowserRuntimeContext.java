package fun.fengwk.mss.core.service.browser.runtime;

import com.microsoft.playwright.BrowserContext;
import com.microsoft.playwright.Page;
import lombok.Builder;
import lombok.Data;

/**
 * Runtime context passed to browser tasks.
 *
 * @author fengwk
 */
@Data
@Builder
public class BrowserRuntimeContext {

    private String workerId;
    private BrowserContext browserContext;
    private Page page;

}
