package fun.fengwk.mss.core.service.browser;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * Browser runtime shared configuration.
 *
 * @author fengwk
 */
@Data
@Component
@ConfigurationProperties(prefix = "mss.browser")
public class BrowserProperties {

    /**
     * Workers launched eagerly at startup.
     */
    private int workerPoolMinSize = 0;

    /**
     * Max concurrently live browsers per process.
     */
    private int workerPoolMaxSize = 2;

    /**
     * Timeout when waiting for an idle worker.
     */
    private long checkoutTimeoutMs = 15000;

    /**
     * Whether browsers run headless.
     */
    private boolean headless = true;

    private String userAgent =
        "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/120.0.0.0 Safari/537.36";

    private int viewportWidth = 1920;

    private int viewportHeight = 1080;

    /**
     * Optional locale for browser context.
     */
    private String locale = "";

    /**
     * Extra headers for browser context.
     */
    private Map<String, String> extraHeaders = Map.of();

    /**
     * Browser channel, e.g. chrome, msedge.
     */
    private String browserChannel = "";

    /**
     * Browser executable path.
     */
    private String executablePath = "";

    /**
     * Extra launch args for browser.
     */
    private List<String> launchArgs = List.of();

    /**
     * Ignore default args for browser launch.
     */
    private List<String> ignoreDefaultArgs = List.of("--enable-automation");

}
