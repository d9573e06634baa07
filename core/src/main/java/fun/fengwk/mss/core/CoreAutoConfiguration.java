package fun.fengwk.mss.core;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.ComponentScan;
import org.springframework.context.annotation.Configuration;

/**
 * Registers the scraping pipeline and its configuration properties.
 *
 * @author fengwk
 */
@Configuration(proxyBeanMethods = false)
@ComponentScan
@EnableConfigurationProperties
public class CoreAutoConfiguration {

}
