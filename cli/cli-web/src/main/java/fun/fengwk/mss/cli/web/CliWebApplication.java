package fun.fengwk.mss.cli.web;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * @author fengwk
 */
@SpringBootApplication
public class CliWebApplication {

    public static void main(String[] args) {
        SpringApplication.run(CliWebApplication.class, args);
    }

}
