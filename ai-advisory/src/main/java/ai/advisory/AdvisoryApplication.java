package ai.advisory;

import ai.advisory.config.AdvisoryProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableConfigurationProperties(AdvisoryProperties.class)
@EnableScheduling
public class AdvisoryApplication {
    public static void main(String[] args) {
        SpringApplication.run(AdvisoryApplication.class, args);
    }
}
