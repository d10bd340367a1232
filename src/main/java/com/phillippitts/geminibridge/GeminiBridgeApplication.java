package com.phillippitts.geminibridge;

import com.phillippitts.geminibridge.config.cli.GeminiCliConfig;
import com.phillippitts.geminibridge.config.cli.RetryProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableConfigurationProperties({
        GeminiCliConfig.class,
        RetryProperties.class,
        com.phillippitts.geminibridge.config.properties.QueueProperties.class,
        com.phillippitts.geminibridge.config.properties.SecurityProperties.class,
        com.phillippitts.geminibridge.config.properties.RateLimitProperties.class,
        com.phillippitts.geminibridge.config.properties.ModelMappingProperties.class,
        com.phillippitts.geminibridge.config.properties.ThreadPoolProperties.class
})
@EnableScheduling
public class GeminiBridgeApplication {

    public static void main(String[] args) {
        SpringApplication.run(GeminiBridgeApplication.class, args);
    }

}
