package com.phillippitts.geminibridge.config;

import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

/**
 * Allows browser clients on the local machine and browser extensions to call the API.
 */
@Configuration
public class CorsConfig implements WebMvcConfigurer {

    static final String[] ALLOWED_ORIGIN_PATTERNS = {
            "http://localhost:[*]",
            "http://127.0.0.1:[*]",
            "https://localhost:[*]",
            "https://127.0.0.1:[*]",
            "chrome-extension://*",
            "moz-extension://*"
    };

    @Override
    public void addCorsMappings(CorsRegistry registry) {
        registry.addMapping("/**")
                .allowedOriginPatterns(ALLOWED_ORIGIN_PATTERNS)
                .allowedMethods("GET", "POST", "OPTIONS")
                .allowedHeaders("Content-Type", "Authorization", "X-Request-ID")
                .allowCredentials(true);
    }
}
