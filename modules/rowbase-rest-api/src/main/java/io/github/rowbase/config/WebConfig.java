package io.github.rowbase.config;

import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

/**
 * CORS for the API routes
 */
@Configuration
public class WebConfig implements WebMvcConfigurer {

    private final RestApiConfig restApiConfig;

    public WebConfig(RestApiConfig restApiConfig) {
        this.restApiConfig = restApiConfig;
    }

    @Override
    public void addCorsMappings(CorsRegistry registry) {
        RestApiConfig.CorsConfig cors = restApiConfig.getCors();
        if (cors.isEnabled()) {
            registry.addMapping("/api/**")
                    .allowedOrigins(cors.getAllowedOrigins())
                    .allowedMethods(cors.getAllowedMethods())
                    .allowedHeaders(cors.getAllowedHeaders())
                    .exposedHeaders("*")
                    .allowCredentials(cors.isAllowCredentials())
                    .maxAge(cors.getMaxAge());
        }
    }
}
