package io.github.rowbase;

import io.github.rowbase.config.RestApiConfig;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * Main application class for Rowbase REST API
 *
 * Serves the tables configured under {@code app.resources} with:
 * - GET/POST/PUT/DELETE on rows addressed by primary key
 * - Filter, order, limit, select and aggregate query parameters
 * - JSON, CSV, multipart form data and url encoded bodies
 * - Optional encryption of numeric row ids
 */
@SpringBootApplication
@EnableConfigurationProperties(RestApiConfig.class)
public class RowbaseRestApplication {

    public static void main(String[] args) {
        SpringApplication.run(RowbaseRestApplication.class, args);
    }

}
