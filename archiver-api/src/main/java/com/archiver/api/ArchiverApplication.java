package com.archiver.api;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;

/**
 * Main application entry point for the audit archiver.
 * The DataSource is only built when the jdbc store is selected.
 */
@SpringBootApplication(
    scanBasePackages = {
        "com.archiver.api",
        "com.archiver.engine"
    },
    exclude = DataSourceAutoConfiguration.class
)
public class ArchiverApplication {

    public static void main(String[] args) {
        SpringApplication.run(ArchiverApplication.class, args);
    }
}
