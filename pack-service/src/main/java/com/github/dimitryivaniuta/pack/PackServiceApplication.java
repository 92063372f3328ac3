package com.github.dimitryivaniuta.pack;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Entry point for the Pack Service.
 * Opens packs, stages draws for commit, and tracks collection progress.
 */
@Slf4j
@SpringBootApplication
public class PackServiceApplication {

    public static void main(final String[] args) {
        SpringApplication.run(PackServiceApplication.class, args);
        log.info("Pack Service application started successfully.");
    }
}
