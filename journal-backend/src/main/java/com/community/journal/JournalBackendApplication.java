package com.community.journal;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class JournalBackendApplication {

    private static final Logger log = LoggerFactory.getLogger(JournalBackendApplication.class);

    public static void main(String[] args) {
        SpringApplication.run(JournalBackendApplication.class, args);
        log.info("Journal Backend Application is running");
    }

}
