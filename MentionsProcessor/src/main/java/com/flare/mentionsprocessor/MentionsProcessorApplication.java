package com.flare.mentionsprocessor;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Mentions Processor Application
 *
 * Consumes article mentions from the mentions stream, classifies
 * their sentiment and persists them into the mentions table.
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class MentionsProcessorApplication {

    public static void main(String[] args) {
        SpringApplication.run(MentionsProcessorApplication.class, args);
    }

}
