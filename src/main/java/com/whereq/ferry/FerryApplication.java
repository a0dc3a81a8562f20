package com.whereq.ferry;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Main application class for WhereQ Ferry.
 * This service ships jobs to Google Cloud Life Sciences, picks the smallest
 * machine type that satisfies each job and tracks the remote operations
 * until they finish.
 *
 * @author WhereQ Inc.
 */
@SpringBootApplication
@EnableScheduling
public class FerryApplication {

    public static void main(String[] args) {
        SpringApplication.run(FerryApplication.class, args);
    }
}
