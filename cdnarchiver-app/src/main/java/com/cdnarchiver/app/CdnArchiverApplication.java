package com.cdnarchiver.app;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * CDN archiver HTTP service entry point.
 */
@SpringBootApplication
public class CdnArchiverApplication {

    public static void main(String[] args) {
        SpringApplication.run(CdnArchiverApplication.class, args);
    }
}
