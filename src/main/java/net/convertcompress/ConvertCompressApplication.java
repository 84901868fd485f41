package net.convertcompress;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Entry point for the headless conversion engine. A UI layer drives the engine through
 * its beans.
 */
@SpringBootApplication
public class ConvertCompressApplication {

    public static void main(String[] args) {
        SpringApplication.run(ConvertCompressApplication.class, args);
    }
}
