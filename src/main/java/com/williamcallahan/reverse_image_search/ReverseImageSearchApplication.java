/**
 * Main application class for the reverse image search service
 *
 * @author William Callahan
 *
 * Features:
 * - Entry point for Spring Boot application
 * - Binds the ris.search configuration properties
 * - Starts the interactive search and cache maintenance shell
 */

package com.williamcallahan.reverse_image_search;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ReverseImageSearchApplication {

    public static void main(String[] args) {
        SpringApplication.run(ReverseImageSearchApplication.class, args);
    }
}
