/**
 * Main application class for the tile fetch service
 *
 * Features:
 * - Serves map tiles assembled from one or more upstream tile servers
 * - Bounded retries, concurrent layer fetches and in-memory tile caching
 * - Entry point for Spring Boot application
 */

package net.tilefetch;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class TileFetchApplication {

    /**
     * Main method that starts the Spring Boot application
     *
     * @param args Command line arguments passed to the application
     */
    public static void main(String[] args) {
        SpringApplication.run(TileFetchApplication.class, args);
    }
}
