package dev.bulletin;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Entry point for the bulletin search service.
 *
 * <p>Serves the HTTP search API and the MCP tools (SSE transport) from the same web server.
 */
@SpringBootApplication
public class BulletinSearchApplication {
    public static void main(String[] args) {
        SpringApplication.run(BulletinSearchApplication.class, args);
    }
}
