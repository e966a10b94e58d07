/**
 * Main application class for the panorama ingest service
 *
 * Features:
 * - Accepts panorama uploads (DNG, JPEG, PNG, TIFF, WebP) over HTTP
 * - Renders high/medium/low WebP derivatives
 * - Stores them in an S3-compatible bucket, or inline as data URIs when no bucket is configured
 * - Entry point for Spring Boot application
 */

package net.panotour;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class PanoramaTourApplication {

    public static void main(String[] args) {
        SpringApplication.run(PanoramaTourApplication.class, args);
    }
}
