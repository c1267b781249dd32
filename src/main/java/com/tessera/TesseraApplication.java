package com.tessera;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Main application class for Tessera Analytics.
 *
 * Tessera compiles declarative analytics queries (measures, dimensions, time
 * windows and filters over registered cubes) into tenant-isolated query plans
 * for an external execution engine, and sequences event streams into
 * step-by-step conversion funnels.
 *
 * Key Features:
 * - Relative and literal date range resolution with calendar arithmetic
 * - Typed filter predicates with operator and value validation
 * - Join path resolution across cubes
 * - Mandatory tenant predicate injection for every referenced cube
 * - Funnel sequencing with per-step and global conversion windows
 */
@SpringBootApplication
public class TesseraApplication {

    /**
     * Main entry point for the Tessera application.
     *
     * @param args command line arguments
     */
    public static void main(String[] args) {
        SpringApplication.run(TesseraApplication.class, args);
    }
}
