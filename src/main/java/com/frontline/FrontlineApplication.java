package com.frontline;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Main entry point for the Frontline territorial conflict server.
 *
 * Features:
 * - Wars and border pushes between player-owned countries
 * - Resource economy with atomic debits
 * - Periodic conflict and economy ticks
 * - Real-time updates via STOMP over WebSockets
 */
@SpringBootApplication
@EnableScheduling
public class FrontlineApplication {

    public static void main(String[] args) {
        SpringApplication.run(FrontlineApplication.class, args);
    }
}
