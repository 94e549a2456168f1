package com.reconengine;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Main application class for the Recon Engine.
 *
 * Recon Engine decides, without a shared transaction identifier, which bank and card
 * movements correspond to which entries of an independently maintained business ledger,
 * and keeps both sides consistent when matches are committed or undone.
 */
@SpringBootApplication
public class ReconEngineApplication {

    public static void main(String[] args) {
        SpringApplication.run(ReconEngineApplication.class, args);
    }
}
