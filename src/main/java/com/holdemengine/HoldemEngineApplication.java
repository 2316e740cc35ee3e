package com.holdemengine;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Main application class for the Holdem Engine.
 *
 * Holdem Engine is the betting rules engine for a single No-Limit Texas Hold'em table:
 * it decides which actions are legal, applies them to produce the next round state, and
 * detects when a betting round is over. Seating, cards, hand evaluation and transport are
 * left to the host application.
 */
@SpringBootApplication
public class HoldemEngineApplication {

    public static void main(String[] args) {
        SpringApplication.run(HoldemEngineApplication.class, args);
    }
}
