package dev.irsweep;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Entry point for the retrieval evaluation sweep.
 *
 * <p>Runs as a command-line application: {@link SweepRunner} loads the corpus, evaluates every
 * configured combination and writes the result table, then the context shuts down.
 */
@SpringBootApplication
public class IrSweepApplication {
    public static void main(String[] args) {
        System.exit(SpringApplication.exit(SpringApplication.run(IrSweepApplication.class, args)));
    }
}
