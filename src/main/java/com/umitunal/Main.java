package com.umitunal;

import com.umitunal.examples.*;

/**
 * Main class that runs all QDelay examples.
 */
public class Main {
    public static void main(String[] args) throws Exception {
        System.out.println("=== QDelay Examples ===\n");

        // Run all examples
        DelayedJobsExample.main(args);
        DynamicScheduleExample.main(args);

        System.out.println("\n=== All Examples Complete ===");
    }
}
