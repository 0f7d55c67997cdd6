/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package dev.mars.pimflow.examples.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;

/**
 * Console output helper for the Pimflow examples.
 * <p>
 * Formatted progress goes to the console, and every line is mirrored to SLF4J so that a run
 * can be captured by the logback configuration as well.
 *
 * <pre>
 * private static final ExampleLogger log = ExampleLogger.getLogger(MyExample.class);
 *
 * log.header("My Example");
 * log.step(1, "Starting run...");
 * log.success("Run completed");
 * </pre>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-08
 * @version 1.0
 */
public class ExampleLogger {

    private static final String SYMBOL_SUCCESS = "✓";
    private static final String SYMBOL_FAILURE = "✗";
    private static final String SYMBOL_INFO = "•";

    private static final String INDENT = "   ";

    private final Logger logger;
    private final PrintStream out;
    private final PrintStream err;

    private ExampleLogger(Class<?> clazz) {
        this.logger = LoggerFactory.getLogger(clazz);
        this.out = System.out;
        this.err = System.err;
    }

    public static ExampleLogger getLogger(Class<?> clazz) {
        return new ExampleLogger(clazz);
    }

    public void header(String title) {
        out.println();
        out.println("=== " + title + " ===");
        logger.info("Starting: {}", title);
    }

    public void step(int number, String message) {
        out.println(number + ". " + message);
        logger.info("Step {}: {}", number, message);
    }

    public void info(String message) {
        out.println(INDENT + SYMBOL_INFO + " " + message);
        logger.debug(message);
    }

    public void success(String message) {
        out.println(INDENT + SYMBOL_SUCCESS + " " + message);
        logger.info(message);
    }

    public void failure(String message) {
        err.println(INDENT + SYMBOL_FAILURE + " " + message);
        logger.warn(message);
    }

    /**
     * Reports an error the example did not expect and logs its stack trace.
     */
    public void unexpected(String exampleName, Throwable error) {
        err.println();
        err.println(SYMBOL_FAILURE + " " + exampleName + " failed: " + error.getMessage());
        logger.error("{} failed", exampleName, error);
    }

    public void completed(String exampleName) {
        out.println();
        out.println("=== " + exampleName + " completed ===");
        logger.info("Completed: {}", exampleName);
    }
}
