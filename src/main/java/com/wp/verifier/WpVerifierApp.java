package com.wp.verifier;

import com.wp.verifier.processor.SourceProcessor;
import com.wp.verifier.report.DiagnosticsReporter;
import com.wp.verifier.report.FunctionReport;
import com.wp.verifier.report.FunctionVerdict;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

/**
 * Main application entry point of the WP verifier.
 * Verifies annotated Java methods and prints a verdict per method.
 */
public class WpVerifierApp {

    private static final Logger logger = LoggerFactory.getLogger(WpVerifierApp.class);

    static final int EXIT_OK = 0;
    static final int EXIT_ERROR = 1;
    static final int EXIT_FAILED = 2;

    public static void main(String[] args) {
        System.exit(run(args));
    }

    static int run(String[] args) {
        VerifierOptions options = new VerifierOptions();
        List<Path> sources = new ArrayList<>();
        try {
            for (String arg : args) {
                if (arg.startsWith("--timeout=")) {
                    options.setSolverTimeoutMillis(Long.parseLong(value(arg)));
                } else if (arg.startsWith("--jobs=")) {
                    options.setParallelism(Integer.parseInt(value(arg)));
                } else if (arg.startsWith("--contracts=")) {
                    options.setContractsFile(Paths.get(value(arg)));
                } else if (arg.startsWith("--dot=")) {
                    options.setDotOutputDirectory(Paths.get(value(arg)));
                } else if (arg.equals("--no-metrics")) {
                    options.setCollectMetrics(false);
                } else if (arg.startsWith("--")) {
                    throw new IllegalArgumentException("Unknown option: " + arg);
                } else {
                    sources.add(Paths.get(arg));
                }
            }
        } catch (IllegalArgumentException e) {
            System.err.println("Error: " + e.getMessage());
            printUsage();
            return EXIT_ERROR;
        }
        if (sources.isEmpty()) {
            printUsage();
            return EXIT_ERROR;
        }

        logger.info("Starting WP verifier with {}", options);
        try {
            SourceProcessor processor = new SourceProcessor(options);
            List<FunctionReport> reports = processor.process(sources);

            DiagnosticsReporter reporter = new DiagnosticsReporter();
            boolean failed = false;
            for (FunctionReport report : reports) {
                System.out.println(reporter.format(report));
                failed |= report.getVerdict() == FunctionVerdict.FAILED;
            }
            logger.info("Verification complete: {} function(s)", reports.size());
            return failed ? EXIT_FAILED : EXIT_OK;
        } catch (Exception e) {
            logger.error("Error verifying sources", e);
            System.err.println("Error: " + e.getMessage());
            return EXIT_ERROR;
        }
    }

    private static String value(String arg) {
        return arg.substring(arg.indexOf('=') + 1);
    }

    private static void printUsage() {
        System.err.println("Usage: java -jar wp-verifier.jar [options] <file-or-directory>...");
        System.err.println("  --timeout=<ms>      solver timeout per condition (default "
                + VerifierOptions.DEFAULT_SOLVER_TIMEOUT_MILLIS + ")");
        System.err.println("  --jobs=<n>          conditions checked in parallel");
        System.err.println("  --contracts=<file>  JSON contracts of external methods");
        System.err.println("  --dot=<dir>         write the CFG of every method as DOT");
        System.err.println("  --no-metrics        skip the metrics report");
        System.err.println("Example: java -jar wp-verifier.jar --timeout=5000 src/main/java");
    }
}
