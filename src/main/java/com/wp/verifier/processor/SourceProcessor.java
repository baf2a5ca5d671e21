package com.wp.verifier.processor;

import com.github.javaparser.JavaParser;
import com.github.javaparser.ParseResult;
import com.github.javaparser.ParserConfiguration;
import com.github.javaparser.ast.CompilationUnit;
import com.wp.verifier.VerifierOptions;
import com.wp.verifier.analysis.ContractCache;
import com.wp.verifier.analysis.ContractFileReader;
import com.wp.verifier.ast.FunctionDecl;
import com.wp.verifier.evaluation.MetricsCollector;
import com.wp.verifier.report.FunctionReport;
import com.wp.verifier.solver.ValidityChecker;
import com.wp.verifier.solver.Z3ValidityChecker;
import com.wp.verifier.visitor.FunctionExtractionVisitor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Verifies the annotated methods of Java source files.
 */
public class SourceProcessor {

    private static final Logger logger = LoggerFactory.getLogger(SourceProcessor.class);

    public static final String METRICS_FILE = "wp-verifier-metrics.json";

    private final JavaParser javaParser;
    private final VerifierOptions options;
    private final ValidityChecker checker;

    public SourceProcessor(VerifierOptions options) {
        this(options, new Z3ValidityChecker(options.getSolverTimeoutMillis()));
    }

    public SourceProcessor(VerifierOptions options, ValidityChecker checker) {
        ParserConfiguration parserConfig = new ParserConfiguration();
        parserConfig.setLanguageLevel(ParserConfiguration.LanguageLevel.JAVA_17);
        this.javaParser = new JavaParser(parserConfig);
        this.options = options;
        this.checker = checker;
    }

    /**
     * Verifies every method of every {@code .java} file under the given paths.
     * Files that fail to parse are logged and skipped.
     *
     * @param sourcePaths files or directories
     * @return one report per verified method
     * @throws IOException if a path does not exist or the contracts file cannot be read
     */
    public List<FunctionReport> process(List<Path> sourcePaths) throws IOException {
        List<Path> javaFiles = new ArrayList<>();
        for (Path sourcePath : sourcePaths) {
            javaFiles.addAll(collectJavaFiles(sourcePath));
        }
        logger.info("Found {} Java files", javaFiles.size());

        ContractCache contracts = new ContractCache();
        if (options.getContractsFile() != null) {
            new ContractFileReader().loadContracts(options.getContractsFile(), contracts);
        }

        try (VerificationPipeline pipeline = new VerificationPipeline(options, checker, contracts)) {
            MetricsCollector metrics = pipeline.getMetricsCollector();
            if (metrics != null) {
                metrics.startAnalysis();
            }

            List<FunctionDecl> functions = new ArrayList<>();
            for (Path javaFile : javaFiles) {
                try {
                    functions.addAll(extractFunctions(javaFile));
                    if (metrics != null) {
                        metrics.recordFile();
                    }
                } catch (Exception e) {
                    logger.error("Error parsing file: {}", javaFile, e);
                }
            }
            logger.info("Verifying {} function(s)", functions.size());

            List<FunctionReport> reports = pipeline.verifyAll(functions);

            if (metrics != null) {
                metrics.endAnalysis();
                metrics.printReport();
                exportMetrics(metrics, sourcePaths.get(0));
            }
            return reports;
        }
    }

    /**
     * Parses one file and lowers its methods.
     *
     * @throws IOException if the file cannot be read or does not parse
     */
    public List<FunctionDecl> extractFunctions(Path javaFile) throws IOException {
        ParseResult<CompilationUnit> result = javaParser.parse(javaFile);
        CompilationUnit cu = result.getResult()
                .filter(unit -> result.isSuccessful())
                .orElseThrow(() -> new IOException("Failed to parse file: " + javaFile + " " + result.getProblems()));
        FunctionExtractionVisitor visitor = new FunctionExtractionVisitor(javaFile.getFileName().toString());
        visitor.visit(cu, null);
        logger.debug("{}: {} function(s), {} skipped", javaFile, visitor.getFunctions().size(),
                visitor.getSkippedCount());
        return visitor.getFunctions();
    }

    private static List<Path> collectJavaFiles(Path sourcePath) throws IOException {
        if (!Files.exists(sourcePath)) {
            throw new IOException("Path does not exist: " + sourcePath);
        }
        try (Stream<Path> paths = Files.walk(sourcePath)) {
            return paths.filter(Files::isRegularFile)
                    .filter(path -> path.toString().endsWith(".java"))
                    .sorted()
                    .collect(Collectors.toList());
        }
    }

    private static void exportMetrics(MetricsCollector metrics, Path sourcePath) {
        Path directory = Files.isDirectory(sourcePath) ? sourcePath : sourcePath.toAbsolutePath().getParent();
        try {
            metrics.exportJSON(directory.resolve(METRICS_FILE));
        } catch (IOException e) {
            logger.error("Failed to export metrics to JSON", e);
        }
    }
}
