package com.mtb.parser.main;

import com.mtb.parser.config.ParserConfig;
import com.mtb.parser.fhir.FhirBundleMapper;
import com.mtb.parser.report.ExtractionReport;
import com.mtb.parser.report.JsonReportWriter;
import com.mtb.parser.report.MtbReportParser;
import com.mtb.parser.report.ReportGenerator;
import com.mtb.parser.vocabulary.JsonVocabularyService;
import com.mtb.parser.vocabulary.VocabularyService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Main application for the MTB report parser.
 * Parses report text files in parallel and prints a summary, optionally followed
 * by the JSON export and the FHIR bundle of every report.
 */
public class MtbParserApp {

    private static final Logger logger = LoggerFactory.getLogger(MtbParserApp.class);
    static final String JSON_FLAG = "--json";
    static final String FHIR_FLAG = "--fhir";

    public static void main(String[] args) {
        logger.info("Starting MTB report parser");

        Options options = parseArguments(args);
        if (options.files.isEmpty()) {
            System.err.println("Usage: MtbParserApp [--json] [--fhir] <report.txt>...");
            System.exit(2);
        }

        try {
            ParserConfig config = ParserConfig.load();
            VocabularyService vocabulary = new JsonVocabularyService(config);
            MtbReportParser parser = new MtbReportParser(vocabulary, config);

            logger.info("Parsing {} report(s) with {} thread(s)", options.files.size(), config.getThreads());
            Map<String, ExtractionReport> reports = parseInParallel(options.files, parser, config.getThreads());

            if (reports.isEmpty()) {
                logger.warn("No report could be parsed");
                System.out.println("No reports parsed.");
                System.exit(1);
            }

            System.out.println(new ReportGenerator(config.getClock()).generateBatchReport(reports));

            if (options.json) {
                JsonReportWriter writer = new JsonReportWriter();
                reports.forEach((name, report) -> {
                    System.out.println("// " + name);
                    System.out.println(writer.toJson(report));
                });
            }
            if (options.fhir) {
                FhirBundleMapper mapper = new FhirBundleMapper();
                reports.forEach((name, report) -> {
                    System.out.println("// " + name);
                    System.out.println(mapper.toJson(report));
                });
            }

            logger.info("MTB report parser completed: {}/{} report(s) parsed",
                reports.size(), options.files.size());

        } catch (Exception e) {
            logger.error("Fatal error in MTB report parser: {}", e.getMessage(), e);
            System.err.println("Error: " + e.getMessage());
            System.exit(1);
        }
    }

    /**
     * Parse report files in parallel using CompletableFuture on a fixed pool.
     * A file that cannot be read or parsed is logged and left out.
     * @param files Report files
     * @param parser Shared, stateless report parser
     * @param threads Pool size
     * @return Parsed reports keyed by file name, in argument order
     */
    static Map<String, ExtractionReport> parseInParallel(List<Path> files, MtbReportParser parser, int threads) {
        ExecutorService executorService = Executors.newFixedThreadPool(threads);

        AtomicInteger processedCount = new AtomicInteger(0);
        int totalFiles = files.size();

        try {
            List<CompletableFuture<ExtractionReport>> futures = files.stream()
                .map(file -> CompletableFuture.supplyAsync(() -> {
                    try {
                        int currentCount = processedCount.incrementAndGet();
                        logger.info("Parsing report {}/{}: {}", currentCount, totalFiles, file);

                        String text = Files.readString(file, StandardCharsets.UTF_8);
                        return parser.parse(text);

                    } catch (IOException e) {
                        logger.error("Cannot read report {}: {}", file, e.getMessage());
                        return null;
                    } catch (RuntimeException e) {
                        logger.error("Error parsing report {}: {}", file, e.getMessage(), e);
                        return null;
                    }
                }, executorService))
                .toList();

            CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();

            Map<String, ExtractionReport> reports = new LinkedHashMap<>();
            for (int i = 0; i < files.size(); i++) {
                ExtractionReport report = futures.get(i).join();
                if (report != null) {
                    String name = displayName(files.get(i));
                    reports.put(reports.containsKey(name) ? files.get(i).toString() : name, report);
                }
            }
            return reports;

        } finally {
            executorService.shutdown();
            try {
                if (!executorService.awaitTermination(60, TimeUnit.SECONDS)) {
                    logger.warn("Executor service did not terminate in time, forcing shutdown");
                    executorService.shutdownNow();
                }
            } catch (InterruptedException e) {
                logger.error("Interrupted while waiting for executor service to terminate");
                executorService.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }
    }

    /**
     * Split command-line arguments into flags and report paths
     * @param args Command-line arguments
     * @return Parsed options
     */
    static Options parseArguments(String[] args) {
        Options options = new Options();
        for (String arg : args) {
            if (JSON_FLAG.equals(arg)) {
                options.json = true;
            } else if (FHIR_FLAG.equals(arg)) {
                options.fhir = true;
            } else if (arg.startsWith("--")) {
                logger.warn("Ignoring unknown option: {}", arg);
            } else {
                options.files.add(Paths.get(arg));
            }
        }
        return options;
    }

    private static String displayName(Path file) {
        Path name = file.getFileName();
        return name != null ? name.toString() : file.toString();
    }

    static final class Options {
        boolean json;
        boolean fhir;
        final List<Path> files = new ArrayList<>();
    }
}
