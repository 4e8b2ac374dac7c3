package com.williamcallahan.crossref.cli;

import com.williamcallahan.crossref.config.CrossRefProperties;
import com.williamcallahan.crossref.domain.report.CrossReferenceResult;
import com.williamcallahan.crossref.domain.report.RunStatus;
import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Command-line entry point, active with {@code crossref.cli.enabled=true}.
 * Exits with 1 when the input cannot be read or the output cannot be written.
 */
@Component
@ConditionalOnProperty(prefix = "crossref.cli", name = "enabled", havingValue = "true")
public class CrossRefCommandLine implements CommandLineRunner, ExitCodeGenerator {
    private static final Logger log = LoggerFactory.getLogger(CrossRefCommandLine.class);

    private final ChunkDirectoryProcessor processor;
    private final CrossRefProperties properties;
    private int exitCode = 0;

    public CrossRefCommandLine(ChunkDirectoryProcessor processor, CrossRefProperties properties) {
        this.processor = processor;
        this.properties = properties;
    }

    @Override
    public void run(String... args) {
        Path inputDir = Paths.get(properties.getCli().getInputDir());
        Path outputDir = Paths.get(properties.getCli().getOutputDir());

        log.info("===============================================");
        log.info("Cross-reference resolution");
        log.info("===============================================");
        log.info("Input directory: {}", inputDir);
        log.info("Output directory: {}", outputDir);

        try {
            CrossReferenceResult result = processor.processDirectory(inputDir, outputDir);
            for (String line : result.report().summary().split("\n")) {
                log.info(line);
            }
            if (result.report().status() == RunStatus.COMPLETED_WITH_BROKEN_REFS) {
                log.warn("Some references could not be resolved; see {}", outputDir.resolve(ChunkDirectoryProcessor.REPORT_FILE));
            }
        } catch (IOException e) {
            log.error("✗ Cross-reference resolution failed: {}", e.getMessage());
            log.debug("Stack trace:", e);
            exitCode = 1;
        }
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
