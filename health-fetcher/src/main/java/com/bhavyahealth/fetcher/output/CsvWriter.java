package com.bhavyahealth.fetcher.output;

import com.bhavyahealth.fetcher.config.HealthFetcherProperties;
import com.bhavyahealth.fetcher.model.HealthColumns;
import com.bhavyahealth.fetcher.model.HealthRecord;
import com.opencsv.CSVWriter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Mirrors each saved record to its own CSV file.
 *
 * Output path pattern: {outputDir}/health_{date}.csv, e.g. /data/output/health_2024-01-01.csv.
 * A re-fetched date overwrites its file, matching the table's upsert.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class CsvWriter {

    private static final String[] HEADERS = HealthColumns.ALL.toArray(new String[0]);

    private final HealthFetcherProperties properties;

    public Path write(HealthRecord record) {
        Path outputDir = Paths.get(properties.getOutput().getCsv().getOutputDir());
        ensureDirectory(outputDir);

        Path outputPath = outputDir.resolve("health_" + record.getDate() + ".csv");

        try (Writer out = Files.newBufferedWriter(outputPath, StandardCharsets.UTF_8);
             CSVWriter writer = new CSVWriter(out,
                     CSVWriter.DEFAULT_SEPARATOR,
                     CSVWriter.DEFAULT_QUOTE_CHARACTER,
                     CSVWriter.DEFAULT_ESCAPE_CHARACTER,
                     CSVWriter.DEFAULT_LINE_END)) {

            if (properties.getOutput().getCsv().isIncludeHeader()) {
                writer.writeNext(HEADERS);
            }
            writer.writeNext(HealthColumns.ALL.stream().map(record::get).toArray(String[]::new));

            log.debug("Written {} to CSV: {}", record.getDate(), outputPath);
            return outputPath;

        } catch (IOException e) {
            throw new IllegalStateException("CSV write failed for " + outputPath, e);
        }
    }

    private void ensureDirectory(Path dir) {
        try {
            Files.createDirectories(dir);
        } catch (IOException e) {
            throw new IllegalStateException("Cannot create output directory: " + dir, e);
        }
    }
}
