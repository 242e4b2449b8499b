package com.hookintel.hook.output;

import com.hookintel.hook.config.HookScraperProperties;
import com.hookintel.hook.model.Dataset;
import com.hookintel.hook.model.TrainingRecord;
import com.hookintel.hook.store.PersistenceException;
import com.opencsv.CSVWriter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Writes training records to a CSV file next to the JSON document.
 *
 * Output path pattern: {name}.csv, e.g. training_dataset.csv
 * Hashtags are joined with spaces into one column.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class DatasetCsvWriter {

    private final HookScraperProperties properties;

    private static final String[] HEADERS = {
            "hook", "category", "quality_score",
            "likes", "views", "comments", "shares",
            "profile_id", "post_id",
            "word_count", "hashtags"
    };

    public Path write(Dataset dataset, Path output) {
        Path csvPath = csvPath(output);
        ensureParent(csvPath);

        try (Writer out = Files.newBufferedWriter(csvPath, StandardCharsets.UTF_8);
             CSVWriter writer = new CSVWriter(
                     out,
                     CSVWriter.DEFAULT_SEPARATOR,
                     CSVWriter.DEFAULT_QUOTE_CHARACTER,
                     CSVWriter.DEFAULT_ESCAPE_CHARACTER,
                     CSVWriter.DEFAULT_LINE_END)) {

            if (properties.getOutput().getCsv().isIncludeHeader()) {
                writer.writeNext(HEADERS);
            }

            for (TrainingRecord r : dataset.records()) {
                writer.writeNext(toRow(r));
            }

            log.info("Written {} records to CSV: {}", dataset.records().size(), csvPath);
            return csvPath;

        } catch (IOException e) {
            log.error("Failed to write CSV file {}: {}", csvPath, e.getMessage(), e);
            throw new PersistenceException("CSV write failed: " + csvPath, e);
        }
    }

    static Path csvPath(Path output) {
        String name = output.getFileName().toString();
        String base = name.endsWith(".json") ? name.substring(0, name.length() - ".json".length()) : name;
        return output.resolveSibling(base + ".csv");
    }

    private String[] toRow(TrainingRecord r) {
        return new String[]{
                r.hook(),
                r.category().getLabel(),
                String.valueOf(r.qualityScore()),
                String.valueOf(r.engagement().likes()),
                String.valueOf(r.engagement().views()),
                String.valueOf(r.engagement().comments()),
                String.valueOf(r.engagement().shares()),
                r.profileId(),
                r.postId(),
                String.valueOf(r.wordCount()),
                String.join(" ", r.hashtags())
        };
    }

    private void ensureParent(Path file) {
        Path dir = file.toAbsolutePath().getParent();
        try {
            if (dir != null) {
                Files.createDirectories(dir);
            }
        } catch (IOException e) {
            throw new PersistenceException("Cannot create output directory: " + dir, e);
        }
    }
}
