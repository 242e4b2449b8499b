package com.hookintel.hook.output;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.hookintel.hook.model.Dataset;
import com.hookintel.hook.model.DatasetStatistics;
import com.hookintel.hook.model.HookCategory;
import com.hookintel.hook.model.TrainingRecord;
import com.hookintel.hook.store.PersistenceException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Writes the dataset as one JSON document plus a simplified sibling.
 *
 * Output: {name}.json with metadata, records and statistics, and {name}_simplified.json
 * holding only hook text, category and quality score per record.
 */
@Component
@Slf4j
public class DatasetJsonWriter {

    private final ObjectWriter writer;

    public DatasetJsonWriter(ObjectMapper objectMapper) {
        this.writer = objectMapper.writerWithDefaultPrettyPrinter();
    }

    record Metadata(LocalDateTime generatedAt, int totalRecords, int totalProfiles) {
    }

    record Document(Metadata metadata, List<TrainingRecord> records, DatasetStatistics statistics) {
    }

    record SimplifiedRecord(String hook, HookCategory category, double qualityScore) {
    }

    /**
     * @return the files written, document first
     */
    public List<Path> write(Dataset dataset, Path output, LocalDateTime generatedAt) {
        Path simplified = simplifiedPath(output);
        DatasetStatistics stats = dataset.statistics();

        Document document = new Document(
                new Metadata(generatedAt, stats.getTotalRecords(), stats.getTotalProfiles()),
                dataset.records(),
                stats);
        List<SimplifiedRecord> simple = dataset.records().stream()
                .map(r -> new SimplifiedRecord(r.hook(), r.category(), r.qualityScore()))
                .collect(Collectors.toList());

        writeJson(output, document);
        writeJson(simplified, simple);
        log.info("Written {} records to {} and {}", dataset.records().size(), output, simplified);
        return List.of(output, simplified);
    }

    static Path simplifiedPath(Path output) {
        String name = output.getFileName().toString();
        String base = name.endsWith(".json") ? name.substring(0, name.length() - ".json".length()) : name;
        return output.resolveSibling(base + "_simplified.json");
    }

    private void writeJson(Path file, Object value) {
        try {
            Path dir = file.toAbsolutePath().getParent();
            if (dir != null) {
                Files.createDirectories(dir);
            }
            writer.writeValue(file.toFile(), value);
        } catch (IOException e) {
            log.error("Failed to write dataset file {}: {}", file, e.getMessage(), e);
            throw new PersistenceException("Cannot write dataset file " + file + ": " + e.getMessage(), e);
        }
    }
}
