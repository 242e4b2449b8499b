package com.hookintel.hook.output;

import com.hookintel.hook.config.HookScraperProperties;
import com.hookintel.hook.model.Dataset;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Routes the dataset to the configured format(s).
 * Supports JSON, CSV, or BOTH modes.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class DatasetWriter {

    private final DatasetJsonWriter jsonWriter;
    private final DatasetCsvWriter csvWriter;
    private final HookScraperProperties properties;

    /**
     * @return every file written
     */
    public List<Path> write(Dataset dataset, Path output) {
        HookScraperProperties.Output.OutputMode mode = properties.getOutput().getMode();
        List<Path> written = new ArrayList<>();

        switch (mode) {
            case JSON -> written.addAll(jsonWriter.write(dataset, output, LocalDateTime.now()));
            case CSV -> written.add(csvWriter.write(dataset, output));
            case BOTH -> {
                written.addAll(jsonWriter.write(dataset, output, LocalDateTime.now()));
                written.add(csvWriter.write(dataset, output));
            }
        }
        log.debug("Dataset output ({}): {}", mode, written);
        return written;
    }
}
