package com.hookintel.hook.output;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.hookintel.hook.config.HookScraperProperties;
import com.hookintel.hook.model.ScrapeRun;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

/**
 * History of scrape attempts, one JSON line per profile attempt.
 *
 * Best effort: a failed write is logged and never fails the scrape.
 */
@Component
@Slf4j
public class ScrapeRunLog {

    private final Path file;
    private final ObjectMapper objectMapper;

    @Autowired
    public ScrapeRunLog(HookScraperProperties properties, ObjectMapper objectMapper) {
        this(Path.of(properties.getStorage().getDataDir()).resolve(properties.getStorage().getRunLogFile()), objectMapper);
    }

    public ScrapeRunLog(Path file, ObjectMapper objectMapper) {
        this.file = file;
        this.objectMapper = objectMapper;
    }

    public Path getFile() {
        return file;
    }

    public synchronized void append(ScrapeRun run) {
        try {
            String line = objectMapper.writeValueAsString(run) + System.lineSeparator();
            if (file.getParent() != null) {
                Files.createDirectories(file.getParent());
            }
            Files.writeString(file, line, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND);
        } catch (JsonProcessingException e) {
            log.warn("Failed to serialise scrape run {}: {}", run.getRunId(), e.getOriginalMessage());
        } catch (IOException e) {
            log.warn("Failed to write scrape run metadata to {}: {}", file, e.getMessage());
        }
    }
}
