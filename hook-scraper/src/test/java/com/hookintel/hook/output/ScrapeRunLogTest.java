package com.hookintel.hook.output;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.hookintel.hook.model.ProfileStatus;
import com.hookintel.hook.model.ScrapeRun;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ScrapeRunLogTest {

    @TempDir
    Path dataDir;

    private final ObjectMapper objectMapper = JsonMapper.builder()
            .findAndAddModules()
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .build();

    @Test
    void append_writesOneLinePerRun() throws IOException {
        ScrapeRunLog runLog = new ScrapeRunLog(dataDir.resolve("logs/scrape_runs.jsonl"), objectMapper);

        runLog.append(run("alpha", ProfileStatus.COMPLETED, null));
        runLog.append(run("beta", ProfileStatus.FAILED, "Navigation timed out"));

        List<String> lines = Files.readAllLines(runLog.getFile());
        assertEquals(2, lines.size());
        JsonNode failed = objectMapper.readTree(lines.get(1));
        assertEquals("beta", failed.path("profileId").asText());
        assertEquals("FAILED", failed.path("outcome").asText());
        assertEquals("Navigation timed out", failed.path("errorMessage").asText());
        assertEquals("2024-05-01T10:00:00", failed.path("startedAt").asText());
    }

    @Test
    void append_unwritableFileIsOnlyLogged() throws IOException {
        Path directory = Files.createDirectories(dataDir.resolve("taken"));
        ScrapeRunLog runLog = new ScrapeRunLog(directory, objectMapper);

        assertDoesNotThrow(() -> runLog.append(run("alpha", ProfileStatus.COMPLETED, null)));
        assertTrue(Files.isDirectory(directory));
    }

    private static ScrapeRun run(String profileId, ProfileStatus outcome, String error) {
        return ScrapeRun.builder()
                .runId(profileId + "-run")
                .profileId(profileId)
                .startedAt(LocalDateTime.of(2024, 5, 1, 10, 0))
                .completedAt(LocalDateTime.of(2024, 5, 1, 10, 1))
                .outcome(outcome)
                .postsFetched(3)
                .postsAccepted(outcome == ProfileStatus.COMPLETED ? 3 : 0)
                .errorMessage(error)
                .build();
    }
}
