package com.hookintel.hook.store;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.hookintel.hook.config.HookScraperProperties;
import com.hookintel.hook.model.Profile;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collection;
import java.util.List;

/**
 * Reads and writes profiles.json: a JSON array of profiles in insertion order.
 */
@Component
@Slf4j
public class ProfileFileStore {

    private static final TypeReference<List<Profile>> PROFILE_LIST = new TypeReference<>() {};

    private final Path file;
    private final ObjectMapper objectMapper;
    private final ObjectWriter writer;

    @Autowired
    public ProfileFileStore(HookScraperProperties properties, ObjectMapper objectMapper) {
        this(Path.of(properties.getStorage().getDataDir()).resolve(properties.getStorage().getRegistryFile()),
                objectMapper);
    }

    public ProfileFileStore(Path file, ObjectMapper objectMapper) {
        this.file = file;
        this.objectMapper = objectMapper;
        this.writer = objectMapper.writerWithDefaultPrettyPrinter();
    }

    public Path getFile() {
        return file;
    }

    /**
     * @return stored profiles, empty when the file does not exist yet
     * @throws PersistenceException if the file exists but cannot be read or parsed
     */
    public List<Profile> load() {
        if (!Files.exists(file)) {
            log.debug("No registry file at {}, starting empty", file);
            return List.of();
        }
        try {
            List<Profile> profiles = objectMapper.readValue(file.toFile(), PROFILE_LIST);
            return profiles == null ? List.of() : profiles;
        } catch (IOException e) {
            throw new PersistenceException("Cannot read profile registry " + file + ": " + e.getMessage(), e);
        }
    }

    public void save(Collection<Profile> profiles) {
        try {
            JsonFiles.writeAtomically(file, writer, profiles);
        } catch (IOException e) {
            throw new PersistenceException("Cannot write profile registry " + file + ": " + e.getMessage(), e);
        }
    }
}
