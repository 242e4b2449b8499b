package com.hookintel.hook.store;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.hookintel.hook.config.HookScraperProperties;
import com.hookintel.hook.model.SlideshowPost;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.BufferedWriter;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Per-profile post collections on disk.
 *
 * Layout: {dataDir}/posts/{profileId}/slideshows.json plus a hooks.txt companion.
 * Posts are keyed by id: storing an id again replaces the old post in place, so
 * re-scraping a profile is idempotent and capture order is kept.
 */
@Component
@Slf4j
public class PostStore {

    public static final String POSTS_FILE = "slideshows.json";
    public static final String HOOKS_FILE = "hooks.txt";

    private static final TypeReference<List<SlideshowPost>> POST_LIST = new TypeReference<>() {};

    private final Path baseDir;
    private final ObjectMapper objectMapper;
    private final ObjectWriter writer;
    private final Map<String, Object> profileLocks = new ConcurrentHashMap<>();

    @Autowired
    public PostStore(HookScraperProperties properties, ObjectMapper objectMapper) {
        this(Path.of(properties.getStorage().getDataDir()).resolve("posts"), objectMapper);
    }

    public PostStore(Path baseDir, ObjectMapper objectMapper) {
        this.baseDir = baseDir;
        this.objectMapper = objectMapper;
        this.writer = objectMapper.writerWithDefaultPrettyPrinter();
    }

    public Path getBaseDir() {
        return baseDir;
    }

    /**
     * Merge posts into the profile's collection and rewrite it.
     *
     * @return number of posts now stored for the profile
     */
    public int saveAll(String profileId, Collection<SlideshowPost> posts) {
        synchronized (lockFor(profileId)) {
            Map<String, SlideshowPost> byId = new LinkedHashMap<>();
            for (SlideshowPost existing : load(profileId)) {
                byId.put(existing.getPostId(), existing);
            }
            for (SlideshowPost post : posts) {
                byId.put(post.getPostId(), post);
            }

            List<SlideshowPost> merged = new ArrayList<>(byId.values());
            Path dir = profileDir(profileId);
            try {
                JsonFiles.writeAtomically(dir.resolve(POSTS_FILE), writer, merged);
                writeHooks(dir.resolve(HOOKS_FILE), merged);
            } catch (IOException e) {
                throw new PersistenceException("Cannot write posts for profile " + profileId + ": " + e.getMessage(), e);
            }
            log.info("Stored {} posts for @{} ({} in collection)", posts.size(), profileId, merged.size());
            return merged.size();
        }
    }

    /**
     * @return stored posts in capture order, empty when nothing was stored
     */
    public List<SlideshowPost> load(String profileId) {
        Path file = profileDir(profileId).resolve(POSTS_FILE);
        if (!Files.exists(file)) {
            return List.of();
        }
        synchronized (lockFor(profileId)) {
            try {
                List<SlideshowPost> posts = objectMapper.readValue(file.toFile(), POST_LIST);
                return posts == null ? List.of() : posts;
            } catch (IOException e) {
                throw new PersistenceException("Cannot read posts for profile " + profileId + ": " + e.getMessage(), e);
            }
        }
    }

    /**
     * @return ids of every profile with a stored collection, sorted by name
     */
    public List<String> profileIds() {
        if (!Files.isDirectory(baseDir)) {
            return List.of();
        }
        try (Stream<Path> dirs = Files.list(baseDir)) {
            return dirs.filter(dir -> Files.isRegularFile(dir.resolve(POSTS_FILE)))
                    .map(dir -> dir.getFileName().toString())
                    .sorted()
                    .collect(Collectors.toList());
        } catch (IOException e) {
            throw new PersistenceException("Cannot list post store " + baseDir + ": " + e.getMessage(), e);
        }
    }

    /**
     * Files stored for a profile, empty when nothing was stored.
     */
    public List<Path> files(String profileId) {
        Path dir = profileDir(profileId);
        if (!Files.isDirectory(dir)) {
            return List.of();
        }
        try (Stream<Path> files = Files.list(dir)) {
            return files.filter(Files::isRegularFile).sorted().collect(Collectors.toList());
        } catch (IOException e) {
            throw new PersistenceException("Cannot list files of profile " + profileId + ": " + e.getMessage(), e);
        }
    }

    /**
     * Delete every stored collection.
     */
    public void clear() {
        if (!Files.exists(baseDir)) {
            return;
        }
        try (Stream<Path> paths = Files.walk(baseDir)) {
            for (Path path : paths.sorted(Comparator.reverseOrder()).collect(Collectors.toList())) {
                Files.delete(path);
            }
            log.info("Removed post store {}", baseDir);
        } catch (IOException e) {
            throw new PersistenceException("Cannot delete post store " + baseDir + ": " + e.getMessage(), e);
        }
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private Path profileDir(String profileId) {
        Path dir = baseDir.resolve(profileId).normalize();
        if (profileId.isEmpty() || !baseDir.normalize().equals(dir.getParent())) {
            throw new IllegalArgumentException("Profile id '" + profileId + "' is not a plain directory name");
        }
        return dir;
    }

    private Object lockFor(String profileId) {
        return profileLocks.computeIfAbsent(profileId, id -> new Object());
    }

    /**
     * Written through a plain stream; NIO channels close when the writing thread is interrupted.
     */
    private void writeHooks(Path file, List<SlideshowPost> posts) throws IOException {
        try (Writer out = new BufferedWriter(new OutputStreamWriter(
                new FileOutputStream(file.toFile()), StandardCharsets.UTF_8))) {
            for (SlideshowPost post : posts) {
                if (post.getHook() != null && !post.getHook().text().isEmpty()) {
                    out.write(post.getHook().text());
                    out.write("\n\n");
                }
            }
        }
    }
}
