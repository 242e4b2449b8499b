package com.hookintel.hook.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.hookintel.hook.model.Engagement;
import com.hookintel.hook.model.Hook;
import com.hookintel.hook.model.HookCategory;
import com.hookintel.hook.model.MediaType;
import com.hookintel.hook.model.SlideshowPost;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PostStoreTest {

    @TempDir
    Path baseDir;

    private final ObjectMapper objectMapper = JsonMapper.builder()
            .findAndAddModules()
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .build();

    private PostStore store;

    @BeforeEach
    void setUp() {
        store = new PostStore(baseDir.resolve("posts"), objectMapper);
    }

    @Test
    void saveAll_roundTripsPostsInOrder() {
        store.saveAll("foo", List.of(post("1", "First hook"), post("2", "Second hook")));

        List<SlideshowPost> loaded = store.load("foo");

        assertEquals(List.of("1", "2"), ids(loaded));
        assertEquals(new Engagement(2000, 9000, 10, 1), loaded.get(0).getEngagement());
        assertEquals(HookCategory.STATEMENT, loaded.get(0).getHook().category());
        assertEquals(LocalDateTime.of(2024, 5, 1, 10, 30), loaded.get(0).getCapturedAt());
    }

    @Test
    void saveAll_duplicateIdOverwritesInPlace() {
        store.saveAll("foo", List.of(post("1", "Old"), post("2", "Keep")));

        int size = store.saveAll("foo", List.of(post("1", "New"), post("3", "Added")));

        List<SlideshowPost> loaded = store.load("foo");
        assertEquals(3, size);
        assertEquals(List.of("1", "2", "3"), ids(loaded));
        assertEquals("New", loaded.get(0).getCaption());
    }

    @Test
    void saveAll_writesHooksFile() throws IOException {
        store.saveAll("foo", List.of(post("1", "First hook"), post("2", "Second hook")));

        String hooks = Files.readString(baseDir.resolve("posts/foo/" + PostStore.HOOKS_FILE));
        assertEquals("First hook\n\nSecond hook\n\n", hooks);
    }

    @Test
    void load_missingProfileIsEmpty() {
        assertTrue(store.load("nobody").isEmpty());
        assertTrue(store.files("nobody").isEmpty());
        assertTrue(store.profileIds().isEmpty());
    }

    @Test
    void load_corruptFileIsPersistenceError() throws IOException {
        Path dir = Files.createDirectories(baseDir.resolve("posts/foo"));
        Files.writeString(dir.resolve(PostStore.POSTS_FILE), "[{ broken");

        assertThrows(PersistenceException.class, () -> store.load("foo"));
    }

    @Test
    void profileIds_sortedByName() {
        store.saveAll("zed", List.of(post("1", "a")));
        store.saveAll("amy", List.of(post("1", "b")));

        assertEquals(List.of("amy", "zed"), store.profileIds());
        assertEquals(2, store.files("amy").size());
    }

    @Test
    void clear_removesEverything() {
        store.saveAll("foo", List.of(post("1", "a")));

        store.clear();

        assertFalse(Files.exists(store.getBaseDir()));
        assertTrue(store.load("foo").isEmpty());
    }

    @Test
    void profileIdOutsideTheStoreIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> store.saveAll("../escaped", List.of(post("1", "a"))));
        assertThrows(IllegalArgumentException.class, () -> store.load(".."));
        assertThrows(IllegalArgumentException.class, () -> store.files("a/b"));

        assertFalse(Files.exists(baseDir.resolve("escaped")));
    }

    @Test
    void saveAll_completesWhileThreadIsInterrupted() {
        Thread.currentThread().interrupt();
        try {
            store.saveAll("foo", List.of(post("1", "First hook")));
        } finally {
            Thread.interrupted();
        }

        assertEquals(1, store.load("foo").size());
        assertTrue(Files.exists(store.getBaseDir().resolve("foo").resolve(PostStore.HOOKS_FILE)));
    }

    private static SlideshowPost post(String id, String caption) {
        return SlideshowPost.builder()
                .postId(id)
                .profileId("foo")
                .caption(caption)
                .mediaType(MediaType.SLIDESHOW)
                .imageUrls(List.of())
                .hashtags(List.of())
                .mentions(List.of())
                .engagement(new Engagement(2000, 9000, 10, 1))
                .capturedAt(LocalDateTime.of(2024, 5, 1, 10, 30))
                .hook(new Hook(caption, HookCategory.STATEMENT, 0.5))
                .build();
    }

    private static List<String> ids(List<SlideshowPost> posts) {
        return posts.stream().map(SlideshowPost::getPostId).collect(Collectors.toList());
    }
}
