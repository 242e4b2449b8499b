package com.hookintel.hook.service;

import com.hookintel.hook.model.Engagement;
import com.hookintel.hook.model.MediaType;
import com.hookintel.hook.model.RawPost;
import com.hookintel.hook.model.SlideshowPost;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

class RawPostMapperTest {

    private final RawPostMapper mapper = new RawPostMapper();

    @Test
    void map_copiesFieldsAndDefaultsMissingCountersToZero() {
        LocalDateTime captured = LocalDateTime.of(2024, 3, 1, 12, 0);
        RawPost raw = RawPost.builder()
                .postId(" 7301 ")
                .caption("  Morning routine ideas #Routine #morning #routine with @Coach.Anna  ")
                .mediaType(MediaType.SLIDESHOW)
                .likes(1200L)
                .views(9000L)
                .capturedAt(captured)
                .imageUrls(List.of("https://img/1.jpg", "https://img/2.jpg"))
                .build();

        SlideshowPost post = mapper.map(raw, "creator");

        assertEquals("7301", post.getPostId());
        assertEquals("creator", post.getProfileId());
        assertEquals("Morning routine ideas #Routine #morning #routine with @Coach.Anna", post.getCaption());
        assertEquals(new Engagement(1200, 9000, 0, 0), post.getEngagement());
        assertEquals(List.of("routine", "morning"), post.getHashtags());
        assertEquals(List.of("coach.anna"), post.getMentions());
        assertEquals(captured, post.getCapturedAt());
        assertEquals(2, post.getImageUrls().size());
    }

    @Test
    void map_defaultsCaptureTimeAndCaption() {
        SlideshowPost post = mapper.map(RawPost.builder().postId("1").mediaType(MediaType.SLIDESHOW).build(), "p");

        assertEquals("", post.getCaption());
        assertNotNull(post.getCapturedAt());
        assertEquals(List.of(), post.getImageUrls());
    }

    @Test
    void validate_rejectsMissingIdOrMediaType() {
        assertThrows(MalformedPostException.class, () -> mapper.validate(null));
        assertThrows(MalformedPostException.class,
                () -> mapper.validate(RawPost.builder().postId(" ").mediaType(MediaType.SLIDESHOW).build()));
        assertThrows(MalformedPostException.class,
                () -> mapper.validate(RawPost.builder().postId("1").build()));
    }

    @Test
    void validate_rejectsNegativeCounters() {
        RawPost raw = RawPost.builder().postId("1").mediaType(MediaType.SLIDESHOW).likes(-1L).build();

        MalformedPostException e = assertThrows(MalformedPostException.class, () -> mapper.validate(raw));
        assertEquals("Post 1 has negative likes: -1", e.getMessage());
    }
}
