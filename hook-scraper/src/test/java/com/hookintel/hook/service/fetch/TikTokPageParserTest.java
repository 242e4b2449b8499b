package com.hookintel.hook.service.fetch;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.hookintel.hook.model.MediaType;
import com.hookintel.hook.model.RawPost;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.time.LocalDateTime;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TikTokPageParserTest {

    private static final LocalDateTime CAPTURED = LocalDateTime.of(2024, 5, 2, 9, 0);

    private final TikTokPageParser parser = new TikTokPageParser(new ObjectMapper());

    @Test
    void parse_readsUniversalDataItems() throws IOException {
        List<RawPost> posts = parser.parse(fixture("profile_universal.html"), 50, CAPTURED);

        assertEquals(2, posts.size());

        RawPost slideshow = posts.get(0);
        assertEquals("7301", slideshow.getPostId());
        assertEquals("3 ways to style a blazer. Save this! #style @brand", slideshow.getCaption());
        assertEquals(MediaType.SLIDESHOW, slideshow.getMediaType());
        assertEquals(3, slideshow.getImageCount());
        assertEquals("https://cdn.example/7301/1.jpg", slideshow.getImageUrls().get(0));
        assertEquals(15_400L, slideshow.getLikes());
        assertEquals(210_000L, slideshow.getViews());
        assertEquals(320L, slideshow.getComments());
        assertEquals(45L, slideshow.getShares());
        assertEquals(LocalDateTime.of(2024, 5, 1, 10, 0), slideshow.getPostedAt());
        assertEquals(CAPTURED, slideshow.getCapturedAt());

        RawPost video = posts.get(1);
        assertEquals(MediaType.VIDEO, video.getMediaType());
        assertEquals(800L, video.getLikes());
        assertEquals(12_000L, video.getViews());
        assertNull(video.getPostedAt());
        assertNull(video.getImageCount());
    }

    @Test
    void parse_appliesLimit() throws IOException {
        List<RawPost> posts = parser.parse(fixture("profile_universal.html"), 1, CAPTURED);

        assertEquals(1, posts.size());
        assertEquals("7301", posts.get(0).getPostId());
    }

    @Test
    void parse_readsInlineSigiState() throws IOException {
        List<RawPost> posts = parser.parse(fixture("profile_sigi.html"), 50, CAPTURED);

        assertEquals(2, posts.size());
        assertEquals("9001", posts.get(0).getPostId());
        assertEquals(MediaType.SLIDESHOW, posts.get(0).getMediaType());
        assertEquals(2, posts.get(0).getImageUrls().size());
        assertEquals(MediaType.VIDEO, posts.get(1).getMediaType());
    }

    @Test
    void parse_fallsBackToPostTiles() throws IOException {
        List<RawPost> posts = parser.parse(fixture("profile_tiles.html"), 50, CAPTURED);

        assertEquals(2, posts.size());
        RawPost photo = posts.get(0);
        assertEquals("7400000000000000001", photo.getPostId());
        assertEquals(MediaType.SLIDESHOW, photo.getMediaType());
        assertEquals("Top 5 budget travel tips", photo.getCaption());
        assertEquals(1_200_000L, photo.getViews());
        assertNull(photo.getLikes());
        assertEquals(MediaType.VIDEO, posts.get(1).getMediaType());
        assertEquals(523_000L, posts.get(1).getViews());
    }

    @Test
    void parse_pageWithoutPostsIsEmpty() {
        assertTrue(parser.parse("<html><body>Nothing here</body></html>", 50, CAPTURED).isEmpty());
        assertTrue(parser.parse("<html><script id=\"SIGI_STATE\">{ broken</script></html>", 50, CAPTURED).isEmpty());
    }

    @Test
    void parseStatNumber_handlesSuffixes() {
        assertEquals(1_200_000L, TikTokPageParser.parseStatNumber("1.2M"));
        assertEquals(523_000L, TikTokPageParser.parseStatNumber("523K"));
        assertEquals(87L, TikTokPageParser.parseStatNumber(" 87 "));
        assertEquals(1_234L, TikTokPageParser.parseStatNumber("1,234"));
        assertNull(TikTokPageParser.parseStatNumber("views"));
        assertNull(TikTokPageParser.parseStatNumber(null));
    }

    private static String fixture(String name) throws IOException {
        try (InputStream in = TikTokPageParserTest.class.getResourceAsStream("/fixtures/" + name)) {
            assertNotNull(in, name);
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
    }
}
