package com.hookintel.hook.service.fetch;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.hookintel.hook.model.MediaType;
import com.hookintel.hook.model.RawPost;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns a rendered profile page into RawPosts.
 *
 * The page embeds its initial state as JSON, either in the
 * __UNIVERSAL_DATA_FOR_REHYDRATION__ script or in window.SIGI_STATE. Item lists are
 * collected from every known location in that state. When no state JSON is present the
 * post tiles of the DOM are read instead, which only yields id, media type, caption
 * and view count.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class TikTokPageParser {

    private static final String UNIVERSAL_DATA_ID = "__UNIVERSAL_DATA_FOR_REHYDRATION__";
    private static final Pattern SIGI_STATE = Pattern.compile("window\\.SIGI_STATE\\s*=\\s*(\\{.*?\\});", Pattern.DOTALL);
    private static final Pattern POST_HREF = Pattern.compile("/(video|photo)/(\\d+)");
    private static final Pattern STAT_NUMBER = Pattern.compile("([\\d.,]+)\\s*([KMB]?)", Pattern.CASE_INSENSITIVE);

    private static final String[] CAPTION_FIELDS = {"desc", "description", "caption", "text", "title"};
    private static final String[] ID_FIELDS = {"id", "itemId", "video_id"};
    private static final String[] LIKE_FIELDS = {"diggCount", "digg_count", "likes", "heart_count"};
    private static final String[] VIEW_FIELDS = {"playCount", "play_count", "views", "video_play_count"};
    private static final String[] COMMENT_FIELDS = {"commentCount", "comment_count", "comments"};
    private static final String[] SHARE_FIELDS = {"shareCount", "share_count", "shares"};
    private static final String[] TIME_FIELDS = {"createTime", "create_time", "createdAt", "created_at", "timestamp"};

    private final ObjectMapper objectMapper;

    /**
     * @param html       page source
     * @param limit      maximum posts to return
     * @param capturedAt capture timestamp stamped on every post
     */
    public List<RawPost> parse(String html, int limit, LocalDateTime capturedAt) {
        Document doc = Jsoup.parse(html);
        JsonNode state = readState(doc);

        List<RawPost> posts = new ArrayList<>();
        if (state != null) {
            for (JsonNode item : collectItems(state)) {
                posts.add(toRawPost(item, capturedAt));
            }
        }
        if (posts.isEmpty()) {
            log.debug("No items in page state, reading post tiles");
            posts = readTiles(doc, capturedAt);
        }
        return posts.size() > limit ? new ArrayList<>(posts.subList(0, limit)) : posts;
    }

    // ── Page state ───────────────────────────────────────────────────────────

    private JsonNode readState(Document doc) {
        Element universal = doc.getElementById(UNIVERSAL_DATA_ID);
        if (universal != null) {
            JsonNode node = readJson(universal.data());
            if (node != null) return node;
        }
        Element sigiScript = doc.getElementById("SIGI_STATE");
        if (sigiScript != null) {
            JsonNode node = readJson(sigiScript.data());
            if (node != null) return node;
        }
        for (Element script : doc.select("script")) {
            String data = script.data();
            if (data.contains("window.SIGI_STATE")) {
                Matcher m = SIGI_STATE.matcher(data);
                if (m.find()) {
                    JsonNode node = readJson(m.group(1));
                    if (node != null) return node;
                }
            }
        }
        return null;
    }

    private JsonNode readJson(String json) {
        if (json == null || json.isBlank()) {
            return null;
        }
        try {
            return objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            log.warn("Unparseable page state: {}", e.getOriginalMessage());
            return null;
        }
    }

    /**
     * Items from every list the page state is known to carry, first occurrence of an id wins.
     */
    private List<JsonNode> collectItems(JsonNode state) {
        Map<String, JsonNode> items = new LinkedHashMap<>();
        List<JsonNode> withoutId = new ArrayList<>();

        JsonNode scope = state.path("__DEFAULT_SCOPE__");
        if (scope.isObject()) {
            JsonNode userDetail = scope.path("webapp.user-detail");
            addAll(userDetail.path("userInfo").path("itemList"), items, withoutId);
            Iterator<Map.Entry<String, JsonNode>> fields = scope.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> entry = fields.next();
                if (entry.getKey().startsWith("webapp.")) {
                    addAll(entry.getValue().path("itemList"), items, withoutId);
                }
            }
        }
        JsonNode itemModule = state.path("ItemModule");
        if (itemModule.isObject()) {
            itemModule.elements().forEachRemaining(item -> add(item, items, withoutId));
        }
        addAll(state.path("items"), items, withoutId);

        List<JsonNode> all = new ArrayList<>(items.values());
        all.addAll(withoutId);
        return all;
    }

    private void addAll(JsonNode list, Map<String, JsonNode> items, List<JsonNode> withoutId) {
        if (list.isArray()) {
            list.forEach(item -> add(item, items, withoutId));
        }
    }

    private void add(JsonNode item, Map<String, JsonNode> items, List<JsonNode> withoutId) {
        if (!item.isObject()) {
            return;
        }
        String id = text(item, ID_FIELDS);
        if (id == null) {
            withoutId.add(item);
        } else {
            items.putIfAbsent(id, item);
        }
    }

    private RawPost toRawPost(JsonNode item, LocalDateTime capturedAt) {
        List<String> images = imageUrls(item);
        return RawPost.builder()
                .postId(text(item, ID_FIELDS))
                .caption(caption(item))
                .mediaType(mediaType(item, images))
                .imageCount(images.isEmpty() ? null : images.size())
                .imageUrls(images)
                .likes(stat(item, LIKE_FIELDS))
                .views(stat(item, VIEW_FIELDS))
                .comments(stat(item, COMMENT_FIELDS))
                .shares(stat(item, SHARE_FIELDS))
                .postedAt(timestamp(item))
                .capturedAt(capturedAt)
                .build();
    }

    private String caption(JsonNode item) {
        String caption = text(item, CAPTION_FIELDS);
        if (caption == null) {
            caption = text(item.path("video"), CAPTION_FIELDS);
        }
        return caption;
    }

    private MediaType mediaType(JsonNode item, List<String> images) {
        if (item.has("imagePost") || images.size() > 1) {
            return MediaType.SLIDESHOW;
        }
        if (item.path("video").isObject() || item.has("videoUrl")) {
            return MediaType.VIDEO;
        }
        return MediaType.UNKNOWN;
    }

    private List<String> imageUrls(JsonNode item) {
        List<String> urls = new ArrayList<>();
        JsonNode images = item.path("imagePost").path("images");
        if (!images.isArray()) {
            images = item.path("images");
        }
        if (images.isArray()) {
            for (JsonNode image : images) {
                String url = image.isTextual() ? image.asText() : imageUrl(image);
                if (url != null && !urls.contains(url)) {
                    urls.add(url);
                }
            }
        }
        return urls;
    }

    private String imageUrl(JsonNode image) {
        JsonNode urlList = image.path("imageURL").path("urlList");
        if (urlList.isArray() && !urlList.isEmpty()) {
            return urlList.get(0).asText();
        }
        return text(image, "url", "imageUrl", "imageURL");
    }

    /**
     * Counters live on the item itself, under stats, or as strings under statsV2.
     */
    private Long stat(JsonNode item, String[] fields) {
        for (JsonNode holder : List.of(item.path("stats"), item.path("statsV2"), item.path("statistics"), item)) {
            for (String field : fields) {
                JsonNode value = holder.get(field);
                if (value != null && !value.isNull()) {
                    if (value.isNumber()) return value.asLong();
                    if (value.isTextual() && value.asText().matches("-?\\d+")) return Long.parseLong(value.asText());
                }
            }
        }
        return null;
    }

    private LocalDateTime timestamp(JsonNode item) {
        for (String field : TIME_FIELDS) {
            JsonNode value = item.get(field);
            if (value == null || value.isNull()) continue;
            long epoch = value.isNumber() ? value.asLong()
                    : value.asText().matches("\\d+") ? Long.parseLong(value.asText()) : -1;
            if (epoch > 0) {
                return LocalDateTime.ofEpochSecond(epoch, 0, ZoneOffset.UTC);
            }
        }
        return null;
    }

    private String text(JsonNode node, String... fields) {
        for (String field : fields) {
            JsonNode value = node.get(field);
            if (value != null && value.isValueNode() && !value.isNull() && !value.asText().isBlank()) {
                return value.asText();
            }
        }
        return null;
    }

    // ── DOM fallback ─────────────────────────────────────────────────────────

    private List<RawPost> readTiles(Document doc, LocalDateTime capturedAt) {
        List<RawPost> posts = new ArrayList<>();
        for (Element tile : doc.select("[data-e2e=user-post-item]")) {
            Element link = tile.selectFirst("a[href]");
            if (link == null) continue;
            Matcher m = POST_HREF.matcher(link.attr("href"));
            if (!m.find()) continue;

            Element img = tile.selectFirst("img[alt]");
            Element views = tile.selectFirst("[data-e2e=video-views]");
            posts.add(RawPost.builder()
                    .postId(m.group(2))
                    .mediaType("photo".equals(m.group(1)) ? MediaType.SLIDESHOW : MediaType.VIDEO)
                    .caption(img != null ? img.attr("alt") : null)
                    .views(views != null ? parseStatNumber(views.text()) : null)
                    .capturedAt(capturedAt)
                    .build());
        }
        return posts;
    }

    /**
     * Parse display counters such as "523", "12.5K" or "1.2M".
     */
    static Long parseStatNumber(String text) {
        if (text == null) return null;
        Matcher m = STAT_NUMBER.matcher(text.strip());
        if (!m.matches()) return null;
        try {
            double value = Double.parseDouble(m.group(1).replace(",", ""));
            double multiplier = switch (m.group(2).toUpperCase()) {
                case "K" -> 1_000d;
                case "M" -> 1_000_000d;
                case "B" -> 1_000_000_000d;
                default -> 1d;
            };
            return Math.round(value * multiplier);
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
