package com.hookintel.hook.service;

import com.hookintel.hook.config.HookScraperProperties;
import com.hookintel.hook.model.Profile;
import com.hookintel.hook.model.ProfileStatus;
import com.hookintel.hook.store.PersistenceException;
import com.hookintel.hook.store.ProfileFileStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Consumer;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Tracked profiles and their scrape state.
 *
 * Every mutation is serialised on this registry and written to disk before it becomes
 * visible; a failed write leaves the in-memory state untouched and throws
 * {@link PersistenceException}. Workers claim a profile before touching its data, and a
 * profile claimed by a live worker cannot be claimed again until it completes or fails.
 */
@Service
@Slf4j
public class ProfileRegistry {

    /** Handles double as directory names under the post store */
    private static final Pattern VALID_ID = Pattern.compile("[a-z0-9._]+");

    private final ProfileFileStore fileStore;
    private final String urlTemplate;

    private final Map<String, Profile> profiles = new LinkedHashMap<>();
    private final Set<String> claimed = new HashSet<>();
    private final String loadWarning;

    public ProfileRegistry(ProfileFileStore fileStore, HookScraperProperties properties) {
        this.fileStore = fileStore;
        this.urlTemplate = properties.getBrowser().getProfileUrlTemplate();

        String warning = null;
        try {
            for (Profile profile : fileStore.load()) {
                if (isValidId(profile.getId())) {
                    profiles.put(profile.getId(), profile);
                } else {
                    log.warn("Dropping stored profile with invalid handle '{}'", profile.getId());
                }
            }
            log.debug("Loaded {} profiles from {}", profiles.size(), fileStore.getFile());
        } catch (PersistenceException e) {
            warning = e.getMessage() + " - starting with an empty registry";
            log.warn(warning);
        }
        this.loadWarning = warning;
    }

    /**
     * Normalise a handle: surrounding whitespace and leading @ removed, lower-cased.
     */
    public static String normalize(String handle) {
        if (handle == null) {
            return "";
        }
        String trimmed = handle.strip();
        int start = 0;
        while (start < trimmed.length() && trimmed.charAt(start) == '@') {
            start++;
        }
        return trimmed.substring(start).strip().toLowerCase(Locale.ROOT);
    }

    /**
     * True for handles made only of a-z, 0-9, '.' and '_' that are not "." or "..".
     */
    public static boolean isValidId(String id) {
        return id != null && VALID_ID.matcher(id).matches() && !id.equals(".") && !id.equals("..");
    }

    /** Problem met while loading the registry file, if any */
    public Optional<String> loadWarning() {
        return Optional.ofNullable(loadWarning);
    }

    // ── Membership ───────────────────────────────────────────────────────────

    /**
     * Start tracking handles. Already tracked handles, in any case and with or without @,
     * are ignored.
     *
     * @return number of profiles added
     */
    public synchronized int add(Collection<String> handles) {
        Map<String, Profile> next = new LinkedHashMap<>(profiles);
        int added = 0;
        for (String handle : handles) {
            String id = normalize(handle);
            if (id.isEmpty()) {
                log.warn("Ignoring empty handle '{}'", handle);
                continue;
            }
            if (!isValidId(id)) {
                log.warn("Ignoring invalid handle '{}'", handle);
                continue;
            }
            if (next.containsKey(id)) {
                log.debug("Profile @{} already tracked", id);
                continue;
            }
            next.put(id, Profile.builder()
                    .id(id)
                    .url(String.format(urlTemplate, id))
                    .status(ProfileStatus.PENDING)
                    .addedAt(LocalDateTime.now())
                    .build());
            added++;
        }
        if (added > 0) {
            commit(next);
            log.info("Added {} profile(s)", added);
        }
        return added;
    }

    /**
     * Stop tracking handles. Untracked handles are ignored.
     *
     * @return number of profiles removed
     */
    public synchronized int remove(Collection<String> handles) {
        Map<String, Profile> next = new LinkedHashMap<>(profiles);
        int removed = 0;
        for (String handle : handles) {
            if (next.remove(normalize(handle)) != null) {
                removed++;
            }
        }
        if (removed > 0) {
            commit(next);
            log.info("Removed {} profile(s)", removed);
        }
        return removed;
    }

    public synchronized List<Profile> listAll() {
        return profiles.values().stream().map(Profile::copy).collect(Collectors.toList());
    }

    public synchronized Optional<Profile> get(String handle) {
        return Optional.ofNullable(profiles.get(normalize(handle))).map(Profile::copy);
    }

    public synchronized boolean contains(String handle) {
        return profiles.containsKey(normalize(handle));
    }

    /**
     * First PENDING profile in insertion order, without claiming it.
     */
    public synchronized Optional<Profile> nextPending() {
        return profiles.values().stream()
                .filter(p -> p.getStatus() == ProfileStatus.PENDING)
                .findFirst()
                .map(Profile::copy);
    }

    // ── Claims ───────────────────────────────────────────────────────────────

    /**
     * Atomically take the first PENDING profile and move it to SCRAPING. A profile left in
     * SCRAPING by an interrupted earlier run counts as pending.
     */
    public synchronized Optional<Profile> claimNextPending() {
        Optional<Profile> next = profiles.values().stream()
                .filter(p -> p.getStatus() == ProfileStatus.PENDING || p.getStatus() == ProfileStatus.SCRAPING)
                .filter(p -> !claimed.contains(p.getId()))
                .findFirst();
        if (next.isEmpty()) {
            return Optional.empty();
        }
        String id = next.get().getId();
        markScraping(id);
        claimed.add(id);
        return get(id);
    }

    /**
     * Atomically move a profile to SCRAPING for the calling worker.
     *
     * @return false when the profile is untracked, COMPLETED, SKIPPED or held by another worker
     */
    public synchronized boolean claim(String handle) {
        String id = normalize(handle);
        Profile profile = profiles.get(id);
        if (profile == null || profile.getStatus().isTerminal() || claimed.contains(id)) {
            return false;
        }
        markScraping(id);
        claimed.add(id);
        return true;
    }

    // ── Transitions ──────────────────────────────────────────────────────────

    /**
     * Any non-terminal state may move to SCRAPING, which lets an interrupted run resume.
     */
    public synchronized void markScraping(String handle) {
        String id = normalize(handle);
        Profile current = require(id);
        if (current.getStatus().isTerminal()) {
            throw new IllegalStateException("Profile @" + id + " is " + current.getStatus() + "; reset it first");
        }
        mutate(id, p -> {
            p.setStatus(ProfileStatus.SCRAPING);
            p.setFailureReason(null);
        });
    }

    /**
     * @param postCount  slideshow posts retained by this scrape
     * @param totalPosts posts fetched by this scrape, slideshows or not
     */
    public synchronized void markCompleted(String handle, int postCount, int totalPosts) {
        String id = normalize(handle);
        Profile current = require(id);
        if (current.getStatus() != ProfileStatus.SCRAPING) {
            throw new IllegalStateException("Profile @" + id + " is " + current.getStatus() + ", not SCRAPING");
        }
        try {
            mutate(id, p -> {
                p.setStatus(ProfileStatus.COMPLETED);
                p.setPostCount(postCount);
                p.setTotalPosts(totalPosts);
                p.setLastScrapedAt(LocalDateTime.now());
                p.setFailureReason(null);
            });
        } finally {
            claimed.remove(id);
        }
    }

    public synchronized void markFailed(String handle, String reason) {
        String id = normalize(handle);
        Profile current = require(id);
        if (current.getStatus().isTerminal()) {
            throw new IllegalStateException("Profile @" + id + " is " + current.getStatus() + "; cannot fail it");
        }
        String why = reason == null || reason.isBlank() ? "Unknown error" : reason;
        try {
            mutate(id, p -> {
                p.setStatus(ProfileStatus.FAILED);
                p.setFailureReason(why);
                p.setErrorCount(p.getErrorCount() + 1);
                p.setLastErrorAt(LocalDateTime.now());
            });
        } finally {
            claimed.remove(id);
        }
    }

    public synchronized void markSkipped(String handle) {
        String id = normalize(handle);
        require(id);
        try {
            mutate(id, p -> {
                p.setStatus(ProfileStatus.SKIPPED);
                p.setFailureReason(null);
            });
        } finally {
            claimed.remove(id);
        }
    }

    /**
     * Return profiles to PENDING and clear their error history. Untracked handles are ignored.
     *
     * @return ids that were reset
     */
    public synchronized List<String> reset(Collection<String> handles) {
        Map<String, Profile> next = new LinkedHashMap<>(profiles);
        List<String> reset = new ArrayList<>();
        for (String handle : handles) {
            String id = normalize(handle);
            Profile profile = next.get(id);
            if (profile == null || reset.contains(id)) {
                continue;
            }
            Profile updated = profile.copy();
            updated.setStatus(ProfileStatus.PENDING);
            updated.setFailureReason(null);
            updated.setErrorCount(0);
            next.put(id, updated);
            reset.add(id);
        }
        if (!reset.isEmpty()) {
            commit(next);
            reset.forEach(claimed::remove);
            log.info("Reset {} profile(s) to PENDING", reset.size());
        }
        return reset;
    }

    public synchronized List<String> resetFailed() {
        List<String> failed = profiles.values().stream()
                .filter(p -> p.getStatus() == ProfileStatus.FAILED)
                .map(Profile::getId)
                .collect(Collectors.toList());
        return reset(failed);
    }

    public synchronized List<String> resetAll() {
        return reset(new ArrayList<>(profiles.keySet()));
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private Profile require(String id) {
        Profile profile = profiles.get(id);
        if (profile == null) {
            throw new IllegalArgumentException("Profile @" + id + " is not tracked");
        }
        return profile;
    }

    private void mutate(String id, Consumer<Profile> change) {
        Map<String, Profile> next = new LinkedHashMap<>(profiles);
        Profile updated = next.get(id).copy();
        change.accept(updated);
        next.put(id, updated);
        commit(next);
    }

    private void commit(Map<String, Profile> next) {
        fileStore.save(next.values());
        profiles.clear();
        profiles.putAll(next);
    }
}
