package com.hookintel.hook.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.hookintel.hook.config.HookScraperProperties;
import com.hookintel.hook.model.Dataset;
import com.hookintel.hook.model.DatasetStatistics;
import com.hookintel.hook.model.HookCategory;
import com.hookintel.hook.model.Profile;
import com.hookintel.hook.model.ProfileStatus;
import com.hookintel.hook.model.RunSummary;
import com.hookintel.hook.output.DatasetWriter;
import com.hookintel.hook.service.DatasetAggregator;
import com.hookintel.hook.service.ProfileRegistry;
import com.hookintel.hook.service.ScrapeOrchestrator;
import com.hookintel.hook.store.PersistenceException;
import com.hookintel.hook.store.PostStore;
import com.hookintel.hook.store.ProfileFileStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Command line front end.
 *
 * Usage: hook-scraper &lt;command&gt; [arguments] [--options]
 * The first non-option argument is the command, the rest are its handles.
 * Exit code 1 on usage errors and storage failures; failed profiles do not change it.
 */
@Component
@Slf4j
public class HookScraperCli implements ApplicationRunner, ExitCodeGenerator {

    private static final DateTimeFormatter TIME = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm");

    private final ProfileRegistry registry;
    private final PostStore postStore;
    private final ScrapeOrchestrator orchestrator;
    private final DatasetAggregator aggregator;
    private final DatasetWriter datasetWriter;
    private final HookScraperProperties properties;
    private final ObjectMapper objectMapper;
    private final PrintStream out;
    private final BufferedReader in;

    private int exitCode;

    @Autowired
    public HookScraperCli(ProfileRegistry registry,
                          PostStore postStore,
                          ScrapeOrchestrator orchestrator,
                          DatasetAggregator aggregator,
                          DatasetWriter datasetWriter,
                          HookScraperProperties properties,
                          ObjectMapper objectMapper) {
        this(registry, postStore, orchestrator, aggregator, datasetWriter, properties, objectMapper,
                System.out, System.in);
    }

    public HookScraperCli(ProfileRegistry registry,
                          PostStore postStore,
                          ScrapeOrchestrator orchestrator,
                          DatasetAggregator aggregator,
                          DatasetWriter datasetWriter,
                          HookScraperProperties properties,
                          ObjectMapper objectMapper,
                          PrintStream out,
                          InputStream in) {
        this.registry = registry;
        this.postStore = postStore;
        this.orchestrator = orchestrator;
        this.aggregator = aggregator;
        this.datasetWriter = datasetWriter;
        this.properties = properties;
        this.objectMapper = objectMapper;
        this.out = out;
        this.in = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8));
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    @Override
    public void run(ApplicationArguments args) {
        List<String> positional = args.getNonOptionArgs();
        if (positional.isEmpty()) {
            printUsage();
            return;
        }
        String command = positional.get(0).toLowerCase(Locale.ROOT);
        List<String> handles = splitHandles(positional.subList(1, positional.size()));

        registry.loadWarning().ifPresent(warning -> out.println("Warning: " + warning));

        try {
            switch (command) {
                case "add" -> add(handles);
                case "remove" -> remove(handles);
                case "list" -> list();
                case "info" -> info(handles);
                case "reset" -> reset(handles);
                case "skip" -> skip(handles);
                case "scrape" -> scrape(args);
                case "analyze" -> analyze(args);
                case "clean" -> clean(args.containsOption("force"));
                case "help" -> printUsage();
                default -> usageError("Unknown command: " + command);
            }
        } catch (PersistenceException e) {
            log.error("Storage failure during '{}': {}", command, e.getMessage(), e);
            out.println("Error: " + e.getMessage());
            exitCode = 1;
        } catch (IllegalArgumentException e) {
            usageError(e.getMessage());
        }
    }

    // ── Profile commands ─────────────────────────────────────────────────────

    private void add(List<String> handles) {
        if (handles.isEmpty()) {
            usageError("add needs at least one handle");
            return;
        }
        for (String handle : handles) {
            String id = ProfileRegistry.normalize(handle);
            if (!id.isEmpty() && !ProfileRegistry.isValidId(id)) {
                out.println("Invalid handle: " + handle + " (letters, digits, '.' and '_' only)");
            } else if (registry.add(List.of(handle)) > 0) {
                out.println("Added profile: @" + id);
            } else if (!id.isEmpty()) {
                out.println("Profile already exists: @" + id);
            }
        }
    }

    private void remove(List<String> handles) {
        if (handles.isEmpty()) {
            usageError("remove needs at least one handle");
            return;
        }
        for (String handle : handles) {
            String id = ProfileRegistry.normalize(handle);
            if (registry.remove(List.of(handle)) > 0) {
                out.println("Removed profile: @" + id);
            } else {
                out.println("Profile not found: @" + id);
            }
        }
    }

    private void list() {
        List<Profile> profiles = registry.listAll();
        if (profiles.isEmpty()) {
            out.println("No profiles tracked. Add one with: add <handle>");
            return;
        }
        out.printf("%-30s %-10s %6s %10s  %-16s  %s%n",
                "PROFILE", "STATUS", "TOTAL", "SLIDESHOWS", "LAST SCRAPED", "REASON");
        for (Profile p : profiles) {
            out.printf("%-30s %-10s %6d %10d  %-16s  %s%n",
                    "@" + p.getId(),
                    p.getStatus(),
                    p.getTotalPosts(),
                    p.getPostCount(),
                    p.getLastScrapedAt() == null ? "-" : TIME.format(p.getLastScrapedAt()),
                    p.getFailureReason() == null ? "" : p.getFailureReason());
        }
        out.printf("%nTotal: %d | Completed: %d | Pending: %d | Failed: %d | Skipped: %d%n",
                profiles.size(),
                count(profiles, ProfileStatus.COMPLETED),
                count(profiles, ProfileStatus.PENDING),
                count(profiles, ProfileStatus.FAILED),
                count(profiles, ProfileStatus.SKIPPED));
    }

    private void info(List<String> handles) {
        if (handles.size() != 1) {
            usageError("info needs exactly one handle");
            return;
        }
        Optional<Profile> found = registry.get(handles.get(0));
        if (found.isEmpty()) {
            out.println("Profile @" + ProfileRegistry.normalize(handles.get(0)) + " not found");
            return;
        }
        Profile p = found.get();
        out.println("Profile: @" + p.getId());
        out.println("url: " + p.getUrl());
        out.println("status: " + p.getStatus());
        out.println("added: " + (p.getAddedAt() == null ? "-" : TIME.format(p.getAddedAt())));
        out.println("last scraped: " + (p.getLastScrapedAt() == null ? "-" : TIME.format(p.getLastScrapedAt())));
        out.println("total posts: " + p.getTotalPosts());
        out.println("slideshow posts: " + p.getPostCount());
        out.println("errors: " + p.getErrorCount());
        if (p.getFailureReason() != null) {
            out.println("failure reason: " + p.getFailureReason());
        }

        List<Path> files = postStore.files(p.getId());
        if (!files.isEmpty()) {
            out.println();
            out.println("Scraped files:");
            for (Path file : files) {
                out.printf(Locale.ROOT, "  - %s (%.1f KB)%n", file.getFileName(), sizeOf(file) / 1024.0);
            }
        }
    }

    private void reset(List<String> handles) {
        List<String> reset;
        if (handles.isEmpty()) {
            reset = registry.resetFailed();
            if (reset.isEmpty()) {
                out.println("No failed profiles to reset");
                return;
            }
        } else {
            reset = registry.reset(handles);
            for (String handle : handles) {
                String id = ProfileRegistry.normalize(handle);
                if (!reset.contains(id)) {
                    out.println("Profile not found: @" + id);
                }
            }
        }
        reset.forEach(id -> out.println("Reset profile: @" + id));
    }

    private void skip(List<String> handles) {
        if (handles.isEmpty()) {
            usageError("skip needs at least one handle");
            return;
        }
        for (String handle : handles) {
            String id = ProfileRegistry.normalize(handle);
            if (registry.contains(id)) {
                registry.markSkipped(id);
                out.println("Skipped profile: @" + id);
            } else {
                out.println("Profile not found: @" + id);
            }
        }
    }

    // ── Scrape ───────────────────────────────────────────────────────────────

    private void scrape(ApplicationArguments args) {
        int limit = parseLimit(args);
        List<String> requested = splitHandles(optionValues(args, "profiles"));

        RunSummary summary;
        if (!requested.isEmpty()) {
            out.println("Profiles to scrape: " + requested.stream()
                    .map(h -> "@" + ProfileRegistry.normalize(h))
                    .collect(Collectors.joining(", ")));
            summary = orchestrator.scrapeProfiles(requested, limit);
        } else {
            if (registry.listAll().stream().noneMatch(p -> p.getStatus() == ProfileStatus.PENDING
                    || p.getStatus() == ProfileStatus.SCRAPING)) {
                out.println("No pending profiles to scrape");
                if (!args.containsOption("all")) {
                    out.println("Use --profiles=a,b to pick profiles or reset failed ones first");
                }
                return;
            }
            summary = orchestrator.scrapePending(limit);
        }
        printSummary(summary);
    }

    private void printSummary(RunSummary summary) {
        out.println();
        out.println("Scraping summary");
        out.println("----------------------------------------");
        out.println("Profiles completed: " + summary.getProfilesCompleted());
        out.println("Profiles failed:    " + summary.getProfilesFailed());
        summary.getFailures().forEach((id, reason) -> out.println("  @" + id + ": " + reason));
        if (!summary.getUnclaimedProfiles().isEmpty()) {
            out.println("Not scraped (completed, skipped or busy): " + summary.getUnclaimedProfiles().stream()
                    .map(id -> "@" + id)
                    .collect(Collectors.joining(", ")));
        }
        out.println("Posts accepted:     " + summary.getPostsAccepted());
        out.println("Posts rejected:     " + summary.getPostsRejected());
        out.println("Posts malformed:    " + summary.getPostsMalformed());
    }

    // ── Analyze ──────────────────────────────────────────────────────────────

    private void analyze(ApplicationArguments args) {
        Path output = Path.of(optionValue(args, "output").orElse(properties.getOutput().getDefaultFile()));
        Optional<String> dataDir = optionValue(args, "data-dir");

        Dataset dataset;
        if (dataDir.isPresent()) {
            Path dir = Path.of(dataDir.get());
            ProfileFileStore profiles = new ProfileFileStore(dir.resolve(properties.getStorage().getRegistryFile()), objectMapper);
            dataset = aggregator.build(loadProfiles(profiles), new PostStore(dir.resolve("posts"), objectMapper));
        } else {
            dataset = aggregator.build(registry.listAll());
        }

        if (dataset.isEmpty()) {
            out.println("No hooks found in scraped data");
        }
        List<Path> written = datasetWriter.write(dataset, output);

        DatasetStatistics stats = dataset.statistics();
        out.println();
        out.println("Analysis summary");
        out.println("----------------------------------------");
        out.println("Total hooks:    " + stats.getTotalRecords());
        out.println("Total profiles: " + stats.getTotalProfiles());
        out.println();
        out.println("Categories:");
        for (Map.Entry<HookCategory, Integer> e : stats.getCategoryCounts().entrySet()) {
            out.println("  - " + e.getKey().getLabel() + ": " + e.getValue());
        }
        out.println();
        out.printf(Locale.ROOT, "Avg quality score: %.2f%n", stats.getMeanQualityScore());
        out.printf(Locale.ROOT, "Avg hook length:   %.1f chars%n", stats.getMeanHookLength());
        out.printf(Locale.ROOT, "Avg word count:    %.1f words%n", stats.getMeanWordCount());
        written.forEach(path -> out.println("Written " + path));
    }

    private List<Profile> loadProfiles(ProfileFileStore store) {
        try {
            return store.load();
        } catch (PersistenceException e) {
            out.println("Warning: " + e.getMessage() + " - using stored posts only");
            return List.of();
        }
    }

    // ── Clean ────────────────────────────────────────────────────────────────

    private void clean(boolean force) {
        if (!force && !confirm("This will delete all scraped data. Continue? [y/N] ")) {
            out.println("Cleanup cancelled");
            return;
        }
        postStore.clear();
        out.println("Removed scraped data directory");
        List<String> reset = registry.resetAll();
        out.println("Reset " + reset.size() + " profiles");
    }

    private boolean confirm(String prompt) {
        out.print(prompt);
        out.flush();
        try {
            String answer = in.readLine();
            return answer != null && answer.strip().toLowerCase(Locale.ROOT).startsWith("y");
        } catch (IOException e) {
            log.warn("Could not read confirmation: {}", e.getMessage());
            return false;
        }
    }

    // ── Helpers ──────────────────────────────────────────────────────────────

    private void printUsage() {
        out.println("Usage: hook-scraper <command> [arguments] [options]");
        out.println();
        out.println("Commands:");
        out.println("  add <handles...>        Track profiles (with or without @)");
        out.println("  remove <handles...>     Stop tracking profiles");
        out.println("  list                    Show tracked profiles and their status");
        out.println("  info <handle>           Show one profile and its stored files");
        out.println("  reset [handles...]      Return profiles to PENDING (default: all FAILED)");
        out.println("  skip <handles...>       Mark profiles SKIPPED");
        out.println("  scrape [--profiles=a,b] [--all] [--limit=N]");
        out.println("                          Scrape named profiles, or every pending one");
        out.println("  analyze [--output=file] [--data-dir=dir]");
        out.println("                          Build the training dataset from stored posts");
        out.println("  clean [--force]         Delete stored posts and reset every profile");
        out.println("  help                    Show this message");
    }

    private void usageError(String message) {
        out.println("Error: " + message);
        out.println("Run 'help' for usage.");
        exitCode = 1;
    }

    private int parseLimit(ApplicationArguments args) {
        Optional<String> value = optionValue(args, "limit");
        if (value.isEmpty()) {
            return 0;
        }
        try {
            int limit = Integer.parseInt(value.get().strip());
            if (limit <= 0) {
                throw new IllegalArgumentException("--limit must be a positive number");
            }
            return limit;
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("--limit must be a number: " + value.get());
        }
    }

    private static List<String> optionValues(ApplicationArguments args, String name) {
        List<String> values = args.getOptionValues(name);
        return values == null ? List.of() : values;
    }

    private static Optional<String> optionValue(ApplicationArguments args, String name) {
        return optionValues(args, name).stream().filter(v -> !v.isBlank()).findFirst();
    }

    /**
     * Handles may be given as separate arguments or comma separated.
     */
    private static List<String> splitHandles(List<String> raw) {
        List<String> handles = new ArrayList<>();
        for (String value : raw) {
            Arrays.stream(value.split(","))
                    .map(String::strip)
                    .filter(s -> !s.isEmpty())
                    .forEach(handles::add);
        }
        return handles;
    }

    private static long count(List<Profile> profiles, ProfileStatus status) {
        return profiles.stream().filter(p -> p.getStatus() == status).count();
    }

    private static long sizeOf(Path file) {
        try {
            return Files.size(file);
        } catch (IOException e) {
            log.warn("Cannot read size of {}: {}", file, e.getMessage());
            return 0;
        }
    }
}
