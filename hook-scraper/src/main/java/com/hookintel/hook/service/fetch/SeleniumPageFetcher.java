package com.hookintel.hook.service.fetch;

import com.hookintel.hook.config.HookScraperProperties;
import com.hookintel.hook.model.RawPost;
import com.hookintel.hook.service.Pacer;
import lombok.extern.slf4j.Slf4j;
import org.openqa.selenium.By;
import org.openqa.selenium.JavascriptExecutor;
import org.openqa.selenium.TimeoutException;
import org.openqa.selenium.WebDriver;
import org.openqa.selenium.WebDriverException;
import org.openqa.selenium.support.ui.ExpectedConditions;
import org.openqa.selenium.support.ui.WebDriverWait;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Loads a profile page in a real browser, scrolls to load more posts and hands the
 * rendered page to the parser.
 *
 * Scrolls stop early once the page shows enough posts or stops growing.
 */
@Slf4j
public class SeleniumPageFetcher implements PageFetcher {

    private static final By POST_ITEM = By.cssSelector("[data-e2e=user-post-item]");

    private final WebDriver driver;
    private final TikTokPageParser parser;
    private final Pacer pacer;
    private final HookScraperProperties.Browser settings;

    public SeleniumPageFetcher(WebDriver driver, TikTokPageParser parser, Pacer pacer,
                               HookScraperProperties.Browser settings) {
        this.driver = driver;
        this.parser = parser;
        this.pacer = pacer;
        this.settings = settings;
    }

    @Override
    public List<RawPost> fetchPosts(String profileId, int limit) {
        String url = String.format(settings.getProfileUrlTemplate(), profileId);
        log.info("Navigating to profile: {}", url);
        try {
            driver.get(url);
            new WebDriverWait(driver, settings.getTimeout())
                    .until(ExpectedConditions.presenceOfElementLocated(POST_ITEM));

            int loaded = scroll(limit);
            log.info("@{}: {} post tiles rendered", profileId, loaded);

            List<RawPost> posts = parser.parse(driver.getPageSource(), limit, LocalDateTime.now());
            log.info("@{}: parsed {} posts", profileId, posts.size());
            return posts;

        } catch (TimeoutException e) {
            throw new FetchException("No posts rendered for @" + profileId + " within " + settings.getTimeout(), e);
        } catch (WebDriverException e) {
            throw new FetchException("Browser failed on @" + profileId + ": " + firstLine(e.getMessage()), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new FetchException("Interrupted while loading @" + profileId, e);
        }
    }

    @Override
    public void close() {
        try {
            driver.quit();
        } catch (WebDriverException e) {
            log.warn("Error closing browser session: {}", firstLine(e.getMessage()));
        }
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private int scroll(int limit) throws InterruptedException {
        int count = driver.findElements(POST_ITEM).size();
        for (int i = 0; i < settings.getMaxScrolls() && count < limit; i++) {
            ((JavascriptExecutor) driver).executeScript("window.scrollTo(0, document.body.scrollHeight)");
            pacer.pause();

            int next = driver.findElements(POST_ITEM).size();
            if (next == count) {
                log.debug("No new posts after scroll {}", i + 1);
                break;
            }
            count = next;
        }
        return count;
    }

    private static String firstLine(String message) {
        if (message == null) {
            return "unknown error";
        }
        int nl = message.indexOf('\n');
        return nl < 0 ? message : message.substring(0, nl);
    }
}
