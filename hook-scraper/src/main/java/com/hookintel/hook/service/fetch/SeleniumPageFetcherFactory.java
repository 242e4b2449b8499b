package com.hookintel.hook.service.fetch;

import com.hookintel.hook.config.HookScraperProperties;
import com.hookintel.hook.service.Pacer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.openqa.selenium.WebDriver;
import org.springframework.beans.BeansException;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Component;

@Component
@Slf4j
@RequiredArgsConstructor
public class SeleniumPageFetcherFactory implements PageFetcherFactory {

    private final ObjectProvider<WebDriver> webDrivers;
    private final TikTokPageParser parser;
    private final Pacer pacer;
    private final HookScraperProperties properties;

    @Override
    public PageFetcher open() {
        try {
            return new SeleniumPageFetcher(webDrivers.getObject(), parser, pacer, properties.getBrowser());
        } catch (BeansException e) {
            log.error("Could not start browser session: {}", e.getMessage());
            throw new FetchException("Could not start browser session: " + e.getMessage(), e);
        }
    }
}
