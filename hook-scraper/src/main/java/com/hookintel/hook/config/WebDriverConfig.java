package com.hookintel.hook.config;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.openqa.selenium.Dimension;
import org.openqa.selenium.WebDriver;
import org.openqa.selenium.chrome.ChromeDriver;
import org.openqa.selenium.chrome.ChromeOptions;
import org.openqa.selenium.firefox.FirefoxDriver;
import org.openqa.selenium.firefox.FirefoxOptions;
import org.springframework.beans.factory.config.ConfigurableBeanFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Lazy;
import org.springframework.context.annotation.Scope;

import java.time.Duration;

/**
 * Browser sessions for the Selenium page fetcher. One driver per scrape worker,
 * created only when a worker asks for it.
 */
@Configuration
@Slf4j
@RequiredArgsConstructor
public class WebDriverConfig {

    private static final String USER_AGENT =
            "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/124.0.0.0 Safari/537.36";

    private final HookScraperProperties properties;

    @Bean
    @Lazy
    @Scope(ConfigurableBeanFactory.SCOPE_PROTOTYPE)
    public WebDriver webDriver() {
        HookScraperProperties.Browser browser = properties.getBrowser();
        log.info("Creating WebDriver instance: type={}, headless={}", browser.getType(), browser.isHeadless());

        WebDriver driver = switch (browser.getType()) {
            case FIREFOX -> createFirefoxDriver(browser.isHeadless());
            case CHROME -> createChromeDriver(browser.isHeadless());
        };

        driver.manage().timeouts().pageLoadTimeout(browser.getTimeout());
        driver.manage().timeouts().implicitlyWait(Duration.ofSeconds(10));
        driver.manage().window().setSize(new Dimension(browser.getWindowWidth(), browser.getWindowHeight()));

        return driver;
    }

    private WebDriver createChromeDriver(boolean headless) {
        ChromeOptions options = new ChromeOptions();
        if (headless) {
            options.addArguments("--headless=new");
        }
        options.addArguments("--no-sandbox");
        options.addArguments("--disable-dev-shm-usage");
        options.addArguments("--disable-gpu");
        options.addArguments("--disable-blink-features=AutomationControlled");
        options.addArguments("--user-agent=" + USER_AGENT);
        return new ChromeDriver(options);
    }

    private WebDriver createFirefoxDriver(boolean headless) {
        FirefoxOptions options = new FirefoxOptions();
        if (headless) {
            options.addArguments("--headless");
        }
        options.addPreference("general.useragent.override", USER_AGENT);
        options.addPreference("dom.webdriver.enabled", false);
        return new FirefoxDriver(options);
    }
}
