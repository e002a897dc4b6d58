package com.esports.scraper.service.fetch;

import com.esports.scraper.config.ScraperProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.openqa.selenium.WebDriver;
import org.openqa.selenium.chrome.ChromeDriver;
import org.openqa.selenium.chrome.ChromeDriverService;
import org.openqa.selenium.chrome.ChromeOptions;

import java.io.File;
import java.util.function.Supplier;

/**
 * Opens headless Chrome sessions for the browser transport.
 */
@Slf4j
@RequiredArgsConstructor
public class ChromeDriverFactory implements Supplier<WebDriver> {

    private final ScraperProperties.Browser browser;

    private final String userAgent;

    @Override
    public WebDriver get() {
        log.debug("Starting Chrome (headless={})", browser.isHeadless());
        ChromeOptions options = new ChromeOptions();
        if (browser.isHeadless()) {
            options.addArguments("--headless=new");
        }
        options.addArguments(
                "--no-sandbox",
                "--disable-dev-shm-usage",
                "--disable-gpu",
                "--window-size=1920,1080",
                "--user-agent=" + userAgent);

        if (StringUtils.isNotBlank(browser.getDriverPath())) {
            ChromeDriverService service = new ChromeDriverService.Builder()
                    .usingDriverExecutable(new File(browser.getDriverPath()))
                    .build();
            return new ChromeDriver(service, options);
        }
        return new ChromeDriver(options);
    }
}
