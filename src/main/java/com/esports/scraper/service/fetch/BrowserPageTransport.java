package com.esports.scraper.service.fetch;

import com.esports.scraper.model.FetchTarget;
import com.esports.scraper.model.RawPage;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.openqa.selenium.By;
import org.openqa.selenium.WebDriver;
import org.openqa.selenium.WebDriverException;
import org.openqa.selenium.support.ui.ExpectedConditions;
import org.openqa.selenium.support.ui.WebDriverWait;

import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.TimeoutException;

/**
 * Renders a page in a real browser so script-populated content is present
 * in the returned markup.
 * <p>
 * After navigation the transport waits for the template's ready selector,
 * falling back to a fixed settle time for templates without one.
 * </p>
 */
@Slf4j
public class BrowserPageTransport implements PageTransport {

    private static final int RENDERED_STATUS = 200;

    private final BrowserSessionPool pool;

    private final Map<String, String> readySelectors;

    private final Duration settleTime;

    private final Duration slotWait;

    private final Clock clock;

    public BrowserPageTransport(final BrowserSessionPool pool,
                                final Map<String, String> readySelectors,
                                final Duration settleTime,
                                final Duration slotWait,
                                final Clock clock) {
        this.pool = pool;
        this.readySelectors = Map.copyOf(readySelectors);
        this.settleTime = settleTime;
        this.slotWait = slotWait;
        this.clock = clock;
    }

    @Override
    public RawPage fetch(final FetchTarget target, final Duration timeout) {
        String url = target.url();
        WebDriver driver;
        try {
            driver = pool.borrow(slotWait);
        } catch (TimeoutException ex) {
            throw FetchException.renderFailure(url, ex.getMessage(), ex);
        } catch (WebDriverException ex) {
            throw FetchException.renderFailure(url, "browser session could not be opened: "
                    + StringUtils.defaultString(ex.getRawMessage(), ex.toString()), ex);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw FetchException.interrupted(url, ex);
        }

        try {
            driver.manage().timeouts().pageLoadTimeout(timeout);
            driver.get(url);
            awaitReady(driver, target, timeout);
            String html = driver.getPageSource();
            if (StringUtils.isBlank(html)) {
                pool.release(driver);
                throw FetchException.renderFailure(url, "browser returned an empty document", null);
            }
            pool.release(driver);
            log.debug("Rendered {} ({} chars)", url, html.length());
            return new RawPage(target, html, clock.instant(), RENDERED_STATUS);
        } catch (org.openqa.selenium.TimeoutException ex) {
            pool.release(driver);
            throw FetchException.timeout(url, "page not ready within " + timeout, ex);
        } catch (WebDriverException ex) {
            pool.discard(driver);
            throw FetchException.renderFailure(url, StringUtils.defaultString(ex.getRawMessage(), ex.toString()), ex);
        } catch (InterruptedException ex) {
            pool.release(driver);
            Thread.currentThread().interrupt();
            throw FetchException.interrupted(url, ex);
        }
    }

    @Override
    public void close() {
        pool.close();
    }

    private void awaitReady(final WebDriver driver, final FetchTarget target, final Duration timeout)
            throws InterruptedException {
        String selector = readySelectors.get(target.template().key());
        if (StringUtils.isBlank(selector)) {
            Thread.sleep(settleTime.toMillis());
            return;
        }
        new WebDriverWait(driver, timeout)
                .until(ExpectedConditions.presenceOfElementLocated(By.cssSelector(selector)));
    }
}
