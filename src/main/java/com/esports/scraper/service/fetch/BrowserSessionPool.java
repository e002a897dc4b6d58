package com.esports.scraper.service.fetch;

import lombok.extern.slf4j.Slf4j;
import org.openqa.selenium.WebDriver;
import org.openqa.selenium.WebDriverException;

import java.time.Duration;
import java.util.concurrent.BlockingDeque;
import java.util.concurrent.LinkedBlockingDeque;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * Bounded pool of browser sessions shared by one run.
 * <p>
 * Sessions are created lazily up to {@code maxSessions}. A borrowed session
 * is handed back with {@link #release(WebDriver)} after a clean render, or
 * with {@link #discard(WebDriver)} when the driver misbehaved, which quits it
 * and frees its slot.
 * </p>
 */
@Slf4j
public class BrowserSessionPool implements AutoCloseable {

    private final Supplier<WebDriver> factory;

    private final int maxSessions;

    private final BlockingDeque<WebDriver> idle = new LinkedBlockingDeque<>();

    private final AtomicInteger open = new AtomicInteger();

    private volatile boolean closed;

    public BrowserSessionPool(final Supplier<WebDriver> factory, final int maxSessions) {
        if (maxSessions < 1) {
            throw new IllegalArgumentException("maxSessions must be at least 1");
        }
        this.factory = factory;
        this.maxSessions = maxSessions;
    }

    /**
     * Takes an idle session, opens a new one while under the cap, or waits.
     *
     * @throws TimeoutException     when no session frees up within {@code wait}
     * @throws InterruptedException when interrupted while waiting
     */
    public WebDriver borrow(final Duration wait) throws TimeoutException, InterruptedException {
        if (closed) {
            throw new IllegalStateException("browser pool is closed");
        }
        long deadline = System.nanoTime() + wait.toNanos();
        while (true) {
            WebDriver driver = idle.pollFirst();
            if (driver != null) {
                if (isAlive(driver)) {
                    return driver;
                }
                discard(driver);
                continue;
            }
            if (tryReserveSlot()) {
                try {
                    WebDriver created = factory.get();
                    log.info("Opened browser session {}/{}", open.get(), maxSessions);
                    return created;
                } catch (RuntimeException ex) {
                    open.decrementAndGet();
                    throw ex;
                }
            }
            long remaining = deadline - System.nanoTime();
            if (remaining <= 0) {
                throw new TimeoutException("no browser session free within " + wait);
            }
            driver = idle.pollFirst(remaining, TimeUnit.NANOSECONDS);
            if (driver != null) {
                idle.offerFirst(driver);
            }
        }
    }

    public void release(final WebDriver driver) {
        if (closed) {
            quit(driver);
            return;
        }
        idle.offerFirst(driver);
    }

    public void discard(final WebDriver driver) {
        open.decrementAndGet();
        quit(driver);
    }

    public int openSessions() {
        return open.get();
    }

    @Override
    public void close() {
        closed = true;
        WebDriver driver;
        while ((driver = idle.pollFirst()) != null) {
            discard(driver);
        }
    }

    private boolean tryReserveSlot() {
        int current;
        do {
            current = open.get();
            if (current >= maxSessions) {
                return false;
            }
        } while (!open.compareAndSet(current, current + 1));
        return true;
    }

    private static boolean isAlive(final WebDriver driver) {
        try {
            driver.getWindowHandle();
            return true;
        } catch (WebDriverException ex) {
            log.warn("Dropping dead browser session: {}", ex.getMessage());
            return false;
        }
    }

    private static void quit(final WebDriver driver) {
        try {
            driver.quit();
        } catch (WebDriverException ex) {
            log.warn("Browser session did not quit cleanly: {}", ex.getMessage());
        }
    }
}
