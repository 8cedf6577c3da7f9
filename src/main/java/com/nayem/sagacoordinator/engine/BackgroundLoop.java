package com.nayem.sagacoordinator.engine;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * A daemon thread that runs one pass, sleeps for the interval and repeats
 * until stopped. Errors of a single pass are logged and do not end the loop.
 */
abstract class BackgroundLoop {

    private static final Logger log = LoggerFactory.getLogger(BackgroundLoop.class);

    private final String name;
    private final Duration interval;
    private volatile Thread thread;

    BackgroundLoop(String name, Duration interval) {
        this.name = name;
        this.interval = interval;
    }

    /**
     * One pass of the loop.
     */
    abstract void runOnce();

    synchronized void start() {
        if (thread != null) {
            return;
        }
        Thread loop = new Thread(this::loop, name);
        loop.setDaemon(true);
        thread = loop;
        loop.start();
    }

    synchronized void stop() {
        Thread loop = thread;
        thread = null;
        if (loop != null) {
            loop.interrupt();
        }
    }

    private void loop() {
        log.info("Started {} with interval {}", name, interval);
        while (thread == Thread.currentThread()) {
            try {
                runOnce();
                Thread.sleep(interval.toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            } catch (Exception e) {
                log.error("Error in {}", name, e);
            }
        }
        log.info("Stopped {}", name);
    }
}
