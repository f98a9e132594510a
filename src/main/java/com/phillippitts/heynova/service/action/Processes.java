package com.phillippitts.heynova.service.action;

import com.phillippitts.heynova.util.ProcessTimeouts;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Duration;
import java.util.Locale;
import java.util.concurrent.TimeUnit;

/**
 * Helpers shared by the process-based actions.
 */
final class Processes {

    private static final Logger LOG = LogManager.getLogger(Processes.class);

    private Processes() {
    }

    /**
     * Waits for the process to exit; destroys it when the timeout elapses.
     *
     * @return exit code, or -1 when the process had to be destroyed
     * @throws InterruptedException if the waiting thread is interrupted (the process is destroyed first)
     */
    static int awaitExit(Process process, Duration timeout) throws InterruptedException {
        try {
            if (process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                return process.exitValue();
            }
            LOG.warn("Process did not exit within {} ms; destroying", timeout.toMillis());
            destroy(process);
            return -1;
        } catch (InterruptedException e) {
            destroy(process);
            throw e;
        }
    }

    static void destroy(Process process) throws InterruptedException {
        process.destroy();
        if (!process.waitFor(ProcessTimeouts.GRACEFUL_SHUTDOWN_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS)) {
            process.destroyForcibly();
            process.waitFor(ProcessTimeouts.FORCEFUL_SHUTDOWN_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS);
        }
    }

    static OperatingSystem currentOs() {
        return OperatingSystem.from(System.getProperty("os.name", ""));
    }

    enum OperatingSystem {
        MAC, WINDOWS, OTHER;

        static OperatingSystem from(String osName) {
            String os = osName.toLowerCase(Locale.ROOT);
            if (os.contains("mac")) {
                return MAC;
            }
            if (os.contains("win")) {
                return WINDOWS;
            }
            return OTHER;
        }
    }
}
