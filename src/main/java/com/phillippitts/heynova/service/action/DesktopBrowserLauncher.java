package com.phillippitts.heynova.service.action;

import com.phillippitts.heynova.exception.SkillExecutionException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.awt.Desktop;
import java.awt.GraphicsEnvironment;
import java.io.IOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.util.List;
import java.util.Objects;

/**
 * Opens URLs with {@link Desktop#browse(URI)} when the platform supports it, otherwise with
 * the OS opener command ({@code open}, {@code xdg-open}, {@code rundll32}).
 */
@Component
public class DesktopBrowserLauncher implements BrowserLauncher {

    private static final Logger LOG = LogManager.getLogger(DesktopBrowserLauncher.class);

    private final ProcessFactory processFactory;
    private final boolean desktopBrowse;
    private final Processes.OperatingSystem os;

    public DesktopBrowserLauncher() {
        this(new DefaultProcessFactory(), desktopBrowseSupported(), Processes.currentOs());
    }

    // Package-private for tests
    DesktopBrowserLauncher(ProcessFactory processFactory, boolean desktopBrowse, Processes.OperatingSystem os) {
        this.processFactory = Objects.requireNonNull(processFactory);
        this.desktopBrowse = desktopBrowse;
        this.os = Objects.requireNonNull(os);
    }

    private static boolean desktopBrowseSupported() {
        return !GraphicsEnvironment.isHeadless()
                && Desktop.isDesktopSupported()
                && Desktop.getDesktop().isSupported(Desktop.Action.BROWSE);
    }

    @Override
    public void open(String url) {
        URI uri;
        try {
            uri = new URI(url);
        } catch (URISyntaxException e) {
            throw new SkillExecutionException("browser", "Invalid URL: " + url, e);
        }
        LOG.info("Opening {}", uri);
        try {
            if (desktopBrowse) {
                Desktop.getDesktop().browse(uri);
            } else {
                processFactory.start(openerCommand(uri.toString()));
            }
        } catch (IOException | UnsupportedOperationException | SecurityException e) {
            throw new SkillExecutionException("browser", "Could not open a browser for " + uri.getHost(), e);
        }
    }

    List<String> openerCommand(String url) {
        return switch (os) {
            case MAC -> List.of("open", url);
            case WINDOWS -> List.of("rundll32", "url.dll,FileProtocolHandler", url);
            case OTHER -> List.of("xdg-open", url);
        };
    }
}
