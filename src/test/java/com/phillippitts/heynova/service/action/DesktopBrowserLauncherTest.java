package com.phillippitts.heynova.service.action;

import com.phillippitts.heynova.exception.SkillExecutionException;
import com.phillippitts.heynova.service.action.Processes.OperatingSystem;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;

class DesktopBrowserLauncherTest {

    private final List<List<String>> started = new ArrayList<>();
    private final ProcessFactory factory = command -> {
        started.add(command);
        return mock(Process.class);
    };

    @Test
    void usesPlatformOpenerWithoutDesktopSupport() {
        new DesktopBrowserLauncher(factory, false, OperatingSystem.OTHER).open("https://github.com");

        assertThat(started).containsExactly(List.of("xdg-open", "https://github.com"));
    }

    @Test
    void openerCommandPerPlatform() {
        assertThat(new DesktopBrowserLauncher(factory, false, OperatingSystem.MAC).openerCommand("u"))
                .containsExactly("open", "u");
        assertThat(new DesktopBrowserLauncher(factory, false, OperatingSystem.WINDOWS).openerCommand("u"))
                .containsExactly("rundll32", "url.dll,FileProtocolHandler", "u");
    }

    @Test
    void failureToStartOpenerIsASkillFailure() {
        DesktopBrowserLauncher launcher = new DesktopBrowserLauncher(command -> {
            throw new IOException("xdg-open not found");
        }, false, OperatingSystem.OTHER);

        assertThatThrownBy(() -> launcher.open("https://github.com"))
                .isInstanceOf(SkillExecutionException.class)
                .hasMessageContaining("github.com");
    }

    @Test
    void rejectsMalformedUrl() {
        DesktopBrowserLauncher launcher = new DesktopBrowserLauncher(factory, false, OperatingSystem.OTHER);

        assertThatThrownBy(() -> launcher.open("http://bad host/ x"))
                .isInstanceOf(SkillExecutionException.class);
        assertThat(started).isEmpty();
    }
}
