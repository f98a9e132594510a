package com.phillippitts.heynova.service.action;

import com.phillippitts.heynova.config.skills.SkillProperties;
import com.phillippitts.heynova.exception.SkillExecutionException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Starts applications from the {@code skills.applications.*} table.
 *
 * <p>Paths are validated once at construction; an entry whose path does not exist is
 * unavailable and never launched. Nothing outside the table can be started.
 */
@Component
public class ProcessApplicationLauncher implements ApplicationLauncher {

    private static final Logger LOG = LogManager.getLogger(ProcessApplicationLauncher.class);

    private final Map<String, Path> applications;
    private final ProcessFactory processFactory;
    private final Processes.OperatingSystem os;

    @Autowired
    public ProcessApplicationLauncher(SkillProperties props) {
        this(props.getApplications(), new DefaultProcessFactory(), Processes.currentOs());
    }

    // Package-private for tests
    ProcessApplicationLauncher(Map<String, String> configured, ProcessFactory processFactory,
                               Processes.OperatingSystem os) {
        this.processFactory = Objects.requireNonNull(processFactory);
        this.os = Objects.requireNonNull(os);
        Map<String, Path> valid = new LinkedHashMap<>();
        configured.forEach((name, location) -> {
            Path path;
            try {
                path = Paths.get(location);
            } catch (InvalidPathException e) {
                LOG.warn("Application '{}' unavailable: malformed path: {}", name, e.getMessage());
                return;
            }
            if (Files.exists(path)) {
                valid.put(name, path);
            } else {
                LOG.warn("Application '{}' unavailable: path does not exist: {}", name, path);
            }
        });
        this.applications = Map.copyOf(valid);
        LOG.info("Launchable applications: {}", applications.keySet());
    }

    @Override
    public Set<String> availableApplications() {
        return applications.keySet();
    }

    @Override
    public void launch(String name) {
        Path path = applications.get(name);
        if (path == null) {
            throw new SkillExecutionException("open-application", "Application not available: " + name);
        }
        List<String> command = launchCommand(path);
        LOG.info("Launching '{}' via {}", name, command);
        try {
            processFactory.start(command);
        } catch (IOException e) {
            throw new SkillExecutionException("open-application", "Failed to launch " + name, e);
        }
    }

    List<String> launchCommand(Path path) {
        String location = path.toString();
        if (os == Processes.OperatingSystem.MAC && (Files.isDirectory(path) || location.endsWith(".app"))) {
            return List.of("open", "-a", location);
        }
        if (os == Processes.OperatingSystem.WINDOWS) {
            return List.of("cmd", "/c", "start", "", location);
        }
        return List.of(location);
    }
}
