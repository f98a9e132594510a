package com.phillippitts.heynova.service.action;

import java.io.IOException;
import java.util.List;

/**
 * Abstraction over {@link ProcessBuilder} to enable hermetic testing of process-based actions.
 *
 * <p>Production code uses {@link DefaultProcessFactory}. Tests may provide a stub
 * implementation that returns a fake {@link Process} with controlled exit behavior.
 */
interface ProcessFactory {
    /**
     * Starts a new process with the given command.
     *
     * @param command full command line, with the executable as the first element
     * @return started {@link Process}
     * @throws IOException if the process cannot be started
     */
    Process start(List<String> command) throws IOException;
}
