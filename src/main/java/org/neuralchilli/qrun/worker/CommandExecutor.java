package org.neuralchilli.qrun.worker;

import java.nio.file.Path;
import java.time.Duration;

/**
 * Runs one task command to completion.
 */
public interface CommandExecutor {

    /**
     * @param command          shell command line
     * @param workingDirectory directory the command runs in
     * @param timeout          deadline, or null for none
     * @param stream           also copy output to the console as it arrives
     * @return exit status and captured output; a non-zero status is returned, not thrown
     * @throws CommandException if the command cannot be started or exceeds its deadline
     */
    ProcessOutput run(String command, Path workingDirectory, Duration timeout, boolean stream);
}
