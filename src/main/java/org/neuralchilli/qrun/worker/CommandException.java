package org.neuralchilli.qrun.worker;

import java.time.Duration;
import java.util.Optional;

/**
 * A command that did not run to completion: it could not be started
 * ({@link Kind#IO}) or was killed at its deadline ({@link Kind#TIMEOUT}).
 * Either way this is a failure of one task, not of the engine.
 */
public class CommandException extends RuntimeException {

    public enum Kind {
        IO,
        TIMEOUT
    }

    private final Kind kind;
    private final Duration timeout;

    private CommandException(Kind kind, String message, Duration timeout, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.timeout = timeout;
    }

    public static CommandException io(String command, Throwable cause) {
        return new CommandException(Kind.IO,
                "Command execution error for '" + command + "': " + cause.getMessage(), null, cause);
    }

    public static CommandException timeout(String command, Duration timeout) {
        return new CommandException(Kind.TIMEOUT,
                "Command '" + command + "' timed out after " + timeout.toMillis() + "ms", timeout, null);
    }

    public Kind kind() {
        return kind;
    }

    public boolean isTimeout() {
        return kind == Kind.TIMEOUT;
    }

    public Optional<Duration> timeout() {
        return Optional.ofNullable(timeout);
    }
}
