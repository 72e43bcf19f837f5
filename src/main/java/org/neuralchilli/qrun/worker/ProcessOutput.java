package org.neuralchilli.qrun.worker;

import java.nio.charset.StandardCharsets;

/**
 * Exit status and fully captured output of a finished command.
 */
public record ProcessOutput(int exitCode, byte[] stdout, byte[] stderr) {

    public ProcessOutput {
        stdout = stdout != null ? stdout : new byte[0];
        stderr = stderr != null ? stderr : new byte[0];
    }

    public boolean isSuccess() {
        return exitCode == 0;
    }

    public String stdoutText() {
        return new String(stdout, StandardCharsets.UTF_8);
    }

    public String stderrText() {
        return new String(stderr, StandardCharsets.UTF_8);
    }

    @Override
    public String toString() {
        return "ProcessOutput[exitCode=" + exitCode +
                ", stdout=" + stdout.length + " bytes, stderr=" + stderr.length + " bytes]";
    }
}
