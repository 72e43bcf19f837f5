package org.neuralchilli.qrun.cli;

import io.quarkus.test.junit.main.LaunchResult;
import io.quarkus.test.junit.main.QuarkusMainLauncher;
import io.quarkus.test.junit.main.QuarkusMainTest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.DisabledOnOs;
import org.junit.jupiter.api.condition.OS;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;

@QuarkusMainTest
@DisabledOnOs(OS.WINDOWS)
class QrunCommandTest {

    private Path projectDir;

    @BeforeEach
    void setup() throws IOException {
        projectDir = Files.createTempDirectory("qrun-cli-test-");
    }

    @AfterEach
    void cleanup() throws IOException {
        try (Stream<Path> walk = Files.walk(projectDir)) {
            walk.sorted(Comparator.reverseOrder()).forEach(path -> path.toFile().delete());
        }
    }

    private Path config(String yaml) throws IOException {
        return Files.writeString(projectDir.resolve("qrun.yaml"), yaml);
    }

    @Test
    void shouldRunTasksAndPersistCache(QuarkusMainLauncher launcher) throws IOException {
        Files.writeString(projectDir.resolve("in.txt"), "hello");
        Path file = config("""
                config:
                  cache_dir: .qrun
                tasks:
                  copy:
                    command: "cp in.txt out.txt && echo run >> runs.log"
                    inputs: [in.txt]
                    outputs: [out.txt]
                """);

        LaunchResult first = launcher.launch("-f", file.toString());

        assertThat(first.exitCode()).isEqualTo(0);
        assertThat(projectDir.resolve("out.txt")).hasContent("hello");
        assertThat(projectDir.resolve(".qrun/qrun_cache.json")).exists();

        LaunchResult second = launcher.launch("-f", file.toString());

        assertThat(second.exitCode()).isEqualTo(0);
        assertThat(Files.readAllLines(projectDir.resolve("runs.log"))).hasSize(1);
    }

    @Test
    void shouldRunOnlyTargetClosure(QuarkusMainLauncher launcher) throws IOException {
        Path file = config("""
                tasks:
                  gen:
                    command: "touch gen.done"
                  build:
                    command: "touch build.done"
                    dependencies: [gen]
                    aliases: [b]
                  docs:
                    command: "touch docs.done"
                """);

        LaunchResult result = launcher.launch("-f", file.toString(), "b");

        assertThat(result.exitCode()).isEqualTo(0);
        assertThat(projectDir.resolve("gen.done")).exists();
        assertThat(projectDir.resolve("build.done")).exists();
        assertThat(projectDir.resolve("docs.done")).doesNotExist();
    }

    @Test
    void shouldUseConfiguredDefaultTarget(QuarkusMainLauncher launcher) throws IOException {
        Path file = config("""
                config:
                  default: one
                tasks:
                  one:
                    command: "touch one.done"
                  two:
                    command: "touch two.done"
                """);

        LaunchResult result = launcher.launch("--file", file.toString());

        assertThat(result.exitCode()).isEqualTo(0);
        assertThat(projectDir.resolve("one.done")).exists();
        assertThat(projectDir.resolve("two.done")).doesNotExist();
    }

    @Test
    void shouldExitWithFailureWhenTaskFails(QuarkusMainLauncher launcher) throws IOException {
        Path file = config("""
                tasks:
                  broken:
                    command: "exit 7"
                """);

        LaunchResult result = launcher.launch("-f", file.toString());

        assertThat(result.exitCode()).isEqualTo(1);
    }

    @Test
    void shouldExitWithFailureForUnknownTarget(QuarkusMainLauncher launcher) throws IOException {
        Path file = config("""
                tasks:
                  a:
                    command: "true"
                """);

        LaunchResult result = launcher.launch("-f", file.toString(), "missing");

        assertThat(result.exitCode()).isEqualTo(1);
        assertThat(result.getErrorOutput()).contains("Task 'missing' not found");
    }

    @Test
    void shouldExitWithFailureForCycle(QuarkusMainLauncher launcher) throws IOException {
        Path file = config("""
                tasks:
                  a:
                    command: "true"
                    dependencies: [b]
                  b:
                    command: "true"
                    dependencies: [a]
                """);

        LaunchResult result = launcher.launch("-f", file.toString());

        assertThat(result.exitCode()).isEqualTo(1);
        assertThat(result.getErrorOutput()).contains("Circular dependency: a -> b -> a");
    }

    @Test
    void shouldExitWithFailureForMissingConfig(QuarkusMainLauncher launcher) {
        LaunchResult result = launcher.launch("-f", projectDir.resolve("nope.yaml").toString());

        assertThat(result.exitCode()).isEqualTo(1);
        assertThat(result.getErrorOutput()).contains("Configuration file not found");
    }

    @Test
    void dryRunShouldNotExecuteOrSaveCache(QuarkusMainLauncher launcher) throws IOException {
        Files.writeString(projectDir.resolve("in.txt"), "x");
        Path file = config("""
                tasks:
                  make:
                    command: "touch made.txt"
                    inputs: [in.txt]
                """);

        LaunchResult result = launcher.launch("-f", file.toString(), "--dry-run");

        assertThat(result.exitCode()).isEqualTo(0);
        assertThat(result.getOutput()).contains("RUN  make: touch made.txt");
        assertThat(projectDir.resolve("made.txt")).doesNotExist();
        assertThat(projectDir.resolve("qrun_cache.json")).doesNotExist();
    }

    @Test
    void shouldRejectInvalidWorkerCount(QuarkusMainLauncher launcher) throws IOException {
        Path file = config("""
                tasks:
                  a:
                    command: "true"
                """);

        LaunchResult result = launcher.launch("-f", file.toString(), "-j", "0");

        assertThat(result.exitCode()).isEqualTo(1);
    }

    @Test
    void shouldApplyTimeoutFromCommandLine(QuarkusMainLauncher launcher) throws IOException {
        Path file = config("""
                tasks:
                  slow:
                    command: "sleep 10"
                """);

        LaunchResult result = launcher.launch("-f", file.toString(), "-t", "300ms");

        assertThat(result.exitCode()).isEqualTo(1);
    }
}
