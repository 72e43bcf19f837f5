package org.neuralchilli.qrun.config;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class VariableSubstitutorTest {

    private final VariableSubstitutor substitutor = VariableSubstitutor.forConfig(
            Path.of("/work/project"),
            Map.of("SRC", "src", "OUT", "build/out"),
            Map.of("HOME", "/home/dev"));

    @Test
    void shouldReplaceBracedAndBareReferences() {
        assertThat(substitutor.substitute("gcc ${SRC}/main.c -o $OUT")).isEqualTo("gcc src/main.c -o build/out");
    }

    @Test
    void shouldExposeEnvironmentAndConfigDirectory() {
        assertThat(substitutor.substitute("${ENV_HOME}/bin")).isEqualTo("/home/dev/bin");
        assertThat(substitutor.substitute("$PWD/data")).isEqualTo(Path.of("/work/project") + "/data");
    }

    @Test
    void shouldLeaveUnknownReferencesAlone() {
        assertThat(substitutor.substitute("echo ${MISSING} $ALSO_MISSING")).isEqualTo("echo ${MISSING} $ALSO_MISSING");
    }

    @Test
    void userVariablesShouldShadowBuiltIns() {
        VariableSubstitutor shadowing = VariableSubstitutor.forConfig(
                Path.of("/work"), Map.of("PWD", "custom"), Map.of());

        assertThat(shadowing.substitute("$PWD")).isEqualTo("custom");
    }

    @Test
    void shouldSubstituteEveryListEntry() {
        assertThat(substitutor.substituteAll(List.of("${SRC}/*.c", "plain.txt")))
                .containsExactly("src/*.c", "plain.txt");
    }

    @Test
    void shouldNotTreatReplacementTextAsRegex() {
        VariableSubstitutor special = new VariableSubstitutor(Map.of("COST", "$5\\each"));

        assertThat(special.substitute("price ${COST}")).isEqualTo("price $5\\each");
    }
}
