package com.helios.sketchbook;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import com.helios.sketchbook.model.ids.VarId;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("Command line application")
class SketchbookApplicationTest {

    private static String fixture(String name) throws Exception {
        return Path.of(SketchbookApplicationTest.class.getResource("/sketches/" + name).toURI()).toString();
    }

    @ParameterizedTest
    @ValueSource(strings = {"reference_sketch.json", "reference_sketch.aeon"})
    @DisplayName("Runs inference on a consistent sketch")
    void testRun(String name) throws Exception {
        int code = new SketchbookApplication().run(new String[]{fixture(name), "--type=STATIC"});

        assertThat(code).isEqualTo(SketchbookApplication.EXIT_OK);
    }

    @Test
    @DisplayName("Samples witness networks after the summary")
    void testWitnesses() throws Exception {
        int code = new SketchbookApplication().run(
                new String[]{fixture("reference_sketch.json"), "--type=STATIC", "--witnesses=2", "--seed=5"});

        assertThat(code).isEqualTo(SketchbookApplication.EXIT_OK);
    }

    @Test
    @DisplayName("Witnesses are printed as numbered update function listings")
    void testFormatWitnesses() {
        Map<VarId, String> witness = new LinkedHashMap<>();
        witness.put(VarId.of("A"), "true");
        witness.put(VarId.of("B"), "A");

        assertThat(SketchbookApplication.formatWitnesses(List.of(witness)))
                .isEqualTo("Witness 1:\n  $A: true\n  $B: A\n");
        assertThat(SketchbookApplication.formatWitnesses(List.of())).isEmpty();
    }

    @Test
    @DisplayName("Loads by file extension")
    void testLoad() throws Exception {
        assertThat(SketchbookApplication.load(Path.of(fixture("reference_sketch.aeon"))))
                .isEqualTo(SketchbookApplication.load(Path.of(fixture("reference_sketch.json"))));
    }

    @Test
    @DisplayName("Invalid arguments produce the usage exit code")
    void testUsage() throws Exception {
        SketchbookApplication app = new SketchbookApplication();

        assertThat(app.run(new String[0])).isEqualTo(SketchbookApplication.EXIT_USAGE);
        assertThat(app.run(new String[]{fixture("reference_sketch.json"), "--type=ALL"}))
                .isEqualTo(SketchbookApplication.EXIT_USAGE);
        assertThat(app.run(new String[]{"a.json", "b.json"})).isEqualTo(SketchbookApplication.EXIT_USAGE);
        assertThat(app.run(new String[]{"--verbose"})).isEqualTo(SketchbookApplication.EXIT_USAGE);
        assertThat(app.run(new String[]{fixture("reference_sketch.json"), "--witnesses=many"}))
                .isEqualTo(SketchbookApplication.EXIT_USAGE);
        assertThat(app.run(new String[]{fixture("reference_sketch.json"), "--witnesses=-2"}))
                .isEqualTo(SketchbookApplication.EXIT_USAGE);
        assertThat(app.run(new String[]{fixture("reference_sketch.json"), "--seed=x"}))
                .isEqualTo(SketchbookApplication.EXIT_USAGE);
    }

    @Test
    @DisplayName("Unreadable and inconsistent sketches fail")
    void testFailures(@TempDir Path dir) throws Exception {
        Path inconsistent = dir.resolve("empty.json");
        Files.writeString(inconsistent, "{}");

        SketchbookApplication app = new SketchbookApplication();

        assertThat(app.run(new String[]{dir.resolve("missing.json").toString()}))
                .isEqualTo(SketchbookApplication.EXIT_FAILURE);
        assertThat(app.run(new String[]{inconsistent.toString()})).isEqualTo(SketchbookApplication.EXIT_FAILURE);
    }
}
