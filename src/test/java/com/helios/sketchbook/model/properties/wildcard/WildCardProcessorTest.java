package com.helios.sketchbook.model.properties.wildcard;

import com.helios.sketchbook.core.error.ReferenceException;
import com.helios.sketchbook.core.error.ValidationException;
import com.helios.sketchbook.model.ids.DatasetId;
import com.helios.sketchbook.model.ids.ObservationId;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("Wildcard processor")
class WildCardProcessorTest {

    static Stream<Arguments> provideWildCards() {
        return Stream.of(
                Arguments.of("%d1/o1%", "observation_d1_o1"),
                Arguments.of("% d1 / o1 %", "observation_d1_o1"),
                Arguments.of("%trajectory(d1)%", "trajectory_d1"),
                Arguments.of("%attractors(d1)%", "attractors_d1_all"),
                Arguments.of("%attractors(d1, o2)%", "attractors_d1_o2"),
                Arguments.of("%fixed_points(d1,o1)%", "fixed_points_d1_o1"),
                Arguments.of("%trap_spaces(d2)%", "trap_spaces_d2_all"),
                Arguments.of("%attractor_count(1, 3)%", "attractor_count_1_3")
        );
    }

    @ParameterizedTest(name = "[{index}] {0}")
    @MethodSource("provideWildCards")
    void shouldCanonicalizeEachForm(String formula, String token) {
        ProcessedFormula processed = WildCardProcessor.process(formula);

        assertThat(processed.canonical()).isEqualTo("%" + token + "%");
        assertThat(processed.wildCards()).hasSize(1);
        assertThat(processed.wildCards().get(0).canonical()).isEqualTo(token);
    }

    @Test
    @DisplayName("Text outside wildcards is kept and every occurrence is listed in order")
    void testSurroundingTextAndOccurrences() {
        String formula = "3{x}: @{x}: (%d/o% & AG EF % d/o %) | %trajectory(d)%";

        ProcessedFormula processed = WildCardProcessor.process(formula);

        assertThat(processed.canonical())
                .isEqualTo("3{x}: @{x}: (%observation_d_o% & AG EF %observation_d_o%) | %trajectory_d%");
        assertThat(processed.wildCards()).extracting(WildCardProposition::canonical)
                .containsExactly("observation_d_o", "observation_d_o", "trajectory_d");
        assertThat(processed.wildCards()).extracting(WildCardProposition::origStr)
                .containsExactly("d/o", " d/o ", "trajectory(d)");
    }

    @Test
    @DisplayName("A repeated wildcard yields one proposition per occurrence")
    void testRepeatedWildCard() {
        ProcessedFormula processed = WildCardProcessor.process("%d/o% & EF %d/o%");

        assertThat(processed.wildCards()).hasSize(2);
        assertThat(processed.canonical()).isEqualTo("%observation_d_o% & EF %observation_d_o%");
    }

    @Test
    @DisplayName("References expose the dataset and observation they name")
    void testReferences() {
        ProcessedFormula processed = WildCardProcessor.process("%fixed_points(data)% & %data/obs%");

        WildCardReference all = processed.wildCards().get(0).reference();
        WildCardReference single = processed.wildCards().get(1).reference();
        assertThat(all.dataset()).contains(DatasetId.of("data"));
        assertThat(all.observation()).isEmpty();
        assertThat(single.observation()).contains(ObservationId.of("obs"));
        assertThat(WildCardProcessor.resolve("observation_data_obs", processed.wildCards())).isPresent();
        assertThat(processed.resolve("%fixed_points_data_all%")).map(WildCardProposition::reference).contains(all);
        assertThat(WildCardProcessor.resolve("unknown", processed.wildCards())).isEmpty();
    }

    @Test
    @DisplayName("Formulas without wildcards pass through unchanged")
    void testNoWildCards() {
        ProcessedFormula processed = WildCardProcessor.process("AG EF (A & !B)");

        assertThat(processed.canonical()).isEqualTo("AG EF (A & !B)");
        assertThat(processed.wildCards()).isEmpty();
    }

    @Test
    @DisplayName("An unmatched delimiter is a validation error")
    void testUnmatchedDelimiter() {
        assertThatThrownBy(() -> WildCardProcessor.process("AG %d/o"))
                .isInstanceOf(ValidationException.class)
                .hasMessage("Unmatched '%' in the formula");
    }

    @ParameterizedTest(name = "[{index}] {0}")
    @ValueSource(strings = {"%foo%", "%d/o/x%", "%attractors()%", "%%", "%trajectory(d, o)%"})
    void shouldRejectUnknownForms(String formula) {
        assertThatThrownBy(() -> WildCardProcessor.process(formula))
                .isInstanceOf(ReferenceException.class)
                .hasMessageStartingWith("Invalid wild-card proposition");
    }

    @Test
    @DisplayName("Attractor count bounds are validated")
    void testAttractorCountBounds() {
        assertThatThrownBy(() -> WildCardProcessor.process("%attractor_count(3, 1)%"))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("cannot be larger");
        assertThatThrownBy(() -> WildCardProcessor.process("%attractor_count(0, 1)%"))
                .isInstanceOf(ValidationException.class)
                .hasMessage("Attractor count must be larger than 0.");
    }

    @Test
    @DisplayName("Attractor counts that do not fit an int are validation errors")
    void testAttractorCountOverflow() {
        assertThatThrownBy(() -> WildCardProcessor.process("%attractor_count(1, 99999999999)%"))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("99999999999")
                .hasCauseInstanceOf(NumberFormatException.class);
    }
}
