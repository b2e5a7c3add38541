package com.helios.sketchbook.model.properties;

import com.helios.sketchbook.core.error.ValidationException;
import com.helios.sketchbook.core.error.VariantMismatchException;
import com.helios.sketchbook.model.ids.DatasetId;
import com.helios.sketchbook.model.ids.ObservationId;
import com.helios.sketchbook.model.properties.DynPropertyType.AttractorCount;
import com.helios.sketchbook.model.properties.DynPropertyType.ExistsFixedPoint;
import com.helios.sketchbook.model.properties.DynPropertyType.ExistsTrapSpace;
import com.helios.sketchbook.model.properties.DynPropertyType.GenericDynProp;
import com.helios.sketchbook.model.properties.DynPropertyType.HasAttractor;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("Dynamic properties")
class DynPropertyTest {

    private static final DatasetId D1 = DatasetId.of("d1");
    private static final DatasetId D2 = DatasetId.of("d2");
    private static final ObservationId O1 = ObservationId.of("o1");

    @Test
    @DisplayName("Generic properties keep the raw formula and its wildcards")
    void testGeneric() {
        DynProperty property = DynProperty.tryMkGeneric("reach", "EF %d1/o1%");

        GenericDynProp variant = (GenericDynProp) property.getVariant();
        assertThat(variant.rawFormula()).isEqualTo("EF %d1/o1%");
        assertThat(variant.processedFormula()).isEqualTo("EF %observation_d1_o1%");
        assertThat(variant.wildCards()).hasSize(1);
        assertThat(property.isGeneric()).isTrue();

        property.setFormula("AG true");
        assertThat(((GenericDynProp) property.getVariant()).wildCards()).isEmpty();
    }

    @Test
    @DisplayName("Generic formulas must be non-empty and balanced")
    void testGenericValidation() {
        assertThatThrownBy(() -> DynProperty.tryMkGeneric("p", "  "))
                .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> DynProperty.tryMkGeneric("p", "AG (EF x"))
                .isInstanceOf(ValidationException.class);
    }

    @Test
    @DisplayName("Attractor count bounds are validated on creation and on update")
    void testAttractorCount() {
        assertThatThrownBy(() -> DynProperty.tryMkAttractorCount("c", 3, 2))
                .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> DynProperty.tryMkAttractorCount("c", 0, 2))
                .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> DynProperty.tryMkAttractorCount("c", -3, -1))
                .isInstanceOf(ValidationException.class)
                .hasMessage("Attractor count must be larger than 0.");

        DynProperty property = DynProperty.tryMkAttractorCount("c", 1, 2);
        property.setAttractorCountMaximal(4);
        assertThat(property.getVariant()).isEqualTo(new AttractorCount(1, 4));
        assertThatThrownBy(() -> property.setAttractorCountMinimal(5))
                .isInstanceOf(ValidationException.class);
        assertThat(property.getVariant()).isEqualTo(new AttractorCount(1, 4));
    }

    @Test
    @DisplayName("Switching dataset clears the observation, re-selecting it keeps it")
    void testDatasetChange() {
        DynProperty property = DynProperty.mkFixedPoint("fp", D1, O1);

        property.setDataset(D1);
        assertThat(property.getVariant()).isEqualTo(new ExistsFixedPoint(D1, O1));

        property.setDataset(D2);
        assertThat(property.getVariant()).isEqualTo(new ExistsFixedPoint(D2, null));

        property.removeDataset();
        assertThat(property.getVariant()).isEqualTo(new ExistsFixedPoint(null, null));
    }

    @Test
    @DisplayName("An observation can only be selected together with a dataset")
    void testObservationNeedsDataset() {
        DynProperty property = DynProperty.mkHasAttractor("h", null, null);

        assertThatThrownBy(() -> property.setObservation(O1))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("before a dataset is selected");
        assertThat(property.getVariant()).isEqualTo(new HasAttractor(null, null));

        property.setObservation(null);
        property.setDataset(D1);
        property.setObservation(O1);
        assertThat(property.getVariant()).isEqualTo(new HasAttractor(D1, O1));
    }

    @Test
    @DisplayName("Trap space flags are updated independently")
    void testTrapSpaceFlags() {
        DynProperty property = DynProperty.mkTrapSpace("ts", D1, O1, false, false);

        property.setTrapSpaceMinimal(true);
        property.setTrapSpaceNonpercolable(true);

        assertThat(property.getVariant()).isEqualTo(new ExistsTrapSpace(D1, O1, true, true));
    }

    @Test
    @DisplayName("Mutators reject variants they do not apply to")
    void testVariantMismatch() {
        DynProperty trajectory = DynProperty.mkTrajectory("t", D1);
        DynProperty count = DynProperty.tryMkAttractorCount("c", 1, 1);

        assertThatThrownBy(() -> trajectory.setObservation(O1))
                .isInstanceOf(VariantMismatchException.class)
                .hasMessage("Cannot set observation of a ExistsTrajectory property");
        assertThatThrownBy(() -> count.setDataset(D1)).isInstanceOf(VariantMismatchException.class);
        assertThatThrownBy(() -> count.setFormula("true")).isInstanceOf(VariantMismatchException.class);
        assertThatThrownBy(() -> trajectory.setTrapSpaceMinimal(true)).isInstanceOf(VariantMismatchException.class);
    }

    @Test
    @DisplayName("withAnnotation returns a copy and leaves the original unchanged")
    void testWithAnnotation() {
        DynProperty original = DynProperty.mkHasAttractor("h", D1, null);

        DynProperty annotated = original.withAnnotation("note");

        assertThat(annotated.getAnnotation()).isEqualTo("note");
        assertThat(original.getAnnotation()).isEmpty();
        assertThat(annotated.getVariant()).isEqualTo(original.getVariant());
        assertThat(annotated).isNotEqualTo(original);
    }

    @Test
    @DisplayName("Names cannot be blank")
    void testBlankName() {
        DynProperty property = DynProperty.mkTrajectory("t", D1);

        assertThatThrownBy(() -> property.setName(" ")).isInstanceOf(ValidationException.class);
    }

    @ParameterizedTest(name = "[{index}] {0}")
    @EnumSource(DynPropertyKind.class)
    void shouldCreateDefaultOfEveryKind(DynPropertyKind kind) {
        DynProperty property = DynProperty.defaultOf(kind);

        assertThat(property.kind()).isEqualTo(kind);
        assertThat(DynPropertyKind.fromString(kind.tag())).isEqualTo(kind);
    }
}
