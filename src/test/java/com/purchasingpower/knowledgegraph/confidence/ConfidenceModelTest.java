package com.purchasingpower.knowledgegraph.confidence;

import com.purchasingpower.knowledgegraph.configuration.KnowledgeGraphProperties;
import com.purchasingpower.knowledgegraph.core.QualityTier;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class ConfidenceModelTest {

    private ConfidenceModel model;

    @BeforeEach
    void setUp() {
        model = new ConfidenceModel(new KnowledgeGraphProperties());
    }

    @Test
    @DisplayName("Weighted factors are normalized and averaged with the base")
    void combine_averagesBaseWithNormalizedFactors() {
        Map<String, ConfidenceFactor> factors = new LinkedHashMap<>();
        factors.put("a", ConfidenceFactor.of(1.0, 3.0));
        factors.put("b", ConfidenceFactor.of(0.0, 1.0));

        ConfidenceAssessment assessment = model.combine(0.5, factors);

        // blend = 0.75, (0.5 + 0.75) / 2
        assertThat(assessment.getConfidence()).isCloseTo(0.625, within(1e-9));
        assertThat(assessment.getTier()).isEqualTo(QualityTier.MEDIUM);
        assertThat(assessment.getFactors()).containsEntry("a", 1.0).containsEntry("b", 0.0);
    }

    @Test
    void combine_withoutFactorsReturnsClampedBase() {
        assertThat(model.combine(1.7, Map.of()).getConfidence()).isEqualTo(1.0);
        assertThat(model.combine(-0.2, null).getConfidence()).isEqualTo(0.0);
        assertThat(model.combine(0.42, Map.of("zero", ConfidenceFactor.of(0.9, 0.0))).getConfidence())
            .isEqualTo(0.42);
    }

    @Test
    void combine_clampsOutOfRangeFactorValues() {
        ConfidenceAssessment assessment = model.combine(1.0, Map.of("huge", ConfidenceFactor.of(5.0)));

        assertThat(assessment.getConfidence()).isEqualTo(1.0);
        assertThat(assessment.getFactors()).containsEntry("huge", 1.0);
    }

    @Test
    void combine_rejectsNaNBase() {
        assertThatThrownBy(() -> model.combine(Double.NaN, Map.of()))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void factor_rejectsNegativeWeight() {
        assertThatThrownBy(() -> ConfidenceFactor.of(0.5, -1.0))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Tier thresholds are inclusive at 0.8 and 0.5")
    void tierOf_usesSharedThresholds() {
        assertThat(model.tierOf(0.8)).isEqualTo(QualityTier.HIGH);
        assertThat(model.tierOf(0.7999)).isEqualTo(QualityTier.MEDIUM);
        assertThat(model.tierOf(0.5)).isEqualTo(QualityTier.MEDIUM);
        assertThat(model.tierOf(0.4999)).isEqualTo(QualityTier.LOW);
    }

    @Test
    void propagate_degradesSingleInput() {
        assertThat(model.propagate(List.of(0.8), PropagationRule.GRAPH_ANALYSIS))
            .isCloseTo(0.76, within(1e-9));
    }

    @Test
    void propagate_usesHarmonicMeanForSeveralInputs() {
        // harmonic mean of 0.5 and 1.0 is 2/3
        assertThat(model.propagate(List.of(0.5, 1.0), PropagationRule.NLP_PROCESSING))
            .isCloseTo(2.0 / 3.0 * 0.9, within(1e-9));
    }

    @Test
    void propagate_neverDropsBelowFloor() {
        assertThat(model.propagate(List.of(0.01), PropagationRule.RELATIONSHIP_EXTRACTION)).isEqualTo(0.1);
        assertThat(model.propagate(List.of(0.0, 0.9), PropagationRule.RELATIONSHIP_EXTRACTION)).isEqualTo(0.1);
        assertThat(model.propagate(List.of(), PropagationRule.TEXT_EXTRACTION)).isEqualTo(0.5);
    }
}
