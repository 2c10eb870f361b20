package com.purchasingpower.knowledgegraph.ranking.impl;

import com.purchasingpower.knowledgegraph.knowledge.GraphSnapshot.Edge;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class PageRankCalculatorTest {

    private final PageRankCalculator calculator = new PageRankCalculator(0.85, 100, 1e-6, 0.01);

    @AfterEach
    void clearInterrupt() {
        Thread.interrupted();
    }

    @Test
    @DisplayName("A single entity without edges ranks 1.0")
    void compute_singleNode() {
        PageRankCalculator.Computation result = calculator.compute(List.of("only"), List.of());

        assertThat(result.scores().get("only")).isCloseTo(1.0, within(1e-9));
        assertThat(result.converged()).isTrue();
    }

    @Test
    @DisplayName("An equally weighted cycle converges to 1/N")
    void compute_cycleIsUniform() {
        List<Edge> cycle = List.of(
            new Edge("a", "b", "NEXT", 0.7),
            new Edge("b", "c", "NEXT", 0.7),
            new Edge("c", "d", "NEXT", 0.7),
            new Edge("d", "a", "NEXT", 0.7));

        PageRankCalculator.Computation result = calculator.compute(List.of("a", "b", "c", "d"), cycle);

        assertThat(result.scores().values()).allSatisfy(score -> assertThat(score).isCloseTo(0.25, within(1e-6)));
    }

    @Test
    void compute_noEdgesGivesUniformRanks() {
        PageRankCalculator.Computation result = calculator.compute(List.of("a", "b", "c", "d", "e"), List.of());

        assertThat(result.scores().values()).allSatisfy(score -> assertThat(score).isCloseTo(0.2, within(1e-9)));
    }

    @Test
    void compute_hubOutranksLeavesAndScoresSumToOne() {
        List<Edge> star = List.of(
            new Edge("a", "hub", "CITES", 1.0),
            new Edge("b", "hub", "CITES", 1.0),
            new Edge("c", "hub", "CITES", 1.0),
            new Edge("hub", "a", "CITES", 0.2));

        PageRankCalculator.Computation result = calculator.compute(List.of("a", "b", "c", "hub"), star);

        assertThat(result.scores().get("hub")).isGreaterThan(result.scores().get("a"));
        assertThat(result.scores().get("a")).isGreaterThan(result.scores().get("b"));
        assertThat(result.scores().values().stream().mapToDouble(Double::doubleValue).sum())
            .isCloseTo(1.0, within(1e-9));
    }

    @Test
    void compute_splitsRankByEdgeWeight() {
        List<Edge> edges = List.of(
            new Edge("a", "b", "X", 0.5),
            new Edge("a", "b", "Y", 0.5),
            new Edge("a", "c", "X", 1.0),
            new Edge("a", "ghost", "X", 1.0));

        PageRankCalculator.Computation result = calculator.compute(List.of("a", "b", "c"), edges);

        assertThat(result.scores()).containsOnlyKeys("a", "b", "c");
        assertThat(result.scores().get("b")).isCloseTo(result.scores().get("c"), within(1e-9));
    }

    @Test
    void compute_stopsWhenInterrupted() {
        Thread.currentThread().interrupt();

        PageRankCalculator.Computation result = calculator.compute(List.of("a", "b"),
            List.of(new Edge("a", "b", "X", 1.0)));

        assertThat(result.interrupted()).isTrue();
        assertThat(result.iterations()).isZero();
        assertThat(result.scores().get("a")).isEqualTo(0.5);
    }

    @Test
    void compute_emptyGraph() {
        assertThat(calculator.compute(List.of(), List.of()).scores()).isEmpty();
    }
}
