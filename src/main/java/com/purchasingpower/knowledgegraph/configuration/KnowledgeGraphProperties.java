package com.purchasingpower.knowledgegraph.configuration;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.NestedConfigurationProperty;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

/**
 * Root of the {@code app} configuration namespace.
 *
 * <p>Every hand-tuned constant used by the graph pipeline is bound here so that it can be
 * overridden per deployment in application.yml:
 * <pre>
 * app:
 *   neo4j:
 *     uri: bolt://localhost:7687
 *   edges:
 *     min-weight: 0.1
 *     max-weight: 1.0
 *   ranking:
 *     damping-factor: 0.85
 * </pre>
 */
@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "app")
public class KnowledgeGraphProperties {

    @Valid
    @NotNull
    @NestedConfigurationProperty
    private Neo4jProperties neo4j = new Neo4jProperties();

    @Valid
    @NotNull
    @NestedConfigurationProperty
    private ConfidenceProperties confidence = new ConfidenceProperties();

    @Valid
    @NotNull
    @NestedConfigurationProperty
    private EntityProperties entities = new EntityProperties();

    @Valid
    @NotNull
    @NestedConfigurationProperty
    private EdgeProperties edges = new EdgeProperties();

    @Valid
    @NotNull
    @NestedConfigurationProperty
    private RankingProperties ranking = new RankingProperties();

    @Valid
    @NotNull
    @NestedConfigurationProperty
    private QueryProperties query = new QueryProperties();
}
