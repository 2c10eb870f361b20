package com.purchasingpower.knowledgegraph.config;

import com.purchasingpower.knowledgegraph.configuration.KnowledgeGraphProperties;
import com.purchasingpower.knowledgegraph.configuration.Neo4jProperties;
import lombok.extern.slf4j.Slf4j;
import org.neo4j.driver.AuthTokens;
import org.neo4j.driver.Driver;
import org.neo4j.driver.GraphDatabase;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Neo4j driver wiring. The driver connects lazily, so the application starts even when the
 * store is down; each stage checks connectivity before it writes.
 */
@Slf4j
@Configuration
public class Neo4jConfig {

    @Bean(destroyMethod = "close")
    public Driver neo4jDriver(KnowledgeGraphProperties properties) {
        Neo4jProperties neo4j = properties.getNeo4j();
        log.info("Initializing Neo4j driver at: {}", neo4j.getUri());
        return GraphDatabase.driver(neo4j.getUri(), AuthTokens.basic(neo4j.getUsername(), neo4j.getPassword()));
    }
}
