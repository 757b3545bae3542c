package com.purchasingpower.memory.configuration;

import io.pinecone.clients.Pinecone;
import lombok.extern.slf4j.Slf4j;
import org.neo4j.driver.AuthTokens;
import org.neo4j.driver.Driver;
import org.neo4j.driver.GraphDatabase;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Client beans for the two backing stores.
 */
@Slf4j
@Configuration
public class StoreConfig {

    @Bean
    public Pinecone pineconeClient(MemoryProperties properties) {
        log.info("🔵 Pinecone client for index '{}'", properties.getPinecone().getIndexName());
        return new Pinecone.Builder(properties.getPinecone().getApiKey()).build();
    }

    @Bean(destroyMethod = "close")
    public Driver neo4jDriver(MemoryProperties properties) {
        Neo4jProperties neo4j = properties.getNeo4j();
        log.info("🟢 Neo4j driver at: {}", neo4j.getUri());
        return GraphDatabase.driver(neo4j.getUri(),
                AuthTokens.basic(neo4j.getUsername(), neo4j.getPassword() != null ? neo4j.getPassword() : ""));
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
