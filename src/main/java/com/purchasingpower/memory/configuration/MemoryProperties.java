package com.purchasingpower.memory.configuration;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.NestedConfigurationProperty;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "memory")
public class MemoryProperties {

    @Valid
    @NotNull
    @NestedConfigurationProperty
    private PineconeProperties pinecone = new PineconeProperties();

    @Valid
    @NotNull
    @NestedConfigurationProperty
    private Neo4jProperties neo4j = new Neo4jProperties();

    @Valid
    @NotNull
    @NestedConfigurationProperty
    private EmbeddingProperties embedding = new EmbeddingProperties();

    @Valid
    @NotNull
    @NestedConfigurationProperty
    private InferenceProperties inference = new InferenceProperties();

    @Valid
    @NotNull
    @NestedConfigurationProperty
    private RelationshipProperties relationships = new RelationshipProperties();

    @Valid
    @NotNull
    @NestedConfigurationProperty
    private NormalizationProperties normalization = new NormalizationProperties();

    @Valid
    @NotNull
    @NestedConfigurationProperty
    private TestResultProperties testResults = new TestResultProperties();

    @Valid
    @NotNull
    @NestedConfigurationProperty
    private IndexingProperties indexing = new IndexingProperties();

    @Valid
    @NotNull
    @NestedConfigurationProperty
    private JobProperties jobs = new JobProperties();
}
