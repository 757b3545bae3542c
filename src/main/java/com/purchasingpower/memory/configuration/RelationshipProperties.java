package com.purchasingpower.memory.configuration;

import com.purchasingpower.memory.memory.RelationshipUpdatePolicy;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

@Data
public class RelationshipProperties {

    @NotNull
    private RelationshipUpdatePolicy updatePolicy = RelationshipUpdatePolicy.REPLACE;
}
