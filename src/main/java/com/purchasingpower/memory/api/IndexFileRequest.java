package com.purchasingpower.memory.api;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class IndexFileRequest {

    @NotBlank
    private String path;

    private String language;
    private String targetClass;
}
