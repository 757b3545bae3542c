package com.purchasingpower.memory.api;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class BulkCreateRequest {

    @NotEmpty
    @Size(max = 100)
    private List<@Valid CreateMemoryRequest> memories;
}
