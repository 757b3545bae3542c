package com.purchasingpower.memory.api;

import com.purchasingpower.memory.exception.QueryRejectedException;
import com.purchasingpower.memory.storage.GraphStore;
import com.purchasingpower.memory.storage.RelatedNode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;
import java.util.Map;

import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(GraphController.class)
class GraphControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private GraphStore graphStore;

    @Test
    @DisplayName("Read query returns rows and passes parameters through")
    void queryReturnsRows() throws Exception {
        // Given
        String cypher = "MATCH (n:Requirements {project_id: $projectId}) RETURN n.memory_id AS id LIMIT $max";
        when(graphStore.query("demo-project", cypher, Map.of("max", 5)))
                .thenReturn(List.of(Map.of("id", "m-1")));

        // When / Then
        mockMvc.perform(post("/api/v1/projects/demo-project/graph/query")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"cypher\":\"" + cypher + "\",\"parameters\":{\"max\":5}}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].id").value("m-1"));
    }

    @Test
    @DisplayName("Missing parameters are sent as an empty map")
    void queryWithoutParameters() throws Exception {
        when(graphStore.query("demo-project", "MATCH (n) RETURN count(n) AS c", Map.of()))
                .thenReturn(List.of(Map.of("c", 0)));

        mockMvc.perform(post("/api/v1/projects/demo-project/graph/query")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"cypher\":\"MATCH (n) RETURN count(n) AS c\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].c").value(0));
    }

    @Test
    @DisplayName("Write queries are refused with 403 SECURITY_REJECTED")
    void writeQueryIsForbidden() throws Exception {
        // Given
        when(graphStore.query(eq("demo-project"), anyString(), anyMap()))
                .thenThrow(new QueryRejectedException("Write operations are not allowed: DELETE"));

        // When / Then
        mockMvc.perform(post("/api/v1/projects/demo-project/graph/query")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"cypher\":\"MATCH (n) DETACH DELETE n\"}"))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.status").value(403))
                .andExpect(jsonPath("$.code").value("SECURITY_REJECTED"))
                .andExpect(jsonPath("$.retryable").value(false));
    }

    @Test
    @DisplayName("Blank cypher never reaches the store")
    void blankQueryIsInvalid() throws Exception {
        mockMvc.perform(post("/api/v1/projects/demo-project/graph/query")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"cypher\":\"\"}"))
                .andExpect(status().isBadRequest());

        verifyNoInteractions(graphStore);
    }

    @Test
    @DisplayName("Invalid project id is a 400")
    void invalidProjectId() throws Exception {
        mockMvc.perform(get("/api/v1/projects/BadProject/graph/related/m-1"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("VALIDATION"));

        verifyNoInteractions(graphStore);
    }

    @Test
    @DisplayName("Related nodes default to depth 2 and every relationship type")
    void relatedDefaults() throws Exception {
        // Given
        when(graphStore.getRelated("demo-project", "m-1", List.of(), 2)).thenReturn(List.of(
                RelatedNode.builder().memoryId("m-2").type("Design").properties(Map.of()).distance(1).build()));

        // When / Then
        mockMvc.perform(get("/api/v1/projects/demo-project/graph/related/m-1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].memoryId").value("m-2"))
                .andExpect(jsonPath("$[0].distance").value(1));
    }

    @Test
    @DisplayName("Relationship types and depth are forwarded")
    void relatedWithFilters() throws Exception {
        when(graphStore.getRelated("demo-project", "m-1", List.of("IMPLEMENTS", "TESTS"), 3)).thenReturn(List.of());

        mockMvc.perform(get("/api/v1/projects/demo-project/graph/related/m-1")
                        .param("types", "IMPLEMENTS", "TESTS")
                        .param("depth", "3"))
                .andExpect(status().isOk());

        verify(graphStore).getRelated("demo-project", "m-1", List.of("IMPLEMENTS", "TESTS"), 3);
    }
}
