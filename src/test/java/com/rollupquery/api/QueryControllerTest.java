package com.rollupquery.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.rollupquery.domain.model.QueryDescriptor;
import com.rollupquery.domain.model.QueryExecutionResponse;
import com.rollupquery.domain.model.RollupDescriptor;
import com.rollupquery.domain.parse.QueryDescriptorParser;
import com.rollupquery.domain.routing.RollupCatalog;
import com.rollupquery.domain.routing.RollupRouter;
import com.rollupquery.domain.service.QueryService;
import com.rollupquery.infrastructure.cache.CacheStats;
import com.rollupquery.infrastructure.cache.ResultCache;
import com.rollupquery.infrastructure.storage.QueryExecutionException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.util.List;
import java.util.Set;
import java.util.concurrent.RejectedExecutionException;

import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
class QueryControllerTest {

    @Mock
    private QueryService queryService;

    @Mock
    private ResultCache resultCache;

    @Mock
    private RollupRouter router;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        QueryDescriptorParser parser = new QueryDescriptorParser(new ObjectMapper());
        QueryController controller = new QueryController(queryService, parser, resultCache, router);
        mockMvc = MockMvcBuilders.standaloneSetup(controller)
                .setControllerAdvice(new ApiExceptionHandler())
                .build();
    }

    @Test
    void testExecute() throws Exception {
        // Given
        when(queryService.execute(any(QueryDescriptor.class))).thenReturn(QueryExecutionResponse.builder()
                .source("by_country")
                .columns(List.of("country", "count_star()"))
                .rows(List.of(List.of("US", 12)))
                .cached(false)
                .fallback(false)
                .queryTimeMs(7)
                .build());

        // When / Then
        mockMvc.perform(post("/api/v1/queries")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"select\":[\"country\",{\"COUNT\":\"*\"}],\"group_by\":[\"country\"]}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.source").value("by_country"))
                .andExpect(jsonPath("$.rows[0][1]").value(12))
                .andExpect(jsonPath("$.cached").value(false));
    }

    @Test
    void testExecute_MalformedDescriptor() throws Exception {
        mockMvc.perform(post("/api/v1/queries")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"group_by\":[\"country\"]}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.status").value(400));

        verify(queryService, never()).execute(any());
    }

    @Test
    void testExecute_StorageFailure() throws Exception {
        // Given
        when(queryService.execute(any(QueryDescriptor.class)))
                .thenThrow(new QueryExecutionException("Query failed: connection refused", "sql", null));

        // When / Then
        mockMvc.perform(post("/api/v1/queries")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"select\":[{\"COUNT\":\"*\"}]}"))
                .andExpect(status().isBadGateway())
                .andExpect(jsonPath("$.message").value("Query failed: connection refused"));
    }

    @Test
    void testExecuteBatch() throws Exception {
        // Given
        when(queryService.executeBatch(anyList())).thenReturn(List.of(
                QueryExecutionResponse.builder().source("by_day").build(),
                QueryExecutionResponse.builder().source("events_parquet").build()));

        // When / Then
        mockMvc.perform(post("/api/v1/queries/batch")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("[{\"select\":[{\"COUNT\":\"*\"}]},{\"select\":[\"user_id\"],\"group_by\":[\"user_id\"]}]"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].source").value("by_day"))
                .andExpect(jsonPath("$[1].source").value("events_parquet"));
    }

    @Test
    void testExecuteBatch_OversizedIsBadRequest() throws Exception {
        // Given
        when(queryService.executeBatch(anyList()))
                .thenThrow(new IllegalArgumentException("Batch of 2 queries exceeds the limit of 1"));

        // When / Then
        mockMvc.perform(post("/api/v1/queries/batch")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("[{\"select\":[{\"COUNT\":\"*\"}]},{\"select\":[{\"COUNT\":\"*\"}]}]"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("Batch of 2 queries exceeds the limit of 1"));
    }

    @Test
    void testExecuteBatch_SaturatedPoolIsUnavailable() throws Exception {
        // Given
        when(queryService.executeBatch(anyList()))
                .thenThrow(new RejectedExecutionException("queue full"));

        // When / Then
        mockMvc.perform(post("/api/v1/queries/batch")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("[{\"select\":[{\"COUNT\":\"*\"}]}]"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.status").value(503));
    }

    @Test
    void testRoute() throws Exception {
        // Given
        when(queryService.route(any(QueryDescriptor.class))).thenReturn("by_country_day");

        // When / Then
        mockMvc.perform(post("/api/v1/queries/route")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"select\":[{\"COUNT\":\"*\"}],\"group_by\":[\"country\"],"
                                + "\"where\":[{\"col\":\"day\",\"op\":\"eq\",\"val\":\"2024-01-01\"}]}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.source").value("by_country_day"));
    }

    @Test
    void testCacheStats() throws Exception {
        // Given
        when(resultCache.stats()).thenReturn(CacheStats.builder()
                .hits(3)
                .misses(1)
                .hitRate(0.75)
                .entries(2)
                .maxEntries(500)
                .build());

        // When / Then
        mockMvc.perform(get("/api/v1/cache/stats"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.hits").value(3))
                .andExpect(jsonPath("$.hitRate").value(0.75));
    }

    @Test
    void testClearCaches() throws Exception {
        mockMvc.perform(delete("/api/v1/cache"))
                .andExpect(status().isNoContent());
        mockMvc.perform(delete("/api/v1/routing/cache"))
                .andExpect(status().isNoContent());

        verify(resultCache).clear();
        verify(router).clearCache();
    }

    @Test
    void testCatalog() throws Exception {
        // Given
        RollupCatalog catalog = RollupCatalog.builder()
                .rollup(RollupDescriptor.builder().name("by_country").dimensions(Set.of("country")).priority(8).build())
                .build();
        when(router.getCatalog()).thenReturn(catalog);

        // When / Then
        mockMvc.perform(get("/api/v1/routing/catalog"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].name").value("by_country"))
                .andExpect(jsonPath("$[0].priority").value(8));
    }

    @Test
    void testHealth() throws Exception {
        mockMvc.perform(get("/api/v1/health"))
                .andExpect(status().isOk())
                .andExpect(content().string("OK"));
    }
}
