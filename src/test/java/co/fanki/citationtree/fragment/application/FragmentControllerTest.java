package co.fanki.citationtree.fragment.application;

import co.fanki.citationtree.fragment.domain.DataBounds;
import co.fanki.citationtree.fragment.domain.Fragment;
import co.fanki.citationtree.fragment.domain.Viewport;
import co.fanki.citationtree.graph.domain.CitationNode;
import co.fanki.citationtree.query.domain.QueryCancelledException;
import co.fanki.citationtree.query.domain.QueryExecutor;
import co.fanki.citationtree.query.domain.QueryExecutorSettings;
import co.fanki.citationtree.query.domain.QueryScope;
import co.fanki.citationtree.query.domain.QueryStatistics;
import co.fanki.citationtree.query.domain.QueryTimeoutException;
import co.fanki.citationtree.shared.DomainException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.time.Duration;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * Unit tests for {@link FragmentController}.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class FragmentControllerTest {

    private TreeFragmentService fragmentService;
    private QueryExecutor executor;
    private MockMvc mvc;

    @BeforeEach
    void setUp() {
        fragmentService = mock(TreeFragmentService.class);
        executor = new QueryExecutor(new QueryExecutorSettings(1, 1, 4,
                Duration.ofSeconds(1), Duration.ofSeconds(1),
                Duration.ofSeconds(1)), new QueryStatistics());
        mvc = MockMvcBuilders.standaloneSetup(
                new FragmentController(fragmentService, executor)).build();
        when(fragmentService.resolveLimit(any())).thenReturn(1000);
    }

    @AfterEach
    void tearDown() {
        executor.shutdown();
    }

    @Test
    void whenPostingViewport_givenFilters_shouldBuildTheViewport()
            throws Exception {
        when(fragmentService.viewportFragment(any(), any(), anyBoolean()))
                .thenReturn(Fragment.empty(0, 0, 1000));

        mvc.perform(post("/api/fragments/viewport")
                        .header("X-Request-Id", "req-42")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"minX": 0, "maxX": 10, "minY": -5, "maxY": 5,
                                 "minDegree": 3, "visibleClusters": "1,2",
                                 "maxLevel": 4, "includeExtraEdges": true}
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.hasMore").value(false))
                .andExpect(jsonPath("$.stats.limit").value(1000));

        final ArgumentCaptor<QueryScope> scope =
                ArgumentCaptor.forClass(QueryScope.class);
        final ArgumentCaptor<Viewport> viewport =
                ArgumentCaptor.forClass(Viewport.class);
        verify(fragmentService).viewportFragment(scope.capture(),
                viewport.capture(), eq(true));
        assertEquals("req-42", scope.getValue().requestId());
        assertEquals(3, viewport.getValue().minDegree());
        assertEquals(Set.of(1, 2), viewport.getValue().visibleClusters());
        assertEquals(4, viewport.getValue().maxLevel());
        assertEquals(0, viewport.getValue().offset());
    }

    @Test
    void whenPostingViewport_givenInvertedBox_shouldReturnBadRequest()
            throws Exception {
        mvc.perform(post("/api/fragments/viewport")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"minX\": 10, \"maxX\": 0,"
                                + " \"minY\": 0, \"maxY\": 1}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errorCode").value("INVALID_VIEWPORT"));
    }

    @Test
    void whenPostingViewport_givenTimeout_shouldReturnGatewayTimeout()
            throws Exception {
        when(fragmentService.viewportFragment(any(), any(), anyBoolean()))
                .thenThrow(new QueryTimeoutException("slow"));

        mvc.perform(post("/api/fragments/viewport")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"minX\": 0, \"maxX\": 1,"
                                + " \"minY\": 0, \"maxY\": 1}"))
                .andExpect(status().isGatewayTimeout())
                .andExpect(jsonPath("$.errorCode").value("QUERY_TIMEOUT"))
                .andExpect(jsonPath("$.retryable").value(true));
    }

    @Test
    void whenPostingViewport_givenCancelledRequest_shouldReturnNoContent()
            throws Exception {
        when(fragmentService.viewportFragment(any(), any(), anyBoolean()))
                .thenThrow(new QueryCancelledException("cancelled"));

        mvc.perform(post("/api/fragments/viewport")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"minX\": 0, \"maxX\": 1,"
                                + " \"minY\": 0, \"maxY\": 1}"))
                .andExpect(status().isNoContent());
    }

    @Test
    void whenGettingChildren_givenUnknownNode_shouldReturnNotFound()
            throws Exception {
        when(fragmentService.treeChildren(any(), eq("nope"), anyInt()))
                .thenThrow(new DomainException("Node not found: nope",
                        "NODE_NOT_FOUND"));

        mvc.perform(get("/api/nodes/nope/children").param("depth", "2"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.errorCode").value("NODE_NOT_FOUND"));
    }

    @Test
    void whenGettingNodes_givenIds_shouldReturnThem() throws Exception {
        when(fragmentService.nodes(List.of("a", "b"))).thenReturn(List.of(
                CitationNode.of("a", 1, 2, 3, 4, 2001)));

        mvc.perform(get("/api/nodes").param("ids", "a,b"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.nodes[0].id").value("a"))
                .andExpect(jsonPath("$.nodes[0].degree").value(4));
    }

    @Test
    void whenGettingBounds_givenData_shouldReturnThem() throws Exception {
        when(fragmentService.dataBounds()).thenReturn(
                new DataBounds(-1, 1, -2, 2, 7));

        mvc.perform(get("/api/bounds"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.maxY").value(2.0))
                .andExpect(jsonPath("$.totalNodes").value(7));
    }

    @Test
    void whenPostingExtraEdges_givenRequest_shouldCloseTheScope()
            throws Exception {
        when(fragmentService.extraEdgesForNodes(any(), any(), any()))
                .thenReturn(List.of());

        mvc.perform(post("/api/edges/extra")
                        .header("X-Request-Id", "batch-1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"nodeIds\": [\"a\"], \"maxEdges\": 5}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.extraEdges").isArray());

        assertFalse(executor.cancel("batch-1"));
    }

    @Test
    void whenGettingOverview_givenDefaults_shouldAskForFiveLevels()
            throws Exception {
        when(fragmentService.topologicalOverview(any(), eq(5), eq(100)))
                .thenReturn(List.of());

        mvc.perform(get("/api/overview/topological"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.nodes").isEmpty());

        verify(fragmentService).topologicalOverview(any(), eq(5), eq(100));
    }

}
