package co.fanki.citationtree.decomposition.application;

import co.fanki.citationtree.decomposition.domain.DecompositionRun;
import co.fanki.citationtree.decomposition.domain.DecompositionRunRepository;
import co.fanki.citationtree.decomposition.domain.DecompositionStatus;
import co.fanki.citationtree.graph.domain.ExtraEdge;
import co.fanki.citationtree.graph.domain.ExtraEdgeRepository;
import co.fanki.citationtree.spatial.domain.SpatialIndexService;
import org.jdbi.v3.core.Jdbi;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.util.List;
import java.util.Optional;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * End to end decomposition against PostgreSQL using TestContainers.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@SpringBootTest
@Testcontainers(disabledWithoutDocker = true)
@ActiveProfiles("test")
class DecompositionServiceIntegrationTest {

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:14")
            .withDatabaseName("testdb")
            .withUsername("test")
            .withPassword("test");

    @DynamicPropertySource
    static void configureProperties(final DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);
    }

    @Autowired
    private Jdbi jdbi;

    @Autowired
    private DecompositionService decompositionService;

    @Autowired
    private DecompositionRunRepository runRepository;

    @Autowired
    private ExtraEdgeRepository extraEdgeRepository;

    @Autowired
    private SpatialIndexService spatialIndex;

    @BeforeEach
    void setUp() {
        jdbi.useHandle(handle -> {
            handle.execute("DELETE FROM tree_edges");
            handle.execute("DELETE FROM extra_edges");
            handle.execute("DELETE FROM citation_edges");
            handle.execute("DELETE FROM citation_nodes");
            handle.execute("DELETE FROM decomposition_runs");
            handle.execute("""
                    INSERT INTO citation_nodes
                        (id, x, y, cluster_id, degree, publication_year)
                    VALUES ('a', 0, 0, 1, 4, 2001),
                           ('b', 1, 0, 1, 3, 2004),
                           ('c', 0, 1, 2, 3, 2008),
                           ('d', 5, 5, 2, 1, 2012),
                           ('e', 9, 9, NULL, 0, NULL)
                    """);
            handle.execute("""
                    INSERT INTO citation_edges (src, dst)
                    VALUES ('a', 'b'), ('b', 'c'), ('c', 'a'), ('d', 'a')
                    """);
        });
    }

    @Test
    void whenDecomposing_givenCyclicGraph_shouldPublishAnAcyclicTree() {
        final DecompositionRun run = decompositionService.decompose(null);

        assertEquals(DecompositionStatus.COMPLETED, run.status());
        assertEquals(3, countRows("tree_edges"));
        assertEquals(1, countRows("extra_edges"));

        final List<ExtraEdge> extra = extraEdgeRepository.findTouching(
                Set.of("a", "b", "c"), 10);
        assertEquals(1, extra.size());
        assertTrue(Set.of("a", "b", "c").contains(extra.get(0).src()));

        assertEquals(0, countRows("citation_nodes WHERE topo_level IS NULL"));

        final Optional<DecompositionRun> stored = runRepository.findById(
                run.id());
        assertTrue(stored.isPresent());
        assertEquals(DecompositionStatus.COMPLETED, stored.get().status());
        assertEquals(1, stored.get().extraEdgeCount());
        assertEquals(run.id(), runRepository.findLatestCompleted()
                .orElseThrow().id());

        assertEquals(5, spatialIndex.snapshot().size());
        assertEquals(0, spatialIndex.snapshot().node("e").orElseThrow()
                .topoLevel());
    }

    @Test
    void whenDecomposingTwice_givenSameGraph_shouldReplaceThePublication() {
        decompositionService.decompose(null);
        decompositionService.decompose(null);

        assertEquals(3, countRows("tree_edges"));
        assertEquals(1, countRows("extra_edges"));
        assertEquals(2, decompositionService.listRuns(10).size());
    }

    private long countRows(final String from) {
        return jdbi.withHandle(handle -> handle
                .createQuery("SELECT COUNT(*) FROM " + from)
                .mapTo(Long.class)
                .one());
    }

}
