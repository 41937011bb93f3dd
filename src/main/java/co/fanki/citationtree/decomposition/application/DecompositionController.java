package co.fanki.citationtree.decomposition.application;

import co.fanki.citationtree.decomposition.domain.DecompositionRun;
import co.fanki.citationtree.decomposition.domain.FeedbackArcSetStrategyType;
import co.fanki.citationtree.shared.DomainException;
import co.fanki.citationtree.shared.ErrorResponses;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.List;

/**
 * REST controller for decomposition runs.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@RestController
@RequestMapping("/api/decomposition/runs")
@Tag(name = "Decomposition",
        description = "Cycle removal, tree/extra partition and levels")
public class DecompositionController {

    private static final Logger LOG = LoggerFactory.getLogger(
            DecompositionController.class);

    private final DecompositionService decompositionService;

    /**
     * Creates a new DecompositionController.
     *
     * @param theDecompositionService the decomposition service
     */
    public DecompositionController(
            final DecompositionService theDecompositionService) {
        this.decompositionService = theDecompositionService;
    }

    /**
     * Runs a decomposition and waits for it.
     *
     * @param request the optional strategy override
     * @return the finished run
     */
    @PostMapping
    @Operation(summary = "Run a decomposition",
            description = "Recomputes and republishes the tree and extra"
                    + " edges and the levels. Blocks until done")
    public ResponseEntity<Object> start(
            @RequestBody(required = false) final StartRequest request) {

        final FeedbackArcSetStrategyType strategy =
                request != null ? request.strategy() : null;
        LOG.info("Decomposition requested with strategy {}", strategy);

        try {
            final DecompositionRun run = decompositionService.decompose(
                    strategy);
            return ResponseEntity.ok(RunResponse.from(run));
        } catch (final DomainException e) {
            LOG.warn("Decomposition failed: {}", e.getMessage());
            return ErrorResponses.of(e);
        }
    }

    /**
     * Lists recent runs.
     *
     * @param limit how many runs
     * @return the runs, newest first
     */
    @GetMapping
    @Operation(summary = "List decomposition runs")
    public ResponseEntity<List<RunResponse>> list(
            @RequestParam(defaultValue = "20") final int limit) {
        return ResponseEntity.ok(decompositionService.listRuns(limit).stream()
                .map(RunResponse::from)
                .toList());
    }

    /**
     * Gets one run.
     *
     * @param id the run id
     * @return the run
     */
    @GetMapping("/{id}")
    @Operation(summary = "Get a decomposition run")
    public ResponseEntity<Object> get(@PathVariable final String id) {
        try {
            return ResponseEntity.ok(RunResponse.from(
                    decompositionService.getRun(id)));
        } catch (final DomainException e) {
            return ErrorResponses.of(e);
        }
    }

    /**
     * Request to start a run.
     *
     * @param strategy the preferred strategy, the configured one when null
     */
    public record StartRequest(FeedbackArcSetStrategyType strategy) {}

    /**
     * Response for a run.
     *
     * @param id the run id
     * @param strategy the preferred strategy
     * @param scope the scope
     * @param levelMode the level mode
     * @param status the status
     * @param nodeCount nodes loaded
     * @param edgeCount citations loaded
     * @param componentCount strongly connected components
     * @param largestComponent size of the largest component
     * @param treeEdgeCount tree edges published
     * @param extraEdgeCount extra edges published
     * @param maxLevel deepest level
     * @param attempts solver rounds
     * @param errorMessage why the run failed
     * @param startedAt start time
     * @param finishedAt finish time
     */
    public record RunResponse(
            String id,
            String strategy,
            String scope,
            String levelMode,
            String status,
            Integer nodeCount,
            Integer edgeCount,
            Integer componentCount,
            Integer largestComponent,
            Integer treeEdgeCount,
            Integer extraEdgeCount,
            Integer maxLevel,
            Integer attempts,
            String errorMessage,
            Instant startedAt,
            Instant finishedAt) {

        static RunResponse from(final DecompositionRun run) {
            return new RunResponse(
                    run.id(),
                    run.strategy().name(),
                    run.scope().name(),
                    run.levelMode().name(),
                    run.status().name(),
                    run.nodeCount(),
                    run.edgeCount(),
                    run.componentCount(),
                    run.largestComponent(),
                    run.treeEdgeCount(),
                    run.extraEdgeCount(),
                    run.maxLevel(),
                    run.attempts(),
                    run.errorMessage(),
                    run.startedAt(),
                    run.finishedAt());
        }
    }

}
