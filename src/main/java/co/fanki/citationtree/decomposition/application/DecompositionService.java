package co.fanki.citationtree.decomposition.application;

import co.fanki.citationtree.decomposition.domain.ComponentAnalyzer;
import co.fanki.citationtree.decomposition.domain.ComponentReport;
import co.fanki.citationtree.decomposition.domain.DecompositionInvariantException;
import co.fanki.citationtree.decomposition.domain.DecompositionPublisher;
import co.fanki.citationtree.decomposition.domain.DecompositionRun;
import co.fanki.citationtree.decomposition.domain.DecompositionRunRepository;
import co.fanki.citationtree.decomposition.domain.DecompositionScope;
import co.fanki.citationtree.decomposition.domain.Digraph;
import co.fanki.citationtree.decomposition.domain.EdgePartition;
import co.fanki.citationtree.decomposition.domain.FeedbackArcSet;
import co.fanki.citationtree.decomposition.domain.FeedbackArcSetSolver;
import co.fanki.citationtree.decomposition.domain.FeedbackArcSetStrategyType;
import co.fanki.citationtree.decomposition.domain.LevelAssigner;
import co.fanki.citationtree.decomposition.domain.LevelMode;
import co.fanki.citationtree.decomposition.domain.TopologicalLevels;
import co.fanki.citationtree.decomposition.domain.TreeExtraPartitioner;
import co.fanki.citationtree.graph.domain.CitationGraph;
import co.fanki.citationtree.graph.domain.GraphLoader;
import co.fanki.citationtree.shared.DomainException;
import co.fanki.citationtree.spatial.domain.SpatialIndexService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Runs the batch decomposition: load, analyze, break cycles, partition,
 * level and publish.
 *
 * <p>Nothing is written until the partition and the levels are verified;
 * publishing replaces the previous decomposition in one transaction. Only
 * one run executes at a time.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Service
public class DecompositionService {

    private static final Logger LOG = LoggerFactory.getLogger(
            DecompositionService.class);

    private final GraphLoader graphLoader;

    private final FeedbackArcSetSolver solver;

    private final DecompositionPublisher publisher;

    private final DecompositionRunRepository runRepository;

    private final SpatialIndexService spatialIndex;

    private final FeedbackArcSetStrategyType defaultStrategy;

    private final DecompositionScope scope;

    private final LevelMode levelMode;

    private final ReentrantLock lock = new ReentrantLock();

    /**
     * Creates a new DecompositionService.
     *
     * @param theGraphLoader loads the citation graph
     * @param theSolver the feedback arc set solver
     * @param thePublisher writes the result
     * @param theRunRepository the run repository
     * @param theSpatialIndex the index to rebuild after publishing
     * @param theDefaultStrategy the strategy used when a run names none
     * @param theScope which components are broken
     * @param theLevelMode how levels are measured
     */
    public DecompositionService(
            final GraphLoader theGraphLoader,
            final FeedbackArcSetSolver theSolver,
            final DecompositionPublisher thePublisher,
            final DecompositionRunRepository theRunRepository,
            final SpatialIndexService theSpatialIndex,
            @Value("${decomposition.strategy:GREEDY_ORDERING}")
            final FeedbackArcSetStrategyType theDefaultStrategy,
            @Value("${decomposition.scope:LARGEST_COMPONENT}")
            final DecompositionScope theScope,
            @Value("${decomposition.level-mode:LONGEST_PATH}")
            final LevelMode theLevelMode) {
        this.graphLoader = theGraphLoader;
        this.solver = theSolver;
        this.publisher = thePublisher;
        this.runRepository = theRunRepository;
        this.spatialIndex = theSpatialIndex;
        this.defaultStrategy = theDefaultStrategy;
        this.scope = theScope;
        this.levelMode = theLevelMode;
    }

    /**
     * Runs a decomposition to completion.
     *
     * @param strategy the preferred strategy, the configured one when null
     * @return the finished run
     * @throws DomainException with code {@code DECOMPOSITION_IN_PROGRESS} if
     *         another run is executing; any failure of the pipeline is
     *         recorded on the run and rethrown
     */
    public DecompositionRun decompose(
            final FeedbackArcSetStrategyType strategy) {
        if (!lock.tryLock()) {
            throw new DomainException("A decomposition is already running",
                    "DECOMPOSITION_IN_PROGRESS");
        }
        try {
            final DecompositionRun run = DecompositionRun.start(
                    strategy != null ? strategy : defaultStrategy, scope,
                    levelMode);
            runRepository.save(run);
            LOG.info("Starting decomposition {} with {} on {}", run.id(),
                    run.strategy(), run.scope());
            try {
                execute(run);
            } catch (final RuntimeException e) {
                LOG.error("Decomposition {} failed: {}", run.id(),
                        e.getMessage(), e);
                if (!run.status().isFinished()) {
                    run.fail(e.getMessage());
                }
                runRepository.update(run);
                throw e;
            }
            runRepository.update(run);
            spatialIndex.rebuild();
            return run;
        } finally {
            lock.unlock();
        }
    }

    private void execute(final DecompositionRun run) {
        final CitationGraph graph = graphLoader.load();
        final Digraph digraph = Digraph.of(graph);

        final ComponentReport report = ComponentAnalyzer.analyze(digraph);
        logReport(report);
        run.graphAnalyzed(graph.nodeCount(), graph.edgeCount(), report);

        final Set<Integer> targets = targetComponents(report);
        final List<FeedbackArcSet> sets = new ArrayList<>(targets.size());
        for (final int componentId : targets) {
            final Digraph component = digraph.induced(
                    report.component(componentId));
            LOG.info("Breaking component {} of {} nodes and {} edges",
                    componentId, component.vertexCount(),
                    component.edgeCount());
            sets.add(solver.solve(component, run.strategy()));
        }
        final FeedbackArcSet feedback = sets.isEmpty()
                ? FeedbackArcSet.empty() : FeedbackArcSet.combine(sets);

        final EdgePartition partition = TreeExtraPartitioner.partition(graph,
                digraph, feedback, report, targets);
        final TopologicalLevels levels = LevelAssigner.assign(
                partition.treeGraph(), run.levelMode());

        publisher.publish(graph, partition, levels);
        run.complete(partition, levels, feedback.attempts());

        LOG.info("Decomposition {} completed: {} tree edges, {} extra edges,"
                + " {} levels, strategies {}", run.id(),
                partition.treeEdges().size(), partition.extraEdges().size(),
                levels.maxLevel() + 1, feedback.strategies());
    }

    private Set<Integer> targetComponents(final ComponentReport report) {
        final List<Integer> nonTrivial = report.nonTrivialComponents();
        if (nonTrivial.size() > 1) {
            LOG.warn("Graph has {} non-trivial components; {} of its nodes"
                    + " are on cycles", nonTrivial.size(),
                    report.verticesInCycles());
        }
        if (scope == DecompositionScope.ALL_COMPONENTS) {
            return new LinkedHashSet<>(nonTrivial);
        }
        if (nonTrivial.size() > 1) {
            throw new DecompositionInvariantException("Only the largest of "
                    + nonTrivial.size() + " cyclic components would be"
                    + " broken; run with scope ALL_COMPONENTS");
        }
        final Optional<Integer> largest = report.largestNonTrivial();
        return largest.map(Set::of).orElseGet(Set::of);
    }

    private void logReport(final ComponentReport report) {
        LOG.info("Found {} strongly connected components: largest {},"
                + " {} singletons, {} non-trivial, {} nodes on cycles",
                report.componentCount(), report.largestSize(),
                report.singletonCount(), report.nonTrivialComponents().size(),
                report.verticesInCycles());
        LOG.info("Component size distribution: {}", report.sizeDistribution());
    }

    /**
     * Finds a run by id.
     *
     * @param id the run id
     * @return the run
     * @throws DomainException with code {@code RUN_NOT_FOUND} if unknown
     */
    public DecompositionRun getRun(final String id) {
        return runRepository.findById(id)
                .orElseThrow(() -> new DomainException(
                        "Decomposition run not found: " + id,
                        "RUN_NOT_FOUND"));
    }

    /**
     * Lists the most recent runs.
     *
     * @param limit how many, at least 1
     * @return the runs, newest first
     */
    public List<DecompositionRun> listRuns(final int limit) {
        return runRepository.findRecent(Math.max(1, limit));
    }

    /** @return whether a run is executing */
    public boolean isRunning() {
        return lock.isLocked();
    }

}
