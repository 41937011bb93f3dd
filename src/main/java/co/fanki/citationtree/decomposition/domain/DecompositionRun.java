package co.fanki.citationtree.decomposition.domain;

import co.fanki.citationtree.shared.Preconditions;

import java.time.Instant;
import java.util.UUID;

/**
 * Aggregate root recording one execution of the decomposition pipeline.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class DecompositionRun {

    private final String id;
    private final FeedbackArcSetStrategyType strategy;
    private final DecompositionScope scope;
    private final LevelMode levelMode;
    private DecompositionStatus status;
    private Integer nodeCount;
    private Integer edgeCount;
    private Integer componentCount;
    private Integer largestComponent;
    private Integer treeEdgeCount;
    private Integer extraEdgeCount;
    private Integer maxLevel;
    private Integer attempts;
    private String errorMessage;
    private final Instant startedAt;
    private Instant finishedAt;

    private DecompositionRun(
            final String theId,
            final FeedbackArcSetStrategyType theStrategy,
            final DecompositionScope theScope,
            final LevelMode theLevelMode,
            final Instant theStartedAt) {
        this.id = Preconditions.requireNonBlank(theId, "Run ID is required");
        this.strategy = Preconditions.requireNonNull(theStrategy,
                "Strategy is required");
        this.scope = Preconditions.requireNonNull(theScope,
                "Scope is required");
        this.levelMode = Preconditions.requireNonNull(theLevelMode,
                "Level mode is required");
        this.status = DecompositionStatus.RUNNING;
        this.startedAt = theStartedAt != null ? theStartedAt : Instant.now();
    }

    /**
     * Starts a new run.
     *
     * @param strategy the preferred feedback arc set strategy
     * @param scope the components to break
     * @param levelMode how levels are measured
     * @return a running DecompositionRun
     */
    public static DecompositionRun start(
            final FeedbackArcSetStrategyType strategy,
            final DecompositionScope scope,
            final LevelMode levelMode) {
        return new DecompositionRun(UUID.randomUUID().toString(), strategy,
                scope, levelMode, Instant.now());
    }

    /**
     * Reconstitutes a run from persistence.
     *
     * @param id the run ID
     * @param strategy the preferred strategy
     * @param scope the scope
     * @param levelMode the level mode
     * @param status the status
     * @param nodeCount nodes loaded, may be null
     * @param edgeCount edges loaded, may be null
     * @param componentCount strongly connected components, may be null
     * @param largestComponent size of the largest component, may be null
     * @param treeEdgeCount tree edges published, may be null
     * @param extraEdgeCount extra edges published, may be null
     * @param maxLevel deepest level, may be null
     * @param attempts solver rounds, may be null
     * @param errorMessage why the run failed, may be null
     * @param startedAt when the run started
     * @param finishedAt when the run finished, may be null
     * @return the reconstituted DecompositionRun
     */
    public static DecompositionRun reconstitute(
            final String id,
            final FeedbackArcSetStrategyType strategy,
            final DecompositionScope scope,
            final LevelMode levelMode,
            final DecompositionStatus status,
            final Integer nodeCount,
            final Integer edgeCount,
            final Integer componentCount,
            final Integer largestComponent,
            final Integer treeEdgeCount,
            final Integer extraEdgeCount,
            final Integer maxLevel,
            final Integer attempts,
            final String errorMessage,
            final Instant startedAt,
            final Instant finishedAt) {

        final DecompositionRun run = new DecompositionRun(id, strategy, scope,
                levelMode, startedAt);
        run.status = Preconditions.requireNonNull(status, "Status is required");
        run.nodeCount = nodeCount;
        run.edgeCount = edgeCount;
        run.componentCount = componentCount;
        run.largestComponent = largestComponent;
        run.treeEdgeCount = treeEdgeCount;
        run.extraEdgeCount = extraEdgeCount;
        run.maxLevel = maxLevel;
        run.attempts = attempts;
        run.errorMessage = errorMessage;
        run.finishedAt = finishedAt;
        return run;
    }

    /**
     * Records the size of the loaded graph and its components.
     *
     * @param theNodeCount nodes loaded
     * @param theEdgeCount distinct citations loaded
     * @param components the component analysis
     */
    public void graphAnalyzed(final int theNodeCount, final int theEdgeCount,
            final ComponentReport components) {
        Preconditions.requireNonNull(components, "Components are required");
        this.nodeCount = theNodeCount;
        this.edgeCount = theEdgeCount;
        this.componentCount = components.componentCount();
        this.largestComponent = components.largestSize();
    }

    /**
     * Marks the run as published.
     *
     * @param partition the published partition
     * @param levels the published levels
     * @param theAttempts solver rounds needed
     */
    public void complete(final EdgePartition partition,
            final TopologicalLevels levels, final int theAttempts) {
        Preconditions.requireNonNull(partition, "Partition is required");
        Preconditions.requireNonNull(levels, "Levels are required");
        this.status = DecompositionStateMachine.transition(status,
                DecompositionStatus.COMPLETED);
        this.treeEdgeCount = partition.treeEdges().size();
        this.extraEdgeCount = partition.extraEdges().size();
        this.maxLevel = levels.maxLevel();
        this.attempts = theAttempts;
        this.finishedAt = Instant.now();
    }

    /**
     * Marks the run as failed.
     *
     * @param reason why the run aborted
     */
    public void fail(final String reason) {
        this.status = DecompositionStateMachine.transition(status,
                DecompositionStatus.FAILED);
        this.errorMessage = reason;
        this.finishedAt = Instant.now();
    }

    public String id() {
        return id;
    }

    public FeedbackArcSetStrategyType strategy() {
        return strategy;
    }

    public DecompositionScope scope() {
        return scope;
    }

    public LevelMode levelMode() {
        return levelMode;
    }

    public DecompositionStatus status() {
        return status;
    }

    public Integer nodeCount() {
        return nodeCount;
    }

    public Integer edgeCount() {
        return edgeCount;
    }

    public Integer componentCount() {
        return componentCount;
    }

    public Integer largestComponent() {
        return largestComponent;
    }

    public Integer treeEdgeCount() {
        return treeEdgeCount;
    }

    public Integer extraEdgeCount() {
        return extraEdgeCount;
    }

    public Integer maxLevel() {
        return maxLevel;
    }

    public Integer attempts() {
        return attempts;
    }

    public String errorMessage() {
        return errorMessage;
    }

    public Instant startedAt() {
        return startedAt;
    }

    public Instant finishedAt() {
        return finishedAt;
    }

}
