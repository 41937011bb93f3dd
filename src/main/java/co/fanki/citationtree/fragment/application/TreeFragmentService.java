package co.fanki.citationtree.fragment.application;

import co.fanki.citationtree.fragment.domain.BrokenEdge;
import co.fanki.citationtree.fragment.domain.DataBounds;
import co.fanki.citationtree.fragment.domain.EdgeRole;
import co.fanki.citationtree.fragment.domain.Fragment;
import co.fanki.citationtree.fragment.domain.Viewport;
import co.fanki.citationtree.graph.domain.CitationEdge;
import co.fanki.citationtree.graph.domain.CitationNode;
import co.fanki.citationtree.graph.domain.CitationNodeRepository;
import co.fanki.citationtree.graph.domain.ExtraEdge;
import co.fanki.citationtree.graph.domain.ExtraEdgeRepository;
import co.fanki.citationtree.graph.domain.TreeEdgeRepository;
import co.fanki.citationtree.query.domain.QueryKind;
import co.fanki.citationtree.query.domain.QueryScope;
import co.fanki.citationtree.shared.DomainException;
import co.fanki.citationtree.spatial.domain.BoundingBox;
import co.fanki.citationtree.spatial.domain.SpatialIndexService;
import co.fanki.citationtree.spatial.domain.SpatialSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Builds viewport fragments of the decomposition.
 *
 * <p>Node selection runs over the in-memory spatial snapshot; tree and
 * extra edges are read from the store. Every step is submitted through the
 * caller's {@link QueryScope}, so it is bounded by the timeout of its kind
 * and stops when the request is cancelled.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Service
public class TreeFragmentService {

    private static final Logger LOG = LoggerFactory.getLogger(
            TreeFragmentService.class);

    /** Deepest tree expansion allowed in one call. */
    public static final int MAX_CHILDREN_DEPTH = 5;

    private static final double BOUNDS_PADDING = 0.05;

    private static final double EMPTY_BOUNDS = 10.0;

    private static final Comparator<CitationNode> BY_IMPORTANCE =
            Comparator.comparingInt(CitationNode::degree).reversed()
                    .thenComparing(CitationNode::id);

    private final SpatialIndexService spatialIndex;

    private final CitationNodeRepository nodeRepository;

    private final TreeEdgeRepository treeEdgeRepository;

    private final ExtraEdgeRepository extraEdgeRepository;

    private final double viewportMargin;

    private final int defaultLimit;

    private final int maxLimit;

    private final int maxBrokenEdges;

    /**
     * Creates a new TreeFragmentService.
     *
     * @param theSpatialIndex the spatial index
     * @param theNodeRepository the node repository
     * @param theTreeEdgeRepository the tree edge repository
     * @param theExtraEdgeRepository the extra edge repository
     * @param theViewportMargin share of the box extent added on every side
     * @param theDefaultLimit page size when the client sends none
     * @param theMaxLimit largest page size and extra edge batch
     * @param theMaxBrokenEdges broken edges returned per fragment at most
     */
    public TreeFragmentService(
            final SpatialIndexService theSpatialIndex,
            final CitationNodeRepository theNodeRepository,
            final TreeEdgeRepository theTreeEdgeRepository,
            final ExtraEdgeRepository theExtraEdgeRepository,
            @Value("${fragment.viewport-margin:0.1}")
            final double theViewportMargin,
            @Value("${fragment.default-limit:1000}") final int theDefaultLimit,
            @Value("${fragment.max-limit:10000}") final int theMaxLimit,
            @Value("${fragment.max-broken-edges:500}")
            final int theMaxBrokenEdges) {
        if (theViewportMargin < 0 || theDefaultLimit <= 0
                || theMaxLimit < theDefaultLimit || theMaxBrokenEdges < 0) {
            throw new IllegalArgumentException("Invalid fragment settings");
        }
        this.spatialIndex = theSpatialIndex;
        this.nodeRepository = theNodeRepository;
        this.treeEdgeRepository = theTreeEdgeRepository;
        this.extraEdgeRepository = theExtraEdgeRepository;
        this.viewportMargin = theViewportMargin;
        this.defaultLimit = theDefaultLimit;
        this.maxLimit = theMaxLimit;
        this.maxBrokenEdges = theMaxBrokenEdges;
    }

    /**
     * Resolves the page size a client asked for.
     *
     * @param requested the requested limit, may be null
     * @return the default when null, capped at the maximum otherwise
     */
    public int resolveLimit(final Integer requested) {
        if (requested == null) {
            return defaultLimit;
        }
        if (requested <= 0) {
            throw new DomainException("Limit must be positive: " + requested,
                    "INVALID_VIEWPORT");
        }
        return Math.min(requested, maxLimit);
    }

    /**
     * Returns one page of the nodes inside a viewport with their edges.
     *
     * @param scope the request scope
     * @param viewport the viewport query
     * @param includeExtraEdges whether to also fetch extra edges between
     *        the returned nodes
     * @return the fragment, empty when nothing matches
     */
    public Fragment viewportFragment(final QueryScope scope,
            final Viewport viewport, final boolean includeExtraEdges) {
        final SpatialSnapshot snapshot = spatialIndex.snapshot();
        final BoundingBox searchBox = viewport.box().expand(viewportMargin);

        final Page page = scope.execute(QueryKind.VIEWPORT,
                "viewport " + describe(searchBox) + " minDegree="
                        + viewport.minDegree() + " offset=" + viewport.offset(),
                () -> select(snapshot, searchBox, viewport));

        if (page.nodes.isEmpty()) {
            LOG.debug("Viewport {} matched {} nodes, page is empty",
                    describe(searchBox), page.total);
            return Fragment.empty(page.total, viewport.offset(),
                    viewport.limit());
        }

        final Set<String> ids = idsOf(page.nodes);
        final EdgeSplit split = splitEdges(scope, QueryKind.VIEWPORT, ids,
                snapshot);

        List<ExtraEdge> extraEdges = List.of();
        if (includeExtraEdges) {
            extraEdges = scope.execute(QueryKind.EDGE_BATCH,
                    "extra edges within " + ids.size() + " viewport nodes",
                    () -> extraEdgeRepository.findWithin(ids, maxLimit));
        }

        final boolean hasMore = viewport.offset() + page.nodes.size()
                < page.total;
        return new Fragment(page.nodes, split.treeEdges, split.brokenEdges,
                extraEdges, hasMore, new Fragment.Stats(page.total,
                        page.nodes.size(), viewport.offset(),
                        viewport.limit()));
    }

    /**
     * Returns the extra edges with at least one end in a node set, highest
     * priority first.
     *
     * @param scope the request scope
     * @param nodeIds the node ids
     * @param maxEdges the largest number of edges to return, may be null
     * @return the extra edges
     */
    public List<ExtraEdge> extraEdgesForNodes(final QueryScope scope,
            final Collection<String> nodeIds, final Integer maxEdges) {
        if (nodeIds == null || nodeIds.isEmpty()) {
            return List.of();
        }
        final int limit = resolveLimit(maxEdges);
        final Set<String> ids = new LinkedHashSet<>(nodeIds);
        return scope.execute(QueryKind.EDGE_BATCH,
                "extra edges touching " + ids.size() + " nodes, max " + limit,
                () -> extraEdgeRepository.findTouching(ids, limit));
    }

    /**
     * Returns the most cited nodes of each of the first levels.
     *
     * @param scope the request scope
     * @param maxLevels how many levels, from the roots
     * @param maxNodesPerLevel nodes per level at most
     * @return the nodes ordered by level, then degree descending
     */
    public List<CitationNode> topologicalOverview(final QueryScope scope,
            final int maxLevels, final int maxNodesPerLevel) {
        if (maxLevels <= 0 || maxNodesPerLevel <= 0) {
            throw new DomainException("Levels and nodes per level must be"
                    + " positive", "INVALID_OVERVIEW");
        }
        return scope.execute(QueryKind.OVERVIEW,
                "overview of " + maxLevels + " levels, " + maxNodesPerLevel
                        + " nodes each",
                () -> nodeRepository.findTopologicalOverview(maxLevels,
                        maxNodesPerLevel));
    }

    /**
     * Expands the tree below a node.
     *
     * @param scope the request scope
     * @param nodeId the node to expand
     * @param depth how many tree hops to follow, 1 to 5
     * @return the node, its descendants up to {@code depth} and their edges;
     *         {@code hasMore} tells whether deeper children exist
     */
    public Fragment treeChildren(final QueryScope scope, final String nodeId,
            final int depth) {
        if (depth < 1 || depth > MAX_CHILDREN_DEPTH) {
            throw new DomainException("Depth must be between 1 and "
                    + MAX_CHILDREN_DEPTH, "INVALID_DEPTH");
        }
        final SpatialSnapshot snapshot = spatialIndex.snapshot();
        final CitationNode root = snapshot.node(nodeId).orElseThrow(() ->
                new DomainException("Node not found: " + nodeId,
                        "NODE_NOT_FOUND"));

        final Set<String> collected = new LinkedHashSet<>();
        collected.add(root.id());
        Set<String> frontier = Set.of(root.id());
        for (int hop = 1; hop <= depth && !frontier.isEmpty(); hop++) {
            final Set<String> parents = frontier;
            final List<CitationEdge> edges = scope.execute(
                    QueryKind.EDGE_BATCH,
                    "tree children of " + parents.size() + " nodes, hop "
                            + hop + " below " + nodeId,
                    () -> treeEdgeRepository.findBySources(parents));
            final Set<String> next = new LinkedHashSet<>();
            for (final CitationEdge edge : edges) {
                if (collected.add(edge.dst())) {
                    next.add(edge.dst());
                }
            }
            frontier = next;
        }

        final List<CitationNode> nodes = new ArrayList<>(
                snapshot.nodes(collected));
        nodes.sort(BY_IMPORTANCE);
        final EdgeSplit split = splitEdges(scope, QueryKind.EDGE_BATCH,
                collected, snapshot);
        final boolean hasMore = split.brokenEdges.stream()
                .anyMatch(e -> e.role() == EdgeRole.CHILD)
                || split.truncated;
        return new Fragment(nodes, split.treeEdges, split.brokenEdges,
                List.of(), hasMore, new Fragment.Stats(nodes.size(),
                        nodes.size(), 0, nodes.size()));
    }

    /**
     * Resolves node ids against the spatial snapshot.
     *
     * @param nodeIds the ids to resolve
     * @return the known nodes, unknown ids are skipped
     */
    public List<CitationNode> nodes(final Collection<String> nodeIds) {
        if (nodeIds == null || nodeIds.isEmpty()) {
            return List.of();
        }
        return spatialIndex.snapshot().nodes(new LinkedHashSet<>(nodeIds));
    }

    /**
     * Returns the extent of every node, padded by 5% on each side.
     *
     * @return the bounds; {@code [-10, 10]} on both axes without nodes
     */
    public DataBounds dataBounds() {
        final SpatialSnapshot snapshot = spatialIndex.snapshot();
        final Optional<BoundingBox> bounds = snapshot.dataBounds();
        if (bounds.isEmpty()) {
            return new DataBounds(-EMPTY_BOUNDS, EMPTY_BOUNDS, -EMPTY_BOUNDS,
                    EMPTY_BOUNDS, 0);
        }
        final BoundingBox padded = bounds.get().expand(BOUNDS_PADDING);
        return new DataBounds(padded.minX(), padded.maxX(), padded.minY(),
                padded.maxY(), snapshot.size());
    }

    private Page select(final SpatialSnapshot snapshot,
            final BoundingBox searchBox, final Viewport viewport) {
        final List<CitationNode> matches = new ArrayList<>();
        for (final CitationNode node : snapshot.search(searchBox)) {
            if (viewport.accepts(node)) {
                matches.add(node);
            }
        }
        matches.sort(BY_IMPORTANCE);
        final int from = Math.min(viewport.offset(), matches.size());
        final int to = Math.min(from + viewport.limit(), matches.size());
        return new Page(new ArrayList<>(matches.subList(from, to)),
                matches.size());
    }

    private EdgeSplit splitEdges(final QueryScope scope, final QueryKind kind,
            final Set<String> ids, final SpatialSnapshot snapshot) {
        final List<CitationEdge> touching = scope.execute(kind,
                "tree edges touching " + ids.size() + " nodes",
                () -> treeEdgeRepository.findTouching(ids));

        final List<CitationEdge> inside = new ArrayList<>();
        final List<BrokenEdge> broken = new ArrayList<>();
        for (final CitationEdge edge : touching) {
            final boolean srcInside = ids.contains(edge.src());
            final boolean dstInside = ids.contains(edge.dst());
            if (srcInside && dstInside) {
                inside.add(edge);
            } else if (srcInside) {
                broken.add(BrokenEdge.of(edge, false, degreeOf(snapshot,
                        edge.dst())));
            } else if (dstInside) {
                broken.add(BrokenEdge.of(edge, true, degreeOf(snapshot,
                        edge.src())));
            }
        }
        broken.sort(Comparator.comparingDouble(BrokenEdge::priority)
                .reversed()
                .thenComparing(BrokenEdge::externalNodeId)
                .thenComparing(BrokenEdge::src)
                .thenComparing(BrokenEdge::dst));
        final boolean truncated = broken.size() > maxBrokenEdges;
        final List<BrokenEdge> kept = truncated
                ? broken.subList(0, maxBrokenEdges) : broken;
        return new EdgeSplit(inside, kept, truncated);
    }

    private static int degreeOf(final SpatialSnapshot snapshot,
            final String id) {
        return snapshot.node(id).map(CitationNode::degree).orElse(0);
    }

    private static Set<String> idsOf(final List<CitationNode> nodes) {
        final Set<String> ids = new HashSet<>(nodes.size() * 2);
        for (final CitationNode node : nodes) {
            ids.add(node.id());
        }
        return ids;
    }

    private static String describe(final BoundingBox box) {
        return String.format("[%.2f, %.2f] x [%.2f, %.2f]", box.minX(),
                box.maxX(), box.minY(), box.maxY());
    }

    private record Page(List<CitationNode> nodes, int total) {
    }

    private record EdgeSplit(List<CitationEdge> treeEdges,
            List<BrokenEdge> brokenEdges, boolean truncated) {
    }

}
