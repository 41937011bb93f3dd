package co.fanki.citationtree.fragment.application;

import co.fanki.citationtree.fragment.domain.DataBounds;
import co.fanki.citationtree.fragment.domain.Fragment;
import co.fanki.citationtree.fragment.domain.Viewport;
import co.fanki.citationtree.fragment.domain.ViewportFilterParser;
import co.fanki.citationtree.graph.domain.CitationNode;
import co.fanki.citationtree.graph.domain.ExtraEdge;
import co.fanki.citationtree.query.domain.QueryExecutor;
import co.fanki.citationtree.query.domain.QueryScope;
import co.fanki.citationtree.shared.DomainException;
import co.fanki.citationtree.shared.ErrorResponses;
import co.fanki.citationtree.spatial.domain.BoundingBox;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * REST controller serving fragments of the decomposition.
 *
 * <p>Every request opens a query scope named after the {@code X-Request-Id}
 * header (or a generated id), so a client can cancel it through
 * {@code DELETE /api/queries/{requestId}}.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@RestController
@RequestMapping("/api")
@Tag(name = "Fragments",
        description = "Viewport fragments, enrichment and overview")
public class FragmentController {

    private static final Logger LOG = LoggerFactory.getLogger(
            FragmentController.class);

    /** Header carrying the client request id. */
    public static final String REQUEST_ID_HEADER = "X-Request-Id";

    private final TreeFragmentService fragmentService;

    private final QueryExecutor queryExecutor;

    /**
     * Creates a new FragmentController.
     *
     * @param theFragmentService the fragment service
     * @param theQueryExecutor the query executor
     */
    public FragmentController(final TreeFragmentService theFragmentService,
            final QueryExecutor theQueryExecutor) {
        this.fragmentService = theFragmentService;
        this.queryExecutor = theQueryExecutor;
    }

    /**
     * Returns one page of a viewport.
     *
     * @param requestId the client request id, may be null
     * @param request the viewport
     * @return the fragment
     */
    @PostMapping("/fragments/viewport")
    @Operation(summary = "Get a viewport fragment",
            description = "Nodes inside the box passing the degree, cluster"
                    + " and level filters, most cited first, with the tree"
                    + " edges between them and the broken edges leaving"
                    + " them")
    public ResponseEntity<Object> viewport(
            @RequestHeader(name = REQUEST_ID_HEADER, required = false)
            final String requestId,
            @RequestBody final ViewportRequest request) {

        try (QueryScope scope = queryExecutor.openScope(requestId)) {
            final Viewport viewport = new Viewport(
                    new BoundingBox(request.minX(), request.maxX(),
                            request.minY(), request.maxY()),
                    request.minDegree() != null ? request.minDegree() : 0,
                    ViewportFilterParser.parseClusters(
                            request.visibleClusters()),
                    request.maxLevel(),
                    request.offset() != null ? request.offset() : 0,
                    fragmentService.resolveLimit(request.limit()));

            final Fragment fragment = fragmentService.viewportFragment(scope,
                    viewport, Boolean.TRUE.equals(request.includeExtraEdges()));

            LOG.debug("Viewport {} returned {} of {} nodes", scope.requestId(),
                    fragment.stats().returned(),
                    fragment.stats().totalMatches());
            return ResponseEntity.ok(fragment);
        } catch (final DomainException e) {
            return failed("Viewport", e);
        }
    }

    /**
     * Returns the extra edges touching a node set.
     *
     * @param requestId the client request id, may be null
     * @param request the node ids and edge limit
     * @return the extra edges, highest priority first
     */
    @PostMapping("/edges/extra")
    @Operation(summary = "Get extra edges for nodes",
            description = "Removed cycle edges with at least one end in the"
                    + " given nodes, for progressive enrichment")
    public ResponseEntity<Object> extraEdges(
            @RequestHeader(name = REQUEST_ID_HEADER, required = false)
            final String requestId,
            @RequestBody final ExtraEdgesRequest request) {

        try (QueryScope scope = queryExecutor.openScope(requestId)) {
            final List<ExtraEdge> edges = fragmentService.extraEdgesForNodes(
                    scope, request.nodeIds(), request.maxEdges());
            return ResponseEntity.ok(new ExtraEdgesResponse(edges));
        } catch (final DomainException e) {
            return failed("Extra edges", e);
        }
    }

    /**
     * Returns the most cited nodes of the first topological levels.
     *
     * @param requestId the client request id, may be null
     * @param maxLevels how many levels
     * @param maxNodesPerLevel nodes per level
     * @return the nodes, tagged with their level
     */
    @GetMapping("/overview/topological")
    @Operation(summary = "Get the topological overview",
            description = "Top nodes by degree for each level from the roots")
    public ResponseEntity<Object> overview(
            @RequestHeader(name = REQUEST_ID_HEADER, required = false)
            final String requestId,
            @RequestParam(defaultValue = "5") final int maxLevels,
            @RequestParam(defaultValue = "100") final int maxNodesPerLevel) {

        try (QueryScope scope = queryExecutor.openScope(requestId)) {
            final List<CitationNode> nodes = fragmentService
                    .topologicalOverview(scope, maxLevels, maxNodesPerLevel);
            return ResponseEntity.ok(new NodesResponse(nodes));
        } catch (final DomainException e) {
            return failed("Overview", e);
        }
    }

    /**
     * Resolves nodes by id.
     *
     * @param ids the node ids
     * @return the known nodes
     */
    @GetMapping("/nodes")
    @Operation(summary = "Get nodes by id")
    public ResponseEntity<NodesResponse> nodes(
            @RequestParam final List<String> ids) {
        return ResponseEntity.ok(new NodesResponse(
                fragmentService.nodes(ids)));
    }

    /**
     * Expands the tree below a node.
     *
     * @param requestId the client request id, may be null
     * @param id the node id
     * @param depth hops to follow, 1 to 5
     * @return the expansion fragment
     */
    @GetMapping("/nodes/{id}/children")
    @Operation(summary = "Get tree children of a node",
            description = "Follows tree edges downwards up to the given depth")
    public ResponseEntity<Object> children(
            @RequestHeader(name = REQUEST_ID_HEADER, required = false)
            final String requestId,
            @PathVariable final String id,
            @RequestParam(defaultValue = "1") final int depth) {

        try (QueryScope scope = queryExecutor.openScope(requestId)) {
            return ResponseEntity.ok(fragmentService.treeChildren(scope, id,
                    depth));
        } catch (final DomainException e) {
            return failed("Children", e);
        }
    }

    /**
     * Returns the padded extent of the layout.
     *
     * @return the bounds
     */
    @GetMapping("/bounds")
    @Operation(summary = "Get the data bounds")
    public ResponseEntity<DataBounds> bounds() {
        return ResponseEntity.ok(fragmentService.dataBounds());
    }

    private ResponseEntity<Object> failed(final String operation,
            final DomainException e) {
        if ("QUERY_CANCELLED".equals(e.getErrorCode())) {
            LOG.debug("{} cancelled: {}", operation, e.getMessage());
        } else {
            LOG.warn("{} failed: {}", operation, e.getMessage());
        }
        return ErrorResponses.of(e);
    }

    /**
     * Request body of a viewport query.
     *
     * @param minX left edge of the box
     * @param maxX right edge of the box
     * @param minY bottom edge of the box
     * @param maxY top edge of the box
     * @param minDegree minimum degree, defaults to 0
     * @param visibleClusters comma separated cluster ids, all when absent
     * @param maxLevel deepest level, all when absent
     * @param offset page offset, defaults to 0
     * @param limit page size, the configured default when absent
     * @param includeExtraEdges whether to add extra edges, defaults to false
     */
    public record ViewportRequest(
            double minX,
            double maxX,
            double minY,
            double maxY,
            Integer minDegree,
            String visibleClusters,
            Integer maxLevel,
            Integer offset,
            Integer limit,
            Boolean includeExtraEdges) {}

    /**
     * Request body of an extra edge batch.
     *
     * @param nodeIds the node ids
     * @param maxEdges the largest number of edges, the default when absent
     */
    public record ExtraEdgesRequest(List<String> nodeIds, Integer maxEdges) {}

    /**
     * Extra edges response.
     *
     * @param extraEdges the edges
     */
    public record ExtraEdgesResponse(List<ExtraEdge> extraEdges) {}

    /**
     * Node list response.
     *
     * @param nodes the nodes
     */
    public record NodesResponse(List<CitationNode> nodes) {}

}
