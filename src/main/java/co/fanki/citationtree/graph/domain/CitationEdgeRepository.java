package co.fanki.citationtree.graph.domain;

import co.fanki.citationtree.shared.Queries;
import org.jdbi.v3.core.Jdbi;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * Read access to the full citation edge set.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Repository
public class CitationEdgeRepository {

    private final Jdbi jdbi;

    /**
     * Creates a new CitationEdgeRepository.
     *
     * @param theJdbi the JDBI instance
     */
    public CitationEdgeRepository(final Jdbi theJdbi) {
        this.jdbi = theJdbi;
    }

    /**
     * Loads every citation.
     *
     * @return all citation edges
     */
    public List<CitationEdge> findAll() {
        return jdbi.withHandle(handle -> handle
                .createQuery(Queries.CITATION_FIND_ALL)
                .map((rs, ctx) -> new CitationEdge(
                        rs.getString("src"), rs.getString("dst")))
                .list());
    }

}
