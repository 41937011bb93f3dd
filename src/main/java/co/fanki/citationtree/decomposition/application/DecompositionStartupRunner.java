package co.fanki.citationtree.decomposition.application;

import co.fanki.citationtree.decomposition.domain.DecompositionRun;
import co.fanki.citationtree.shared.DomainException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Runs a decomposition once the application is ready.
 *
 * <p>Opt-in via {@code decomposition.run-on-startup=true}. Disabled by
 * default. A failed run is logged and recorded; the server keeps serving the
 * previously published decomposition.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Component
@ConditionalOnProperty(
        name = "decomposition.run-on-startup",
        havingValue = "true",
        matchIfMissing = false)
public class DecompositionStartupRunner {

    private static final Logger LOG = LoggerFactory.getLogger(
            DecompositionStartupRunner.class);

    private final DecompositionService decompositionService;

    /**
     * Creates a new DecompositionStartupRunner.
     *
     * @param theDecompositionService the decomposition service
     */
    public DecompositionStartupRunner(
            final DecompositionService theDecompositionService) {
        this.decompositionService = theDecompositionService;
    }

    /** Runs the decomposition with the configured strategy. */
    @EventListener(ApplicationReadyEvent.class)
    public void decomposeOnStartup() {
        LOG.info("Running start-up decomposition");
        try {
            final DecompositionRun run = decompositionService.decompose(null);
            LOG.info("Start-up decomposition {} finished with {}", run.id(),
                    run.status());
        } catch (final DomainException e) {
            LOG.error("Start-up decomposition failed [{}]: {}",
                    e.getErrorCode(), e.getMessage());
        }
    }

}
