package villagecompute.clipindex.jobs;

import io.quarkus.scheduler.Scheduled;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;
import villagecompute.clipindex.services.ScanStateService;

import java.time.Duration;

/**
 * Cancels scans whose worker died: PENDING or RUNNING rows not updated within {@code clipindex.scan.stale-after}
 * (30 minutes by default). A live scan touches its row after every page, so only abandoned rows match.
 */
@ApplicationScoped
public class ScanRecoveryScheduler {

    private static final Logger LOG = Logger.getLogger(ScanRecoveryScheduler.class);

    @Inject
    ScanStateService scanStateService;

    @ConfigProperty(
            name = "clipindex.scan.stale-after",
            defaultValue = "30m")
    Duration staleAfter;

    @Scheduled(
            every = "5m",
            identity = "scan-recovery")
    void recoverStaleScans() {
        try {
            scanStateService.recoverStale(staleAfter);
        } catch (Exception e) {
            LOG.errorf(e, "Stale scan recovery failed: %s", e.getMessage());
            // Swallow exception to prevent scheduler from being disabled
        }
    }
}
