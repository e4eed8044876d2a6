package tech.terrareg.platform.authentication.session;

import io.quarkus.scheduler.Scheduled;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import tech.terrareg.platform.authentication.terraform.TerraformIdpService;

import java.util.function.LongSupplier;

/**
 * Periodically removes expired sessions, OAuth state records and Terraform login
 * codes and tokens. A failed step is logged and the remaining steps still run.
 */
@ApplicationScoped
public class SessionCleanupService {

    private static final Logger LOG = Logger.getLogger(SessionCleanupService.class);

    @Inject
    SessionService sessionService;

    @Inject
    TerraformIdpService terraformIdpService;

    /**
     * Totals removed by one run.
     */
    public record CleanupResult(long sessions, long oauthStates, long terraformCredentials) {

        public long total() {
            return sessions + oauthStates + terraformCredentials;
        }
    }

    @Scheduled(
            every = "${terrareg.session-cleanup-interval-mins:60}m",
            delayed = "1m",
            concurrentExecution = Scheduled.ConcurrentExecution.SKIP
    )
    void scheduledCleanup() {
        CleanupResult result = cleanup();
        LOG.infof("Session cleanup removed %d sessions, %d OAuth states and %d Terraform credentials",
            result.sessions(), result.oauthStates(), result.terraformCredentials());
    }

    public CleanupResult cleanup() {
        long sessions = safely("sessions", () -> sessionService.deleteExpired(SessionKind.SESSION));
        long states = safely("OAuth states", () -> sessionService.deleteExpired(SessionKind.OAUTH_STATE));
        long terraform = safely("Terraform credentials", terraformIdpService::deleteExpired);
        return new CleanupResult(sessions, states, terraform);
    }

    private long safely(String what, LongSupplier step) {
        try {
            return step.getAsLong();
        } catch (RuntimeException e) {
            LOG.errorf(e, "Error removing expired %s", what);
            return 0;
        }
    }
}
