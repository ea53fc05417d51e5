package dk.trustworks.leaveledger.aggregates.employees.services;

import dk.trustworks.leaveledger.aggregates.employees.dto.EmployeeIdAssignment;
import io.quarkus.scheduler.Scheduled;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import lombok.extern.jbosslog.JBossLog;
import org.eclipse.microprofile.config.inject.ConfigProperty;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * Throttled entry point to {@link EmployeeIdSequencer}. Runs at most once per interval; callers
 * arriving while a run is in flight wait for that run instead of starting another.
 * <p>
 * TODO: the throttle is per instance; move last-run and in-flight state to a shared lease
 * before running more than one replica.
 * </p>
 */
@JBossLog
@ApplicationScoped
public class EmployeeIdAssigner {

    @Inject
    EmployeeIdSequencer sequencer;

    @ConfigProperty(name = "leaveledger.employee-id.min-interval", defaultValue = "PT5M")
    Duration minInterval = Duration.ofMinutes(5);

    Clock clock = Clock.systemUTC();

    private Instant lastRun;

    private CompletableFuture<EmployeeIdAssignment> inFlight;

    @Scheduled(every = "15m", delayed = "1m", concurrentExecution = Scheduled.ConcurrentExecution.SKIP)
    void scheduledAssignment() {
        ensureEmployeeIds();
    }

    public EmployeeIdAssignment ensureEmployeeIds() {
        return ensureEmployeeIds(false);
    }

    /**
     * @param force ignore the interval, still joining a run in flight
     */
    public EmployeeIdAssignment ensureEmployeeIds(boolean force) {
        CompletableFuture<EmployeeIdAssignment> run;
        boolean owner = false;
        synchronized (this) {
            if (inFlight != null) {
                run = inFlight;
            } else if (!force && lastRun != null && Duration.between(lastRun, clock.instant()).compareTo(minInterval) < 0) {
                log.debugf("Employee id assignment ran at %s, skipping", lastRun);
                return EmployeeIdAssignment.skipped();
            } else {
                run = new CompletableFuture<>();
                inFlight = run;
                owner = true;
            }
        }

        if (owner) {
            try {
                run.complete(sequencer.assign());
            } catch (RuntimeException e) {
                run.completeExceptionally(e);
            } finally {
                synchronized (this) {
                    lastRun = clock.instant();
                    inFlight = null;
                }
            }
        }

        try {
            return run.join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException cause) throw cause;
            throw e;
        }
    }
}
