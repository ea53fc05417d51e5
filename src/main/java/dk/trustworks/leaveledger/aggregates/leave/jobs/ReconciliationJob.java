package dk.trustworks.leaveledger.aggregates.leave.jobs;

import dk.trustworks.leaveledger.aggregates.leave.dto.ReconciliationResult;
import dk.trustworks.leaveledger.aggregates.leave.model.Allotment;
import dk.trustworks.leaveledger.aggregates.leave.repositories.AllotmentRepository;
import dk.trustworks.leaveledger.config.FeatureFlags;
import io.quarkus.scheduler.Scheduled;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import lombok.extern.jbosslog.JBossLog;

import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Forces a recompute of every allotment. Safe to run at any time: on a consistent ledger
 * nothing changes.
 */
@JBossLog
@ApplicationScoped
public class ReconciliationJob {

    private final AtomicBoolean running = new AtomicBoolean(false);

    @Inject
    AllotmentRepository allotmentRepository;

    @Inject
    AllotmentReconciler allotmentReconciler;

    @Inject
    FeatureFlags featureFlags;

    @Scheduled(cron = "{leaveledger.reconciliation.cron}", concurrentExecution = Scheduled.ConcurrentExecution.SKIP)
    void scheduledReconciliation() {
        if (!featureFlags.isScheduledReconciliationEnabled()) {
            log.debug("Scheduled reconciliation disabled");
            return;
        }
        reconcileAll();
    }

    public ReconciliationResult reconcileAll() {
        if (!running.compareAndSet(false, true)) {
            log.warn("Reconciliation already running, skipping this run");
            return new ReconciliationResult(0, 0, 0);
        }
        try {
            List<Allotment> allotments = allotmentRepository.findAllOrdered();
            log.infof("Reconciling %d allotments", allotments.size());
            int changed = 0;
            int failed = 0;
            for (Allotment allotment : allotments) {
                try {
                    if (allotmentReconciler.reconcile(allotment.getEmployeeUuid(), allotment.getCategoryUuid())) {
                        changed++;
                    }
                } catch (RuntimeException e) {
                    failed++;
                    log.errorf(e, "Failed to reconcile allotment %s (employee %s, category %s)",
                            allotment.getUuid(), allotment.getEmployeeUuid(), allotment.getCategoryUuid());
                }
            }
            ReconciliationResult result = new ReconciliationResult(allotments.size(), changed, failed);
            log.infof("Reconciliation finished: %s", result);
            return result;
        } finally {
            running.set(false);
        }
    }
}
