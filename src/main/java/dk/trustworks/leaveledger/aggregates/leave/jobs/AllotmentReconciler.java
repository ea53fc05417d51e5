package dk.trustworks.leaveledger.aggregates.leave.jobs;

import dk.trustworks.leaveledger.aggregates.leave.services.BalanceLedger;
import io.quarkus.narayana.jta.QuarkusTransaction;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.persistence.PersistenceException;
import org.eclipse.microprofile.faulttolerance.Retry;

/**
 * Reconciles a single allotment in a transaction of its own, retrying transient
 * persistence failures such as lock timeouts.
 */
@ApplicationScoped
public class AllotmentReconciler {

    @Inject
    BalanceLedger balanceLedger;

    @Retry(maxRetries = 2, delay = 200, retryOn = PersistenceException.class)
    public boolean reconcile(String employeeUuid, String categoryUuid) {
        return QuarkusTransaction.requiringNew().call(() -> balanceLedger.reconcile(employeeUuid, categoryUuid));
    }
}
