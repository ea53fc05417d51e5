package dk.trustworks.leaveledger.security;

import dk.trustworks.leaveledger.model.Auditable;
import jakarta.enterprise.context.ContextNotActiveException;
import jakarta.enterprise.inject.spi.CDI;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import lombok.extern.jbosslog.JBossLog;

import java.time.LocalDateTime;

/**
 * Fills the audit columns of {@link Auditable} ledger rows.
 * <p>
 * Outside a request (scheduled reconciliation, penalty writes triggered from jobs) there is
 * no {@link RequestActorHolder} and the rows are attributed to {@link Actor#SYSTEM_UUID}.
 * </p>
 */
@JBossLog
public class AuditEntityListener {

    @PrePersist
    public void prePersist(Object entity) {
        setAuditFields(entity, true);
    }

    @PreUpdate
    public void preUpdate(Object entity) {
        setAuditFields(entity, false);
    }

    private void setAuditFields(Object entity, boolean isNew) {
        if (!(entity instanceof Auditable auditable)) {
            return;
        }

        String actorUuid = currentActorUuid();
        LocalDateTime now = LocalDateTime.now();

        if (isNew) {
            auditable.setCreatedAt(now);
            auditable.setCreatedBy(actorUuid);
        }
        auditable.setUpdatedAt(now);
        auditable.setModifiedBy(actorUuid);
        log.debugf("Audit fields set on %s by %s", entity.getClass().getSimpleName(), actorUuid);
    }

    private String currentActorUuid() {
        try {
            String user = CDI.current().select(RequestActorHolder.class).get().getAuditUsername();
            return (user == null || user.isBlank()) ? Actor.SYSTEM_UUID : user;
        } catch (ContextNotActiveException e) {
            log.debug("No request context active, attributing change to system");
            return Actor.SYSTEM_UUID;
        }
    }
}
