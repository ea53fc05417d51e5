package dk.trustworks.leaveledger.model;

import java.time.LocalDateTime;

/**
 * Ledger entities whose audit columns are filled in by
 * {@link dk.trustworks.leaveledger.security.AuditEntityListener}.
 * <p>
 * Implementations map the four columns {@code created_at}, {@code created_by},
 * {@code updated_at} and {@code modified_by} and expose them read-only to JSON clients.
 * </p>
 */
public interface Auditable {

    LocalDateTime getCreatedAt();

    void setCreatedAt(LocalDateTime createdAt);

    LocalDateTime getUpdatedAt();

    void setUpdatedAt(LocalDateTime updatedAt);

    /**
     * @return uuid of the actor that created the row, or {@code system} for jobs
     */
    String getCreatedBy();

    void setCreatedBy(String createdBy);

    String getModifiedBy();

    void setModifiedBy(String modifiedBy);
}
