package dk.trustworks.leaveledger.config.model;

import dk.trustworks.leaveledger.model.Auditable;
import dk.trustworks.leaveledger.security.AuditEntityListener;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.quarkus.hibernate.orm.panache.PanacheEntityBase;
import jakarta.persistence.*;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Data
@EqualsAndHashCode(onlyExplicitlyIncluded = true, callSuper = false)
@NoArgsConstructor
@Entity
@Table(name = "ledger_setting")
@EntityListeners(AuditEntityListener.class)
public class LedgerSetting extends PanacheEntityBase implements Auditable {

    @Id
    @EqualsAndHashCode.Include
    @Column(name = "setting_key", length = 100)
    private String key;

    @Column(name = "setting_value", nullable = false)
    private String value;

    @Column(name = "created_at", nullable = false)
    @JsonProperty(access = JsonProperty.Access.READ_ONLY)
    private LocalDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    @JsonProperty(access = JsonProperty.Access.READ_ONLY)
    private LocalDateTime updatedAt;

    @Column(name = "created_by", nullable = false, length = 255)
    @JsonProperty(access = JsonProperty.Access.READ_ONLY)
    private String createdBy;

    @Column(name = "modified_by", length = 255)
    @JsonProperty(access = JsonProperty.Access.READ_ONLY)
    private String modifiedBy;

    public LedgerSetting(String key, String value) {
        this.key = key;
        this.value = value;
    }
}
