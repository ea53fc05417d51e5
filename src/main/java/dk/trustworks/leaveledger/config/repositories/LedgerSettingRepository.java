package dk.trustworks.leaveledger.config.repositories;

import dk.trustworks.leaveledger.config.model.LedgerSetting;
import io.quarkus.hibernate.orm.panache.PanacheRepositoryBase;
import jakarta.enterprise.context.ApplicationScoped;

import java.util.Optional;

@ApplicationScoped
public class LedgerSettingRepository implements PanacheRepositoryBase<LedgerSetting, String> {

    public Optional<String> findValue(String key) {
        return findByIdOptional(key).map(LedgerSetting::getValue);
    }
}
