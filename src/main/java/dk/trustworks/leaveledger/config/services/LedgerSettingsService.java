package dk.trustworks.leaveledger.config.services;

import dk.trustworks.leaveledger.aggregates.attendance.model.ClockInThreshold;
import dk.trustworks.leaveledger.config.model.LedgerSetting;
import dk.trustworks.leaveledger.config.repositories.LedgerSettingRepository;
import dk.trustworks.leaveledger.exceptions.RecordNotFoundException;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.transaction.Transactional;
import jakarta.ws.rs.BadRequestException;
import lombok.extern.jbosslog.JBossLog;

import java.util.List;
import java.util.Optional;

/**
 * Key/value settings that drive the attendance penalty rules.
 */
@JBossLog
@ApplicationScoped
public class LedgerSettingsService {

    public static final String DEFAULT_CLOCK_IN_THRESHOLD = "defaultClockInThreshold";
    public static final String MAX_LATE_DAYS_PER_MONTH = "maxLateDaysPerMonth";

    public static final List<String> KNOWN_KEYS = List.of(DEFAULT_CLOCK_IN_THRESHOLD, MAX_LATE_DAYS_PER_MONTH);

    @Inject
    LedgerSettingRepository settingRepository;

    public Optional<ClockInThreshold> defaultClockInThreshold() {
        Optional<String> raw = settingRepository.findValue(DEFAULT_CLOCK_IN_THRESHOLD);
        try {
            return raw.flatMap(ClockInThreshold::parse);
        } catch (IllegalArgumentException e) {
            log.warnf("Ignoring stored %s: %s", DEFAULT_CLOCK_IN_THRESHOLD, e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Number of late days tolerated per calendar month before a penalty is charged. Defaults to 0.
     */
    public int maxLateDaysPerMonth() {
        return settingRepository.findValue(MAX_LATE_DAYS_PER_MONTH)
                .map(this::parseGraceCount)
                .orElse(0);
    }

    public LedgerSetting get(String key) {
        return settingRepository.findByIdOptional(key)
                .orElseThrow(() -> RecordNotFoundException.of("Setting", key));
    }

    @Transactional
    public LedgerSetting saveOrUpdate(String key, String value) {
        validate(key, value);
        String normalized = value.trim();
        LedgerSetting setting = settingRepository.findByIdOptional(key).orElse(null);
        if (setting == null) {
            setting = new LedgerSetting(key, normalized);
            settingRepository.persist(setting);
            log.infof("Created ledger setting %s = %s", key, normalized);
        } else {
            log.infof("Updated ledger setting %s: %s -> %s", key, setting.getValue(), normalized);
            setting.setValue(normalized);
        }
        return setting;
    }

    void validate(String key, String value) {
        if (!KNOWN_KEYS.contains(key)) {
            throw new BadRequestException("Unknown ledger setting: " + key);
        }
        if (value == null || value.isBlank()) {
            throw new BadRequestException("Value of " + key + " must not be blank");
        }
        switch (key) {
            case DEFAULT_CLOCK_IN_THRESHOLD -> {
                try {
                    ClockInThreshold.parse(value);
                } catch (IllegalArgumentException e) {
                    throw new BadRequestException(e.getMessage());
                }
            }
            case MAX_LATE_DAYS_PER_MONTH -> {
                int parsed;
                try {
                    parsed = Integer.parseInt(value.trim());
                } catch (NumberFormatException e) {
                    throw new BadRequestException(MAX_LATE_DAYS_PER_MONTH + " must be a whole number: " + value);
                }
                if (parsed < 0) throw new BadRequestException(MAX_LATE_DAYS_PER_MONTH + " cannot be negative");
            }
            default -> throw new BadRequestException("Unknown ledger setting: " + key);
        }
    }

    private int parseGraceCount(String raw) {
        try {
            return Math.max(0, Integer.parseInt(raw.trim()));
        } catch (NumberFormatException e) {
            log.warnf("Stored %s is not a number (%s), using 0", MAX_LATE_DAYS_PER_MONTH, raw);
            return 0;
        }
    }
}
