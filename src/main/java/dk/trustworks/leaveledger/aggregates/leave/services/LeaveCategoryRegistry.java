package dk.trustworks.leaveledger.aggregates.leave.services;

import dk.trustworks.leaveledger.aggregates.leave.model.Allotment;
import dk.trustworks.leaveledger.aggregates.leave.model.LeaveCategory;
import dk.trustworks.leaveledger.aggregates.leave.model.enums.LeaveUnit;
import dk.trustworks.leaveledger.aggregates.leave.repositories.AllotmentRepository;
import dk.trustworks.leaveledger.aggregates.leave.repositories.LeaveCategoryRepository;
import dk.trustworks.leaveledger.exceptions.InvalidCategoryException;
import dk.trustworks.leaveledger.exceptions.RecordNotFoundException;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.transaction.Transactional;
import lombok.extern.jbosslog.JBossLog;
import org.eclipse.microprofile.config.inject.ConfigProperty;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Catalogue of leave categories. Categories are looked up by uuid everywhere; name lookup
 * is kept for collaborators and for the penalty fallback.
 */
@JBossLog
@ApplicationScoped
public class LeaveCategoryRegistry {

    @Inject
    LeaveCategoryRepository categoryRepository;

    @Inject
    AllotmentRepository allotmentRepository;

    @ConfigProperty(name = "leaveledger.penalty.category-name", defaultValue = "Casual Leave")
    String penaltyCategoryName = "Casual Leave";

    @Transactional
    public LeaveCategory create(String name, String description, LeaveUnit unit) {
        if (name == null || name.isBlank()) throw new InvalidCategoryException("Leave category name is required");
        if (unit == null) throw new InvalidCategoryException("Leave category unit is required");
        if (categoryRepository.findByNameIgnoreCase(name).isPresent()) {
            throw new InvalidCategoryException("Leave category '" + name.trim() + "' already exists");
        }
        LeaveCategory category = LeaveCategory.create(name, description, unit);
        categoryRepository.persist(category);
        log.infof("Created leave category %s (%s)", category.getName(), unit);
        return category;
    }

    public List<LeaveCategory> listActive() {
        return categoryRepository.findActive();
    }

    public Optional<LeaveCategory> findByUuid(String uuid) {
        return categoryRepository.findByIdOptional(uuid);
    }

    /**
     * @throws InvalidCategoryException when the category is missing or deactivated
     */
    public LeaveCategory findActive(String uuid) {
        if (uuid == null) throw new InvalidCategoryException("Leave category is required");
        LeaveCategory category = categoryRepository.findByIdOptional(uuid)
                .orElseThrow(() -> new InvalidCategoryException("Invalid leave type"));
        if (!category.isActive()) {
            throw new InvalidCategoryException("Leave type " + category.getName() + " is no longer active");
        }
        return category;
    }

    public Optional<LeaveCategory> findByName(String name) {
        if (name == null || name.isBlank()) return Optional.empty();
        return categoryRepository.findByNameIgnoreCase(name);
    }

    /**
     * Renames a category or changes its unit. The unit is fixed once the category is allotted.
     */
    @Transactional
    public LeaveCategory update(String uuid, String name, String description, LeaveUnit unit) {
        LeaveCategory category = categoryRepository.findByIdOptional(uuid)
                .orElseThrow(() -> RecordNotFoundException.of("Leave category", uuid));
        if (name != null && !name.isBlank() && !name.trim().equalsIgnoreCase(category.getName())) {
            if (categoryRepository.findByNameIgnoreCase(name).isPresent()) {
                throw new InvalidCategoryException("Leave category '" + name.trim() + "' already exists");
            }
            category.setName(name.trim());
        }
        if (description != null) category.setDescription(description);
        if (unit != null && unit != category.getUnit()) {
            if (allotmentRepository.existsForCategory(uuid)) {
                throw new InvalidCategoryException("The unit of " + category.getName() + " cannot change while it is allotted");
            }
            category.setUnit(unit);
        }
        return category;
    }

    @Transactional
    public void deactivate(String uuid) {
        LeaveCategory category = categoryRepository.findByIdOptional(uuid)
                .orElseThrow(() -> RecordNotFoundException.of("Leave category", uuid));
        category.setActive(false);
        log.infof("Deactivated leave category %s", category.getName());
    }

    @Transactional
    public void delete(String uuid) {
        LeaveCategory category = categoryRepository.findByIdOptional(uuid)
                .orElseThrow(() -> RecordNotFoundException.of("Leave category", uuid));
        if (allotmentRepository.existsForCategory(uuid)) {
            throw new InvalidCategoryException("Leave category " + category.getName() + " is allotted and cannot be deleted");
        }
        categoryRepository.delete(category);
        log.infof("Deleted leave category %s", category.getName());
    }

    /**
     * The category penalty deductions are charged to: the flagged one, else the one carrying
     * the configured name. Only DAYS categories qualify. With {@code createIfMissing} a DAYS
     * category is created and flagged, named "&lt;name&gt; (days)" when the configured name is
     * already taken by an hour category.
     */
    @Transactional
    public Optional<LeaveCategory> resolvePenaltyCategory(boolean createIfMissing) {
        Optional<LeaveCategory> flagged = categoryRepository.findFlaggedPenaltyCategory();
        Optional<LeaveCategory> category = flagged.filter(LeaveCategoryRegistry::chargedInDays);
        Optional<LeaveCategory> named = Optional.empty();
        if (category.isEmpty()) {
            named = categoryRepository.findByNameIgnoreCase(penaltyCategoryName);
            category = named.filter(LeaveCategoryRegistry::chargedInDays);
        }
        if (category.isPresent() || !createIfMissing) return category;

        flagged.ifPresent(stale -> {
            log.warnf("Penalty category %s is measured in %s, removing the penalty flag", stale.getName(), stale.getUnit());
            stale.setPenaltyCategory(false);
        });
        String name = named.isPresent() ? penaltyCategoryName + " (days)" : penaltyCategoryName;
        LeaveCategory created = LeaveCategory.create(name,
                "Created automatically for attendance penalties", LeaveUnit.DAYS);
        created.setPenaltyCategory(true);
        categoryRepository.persist(created);
        log.warnf("No penalty leave category in days found, created '%s' (%s)", created.getName(), created.getUuid());
        return Optional.of(created);
    }

    private static boolean chargedInDays(LeaveCategory category) {
        return category.getUnit() == LeaveUnit.DAYS;
    }

    /**
     * Makes {@code uuid} the only category penalty deductions are charged to.
     */
    @Transactional
    public LeaveCategory markPenaltyCategory(String uuid) {
        LeaveCategory category = findActive(uuid);
        if (category.getUnit() != LeaveUnit.DAYS) {
            throw new InvalidCategoryException("Penalties are charged in days, " + category.getName() + " is measured in " + category.getUnit());
        }
        categoryRepository.findFlaggedPenaltyCategory()
                .filter(current -> !current.getUuid().equals(uuid))
                .ifPresent(current -> current.setPenaltyCategory(false));
        category.setPenaltyCategory(true);
        log.infof("Penalty deductions are now charged to %s", category.getName());
        return category;
    }

    public List<LeaveCategory> allottedCategories(String employeeUuid) {
        Set<String> categoryUuids = new LinkedHashSet<>();
        for (Allotment allotment : allotmentRepository.findByEmployee(employeeUuid)) {
            categoryUuids.add(allotment.getCategoryUuid());
        }
        return categoryRepository.findByUuids(categoryUuids);
    }
}
