package com.frontline.repository;

import com.frontline.model.War;
import com.frontline.model.WarStatus;
import org.springframework.stereotype.Repository;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Repository for War entities.
 */
@Repository
public class WarRepository extends InMemoryRepository<War> {

    public WarRepository() {
        super(War::getId, War::copy);
    }

    public List<War> findByStatus(WarStatus status) {
        return findAllMatching(w -> w.getStatus() == status).stream()
                .sorted(Comparator.comparing(War::getDeclaredAt).reversed())
                .toList();
    }

    /**
     * Active war between two countries in either direction.
     */
    public Optional<War> findActiveBetween(String countryA, String countryB) {
        String key = War.pairKey(countryA, countryB);
        return findFirstMatching(w -> w.isActive() && w.pairKey().equals(key));
    }

    public Optional<War> findLatestDeclaredBy(String playerId) {
        return findAllMatching(w -> playerId.equals(w.getDeclaredBy())).stream()
                .max(Comparator.comparing(War::getDeclaredAt));
    }
}
