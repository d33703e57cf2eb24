package com.frontline.repository;

import com.frontline.model.CountryHistoryEntry;
import org.springframework.stereotype.Repository;

import java.util.Comparator;
import java.util.List;

/**
 * Repository for country timeline entries.
 */
@Repository
public class CountryHistoryRepository extends InMemoryRepository<CountryHistoryEntry> {

    private static final Comparator<CountryHistoryEntry> NEWEST_FIRST =
            Comparator.comparing(CountryHistoryEntry::getTimestamp)
                    .thenComparingLong(CountryHistoryEntry::getSequence)
                    .reversed();

    public CountryHistoryRepository() {
        super(CountryHistoryEntry::getId, CountryHistoryEntry::copy);
    }

    public List<CountryHistoryEntry> findByCountryId(String countryId, int limit) {
        return findAllMatching(e -> countryId.equals(e.getCountryId())).stream()
                .sorted(NEWEST_FIRST)
                .limit(limit)
                .toList();
    }
}
