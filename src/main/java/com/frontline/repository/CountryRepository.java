package com.frontline.repository;

import com.frontline.model.Country;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * Repository for Country entities.
 */
@Repository
public class CountryRepository extends InMemoryRepository<Country> {

    public CountryRepository() {
        super(Country::getId, Country::copy);
    }

    public List<Country> findByClaimed(boolean claimed) {
        return findAllMatching(c -> c.isClaimed() == claimed);
    }
}
