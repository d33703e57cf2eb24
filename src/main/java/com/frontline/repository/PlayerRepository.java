package com.frontline.repository;

import com.frontline.model.Player;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

/**
 * Repository for Player entities.
 */
@Repository
public class PlayerRepository extends InMemoryRepository<Player> {

    public PlayerRepository() {
        super(Player::getId, Player::copy);
    }

    public List<Player> findByCountryId(String countryId) {
        return findAllMatching(p -> p.belongsTo(countryId));
    }

    public Optional<Player> findByUsername(String username) {
        return findFirstMatching(p -> p.getUsername() != null && p.getUsername().equalsIgnoreCase(username));
    }
}
