package com.frontline.repository;

import com.frontline.model.BorderPush;
import com.frontline.model.PushStatus;
import org.springframework.stereotype.Repository;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Repository for BorderPush entities.
 */
@Repository
public class BorderPushRepository extends InMemoryRepository<BorderPush> {

    public BorderPushRepository() {
        super(BorderPush::getId, BorderPush::copy);
    }

    public List<BorderPush> findByStatus(PushStatus status) {
        return findAllMatching(p -> p.getStatus() == status);
    }

    public List<BorderPush> findByWarId(String warId) {
        return findAllMatching(p -> warId.equals(p.getWarId())).stream()
                .sorted(Comparator.comparing(BorderPush::getStartedAt).reversed())
                .toList();
    }

    public List<BorderPush> findByWarIdAndStatus(String warId, PushStatus status) {
        return findAllMatching(p -> warId.equals(p.getWarId()) && p.getStatus() == status);
    }

    public Optional<BorderPush> findActiveByPlayerId(String playerId) {
        return findFirstMatching(p -> p.isActive() && playerId.equals(p.getPlayerId()));
    }
}
