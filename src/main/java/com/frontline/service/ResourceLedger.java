package com.frontline.service;

import com.frontline.exception.InvariantViolationException;
import com.frontline.model.Country;
import com.frontline.model.Player;
import com.frontline.model.ResourceHolder;
import com.frontline.repository.CountryRepository;
import com.frontline.repository.PlayerRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Resource balances of players and countries.
 * <p>
 * Every balance change runs under the account's own ledger lock, so debits against one
 * account serialize while different accounts proceed in parallel. Callers must not hold
 * any conflict lock (war, push, country) when calling in.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ResourceLedger {

    private final PlayerRepository playerRepository;
    private final CountryRepository countryRepository;
    private final EntityLockRegistry lockRegistry;

    private final Set<String> frozenAccounts = ConcurrentHashMap.newKeySet();

    /**
     * Atomically take {@code amount} from an account if the balance covers it.
     *
     * @return the new balance, or INSUFFICIENT_RESOURCES without any mutation
     */
    public OperationResult<Integer> debit(String entityId, int amount) {
        requireNonNegative(amount);
        return lockRegistry.withLock(EntityLockRegistry.LEDGER + entityId, () -> {
            Optional<ResourceHolder> account = load(entityId);
            if (account.isEmpty()) {
                return OperationResult.failure(ErrorKind.NOT_FOUND, "Account not found: " + entityId);
            }
            int balance = checkedBalance(account.get());
            if (balance < amount) {
                log.debug("Debit of {} refused for {}: balance {}", amount, entityId, balance);
                return OperationResult.insufficient(amount, balance);
            }
            int newBalance = store(entityId, balance - amount);
            log.debug("Debited {} from {}, balance now {}", amount, entityId, newBalance);
            return OperationResult.ok(newBalance);
        });
    }

    /**
     * Add {@code amount} to an account. Saturates at {@link Integer#MAX_VALUE}.
     *
     * @return the new balance
     */
    public OperationResult<Integer> credit(String entityId, int amount) {
        requireNonNegative(amount);
        return lockRegistry.withLock(EntityLockRegistry.LEDGER + entityId, () -> {
            Optional<ResourceHolder> account = load(entityId);
            if (account.isEmpty()) {
                return OperationResult.failure(ErrorKind.NOT_FOUND, "Account not found: " + entityId);
            }
            int balance = checkedBalance(account.get());
            int newBalance = store(entityId, (int) Math.min(Integer.MAX_VALUE, (long) balance + amount));
            log.debug("Credited {} to {}, balance now {}", amount, entityId, newBalance);
            return OperationResult.ok(newBalance);
        });
    }

    /**
     * One generation event: credits {@code floor(rate)}. Cadence is the caller's concern.
     *
     * @return the amount generated
     */
    public OperationResult<Integer> generate(String entityId, double rate) {
        int amount = (int) Math.floor(Math.max(0, rate));
        return credit(entityId, amount).map(balance -> amount);
    }

    /**
     * Current balance as of the last committed change.
     */
    public OperationResult<Integer> balanceOf(String entityId) {
        return load(entityId)
                .map(holder -> OperationResult.ok(holder.getResources()))
                .orElseGet(() -> OperationResult.failure(ErrorKind.NOT_FOUND, "Account not found: " + entityId));
    }

    public boolean isFrozen(String entityId) {
        return frozenAccounts.contains(entityId);
    }

    private int checkedBalance(ResourceHolder holder) {
        if (frozenAccounts.contains(holder.getId())) {
            throw new InvariantViolationException(holder.getId(), "Account is frozen: " + holder.getId());
        }
        int balance = holder.getResources();
        if (balance < 0) {
            frozenAccounts.add(holder.getId());
            log.error("Negative balance {} on account {}; account frozen", balance, holder.getId());
            throw new InvariantViolationException(holder.getId(),
                    "Negative balance " + balance + " on account " + holder.getId());
        }
        return balance;
    }

    private Optional<ResourceHolder> load(String entityId) {
        Optional<ResourceHolder> player = playerRepository.findById(entityId).map(p -> p);
        return player.isPresent() ? player : countryRepository.findById(entityId).map(c -> c);
    }

    private int store(String entityId, int newBalance) {
        Optional<Player> player = playerRepository.update(entityId, p -> p.setResources(newBalance));
        if (player.isPresent()) {
            return player.get().getResources();
        }
        return countryRepository.update(entityId, c -> c.setResources(newBalance))
                .map(Country::getResources)
                .orElseThrow(() -> new IllegalStateException("Account vanished during ledger update: " + entityId));
    }

    private static void requireNonNegative(int amount) {
        if (amount < 0) {
            throw new IllegalArgumentException("Amount must not be negative: " + amount);
        }
    }
}
