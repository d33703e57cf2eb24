package com.frontline.repository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.function.UnaryOperator;

/**
 * Identity-keyed store backing the authoritative in-memory world.
 * <p>
 * Entities are copied on the way in and on the way out, so a stored instance is never
 * shared with a caller and readers always see the state of the last write.
 * <p>
 * Existing entities are changed through {@link #update}, which applies the mutation to the
 * latest stored version atomically. Services that touch different fields of the same
 * entity under different locks (the ledger and the membership rules both write a
 * Country) therefore never overwrite each other's changes. Multi-step check-then-act
 * sequences still serialize through {@code EntityLockRegistry}.
 */
public abstract class InMemoryRepository<T> {

    private final ConcurrentHashMap<String, T> store = new ConcurrentHashMap<>();
    private final Function<T, String> idOf;
    private final UnaryOperator<T> copier;

    protected InMemoryRepository(Function<T, String> idOf, UnaryOperator<T> copier) {
        this.idOf = idOf;
        this.copier = copier;
    }

    public Optional<T> findById(String id) {
        if (id == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(store.get(id)).map(copier);
    }

    public boolean existsById(String id) {
        return id != null && store.containsKey(id);
    }

    public T save(T entity) {
        String id = idOf.apply(entity);
        if (id == null) {
            throw new IllegalArgumentException("Entity id must be assigned before save");
        }
        store.put(id, copier.apply(entity));
        return entity;
    }

    /**
     * Apply {@code mutation} to the current stored version and store the result.
     *
     * @return the updated entity, or empty if no entity has this id
     */
    public Optional<T> update(String id, Consumer<T> mutation) {
        if (id == null) {
            return Optional.empty();
        }
        T updated = store.computeIfPresent(id, (key, current) -> {
            T working = copier.apply(current);
            mutation.accept(working);
            return working;
        });
        return Optional.ofNullable(updated).map(copier);
    }

    public List<T> saveAll(Collection<T> entities) {
        entities.forEach(this::save);
        return List.copyOf(entities);
    }

    public List<T> findAll() {
        return store.values().stream().map(copier).toList();
    }

    public long count() {
        return store.size();
    }

    public void deleteAll() {
        store.clear();
    }

    protected List<T> findAllMatching(Predicate<T> predicate) {
        return store.values().stream()
                .filter(predicate)
                .map(copier)
                .toList();
    }

    protected Optional<T> findFirstMatching(Predicate<T> predicate) {
        return store.values().stream()
                .filter(predicate)
                .findFirst()
                .map(copier);
    }
}
