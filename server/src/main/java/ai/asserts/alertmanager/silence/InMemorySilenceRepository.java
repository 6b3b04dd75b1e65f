/*
 *  Copyright © 2023.
 *  Asserts, Inc. - All Rights Reserved
 */
package ai.asserts.alertmanager.silence;

import ai.asserts.alertmanager.error.StorageException;
import com.google.common.collect.ImmutableList;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

@Component
public class InMemorySilenceRepository implements SilenceRepository {
    private final Map<String, Silence> silences = new ConcurrentHashMap<>();

    @Override
    public Optional<Silence> findById(String id) {
        return Optional.ofNullable(silences.get(id));
    }

    @Override
    public Collection<Silence> findAll() {
        return ImmutableList.copyOf(silences.values());
    }

    @Override
    public void insert(Silence silence) {
        if (silences.putIfAbsent(silence.getId(), silence) != null) {
            throw new StorageException("Silence " + silence.getId() + " already stored");
        }
    }

    @Override
    public boolean replace(long expectedVersion, Silence updated) {
        AtomicBoolean replaced = new AtomicBoolean();
        silences.computeIfPresent(updated.getId(), (id, current) -> {
            if (current.getVersion() == expectedVersion) {
                replaced.set(true);
                return updated;
            }
            return current;
        });
        return replaced.get();
    }

    @Override
    public boolean delete(String id) {
        return silences.remove(id) != null;
    }

    @Override
    public int count() {
        return silences.size();
    }
}
