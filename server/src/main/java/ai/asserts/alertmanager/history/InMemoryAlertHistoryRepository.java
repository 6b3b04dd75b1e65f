/*
 *  Copyright © 2023.
 *  Asserts, Inc. - All Rights Reserved
 */
package ai.asserts.alertmanager.history;

import ai.asserts.alertmanager.error.StorageException;
import com.google.common.collect.EvictingQueue;
import com.google.common.collect.Lists;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Bounded history kept in memory. The oldest records are evicted once capacity is reached.
 */
@Slf4j
@Component
public class InMemoryAlertHistoryRepository implements AlertHistoryRepository {
    private final EvictingQueue<AlertRecord> records;

    public InMemoryAlertHistoryRepository(@Value("${alertmanager.history.capacity:10000}") int capacity) {
        records = EvictingQueue.create(capacity);
        log.info("Alert history capacity {}", capacity);
    }

    @Override
    public void save(AlertRecord record) {
        if (record.getAlert() == null || record.getAlert().getFingerprint() == null) {
            throw new StorageException("Cannot store alert record without fingerprint");
        }
        synchronized (records) {
            records.add(record);
        }
    }

    @Override
    public List<AlertRecord> findByFingerprint(String fingerprint, int limit) {
        List<AlertRecord> copy;
        synchronized (records) {
            copy = Lists.newArrayList(records);
        }
        return Lists.reverse(copy).stream()
                .filter(record -> fingerprint.equals(record.getAlert().getFingerprint()))
                .limit(limit)
                .collect(Collectors.toList());
    }

    @Override
    public long count() {
        synchronized (records) {
            return records.size();
        }
    }
}
