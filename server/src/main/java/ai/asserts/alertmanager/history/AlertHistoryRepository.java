/*
 *  Copyright © 2023.
 *  Asserts, Inc. - All Rights Reserved
 */
package ai.asserts.alertmanager.history;

import java.util.List;

public interface AlertHistoryRepository {
    /**
     * @throws ai.asserts.alertmanager.error.StorageException if the record could not be written
     */
    void save(AlertRecord record);

    /**
     * @return records of one fingerprint, newest first
     */
    List<AlertRecord> findByFingerprint(String fingerprint, int limit);

    long count();
}
