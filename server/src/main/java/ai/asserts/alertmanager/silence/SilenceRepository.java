/*
 *  Copyright © 2023.
 *  Asserts, Inc. - All Rights Reserved
 */
package ai.asserts.alertmanager.silence;

import java.util.Collection;
import java.util.Optional;

public interface SilenceRepository {
    Optional<Silence> findById(String id);

    Collection<Silence> findAll();

    void insert(Silence silence);

    /**
     * Compare-and-set on the version.
     *
     * @return <code>false</code> when the stored silence is gone or no longer at <code>expectedVersion</code>
     */
    boolean replace(long expectedVersion, Silence updated);

    boolean delete(String id);

    int count();
}
