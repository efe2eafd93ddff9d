// file: src/main/java/io/branchtree/storage/DocumentStore.java
package io.branchtree.storage;

import io.branchtree.core.BranchDocument;

/**
 * Minimal synchronous persistence interface used by the service layer.
 * <p>
 * Semantics:
 *  - load() returns a freshly built document the caller owns exclusively.
 *  - save() replaces the whole stored document atomically: readers observe
 *    either the old or the new version, never a partial write.
 *  - No locking or versioning: concurrent writers to the same id are
 *    last-write-wins.
 */
public interface DocumentStore {

    /**
     * @throws io.branchtree.core.BranchException NOT_FOUND when nothing is stored under {@code id},
     *         INVALID_DOCUMENT when the stored bytes are not a usable document
     */
    BranchDocument load(String id);

    /**
     * @throws io.branchtree.core.BranchException WRITE_ERROR when the write fails
     */
    void save(String id, BranchDocument doc);
}
