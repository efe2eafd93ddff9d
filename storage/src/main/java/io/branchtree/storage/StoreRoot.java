// file: src/main/java/io/branchtree/storage/StoreRoot.java
package io.branchtree.storage;

import io.branchtree.core.BranchException;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.util.logging.Logger;

/**
 * The allow-listed directory a store may touch.
 * <p>
 * Every caller-supplied id is resolved here, before any I/O. An id that is
 * blank, absolute, or normalizes to a path outside the root is rejected with
 * INVALID_OPERATION. The nearest existing ancestor of the target (the
 * target itself when it exists) is also checked after symlink resolution,
 * so a link inside the root cannot point the store elsewhere, even for
 * files and directories that are about to be created.
 */
final class StoreRoot {
    private static final Logger log = Logger.getLogger(StoreRoot.class.getName());

    private final Path root;

    StoreRoot(Path root) {
        this.root = root.toAbsolutePath().normalize();
    }

    Path path() { return root; }

    Path resolve(String id) {
        if (id == null || id.isBlank()) {
            throw BranchException.invalidOperation("path must not be empty");
        }
        Path rel;
        try {
            rel = Path.of(id);
        } catch (InvalidPathException e) {
            throw reject(id);
        }
        if (rel.isAbsolute()) throw reject(id);

        Path resolved = root.resolve(rel).normalize();
        if (resolved.equals(root) || !resolved.startsWith(root)) throw reject(id);

        if (Files.exists(root)) {
            Path existing = resolved;
            while (existing != null && !Files.exists(existing, LinkOption.NOFOLLOW_LINKS)) {
                existing = existing.getParent();
            }
            try {
                if (existing == null || !existing.toRealPath().startsWith(root.toRealPath())) throw reject(id);
            } catch (IOException e) {
                throw reject(id);
            }
        }
        return resolved;
    }

    private BranchException reject(String id) {
        log.warning(() -> "rejected path outside store root " + root + ": " + id);
        return BranchException.invalidOperation("path escapes the allowed directory: " + id);
    }
}
