// file: src/main/java/io/branchtree/storage/FileDocumentStore.java
package io.branchtree.storage;

import io.branchtree.core.BranchDocument;
import io.branchtree.core.BranchException;
import io.branchtree.core.ErrorKind;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.logging.Logger;

/**
 * {@link DocumentStore} backed by one JSON file per document.
 * <p>
 * Ids are relative paths under a single root directory, e.g.
 * "my-chat/conversation.json". Saves go through {@link AtomicFiles}, so a
 * crash mid-save leaves the previous file intact.
 */
public final class FileDocumentStore implements DocumentStore {
    private static final Logger log = Logger.getLogger(FileDocumentStore.class.getName());

    private final StoreRoot root;
    private final DocumentCodec codec;

    public FileDocumentStore(Path root, DocumentCodec codec) {
        this.root = new StoreRoot(root);
        this.codec = codec;
    }

    public Path root() { return root.path(); }

    @Override
    public BranchDocument load(String id) {
        Path file = root.resolve(id);
        byte[] bytes;
        try {
            bytes = Files.readAllBytes(file);
        } catch (NoSuchFileException e) {
            throw BranchException.notFound("File not found: " + id);
        } catch (IOException e) {
            throw new UncheckedIOException("failed to read " + file, e);
        }
        return codec.decode(bytes);
    }

    @Override
    public void save(String id, BranchDocument doc) {
        Path file = root.resolve(id);
        byte[] bytes = codec.toBytes(codec.encode(doc));
        try {
            AtomicFiles.write(file, bytes);
        } catch (IOException e) {
            throw new BranchException(ErrorKind.WRITE_ERROR, "failed to write " + id, e);
        }
        log.fine(() -> "saved " + file + " (" + bytes.length + " bytes, " + doc.size() + " nodes)");
    }
}
