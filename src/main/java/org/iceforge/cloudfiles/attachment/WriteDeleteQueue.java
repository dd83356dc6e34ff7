package org.iceforge.cloudfiles.attachment;

import org.iceforge.cloudfiles.store.RemoteObjectNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Uploads and deletions of one attachment, held locally until the host flushes them.
 *
 * <p>At most one pending write per style; a later write replaces the earlier one. Pending
 * deletes keep insertion order and may repeat a path.
 *
 * <p>Flushes are fail-fast. Entries go out in insertion order and each one is dropped from the
 * queue as soon as it succeeds. The first failure stops the flush and propagates; the failed
 * entry and everything after it stay queued for the next flush. A delete of a missing object
 * counts as success.
 *
 * <p>Not thread-safe; owned by a single attachment instance.
 */
public class WriteDeleteQueue {
    private static final Logger log = LoggerFactory.getLogger(WriteDeleteQueue.class);

    @FunctionalInterface
    public interface Uploader {
        void upload(String style, Path localFile);
    }

    @FunctionalInterface
    public interface Deleter {
        void delete(String objectPath);
    }

    private final Map<String, Path> pendingWrites = new LinkedHashMap<>();
    private final List<String> pendingDeletes = new ArrayList<>();

    public void queueWrite(String style, Path localFile) {
        Objects.requireNonNull(style, "style");
        Objects.requireNonNull(localFile, "localFile");
        Path previous = pendingWrites.put(style, localFile);
        if (previous != null) {
            log.debug("Pending write for style {} replaced: {} -> {}", style, previous, localFile);
        }
    }

    public void queueDelete(String objectPath) {
        Objects.requireNonNull(objectPath, "objectPath");
        pendingDeletes.add(objectPath);
    }

    public Optional<Path> pendingWrite(String style) {
        return Optional.ofNullable(pendingWrites.get(style));
    }

    public Map<String, Path> pendingWrites() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(pendingWrites));
    }

    public List<String> pendingDeletes() {
        return List.copyOf(pendingDeletes);
    }

    public boolean isClean() {
        return pendingWrites.isEmpty() && pendingDeletes.isEmpty();
    }

    /** @return number of writes uploaded */
    public int flushWrites(Uploader uploader) {
        int done = 0;
        Iterator<Map.Entry<String, Path>> it = pendingWrites.entrySet().iterator();
        while (it.hasNext()) {
            Map.Entry<String, Path> e = it.next();
            uploader.upload(e.getKey(), e.getValue());
            it.remove();
            done++;
        }
        log.debug("Flushed {} writes", done);
        return done;
    }

    /** @return number of deletes applied, including deletes of objects that were already gone */
    public int flushDeletes(Deleter deleter) {
        int done = 0;
        Iterator<String> it = pendingDeletes.iterator();
        while (it.hasNext()) {
            String path = it.next();
            try {
                deleter.delete(path);
            } catch (RemoteObjectNotFoundException e) {
                log.debug("Object {} already absent, nothing to delete", path);
            }
            it.remove();
            done++;
        }
        log.debug("Flushed {} deletes", done);
        return done;
    }
}
