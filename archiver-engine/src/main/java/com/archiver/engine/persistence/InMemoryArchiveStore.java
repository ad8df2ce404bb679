package com.archiver.engine.persistence;

import com.archiver.core.exception.VersionConflictException;
import com.archiver.core.model.ArchiveListing;
import com.archiver.core.model.VersionedArchive;
import com.archiver.core.model.WeekArchive;
import com.archiver.core.model.WeekKey;
import com.archiver.core.store.ArchiveStore;
import com.archiver.engine.codec.ArchiveDocumentCodec;

import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory implementation of ArchiveStore.
 * Keeps encoded documents so reads behave like a real store (fresh copies, format checks).
 * Versions are a per-week counter; compare-and-set runs inside ConcurrentHashMap.compute.
 */
public class InMemoryArchiveStore implements ArchiveStore {

    private record StoredDocument(byte[] document, long version, Instant lastModified) {}

    private final Map<WeekKey, StoredDocument> documents = new ConcurrentHashMap<>();
    private final ArchiveDocumentCodec codec;
    private final Clock clock;
    private final String keyPrefix;

    public InMemoryArchiveStore(ArchiveDocumentCodec codec, Clock clock) {
        this(codec, clock, ArchiveKeys.DEFAULT_PREFIX);
    }

    public InMemoryArchiveStore(ArchiveDocumentCodec codec, Clock clock, String keyPrefix) {
        this.codec = codec;
        this.clock = clock;
        this.keyPrefix = keyPrefix;
    }

    @Override
    public Optional<VersionedArchive> get(WeekKey week) {
        StoredDocument stored = documents.get(week);
        if (stored == null) {
            return Optional.empty();
        }
        WeekArchive archive = ArchiveKeys.checkedWeek(codec.decode(stored.document()), week, storageKey(week));
        return Optional.of(new VersionedArchive(archive, String.valueOf(stored.version()), stored.lastModified()));
    }

    @Override
    public void putIfVersion(WeekKey week, WeekArchive archive, String expectedVersion) {
        ArchiveKeys.checkWrite(week, archive);
        byte[] document = codec.encode(archive);

        documents.compute(week, (key, current) -> {
            String actualVersion = current != null ? String.valueOf(current.version()) : null;
            boolean matches = expectedVersion == null
                ? current == null
                : expectedVersion.equals(actualVersion);
            if (!matches) {
                throw new VersionConflictException(storageKey(week), expectedVersion, actualVersion);
            }
            long nextVersion = current != null ? current.version() + 1 : 1L;
            return new StoredDocument(document, nextVersion, clock.instant());
        });
    }

    @Override
    public List<ArchiveListing> list() {
        return documents.entrySet().stream()
            .map(e -> new ArchiveListing(
                e.getKey(),
                storageKey(e.getKey()),
                e.getValue().lastModified(),
                e.getValue().document().length))
            .sorted(Comparator.comparing(ArchiveListing::week))
            .toList();
    }

    @Override
    public String storageKey(WeekKey week) {
        return ArchiveKeys.storageKey(keyPrefix, week);
    }

    /**
     * Raw stored bytes of a week, for byte-level assertions.
     */
    public Optional<byte[]> rawDocument(WeekKey week) {
        return Optional.ofNullable(documents.get(week)).map(d -> d.document().clone());
    }

    /**
     * Replace the stored bytes of a week, bumping its version. Used to simulate foreign or corrupt writes.
     */
    public void overwriteRaw(WeekKey week, byte[] document) {
        documents.merge(week, new StoredDocument(document.clone(), 1L, clock.instant()),
            (current, fresh) -> new StoredDocument(fresh.document(), current.version() + 1, fresh.lastModified()));
    }
}
