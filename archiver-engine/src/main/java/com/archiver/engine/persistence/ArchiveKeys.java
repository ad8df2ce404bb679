package com.archiver.engine.persistence;

import com.archiver.core.exception.ArchiveFormatException;
import com.archiver.core.model.WeekArchive;
import com.archiver.core.model.WeekKey;

import java.util.Optional;

/**
 * Storage key layout shared by all stores: {@code <prefix><year>-W<ww>.json}.
 */
public final class ArchiveKeys {

    public static final String DEFAULT_PREFIX = "weekly-logs/";
    public static final String SUFFIX = ".json";

    private ArchiveKeys() {
    }

    public static String storageKey(String prefix, WeekKey week) {
        return prefix + week + SUFFIX;
    }

    /**
     * Week addressed by a storage key, or empty if the key is not an archive of this layout.
     */
    public static Optional<WeekKey> weekOf(String prefix, String storageKey) {
        if (storageKey == null || !storageKey.startsWith(prefix) || !storageKey.endsWith(SUFFIX)) {
            return Optional.empty();
        }
        String name = storageKey.substring(prefix.length(), storageKey.length() - SUFFIX.length());
        try {
            return Optional.of(WeekKey.parse(name));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }

    /**
     * Reject a decoded document that is stored under another week's key.
     */
    public static WeekArchive checkedWeek(WeekArchive archive, WeekKey expected, String storageKey) {
        if (!archive.week().equals(expected)) {
            throw new ArchiveFormatException(String.format(
                "%s holds week %s, expected %s", storageKey, archive.week(), expected));
        }
        return archive;
    }

    public static void checkWrite(WeekKey week, WeekArchive archive) {
        if (!week.equals(archive.week())) {
            throw new IllegalArgumentException("Archive of " + archive.week() + " cannot be stored as " + week);
        }
    }
}
