package waypoint.core.model.cache;

import java.time.Instant;

/**
 * Bookkeeping attached to every cache entry.
 *
 * @param createdAt when the entry was created
 * @param lastAccessedAt when the entry was last read
 * @param accessCount number of reads, including the initial write
 * @param source where the data was last obtained from
 * @param pageKind page classification, null for unclassified entries
 * @param contentKind content classification, null for unclassified entries
 * @param hasUnsavedChanges true if the page holds user input not yet saved; such entries are never evicted
 */
public record EntryMetadata(
        Instant createdAt,
        Instant lastAccessedAt,
        long accessCount,
        EntrySource source,
        PageKind pageKind,
        ContentKind contentKind,
        boolean hasUnsavedChanges) {

    public EntryMetadata {
        if (createdAt == null) {
            createdAt = Instant.EPOCH;
        }
        if (lastAccessedAt == null) {
            lastAccessedAt = createdAt;
        }
        if (accessCount < 0) {
            accessCount = 0;
        }
        if (source == null) {
            source = EntrySource.NETWORK;
        }
    }

    /**
     * Metadata for an entry that has just been fetched from the network.
     */
    public static EntryMetadata fresh(Instant now, PageKind pageKind, ContentKind contentKind) {
        return new EntryMetadata(now, now, 1, EntrySource.NETWORK, pageKind, contentKind, false);
    }

    /**
     * Records one read at the given instant.
     */
    public EntryMetadata withAccess(Instant accessedAt) {
        return new EntryMetadata(
                createdAt, accessedAt, accessCount + 1, source, pageKind, contentKind, hasUnsavedChanges);
    }

    public EntryMetadata withSource(EntrySource source) {
        return new EntryMetadata(
                createdAt, lastAccessedAt, accessCount, source, pageKind, contentKind, hasUnsavedChanges);
    }

    public EntryMetadata withLastAccessedAt(Instant lastAccessedAt) {
        return new EntryMetadata(
                createdAt, lastAccessedAt, accessCount, source, pageKind, contentKind, hasUnsavedChanges);
    }

    public EntryMetadata withUnsavedChanges(boolean hasUnsavedChanges) {
        return new EntryMetadata(
                createdAt, lastAccessedAt, accessCount, source, pageKind, contentKind, hasUnsavedChanges);
    }

    /**
     * True when both page and content classification are known.
     */
    public boolean hasClassification() {
        return pageKind != null && contentKind != null;
    }
}
