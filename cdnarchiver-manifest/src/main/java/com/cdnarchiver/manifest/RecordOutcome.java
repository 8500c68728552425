package com.cdnarchiver.manifest;

/**
 * Result of an insert-if-absent: the stored row and whether this call created it.
 */
public record RecordOutcome(ArchiveRecord record, boolean inserted) {
}
