package kestrel.persistence.rdb;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Outcome of a key scan: the live records read, and whether the scan stopped at a record
 * type it cannot decode. Everything after such a record is unreadable, so the record list
 * is a prefix of the file's keys in that case.
 */
public final class ScanResult {
    public static final int NONE = -1;

    private final List<SnapshotRecord> records;
    private final int unsupportedType;

    public ScanResult(List<SnapshotRecord> records, int unsupportedType) {
        this.records = Collections.unmodifiableList(new ArrayList<>(records));
        this.unsupportedType = unsupportedType;
    }

    public List<SnapshotRecord> getRecords() {
        return records;
    }

    public List<String> keys() {
        List<String> keys = new ArrayList<>(records.size());
        for (SnapshotRecord record : records) {
            keys.add(record.getKey());
        }
        return keys;
    }

    public boolean stoppedAtUnsupportedType() {
        return unsupportedType != NONE;
    }

    /** The type tag that ended the scan, or {@link #NONE}. */
    public int getUnsupportedType() {
        return unsupportedType;
    }
}
