package com.stockpipe.jp.archive;

public record ArchiveWriteResult(int appended, int skipped, boolean snapshotWritten, int attempts) {
    public static ArchiveWriteResult empty() {
        return new ArchiveWriteResult(0, 0, false, 0);
    }

    public ArchiveWriteResult withSnapshotWritten(boolean written) {
        return new ArchiveWriteResult(appended, skipped, written, attempts);
    }
}
