package com.stockpipe.jp.error;

import java.time.LocalDate;

/**
 * The live selection for {@link #date()} is not durably archived yet, so it must not be overwritten.
 */
public class BackupMissingException extends Exception {
    private final LocalDate date;
    private final boolean snapshotPresent;
    private final boolean archiveRowPresent;

    public BackupMissingException(LocalDate date, boolean snapshotPresent, boolean archiveRowPresent, String message) {
        super(message);
        this.date = date;
        this.snapshotPresent = snapshotPresent;
        this.archiveRowPresent = archiveRowPresent;
    }

    public BackupMissingException(LocalDate date, String message, Throwable cause) {
        super(message, cause);
        this.date = date;
        this.snapshotPresent = false;
        this.archiveRowPresent = false;
    }

    public LocalDate date() {
        return date;
    }

    public boolean snapshotPresent() {
        return snapshotPresent;
    }

    public boolean archiveRowPresent() {
        return archiveRowPresent;
    }
}
