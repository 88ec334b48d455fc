package com.topostat.core.error;

/**
 * Classes of ingestion failure. Each kind has a fixed discard scope:
 * an {@link #AUTH} failure drops the whole envelope, the others drop a single unit.
 */
public enum ErrorKind {
    /** Envelope or record fails schema/type checks. */
    STRUCTURAL,
    /** Envelope digest mismatch. */
    AUTH,
    /** A dimension could not be resolved or created for a record. */
    NORMALIZATION,
    /** The store rejected a unit of work. */
    PERSISTENCE
}
