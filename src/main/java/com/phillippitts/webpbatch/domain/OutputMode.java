package com.phillippitts.webpbatch.domain;

/**
 * The output strategy applied to every folder of a run. Exactly one is active per run.
 */
public enum OutputMode {
    /** Delete converted originals and move the WebP files into the source folder. */
    REPLACE_IN_PLACE,
    /** Pack the WebP files into one archive next to the source folder. */
    ARCHIVE
}
