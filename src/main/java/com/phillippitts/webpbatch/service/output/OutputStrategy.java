package com.phillippitts.webpbatch.service.output;

import com.phillippitts.webpbatch.domain.ArchiveFormat;
import com.phillippitts.webpbatch.domain.OutputMode;

/**
 * Decides what happens to the converted files of a folder once its conversion loop is done.
 *
 * <p>Implementations collect failures into the {@link OutputResult} instead of throwing, and
 * always remove the temporary directory before returning.
 */
public interface OutputStrategy {

    /**
     * @return the mode this strategy implements
     */
    OutputMode mode();

    /**
     * Applies the strategy to one folder.
     *
     * @param output        files produced for the folder
     * @param archiveFormat archive container requested by the run (ignored by replace mode)
     * @return errors and archive information
     */
    OutputResult apply(FolderOutput output, ArchiveFormat archiveFormat);
}
