package com.phillippitts.webpbatch.presentation.controller;

import com.phillippitts.webpbatch.domain.ArchiveFormat;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;

import java.util.List;

/**
 * Body of {@code POST /api/runs}. Null optional fields fall back to the {@code conversion.*}
 * defaults.
 *
 * @param folders          folder paths to convert, in order
 * @param quality          encoder quality, 10 to 100
 * @param archiveFormat    ZIP or CBZ
 * @param replaceOriginals replace originals in place instead of archiving
 * @param skipExistingWebp leave existing WebP files untouched
 */
record RunRequest(
        @NotEmpty List<@NotBlank String> folders,
        @Min(10) @Max(100) Integer quality,
        ArchiveFormat archiveFormat,
        Boolean replaceOriginals,
        Boolean skipExistingWebp
) {}
