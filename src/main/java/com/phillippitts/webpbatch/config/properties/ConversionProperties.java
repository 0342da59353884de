package com.phillippitts.webpbatch.config.properties;

import com.phillippitts.webpbatch.domain.ArchiveFormat;
import com.phillippitts.webpbatch.domain.RunConfiguration;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

/**
 * Typed defaults for conversion runs. Values supplied with a run request override these.
 */
@Validated
@ConfigurationProperties(prefix = "conversion")
public class ConversionProperties {

    public static final String DEFAULT_TEMP_DIR_NAME = ".webp_tmp";

    @Min(RunConfiguration.MIN_QUALITY)
    @Max(RunConfiguration.MAX_QUALITY)
    private final int defaultQuality;

    @NotNull
    private final ArchiveFormat defaultArchiveFormat;

    private final boolean skipExistingWebp;

    /**
     * Name of the per-folder subdirectory the encoder writes into before the output strategy
     * runs. Left-over directories of that name are cleared at the start of every folder.
     */
    @NotBlank
    private final String tempDirName;

    @ConstructorBinding
    public ConversionProperties(Integer defaultQuality, ArchiveFormat defaultArchiveFormat,
                                Boolean skipExistingWebp, String tempDirName) {
        this.defaultQuality = defaultQuality == null ? 75 : defaultQuality;
        this.defaultArchiveFormat = defaultArchiveFormat == null ? ArchiveFormat.ZIP : defaultArchiveFormat;
        this.skipExistingWebp = skipExistingWebp == null || skipExistingWebp;
        this.tempDirName = tempDirName == null ? DEFAULT_TEMP_DIR_NAME : tempDirName;
    }

    /**
     * Defaults for tests and manual wiring.
     */
    public ConversionProperties() {
        this(null, null, null, null);
    }

    public int getDefaultQuality() {
        return defaultQuality;
    }

    public ArchiveFormat getDefaultArchiveFormat() {
        return defaultArchiveFormat;
    }

    public boolean isSkipExistingWebp() {
        return skipExistingWebp;
    }

    public String getTempDirName() {
        return tempDirName;
    }
}
