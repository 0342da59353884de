package com.phillippitts.webpbatch.config.properties;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration of the run history store.
 *
 * @param enabled    record finished runs
 * @param file       JSON file holding the history; application.properties points it at the user home
 * @param maxEntries number of newest entries kept
 */
@Validated
@ConfigurationProperties(prefix = "history")
public record HistoryProperties(
        @DefaultValue("true")
        boolean enabled,

        @NotBlank
        @DefaultValue(".webp-batch/history.json")
        String file,

        @Positive
        @DefaultValue("20")
        int maxEntries
) {}
