package com.phillippitts.webpbatch.util;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class LogSanitizerTest {

    @Test
    void shouldReturnEmptyStringForNull() {
        assertThat(LogSanitizer.truncate(null, 10)).isEmpty();
        assertThat(LogSanitizer.singleLine(null)).isEmpty();
    }

    @Test
    void shouldReturnEmptyStringForNonPositiveMax() {
        assertThat(LogSanitizer.truncate("hello world", 0)).isEmpty();
        assertThat(LogSanitizer.truncate("hello world", -1)).isEmpty();
    }

    @Test
    void shouldReturnFullStringWhenNotLongerThanMax() {
        assertThat(LogSanitizer.truncate("hello", 10)).isEqualTo("hello");
        assertThat(LogSanitizer.truncate("12345", 5)).isEqualTo("12345");
    }

    @Test
    void shouldTruncateWhenLongerThanMax() {
        assertThat(LogSanitizer.truncate("hello world", 5)).isEqualTo("hello");
        assertThat(LogSanitizer.truncate("a".repeat(10000), 100)).hasSize(100);
    }

    @Test
    void shouldJoinEncoderStderrLines() {
        String stderr = "Error! Could not process file in.png\n"
                + "Error! Cannot read input picture file 'in.png'\r\n"
                + "   \n";

        assertThat(LogSanitizer.singleLine(stderr))
                .isEqualTo("Error! Could not process file in.png | Error! Cannot read input picture file 'in.png' |");
    }

    @Test
    void shouldLeaveSingleLineUntouched() {
        assertThat(LogSanitizer.singleLine("Saving file 'out.webp'")).isEqualTo("Saving file 'out.webp'");
    }
}
