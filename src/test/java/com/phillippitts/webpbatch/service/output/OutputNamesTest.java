package com.phillippitts.webpbatch.service.output;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class OutputNamesTest {

    @Test
    void replacesExtensionWithWebp() {
        Map<Path, String> names = OutputNames.assign(List.of(Path.of("dir/a.png"), Path.of("dir/b.jpeg")));

        assertThat(names.values()).containsExactly("a.webp", "b.webp");
    }

    @Test
    void disambiguatesSharedStems() {
        Path png = Path.of("dir/photo.png");
        Path jpg = Path.of("dir/photo.jpg");
        Path bmp = Path.of("dir/Photo.bmp");

        Map<Path, String> names = OutputNames.assign(List.of(jpg, png, bmp));

        assertThat(names).containsEntry(jpg, "photo.webp")
                .containsEntry(png, "photo_png.webp")
                .containsEntry(bmp, "Photo_bmp.webp");
        assertThat(names.values()).doesNotHaveDuplicates();
    }

    @Test
    void addsCounterWhenExtensionVariantIsTaken() {
        Path a = Path.of("dir/x.png");
        Path b = Path.of("dir/x_png.tif");
        Path c = Path.of("dir/x.PNG");

        Map<Path, String> names = OutputNames.assign(List.of(a, b, c));

        assertThat(names).containsEntry(a, "x.webp")
                .containsEntry(b, "x_png.webp")
                .containsEntry(c, "x_PNG_2.webp");
    }

    @Test
    void reservedNamesAreNeverAssigned() {
        Path png = Path.of("dir/x.png");
        Path jpg = Path.of("dir/y.jpg");

        Map<Path, String> names = OutputNames.assign(List.of(png, jpg), List.of(Path.of("dir/X.WEBP")));

        assertThat(names).containsEntry(png, "x_png.webp")
                .containsEntry(jpg, "y.webp");
    }
}
