package com.phillippitts.webpbatch.testutil;

import org.junit.jupiter.api.Tag;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks tests that invoke a real cwebp binary. Excluded from the default Maven build; run with
 * {@code mvn test -DexcludedGroups= -Dgroups=real-binary}.
 */
@Target({ElementType.TYPE, ElementType.METHOD})
@Retention(RetentionPolicy.RUNTIME)
@Tag("real-binary")
public @interface RequiresRealBinary {
}
