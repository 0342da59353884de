package com.phillippitts.webpbatch.service.health;

import com.phillippitts.webpbatch.config.encoder.EncoderConfig;
import com.phillippitts.webpbatch.service.encoder.EncoderLocator;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.Optional;

/**
 * Health indicator for the external WebP encoder.
 *
 * <p>Reports:
 * <ul>
 *   <li>UP: the configured binary resolves to an executable file</li>
 *   <li>DOWN: the binary cannot be found; every run would end immediately</li>
 * </ul>
 *
 * <p>Exposed via /actuator/health endpoint.
 */
@Component
public class EncoderHealthIndicator implements HealthIndicator {

    private final EncoderLocator locator;
    private final EncoderConfig config;

    public EncoderHealthIndicator(EncoderLocator locator, EncoderConfig config) {
        this.locator = locator;
        this.config = config;
    }

    @Override
    public Health health() {
        Optional<Path> binary = locator.locate();
        if (binary.isPresent()) {
            return Health.up()
                    .withDetail("binary", config.binary())
                    .withDetail("path", binary.get().toString())
                    .build();
        }
        return Health.down()
                .withDetail("binary", config.binary())
                .withDetail("status", "Encoder not found on search path")
                .build();
    }
}
