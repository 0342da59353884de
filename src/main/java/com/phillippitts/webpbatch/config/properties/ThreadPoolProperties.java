package com.phillippitts.webpbatch.config.properties;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Configuration properties for the conversion executor.
 *
 * <p>The pool always has a single worker. Only naming and the
 * queue bound are tuneable.
 */
@Component
@ConfigurationProperties(prefix = "threadpool")
public class ThreadPoolProperties {

    private ConversionPoolProperties conversion = new ConversionPoolProperties();

    public ConversionPoolProperties getConversion() {
        return conversion;
    }

    public void setConversion(ConversionPoolProperties conversion) {
        this.conversion = conversion;
    }

    /**
     * Conversion executor configuration.
     */
    public static class ConversionPoolProperties {
        private int queueCapacity = 1;
        private String threadNamePrefix = "conversion-";

        public int getQueueCapacity() {
            return queueCapacity;
        }

        public void setQueueCapacity(int queueCapacity) {
            this.queueCapacity = queueCapacity;
        }

        public String getThreadNamePrefix() {
            return threadNamePrefix;
        }

        public void setThreadNamePrefix(String threadNamePrefix) {
            this.threadNamePrefix = threadNamePrefix;
        }
    }
}
