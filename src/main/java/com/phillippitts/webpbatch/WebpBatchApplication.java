package com.phillippitts.webpbatch;

import com.phillippitts.webpbatch.config.encoder.EncoderConfig;
import com.phillippitts.webpbatch.config.properties.ConversionProperties;
import com.phillippitts.webpbatch.config.properties.HistoryProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties({
        EncoderConfig.class,
        ConversionProperties.class,
        HistoryProperties.class
})
public class WebpBatchApplication {

    public static void main(String[] args) {
        SpringApplication.run(WebpBatchApplication.class, args);
    }

}
