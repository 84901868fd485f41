package net.convertcompress.config;

import net.convertcompress.codec.ImageCodec;
import net.convertcompress.codec.ImageIoCodec;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Registers the ImageIO codec unless the application provides its own {@link ImageCodec}.
 */
@Configuration
public class CodecConfig {

    @Bean
    @ConditionalOnMissingBean(ImageCodec.class)
    public ImageCodec imageCodec(ProcessingProperties properties) {
        return new ImageIoCodec(properties.getEncoding().getDefaultLossyQuality());
    }
}
