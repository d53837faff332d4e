package com.phillippitts.livetranslate;

import com.phillippitts.livetranslate.config.properties.AudioDecoderProperties;
import com.phillippitts.livetranslate.config.properties.StreamingProperties;
import com.phillippitts.livetranslate.config.properties.TranslationProperties;
import com.phillippitts.livetranslate.config.stt.SttConcurrencyProperties;
import com.phillippitts.livetranslate.config.stt.WhisperConfig;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties({
        WhisperConfig.class,
        SttConcurrencyProperties.class,
        StreamingProperties.class,
        TranslationProperties.class,
        AudioDecoderProperties.class
})
public class LiveTranslateApplication {

    public static void main(String[] args) {
        SpringApplication.run(LiveTranslateApplication.class, args);
    }

}
