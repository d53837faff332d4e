package com.phillippitts.livetranslate.service.translation;

import com.phillippitts.livetranslate.config.properties.TranslationProperties;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

/**
 * HTTP client for the translation service, with connect and read timeouts from
 * {@code translation.timeout-ms}.
 */
@Configuration
class TranslationClientConfig {

    private static final Logger LOG = LogManager.getLogger(TranslationClientConfig.class);

    @Bean("translationRestClient")
    RestClient translationRestClient(RestClient.Builder builder, TranslationProperties props) {
        SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
        factory.setConnectTimeout(props.getTimeoutMs());
        factory.setReadTimeout(props.getTimeoutMs());
        LOG.info("Configuring translation client baseUrl={} timeoutMs={} languages={}",
                props.getBaseUrl(), props.getTimeoutMs(), props.getSupportedLanguages());
        return builder
                .baseUrl(props.getBaseUrl())
                .requestFactory(factory)
                .build();
    }
}
