package com.opsos.itemresolution.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class ResolutionConfig {

    @Bean
    public ResolutionSettings resolutionSettings(
            @Value("${resolution.matching.likely-threshold:0.5}") double likelyThreshold,
            @Value("${resolution.matching.maybe-threshold:0.3}") double maybeThreshold,
            @Value("${resolution.matching.min-token-length:4}") int minTokenLength,
            @Value("${resolution.matching.top-k:3}") int topK,
            @Value("${resolution.bulk-map.batch-size:50}") int batchSize,
            @Value("${resolution.page-size:500}") int pageSize) {
        return new ResolutionSettings(likelyThreshold, maybeThreshold, minTokenLength, topK, batchSize, pageSize);
    }
}
