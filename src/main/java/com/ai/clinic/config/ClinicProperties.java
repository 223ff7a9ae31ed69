package com.ai.clinic.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

@ConfigurationProperties(prefix = "clinic")
public record ClinicProperties(
        @DefaultValue("500") int queueCapacity,
        @DefaultValue("1000") long firstTokenId,
        @DefaultValue Seed seed
) {
    public record Seed(
            @DefaultValue("false") boolean enabled
    ) {}
}
