package com.example.fileshelf.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Service settings bound from {@code fileshelf.*}.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "fileshelf")
public class FileShelfProperties {

    @Valid
    private Cache cache = new Cache();

    @Valid
    private Session session = new Session();

    @Data
    public static class Cache {

        /**
         * Lifetime of a cached read. Bounds how long a reader racing a commit can see stale data.
         */
        @NotNull
        private Duration ttl = Duration.ofSeconds(60);

        @Min(1)
        private int maxEntries = 10_000;
    }

    @Data
    public static class Session {

        /**
         * Longest lifetime a login may request.
         */
        @NotNull
        private Duration maxTtl = Duration.ofDays(30);

        @NotNull
        private Duration defaultTtl = Duration.ofDays(7);
    }
}
