package com.example.fileshelf.config;

import com.example.fileshelf.cache.MetadataCache;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Core beans shared by the entry, session and user services.
 */
@Configuration(proxyBeanMethods = false)
public class FileShelfConfiguration {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public MetadataCache metadataCache(FileShelfProperties properties, Clock clock) {
        return new MetadataCache(
                properties.getCache().getMaxEntries(),
                properties.getCache().getTtl(),
                clock
        );
    }
}
