package com.example.fileshelf.storage;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Makes sure the bucket exists before the first upload URL is handed out. The call goes
 * through the storage bean's proxy, so a flaky connection at startup is retried.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class BucketInitializer {

    private final ObjectStorage objectStorage;

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        objectStorage.ensureBucketExists();
        log.info("Object storage bucket is ready");
    }
}
