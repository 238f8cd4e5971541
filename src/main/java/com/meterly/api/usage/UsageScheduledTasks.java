package com.meterly.api.usage;

import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Collection of scheduled tasks for {@link UsageService}.
 */
@Component
@Slf4j
class UsageScheduledTasks {

    private final UsageService usageService;

    @Autowired
    UsageScheduledTasks(@NonNull UsageService usageService) {
        this.usageService = usageService;
    }

    @Scheduled(fixedRateString = "${app.usage.garbage-collection-interval-millis}")
    void garbageCollection() {
        log.info("performing garbage collection");
        usageService.performGarbageCollection();
    }
}
