package com.meterly.api.subscription;

import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Collection of scheduled tasks for {@link WebhookEventProcessor}.
 */
@Component
@Slf4j
class SubscriptionScheduledTasks {

    private final WebhookEventProcessor webhookEventProcessor;

    @Autowired
    SubscriptionScheduledTasks(@NonNull WebhookEventProcessor webhookEventProcessor) {
        this.webhookEventProcessor = webhookEventProcessor;
    }

    @Scheduled(cron = "${app.webhooks.garbage-collection-schedule}")
    void garbageCollection() {
        log.info("performing garbage collection");
        webhookEventProcessor.performGarbageCollection();
    }
}
