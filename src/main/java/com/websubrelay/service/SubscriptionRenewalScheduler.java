package com.websubrelay.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(prefix = "app.subscription", name = "renewal-enabled", havingValue = "true", matchIfMissing = true)
public class SubscriptionRenewalScheduler {

    private static final Logger logger = LoggerFactory.getLogger(SubscriptionRenewalScheduler.class);

    private final SubscriptionManager subscriptionManager;

    public SubscriptionRenewalScheduler(SubscriptionManager subscriptionManager) {
        this.subscriptionManager = subscriptionManager;
    }

    @Scheduled(initialDelayString = "${app.subscription.initial-delay:PT30S}",
            fixedDelayString = "${app.subscription.renewal-interval:PT6H}")
    public void renewSubscriptions() {
        try {
            subscriptionManager.renewDueSubscriptions();
        } catch (Exception e) {
            logger.error("Subscription renewal sweep failed", e);
        }
    }
}
