package io.newsclusters.digest.api.service;

import io.newsclusters.digest.api.dto.UserSubscription;
import io.newsclusters.digest.api.dto.kafka.OutboundMessageEvent;
import io.newsclusters.digest.api.util.MarkdownV2;
import io.newsclusters.digest.config.DigestConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.util.List;

@Service
public class ScheduledDigestService {
    private static final Logger logger = LoggerFactory.getLogger(ScheduledDigestService.class);

    private final UserPreferenceService preferenceService;
    private final DigestService digestService;
    private final MessagePublisherService messagePublisher;
    private final DigestConfig digestConfig;

    public ScheduledDigestService(UserPreferenceService preferenceService,
                                  DigestService digestService,
                                  MessagePublisherService messagePublisher,
                                  DigestConfig digestConfig) {
        this.preferenceService = preferenceService;
        this.digestService = digestService;
        this.messagePublisher = messagePublisher;
        this.digestConfig = digestConfig;
    }

    @Scheduled(
            cron = "#{@digestProps.dailyCron}",
            zone = "#{@digestProps.zone}"
    )
    public void sendDailyDigests() {
        if (!digestConfig.schedule().enabled()) {
            logger.debug("Daily digests disabled, skipping run");
            return;
        }

        List<UserSubscription> subscriptions = preferenceService.findAutomaticSubscriptions();

        logger.info("Starting daily digests for {} users", subscriptions.size());
        long startTime = System.currentTimeMillis();

        int delivered = 0;
        for (UserSubscription subscription : subscriptions) {
            try {
                messagePublisher.publish(
                        subscription.chatId(),
                        greeting(subscription.topic()),
                        OutboundMessageEvent.MARKDOWN_V2,
                        false
                );

                digestService.sendDigest(
                        subscription.chatId(),
                        subscription.topic(),
                        subscription.location(),
                        subscription.language()
                );
                delivered++;

            } catch (Exception e) {
                logger.error("Failed to send daily digest to user {}: {}", subscription.chatId(), e.getMessage());
            }
        }

        logger.info("Daily digests completed: {} of {} users in {}ms",
                delivered, subscriptions.size(), System.currentTimeMillis() - startTime);
    }

    static String greeting(String topic) {
        return "🌅 Good morning\\! Here's your daily news about *" + MarkdownV2.escape(topic) + "*";
    }
}
