package io.newsclusters.digest.api.service;

import io.newsclusters.digest.api.dto.kafka.OutboundMessageEvent;
import io.newsclusters.digest.config.KafkaProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.stereotype.Service;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Hands outbound chat messages to the delivery gateway over Kafka.
 * Records are keyed by chat id so messages for one chat stay in order.
 */
@Service
public class MessagePublisherService {

    private static final Logger logger = LoggerFactory.getLogger(MessagePublisherService.class);

    private final KafkaTemplate<String, Object> kafkaTemplate;
    private final KafkaProperties kafkaProperties;
    private final AtomicLong sequence = new AtomicLong();

    public MessagePublisherService(KafkaTemplate<String, Object> kafkaTemplate, KafkaProperties kafkaProperties) {
        this.kafkaTemplate = kafkaTemplate;
        this.kafkaProperties = kafkaProperties;
    }

    /**
     * Publishes MarkdownV2 text with link previews disabled.
     */
    public void publishMarkdown(long chatId, String text) {
        publish(chatId, text, OutboundMessageEvent.MARKDOWN_V2, true);
    }

    public void publishPlain(long chatId, String text) {
        publish(chatId, text, null, false);
    }

    public void publish(long chatId, String text, String parseMode, boolean disableWebPagePreview) {
        try {
            OutboundMessageEvent event = OutboundMessageEvent.create(
                    chatId,
                    sequence.incrementAndGet(),
                    text,
                    parseMode,
                    disableWebPagePreview
            );

            CompletableFuture<SendResult<String, Object>> future =
                    kafkaTemplate.send(kafkaProperties.outboundMessages(), String.valueOf(chatId), event);

            future.whenComplete((result, ex) -> {
                if (ex == null) {
                    logger.debug("Sent message {} for chat {} to partition: {}",
                            event.messageId(), chatId, result.getRecordMetadata().partition());
                } else {
                    logger.error("Failed to send message {} for chat {}", event.messageId(), chatId, ex);
                }
            });

        } catch (Exception e) {
            logger.error("Error publishing message for chat: {}", chatId, e);
        }
    }
}
