package io.newsclusters.digest.api.service;

import io.newsclusters.digest.api.dto.kafka.OutboundMessageEvent;
import io.newsclusters.digest.config.KafkaProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;

import java.util.List;
import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class MessagePublisherServiceTest {

    private static final String TOPIC = "test-outbound-messages";

    @Mock
    private KafkaTemplate<String, Object> kafkaTemplate;

    private MessagePublisherService service;

    @BeforeEach
    void setUp() {
        service = new MessagePublisherService(kafkaTemplate, new KafkaProperties(TOPIC));
    }

    @Test
    @DisplayName("Should publish MarkdownV2 message keyed by chat id")
    void shouldPublishMarkdownMessage() {
        when(kafkaTemplate.send(anyString(), anyString(), any())).thenReturn(new CompletableFuture<SendResult<String, Object>>());

        service.publishMarkdown(7L, "*Heading*");

        ArgumentCaptor<Object> captor = ArgumentCaptor.forClass(Object.class);
        verify(kafkaTemplate).send(eq(TOPIC), eq("7"), captor.capture());

        OutboundMessageEvent event = (OutboundMessageEvent) captor.getValue();
        assertThat(event.chatId()).isEqualTo(7L);
        assertThat(event.text()).isEqualTo("*Heading*");
        assertThat(event.parseMode()).isEqualTo(OutboundMessageEvent.MARKDOWN_V2);
        assertThat(event.disableWebPagePreview()).isTrue();
        assertThat(event.messageId()).startsWith("MSG-");
    }

    @Test
    @DisplayName("Should publish plain text without parse mode")
    void shouldPublishPlainMessage() {
        when(kafkaTemplate.send(anyString(), anyString(), any())).thenReturn(new CompletableFuture<SendResult<String, Object>>());

        service.publishPlain(7L, "Fetched articles. Analyzing...");

        ArgumentCaptor<Object> captor = ArgumentCaptor.forClass(Object.class);
        verify(kafkaTemplate).send(eq(TOPIC), eq("7"), captor.capture());

        OutboundMessageEvent event = (OutboundMessageEvent) captor.getValue();
        assertThat(event.parseMode()).isNull();
        assertThat(event.disableWebPagePreview()).isFalse();
    }

    @Test
    @DisplayName("Should number messages in publish order")
    void shouldNumberMessagesInOrder() {
        when(kafkaTemplate.send(anyString(), anyString(), any())).thenReturn(new CompletableFuture<SendResult<String, Object>>());

        service.publishPlain(1L, "first");
        service.publishPlain(1L, "second");

        ArgumentCaptor<Object> captor = ArgumentCaptor.forClass(Object.class);
        verify(kafkaTemplate, times(2)).send(eq(TOPIC), eq("1"), captor.capture());

        List<Long> sequences = captor.getAllValues().stream()
                .map(value -> ((OutboundMessageEvent) value).sequence())
                .toList();
        assertThat(sequences.get(1)).isGreaterThan(sequences.get(0));
    }

    @Test
    @DisplayName("Should not throw when the producer fails")
    void shouldNotThrowWhenProducerFails() {
        when(kafkaTemplate.send(anyString(), anyString(), any())).thenThrow(new IllegalStateException("producer closed"));

        assertThatCode(() -> service.publishPlain(1L, "text")).doesNotThrowAnyException();
    }

    @Test
    @DisplayName("Should not throw when the send completes exceptionally")
    void shouldNotThrowWhenSendCompletesExceptionally() {
        CompletableFuture<SendResult<String, Object>> failed = new CompletableFuture<>();
        failed.completeExceptionally(new IllegalStateException("broker down"));
        when(kafkaTemplate.send(anyString(), anyString(), any())).thenReturn(failed);

        assertThatCode(() -> service.publishPlain(1L, "text")).doesNotThrowAnyException();
    }
}
