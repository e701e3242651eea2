package com.puzzlehub.completionkafkanotifier.publisher;

import com.alibaba.fastjson2.JSON;
import com.puzzlehub.completionkafkanotifier.event.CompletionRecordEvent;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.test.util.ReflectionTestUtils;

import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class CompletionEventPublisherTest {

    @Test
    @SuppressWarnings("unchecked")
    void sendsJsonKeyedBySession() {
        KafkaTemplate<String, String> template = mock(KafkaTemplate.class);
        when(template.send(anyString(), anyString(), anyString()))
                .thenReturn(new CompletableFuture<SendResult<String, String>>());
        CompletionEventPublisher publisher = new CompletionEventPublisher(template);
        ReflectionTestUtils.setField(publisher, "topic", "puzzle-completed");

        publisher.publish(CompletionRecordEvent.builder().sessionId("s-9").epoch(1L).participantId("bob").points(1_500L).build());

        ArgumentCaptor<String> body = ArgumentCaptor.forClass(String.class);
        verify(template).send(eq("puzzle-completed"), eq("s-9"), body.capture());
        CompletionRecordEvent sent = JSON.parseObject(body.getValue(), CompletionRecordEvent.class);
        assertThat(sent.getParticipantId()).isEqualTo("bob");
        assertThat(sent.getPoints()).isEqualTo(1_500L);
    }
}
