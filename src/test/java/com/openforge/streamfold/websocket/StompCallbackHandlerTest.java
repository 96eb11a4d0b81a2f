package com.openforge.streamfold.websocket;

import com.openforge.streamfold.message.Message;
import com.openforge.streamfold.model.ChatConfig;
import com.openforge.streamfold.model.GenericFakeChatModel;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.messaging.MessagingException;
import org.springframework.messaging.simp.SimpMessagingTemplate;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class StompCallbackHandlerTest {

    @Mock
    private SimpMessagingTemplate messagingTemplate;

    @Test
    void shouldPublishRunLifecycleToRunTopic() {
        // GIVEN
        StompCallbackHandler handler = new StompCallbackHandler(messagingTemplate);
        GenericFakeChatModel model = GenericFakeChatModel.cycling(Message.ai("hello goodbye"));

        // WHEN
        model.stream("meow", ChatConfig.withCallbacks(handler)).toList();

        // THEN
        ArgumentCaptor<String> destinations = ArgumentCaptor.forClass(String.class);
        ArgumentCaptor<Object> events = ArgumentCaptor.forClass(Object.class);
        verify(messagingTemplate, times(5)).convertAndSend(destinations.capture(), events.capture());

        List<StreamEvent> published = events.getAllValues().stream().map(StreamEvent.class::cast).toList();
        assertThat(published).extracting(StreamEvent::type).containsExactly(
                EventType.START, EventType.TOKEN, EventType.TOKEN, EventType.TOKEN, EventType.END);
        assertThat(published).extracting(StreamEvent::content)
                .containsExactly(null, "hello", " ", "goodbye", null);
        assertThat(destinations.getAllValues()).containsOnly(
                StompCallbackHandler.TOPIC_PREFIX + published.get(0).runId());
    }

    @Test
    void shouldSurviveBrokerFailures() {
        doThrow(new MessagingException("broker down")).when(messagingTemplate).convertAndSend(anyString(), any(Object.class));
        StompCallbackHandler handler = new StompCallbackHandler(messagingTemplate);
        GenericFakeChatModel model = GenericFakeChatModel.cycling(Message.ai("a b"));

        List<String> tokens = model.stream("x", ChatConfig.withCallbacks(handler))
                .map(chunk -> chunk.content())
                .toList();

        assertThat(tokens).containsExactly("a", " ", "b");
    }
}
