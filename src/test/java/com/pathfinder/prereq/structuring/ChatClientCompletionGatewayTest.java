package com.pathfinder.prereq.structuring;

import com.pathfinder.prereq.structuring.StructuringModels.ChatTurn;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.messages.Message;
import org.springframework.ai.chat.messages.MessageType;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.*;

class ChatClientCompletionGatewayTest {
    private final ExecutorService executor = Executors.newCachedThreadPool();
    private final ChatClient chatClient = mock(ChatClient.class, RETURNS_DEEP_STUBS);
    private final List<ChatTurn> conversation = List.of(ChatTurn.system("Return JSON only."), ChatTurn.user("CS 136"));

    @AfterEach
    void shutdown() {
        executor.shutdownNow();
    }

    @Test
    void slowResponseIsAbandonedAfterTimeout() throws InterruptedException {
        CountDownLatch interrupted = new CountDownLatch(1);
        when(chatClient.prompt().messages(anyList()).call().content()).thenAnswer(invocation -> {
            try {
                Thread.sleep(10_000);
            } catch (InterruptedException e) {
                interrupted.countDown();
            }
            return "{}";
        });
        var gateway = new ChatClientCompletionGateway(chatClient, executor, Duration.ofMillis(50));

        CompletionUnavailableException error = assertTimeoutPreemptively(Duration.ofSeconds(2),
                () -> assertThrows(CompletionUnavailableException.class, () -> gateway.complete(conversation)));

        assertTrue(error.getMessage().startsWith("No response within"));
        assertTrue(interrupted.await(2, TimeUnit.SECONDS));
    }

    @Test
    void failedRequestBecomesUnavailable() {
        when(chatClient.prompt().messages(anyList()).call().content()).thenThrow(new IllegalStateException("401 Unauthorized"));
        var gateway = new ChatClientCompletionGateway(chatClient, executor, Duration.ofSeconds(1));

        CompletionUnavailableException error = assertThrows(CompletionUnavailableException.class, () -> gateway.complete(conversation));

        assertEquals("401 Unauthorized", error.getMessage());
    }

    @Test
    void turnsAreSentAsTypedMessages() {
        when(chatClient.prompt().messages(anyList()).call().content()).thenReturn("{\"groups\":[]}");
        var gateway = new ChatClientCompletionGateway(chatClient, executor, Duration.ofSeconds(1));

        assertEquals("{\"groups\":[]}", gateway.complete(conversation));

        @SuppressWarnings("unchecked")
        ArgumentCaptor<List<Message>> captor = ArgumentCaptor.forClass((Class<List<Message>>) (Class<?>) List.class);
        verify(chatClient.prompt(), atLeastOnce()).messages(captor.capture());
        List<Message> sent = captor.getValue();
        assertEquals(List.of(MessageType.SYSTEM, MessageType.USER), sent.stream().map(Message::getMessageType).toList());
    }
}
