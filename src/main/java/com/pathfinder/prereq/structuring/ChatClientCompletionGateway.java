package com.pathfinder.prereq.structuring;

import com.pathfinder.prereq.structuring.StructuringModels.ChatTurn;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.messages.AssistantMessage;
import org.springframework.ai.chat.messages.Message;
import org.springframework.ai.chat.messages.SystemMessage;
import org.springframework.ai.chat.messages.UserMessage;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.*;

/**
 * Gateway backed by a Spring AI {@link ChatClient}. Each request runs on the supplied executor so that
 * it can be abandoned once {@code timeout} elapses.
 */
public class ChatClientCompletionGateway implements CompletionGateway {
    private final ChatClient chatClient;
    private final ExecutorService executor;
    private final Duration timeout;

    public ChatClientCompletionGateway(ChatClient chatClient, ExecutorService executor, Duration timeout) {
        this.chatClient = chatClient;
        this.executor = executor;
        this.timeout = timeout;
    }

    @Override
    public String complete(List<ChatTurn> conversation) {
        List<Message> messages = conversation.stream().map(ChatClientCompletionGateway::toMessage).toList();
        Future<String> pending = executor.submit(() -> chatClient.prompt().messages(messages).call().content());
        try {
            return pending.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            pending.cancel(true);
            throw new CompletionUnavailableException("No response within " + timeout.toSeconds() + "s", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            throw new CompletionUnavailableException(String.valueOf(cause.getMessage()), cause);
        } catch (InterruptedException e) {
            pending.cancel(true);
            Thread.currentThread().interrupt();
            throw new CompletionUnavailableException("Interrupted while waiting for completion", e);
        }
    }

    private static Message toMessage(ChatTurn turn) {
        return switch (turn.role()) {
            case SYSTEM -> new SystemMessage(turn.content());
            case USER -> new UserMessage(turn.content());
            case ASSISTANT -> new AssistantMessage(turn.content());
        };
    }
}
