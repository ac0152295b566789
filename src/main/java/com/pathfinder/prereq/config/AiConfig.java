package com.pathfinder.prereq.config;

import com.pathfinder.prereq.structuring.ChatClientCompletionGateway;
import com.pathfinder.prereq.structuring.CompletionGateway;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Text-generation service wiring. The chat model itself comes from the Spring AI OpenAI starter
 * ({@code spring.ai.openai.*}).
 */
@Configuration
public class AiConfig {

    @Bean
    public ChatClient structuringChatClient(ChatClient.Builder builder) {
        return builder.build();
    }

    /** Daemon threads for model requests, so an abandoned request never blocks shutdown. */
    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService structuringExecutor() {
        return Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "structuring-request");
            t.setDaemon(true);
            return t;
        });
    }

    @Bean
    public CompletionGateway completionGateway(ChatClient structuringChatClient,
                                               ExecutorService structuringExecutor,
                                               PrereqProperties properties) {
        return new ChatClientCompletionGateway(structuringChatClient, structuringExecutor, properties.structuring().timeout());
    }
}
