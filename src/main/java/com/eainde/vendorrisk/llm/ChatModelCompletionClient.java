package com.eainde.vendorrisk.llm;

import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.response.ChatResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Adapts a langchain4j {@link ChatModel} to {@link CompletionClient}.
 */
@Slf4j
@RequiredArgsConstructor
public class ChatModelCompletionClient implements CompletionClient {

    private final ChatModel chatModel;

    @Override
    public String complete(String systemPrompt, String userPrompt) {
        ChatRequest request = ChatRequest.builder()
                .messages(SystemMessage.from(systemPrompt), UserMessage.from(userPrompt))
                .build();
        long start = System.currentTimeMillis();
        try {
            ChatResponse response = chatModel.chat(request);
            String text = response.aiMessage() != null ? response.aiMessage().text() : null;
            log.debug("Completion returned {} chars in {}ms",
                    text == null ? 0 : text.length(), System.currentTimeMillis() - start);
            return text == null ? "" : text;
        } catch (RuntimeException e) {
            throw new CompletionException("Completion failed: " + e.getMessage(), e);
        }
    }
}
