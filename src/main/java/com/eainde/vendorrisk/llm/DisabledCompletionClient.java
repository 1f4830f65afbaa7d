package com.eainde.vendorrisk.llm;

/**
 * Installed when no model is configured. Every call fails, so LLM-assisted passes produce nothing.
 */
public class DisabledCompletionClient implements CompletionClient {

    @Override
    public String complete(String systemPrompt, String userPrompt) {
        throw new CompletionException("No language model configured");
    }
}
