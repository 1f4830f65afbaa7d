package com.eainde.vendorrisk.llm;

/**
 * Language-model completion capability. Treated as replaceable: callers must degrade gracefully
 * when it throws.
 */
@FunctionalInterface
public interface CompletionClient {

    /**
     * @throws CompletionException for any provider, transport or timeout failure
     */
    String complete(String systemPrompt, String userPrompt);
}
