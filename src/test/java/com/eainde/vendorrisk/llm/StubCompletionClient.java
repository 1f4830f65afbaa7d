package com.eainde.vendorrisk.llm;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Returns a fixed reply, or fails every call, and records the user prompts it was given.
 */
public class StubCompletionClient implements CompletionClient {

    private final String reply;
    private final boolean fail;
    private final List<String> prompts = new CopyOnWriteArrayList<>();
    private final AtomicInteger calls = new AtomicInteger();

    private StubCompletionClient(String reply, boolean fail) {
        this.reply = reply;
        this.fail = fail;
    }

    public static StubCompletionClient replying(String reply) {
        return new StubCompletionClient(reply, false);
    }

    public static StubCompletionClient failing() {
        return new StubCompletionClient(null, true);
    }

    @Override
    public String complete(String systemPrompt, String userPrompt) {
        calls.incrementAndGet();
        prompts.add(userPrompt);
        if (fail) {
            throw new CompletionException("model unavailable");
        }
        return reply;
    }

    public int calls() {
        return calls.get();
    }

    public List<String> prompts() {
        return List.copyOf(prompts);
    }
}
