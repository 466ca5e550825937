package com.sage.llm;

import com.sage.model.ChatMessage;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.function.BooleanSupplier;
import java.util.function.Consumer;

/** Scripted client: each call pops the next outcome (a reply or a RuntimeException); records model names called. */
final class FakeChatClient implements ChatModelClient {

    private final Deque<Object> script = new ArrayDeque<>();
    private final String fallbackReply;
    final List<String> calls = new ArrayList<>();
    volatile boolean available = true;

    FakeChatClient(String fallbackReply) {
        this.fallbackReply = fallbackReply;
    }

    FakeChatClient thenReply(String text) {
        script.add(text);
        return this;
    }

    FakeChatClient thenFail(RuntimeException e) {
        script.add(e);
        return this;
    }

    @Override
    public synchronized String complete(String model, List<ChatMessage> messages) {
        calls.add(model);
        Object next = script.isEmpty() ? fallbackReply : script.poll();
        if (next instanceof RuntimeException) throw (RuntimeException) next;
        return (String) next;
    }

    @Override
    public void stream(String model, List<ChatMessage> messages, Consumer<String> onToken, BooleanSupplier cancelled) {
        String text = complete(model, messages);
        for (String word : text.split(" ")) {
            if (cancelled.getAsBoolean()) return;
            onToken.accept(word + " ");
        }
    }

    @Override
    public boolean isAvailable(String model) {
        return available;
    }
}
