package com.sage.orchestrator;

import com.sage.llm.ChatModelClient;
import com.sage.model.ChatMessage;

import java.util.ArrayList;
import java.util.List;
import java.util.function.BooleanSupplier;
import java.util.function.Consumer;
import java.util.function.Function;

/** Chat client replying through a function of the last message; records the models called. */
public final class ScriptedChatClient implements ChatModelClient {

    private final Function<String, String> replies;
    public final List<String> calls = new ArrayList<>();
    public volatile boolean available = true;

    public ScriptedChatClient(Function<String, String> replies) {
        this.replies = replies;
    }

    @Override
    public synchronized String complete(String model, List<ChatMessage> messages) {
        calls.add(model);
        return replies.apply(messages.get(messages.size() - 1).getContent());
    }

    @Override
    public void stream(String model, List<ChatMessage> messages, Consumer<String> onToken, BooleanSupplier cancelled) {
        onToken.accept(complete(model, messages));
    }

    @Override
    public boolean isAvailable(String model) {
        return available;
    }
}
