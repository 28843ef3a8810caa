package dev.pekelund.reconcile.processor.local;

import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.chat.prompt.ChatOptions;
import org.springframework.ai.chat.prompt.DefaultChatOptions;
import org.springframework.ai.chat.prompt.Prompt;
import reactor.core.publisher.Flux;

/**
 * {@link ChatModel} for the {@code local} profile. Extraction is unavailable; invoices are ingested
 * from candidate lines posted directly.
 */
class NoopChatModel implements ChatModel {

    private static final String DISABLED_MESSAGE = "Invoice extraction is disabled for the local profile";

    @Override
    public ChatResponse call(Prompt prompt) {
        throw new UnsupportedOperationException(DISABLED_MESSAGE);
    }

    @Override
    public ChatOptions getDefaultOptions() {
        DefaultChatOptions options = new DefaultChatOptions();
        options.setModel("local-noop");
        return options;
    }

    @Override
    public Flux<ChatResponse> stream(Prompt prompt) {
        return Flux.error(new UnsupportedOperationException(DISABLED_MESSAGE));
    }
}
