package com.jz.chatflow.testutil;

import com.jz.chatflow.client.Transcript;
import com.jz.chatflow.client.TranscriptionClient;

import java.util.Optional;

public class FakeTranscriptionClient implements TranscriptionClient {

    private volatile Transcript next;
    private volatile RuntimeException failure;
    public volatile int calls;

    public void returns(String text, String language) {
        this.next = new Transcript(text, language);
        this.failure = null;
    }

    public void returnsNothing() {
        this.next = null;
        this.failure = null;
    }

    public void failsWith(RuntimeException e) {
        this.failure = e;
    }

    @Override
    public Optional<Transcript> transcribe(String mediaUrl) {
        calls++;
        if (failure != null) throw failure;
        return Optional.ofNullable(next);
    }
}
