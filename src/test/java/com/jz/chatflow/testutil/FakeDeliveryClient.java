package com.jz.chatflow.testutil;

import com.jz.chatflow.client.Collaborator;
import com.jz.chatflow.client.DeliveryClient;
import com.jz.chatflow.client.DeliveryCredentials;
import com.jz.chatflow.exception.CollaboratorException;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

public class FakeDeliveryClient implements DeliveryClient {

    public record Sent(String destination, String text, DeliveryCredentials credentials) {}

    public final List<Sent> sent = new CopyOnWriteArrayList<>();
    private volatile boolean failing;

    public void failing(boolean failing) {
        this.failing = failing;
    }

    @Override
    public void send(String destination, String text, DeliveryCredentials credentials) {
        if (failing) {
            throw new CollaboratorException(Collaborator.DELIVERY, "HTTP 502 bad gateway", null);
        }
        sent.add(new Sent(destination, text, credentials));
    }

    public String lastText() {
        return sent.isEmpty() ? null : sent.get(sent.size() - 1).text();
    }
}
