package com.mimecast.mailfetch.imap;

import com.mimecast.mailfetch.mime.PartDescriptor;
import jakarta.mail.MessagingException;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * In memory MailStore for tests.
 */
public class MailStoreMock implements MailStore {

    private final Map<Long, PartDescriptor> structures = new HashMap<>();
    private final Map<Long, String> headers = new HashMap<>();
    private final Map<String, byte[]> bodies = new HashMap<>();
    private final List<String> fetches = new ArrayList<>();
    private final List<Boolean> peeks = new ArrayList<>();

    public MailStoreMock addMessage(long id, String header, PartDescriptor structure) {
        headers.put(id, header);
        structures.put(id, structure);
        return this;
    }

    public MailStoreMock addBody(long id, String section, String body) {
        return addBody(id, section, body.getBytes(StandardCharsets.ISO_8859_1));
    }

    public MailStoreMock addBody(long id, String section, byte[] body) {
        bodies.put(id + ":" + section, body);
        return this;
    }

    /**
     * Gets fetched sections in call order.
     *
     * @return List of "id:section".
     */
    public List<String> getFetches() {
        return fetches;
    }

    public List<Boolean> getPeeks() {
        return peeks;
    }

    @Override
    public PartDescriptor fetchStructure(long messageId) throws MessagingException {
        PartDescriptor structure = structures.get(messageId);
        if (structure == null) {
            throw new MessagingException("Message " + messageId + " not found");
        }
        return structure;
    }

    @Override
    public byte[] fetchPartBody(long messageId, String section, boolean peek) throws MessagingException {
        fetches.add(messageId + ":" + section);
        peeks.add(peek);
        byte[] body = bodies.get(messageId + ":" + section);
        if (body == null) {
            throw new MessagingException("Section " + section + " of message " + messageId + " not found");
        }
        return body;
    }

    @Override
    public String fetchHeader(long messageId) throws MessagingException {
        String header = headers.get(messageId);
        if (header == null) {
            throw new MessagingException("Message " + messageId + " not found");
        }
        return header;
    }
}
