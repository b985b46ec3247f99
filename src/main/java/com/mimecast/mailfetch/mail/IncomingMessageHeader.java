package com.mimecast.mailfetch.mail;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Parsed message header.
 *
 * <p>Recipient maps are keyed by lower cased address and hold the decoded display name or null.
 */
public class IncomingMessageHeader {

    private long id;
    private boolean draft;
    private String date;
    private String headersRaw = "";
    private String subject;
    private String messageId;
    private String priority = "";
    private String importance = "";
    private String sensitivity = "";
    private String autoSubmitted = "";
    private String precedence = "";
    private String failedRecipients = "";
    private String fromHost;
    private String fromName;
    private String fromAddress;
    private String senderHost;
    private String senderName;
    private String senderAddress;
    private String toString = "";
    private final Map<String, String> to = new LinkedHashMap<>();
    private final Map<String, String> cc = new LinkedHashMap<>();
    private final Map<String, String> bcc = new LinkedHashMap<>();
    private final Map<String, String> replyTo = new LinkedHashMap<>();

    public long getId() {
        return id;
    }

    /**
     * Sets message id.
     *
     * @param id Message id.
     * @return Self.
     */
    public IncomingMessageHeader setId(long id) {
        this.id = id;
        return this;
    }

    /**
     * Checks if the message has no Date header.
     *
     * @return Boolean.
     */
    public boolean isDraft() {
        return draft;
    }

    /**
     * Sets draft flag.
     *
     * @param draft Boolean.
     * @return Self.
     */
    public IncomingMessageHeader setDraft(boolean draft) {
        this.draft = draft;
        return this;
    }

    /**
     * Gets date.
     *
     * @return RFC 3339 date or the unparseable original.
     */
    public String getDate() {
        return date;
    }

    /**
     * Sets date.
     *
     * @param date Date string.
     * @return Self.
     */
    public IncomingMessageHeader setDate(String date) {
        this.date = date;
        return this;
    }

    public String getHeadersRaw() {
        return headersRaw;
    }

    /**
     * Sets raw header block.
     *
     * @param headersRaw Header block.
     * @return Self.
     */
    public IncomingMessageHeader setHeadersRaw(String headersRaw) {
        this.headersRaw = headersRaw;
        return this;
    }

    public String getSubject() {
        return subject;
    }

    /**
     * Sets subject.
     *
     * @param subject Decoded subject.
     * @return Self.
     */
    public IncomingMessageHeader setSubject(String subject) {
        this.subject = subject;
        return this;
    }

    public String getMessageId() {
        return messageId;
    }

    /**
     * Sets Message-ID.
     *
     * @param messageId Message-ID.
     * @return Self.
     */
    public IncomingMessageHeader setMessageId(String messageId) {
        this.messageId = messageId;
        return this;
    }

    public String getPriority() {
        return priority;
    }

    public IncomingMessageHeader setPriority(String priority) {
        this.priority = priority;
        return this;
    }

    public String getImportance() {
        return importance;
    }

    public IncomingMessageHeader setImportance(String importance) {
        this.importance = importance;
        return this;
    }

    public String getSensitivity() {
        return sensitivity;
    }

    public IncomingMessageHeader setSensitivity(String sensitivity) {
        this.sensitivity = sensitivity;
        return this;
    }

    public String getAutoSubmitted() {
        return autoSubmitted;
    }

    public IncomingMessageHeader setAutoSubmitted(String autoSubmitted) {
        this.autoSubmitted = autoSubmitted;
        return this;
    }

    public String getPrecedence() {
        return precedence;
    }

    public IncomingMessageHeader setPrecedence(String precedence) {
        this.precedence = precedence;
        return this;
    }

    public String getFailedRecipients() {
        return failedRecipients;
    }

    public IncomingMessageHeader setFailedRecipients(String failedRecipients) {
        this.failedRecipients = failedRecipients;
        return this;
    }

    public String getFromHost() {
        return fromHost;
    }

    public String getFromName() {
        return fromName;
    }

    public String getFromAddress() {
        return fromAddress;
    }

    /**
     * Sets sender of the message.
     *
     * @param host    Domain.
     * @param name    Decoded display name or null.
     * @param address Lower cased address.
     * @return Self.
     */
    public IncomingMessageHeader setFrom(String host, String name, String address) {
        this.fromHost = host;
        this.fromName = name;
        this.fromAddress = address;
        return this;
    }

    /**
     * Sets from address only.
     *
     * @param address Address.
     * @return Self.
     */
    public IncomingMessageHeader setFromAddress(String address) {
        this.fromAddress = address;
        return this;
    }

    public String getSenderHost() {
        return senderHost;
    }

    public String getSenderName() {
        return senderName;
    }

    public String getSenderAddress() {
        return senderAddress;
    }

    /**
     * Sets Sender header fields.
     *
     * @param host    Domain.
     * @param name    Decoded display name or null.
     * @param address Lower cased address.
     * @return Self.
     */
    public IncomingMessageHeader setSender(String host, String name, String address) {
        this.senderHost = host;
        this.senderName = name;
        this.senderAddress = address;
        return this;
    }

    /**
     * Gets recipients as a display string.
     *
     * @return For example "Tony Stark &lt;tony@example.com&gt;, pepper@example.com".
     */
    public String getToString() {
        return toString;
    }

    public IncomingMessageHeader setToString(String toString) {
        this.toString = toString;
        return this;
    }

    public Map<String, String> getTo() {
        return Collections.unmodifiableMap(to);
    }

    public Map<String, String> getCc() {
        return Collections.unmodifiableMap(cc);
    }

    public Map<String, String> getBcc() {
        return Collections.unmodifiableMap(bcc);
    }

    public Map<String, String> getReplyTo() {
        return Collections.unmodifiableMap(replyTo);
    }

    /**
     * Adds To recipient.
     *
     * @param address Lower cased address.
     * @param name    Display name or null.
     * @return Self.
     */
    public IncomingMessageHeader addTo(String address, String name) {
        to.put(address, name);
        return this;
    }

    public IncomingMessageHeader addCc(String address, String name) {
        cc.put(address, name);
        return this;
    }

    public IncomingMessageHeader addBcc(String address, String name) {
        bcc.put(address, name);
        return this;
    }

    public IncomingMessageHeader addReplyTo(String address, String name) {
        replyTo.put(address, name);
        return this;
    }
}
