package com.mimecast.mailfetch.mime;

/**
 * Immutable state handed down each step of the part walk.
 *
 * <p>Key "0" addresses the whole message body.
 */
public final class TraversalContext {

    /**
     * Whole message key.
     */
    public static final String ROOT = "0";

    private final long messageId;
    private final String key;
    private final boolean markAsSeen;
    private final boolean emlParse;
    private final AssemblyOptions options;

    /**
     * Constructs a new TraversalContext instance.
     *
     * @param messageId  Message id.
     * @param key        Positional key.
     * @param markAsSeen Whether fetching content may set the seen flag.
     * @param emlParse   Whether the part sits inside a message/rfc822 attachment.
     * @param options    AssemblyOptions.
     */
    public TraversalContext(long messageId, String key, boolean markAsSeen, boolean emlParse, AssemblyOptions options) {
        this.messageId = messageId;
        this.key = key;
        this.markAsSeen = markAsSeen;
        this.emlParse = emlParse;
        this.options = options;
    }

    /**
     * Gets root context.
     *
     * @param messageId  Message id.
     * @param markAsSeen Mark as seen.
     * @param options    AssemblyOptions.
     * @return TraversalContext instance.
     */
    public static TraversalContext root(long messageId, boolean markAsSeen, AssemblyOptions options) {
        return new TraversalContext(messageId, ROOT, markAsSeen, false, options);
    }

    public long getMessageId() {
        return messageId;
    }

    public String getKey() {
        return key;
    }

    public boolean isMarkAsSeen() {
        return markAsSeen;
    }

    public boolean isEmlParse() {
        return emlParse;
    }

    public AssemblyOptions getOptions() {
        return options;
    }

    /**
     * Checks if this addresses the whole message.
     *
     * @return Boolean.
     */
    public boolean isRoot() {
        return ROOT.equals(key);
    }

    /**
     * Gets context for the child at given 1 based index.
     *
     * @param index Child index.
     * @return TraversalContext instance.
     */
    public TraversalContext child(int index) {
        return withKey(isRoot() ? String.valueOf(index) : key + "." + index);
    }

    /**
     * Gets a copy with a different key.
     *
     * @param newKey Positional key.
     * @return TraversalContext instance.
     */
    public TraversalContext withKey(String newKey) {
        return new TraversalContext(messageId, newKey, markAsSeen, emlParse, options);
    }

    /**
     * Gets a copy with a different eml-parse flag.
     *
     * @param newEmlParse Boolean.
     * @return TraversalContext instance.
     */
    public TraversalContext withEmlParse(boolean newEmlParse) {
        return newEmlParse == emlParse ? this : new TraversalContext(messageId, key, markAsSeen, newEmlParse, options);
    }

    @Override
    public String toString() {
        return messageId + ":" + key + (emlParse ? " (eml)" : "");
    }
}
