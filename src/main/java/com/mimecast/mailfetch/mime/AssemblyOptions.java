package com.mimecast.mailfetch.mime;

import com.mimecast.mailfetch.storage.AttachmentStorage;

import java.util.Optional;

/**
 * Settings applied while assembling a message.
 */
public final class AssemblyOptions {

    private final String serverEncoding;
    private final boolean ignoreAttachments;
    private final AttachmentStorage storage;

    /**
     * Constructs a new AssemblyOptions instance.
     *
     * @param serverEncoding    Encoding decoded text is converted to.
     * @param ignoreAttachments Skip everything that is not a container or a plain/html text part.
     * @param storage           Attachment storage or null to keep attachments in memory only.
     */
    public AssemblyOptions(String serverEncoding, boolean ignoreAttachments, AttachmentStorage storage) {
        this.serverEncoding = serverEncoding;
        this.ignoreAttachments = ignoreAttachments;
        this.storage = storage;
    }

    /**
     * Gets default options: UTF-8, attachments processed, nothing stored.
     *
     * @return AssemblyOptions instance.
     */
    public static AssemblyOptions defaults() {
        return new AssemblyOptions("UTF-8", false, null);
    }

    public String getServerEncoding() {
        return serverEncoding;
    }

    public boolean isIgnoreAttachments() {
        return ignoreAttachments;
    }

    public Optional<AttachmentStorage> getStorage() {
        return Optional.ofNullable(storage);
    }
}
