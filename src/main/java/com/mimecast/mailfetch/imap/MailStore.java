package com.mimecast.mailfetch.imap;

import com.mimecast.mailfetch.mime.PartDescriptor;
import jakarta.mail.MessagingException;

/**
 * Message access contract the assembler consumes.
 *
 * <p>Messages are addressed by the id the store was configured for, UID or sequence number.
 * <br>Calls are blocking and must not be made concurrently against one store.
 */
public interface MailStore {

    /**
     * Fetches the body structure of a message.
     *
     * @param messageId Message id.
     * @return Root PartDescriptor, a leaf for single part messages.
     * @throws MessagingException Store error.
     */
    PartDescriptor fetchStructure(long messageId) throws MessagingException;

    /**
     * Fetches raw, still transfer encoded, content of a part.
     *
     * @param messageId Message id.
     * @param section   Positional key, "0" for the whole body text.
     * @param peek      Avoid setting the seen flag.
     * @return Bytes, never null.
     * @throws MessagingException Store error.
     */
    byte[] fetchPartBody(long messageId, String section, boolean peek) throws MessagingException;

    /**
     * Fetches the raw header block of a message.
     *
     * @param messageId Message id.
     * @return Header block.
     * @throws MessagingException Store error.
     */
    String fetchHeader(long messageId) throws MessagingException;
}
