package com.mimecast.mailfetch.mail;

import com.mimecast.mailfetch.imap.MailStore;
import com.mimecast.mailfetch.mime.DataPartDecoder;
import com.mimecast.mailfetch.mime.TransferEncoding;
import com.mimecast.mailfetch.util.StringEncoding;
import jakarta.mail.MessagingException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;

/**
 * Lazy content handle for one part.
 *
 * <p>Content is fetched and decoded on first access and kept for later calls.
 */
public class DataPart {
    private static final Logger log = LogManager.getLogger(DataPart.class);

    private final MailStore store;
    private final long messageId;
    private final String section;
    private final TransferEncoding encoding;
    private final boolean peek;
    private final String targetEncoding;
    private String charset;
    private byte[] data;

    /**
     * Constructs a new DataPart instance.
     *
     * @param store          MailStore.
     * @param messageId      Message id.
     * @param section        Positional key, "0" for the whole body.
     * @param encoding       Transfer encoding.
     * @param peek           Avoid setting the seen flag.
     * @param targetEncoding Encoding text is converted to.
     */
    public DataPart(MailStore store, long messageId, String section, TransferEncoding encoding, boolean peek, String targetEncoding) {
        this.store = store;
        this.messageId = messageId;
        this.section = section;
        this.encoding = encoding;
        this.peek = peek;
        this.targetEncoding = targetEncoding;
    }

    public long getMessageId() {
        return messageId;
    }

    public String getSection() {
        return section;
    }

    public TransferEncoding getEncoding() {
        return encoding;
    }

    public boolean isPeek() {
        return peek;
    }

    public String getTargetEncoding() {
        return targetEncoding;
    }

    public String getCharset() {
        return charset;
    }

    /**
     * Sets source charset.
     *
     * @param charset Charset name.
     * @return Self.
     */
    public DataPart setCharset(String charset) {
        this.charset = charset;
        return this;
    }

    /**
     * Checks if content was already fetched.
     *
     * @return Boolean.
     */
    public boolean isFetched() {
        return data != null;
    }

    /**
     * Sets decoded content directly, bypassing the store.
     *
     * @param data Bytes.
     * @return Self.
     */
    public DataPart setData(byte[] data) {
        this.data = data;
        return this;
    }

    /**
     * Fetches and decodes content.
     *
     * @return Decoded bytes in the target encoding, empty when there is no content.
     * @throws MessagingException Store error.
     */
    public byte[] fetch() throws MessagingException {
        if (data == null) {
            log.debug("Fetching message {} section {} peek={}", messageId, section, peek);
            byte[] raw = store.fetchPartBody(messageId, section, peek);
            byte[] decoded = DataPartDecoder.decode(raw, encoding, charset, targetEncoding);
            data = decoded != null ? decoded : new byte[0];
        }
        return data;
    }

    /**
     * Fetches content as text.
     *
     * @return String decoded with the target encoding.
     * @throws MessagingException Store error.
     */
    public String fetchString() throws MessagingException {
        Charset target = StringEncoding.charsetOrNull(targetEncoding);
        return new String(fetch(), target != null ? target : StandardCharsets.UTF_8);
    }
}
