package com.mimecast.mailfetch.mail;

import com.mimecast.mailfetch.mime.PartType;
import com.mimecast.mailfetch.mime.TransferEncoding;
import com.mimecast.mailfetch.storage.AttachmentStorage;
import jakarta.mail.MessagingException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Optional;

/**
 * Message attachment.
 *
 * <p>Backed by exactly one {@link DataPart}; content is fetched on demand, never ahead of time.
 * <p>The storage path is either unset or assigned once.
 */
public class Attachment {
    private static final Logger log = LogManager.getLogger(Attachment.class);

    private String id;
    private String contentId;
    private String name;
    private String disposition;
    private String charset;
    private boolean emlOrigin;
    private PartType type = PartType.APPLICATION;
    private String subtype = "OCTET-STREAM";
    private TransferEncoding encoding = TransferEncoding.SEVEN_BIT;
    private DataPart dataPart;
    private AttachmentStorage storage;
    private Path filePath;

    public String getId() {
        return id;
    }

    /**
     * Sets id.
     *
     * @param id Attachment id.
     * @return Self.
     */
    public Attachment setId(String id) {
        this.id = id;
        return this;
    }

    public String getContentId() {
        return contentId;
    }

    /**
     * Sets Content-ID without angle brackets.
     *
     * @param contentId Content-ID.
     * @return Self.
     */
    public Attachment setContentId(String contentId) {
        this.contentId = contentId;
        return this;
    }

    public String getName() {
        return name;
    }

    /**
     * Sets display name.
     *
     * @param name Decoded file name.
     * @return Self.
     */
    public Attachment setName(String name) {
        this.name = name;
        return this;
    }

    public String getDisposition() {
        return disposition;
    }

    /**
     * Sets disposition.
     *
     * @param disposition Disposition or null.
     * @return Self.
     */
    public Attachment setDisposition(String disposition) {
        this.disposition = disposition;
        return this;
    }

    public String getCharset() {
        return charset;
    }

    /**
     * Sets charset.
     *
     * @param charset Charset or null.
     * @return Self.
     */
    public Attachment setCharset(String charset) {
        this.charset = charset;
        return this;
    }

    /**
     * Checks if this was extracted from a message/rfc822 attachment.
     *
     * @return Boolean.
     */
    public boolean isEmlOrigin() {
        return emlOrigin;
    }

    /**
     * Sets EML origin.
     *
     * @param emlOrigin Boolean.
     * @return Self.
     */
    public Attachment setEmlOrigin(boolean emlOrigin) {
        this.emlOrigin = emlOrigin;
        return this;
    }

    public PartType getType() {
        return type;
    }

    public String getSubtype() {
        return subtype;
    }

    /**
     * Sets media type.
     *
     * @param type    PartType.
     * @param subtype Subtype.
     * @return Self.
     */
    public Attachment setMediaType(PartType type, String subtype) {
        this.type = type;
        this.subtype = subtype;
        return this;
    }

    /**
     * Gets MIME type.
     *
     * @return For example "image/png".
     */
    public String getMimeType() {
        return type.name().toLowerCase(Locale.ROOT) + "/" + subtype.toLowerCase(Locale.ROOT);
    }

    public TransferEncoding getEncoding() {
        return encoding;
    }

    /**
     * Sets transfer encoding.
     *
     * @param encoding TransferEncoding.
     * @return Self.
     */
    public Attachment setEncoding(TransferEncoding encoding) {
        this.encoding = encoding;
        return this;
    }

    public DataPart getDataPart() {
        return dataPart;
    }

    /**
     * Sets backing data part.
     *
     * @param dataPart DataPart.
     * @return Self.
     */
    public Attachment setDataPart(DataPart dataPart) {
        this.dataPart = dataPart;
        return this;
    }

    /**
     * Sets storage used by {@link #saveToDisk()}.
     *
     * @param storage AttachmentStorage.
     * @return Self.
     */
    public Attachment setStorage(AttachmentStorage storage) {
        this.storage = storage;
        return this;
    }

    /**
     * Gets storage path.
     *
     * @return Optional of Path, empty while unset.
     */
    public Optional<Path> getFilePath() {
        return Optional.ofNullable(filePath);
    }

    /**
     * Assigns storage path.
     *
     * @param filePath Path.
     * @return Self.
     * @throws IllegalStateException Path already assigned.
     */
    public Attachment setFilePath(Path filePath) {
        if (this.filePath != null) {
            throw new IllegalStateException("File path already assigned for attachment " + id);
        }
        this.filePath = filePath;
        return this;
    }

    /**
     * Gets decoded contents.
     *
     * @return Bytes.
     * @throws MessagingException    Store error.
     * @throws IllegalStateException No data part set.
     */
    public byte[] getContents() throws MessagingException {
        if (dataPart == null) {
            throw new IllegalStateException("Data part has not been set for attachment " + id);
        }
        return dataPart.fetch();
    }

    /**
     * Saves contents to the assigned path.
     * <p>The path is kept on failure so the save can be retried.
     *
     * @return True if written.
     */
    public boolean saveToDisk() {
        if (dataPart == null || filePath == null || storage == null) {
            return false;
        }

        try {
            storage.save(filePath, getContents());
            return true;
        } catch (IOException | MessagingException e) {
            log.error("Unable to save attachment {} to {}: {}", id, filePath, e.getMessage());
            return false;
        }
    }

    @Override
    public String toString() {
        return "Attachment{id=" + id + ", name=" + name + ", contentId=" + contentId + ", disposition=" + disposition + "}";
    }
}
