package com.mimecast.mailfetch.config;

import com.mimecast.mailfetch.exceptions.InvalidParameterException;
import com.mimecast.mailfetch.mime.AssemblyOptions;
import com.mimecast.mailfetch.storage.LocalAttachmentStorage;

import java.io.File;
import java.io.IOException;
import java.nio.charset.Charset;
import java.util.Locale;
import java.util.Map;

/**
 * Mailbox connection and message assembly configuration.
 *
 * <p>Example:
 * <pre>
 * {
 *   host: "imap.example.com",
 *   port: 993,
 *   username: "tony@example.com",
 *   password: "giveHerTheRing",
 *   folder: "INBOX",
 *   serverEncoding: "UTF-8",
 *   attachmentsDir: "/tmp/attachments",
 *   attachmentsIgnore: false,
 *   searchOption: "uid",
 *   expungeOnDisconnect: true,
 *   timeouts: { connect: 10000, read: 20000, write: 20000 },
 *   debug: false
 * }
 * </pre>
 */
public class MailboxConfig extends ConfigFoundation {

    /**
     * Message addressing by UID.
     */
    public static final String SEARCH_UID = "uid";

    /**
     * Message addressing by sequence number.
     */
    public static final String SEARCH_SEQUENCE = "sequence";

    /**
     * Constructs a new MailboxConfig instance.
     */
    public MailboxConfig() {
        super();
    }

    /**
     * Constructs a new MailboxConfig instance with given map.
     *
     * @param map Configuration map.
     */
    public MailboxConfig(Map<String, Object> map) {
        super(map);
    }

    /**
     * Constructs a new MailboxConfig instance with configuration path.
     *
     * @param path Path to configuration file.
     * @throws IOException Unable to read file.
     */
    public MailboxConfig(String path) throws IOException {
        super(path);
    }

    public String getHost() {
        return getStringProperty("host", "localhost");
    }

    public int getPort() {
        return Math.toIntExact(getLongProperty("port", 993L));
    }

    public String getUsername() {
        return getStringProperty("username", "");
    }

    public String getPassword() {
        return getStringProperty("password", "");
    }

    public String getFolder() {
        return getStringProperty("folder", "INBOX");
    }

    /**
     * Gets the encoding decoded text is converted to.
     *
     * @return Upper cased charset name, UTF-8 by default.
     */
    public String getServerEncoding() {
        return getStringProperty("serverEncoding", "UTF-8").trim().toUpperCase(Locale.ROOT);
    }

    /**
     * Sets server encoding.
     *
     * @param encoding Charset name.
     * @return Self.
     */
    public MailboxConfig setServerEncoding(String encoding) {
        map.put("serverEncoding", encoding);
        return this;
    }

    /**
     * Gets attachments directory.
     *
     * @return Directory path or null when attachments are kept in memory only.
     */
    public String getAttachmentsDir() {
        String dir = getStringProperty("attachmentsDir", "").trim();
        return dir.isEmpty() ? null : dir;
    }

    /**
     * Sets attachments directory.
     *
     * @param dir Directory path.
     * @return Self.
     */
    public MailboxConfig setAttachmentsDir(String dir) {
        map.put("attachmentsDir", dir);
        return this;
    }

    public boolean isAttachmentsIgnore() {
        return getBooleanProperty("attachmentsIgnore", false);
    }

    /**
     * Sets attachments ignore mode.
     *
     * @param ignore Boolean.
     * @return Self.
     */
    public MailboxConfig setAttachmentsIgnore(boolean ignore) {
        map.put("attachmentsIgnore", ignore);
        return this;
    }

    /**
     * Gets message addressing option.
     *
     * @return "uid" or "sequence".
     */
    public String getSearchOption() {
        return getStringProperty("searchOption", SEARCH_UID).trim().toLowerCase(Locale.ROOT);
    }

    /**
     * Checks if messages are addressed by UID.
     *
     * @return Boolean.
     */
    public boolean isUid() {
        return SEARCH_UID.equals(getSearchOption());
    }

    public boolean isExpungeOnDisconnect() {
        return getBooleanProperty("expungeOnDisconnect", true);
    }

    public long getConnectTimeout() {
        return getLongProperty("timeouts.connect", 10000L);
    }

    public long getReadTimeout() {
        return getLongProperty("timeouts.read", 20000L);
    }

    public long getWriteTimeout() {
        return getLongProperty("timeouts.write", 20000L);
    }

    public boolean isDebug() {
        return getBooleanProperty("debug", false);
    }

    /**
     * Validates configuration.
     *
     * @return Self.
     * @throws InvalidParameterException Invalid configuration.
     */
    public MailboxConfig validate() {
        String encoding = getServerEncoding();
        if (encoding.isEmpty() || !Charset.isSupported(encoding)) {
            throw new InvalidParameterException("\"" + encoding + "\" is not supported as server encoding");
        }

        String dir = getAttachmentsDir();
        if (dir != null && !new File(dir).isDirectory()) {
            throw new InvalidParameterException("Directory \"" + dir + "\" not found");
        }

        String option = getSearchOption();
        if (!SEARCH_UID.equals(option) && !SEARCH_SEQUENCE.equals(option)) {
            throw new InvalidParameterException("Search option must be \"uid\" or \"sequence\", got \"" + option + "\"");
        }

        if (getPort() < 1 || getPort() > 65535) {
            throw new InvalidParameterException("Port out of range: " + getPort());
        }

        return this;
    }

    /**
     * Builds assembly options from this configuration.
     *
     * @return AssemblyOptions instance.
     */
    public AssemblyOptions toAssemblyOptions() {
        validate();
        String dir = getAttachmentsDir();
        return new AssemblyOptions(
                getServerEncoding(),
                isAttachmentsIgnore(),
                dir != null ? new LocalAttachmentStorage(dir) : null
        );
    }
}
