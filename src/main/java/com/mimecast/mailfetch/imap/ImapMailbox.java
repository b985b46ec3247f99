package com.mimecast.mailfetch.imap;

import com.mimecast.mailfetch.config.MailboxConfig;
import com.mimecast.mailfetch.exceptions.ConnectionException;
import com.mimecast.mailfetch.exceptions.InvalidParameterException;
import com.mimecast.mailfetch.mail.IncomingMessage;
import com.mimecast.mailfetch.mail.IncomingMessageHeader;
import com.mimecast.mailfetch.mime.AssemblyOptions;
import com.mimecast.mailfetch.mime.MessageAssembler;
import com.mimecast.mailfetch.mime.PartDescriptor;
import com.mimecast.mailfetch.mime.headers.HeaderParser;
import jakarta.mail.Address;
import jakarta.mail.AuthenticationFailedException;
import jakarta.mail.FetchProfile;
import jakarta.mail.Flags;
import jakarta.mail.Folder;
import jakarta.mail.Message;
import jakarta.mail.MessagingException;
import jakarta.mail.Quota;
import jakarta.mail.Session;
import jakarta.mail.Store;
import jakarta.mail.UIDFolder;
import jakarta.mail.internet.InternetAddress;
import jakarta.mail.search.SearchTerm;
import org.apache.commons.io.FileUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.eclipse.angus.mail.iap.ByteArray;
import org.eclipse.angus.mail.imap.IMAPFolder;
import org.eclipse.angus.mail.imap.IMAPMessage;
import org.eclipse.angus.mail.imap.IMAPStore;
import org.eclipse.angus.mail.imap.SortTerm;
import org.eclipse.angus.mail.imap.protocol.BODY;
import org.eclipse.angus.mail.imap.protocol.BODYSTRUCTURE;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Properties;
import java.util.Set;

/**
 * IMAP mailbox backed by Jakarta Mail and the Angus IMAP provider.
 *
 * <p>Connects lazily on first use and opens the configured folder read-write.
 * <br>Messages are addressed by UID or by sequence number depending on the configured search option.
 * <p>Also serves as the {@link MailStore} the {@link MessageAssembler} reads structures and parts from.
 * <p>
 * Usage example:
 * <pre>
 * try (ImapMailbox mailbox = new ImapMailbox(new MailboxConfig("cfg/mailbox.json5"))) {
 *     for (long id : mailbox.searchMailbox("UNSEEN")) {
 *         IncomingMessage message = mailbox.getMail(id, false);
 *     }
 * }
 * </pre>
 * <p>Instances are not thread safe.
 */
public class ImapMailbox implements MailStore, AutoCloseable {
    private static final Logger log = LogManager.getLogger(ImapMailbox.class);

    private static final String QUOTA_ROOT = "INBOX";
    private static final String QUOTA_STORAGE = "STORAGE";

    private final MailboxConfig config;
    private final AssemblyOptions options;
    private final MessageAssembler assembler;
    private final HeaderParser headerParser = new HeaderParser();
    private final BodyStructureMapper mapper = new BodyStructureMapper();

    private String folderName;
    private Store store;
    private IMAPFolder folder;

    /**
     * Constructs a new ImapMailbox instance.
     *
     * @param config MailboxConfig instance.
     * @throws InvalidParameterException Invalid configuration.
     */
    public ImapMailbox(MailboxConfig config) {
        this.config = config.validate();
        this.options = config.toAssemblyOptions();
        this.assembler = new MessageAssembler(this, options);
        this.folderName = config.getFolder();
    }

    /**
     * Gets assembly options.
     *
     * @return AssemblyOptions instance.
     */
    public AssemblyOptions getOptions() {
        return options;
    }

    /**
     * Gets current folder name.
     *
     * @return Folder name.
     */
    public String getFolderName() {
        return folderName;
    }

    /**
     * Builds Jakarta Mail session properties for IMAP/IMAPS.
     */
    Properties buildProperties() {
        Properties props = new Properties();
        String port = String.valueOf(config.getPort());
        boolean ssl = config.getPort() == 993;

        props.put("mail.store.protocol", ssl ? "imaps" : "imap");
        for (String protocol : ssl ? new String[]{"imap", "imaps"} : new String[]{"imap"}) {
            props.put("mail." + protocol + ".host", config.getHost());
            props.put("mail." + protocol + ".port", port);
            props.put("mail." + protocol + ".ssl.enable", String.valueOf(ssl));
            props.put("mail." + protocol + ".ssl.trust", "*");
            props.put("mail." + protocol + ".connectiontimeout", String.valueOf(config.getConnectTimeout()));
            props.put("mail." + protocol + ".timeout", String.valueOf(config.getReadTimeout()));
            props.put("mail." + protocol + ".writetimeout", String.valueOf(config.getWriteTimeout()));
        }

        props.put("mail.imap.auth.login.disable", "false");
        props.put("mail.imap.auth.plain.disable", "false");

        props.put("mail.debug", String.valueOf(config.isDebug()));

        return props;
    }

    /**
     * Connects if needed and returns the open folder.
     *
     * @return IMAPFolder instance.
     * @throws MessagingException Connection or folder error.
     */
    protected IMAPFolder getFolder() throws MessagingException {
        if (folder != null && folder.isOpen()) {
            return folder;
        }

        Store connected = getStore();
        Folder candidate = connected.getFolder(folderName);
        if (candidate == null || !candidate.exists()) {
            throw new ConnectionException("Folder '" + folderName + "' does not exist on " + config.getHost());
        }

        candidate.open(Folder.READ_WRITE);
        folder = (IMAPFolder) candidate;
        log.debug("Opened folder '{}' with {} messages", folderName, folder.getMessageCount());

        return folder;
    }

    /**
     * Connects if needed and returns the store.
     *
     * @return Store instance.
     * @throws ConnectionException Connection error.
     */
    protected Store getStore() throws ConnectionException {
        if (store != null && store.isConnected()) {
            return store;
        }

        Properties props = buildProperties();
        Session session = Session.getInstance(props);
        try {
            store = session.getStore(props.getProperty("mail.store.protocol", "imap"));
            store.connect(config.getHost(), config.getPort(), config.getUsername(), config.getPassword());
            log.info("Connected to {}:{} as {}", config.getHost(), config.getPort(), config.getUsername());

        } catch (AuthenticationFailedException e) {
            throw new ConnectionException("IMAP authentication failed for user '" + config.getUsername() + "'", e);
        } catch (MessagingException e) {
            throw new ConnectionException("Unable to connect to " + config.getHost() + ":" + config.getPort(), e);
        }

        return store;
    }

    /**
     * Is connected.
     *
     * @return Boolean.
     */
    public boolean isConnected() {
        return store != null && store.isConnected();
    }

    // Message addressing.

    private Message message(long id) throws MessagingException {
        IMAPFolder open = getFolder();
        Message message;
        if (config.isUid()) {
            message = open.getMessageByUID(id);
        } else {
            try {
                message = open.getMessage((int) id);
            } catch (IndexOutOfBoundsException e) {
                message = null;
            }
        }

        if (message == null) {
            throw new MessagingException("Message " + id + " not found in folder '" + folderName + "'");
        }

        return message;
    }

    private Message[] messages(List<Long> ids) throws MessagingException {
        List<Message> list = new ArrayList<>();
        for (long id : ids) {
            list.add(message(id));
        }
        return list.toArray(new Message[0]);
    }

    private List<Long> ids(Message[] messages) throws MessagingException {
        List<Long> ids = new ArrayList<>();
        for (Message message : messages) {
            ids.add(config.isUid() ? getFolder().getUID(message) : message.getMessageNumber());
        }
        return ids;
    }

    private int messageNumber(long id) throws MessagingException {
        return config.isUid() ? message(id).getMessageNumber() : (int) id;
    }

    // MailStore.

    @Override
    public PartDescriptor fetchStructure(long messageId) throws MessagingException {
        int msgno = messageNumber(messageId);
        BODYSTRUCTURE structure = (BODYSTRUCTURE) getFolder().doCommand(p -> p.fetchBodyStructure(msgno));

        return mapper.map(structure);
    }

    @Override
    public byte[] fetchPartBody(long messageId, String section, boolean peek) throws MessagingException {
        int msgno = messageNumber(messageId);
        String imapSection = "0".equals(section) ? "TEXT" : section;
        log.debug("Fetching message {} section {} peek={}", messageId, imapSection, peek);

        BODY body = (BODY) getFolder().doCommand(p -> peek ? p.peekBody(msgno, imapSection) : p.fetchBody(msgno, imapSection));

        return bytes(body);
    }

    @Override
    public String fetchHeader(long messageId) throws MessagingException {
        int msgno = messageNumber(messageId);
        BODY body = (BODY) getFolder().doCommand(p -> p.peekBody(msgno, "HEADER"));

        return new String(bytes(body), StandardCharsets.UTF_8);
    }

    private static byte[] bytes(BODY body) {
        ByteArray array = body != null ? body.getByteArray() : null;
        return array != null ? array.getNewBytes() : new byte[0];
    }

    // Mailboxes.

    /**
     * Switches to another folder, the connection is kept.
     *
     * @param name Folder name.
     * @return Self.
     * @throws MessagingException Close error.
     */
    public ImapMailbox switchMailbox(String name) throws MessagingException {
        if (folder != null && folder.isOpen()) {
            folder.close(config.isExpungeOnDisconnect());
        }
        folder = null;
        folderName = name;
        log.debug("Switched to folder '{}'", name);

        return this;
    }

    /**
     * Gets current folder status.
     *
     * @return MailboxStatus instance.
     * @throws MessagingException Store error.
     */
    public MailboxStatus checkMailbox() throws MessagingException {
        IMAPFolder open = getFolder();
        return new MailboxStatus(open.getMessageCount(), open.getNewMessageCount(), open.getUnreadMessageCount(),
                open.getUIDNext(), open.getUIDValidity());
    }

    /**
     * Gets a folder status without opening it.
     *
     * @param name Folder name.
     * @return MailboxStatus instance.
     * @throws MessagingException Store error.
     */
    public MailboxStatus statusMailbox(String name) throws MessagingException {
        if (name.equals(folderName)) {
            return checkMailbox();
        }

        IMAPFolder other = (IMAPFolder) getStore().getFolder(name);
        return new MailboxStatus(other.getMessageCount(), other.getNewMessageCount(), other.getUnreadMessageCount(),
                other.getUIDNext(), other.getUIDValidity());
    }

    /**
     * Creates a folder.
     *
     * @param name Folder name.
     * @return Boolean, false if it already exists.
     * @throws MessagingException Store error.
     */
    public boolean createMailbox(String name) throws MessagingException {
        Folder created = getStore().getFolder(name);
        if (created.exists()) {
            return false;
        }
        return created.create(Folder.HOLDS_MESSAGES);
    }

    /**
     * Deletes a folder.
     *
     * @param name Folder name.
     * @return Boolean.
     * @throws MessagingException Store error.
     */
    public boolean deleteMailbox(String name) throws MessagingException {
        if (name.equals(folderName) && folder != null && folder.isOpen()) {
            folder.close(false);
            folder = null;
        }
        return getStore().getFolder(name).delete(false);
    }

    /**
     * Renames a folder.
     *
     * @param oldName Current folder name.
     * @param newName New folder name.
     * @return Boolean.
     * @throws MessagingException Store error.
     */
    public boolean renameMailbox(String oldName, String newName) throws MessagingException {
        if (oldName.equals(folderName) && folder != null && folder.isOpen()) {
            folder.close(false);
            folder = null;
            folderName = newName;
        }
        Store connected = getStore();
        return connected.getFolder(oldName).renameTo(connected.getFolder(newName));
    }

    /**
     * Lists folders.
     *
     * @param pattern LIST pattern, "*" for all.
     * @return List of MailboxListing.
     * @throws MessagingException Store error.
     */
    public List<MailboxListing> getMailboxes(String pattern) throws MessagingException {
        return listing(getStore().getDefaultFolder().list(pattern));
    }

    /**
     * Lists subscribed folders.
     *
     * @param pattern LSUB pattern, "*" for all.
     * @return List of MailboxListing.
     * @throws MessagingException Store error.
     */
    public List<MailboxListing> getSubscribedMailboxes(String pattern) throws MessagingException {
        return listing(getStore().getDefaultFolder().listSubscribed(pattern));
    }

    private List<MailboxListing> listing(Folder[] folders) throws MessagingException {
        List<MailboxListing> list = new ArrayList<>();
        for (Folder entry : folders) {
            List<String> attributes = entry instanceof IMAPFolder imapFolder && imapFolder.getAttributes() != null
                    ? Arrays.asList(imapFolder.getAttributes())
                    : Collections.emptyList();
            list.add(new MailboxListing(entry.getFullName(), entry.getName(), entry.getSeparator(), attributes));
        }
        return list;
    }

    /**
     * Subscribes to a folder.
     *
     * @param name Folder name.
     * @throws MessagingException Store error.
     */
    public void subscribeMailbox(String name) throws MessagingException {
        getStore().getFolder(name).setSubscribed(true);
    }

    /**
     * Unsubscribes from a folder.
     *
     * @param name Folder name.
     * @throws MessagingException Store error.
     */
    public void unsubscribeMailbox(String name) throws MessagingException {
        getStore().getFolder(name).setSubscribed(false);
    }

    // Search.

    /**
     * Searches the current folder.
     *
     * @param criteria Criteria string, see {@link SearchCriteria}.
     * @return List of message ids.
     * @throws MessagingException Store error.
     */
    public List<Long> searchMailbox(String criteria) throws MessagingException {
        SearchTerm term = SearchCriteria.parse(criteria);
        IMAPFolder open = getFolder();
        Message[] found = term == null ? open.getMessages() : open.search(term);
        log.debug("Search '{}' found {} messages", criteria, found.length);

        return ids(found);
    }

    /**
     * Searches messages from any of the given senders.
     * <p>Senders are lower cased and searched once each.
     *
     * @param criteria Base criteria string.
     * @param sender   Sender address.
     * @param senders  More sender addresses.
     * @return List of unique message ids in order found.
     * @throws MessagingException Store error.
     */
    public List<Long> searchMailboxFrom(String criteria, String sender, String... senders) throws MessagingException {
        Set<String> unique = new LinkedHashSet<>();
        unique.add(sender.toLowerCase(Locale.ROOT));
        for (String other : senders) {
            unique.add(other.toLowerCase(Locale.ROOT));
        }

        List<String> criterias = new ArrayList<>();
        for (String from : unique) {
            criterias.add(criteria + " FROM \"" + from.replace("\"", "\\\"") + "\"");
        }

        return searchMailboxMergeResults(criterias.toArray(new String[0]));
    }

    /**
     * Runs several searches and merges their results.
     *
     * @param criterias Criteria strings.
     * @return List of unique message ids in order found.
     * @throws MessagingException Store error.
     */
    public List<Long> searchMailboxMergeResults(String... criterias) throws MessagingException {
        Set<Long> merged = new LinkedHashSet<>();
        for (String criteria : criterias) {
            merged.addAll(searchMailbox(criteria));
        }
        return new ArrayList<>(merged);
    }

    /**
     * Sorts messages in the current folder.
     *
     * @param criteria       Sort key.
     * @param reverse        Descending order.
     * @param searchCriteria Criteria string to filter by.
     * @return List of message ids.
     * @throws MessagingException Store error.
     */
    public List<Long> sortMails(SortCriteria criteria, boolean reverse, String searchCriteria) throws MessagingException {
        SortTerm[] terms = reverse
                ? new SortTerm[]{SortTerm.REVERSE, criteria.getTerm()}
                : new SortTerm[]{criteria.getTerm()};

        return ids(getFolder().getSortedMessages(terms, SearchCriteria.parse(searchCriteria)));
    }

    /**
     * Counts messages in the current folder.
     *
     * @return Message count.
     * @throws MessagingException Store error.
     */
    public int countMails() throws MessagingException {
        return getFolder().getMessageCount();
    }

    // Message operations.

    /**
     * Deletes a message and expunges.
     *
     * @param id Message id.
     * @throws MessagingException Store error.
     */
    public void deleteMail(long id) throws MessagingException {
        deleteMails(List.of(id));
    }

    /**
     * Deletes messages and expunges.
     *
     * @param ids Message ids.
     * @throws MessagingException Store error.
     */
    public void deleteMails(List<Long> ids) throws MessagingException {
        getFolder().setFlags(messages(ids), new Flags(Flags.Flag.DELETED), true);
        expungeDeletedMails();
    }

    /**
     * Moves a message to another folder.
     *
     * @param id     Message id.
     * @param target Target folder name.
     * @throws MessagingException Store error.
     */
    public void moveMail(long id, String target) throws MessagingException {
        moveMails(List.of(id), target);
    }

    /**
     * Moves messages to another folder.
     * <p>Copies, flags the originals deleted and expunges.
     *
     * @param ids    Message ids.
     * @param target Target folder name.
     * @throws MessagingException Store error.
     */
    public void moveMails(List<Long> ids, String target) throws MessagingException {
        Message[] list = messages(ids);
        IMAPFolder open = getFolder();
        open.copyMessages(list, getStore().getFolder(target));
        open.setFlags(list, new Flags(Flags.Flag.DELETED), true);
        expungeDeletedMails();
    }

    /**
     * Copies a message to another folder.
     *
     * @param id     Message id.
     * @param target Target folder name.
     * @throws MessagingException Store error.
     */
    public void copyMail(long id, String target) throws MessagingException {
        copyMails(List.of(id), target);
    }

    /**
     * Copies messages to another folder and expunges.
     *
     * @param ids    Message ids.
     * @param target Target folder name.
     * @throws MessagingException Store error.
     */
    public void copyMails(List<Long> ids, String target) throws MessagingException {
        getFolder().copyMessages(messages(ids), getStore().getFolder(target));
        expungeDeletedMails();
    }

    /**
     * Expunges deleted messages from the current folder.
     *
     * @throws MessagingException Store error.
     */
    public void expungeDeletedMails() throws MessagingException {
        getFolder().expunge();
    }

    /**
     * Marks a message as read.
     *
     * @param id Message id.
     * @throws MessagingException Store error.
     */
    public void markMailAsRead(long id) throws MessagingException {
        markMailsAsRead(List.of(id));
    }

    /**
     * Marks a message as unread.
     *
     * @param id Message id.
     * @throws MessagingException Store error.
     */
    public void markMailAsUnread(long id) throws MessagingException {
        markMailsAsUnread(List.of(id));
    }

    /**
     * Marks a message as important.
     *
     * @param id Message id.
     * @throws MessagingException Store error.
     */
    public void markMailAsImportant(long id) throws MessagingException {
        markMailsAsImportant(List.of(id));
    }

    public void markMailsAsRead(List<Long> ids) throws MessagingException {
        setFlag(ids, "\\Seen");
    }

    public void markMailsAsUnread(List<Long> ids) throws MessagingException {
        clearFlag(ids, "\\Seen");
    }

    public void markMailsAsImportant(List<Long> ids) throws MessagingException {
        setFlag(ids, "\\Flagged");
    }

    /**
     * Sets a flag on messages.
     *
     * @param ids  Message ids.
     * @param flag System flag like \Seen or a user keyword.
     * @throws MessagingException Store error.
     */
    public void setFlag(List<Long> ids, String flag) throws MessagingException {
        getFolder().setFlags(messages(ids), flags(flag), true);
    }

    /**
     * Clears a flag on messages.
     *
     * @param ids  Message ids.
     * @param flag System flag like \Seen or a user keyword.
     * @throws MessagingException Store error.
     */
    public void clearFlag(List<Long> ids, String flag) throws MessagingException {
        getFolder().setFlags(messages(ids), flags(flag), false);
    }

    /**
     * Builds flags from a name.
     *
     * @param flag Flag name.
     * @return Flags instance.
     * @throws InvalidParameterException Blank flag.
     */
    static Flags flags(String flag) {
        if (flag == null || flag.isBlank()) {
            throw new InvalidParameterException("Flag must not be blank");
        }

        switch (flag.trim().toLowerCase(Locale.ROOT)) {
            case "\\seen":
                return new Flags(Flags.Flag.SEEN);
            case "\\answered":
                return new Flags(Flags.Flag.ANSWERED);
            case "\\flagged":
                return new Flags(Flags.Flag.FLAGGED);
            case "\\deleted":
                return new Flags(Flags.Flag.DELETED);
            case "\\draft":
                return new Flags(Flags.Flag.DRAFT);
            default:
                return new Flags(flag.trim());
        }
    }

    /**
     * Gets message overviews.
     *
     * @param ids Message ids.
     * @return List of MailOverview.
     * @throws MessagingException Store error.
     */
    public List<MailOverview> getMailsInfo(List<Long> ids) throws MessagingException {
        Message[] list = messages(ids);

        FetchProfile profile = new FetchProfile();
        profile.add(FetchProfile.Item.ENVELOPE);
        profile.add(FetchProfile.Item.FLAGS);
        profile.add(FetchProfile.Item.SIZE);
        profile.add(UIDFolder.FetchProfileItem.UID);
        getFolder().fetch(list, profile);

        List<MailOverview> overviews = new ArrayList<>();
        for (int i = 0; i < list.length; i++) {
            Message message = list[i];
            String[] messageId = message.getHeader("Message-ID");
            overviews.add(new MailOverview(
                    ids.get(i),
                    message.getSubject(),
                    addresses(message.getFrom()),
                    addresses(message.getRecipients(Message.RecipientType.TO)),
                    message.getSentDate(),
                    messageId != null && messageId.length > 0 ? messageId[0] : null,
                    message.getSize(),
                    message.isSet(Flags.Flag.SEEN),
                    message.isSet(Flags.Flag.ANSWERED),
                    message.isSet(Flags.Flag.FLAGGED),
                    message.isSet(Flags.Flag.DELETED),
                    message.isSet(Flags.Flag.DRAFT),
                    message.isSet(Flags.Flag.RECENT)
            ));
        }

        return overviews;
    }

    private static String addresses(Address[] addresses) {
        return addresses != null ? InternetAddress.toUnicodeString(addresses) : null;
    }

    /**
     * Gets the raw message.
     *
     * @param id         Message id.
     * @param markAsSeen Whether fetching may set the seen flag.
     * @return Bytes.
     * @throws MessagingException Store error.
     */
    public byte[] getRawMail(long id, boolean markAsSeen) throws MessagingException {
        Message message = message(id);
        if (message instanceof IMAPMessage imapMessage) {
            imapMessage.setPeek(!markAsSeen);
        }

        ByteArrayOutputStream stream = new ByteArrayOutputStream();
        try {
            message.writeTo(stream);
        } catch (IOException e) {
            throw new MessagingException("Unable to read message " + id, e);
        }

        return stream.toByteArray();
    }

    /**
     * Saves the raw message to a file.
     *
     * @param id   Message id.
     * @param path File path.
     * @throws MessagingException Store error.
     * @throws IOException        Write error.
     */
    public void saveMail(long id, Path path) throws MessagingException, IOException {
        FileUtils.writeByteArrayToFile(path.toFile(), getRawMail(id, false));
        log.debug("Saved message {} to {}", id, path);
    }

    /**
     * Gets the message in mbox form, header block followed by body.
     *
     * @param id         Message id.
     * @param markAsSeen Whether fetching may set the seen flag.
     * @return String.
     * @throws MessagingException Store error.
     */
    public String getMailMboxFormat(long id, boolean markAsSeen) throws MessagingException {
        return fetchHeader(id) + new String(fetchPartBody(id, "0", !markAsSeen), StandardCharsets.UTF_8);
    }

    /**
     * Gets the parsed header of a message.
     *
     * @param id Message id.
     * @return IncomingMessageHeader instance.
     * @throws MessagingException Store error.
     */
    public IncomingMessageHeader getMailHeader(long id) throws MessagingException {
        return headerParser.parse(id, fetchHeader(id));
    }

    /**
     * Gets an assembled message.
     *
     * @param id         Message id.
     * @param markAsSeen Whether fetching content may set the seen flag.
     * @return IncomingMessage instance.
     * @throws MessagingException Store error.
     */
    public IncomingMessage getMail(long id, boolean markAsSeen) throws MessagingException {
        return assembler.assembleMessage(id, markAsSeen);
    }

    // Quota.

    /**
     * Gets storage quota limit in KB.
     *
     * @return Limit or -1 if not reported.
     * @throws MessagingException Store error.
     */
    public long getQuotaLimit() throws MessagingException {
        Quota.Resource resource = storageQuota();
        return resource != null ? resource.limit : -1;
    }

    /**
     * Gets storage quota usage in KB.
     *
     * @return Usage or -1 if not reported.
     * @throws MessagingException Store error.
     */
    public long getQuotaUsage() throws MessagingException {
        Quota.Resource resource = storageQuota();
        return resource != null ? resource.usage : -1;
    }

    private Quota.Resource storageQuota() throws MessagingException {
        if (!(getStore() instanceof IMAPStore imapStore) || !imapStore.hasCapability("QUOTA")) {
            return null;
        }

        for (Quota quota : imapStore.getQuota(QUOTA_ROOT)) {
            if (quota.resources == null) {
                continue;
            }
            for (Quota.Resource resource : quota.resources) {
                if (QUOTA_STORAGE.equalsIgnoreCase(resource.name)) {
                    return resource;
                }
            }
        }

        return null;
    }

    @Override
    public void close() {
        try {
            if (folder != null && folder.isOpen()) {
                folder.close(config.isExpungeOnDisconnect());
            }
            if (store != null && store.isConnected()) {
                store.close();
            }
        } catch (MessagingException e) {
            log.error("Error closing IMAP connection: {}", e.getMessage());
        } finally {
            folder = null;
            store = null;
        }
    }
}
