package com.mimecast.mailfetch.mail;

import jakarta.mail.MessagingException;
import org.apache.commons.codec.binary.Base64;
import org.apache.commons.lang3.StringUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.nio.file.Path;
import java.util.*;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Assembled message.
 *
 * <p>Holds the header, the plain and HTML body parts and the attachments keyed by id in insertion order.
 * <br>Body text is the concatenation of each trimmed body part and is computed once on first read.
 * <p>Populated by one assembly pass, after which only attachments can be added or removed.
 */
public class IncomingMessage {
    private static final Logger log = LogManager.getLogger(IncomingMessage.class);

    private static final Pattern INTERNAL_LINK = Pattern.compile("=[\"'](ci?d:([\\w.%*@-]+))[\"']", Pattern.CASE_INSENSITIVE);
    private static final Pattern CID_REFERENCE = Pattern.compile("\\bcid:([^'\"\\s]{1,256})", Pattern.CASE_INSENSITIVE);

    /**
     * Body slots.
     */
    public enum BodyType {
        TEXT_PLAIN,
        TEXT_HTML
    }

    private IncomingMessageHeader header = new IncomingMessageHeader();
    private final Map<BodyType, List<DataPart>> dataParts = new EnumMap<>(BodyType.class);
    private final Map<BodyType, String> bodies = new EnumMap<>(BodyType.class);
    private final Map<String, Attachment> attachments = new LinkedHashMap<>();
    private boolean hasAttachments;

    public IncomingMessageHeader getHeader() {
        return header;
    }

    /**
     * Sets header.
     *
     * @param header IncomingMessageHeader.
     * @return Self.
     */
    public IncomingMessage setHeader(IncomingMessageHeader header) {
        this.header = header;
        return this;
    }

    public long getId() {
        return header.getId();
    }

    /**
     * Adds a body part.
     *
     * @param dataPart DataPart.
     * @param type     BodyType.
     * @return Self.
     */
    public IncomingMessage addDataPart(DataPart dataPart, BodyType type) {
        dataParts.computeIfAbsent(type, k -> new ArrayList<>()).add(dataPart);
        bodies.remove(type);
        return this;
    }

    /**
     * Gets body parts of given type.
     *
     * @param type BodyType.
     * @return Unmodifiable list.
     */
    public List<DataPart> getDataParts(BodyType type) {
        return Collections.unmodifiableList(dataParts.getOrDefault(type, List.of()));
    }

    /**
     * Checks if a body of given type exists.
     *
     * @param type BodyType.
     * @return Boolean.
     */
    public boolean hasBody(BodyType type) {
        return !getDataParts(type).isEmpty();
    }

    /**
     * Gets plain text body.
     *
     * @return String, empty when absent.
     * @throws MessagingException Store error.
     */
    public String getTextPlain() throws MessagingException {
        return getBody(BodyType.TEXT_PLAIN);
    }

    /**
     * Gets HTML body.
     *
     * @return String, empty when absent.
     * @throws MessagingException Store error.
     */
    public String getTextHtml() throws MessagingException {
        return getBody(BodyType.TEXT_HTML);
    }

    private String getBody(BodyType type) throws MessagingException {
        String body = bodies.get(type);
        if (body == null) {
            StringBuilder sb = new StringBuilder();
            for (DataPart part : getDataParts(type)) {
                sb.append(part.fetchString().trim());
            }
            body = sb.toString();
            bodies.put(type, body);
        }
        return body;
    }

    /**
     * Checks if any part was classified as an attachment.
     *
     * @return Boolean.
     */
    public boolean hasAttachments() {
        return hasAttachments;
    }

    /**
     * Sets has attachments flag.
     *
     * @param hasAttachments Boolean.
     * @return Self.
     */
    public IncomingMessage setHasAttachments(boolean hasAttachments) {
        this.hasAttachments = hasAttachments;
        return this;
    }

    /**
     * Adds attachment, replacing any with the same id.
     *
     * @param attachment Attachment.
     * @return Self.
     */
    public IncomingMessage addAttachment(Attachment attachment) {
        attachments.put(attachment.getId(), attachment);
        hasAttachments = true;
        return this;
    }

    /**
     * Removes attachment by id.
     *
     * @param id Attachment id.
     * @return True if it was present.
     */
    public boolean removeAttachment(String id) {
        if (!attachments.containsKey(id)) {
            return false;
        }
        attachments.remove(id);
        hasAttachments = !attachments.isEmpty();
        return true;
    }

    /**
     * Gets attachments in insertion order.
     *
     * @return List of Attachment.
     */
    public List<Attachment> getAttachments() {
        return new ArrayList<>(attachments.values());
    }

    /**
     * Gets attachment by id.
     *
     * @param id Attachment id.
     * @return Optional of Attachment.
     */
    public Optional<Attachment> getAttachment(String id) {
        return Optional.ofNullable(attachments.get(id));
    }

    /**
     * Finds internal links in the HTML body.
     *
     * @return Map of content id to placeholder, for example "logo@example" to "cid:logo@example".
     * @throws MessagingException Store error.
     */
    public Map<String, String> getInternalLinksPlaceholders() throws MessagingException {
        Map<String, String> placeholders = new LinkedHashMap<>();
        Matcher matcher = INTERNAL_LINK.matcher(getTextHtml());
        while (matcher.find()) {
            placeholders.put(matcher.group(2), matcher.group(1));
        }
        return placeholders;
    }

    /**
     * Rewrites internal links in the HTML body to saved attachment files.
     *
     * @param baseUri Base URI the attachment files are served from.
     * @return Rewritten HTML.
     * @throws MessagingException    Store error.
     * @throws IllegalStateException Referenced attachment was not saved.
     */
    public String replaceInternalLinks(String baseUri) throws MessagingException {
        String base = StringUtils.stripEnd(baseUri, "\\/") + "/";
        String html = getTextHtml();

        for (Map.Entry<String, String> entry : getInternalLinksPlaceholders().entrySet()) {
            for (Attachment attachment : attachments.values()) {
                if (entry.getKey().equals(attachment.getContentId())) {
                    Path path = attachment.getFilePath()
                            .orElseThrow(() -> new IllegalStateException("Attachment " + attachment.getId() + " has no file path"));
                    html = html.replace(entry.getValue(), base + path.getFileName());
                }
            }
        }

        return html;
    }

    /**
     * Inlines inline image attachments referenced by cid in the HTML body as base64 data URIs.
     *
     * @throws MessagingException Store error.
     */
    public void embedImageAttachments() throws MessagingException {
        String html = getTextHtml();
        Set<String> cids = new LinkedHashSet<>();
        Matcher matcher = CID_REFERENCE.matcher(html);
        while (matcher.find()) {
            cids.add(matcher.group(1));
        }

        for (String cid : cids) {
            for (Attachment attachment : attachments.values()) {
                if (cid.equals(attachment.getContentId()) && "inline".equalsIgnoreCase(attachment.getDisposition())) {
                    String mimeType = attachment.getMimeType();
                    if (!mimeType.startsWith("image/")) {
                        log.debug("Not embedding {} as it is {}", cid, mimeType);
                        continue;
                    }
                    String replacement = "data:" + mimeType + ";base64, " + Base64.encodeBase64String(attachment.getContents());
                    html = html.replace("cid:" + cid, replacement);
                }
            }
        }

        bodies.put(BodyType.TEXT_HTML, html);
    }
}
