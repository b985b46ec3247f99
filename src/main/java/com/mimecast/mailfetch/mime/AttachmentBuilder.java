package com.mimecast.mailfetch.mime;

import com.mimecast.mailfetch.mail.Attachment;
import com.mimecast.mailfetch.mail.DataPart;
import com.mimecast.mailfetch.storage.AttachmentStorage;
import com.mimecast.mailfetch.util.StringEncoding;
import org.apache.commons.codec.digest.DigestUtils;
import org.apache.commons.io.FilenameUtils;
import org.apache.commons.lang3.StringUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Builds attachments from part descriptors.
 *
 * <p>Names are resolved in this order:
 * <ul>
 *     <li>message/rfc822 attachments and multipart/alternative parts become <code>subtype.eml</code>.</li>
 *     <li>Parts with neither a filename nor a name parameter are named after their subtype.</li>
 *     <li>Otherwise filename, falling back to name, MIME decoded then RFC 2231 decoded.</li>
 * </ul>
 * <p>The id is the SHA-1 of name and raw Content-ID so repeated assembly yields the same ids.
 * <p>When storage is configured the file name is generated from message id, attachment id and a sanitized name.
 */
public class AttachmentBuilder {
    private static final Logger log = LogManager.getLogger(AttachmentBuilder.class);

    /**
     * Longest storage path kept before truncation.
     */
    static final int MAX_PATH_LENGTH = 255;

    private static final Pattern WHITESPACE = Pattern.compile("\\s", Pattern.UNICODE_CHARACTER_CLASS);
    private static final Pattern UNSAFE = Pattern.compile("[^\\w.]", Pattern.UNICODE_CHARACTER_CLASS);
    private static final Pattern UNDERSCORES = Pattern.compile("_+");
    private static final Pattern EDGE_UNDERSCORE = Pattern.compile("(^_)|(_$)");
    private static final Pattern SEPARATORS = Pattern.compile("[\\\\/]");

    /**
     * Builds attachment.
     *
     * @param part      PartDescriptor.
     * @param params    Resolved parameters.
     * @param messageId Message id.
     * @param dataPart  Backing DataPart, not shared with other attachments.
     * @param emlOrigin Whether the part comes from a message/rfc822 attachment.
     * @param options   AssemblyOptions.
     * @return Attachment instance.
     */
    public Attachment build(PartDescriptor part, PartParameters params, long messageId, DataPart dataPart,
                            boolean emlOrigin, AssemblyOptions options) {
        String name = resolveName(part, params);
        String rawId = part.getId().orElse(null);

        Attachment attachment = new Attachment()
                .setId(DigestUtils.sha1Hex(name + (rawId != null ? rawId : "")))
                .setContentId(rawId != null ? StringUtils.strip(rawId, " <>") : null)
                .setName(name)
                .setDisposition(part.getDisposition().orElse(null))
                .setCharset(params.getNonBlank(PartParameters.Kind.CHARSET).orElse(null))
                .setEmlOrigin(emlOrigin)
                .setMediaType(part.getType(), part.getSubtype())
                .setEncoding(part.getEncoding())
                .setDataPart(dataPart);

        Optional<AttachmentStorage> storage = options.getStorage();
        if (storage.isPresent()) {
            Path path = storage.get().resolve(fileSystemName(messageId, attachment.getId(), name));
            attachment.setStorage(storage.get())
                    .setFilePath(truncate(path));
            log.debug("Saving attachment {} of message {} to {}", name, messageId, attachment.getFilePath().orElse(null));
            attachment.saveToDisk();
        }

        return attachment;
    }

    /**
     * Resolves display name.
     *
     * @param part   PartDescriptor.
     * @param params Resolved parameters.
     * @return Name.
     */
    public String resolveName(PartDescriptor part, PartParameters params) {
        String subtype = part.getSubtype().toLowerCase(Locale.ROOT);
        if (part.isEmbeddedMessageAttachment() || part.isSubtype("ALTERNATIVE")) {
            return subtype + ".eml";
        }

        Optional<String> raw = params.getNonBlank(PartParameters.Kind.FILENAME)
                .or(() -> params.getNonBlank(PartParameters.Kind.NAME));
        if (raw.isEmpty()) {
            return subtype;
        }

        return StringEncoding.decodeRfc2231(StringEncoding.decodeMimeStr(raw.get()));
    }

    /**
     * Generates a file system safe name.
     *
     * @param messageId    Message id.
     * @param attachmentId Attachment id.
     * @param name         Display name.
     * @return File name.
     */
    static String fileSystemName(long messageId, String attachmentId, String name) {
        String sanitized = WHITESPACE.matcher(name).replaceAll("_");
        sanitized = UNSAFE.matcher(sanitized).replaceAll("");
        sanitized = UNDERSCORES.matcher(sanitized).replaceAll("_");
        sanitized = EDGE_UNDERSCORE.matcher(sanitized).replaceAll("");

        return SEPARATORS.matcher(messageId + "_" + attachmentId + "_" + sanitized).replaceAll("");
    }

    /**
     * Truncates an over long path keeping its extension.
     *
     * @param path Path.
     * @return Path no longer than the limit.
     */
    static Path truncate(Path path) {
        String full = path.toString();
        if (full.length() <= MAX_PATH_LENGTH) {
            return path;
        }

        String extension = FilenameUtils.getExtension(full);
        if (extension.isEmpty() || extension.length() >= MAX_PATH_LENGTH / 2) {
            return Paths.get(full.substring(0, MAX_PATH_LENGTH));
        }
        return Paths.get(full.substring(0, MAX_PATH_LENGTH - 1 - extension.length()) + "." + extension);
    }
}
