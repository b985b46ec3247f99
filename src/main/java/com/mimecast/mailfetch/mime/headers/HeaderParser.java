package com.mimecast.mailfetch.mime.headers;

import com.mimecast.mailfetch.exceptions.UnexpectedStructureException;
import com.mimecast.mailfetch.mail.IncomingMessageHeader;
import com.mimecast.mailfetch.util.DateTimes;
import com.mimecast.mailfetch.util.StringEncoding;
import jakarta.mail.MessagingException;
import jakarta.mail.internet.AddressException;
import jakarta.mail.internet.InternetAddress;
import jakarta.mail.internet.InternetHeaders;
import jakarta.mail.internet.MimeUtility;
import org.apache.commons.lang3.StringUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.function.BiConsumer;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Raw header block parser.
 */
public class HeaderParser {
    private static final Logger log = LogManager.getLogger(HeaderParser.class);

    private static final Pattern MAILFROM = Pattern.compile("smtp.mailfrom=[-0-9a-zA-Z.+_]+@[-0-9a-zA-Z.+_]+.[a-zA-Z]{2,4}");

    /**
     * Parses a header block.
     *
     * @param id         Message id.
     * @param headersRaw Raw header block.
     * @return IncomingMessageHeader instance.
     * @throws UnexpectedStructureException Header block missing.
     */
    public IncomingMessageHeader parse(long id, String headersRaw) {
        if (headersRaw == null) {
            throw new UnexpectedStructureException("Header block missing for message " + id);
        }

        InternetHeaders headers;
        try {
            headers = new InternetHeaders(new ByteArrayInputStream(headersRaw.getBytes(StandardCharsets.UTF_8)), true);
        } catch (MessagingException e) {
            throw new UnexpectedStructureException("Unparseable header block for message " + id + ": " + e.getMessage());
        }

        IncomingMessageHeader header = new IncomingMessageHeader()
                .setId(id)
                .setHeadersRaw(headersRaw)
                .setPriority(firstMatch("Priority", headersRaw))
                .setImportance(firstMatch("Importance", headersRaw))
                .setSensitivity(firstMatch("Sensitivity", headersRaw))
                .setAutoSubmitted(firstMatch("Auto-Submitted", headersRaw))
                .setPrecedence(firstMatch("Precedence", headersRaw))
                .setFailedRecipients(firstMatch("Failed-Recipients", headersRaw));

        String date = value(headers, "Date");
        header.setDraft(date == null);
        header.setDate(StringUtils.isNotBlank(date) ? DateTimes.parseDateTime(date) : DateTimes.now());

        String subject = value(headers, "Subject");
        header.setSubject(StringUtils.isNotBlank(subject) ? StringEncoding.decodeMimeStr(subject) : null);

        List<InternetAddress> from = addresses(headers, "From");
        if (!from.isEmpty()) {
            InternetAddress first = from.get(0);
            header.setFrom(host(first), name(from), first.getAddress().toLowerCase(Locale.ROOT));
        } else {
            Matcher matcher = MAILFROM.matcher(headersRaw);
            if (matcher.find()) {
                header.setFromAddress(matcher.group().substring(14));
            }
        }

        List<InternetAddress> sender = addresses(headers, "Sender");
        if (!sender.isEmpty()) {
            InternetAddress first = sender.get(0);
            header.setSender(host(first), name(sender), first.getAddress().toLowerCase(Locale.ROOT));
        }

        List<String> toStrings = new ArrayList<>();
        recipients(headers, "To", (address, name) -> {
            header.addTo(address, name);
            toStrings.add(name != null ? name + " <" + address + ">" : address);
        });
        header.setToString(String.join(", ", toStrings));

        recipients(headers, "Cc", header::addCc);
        recipients(headers, "Bcc", header::addBcc);
        recipients(headers, "Reply-To", header::addReplyTo);

        String messageId = value(headers, "Message-ID");
        if (messageId != null) {
            header.setMessageId(messageId.trim());
        }

        return header;
    }

    /**
     * Gets first match of <code>Name:(.*)</code> anywhere in the raw block.
     */
    private String firstMatch(String name, String headersRaw) {
        Matcher matcher = Pattern.compile(Pattern.quote(name) + ":(.*)", Pattern.CASE_INSENSITIVE).matcher(headersRaw);
        return matcher.find() ? matcher.group(1).trim() : "";
    }

    /**
     * Gets unfolded header value.
     *
     * @return String or null when absent.
     */
    private String value(InternetHeaders headers, String name) {
        String value = headers.getHeader(name, ",");
        return value != null ? MimeUtility.unfold(value) : null;
    }

    /**
     * Parses address header, skipping entries without mailbox or host.
     */
    private List<InternetAddress> addresses(InternetHeaders headers, String name) {
        List<InternetAddress> list = new ArrayList<>();
        String value = value(headers, name);
        if (StringUtils.isBlank(value)) {
            return list;
        }

        try {
            for (InternetAddress address : InternetAddress.parseHeader(value, false)) {
                String email = address.getAddress();
                int at = email != null ? email.lastIndexOf('@') : -1;
                if (at > 0 && at < email.length() - 1) {
                    list.add(address);
                }
            }
        } catch (AddressException e) {
            log.warn("Unable to parse {} header \"{}\": {}", name, value, e.getMessage());
        }

        return list;
    }

    private void recipients(InternetHeaders headers, String name, BiConsumer<String, String> consumer) {
        for (InternetAddress address : addresses(headers, name)) {
            consumer.accept(address.getAddress().toLowerCase(Locale.ROOT), personal(address));
        }
    }

    private String host(InternetAddress address) {
        String email = address.getAddress();
        return email.substring(email.lastIndexOf('@') + 1);
    }

    /**
     * Gets first non blank display name of the first two addresses.
     */
    private String name(List<InternetAddress> list) {
        for (int i = 0; i < Math.min(2, list.size()); i++) {
            String personal = personal(list.get(i));
            if (personal != null) {
                return personal;
            }
        }
        return null;
    }

    private String personal(InternetAddress address) {
        String personal = address.getPersonal();
        return StringUtils.isNotBlank(personal) ? StringEncoding.decodeMimeStr(personal) : null;
    }
}
