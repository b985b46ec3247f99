package com.mimecast.mailfetch.util;

import org.apache.commons.codec.DecoderException;
import org.apache.commons.codec.binary.Base64;
import org.apache.commons.codec.net.QuotedPrintableCodec;
import org.apache.commons.lang3.StringUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.eclipse.angus.mail.imap.protocol.BASE64MailboxDecoder;
import org.eclipse.angus.mail.imap.protocol.BASE64MailboxEncoder;

import java.io.ByteArrayOutputStream;
import java.net.URLDecoder;
import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.*;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * String encoding utilities.
 *
 * <p>None of these methods throw for bad input.
 * <br>Conversion failures fall back to the original value.
 */
public class StringEncoding {
    private static final Logger log = LogManager.getLogger(StringEncoding.class);

    private static final Pattern ASCII_OR_DEFAULT = Pattern.compile("default|ascii", Pattern.CASE_INSENSITIVE);
    private static final Pattern ENCODED_WORD = Pattern.compile("=\\?([^?\\s]+)\\?([BbQq])\\?([^?\\s]*)\\?=");
    private static final Pattern URL_ILLEGAL = Pattern.compile("[^%a-zA-Z0-9\\-_.+]");
    private static final Pattern URL_ESCAPE = Pattern.compile("%[a-zA-Z0-9]{2}");
    private static final Pattern RFC2231 = Pattern.compile("^(.*?)'.*?'(.*?)$", Pattern.DOTALL);

    /**
     * Protected constructor.
     */
    private StringEncoding() {
        throw new IllegalStateException("Static class");
    }

    /**
     * Converts bytes from one charset to another.
     * <p>Malformed input is dropped and unmappable characters are replaced.
     * <p>Returns the input when the source charset is ascii or default, when both charsets match,
     * when either charset is unknown or when the conversion produced nothing.
     *
     * @param data Bytes to convert.
     * @param from Source charset name.
     * @param to   Target charset name.
     * @return Converted bytes.
     */
    public static byte[] convertEncoding(byte[] data, String from, String to) {
        if (data == null || data.length == 0 || StringUtils.isBlank(from) || StringUtils.isBlank(to)) {
            return data;
        }
        if (ASCII_OR_DEFAULT.matcher(from).find() || from.trim().equalsIgnoreCase(to.trim())) {
            return data;
        }

        Charset source = charsetOrNull(from);
        Charset target = charsetOrNull(to);
        if (source == null || target == null) {
            log.warn("Unable to convert from {} to {}: unsupported charset", from, to);
            return data;
        }
        if (source.equals(target)) {
            return data;
        }

        try {
            CharBuffer chars = source.newDecoder()
                    .onMalformedInput(CodingErrorAction.IGNORE)
                    .onUnmappableCharacter(CodingErrorAction.IGNORE)
                    .decode(ByteBuffer.wrap(data));
            ByteBuffer bytes = target.newEncoder()
                    .onMalformedInput(CodingErrorAction.REPLACE)
                    .onUnmappableCharacter(CodingErrorAction.REPLACE)
                    .encode(chars);

            byte[] converted = new byte[bytes.remaining()];
            bytes.get(converted);
            return converted.length > 0 ? converted : data;
        } catch (CharacterCodingException e) {
            log.warn("Unable to convert from {} to {}: {}", from, to, e.getMessage());
            return data;
        }
    }

    /**
     * Gets charset by name.
     *
     * @param name Charset name.
     * @return Charset or null if unknown.
     */
    public static Charset charsetOrNull(String name) {
        if (StringUtils.isBlank(name)) {
            return null;
        }
        try {
            return Charset.forName(name.trim());
        } catch (IllegalArgumentException e) {
            return null;
        }
    }

    /**
     * Decodes RFC 2047 encoded-words.
     * <p>Adjacent words sharing a charset are joined before decoding so characters split across words survive.
     * <br>Whitespace separating encoded-words is dropped.
     * <br>Words in an unknown charset are left as they are.
     *
     * @param text Header text.
     * @return Decoded text, the input when blank.
     */
    public static String decodeMimeStr(String text) {
        if (StringUtils.isBlank(text)) {
            return text;
        }

        StringBuilder out = new StringBuilder();
        Matcher matcher = ENCODED_WORD.matcher(text);

        int position = 0;
        String pendingCharset = null;
        ByteArrayOutputStream pending = new ByteArrayOutputStream();
        String pendingRaw = "";

        while (matcher.find()) {
            String between = text.substring(position, matcher.start());
            boolean adjacent = pendingCharset != null && between.isBlank();

            String charset = matcher.group(1);
            int star = charset.indexOf('*');
            if (star > 0) {
                charset = charset.substring(0, star);
            }

            if (!adjacent || !pendingCharset.equalsIgnoreCase(charset)) {
                flush(out, pending, pendingCharset, pendingRaw);
                pending.reset();
                pendingRaw = "";
                if (!adjacent) {
                    out.append(between);
                }
            }

            pendingCharset = charset;
            byte[] bytes = decodeWord(matcher.group(2), matcher.group(3));
            pending.write(bytes, 0, bytes.length);
            pendingRaw += matcher.group();
            position = matcher.end();
        }

        flush(out, pending, pendingCharset, pendingRaw);
        out.append(text.substring(position));

        return out.toString();
    }

    /**
     * Appends pending encoded-word bytes decoded with given charset.
     */
    private static void flush(StringBuilder out, ByteArrayOutputStream pending, String charset, String raw) {
        if (charset == null || raw.isEmpty()) {
            return;
        }
        Charset cs = charsetOrNull(charset);
        if (cs == null) {
            log.warn("Unknown charset in encoded-word: {}", charset);
            out.append(raw);
            return;
        }
        out.append(new String(pending.toByteArray(), cs));
    }

    /**
     * Decodes a single encoded-word payload.
     * <p>Q payloads with a malformed escape are kept undecoded.
     *
     * @param encoding B or Q.
     * @param payload  Encoded text.
     * @return Decoded bytes.
     */
    private static byte[] decodeWord(String encoding, String payload) {
        if ("B".equalsIgnoreCase(encoding)) {
            return Base64.decodeBase64(payload);
        }

        try {
            return QuotedPrintableCodec.decodeQuotedPrintable(payload.replace('_', ' ').getBytes(StandardCharsets.ISO_8859_1));
        } catch (DecoderException e) {
            log.warn("Unable to decode Q encoded-word {}: {}", payload, e.getMessage());
            return payload.getBytes(StandardCharsets.ISO_8859_1);
        }
    }

    /**
     * Checks if text looks percent encoded.
     * <p>Only URL safe characters are allowed and at least one escape must be present.
     *
     * @param text Text.
     * @return Boolean.
     */
    public static boolean isUrlEncoded(String text) {
        return text != null
                && !URL_ILLEGAL.matcher(text).find()
                && URL_ESCAPE.matcher(text).find();
    }

    /**
     * Decodes an RFC 2231 <code>charset'language'data</code> value.
     * <p>Values that do not match or whose data is not percent encoded are returned unchanged.
     *
     * @param value Parameter value.
     * @return Decoded value.
     */
    public static String decodeRfc2231(String value) {
        if (value == null) {
            return null;
        }

        Matcher matcher = RFC2231.matcher(value);
        if (!matcher.matches() || !isUrlEncoded(matcher.group(2))) {
            return value;
        }

        byte[] bytes;
        try {
            bytes = URLDecoder.decode(matcher.group(2), StandardCharsets.ISO_8859_1).getBytes(StandardCharsets.ISO_8859_1);
        } catch (IllegalArgumentException e) {
            log.warn("Invalid percent encoding in \"{}\"", value);
            return value;
        }

        Charset charset = charsetOrNull(matcher.group(1));
        return new String(bytes, charset != null ? charset : StandardCharsets.UTF_8);
    }

    /**
     * Encodes a mailbox name to modified UTF-7.
     *
     * @param name Mailbox name.
     * @return Encoded name.
     */
    public static String encodeUtf7Imap(String name) {
        return name == null ? null : BASE64MailboxEncoder.encode(name);
    }

    /**
     * Decodes a modified UTF-7 mailbox name.
     *
     * @param name Encoded mailbox name.
     * @return Decoded name.
     */
    public static String decodeUtf7Imap(String name) {
        return name == null ? null : BASE64MailboxDecoder.decode(name);
    }
}
