package com.mimecast.mailfetch.mime;

import com.mimecast.mailfetch.util.StringEncoding;
import jakarta.mail.MessagingException;
import jakarta.mail.internet.MimeUtility;
import org.apache.commons.codec.binary.Base64;
import org.apache.commons.io.IOUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.regex.Pattern;

/**
 * Transfer and charset decoding of fetched part content.
 *
 * <p>Servers are not guaranteed to produce compliant encodings so nothing here throws.
 * <br>Anything that cannot be decoded is passed through as it was received.
 */
public class DataPartDecoder {
    private static final Logger log = LogManager.getLogger(DataPartDecoder.class);

    private static final Pattern NON_BASE64 = Pattern.compile("[^a-zA-Z0-9+=/]");

    /**
     * Protected constructor.
     */
    private DataPartDecoder() {
        throw new IllegalStateException("Static class");
    }

    /**
     * Decodes raw content.
     *
     * @param raw            Raw bytes as fetched, may be null.
     * @param encoding       Transfer encoding.
     * @param charset        Declared charset or null.
     * @param targetEncoding Encoding to convert text to.
     * @return Decoded bytes, never null.
     */
    public static byte[] decode(byte[] raw, TransferEncoding encoding, String charset, String targetEncoding) {
        if (raw == null) {
            return new byte[0];
        }

        byte[] data = transferDecode(raw, encoding, charset);
        if (charset != null && !charset.isBlank()) {
            data = StringEncoding.convertEncoding(data, charset, targetEncoding);
        }

        return data != null ? data : new byte[0];
    }

    /**
     * Reverses the transfer encoding.
     *
     * @param raw      Raw bytes.
     * @param encoding Transfer encoding.
     * @param charset  Declared charset or null.
     * @return Decoded bytes.
     */
    public static byte[] transferDecode(byte[] raw, TransferEncoding encoding, String charset) {
        if (encoding == null) {
            return raw;
        }

        switch (encoding) {
            case BASE64:
                return decodeBase64(raw);
            case QUOTED_PRINTABLE:
                return decodeQuotedPrintable(raw);
            case EIGHT_BIT:
                return normalizeEightBit(raw, charset);
            default:
                return raw;
        }
    }

    /**
     * Decodes base64 after dropping every byte outside the alphabet.
     *
     * @param raw Raw bytes.
     * @return Decoded bytes.
     */
    static byte[] decodeBase64(byte[] raw) {
        String cleaned = NON_BASE64.matcher(new String(raw, StandardCharsets.ISO_8859_1)).replaceAll("");
        return Base64.decodeBase64(cleaned);
    }

    /**
     * Decodes quoted-printable, falling back to raw bytes on failure.
     *
     * @param raw Raw bytes.
     * @return Decoded bytes.
     */
    static byte[] decodeQuotedPrintable(byte[] raw) {
        try (InputStream stream = MimeUtility.decode(new ByteArrayInputStream(raw), "quoted-printable")) {
            return IOUtils.toByteArray(stream);
        } catch (IOException | MessagingException e) {
            log.warn("Unable to decode quoted-printable content: {}", e.getMessage());
            return raw;
        }
    }

    /**
     * Replaces malformed sequences in 8bit content declared as UTF-8.
     *
     * @param raw     Raw bytes.
     * @param charset Declared charset or null.
     * @return Normalized bytes.
     */
    static byte[] normalizeEightBit(byte[] raw, String charset) {
        Charset declared = StringEncoding.charsetOrNull(charset);
        if (!StandardCharsets.UTF_8.equals(declared)) {
            return raw;
        }
        return new String(raw, StandardCharsets.UTF_8).getBytes(StandardCharsets.UTF_8);
    }
}
