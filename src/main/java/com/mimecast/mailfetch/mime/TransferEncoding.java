package com.mimecast.mailfetch.mime;

import java.util.Locale;

/**
 * Content transfer encoding of a part.
 */
public enum TransferEncoding {
    SEVEN_BIT(0, "7bit"),
    EIGHT_BIT(1, "8bit"),
    BINARY(2, "binary"),
    BASE64(3, "base64"),
    QUOTED_PRINTABLE(4, "quoted-printable"),
    OTHER(5, "other");

    private final int code;
    private final String headerValue;

    TransferEncoding(int code, String headerValue) {
        this.code = code;
        this.headerValue = headerValue;
    }

    public int getCode() {
        return code;
    }

    public String getHeaderValue() {
        return headerValue;
    }

    /**
     * Resolves a Content-Transfer-Encoding value.
     *
     * @param name Header value, may be null.
     * @return TransferEncoding, SEVEN_BIT when absent and OTHER when unknown.
     */
    public static TransferEncoding fromName(String name) {
        if (name == null || name.isBlank()) {
            return SEVEN_BIT;
        }
        String value = name.trim().toLowerCase(Locale.ROOT);
        for (TransferEncoding encoding : values()) {
            if (encoding.headerValue.equals(value)) {
                return encoding;
            }
        }
        return OTHER;
    }
}
