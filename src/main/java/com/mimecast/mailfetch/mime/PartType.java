package com.mimecast.mailfetch.mime;

import java.util.Locale;

/**
 * Structural MIME media type of a part.
 * <p>Codes follow the numbering IMAP client libraries traditionally expose.
 */
public enum PartType {
    TEXT(0),
    MULTIPART(1),
    MESSAGE(2),
    APPLICATION(3),
    AUDIO(4),
    IMAGE(5),
    VIDEO(6),
    MODEL(7),
    OTHER(8);

    private final int code;

    PartType(int code) {
        this.code = code;
    }

    public int getCode() {
        return code;
    }

    /**
     * Resolves a media type name such as "text" or "MULTIPART".
     *
     * @param name Media type name.
     * @return PartType, OTHER when unknown.
     */
    public static PartType fromName(String name) {
        if (name == null) {
            return OTHER;
        }
        try {
            return valueOf(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return OTHER;
        }
    }
}
