package com.mimecast.mailfetch.mime;

import com.mimecast.mailfetch.exceptions.UnexpectedStructureException;

/**
 * Content-Type or Content-Disposition parameter as reported by the server.
 *
 * @param attribute Attribute name, never blank.
 * @param value     Raw value, never null.
 */
public record PartParameter(String attribute, String value) {

    public PartParameter {
        if (attribute == null || attribute.isBlank()) {
            throw new UnexpectedStructureException("Parameter without attribute name");
        }
        if (value == null) {
            value = "";
        }
    }
}
