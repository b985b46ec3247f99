package com.mimecast.mailfetch.mime;

/**
 * Positional key paired with a linearized part.
 *
 * @param key        Dotted positional key, for example "2.1".
 * @param descriptor Part with its sub-parts removed.
 * @param container  Whether the part had sub-parts before linearization.
 * @param embedded   Whether the part sits below a message/rfc822 attachment.
 */
public record FlattenedPart(String key, PartDescriptor descriptor, boolean container, boolean embedded) {
}
