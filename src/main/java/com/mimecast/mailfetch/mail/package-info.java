/**
 * Assembled message model.
 *
 * <p>{@link com.mimecast.mailfetch.mail.IncomingMessage} holds the parsed header, body parts and attachments.
 * <br>Content is fetched lazily through {@link com.mimecast.mailfetch.mail.DataPart} handles and memoized.
 */
package com.mimecast.mailfetch.mail;
