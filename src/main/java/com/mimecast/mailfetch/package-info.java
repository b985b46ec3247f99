/**
 * IMAP mailbox client assembling messages from their MIME structure.
 *
 * <p>Fetched messages are turned into an {@link com.mimecast.mailfetch.mail.IncomingMessage}
 * <br>with a parsed header, plain and HTML bodies and attachments.
 * <p>{@link com.mimecast.mailfetch.Main} is a small command line front end.
 */
package com.mimecast.mailfetch;
