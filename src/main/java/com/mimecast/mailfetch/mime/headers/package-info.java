/**
 * Deals with the headers of a fetched message.
 *
 * <p>{@link com.mimecast.mailfetch.mime.headers.HeaderParser} maps a raw header block
 * <br>into an {@link com.mimecast.mailfetch.mail.IncomingMessageHeader}:
 * <br>date, subject, sender, recipients and the common priority style headers.
 */
package com.mimecast.mailfetch.mime.headers;
