/**
 * String encoding and date utilities.
 *
 * <p>{@link com.mimecast.mailfetch.util.StringEncoding} provides best effort charset conversion,
 * <br>RFC 2047 encoded-word decoding, RFC 2231 value decoding and the modified UTF-7 used for IMAP mailbox names.
 *
 * <p>{@link com.mimecast.mailfetch.util.DateTimes} parses RFC 5322 dates into RFC 3339 strings.
 */
package com.mimecast.mailfetch.util;
