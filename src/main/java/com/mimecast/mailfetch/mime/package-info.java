/**
 * MIME structure walking.
 *
 * <p>This package turns a server reported part tree into an {@link com.mimecast.mailfetch.mail.IncomingMessage}:
 * <ul>
 *   <li>{@link com.mimecast.mailfetch.mime.PartFlattener} - Linearizes the tree into positional keys</li>
 *   <li>{@link com.mimecast.mailfetch.mime.PartParameters} - Resolves type and disposition parameters</li>
 *   <li>{@link com.mimecast.mailfetch.mime.MessagePartClassifier} - Sorts parts into body text, attachments and containers</li>
 *   <li>{@link com.mimecast.mailfetch.mime.AttachmentBuilder} - Names, identifies and optionally stores attachments</li>
 *   <li>{@link com.mimecast.mailfetch.mime.DataPartDecoder} - Reverses transfer encodings and converts charsets</li>
 *   <li>{@link com.mimecast.mailfetch.mime.MessageAssembler} - Drives the above for one message</li>
 * </ul>
 */
package com.mimecast.mailfetch.mime;
