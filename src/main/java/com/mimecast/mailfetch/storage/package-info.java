/**
 * Attachment persistence.
 *
 * <p>The assembler only hands storage a generated file name and the fetched bytes.
 * <br>{@link com.mimecast.mailfetch.storage.LocalAttachmentStorage} writes them under a configured directory.
 */
package com.mimecast.mailfetch.storage;
