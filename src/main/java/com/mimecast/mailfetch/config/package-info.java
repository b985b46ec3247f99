/**
 * Configuration containers.
 *
 * <p>Configuration is read from JSON5 files into maps and exposed through typed accessors.
 * <br>Nested keys can be addressed with dots, for example <code>timeouts.read</code>.
 *
 * <p>{@link com.mimecast.mailfetch.config.MailboxConfig} holds connection and assembly settings
 * <br>and validates them ahead of any mailbox operation.
 *
 * @see com.mimecast.mailfetch.config.BasicConfig
 * @see com.mimecast.mailfetch.config.ConfigFoundation
 */
package com.mimecast.mailfetch.config;
