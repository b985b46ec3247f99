/**
 * IMAP mailbox access.
 *
 * <p>{@link com.mimecast.mailfetch.imap.ImapMailbox} is the Jakarta Mail backed mailbox client.
 * <br>It also implements {@link com.mimecast.mailfetch.imap.MailStore}, the narrow contract message assembly reads through.
 * <p>Search criteria strings are parsed by {@link com.mimecast.mailfetch.imap.SearchCriteria}
 * <br>and results can be paged with {@link com.mimecast.mailfetch.imap.SearchPagination}.
 */
package com.mimecast.mailfetch.imap;
