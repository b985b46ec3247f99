package com.mimecast.mailfetch.imap;

import java.util.List;

/**
 * Mailbox list entry.
 *
 * @param fullPath   Full name including parents.
 * @param shortPath  Name without parents.
 * @param delimiter  Hierarchy delimiter.
 * @param attributes LIST attributes.
 */
public record MailboxListing(String fullPath, String shortPath, char delimiter, List<String> attributes) {
}
