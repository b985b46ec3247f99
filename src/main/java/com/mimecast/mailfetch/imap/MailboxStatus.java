package com.mimecast.mailfetch.imap;

/**
 * Mailbox status counters.
 *
 * @param messages    Message count.
 * @param recent      Recent message count.
 * @param unseen      Unseen message count.
 * @param uidNext     Next UID.
 * @param uidValidity UID validity.
 */
public record MailboxStatus(int messages, int recent, int unseen, long uidNext, long uidValidity) {
}
