package com.mimecast.mailfetch.imap;

import java.util.Date;

/**
 * Envelope level message summary.
 *
 * @param id        Message id, UID or sequence number.
 * @param subject   Subject.
 * @param from      From header.
 * @param to        To header.
 * @param date      Sent date, may be null.
 * @param messageId Message-ID header.
 * @param size      Size in bytes.
 * @param seen      Seen flag.
 * @param answered  Answered flag.
 * @param flagged   Flagged flag.
 * @param deleted   Deleted flag.
 * @param draft     Draft flag.
 * @param recent    Recent flag.
 */
public record MailOverview(long id, String subject, String from, String to, Date date, String messageId, int size,
                           boolean seen, boolean answered, boolean flagged, boolean deleted, boolean draft,
                           boolean recent) {
}
