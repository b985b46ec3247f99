package com.mimecast.mailfetch.imap;

import com.mimecast.mailfetch.exceptions.InvalidParameterException;
import jakarta.mail.MessagingException;

import java.util.List;

/**
 * Runs mailbox searches and pages the results.
 */
public class SearchPagination {

    private final ImapMailbox mailbox;
    private final int pageSize;
    private final boolean markAsSeen;

    /**
     * Constructs a new SearchPagination instance.
     *
     * @param mailbox    ImapMailbox instance.
     * @param pageSize   Page size.
     * @param markAsSeen Whether loading may set the seen flag.
     * @throws InvalidParameterException Page size below 1.
     */
    public SearchPagination(ImapMailbox mailbox, int pageSize, boolean markAsSeen) {
        if (pageSize < 1) {
            throw new InvalidParameterException("Page size must be at least 1, got " + pageSize);
        }
        this.mailbox = mailbox;
        this.pageSize = pageSize;
        this.markAsSeen = markAsSeen;
    }

    /**
     * Searches the mailbox.
     * <p>ALL when criteria is null.
     *
     * @param criteria Criteria string.
     * @return IncomingMessagePages instance.
     * @throws MessagingException Store error.
     */
    public IncomingMessagePages searchMailbox(String criteria) throws MessagingException {
        return pages(mailbox.searchMailbox(criteria == null ? "ALL" : criteria));
    }

    /**
     * Searches messages from any of the given senders.
     *
     * @param criteria Base criteria string.
     * @param sender   Sender address.
     * @param senders  More sender addresses.
     * @return IncomingMessagePages instance.
     * @throws MessagingException Store error.
     */
    public IncomingMessagePages searchMailboxFrom(String criteria, String sender, String... senders) throws MessagingException {
        return pages(mailbox.searchMailboxFrom(criteria, sender, senders));
    }

    /**
     * Runs several searches and pages the merged results.
     *
     * @param criterias Criteria strings.
     * @return IncomingMessagePages instance.
     * @throws MessagingException Store error.
     */
    public IncomingMessagePages searchMailboxMergeResults(String... criterias) throws MessagingException {
        return pages(mailbox.searchMailboxMergeResults(criterias));
    }

    private IncomingMessagePages pages(List<Long> ids) {
        return new IncomingMessagePages(ids, pageSize, markAsSeen, mailbox::getMail);
    }
}
