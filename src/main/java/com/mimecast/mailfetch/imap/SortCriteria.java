package com.mimecast.mailfetch.imap;

import org.eclipse.angus.mail.imap.SortTerm;

/**
 * Sort keys supported by the mailbox.
 */
public enum SortCriteria {
    ARRIVAL(SortTerm.ARRIVAL),
    DATE(SortTerm.DATE),
    FROM(SortTerm.FROM),
    SUBJECT(SortTerm.SUBJECT),
    TO(SortTerm.TO),
    CC(SortTerm.CC),
    SIZE(SortTerm.SIZE);

    private final SortTerm term;

    SortCriteria(SortTerm term) {
        this.term = term;
    }

    /**
     * Gets the IMAP sort term.
     *
     * @return SortTerm instance.
     */
    public SortTerm getTerm() {
        return term;
    }
}
