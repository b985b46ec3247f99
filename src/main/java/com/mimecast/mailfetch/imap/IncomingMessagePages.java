package com.mimecast.mailfetch.imap;

import com.mimecast.mailfetch.exceptions.InvalidParameterException;
import com.mimecast.mailfetch.mail.IncomingMessage;
import jakarta.mail.MessagingException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Paged view over a list of message ids.
 *
 * <p>Messages are only assembled when a page entry is read.
 * <br>The last page may be shorter than the page size.
 */
public class IncomingMessagePages {

    private final List<Long> ids;
    private final int pageSize;
    private final boolean markAsSeen;
    private final Loader loader;

    private int current = 0;

    /**
     * Message loader.
     */
    @FunctionalInterface
    public interface Loader {
        IncomingMessage load(long id, boolean markAsSeen) throws MessagingException;
    }

    /**
     * Constructs a new IncomingMessagePages instance.
     *
     * @param ids        Message ids.
     * @param pageSize   Page size.
     * @param markAsSeen Whether loading may set the seen flag.
     * @param loader     Loader instance.
     * @throws InvalidParameterException Page size below 1.
     */
    public IncomingMessagePages(List<Long> ids, int pageSize, boolean markAsSeen, Loader loader) {
        if (pageSize < 1) {
            throw new InvalidParameterException("Page size must be at least 1, got " + pageSize);
        }
        this.ids = Collections.unmodifiableList(new ArrayList<>(ids));
        this.pageSize = pageSize;
        this.markAsSeen = markAsSeen;
        this.loader = loader;
    }

    /**
     * Gets page count.
     *
     * @return Integer.
     */
    public int count() {
        return (ids.size() + pageSize - 1) / pageSize;
    }

    /**
     * Gets message id count.
     *
     * @return Integer.
     */
    public int countMailIds() {
        return ids.size();
    }

    public int getPageSize() {
        return pageSize;
    }

    /**
     * Gets the current page index.
     *
     * @return Integer.
     */
    public int getCurrent() {
        return current;
    }

    /**
     * Moves to a page.
     *
     * @param page Zero based page index.
     * @return Self.
     * @throws InvalidParameterException Negative index.
     * @throws IndexOutOfBoundsException Index past the last page.
     */
    public IncomingMessagePages seek(int page) {
        if (page < 0) {
            throw new InvalidParameterException("Page must not be negative, got " + page);
        }
        if (page >= count()) {
            throw new IndexOutOfBoundsException("Page " + page + " out of bounds, " + count() + " pages");
        }
        current = page;
        return this;
    }

    /**
     * Whether there is a page after the current one.
     *
     * @return Boolean.
     */
    public boolean hasNext() {
        return current + 1 < count();
    }

    /**
     * Moves to the next page.
     *
     * @return Self.
     * @throws IndexOutOfBoundsException No more pages.
     */
    public IncomingMessagePages next() {
        return seek(current + 1);
    }

    /**
     * Gets the current page.
     *
     * @return Page instance.
     * @throws IndexOutOfBoundsException No pages.
     */
    public Page page() {
        return page(current);
    }

    /**
     * Gets a page.
     *
     * @param page Zero based page index.
     * @return Page instance.
     */
    public Page page(int page) {
        seek(page);
        int from = page * pageSize;
        return new Page(page, ids.subList(from, Math.min(from + pageSize, ids.size())));
    }

    /**
     * Page of lazily loaded messages.
     */
    public class Page {
        private final int index;
        private final List<Long> pageIds;

        private Page(int index, List<Long> pageIds) {
            this.index = index;
            this.pageIds = pageIds;
        }

        public int getIndex() {
            return index;
        }

        public List<Long> getIds() {
            return pageIds;
        }

        public int size() {
            return pageIds.size();
        }

        /**
         * Loads a message on this page.
         *
         * @param position Position within the page.
         * @return IncomingMessage instance.
         * @throws MessagingException Store error.
         */
        public IncomingMessage get(int position) throws MessagingException {
            return loader.load(pageIds.get(position), markAsSeen);
        }

        /**
         * Loads every message on this page.
         *
         * @return List of IncomingMessage.
         * @throws MessagingException Store error.
         */
        public List<IncomingMessage> getMessages() throws MessagingException {
            List<IncomingMessage> messages = new ArrayList<>();
            for (int i = 0; i < pageIds.size(); i++) {
                messages.add(get(i));
            }
            return messages;
        }
    }
}
