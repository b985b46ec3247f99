package com.mimecast.mailfetch.imap;

import com.mimecast.mailfetch.exceptions.InvalidParameterException;
import com.mimecast.mailfetch.mail.IncomingMessage;
import com.mimecast.mailfetch.mail.IncomingMessageHeader;
import jakarta.mail.MessagingException;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.*;

class IncomingMessagePagesTest {

    private final List<Long> loaded = new ArrayList<>();

    private IncomingMessage load(long id, boolean markAsSeen) {
        loaded.add(id);
        return new IncomingMessage().setHeader(new IncomingMessageHeader().setId(id));
    }

    @Test
    void pages() throws MessagingException {
        IncomingMessagePages pages = new IncomingMessagePages(List.of(11L, 12L, 13L, 14L, 15L), 2, false, this::load);

        assertEquals(3, pages.count());
        assertEquals(5, pages.countMailIds());
        assertEquals(List.of(11L, 12L), pages.page().getIds());
        assertTrue(loaded.isEmpty());

        assertTrue(pages.hasNext());
        IncomingMessagePages.Page last = pages.next().next().page();
        assertEquals(2, last.getIndex());
        assertEquals(List.of(15L), last.getIds());
        assertFalse(pages.hasNext());

        assertEquals(15L, last.get(0).getId());
        assertEquals(List.of(15L), loaded);

        List<IncomingMessage> messages = pages.page(1).getMessages();
        assertEquals(2, messages.size());
        assertEquals(List.of(15L, 13L, 14L), loaded);
    }

    @Test
    void bounds() {
        IncomingMessagePages pages = new IncomingMessagePages(List.of(1L, 2L, 3L), 3, false, this::load);

        assertEquals(1, pages.count());
        assertThrows(InvalidParameterException.class, () -> pages.seek(-1));
        assertThrows(IndexOutOfBoundsException.class, () -> pages.seek(1));
        assertThrows(IndexOutOfBoundsException.class, pages::next);
    }

    @Test
    void empty() {
        IncomingMessagePages pages = new IncomingMessagePages(List.of(), 10, false, this::load);

        assertEquals(0, pages.count());
        assertThrows(IndexOutOfBoundsException.class, pages::page);
    }

    @Test
    void pageSize() {
        assertThrows(InvalidParameterException.class, () -> new IncomingMessagePages(List.of(1L), 0, false, this::load));
        assertThrows(InvalidParameterException.class, () -> new SearchPagination(mock(ImapMailbox.class), 0, false));
    }

    @Test
    void searchPagination() throws MessagingException {
        ImapMailbox mailbox = mock(ImapMailbox.class);
        when(mailbox.searchMailboxFrom("UNSEEN", "a@example.com", "B@example.com")).thenReturn(List.of(3L, 1L, 2L));
        when(mailbox.getMail(anyLong(), anyBoolean())).thenAnswer(invocation ->
                load(invocation.getArgument(0), invocation.getArgument(1)));

        IncomingMessagePages pages = new SearchPagination(mailbox, 2, true)
                .searchMailboxFrom("UNSEEN", "a@example.com", "B@example.com");

        assertEquals(2, pages.count());
        assertEquals(3L, pages.page().get(0).getId());
        verify(mailbox).getMail(3L, true);
        verify(mailbox, never()).getMail(1L, true);
    }
}
