package com.mimecast.mailfetch.mime.headers;

import com.mimecast.mailfetch.exceptions.UnexpectedStructureException;
import com.mimecast.mailfetch.mail.IncomingMessageHeader;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class HeaderParserTest {

    private static final String RAW = "Return-Path: <bounce@example.net>\r\n"
            + "Authentication-Results: mx.example.com; spf=pass smtp.mailfrom=bounce@example.net\r\n"
            + "From: =?UTF-8?Q?Tony_St=C3=A4rk?= <Tony@Example.COM>\r\n"
            + "Sender: Pepper <pepper@example.com>\r\n"
            + "To: Jane Doe <jane@example.com>, john@example.com,\r\n"
            + " \"Smith, Bob\" <BOB@example.com>\r\n"
            + "Cc: carol@example.com\r\n"
            + "Reply-To: Support <support@example.com>\r\n"
            + "Subject: =?UTF-8?B?SGVsbG8=?= world\r\n"
            + "Date: Sun, 14 Aug 2005 18:13:03 +0200 (CEST)\r\n"
            + "Message-ID:  <abc@example.com> \r\n"
            + "Importance: High\r\n"
            + "X-Priority: 1\r\n"
            + "Auto-Submitted: auto-replied\r\n"
            + "\r\n";

    private static IncomingMessageHeader header;

    @BeforeAll
    static void before() {
        header = new HeaderParser().parse(42, RAW);
    }

    @Test
    void basics() {
        assertEquals(42, header.getId());
        assertFalse(header.isDraft());
        assertEquals("2005-08-14T16:13:03+00:00", header.getDate());
        assertEquals("Hello world", header.getSubject());
        assertEquals("<abc@example.com>", header.getMessageId());
        assertEquals(RAW, header.getHeadersRaw());
    }

    @Test
    void from() {
        assertEquals("tony@example.com", header.getFromAddress());
        assertEquals("Tony Stärk", header.getFromName());
        assertEquals("Example.COM", header.getFromHost());
        assertEquals("pepper@example.com", header.getSenderAddress());
        assertEquals("Pepper", header.getSenderName());
    }

    @Test
    void recipients() {
        assertEquals(List.of("jane@example.com", "john@example.com", "bob@example.com"), List.copyOf(header.getTo().keySet()));
        assertEquals("Jane Doe", header.getTo().get("jane@example.com"));
        assertNull(header.getTo().get("john@example.com"));
        assertEquals("Smith, Bob", header.getTo().get("bob@example.com"));
        assertEquals("Jane Doe <jane@example.com>, john@example.com, Smith, Bob <bob@example.com>", header.getToString());
        assertTrue(header.getCc().containsKey("carol@example.com"));
        assertTrue(header.getBcc().isEmpty());
        assertEquals("Support", header.getReplyTo().get("support@example.com"));
    }

    @Test
    void extras() {
        assertEquals("High", header.getImportance());
        assertEquals("1", header.getPriority());
        assertEquals("auto-replied", header.getAutoSubmitted());
        assertEquals("", header.getSensitivity());
    }

    @Test
    void draft() {
        IncomingMessageHeader draft = new HeaderParser().parse(1, "Subject: draft\r\n\r\n");

        assertTrue(draft.isDraft());
        assertNotNull(draft.getDate());
        assertNull(draft.getFromAddress());
    }

    @Test
    void mailFromFallback() {
        IncomingMessageHeader parsed = new HeaderParser().parse(1,
                "Authentication-Results: mx; smtp.mailfrom=bounce@example.net\r\nFrom: undisclosed\r\n\r\n");

        assertEquals("bounce@example.net", parsed.getFromAddress());
    }

    @Test
    void unparseableDateKept() {
        IncomingMessageHeader parsed = new HeaderParser().parse(1, "Date: yesterday\r\n\r\n");

        assertEquals("yesterday", parsed.getDate());
        assertFalse(parsed.isDraft());
    }

    @Test
    void missing() {
        assertThrows(UnexpectedStructureException.class, () -> new HeaderParser().parse(1, null));
    }
}
