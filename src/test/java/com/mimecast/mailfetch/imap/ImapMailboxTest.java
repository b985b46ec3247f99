package com.mimecast.mailfetch.imap;

import com.mimecast.mailfetch.config.MailboxConfig;
import com.mimecast.mailfetch.exceptions.InvalidParameterException;
import jakarta.mail.Flags;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

class ImapMailboxTest {

    private static MailboxConfig config(int port) {
        Map<String, Object> map = new HashMap<>();
        map.put("host", "imap.example.com");
        map.put("port", port);
        map.put("folder", "Archive");
        return new MailboxConfig(map);
    }

    @Test
    void plainProperties() {
        Properties props = new ImapMailbox(config(143)).buildProperties();

        assertEquals("imap", props.getProperty("mail.store.protocol"));
        assertEquals("imap.example.com", props.getProperty("mail.imap.host"));
        assertEquals("143", props.getProperty("mail.imap.port"));
        assertEquals("false", props.getProperty("mail.imap.ssl.enable"));
        assertEquals("10000", props.getProperty("mail.imap.connectiontimeout"));
        assertNull(props.getProperty("mail.imaps.host"));
    }

    @Test
    void sslProperties() {
        Properties props = new ImapMailbox(config(993)).buildProperties();

        assertEquals("imaps", props.getProperty("mail.store.protocol"));
        assertEquals("true", props.getProperty("mail.imaps.ssl.enable"));
        assertEquals("993", props.getProperty("mail.imaps.port"));
        assertEquals("20000", props.getProperty("mail.imaps.timeout"));
    }

    @Test
    void lazyConnection() {
        ImapMailbox mailbox = new ImapMailbox(config(143));

        assertFalse(mailbox.isConnected());
        assertEquals("Archive", mailbox.getFolderName());
        assertEquals("UTF-8", mailbox.getOptions().getServerEncoding());
        mailbox.close();
    }

    @Test
    void invalidConfig() {
        MailboxConfig config = config(143).setServerEncoding("NOT-A-CHARSET");

        assertThrows(InvalidParameterException.class, () -> new ImapMailbox(config));
    }

    @Test
    void flags() {
        assertTrue(ImapMailbox.flags("\\Seen").contains(Flags.Flag.SEEN));
        assertTrue(ImapMailbox.flags("\\FLAGGED").contains(Flags.Flag.FLAGGED));
        assertTrue(ImapMailbox.flags(" $Label1 ").contains("$Label1"));
        assertEquals(0, ImapMailbox.flags("$Label1").getSystemFlags().length);
        assertThrows(InvalidParameterException.class, () -> ImapMailbox.flags(" "));
    }
}
