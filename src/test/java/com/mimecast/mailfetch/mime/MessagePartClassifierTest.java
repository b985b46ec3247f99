package com.mimecast.mailfetch.mime;

import com.mimecast.mailfetch.imap.MailStoreMock;
import com.mimecast.mailfetch.mail.Attachment;
import com.mimecast.mailfetch.mail.IncomingMessage;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class MessagePartClassifierTest {

    private final MailStoreMock store = new MailStoreMock();
    private final MessagePartClassifier classifier = new MessagePartClassifier(store);

    private IncomingMessage classify(PartDescriptor root, AssemblyOptions options) {
        IncomingMessage message = new IncomingMessage();
        classifier.classify(message, root, TraversalContext.root(3, false, options));
        return message;
    }

    private static List<String> names(IncomingMessage message) {
        return message.getAttachments().stream().map(Attachment::getName).collect(Collectors.toList());
    }

    @Test
    @DisplayName("Alternative branches share the parent key")
    void alternativeAddressing() {
        PartDescriptor root = Parts.multipart("mixed",
                Parts.multipart("alternative", Parts.plain(), Parts.html()),
                Parts.file(PartType.APPLICATION, "pdf", "a.pdf"));

        IncomingMessage message = classify(root, AssemblyOptions.defaults());

        assertEquals("1", message.getDataParts(IncomingMessage.BodyType.TEXT_PLAIN).get(0).getSection());
        assertEquals("1", message.getDataParts(IncomingMessage.BodyType.TEXT_HTML).get(0).getSection());
        assertEquals(List.of("a.pdf"), names(message));
        assertEquals("2", message.getAttachments().get(0).getDataPart().getSection());
    }

    @Test
    @DisplayName("Inline message/rfc822 shares the parent key")
    void inlineMessageAddressing() {
        PartDescriptor root = Parts.multipart("mixed",
                Parts.plain(),
                Parts.rfc822("inline", Parts.multipart("mixed", Parts.plain(), Parts.html())));

        IncomingMessage message = classify(root, AssemblyOptions.defaults());

        List<String> sections = message.getDataParts(IncomingMessage.BodyType.TEXT_PLAIN).stream()
                .map(part -> part.getSection())
                .collect(Collectors.toList());
        assertEquals(List.of("1", "2.1"), sections);
        assertEquals("2.2", message.getDataParts(IncomingMessage.BodyType.TEXT_HTML).get(0).getSection());
        assertFalse(message.hasAttachments());
    }

    @Test
    @DisplayName("Embedded message attachment is kept whole and split into parts")
    void embeddedMessage() {
        PartDescriptor root = Parts.multipart("mixed",
                Parts.plain(),
                Parts.rfc822("attachment", Parts.multipart("mixed",
                        Parts.plain(),
                        Parts.file(PartType.IMAGE, "png", "b.png"))));

        IncomingMessage message = classify(root, AssemblyOptions.defaults());

        assertEquals(List.of("rfc822.eml", "mixed", "plain", "b.png"), names(message));
        assertFalse(message.getAttachments().get(0).isEmlOrigin());
        assertTrue(message.getAttachments().get(1).isEmlOrigin());
        assertEquals("2", message.getAttachments().get(0).getDataPart().getSection());
        assertEquals("2.1", message.getAttachments().get(1).getDataPart().getSection());
        assertEquals("2.1.1", message.getAttachments().get(2).getDataPart().getSection());
        assertEquals("2.1.2", message.getAttachments().get(3).getDataPart().getSection());
        assertEquals(1, message.getDataParts(IncomingMessage.BodyType.TEXT_PLAIN).size());
    }

    @Test
    @DisplayName("Alternative inside an embedded message is attached as eml")
    void embeddedAlternative() {
        PartDescriptor root = Parts.multipart("mixed",
                Parts.plain(),
                Parts.rfc822("attachment", Parts.multipart("alternative", Parts.plain(), Parts.html())));

        IncomingMessage message = classify(root, AssemblyOptions.defaults());

        assertEquals(List.of("rfc822.eml", "alternative.eml", "plain", "html"), names(message));
        assertTrue(message.getAttachments().get(1).isEmlOrigin());
        assertEquals("2.1", message.getAttachments().get(1).getDataPart().getSection());
        assertEquals("2.1", message.getAttachments().get(3).getDataPart().getSection());
        assertFalse(message.hasBody(IncomingMessage.BodyType.TEXT_HTML));
    }

    @Test
    void ignoreAttachments() {
        PartDescriptor root = Parts.multipart("mixed",
                Parts.plain(),
                Parts.file(PartType.APPLICATION, "pdf", "a.pdf"),
                Parts.leaf(PartType.IMAGE, "png").build());

        IncomingMessage message = classify(root, new AssemblyOptions("UTF-8", true, null));

        assertTrue(message.getAttachments().isEmpty());
        assertTrue(message.hasAttachments());
        assertTrue(message.hasBody(IncomingMessage.BodyType.TEXT_PLAIN));
    }

    @Test
    @DisplayName("Whole message plain text is never an attachment")
    void rootTextNamed() throws Exception {
        store.addBody(3, "0", "body");
        PartDescriptor root = Parts.leaf(PartType.TEXT, "plain").typeParameter("name", "body.txt").build();

        IncomingMessage message = classify(root, AssemblyOptions.defaults());

        assertFalse(message.hasAttachments());
        assertEquals("body", message.getTextPlain());
        assertEquals("0", message.getDataParts(IncomingMessage.BodyType.TEXT_PLAIN).get(0).getSection());
    }

    @Test
    void rootNonTextNamed() {
        IncomingMessage message = classify(Parts.file(PartType.APPLICATION, "pdf", "a.pdf"), AssemblyOptions.defaults());

        assertEquals(List.of("a.pdf"), names(message));
        assertEquals("0", message.getAttachments().get(0).getDataPart().getSection());
    }

    @Test
    @DisplayName("Unnamed text dispositioned as attachment is neither body nor attachment")
    void textAttachmentDisposition() {
        PartDescriptor root = Parts.multipart("mixed",
                Parts.leaf(PartType.TEXT, "html").disposition("attachment").build());

        IncomingMessage message = classify(root, AssemblyOptions.defaults());

        assertFalse(message.hasBody(IncomingMessage.BodyType.TEXT_HTML));
        assertTrue(message.getAttachments().isEmpty());
    }

    @Test
    void otherTextIsHtml() {
        IncomingMessage message = classify(Parts.multipart("mixed",
                Parts.leaf(PartType.TEXT, "enriched").build()), AssemblyOptions.defaults());

        assertTrue(message.hasBody(IncomingMessage.BodyType.TEXT_HTML));
    }

    @Test
    void bareMessage() {
        IncomingMessage message = classify(Parts.multipart("mixed",
                Parts.leaf(PartType.MESSAGE, "delivery-status").build()), AssemblyOptions.defaults());

        assertTrue(message.hasBody(IncomingMessage.BodyType.TEXT_PLAIN));
    }

    @Test
    void charsetStamped() throws Exception {
        store.addBody(3, "1", "café");
        PartDescriptor root = Parts.multipart("mixed",
                Parts.leaf(PartType.TEXT, "plain").typeParameter("charset", "ISO-8859-1").build());

        IncomingMessage message = classify(root, AssemblyOptions.defaults());

        assertEquals("ISO-8859-1", message.getDataParts(IncomingMessage.BodyType.TEXT_PLAIN).get(0).getCharset());
        assertEquals("café", message.getTextPlain());
    }

    @Test
    void childContext() {
        TraversalContext root = TraversalContext.root(3, false, AssemblyOptions.defaults());
        TraversalContext nested = root.child(2);

        assertEquals("2", nested.getKey());
        assertSame(nested, classifier.childContext(Parts.multipart("alternative", Parts.plain()), nested, 1));
        assertEquals("2.1", classifier.childContext(Parts.multipart("mixed", Parts.plain()), nested, 1).getKey());

        TraversalContext embedded = classifier.childContext(Parts.rfc822("attachment", Parts.plain()), nested, 1);
        assertEquals("2.1", embedded.getKey());
        assertTrue(embedded.isEmlParse());

        PartDescriptor alternativeAttachment = Parts.leaf(PartType.MULTIPART, "alternative")
                .disposition("attachment")
                .part(Parts.plain())
                .build();
        assertEquals("2.1", classifier.childContext(alternativeAttachment, nested, 1).getKey());
    }
}
