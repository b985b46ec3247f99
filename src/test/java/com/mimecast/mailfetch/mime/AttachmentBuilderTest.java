package com.mimecast.mailfetch.mime;

import com.mimecast.mailfetch.imap.MailStoreMock;
import com.mimecast.mailfetch.mail.Attachment;
import com.mimecast.mailfetch.mail.DataPart;
import com.mimecast.mailfetch.storage.AttachmentStorage;
import com.mimecast.mailfetch.storage.LocalAttachmentStorage;
import org.apache.commons.codec.digest.DigestUtils;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class AttachmentBuilderTest {

    private final AttachmentBuilder builder = new AttachmentBuilder();
    private final MailStoreMock store = new MailStoreMock().addBody(7, "2", "aGVsbG8=");

    private DataPart dataPart() {
        return new DataPart(store, 7, "2", TransferEncoding.BASE64, true, "UTF-8");
    }

    private Attachment build(PartDescriptor part, AssemblyOptions options) {
        return builder.build(part, PartParameters.resolve(part), 7, dataPart(), false, options);
    }

    @Test
    void build() throws Exception {
        PartDescriptor part = Parts.leaf(PartType.APPLICATION, "octet-stream")
                .encoding(TransferEncoding.BASE64)
                .disposition("attachment")
                .id("<part1@example.com>")
                .dispositionParameter("filename", "notes.txt")
                .typeParameter("charset", "us-ascii")
                .build();

        Attachment attachment = build(part, AssemblyOptions.defaults());

        assertEquals("notes.txt", attachment.getName());
        assertEquals(DigestUtils.sha1Hex("notes.txt<part1@example.com>"), attachment.getId());
        assertEquals("part1@example.com", attachment.getContentId());
        assertEquals("attachment", attachment.getDisposition());
        assertEquals("us-ascii", attachment.getCharset());
        assertEquals("application/octet-stream", attachment.getMimeType());
        assertFalse(attachment.isEmlOrigin());
        assertTrue(attachment.getFilePath().isEmpty());
        assertEquals("hello", new String(attachment.getContents(), StandardCharsets.UTF_8));
    }

    @Test
    @DisplayName("Identity is stable across builds")
    void stableId() {
        PartDescriptor part = Parts.file(PartType.IMAGE, "png", "logo.png");

        assertEquals(build(part, AssemblyOptions.defaults()).getId(), build(part, AssemblyOptions.defaults()).getId());
        assertEquals(DigestUtils.sha1Hex("logo.png"), build(part, AssemblyOptions.defaults()).getId());
    }

    @Test
    void names() {
        assertEquals("rfc822.eml", builder.resolveName(Parts.rfc822("attachment", Parts.plain()),
                PartParameters.resolve(Parts.rfc822("attachment", Parts.plain()))));

        PartDescriptor alternative = Parts.multipart("alternative", Parts.plain(), Parts.html());
        assertEquals("alternative.eml", builder.resolveName(alternative, PartParameters.resolve(alternative)));

        PartDescriptor unnamed = Parts.leaf(PartType.IMAGE, "JPEG").build();
        assertEquals("jpeg", builder.resolveName(unnamed, PartParameters.resolve(unnamed)));

        PartDescriptor both = Parts.leaf(PartType.APPLICATION, "pdf")
                .typeParameter("name", "name.pdf")
                .dispositionParameter("filename", "filename.pdf")
                .build();
        assertEquals("filename.pdf", builder.resolveName(both, PartParameters.resolve(both)));

        PartDescriptor nameOnly = Parts.leaf(PartType.APPLICATION, "pdf").typeParameter("name", "name.pdf").build();
        assertEquals("name.pdf", builder.resolveName(nameOnly, PartParameters.resolve(nameOnly)));
    }

    @Test
    void rfc2231Names() {
        PartDescriptor part = Parts.leaf(PartType.APPLICATION, "octet-stream")
                .disposition("attachment")
                .dispositionParameter("filename*0*", "UTF-8''na%C3%AF")
                .dispositionParameter("filename*1*", "ve.txt")
                .build();
        assertEquals("naïve.txt", builder.resolveName(part, PartParameters.resolve(part)));

        PartDescriptor apostrophes = Parts.file(PartType.APPLICATION, "pdf", "John's 'draft'.pdf");
        assertEquals("John's 'draft'.pdf", builder.resolveName(apostrophes, PartParameters.resolve(apostrophes)));

        PartDescriptor mime = Parts.file(PartType.APPLICATION, "pdf", "=?UTF-8?Q?R=C3=A9sum=C3=A9.pdf?=");
        assertEquals("Résumé.pdf", builder.resolveName(mime, PartParameters.resolve(mime)));
    }

    @Test
    @DisplayName("Stored files get a sanitized generated name")
    void saved(@TempDir Path dir) throws IOException {
        AssemblyOptions options = new AssemblyOptions("UTF-8", false, new LocalAttachmentStorage(dir.toString()));
        PartDescriptor part = Parts.file(PartType.APPLICATION, "pdf", "../../etc/my report (final).pdf");

        Attachment attachment = build(part, options);

        Path path = attachment.getFilePath().orElseThrow();
        assertEquals(dir, path.getParent());
        assertEquals("7_" + attachment.getId() + "_....etcmy_report_final.pdf", path.getFileName().toString());
        assertEquals("hello", Files.readString(path));
    }

    @Test
    @DisplayName("Failed save keeps the path and can be retried")
    void storageFailure() throws IOException {
        AttachmentStorage storage = mock(AttachmentStorage.class);
        when(storage.resolve(any())).thenAnswer(invocation -> Paths.get("/attachments", invocation.getArgument(0, String.class)));
        doThrow(new IOException("disk full")).doNothing().when(storage).save(any(), any());

        Attachment attachment = build(Parts.file(PartType.IMAGE, "png", "a.png"), new AssemblyOptions("UTF-8", false, storage));
        Path expected = Paths.get("/attachments", "7_" + attachment.getId() + "_a.png");

        verify(storage).save(eq(expected), any());
        assertEquals(expected, attachment.getFilePath().orElse(null));

        assertTrue(attachment.saveToDisk());
        verify(storage, times(2)).save(eq(expected), any());
        assertEquals(expected, attachment.getFilePath().orElse(null));
    }

    @Test
    void fileSystemName() {
        assertEquals("1_abc_my_file.txt", AttachmentBuilder.fileSystemName(1, "abc", "  my   file.txt "));
        assertEquals("1_abc_résumé.pdf", AttachmentBuilder.fileSystemName(1, "abc", "résumé.pdf"));
        assertEquals("1_abc_etcpasswd", AttachmentBuilder.fileSystemName(1, "abc", "/etc/passwd"));
    }

    @Test
    void truncate() {
        String longName = "a".repeat(300);

        Path withExtension = AttachmentBuilder.truncate(Paths.get("/tmp/" + longName + ".pdf"));
        assertEquals(AttachmentBuilder.MAX_PATH_LENGTH, withExtension.toString().length());
        assertTrue(withExtension.toString().endsWith("a.pdf"));

        Path withoutExtension = AttachmentBuilder.truncate(Paths.get("/tmp/" + longName));
        assertEquals(AttachmentBuilder.MAX_PATH_LENGTH, withoutExtension.toString().length());

        Path shortPath = Paths.get("/tmp/a.pdf");
        assertSame(shortPath, AttachmentBuilder.truncate(shortPath));
    }
}
