package com.mimecast.mailfetch.imap;

import com.mimecast.mailfetch.exceptions.UnexpectedStructureException;
import com.mimecast.mailfetch.mime.PartDescriptor;
import com.mimecast.mailfetch.mime.PartType;
import com.mimecast.mailfetch.mime.TransferEncoding;
import jakarta.mail.internet.ParameterList;
import org.eclipse.angus.mail.imap.protocol.BODYSTRUCTURE;

import java.util.Enumeration;

/**
 * Maps IMAP BODYSTRUCTURE responses to part descriptors.
 *
 * <p>Required fields are checked here so the assembler can rely on them.
 * <br>A message/rfc822 part carries the embedded message body as its only sub-part.
 */
public class BodyStructureMapper {

    /**
     * Maps a body structure.
     *
     * @param structure BODYSTRUCTURE.
     * @return PartDescriptor instance.
     * @throws UnexpectedStructureException Required field missing.
     */
    public PartDescriptor map(BODYSTRUCTURE structure) {
        return map(structure, "0");
    }

    private PartDescriptor map(BODYSTRUCTURE structure, String section) {
        if (structure == null) {
            throw new UnexpectedStructureException(section, "body structure missing");
        }
        if (structure.type == null) {
            throw new UnexpectedStructureException(section, "type missing");
        }
        if (structure.subtype == null) {
            throw new UnexpectedStructureException(section, "subtype missing");
        }

        PartDescriptor.Builder builder = PartDescriptor.builder()
                .type(PartType.fromName(structure.type))
                .subtype(structure.subtype)
                .encoding(TransferEncoding.fromName(structure.encoding))
                .disposition(structure.disposition)
                .id(structure.id);

        forEach(structure.cParams, section, builder::typeParameter);
        forEach(structure.dParams, section, builder::dispositionParameter);

        if (structure.bodies != null) {
            for (int i = 0; i < structure.bodies.length; i++) {
                builder.part(map(structure.bodies[i], "0".equals(section) ? String.valueOf(i + 1) : section + "." + (i + 1)));
            }
        }

        return builder.build();
    }

    private void forEach(ParameterList list, String section, ParameterConsumer consumer) {
        if (list == null) {
            return;
        }
        Enumeration<String> names = list.getNames();
        while (names.hasMoreElements()) {
            String name = names.nextElement();
            if (name == null || name.isBlank()) {
                throw new UnexpectedStructureException(section, "parameter without attribute name");
            }
            consumer.accept(name, list.get(name));
        }
    }

    @FunctionalInterface
    private interface ParameterConsumer {
        void accept(String attribute, String value);
    }
}
