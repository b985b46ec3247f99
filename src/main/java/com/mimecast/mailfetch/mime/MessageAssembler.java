package com.mimecast.mailfetch.mime;

import com.mimecast.mailfetch.exceptions.InvalidParameterException;
import com.mimecast.mailfetch.imap.MailStore;
import com.mimecast.mailfetch.mail.IncomingMessage;
import com.mimecast.mailfetch.mime.headers.HeaderParser;
import jakarta.mail.MessagingException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Map;

/**
 * Assembles a message from its header and body structure.
 *
 * <p>Single part messages are classified as one part addressed "0".
 * <br>Multipart messages are linearized by {@link PartFlattener} and each entry is classified on its own key.
 * <p>Assembly is sequential and fills the message as it goes,
 * so parts classified before a store error remain on the message.
 */
public class MessageAssembler {
    private static final Logger log = LogManager.getLogger(MessageAssembler.class);

    private final MailStore store;
    private final AssemblyOptions options;
    private final HeaderParser headerParser;
    private final PartFlattener flattener;
    private final MessagePartClassifier classifier;

    /**
     * Constructs a new MessageAssembler instance.
     *
     * @param store   MailStore.
     * @param options AssemblyOptions.
     */
    public MessageAssembler(MailStore store, AssemblyOptions options) {
        this(store, options, new HeaderParser(), new PartFlattener(), new MessagePartClassifier(store));
    }

    /**
     * Constructs a new MessageAssembler instance with given collaborators.
     *
     * @param store        MailStore.
     * @param options      AssemblyOptions.
     * @param headerParser HeaderParser.
     * @param flattener    PartFlattener.
     * @param classifier   MessagePartClassifier.
     */
    public MessageAssembler(MailStore store, AssemblyOptions options, HeaderParser headerParser,
                            PartFlattener flattener, MessagePartClassifier classifier) {
        this.store = store;
        this.options = options;
        this.headerParser = headerParser;
        this.flattener = flattener;
        this.classifier = classifier;
    }

    /**
     * Assembles a message.
     *
     * @param messageId  Message id.
     * @param markAsSeen Whether fetching content may set the seen flag.
     * @return IncomingMessage instance.
     * @throws MessagingException Store error.
     */
    public IncomingMessage assembleMessage(long messageId, boolean markAsSeen) throws MessagingException {
        if (messageId < 1) {
            throw new InvalidParameterException("Message id must be positive, got " + messageId);
        }

        IncomingMessage message = new IncomingMessage();
        message.setHeader(headerParser.parse(messageId, store.fetchHeader(messageId)));

        PartDescriptor structure = store.fetchStructure(messageId);
        TraversalContext root = TraversalContext.root(messageId, markAsSeen, options);

        if (!structure.isContainer()) {
            log.debug("Assembling message {} as single part {}", messageId, structure);
            classifier.classify(message, structure, root);
        } else {
            Map<String, FlattenedPart> parts = flattener.flatten(structure.getParts());
            log.debug("Assembling message {} from {} parts", messageId, parts.size());
            for (FlattenedPart part : parts.values()) {
                classifier.classify(message, part, root.withKey(part.key()).withEmlParse(part.embedded()));
            }
        }

        return message;
    }
}
