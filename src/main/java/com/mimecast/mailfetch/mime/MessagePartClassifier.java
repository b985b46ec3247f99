package com.mimecast.mailfetch.mime;

import com.mimecast.mailfetch.imap.MailStore;
import com.mimecast.mailfetch.mail.DataPart;
import com.mimecast.mailfetch.mail.IncomingMessage;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.List;

/**
 * Decides for each part whether it is body text, an attachment or a container to descend into.
 *
 * <p>Rules applied per part:
 * <ol>
 *     <li>A part with a filename or name parameter is an attachment,
 *     except a text part addressed as the whole message.</li>
 *     <li>A message/rfc822 attachment is also added as a single .eml attachment.</li>
 *     <li>Inside a message/rfc822 attachment every non multipart part is an attachment.</li>
 *     <li>With attachments ignored, anything but containers and plain/html text is skipped with its descendants.</li>
 *     <li>Children of inline message/rfc822 and multipart/alternative share the parent key,
 *     other children extend it with their 1 based index.</li>
 *     <li>Leaves that are not attachments become body text:
 *     text/plain and bare messages as plain, other text not dispositioned as attachment as HTML.</li>
 * </ol>
 * <p>Behaviour depends only on the part tree and the {@link TraversalContext}.
 */
public class MessagePartClassifier {
    private static final Logger log = LogManager.getLogger(MessagePartClassifier.class);

    private final MailStore store;
    private final AttachmentBuilder attachmentBuilder;

    /**
     * Constructs a new MessagePartClassifier instance.
     *
     * @param store MailStore content is fetched from.
     */
    public MessagePartClassifier(MailStore store) {
        this(store, new AttachmentBuilder());
    }

    /**
     * Constructs a new MessagePartClassifier instance with given attachment builder.
     *
     * @param store             MailStore content is fetched from.
     * @param attachmentBuilder AttachmentBuilder.
     */
    public MessagePartClassifier(MailStore store, AttachmentBuilder attachmentBuilder) {
        this.store = store;
        this.attachmentBuilder = attachmentBuilder;
    }

    /**
     * Classifies a part and its descendants into the message.
     *
     * @param message IncomingMessage to populate.
     * @param part    PartDescriptor.
     * @param context TraversalContext addressing the part.
     */
    public void classify(IncomingMessage message, PartDescriptor part, TraversalContext context) {
        classify(message, part, context, false);
    }

    /**
     * Classifies one linearized part.
     * <p>Parts that were containers before linearization never become body text.
     *
     * @param message IncomingMessage to populate.
     * @param part    FlattenedPart.
     * @param context TraversalContext addressing the part.
     */
    public void classify(IncomingMessage message, FlattenedPart part, TraversalContext context) {
        classify(message, part.descriptor(), context, part.container());
    }

    private void classify(IncomingMessage message, PartDescriptor part, TraversalContext context, boolean structural) {
        AssemblyOptions options = context.getOptions();
        PartParameters params = PartParameters.resolve(part);

        boolean isAttachment = params.isNamed();
        if (context.isRoot() && part.getType() == PartType.TEXT) {
            isAttachment = false;
        }
        if (isAttachment) {
            message.setHasAttachments(true);
        }

        if (part.isEmbeddedMessageAttachment()) {
            log.debug("Adding {} as embedded message", context);
            message.addAttachment(attachmentBuilder.build(part, params, context.getMessageId(),
                    newDataPart(part, context), false, options));
        }

        if (context.isEmlParse()) {
            isAttachment = true;
        }

        if (options.isIgnoreAttachments() && part.getType() != PartType.MULTIPART && !isBodyText(part)) {
            log.debug("Skipping {} {} as attachments are ignored", context, part);
            return;
        }

        DataPart dataPart = newDataPart(part, context);
        if (isAttachment) {
            log.debug("Adding {} {} as attachment", context, part);
            message.addAttachment(attachmentBuilder.build(part, params, context.getMessageId(),
                    dataPart, context.isEmlParse(), options));
        } else {
            params.getNonBlank(PartParameters.Kind.CHARSET).ifPresent(dataPart::setCharset);
        }

        if (part.isContainer()) {
            List<PartDescriptor> children = part.getParts();
            for (int i = 0; i < children.size(); i++) {
                classify(message, children.get(i), childContext(part, context, i + 1), false);
            }
        } else if (!isAttachment && !structural) {
            assignBody(message, part, dataPart, context);
        }
    }

    /**
     * Selects the context a child is walked with.
     *
     * @param parent  Parent part.
     * @param context Parent context.
     * @param index   1 based child index.
     * @return TraversalContext instance.
     */
    TraversalContext childContext(PartDescriptor parent, TraversalContext context, int index) {
        boolean inline = !parent.isDispositionAttachment();
        if (inline && parent.getType() == PartType.MESSAGE && parent.isSubtype("RFC822")) {
            return context;
        }
        if (inline && parent.getType() == PartType.MULTIPART && parent.isSubtype("ALTERNATIVE")) {
            return context;
        }
        if (parent.isEmbeddedMessageAttachment()) {
            return context.child(index).withEmlParse(true);
        }
        return context.child(index);
    }

    /**
     * Assigns a leaf to a body slot.
     */
    private void assignBody(IncomingMessage message, PartDescriptor part, DataPart dataPart, TraversalContext context) {
        if (part.getType() == PartType.TEXT) {
            if (part.isSubtype("PLAIN")) {
                log.debug("Adding {} as plain text body", context);
                message.addDataPart(dataPart, IncomingMessage.BodyType.TEXT_PLAIN);
            } else if (!part.isDispositionAttachment()) {
                log.debug("Adding {} as HTML body", context);
                message.addDataPart(dataPart, IncomingMessage.BodyType.TEXT_HTML);
            }
        } else if (part.getType() == PartType.MESSAGE) {
            log.debug("Adding {} bare message as plain text body", context);
            message.addDataPart(dataPart, IncomingMessage.BodyType.TEXT_PLAIN);
        }
    }

    private static boolean isBodyText(PartDescriptor part) {
        return part.getType() == PartType.TEXT && (part.isSubtype("PLAIN") || part.isSubtype("HTML"));
    }

    private DataPart newDataPart(PartDescriptor part, TraversalContext context) {
        return new DataPart(store, context.getMessageId(), context.getKey(), part.getEncoding(),
                !context.isMarkAsSeen(), context.getOptions().getServerEncoding());
    }
}
