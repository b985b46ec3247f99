package com.mimecast.mailfetch;

import com.mimecast.mailfetch.config.MailboxConfig;
import com.mimecast.mailfetch.imap.ImapMailbox;
import com.mimecast.mailfetch.imap.MailboxListing;
import com.mimecast.mailfetch.mail.Attachment;
import com.mimecast.mailfetch.mail.IncomingMessage;
import com.mimecast.mailfetch.mail.IncomingMessageHeader;
import jakarta.mail.MessagingException;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.help.HelpFormatter;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.util.List;
import java.util.Optional;

/**
 * Mailbox CLI tool.
 * <p>Lists folders, searches and fetches assembled messages from an IMAP mailbox.
 */
public class Main {
    private static final Logger log = LogManager.getLogger(Main.class);

    /**
     * Main runnable.
     *
     * @param args String array.
     */
    public static void main(String[] args) {
        new Main(args);
    }

    /**
     * Constructs a new Main instance.
     *
     * @param args String array.
     */
    Main(String[] args) {
        Options options = options();
        Optional<CommandLine> opt = parseArgs(options, args);

        if (opt.isPresent() && opt.get().hasOption("config")) {
            run(opt.get());
        }
        // Show usage.
        else {
            optionsUsage(options);
        }
    }

    /**
     * Runs the selected command.
     *
     * @param cmd CommandLine instance.
     */
    private void run(CommandLine cmd) {
        MailboxConfig config;
        try {
            config = new MailboxConfig(cmd.getOptionValue("config"));
        } catch (IOException e) {
            log("Unable to read config: " + e.getMessage());
            return;
        }
        if (cmd.hasOption("attachments")) {
            config.setAttachmentsDir(cmd.getOptionValue("attachments"));
        }

        try (ImapMailbox mailbox = new ImapMailbox(config)) {
            if (cmd.hasOption("list")) {
                list(mailbox);
            } else if (cmd.hasOption("search")) {
                log(String.valueOf(mailbox.searchMailbox(cmd.getOptionValue("search"))));
            } else if (cmd.hasOption("fetch")) {
                fetch(mailbox, Long.parseLong(cmd.getOptionValue("fetch")), !cmd.hasOption("peek"));
            } else {
                log(String.valueOf(mailbox.checkMailbox()));
            }
        } catch (MessagingException | IllegalArgumentException e) {
            log.error("Mailbox command failed", e);
            log("Ran into a problem: " + e.getMessage());
        }
    }

    /**
     * Prints all folders.
     *
     * @param mailbox ImapMailbox instance.
     * @throws MessagingException Store error.
     */
    private void list(ImapMailbox mailbox) throws MessagingException {
        List<MailboxListing> listings = mailbox.getMailboxes("*");
        for (MailboxListing listing : listings) {
            log(listing.fullPath() + " " + listing.attributes());
        }
    }

    /**
     * Prints an assembled message.
     *
     * @param mailbox    ImapMailbox instance.
     * @param id         Message id.
     * @param markAsSeen Whether fetching may set the seen flag.
     * @throws MessagingException Store error.
     */
    private void fetch(ImapMailbox mailbox, long id, boolean markAsSeen) throws MessagingException {
        IncomingMessage message = mailbox.getMail(id, markAsSeen);
        IncomingMessageHeader header = message.getHeader();

        log("Id:          " + header.getId());
        log("Date:        " + header.getDate());
        log("From:        " + header.getFromName() + " <" + header.getFromAddress() + ">");
        log("To:          " + header.getToString());
        log("Subject:     " + header.getSubject());
        log("Message-ID:  " + header.getMessageId());
        log("-".repeat(70));

        if (message.hasBody(IncomingMessage.BodyType.TEXT_PLAIN)) {
            log(message.getTextPlain());
            log("-".repeat(70));
        }
        if (message.hasBody(IncomingMessage.BodyType.TEXT_HTML)) {
            log(message.getTextHtml());
            log("-".repeat(70));
        }

        for (Attachment attachment : message.getAttachments()) {
            log("Attachment:  " + attachment.getName() + " (" + attachment.getMimeType() + ")"
                    + attachment.getFilePath().map(path -> " saved to " + path).orElse(""));
        }
    }

    /**
     * CLI options.
     *
     * @return Options instance.
     */
    private Options options() {
        Options options = new Options();
        options.addOption("c", "config", true, "Mailbox JSON5 config file");
        options.addOption("l", "list", false, "List mailbox folders");
        options.addOption("s", "search", true, "Search criteria, prints message ids");
        options.addOption("f", "fetch", true, "Fetch and print message by id");
        options.addOption("p", "peek", false, "Do not mark fetched message as seen");
        options.addOption("a", "attachments", true, "Directory to save attachments to");
        return options;
    }

    /**
     * CLI usage.
     *
     * @param options CLI options.
     */
    private void optionsUsage(Options options) {
        log("java -jar mailfetch.jar");
        log(" Mailbox fetch tool");
        log("");
        log("Examples:");
        log("  # List folders");
        log("  java -jar mailfetch.jar --config mailbox.json5 --list");
        log("");
        log("  # Search unseen messages");
        log("  java -jar mailfetch.jar --config mailbox.json5 --search UNSEEN");
        log("");
        log("  # Fetch a message without marking it seen");
        log("  java -jar mailfetch.jar --config mailbox.json5 --fetch 42 --peek");
        log("");

        // Capture System.out to get help output.
        ByteArrayOutputStream baos = new ByteArrayOutputStream();
        PrintStream ps = new PrintStream(baos);
        PrintStream oldOut = System.out;
        System.setOut(ps);

        try {
            HelpFormatter formatter = HelpFormatter.builder()
                .setShowSince(false)
                .get();
            formatter.printHelp(" ", "", options, "", true);
            System.out.flush();
        } catch (IOException e) {
            throw new IllegalStateException(e);
        } finally {
            System.setOut(oldOut);
        }

        log(baos.toString());
        log("");
    }

    /**
     * Parse CLI arguments.
     *
     * @param options CLI options.
     * @param args    String array.
     * @return Optional of CommandLine.
     */
    private Optional<CommandLine> parseArgs(Options options, String[] args) {
        CommandLine cmd = null;

        try {
            cmd = new DefaultParser().parse(options, args, true);
        } catch (Exception e) {
            log("Ran into a problem: " + e.getMessage());
            log("");
        }

        return Optional.ofNullable(cmd);
    }

    /**
     * Output wrapper.
     *
     * @param string String.
     */
    void log(String string) {
        System.out.println(string);
    }
}
