package com.mimecast.mailfetch.imap;

import com.mimecast.mailfetch.exceptions.InvalidParameterException;
import jakarta.mail.Flags;
import jakarta.mail.Message;
import jakarta.mail.search.AndTerm;
import jakarta.mail.search.BodyTerm;
import jakarta.mail.search.ComparisonTerm;
import jakarta.mail.search.FlagTerm;
import jakarta.mail.search.FromStringTerm;
import jakarta.mail.search.HeaderTerm;
import jakarta.mail.search.NotTerm;
import jakarta.mail.search.OrTerm;
import jakarta.mail.search.ReceivedDateTerm;
import jakarta.mail.search.RecipientStringTerm;
import jakarta.mail.search.SearchTerm;
import jakarta.mail.search.SizeTerm;
import jakarta.mail.search.SubjectTerm;

import java.time.LocalDate;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Date;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;

/**
 * IMAP search criteria string parser.
 *
 * <p>Turns strings like <i>UNSEEN FROM "john@example.com" SINCE 1-Jan-2024</i> into a Jakarta {@link SearchTerm}.
 * <br>Keys are case insensitive and combined with AND.
 * <br>Values containing spaces must be double quoted.
 * <p>ALL, or an empty string, matches everything and yields null.
 */
public class SearchCriteria {

    /**
     * IMAP date format, e.g. 1-Feb-2024.
     */
    private static final DateTimeFormatter DATE = new DateTimeFormatterBuilder()
            .parseCaseInsensitive()
            .appendPattern("d-MMM-yyyy")
            .toFormatter(Locale.ENGLISH);

    /**
     * Protected constructor.
     */
    private SearchCriteria() {
        throw new IllegalStateException("Static class");
    }

    /**
     * Parses a criteria string.
     *
     * @param criteria Criteria string.
     * @return SearchTerm instance or null to match all.
     * @throws InvalidParameterException Unknown key or bad value.
     */
    public static SearchTerm parse(String criteria) {
        List<SearchTerm> terms = new ArrayList<>();

        Iterator<String> tokens = tokenize(criteria == null ? "" : criteria).iterator();
        while (tokens.hasNext()) {
            String key = tokens.next().toUpperCase(Locale.ROOT);
            SearchTerm term = term(key, tokens);
            if (term != null) {
                terms.add(term);
            }
        }

        if (terms.isEmpty()) {
            return null;
        }
        if (terms.size() == 1) {
            return terms.get(0);
        }
        return new AndTerm(terms.toArray(new SearchTerm[0]));
    }

    private static SearchTerm term(String key, Iterator<String> tokens) {
        switch (key) {
            case "ALL":
                return null;
            case "SEEN":
                return flag(Flags.Flag.SEEN, true);
            case "UNSEEN":
                return flag(Flags.Flag.SEEN, false);
            case "ANSWERED":
                return flag(Flags.Flag.ANSWERED, true);
            case "UNANSWERED":
                return flag(Flags.Flag.ANSWERED, false);
            case "FLAGGED":
                return flag(Flags.Flag.FLAGGED, true);
            case "UNFLAGGED":
                return flag(Flags.Flag.FLAGGED, false);
            case "DELETED":
                return flag(Flags.Flag.DELETED, true);
            case "UNDELETED":
                return flag(Flags.Flag.DELETED, false);
            case "DRAFT":
                return flag(Flags.Flag.DRAFT, true);
            case "UNDRAFT":
                return flag(Flags.Flag.DRAFT, false);
            case "RECENT":
                return flag(Flags.Flag.RECENT, true);
            case "OLD":
                return flag(Flags.Flag.RECENT, false);
            case "NEW":
                return new AndTerm(flag(Flags.Flag.RECENT, true), flag(Flags.Flag.SEEN, false));
            case "KEYWORD":
                return new FlagTerm(new Flags(value(key, tokens)), true);
            case "UNKEYWORD":
                return new FlagTerm(new Flags(value(key, tokens)), false);
            case "FROM":
                return new FromStringTerm(value(key, tokens));
            case "TO":
                return new RecipientStringTerm(Message.RecipientType.TO, value(key, tokens));
            case "CC":
                return new RecipientStringTerm(Message.RecipientType.CC, value(key, tokens));
            case "BCC":
                return new RecipientStringTerm(Message.RecipientType.BCC, value(key, tokens));
            case "SUBJECT":
                return new SubjectTerm(value(key, tokens));
            case "BODY":
                return new BodyTerm(value(key, tokens));
            case "TEXT":
                String text = value(key, tokens);
                return new OrTerm(new SubjectTerm(text), new BodyTerm(text));
            case "HEADER":
                String header = value(key, tokens);
                return new HeaderTerm(header, value(key, tokens));
            case "SINCE":
                return new ReceivedDateTerm(ComparisonTerm.GE, date(key, value(key, tokens)));
            case "BEFORE":
                return new ReceivedDateTerm(ComparisonTerm.LT, date(key, value(key, tokens)));
            case "ON":
                return new ReceivedDateTerm(ComparisonTerm.EQ, date(key, value(key, tokens)));
            case "LARGER":
                return new SizeTerm(ComparisonTerm.GT, size(key, value(key, tokens)));
            case "SMALLER":
                return new SizeTerm(ComparisonTerm.LT, size(key, value(key, tokens)));
            case "NOT":
                if (!tokens.hasNext()) {
                    throw new InvalidParameterException("Search key NOT requires a criteria");
                }
                SearchTerm negated = term(tokens.next().toUpperCase(Locale.ROOT), tokens);
                if (negated == null) {
                    throw new InvalidParameterException("Search key NOT cannot negate ALL");
                }
                return new NotTerm(negated);
            default:
                throw new InvalidParameterException("Unsupported search key: " + key);
        }
    }

    private static FlagTerm flag(Flags.Flag flag, boolean set) {
        return new FlagTerm(new Flags(flag), set);
    }

    private static String value(String key, Iterator<String> tokens) {
        if (!tokens.hasNext()) {
            throw new InvalidParameterException("Search key " + key + " requires a value");
        }
        return tokens.next();
    }

    private static Date date(String key, String value) {
        try {
            return Date.from(LocalDate.parse(value, DATE).atStartOfDay(ZoneId.systemDefault()).toInstant());
        } catch (DateTimeParseException e) {
            throw new InvalidParameterException("Search key " + key + " requires a d-MMM-yyyy date, got " + value);
        }
    }

    private static int size(String key, String value) {
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new InvalidParameterException("Search key " + key + " requires a number, got " + value);
        }
    }

    /**
     * Splits criteria into tokens honouring double quotes and backslash escapes within them.
     *
     * @param criteria Criteria string.
     * @return List of tokens.
     */
    static List<String> tokenize(String criteria) {
        List<String> tokens = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        boolean quoted = false;
        boolean started = false;

        for (int i = 0; i < criteria.length(); i++) {
            char c = criteria.charAt(i);
            if (quoted) {
                if (c == '\\' && i + 1 < criteria.length()) {
                    current.append(criteria.charAt(++i));
                } else if (c == '"') {
                    quoted = false;
                } else {
                    current.append(c);
                }
            } else if (c == '"') {
                quoted = true;
                started = true;
            } else if (Character.isWhitespace(c)) {
                if (started) {
                    tokens.add(current.toString());
                    current.setLength(0);
                    started = false;
                }
            } else {
                current.append(c);
                started = true;
            }
        }

        if (quoted) {
            throw new InvalidParameterException("Unterminated quote in search criteria: " + criteria);
        }
        if (started) {
            tokens.add(current.toString());
        }

        return tokens;
    }
}
