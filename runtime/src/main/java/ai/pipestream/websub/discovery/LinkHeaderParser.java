package ai.pipestream.websub.discovery;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

/**
 * Parses HTTP {@code Link} header values (RFC 8288).
 * <p>
 * A value holds comma-separated links of the form {@code <target>; rel="a b"; k=v}.
 * Relation types are lower-cased; a link without {@code rel} has no relations.
 */
public final class LinkHeaderParser {

    /**
     * One parsed link.
     *
     * @param target    the URI reference between angle brackets
     * @param relations relation types, lower-cased
     */
    public record Link(String target, List<String> relations) {

        public Link {
            relations = List.copyOf(relations);
        }

        public boolean hasRelation(String relation) {
            return relations.contains(relation.toLowerCase(Locale.ROOT));
        }
    }

    private final String input;
    private int pos;

    private LinkHeaderParser(String input) {
        this.input = input;
    }

    /**
     * Parses every link of the given header values.
     *
     * @throws IllegalArgumentException if a value is malformed
     */
    public static List<Link> parse(List<String> headerValues) {
        if (headerValues == null || headerValues.isEmpty()) {
            return Collections.emptyList();
        }
        List<Link> links = new ArrayList<>();
        for (String value : headerValues) {
            links.addAll(parse(value));
        }
        return links;
    }

    /**
     * Parses the links of one header value.
     *
     * @throws IllegalArgumentException if the value is malformed
     */
    public static List<Link> parse(String headerValue) {
        if (headerValue == null || headerValue.isBlank()) {
            return Collections.emptyList();
        }
        return new LinkHeaderParser(headerValue).links();
    }

    private List<Link> links() {
        List<Link> links = new ArrayList<>();
        while (true) {
            skipWhitespaceAndCommas();
            if (atEnd()) {
                return links;
            }
            links.add(link());
            skipWhitespace();
            if (!atEnd() && input.charAt(pos) != ',') {
                throw malformed("expected ',' after link");
            }
        }
    }

    private Link link() {
        if (input.charAt(pos) != '<') {
            throw malformed("expected '<'");
        }
        int close = input.indexOf('>', pos + 1);
        if (close < 0) {
            throw malformed("unterminated link target");
        }
        String target = input.substring(pos + 1, close).trim();
        if (target.isEmpty()) {
            throw malformed("empty link target");
        }
        pos = close + 1;

        List<String> relations = new ArrayList<>();
        boolean relSeen = false;
        while (true) {
            skipWhitespace();
            if (atEnd() || input.charAt(pos) != ';') {
                break;
            }
            pos++;
            skipWhitespace();
            String name = token().toLowerCase(Locale.ROOT);
            if (name.isEmpty()) {
                throw malformed("empty parameter name");
            }
            skipWhitespace();
            String value = "";
            if (!atEnd() && input.charAt(pos) == '=') {
                pos++;
                skipWhitespace();
                value = !atEnd() && input.charAt(pos) == '"' ? quotedString() : token();
            }
            // only the first rel parameter counts
            if ("rel".equals(name) && !relSeen) {
                relSeen = true;
                for (String relation : value.trim().split("\\s+")) {
                    if (!relation.isEmpty()) {
                        relations.add(relation.toLowerCase(Locale.ROOT));
                    }
                }
            }
        }
        return new Link(target, relations);
    }

    private String token() {
        int start = pos;
        while (!atEnd()) {
            char c = input.charAt(pos);
            if (c == ';' || c == ',' || c == '=' || Character.isWhitespace(c)) {
                break;
            }
            pos++;
        }
        return input.substring(start, pos);
    }

    private String quotedString() {
        StringBuilder value = new StringBuilder();
        pos++;
        while (!atEnd()) {
            char c = input.charAt(pos++);
            if (c == '"') {
                return value.toString();
            }
            if (c == '\\') {
                if (atEnd()) {
                    break;
                }
                c = input.charAt(pos++);
            }
            value.append(c);
        }
        throw malformed("unterminated quoted string");
    }

    private void skipWhitespace() {
        while (!atEnd() && Character.isWhitespace(input.charAt(pos))) {
            pos++;
        }
    }

    private void skipWhitespaceAndCommas() {
        while (!atEnd() && (Character.isWhitespace(input.charAt(pos)) || input.charAt(pos) == ',')) {
            pos++;
        }
    }

    private boolean atEnd() {
        return pos >= input.length();
    }

    private IllegalArgumentException malformed(String reason) {
        return new IllegalArgumentException(
                String.format("Malformed Link header at position %d (%s): %s", pos, reason, input));
    }
}
