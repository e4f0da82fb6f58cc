package software.amazon.policy.ruler.input;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static software.amazon.policy.ruler.input.WildcardParser.appendLiteral;

/**
 * A parser for templates that mix literal text with delimiter-bounded regular expression fragments, e.g.
 * "foo:bar.baz:&lt;[0-9]{2,10}&gt;" with '&lt;' and '&gt;' as delimiters. Literal spans are quoted, fragments are
 * copied verbatim into a capture group. Only top-level delimiters separate fragments from literals; nested pairs are
 * part of the enclosing fragment.
 *
 * Delimiters should be characters with no special meaning in regular expressions, otherwise a fragment cannot use
 * them.
 */
public class TemplateParser {

    private final char delimiterStart;
    private final char delimiterEnd;

    public TemplateParser(final char delimiterStart, final char delimiterEnd) {
        if (delimiterStart == delimiterEnd) {
            throw new IllegalArgumentException("Open and close delimiters must differ, both are '" + delimiterStart + "'");
        }
        this.delimiterStart = delimiterStart;
        this.delimiterEnd = delimiterEnd;
    }

    /**
     * Returns start/end index pairs for the first-level delimiter spans. The start index points at the opening
     * delimiter, the end index just past the closing one.
     *
     * @throws ParseException if the delimiters are unbalanced
     */
    public int[] delimiterIndices(final String template) {
        final List<Integer> indices = new ArrayList<>();
        int level = 0;
        int start = 0;
        for (int i = 0; i < template.length(); i++) {
            final char c = template.charAt(i);
            if (c == delimiterStart) {
                if (++level == 1) {
                    start = i;
                }
            } else if (c == delimiterEnd) {
                if (--level == 0) {
                    indices.add(start);
                    indices.add(i + 1);
                } else if (level < 0) {
                    throw unbalanced(template);
                }
            }
        }
        if (level != 0) {
            throw unbalanced(template);
        }

        final int[] result = new int[indices.size()];
        for (int i = 0; i < result.length; i++) {
            result[i] = indices.get(i);
        }
        return result;
    }

    /**
     * Validates the template and splits it into literal spans and raw fragments.
     *
     * @throws ParseException if the delimiters are unbalanced
     */
    public ParsedTemplate parse(final String template) {
        final int[] indices = delimiterIndices(template);
        final List<String> fragments = new ArrayList<>(indices.length / 2);
        final StringBuilder regex = new StringBuilder(template.length() + 16);
        regex.append('^');

        int end = 0;
        for (int i = 0; i < indices.length; i += 2) {
            appendLiteral(regex, template, end, indices[i]);
            end = indices[i + 1];
            final String fragment = template.substring(indices[i] + 1, end - 1);
            fragments.add(fragment);
            regex.append('(').append(fragment).append(')');
        }
        appendLiteral(regex, template, end, template.length());
        regex.append('$');

        return new ParsedTemplate(regex.toString(), fragments);
    }

    private static ParseException unbalanced(final String template) {
        return new ParseException("Unbalanced delimiters in \"" + template + "\"");
    }

    /**
     * Result of parsing a template: the combined anchored regex source and the raw fragments in order of appearance.
     */
    public static final class ParsedTemplate {

        private final String regex;
        private final List<String> fragments;

        ParsedTemplate(final String regex, final List<String> fragments) {
            this.regex = regex;
            this.fragments = Collections.unmodifiableList(fragments);
        }

        public String regex() {
            return regex;
        }

        public List<String> fragments() {
            return fragments;
        }
    }
}
