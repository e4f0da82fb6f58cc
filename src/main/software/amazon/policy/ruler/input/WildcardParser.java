package software.amazon.policy.ruler.input;

import java.util.regex.Pattern;

/**
 * Translates a wildcard pattern into anchored regular expression source. Every '*' becomes ".*" and every maximal run
 * of other characters is quoted, so regex metacharacters in resource and action names are matched literally.
 */
public class WildcardParser {

    static final char ASTERISK = '*';

    private static final String ANY_SEQUENCE = ".*";

    private static final WildcardParser SINGLETON = new WildcardParser();

    WildcardParser() { }

    public static WildcardParser getParser() {
        return SINGLETON;
    }

    /**
     * @param wildcard pattern such as "ecs:Describe*" or "ecs:*:instance/*"
     * @return regex source such as ^\Qecs:Describe\E.*$
     */
    public String parse(final String wildcard) {
        final StringBuilder regex = new StringBuilder(wildcard.length() + 16);
        regex.append('^');
        int literalStart = 0;
        for (int i = 0; i < wildcard.length(); i++) {
            if (wildcard.charAt(i) == ASTERISK) {
                appendLiteral(regex, wildcard, literalStart, i);
                regex.append(ANY_SEQUENCE);
                literalStart = i + 1;
            }
        }
        appendLiteral(regex, wildcard, literalStart, wildcard.length());
        regex.append('$');
        return regex.toString();
    }

    static void appendLiteral(final StringBuilder regex, final String source, final int start, final int end) {
        if (start < end) {
            regex.append(Pattern.quote(source.substring(start, end)));
        }
    }
}
