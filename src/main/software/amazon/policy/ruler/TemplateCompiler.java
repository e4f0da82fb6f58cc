package software.amazon.policy.ruler;

import software.amazon.policy.ruler.input.ParseException;
import software.amazon.policy.ruler.input.TemplateParser;

import javax.annotation.concurrent.ThreadSafe;
import java.time.Duration;
import java.util.regex.Pattern;

/**
 * Compiles templates that embed raw regular expressions between caller-chosen delimiters. Delimiters without a special
 * meaning in regular expressions work best:
 *
 * <pre>
 *   CompiledPattern pattern = TemplateCompiler.compile("foo:bar.baz:&lt;[0-9]{2,10}&gt;", '&lt;', '&gt;');
 *   pattern.matches("foo:bar.baz:123"); // true
 * </pre>
 *
 * The text outside the delimiters is matched literally and the whole template is anchored at both ends.
 */
@ThreadSafe
public class TemplateCompiler {

    private TemplateCompiler() { }

    public static CompiledPattern compile(final String template, final char delimiterStart, final char delimiterEnd) {
        return compile(template, delimiterStart, delimiterEnd, Constants.DEFAULT_MATCH_TIMEOUT);
    }

    /**
     * @throws ParseException if the delimiters are unbalanced; reported before any regex compilation
     * @throws java.util.regex.PatternSyntaxException if a fragment is not a valid regular expression
     */
    public static CompiledPattern compile(final String template, final char delimiterStart, final char delimiterEnd,
                                          final Duration timeout) {
        final TemplateParser.ParsedTemplate parsed = new TemplateParser(delimiterStart, delimiterEnd).parse(template);

        // Compile fragments on their own first so a syntax error points at the offending fragment.
        for (String fragment : parsed.fragments()) {
            Pattern.compile('^' + fragment + '$');
        }
        return new CompiledPattern(template, Pattern.compile(parsed.regex()), timeout);
    }
}
