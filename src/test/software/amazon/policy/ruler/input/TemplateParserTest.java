package software.amazon.policy.ruler.input;

import org.junit.Test;

import java.util.Arrays;
import java.util.Collections;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.fail;

public class TemplateParserTest {

    private final TemplateParser parser = new TemplateParser('<', '>');

    @Test
    public void testDelimiterIndices() {
        assertArrayEquals(new int[] { 12, 25 }, parser.delimiterIndices("foo:bar.baz:<[0-9]{2,10}>"));
        assertArrayEquals(new int[] { 0, 3, 4, 7 }, parser.delimiterIndices("<a>:<b>"));
        assertArrayEquals(new int[0], parser.delimiterIndices("no fragments"));
    }

    @Test
    public void testNestedDelimitersReportOnlyTopLevel() {
        assertArrayEquals(new int[] { 1, 8 }, parser.delimiterIndices("x<a<b>c>"));
    }

    @Test
    public void testParse() {
        TemplateParser.ParsedTemplate parsed = parser.parse("foo:bar.baz:<[0-9]{2,10}>");
        assertEquals("^\\Qfoo:bar.baz:\\E([0-9]{2,10})$", parsed.regex());
        assertEquals(Collections.singletonList("[0-9]{2,10}"), parsed.fragments());
    }

    @Test
    public void testParseTrailingLiteral() {
        TemplateParser.ParsedTemplate parsed = parser.parse("<a+>.<b+>-end");
        assertEquals("^(a+)\\Q.\\E(b+)\\Q-end\\E$", parsed.regex());
        assertEquals(Arrays.asList("a+", "b+"), parsed.fragments());
    }

    @Test
    public void testEmptyFragment() {
        TemplateParser.ParsedTemplate parsed = parser.parse("a<>b");
        assertEquals("^\\Qa\\E()\\Qb\\E$", parsed.regex());
    }

    @Test
    public void testUnbalanced() {
        for (String bad : new String[] { "foo:<bar", ">", "<a>>", "<<a>" }) {
            try {
                parser.delimiterIndices(bad);
                fail("Allowed unbalanced template: " + bad);
            } catch (ParseException e) {
                assertEquals("Unbalanced delimiters in \"" + bad + "\"", e.getMessage());
            }
        }
    }

    @Test(expected = IllegalArgumentException.class)
    public void testSameDelimiterTwice() {
        new TemplateParser('|', '|');
    }
}
