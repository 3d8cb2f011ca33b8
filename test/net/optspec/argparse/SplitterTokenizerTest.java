package net.optspec.argparse;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import org.junit.Assert;
import org.junit.Before;
import org.junit.Test;

/** Tests {@link SplitterTokenizer} */
public class SplitterTokenizerTest {

    private DefinitionSet defs;

    @Before
    public void setup() {
        defs = DefinitionSet.parse(DefinitionSetTest.specs(
            "flag", "-f,--flag:boolean",
            "quiet", "-q,--quiet:boolean",
            "num", "-n,--num:number",
            "str", "-s,--str:string"));
    }

    private TokenizedArguments tokenize(String... args) {
        return new SplitterTokenizer().tokenize(Arrays.asList(args), defs);
    }

    private static void expectText(RawValue rv, String text,
                                   boolean attached) {
        Assert.assertEquals(RawValue.Kind.TEXT, rv.getKind());
        Assert.assertEquals(text, rv.getText());
        Assert.assertEquals(attached, rv.isAttached());
    }

    @Test
    public void testTargetsAndRest() {
        TokenizedArguments t = tokenize("a", "b", "-", "--", "-a", "--foo");
        Assert.assertEquals(Arrays.asList("a", "b", "-"), t.getTargets());
        Assert.assertEquals(Arrays.asList("-a", "--foo"), t.getRest());
        Assert.assertEquals(Collections.emptyList(), t.getUnknownFlags());
    }

    @Test
    public void testLongValues() {
        TokenizedArguments t = tokenize("--num=1", "--str", "x", "--flag");
        List<RawValue> num = t.getLongValues("num");
        Assert.assertEquals(1, num.size());
        expectText(num.get(0), "1", true);
        Assert.assertTrue(num.get(0).isNumeric());
        expectText(t.getLongValues("str").get(0), "x", false);
        Assert.assertSame(RawValue.SWITCH, t.getLongValues("flag").get(0));
        Assert.assertEquals(Collections.emptyList(), t.getTargets());
    }

    @Test
    public void testShortValues() {
        TokenizedArguments t = tokenize("-n", "5", "-sabc", "-fq");
        expectText(t.getShortValues('n').get(0), "5", false);
        expectText(t.getShortValues('s').get(0), "abc", true);
        Assert.assertSame(RawValue.SWITCH, t.getShortValues('f').get(0));
        Assert.assertSame(RawValue.SWITCH, t.getShortValues('q').get(0));
    }

    /** Boolean switches do not swallow the following token */
    @Test
    public void testSwitchLeavesTarget() {
        TokenizedArguments t = tokenize("--flag", "value");
        Assert.assertSame(RawValue.SWITCH, t.getLongValues("flag").get(0));
        Assert.assertEquals(Arrays.asList("value"), t.getTargets());
    }

    /** A numeric remainder after a boolean short flag is a value */
    @Test
    public void testGluedBooleanValue() {
        TokenizedArguments t = tokenize("-f1");
        expectText(t.getShortValues('f').get(0), "1", true);
        t = tokenize("-f=x");
        expectText(t.getShortValues('f').get(0), "=x", true);
    }

    @Test
    public void testShortEqualsValue() {
        TokenizedArguments t = tokenize("-s=abc", "-n=-1");
        expectText(t.getShortValues('s').get(0), "abc", true);
        expectText(t.getShortValues('n').get(0), "-1", true);
        Assert.assertTrue(t.getShortValues('n').get(0).isNumeric());
    }

    /** Characters outside the BMP stay whole in unknown flags */
    @Test
    public void testNonBmpFlags() {
        TokenizedArguments t = tokenize("-\uD83D\uDE00fq", "-\uD83D\uDE00");
        Assert.assertSame(RawValue.SWITCH, t.getShortValues('f').get(0));
        Assert.assertSame(RawValue.SWITCH, t.getShortValues('q').get(0));
        Assert.assertEquals(Arrays.asList("-\uD83D\uDE00", "-\uD83D\uDE00"),
                            t.getUnknownFlags());
    }

    /** Value-taking flags followed by flags or nothing lack a value */
    @Test
    public void testAbsentValues() {
        TokenizedArguments t = tokenize("--num", "--flag", "-s");
        Assert.assertSame(RawValue.ABSENT, t.getLongValues("num").get(0));
        Assert.assertSame(RawValue.SWITCH, t.getLongValues("flag").get(0));
        Assert.assertSame(RawValue.ABSENT, t.getShortValues('s').get(0));
        t = tokenize("--str", "--", "x");
        Assert.assertSame(RawValue.ABSENT, t.getLongValues("str").get(0));
        Assert.assertEquals(Arrays.asList("x"), t.getRest());
    }

    /** Negative numbers and the lone dash can be separate values */
    @Test
    public void testDashValues() {
        TokenizedArguments t = tokenize("--num", "-5", "--str", "-");
        expectText(t.getLongValues("num").get(0), "-5", false);
        Assert.assertEquals(Double.valueOf(-5),
                            t.getLongValues("num").get(0).getNumber());
        expectText(t.getLongValues("str").get(0), "-", false);
        Assert.assertEquals(Collections.emptyList(), t.getTargets());
    }

    @Test
    public void testUnknownFlags() {
        TokenizedArguments t = tokenize("--bogus=1", "-x", "--flag",
                                        "--other");
        Assert.assertEquals(Arrays.asList("--bogus", "-x", "--other"),
                            t.getUnknownFlags());
        Assert.assertSame(RawValue.SWITCH, t.getLongValues("flag").get(0));
        Assert.assertEquals(Collections.emptyList(), t.getTargets());
    }

    /** Flags after the delimiter are not interpreted */
    @Test
    public void testDelimiter() {
        TokenizedArguments t = tokenize("--", "--flag=x", "--bogus");
        Assert.assertEquals(Collections.emptyList(),
                            t.getLongValues("flag"));
        Assert.assertEquals(Collections.emptyList(), t.getUnknownFlags());
        Assert.assertEquals(Arrays.asList("--flag=x", "--bogus"),
                            t.getRest());
    }

    @Test
    public void testNumericDetection() {
        for (String s : new String[] {"1", "-1", "+1.5", ".5", "1.",
                                      "1e10", "-2.5E-3"}) {
            Assert.assertTrue(s, RawValue.looksNumeric(s));
        }
        for (String s : new String[] {"", "-", "1a", "0x10", "e5", "1.2.3",
                                      "1,2"}) {
            Assert.assertFalse(s, RawValue.looksNumeric(s));
        }
    }

}
