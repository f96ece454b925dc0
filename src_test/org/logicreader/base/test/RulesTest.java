package org.logicreader.base.test;

import java.util.LinkedList;

import org.junit.Assert;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.Parameterized;
import org.junit.runners.Parameterized.Parameters;
import org.logicreader.base.util.prolog.exceptions.PrologException;
import org.logicreader.base.util.prolog.factory.PrologFactory;
import org.logicreader.base.util.prolog.grammar.Rule;
import org.logicreader.base.util.prolog.transforms.SentenceReformatter;

/**
 * Multi-line rules, reformatted and then parsed.
 */
@RunWith(Parameterized.class)
public class RulesTest extends Assert
{
  @Parameters(name="{0}")
  public static Iterable<? extends Object> data()
  {
    LinkedList<Object[]> lTests = new LinkedList<>();

    lTests.add(new Object[] {"initiatedAt(foo(X, Y)=value, T) :-\n" +
                             " happensAt(a(X), T),\n" +
                             " happensAt(b(Y), T).\n"});
    lTests.add(new Object[] {"initiatedAt(foo(X, Y)=value, T) :-\n" +
                             " happensAt(a(X), T),\n" +
                             " not happensAt(b(Y), T).\n"});
    lTests.add(new Object[] {"initiatedAt(foo(X, Y)=value, T1) :-\n" +
                             " happensAt(a(X), T1),\n" +
                             " \\+ happensAt(b(Y), T1).\n"});
    lTests.add(new Object[] {"holdsFor(foo(X, Y)=bar, [T1, T2]) :-\n" +
                             " holdsAt(foo(X, Y)=bar, T1),\n" +
                             " \\+ holdsAt(foo(X, Y)=bar, T2).\n"});
    lTests.add(new Object[] {"holdsFor(foo(X, Y)=bar, [H | T]) :-\n" +
                             " holdsAt(foo(X, Y)=bar, H),\n" +
                             " \\+ holdsAt(foo(X, Y)=bar, T).\n"});
    lTests.add(new Object[] {"holdsFor(foo(X, Y)=bar, [T1, T2]) :-\n" +
                             " holdsAt(foo(X, Y)=bar, T1),\n" +
                             " \\+ (holdsAt(foo(X, Y)=bar, T2), happensAt(something, T2)).\n"});
    lTests.add(new Object[] {"holdsFor(foo(X, Y)=bar, [T1, T2]) :-\n" +
                             " holdsAt(foo(X, Y)=bar, T1),\n" +
                             " not (holdsAt(foo(X, Y)=bar, T2), happensAt(something1(X), T1), " +
                             "happensAt(something2(Y), T2)).\n"});

    return lTests;
  }

  private final String mRuleText;

  public RulesTest(String xiRuleText)
  {
    mRuleText = xiRuleText;
  }

  @Test
  public void testParse() throws PrologException
  {
    String lExpression = SentenceReformatter.reformat(mRuleText);
    String[] lParts = lExpression.split(":-");
    assertEquals("Invalid rule: " + lExpression, 2, lParts.length);

    String lHead = lParts[0].trim();
    String lBody = lParts[1].trim();
    lBody = lBody.substring(0, lBody.length() - 1);

    Rule lRule = PrologFactory.parseRule(lExpression);
    assertEquals(lHead, lRule.getHead().toText());
    assertEquals(lBody, lRule.getBody().toText());
    assertEquals(lExpression, lRule.toText());
  }

  @Test
  public void testRoundTrip() throws PrologException
  {
    Rule lRule = PrologFactory.parseRule(SentenceReformatter.reformat(mRuleText));
    Rule lReparsed = PrologFactory.parseRule(lRule.toText());
    assertEquals(lRule, lReparsed);
    assertEquals(lRule.toText(), lReparsed.toText());
  }

  @Test
  public void testParseWithoutReformatting() throws PrologException
  {
    // Only the list bar and the negation spelling differ.
    Rule lRaw = PrologFactory.parseRule(mRuleText);
    Rule lReformatted = PrologFactory.parseRule(SentenceReformatter.reformat(mRuleText));
    assertEquals(lReformatted.getBody(), lRaw.getBody());
    assertEquals(lReformatted.getHead().toText(), lRaw.getHead().toText());
  }
}
