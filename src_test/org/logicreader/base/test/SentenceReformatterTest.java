package org.logicreader.base.test;

import java.util.Arrays;

import org.junit.After;
import org.junit.Assert;
import org.junit.Test;
import org.logicreader.base.util.configuration.ParserConfiguration;
import org.logicreader.base.util.configuration.ParserConfiguration.CfgItem;
import org.logicreader.base.util.prolog.exceptions.MalformedSentenceException;
import org.logicreader.base.util.prolog.exceptions.PrologException;
import org.logicreader.base.util.prolog.factory.PrologFactory;
import org.logicreader.base.util.prolog.grammar.Atom;
import org.logicreader.base.util.prolog.grammar.Conjunction;
import org.logicreader.base.util.prolog.grammar.DefiniteClauseConstruct;
import org.logicreader.base.util.prolog.grammar.Negation;
import org.logicreader.base.util.prolog.grammar.Term;
import org.logicreader.base.util.prolog.grammar.Variable;
import org.logicreader.base.util.prolog.transforms.SentenceReformatter;

public class SentenceReformatterTest extends Assert
{
  @After
  public void tearDown()
  {
    ParserConfiguration.utResetCfgVal(CfgItem.MULTILINE_INDENT);
  }

  @Test
  public void testJoinLines() throws MalformedSentenceException
  {
    assertEquals("p(X) :- q(X), r(X).", SentenceReformatter.reformat("p(X) :-\n  q(X),\n\n  r(X)."));
    assertEquals("p(X) :- q(X), r(X).", SentenceReformatter.reformat("p(X) :- q(X), r(X)"));
    assertEquals("p(X) :- q(X), r(X).", SentenceReformatter.reformat("  p(X)   :-   q(X),   \n r(X).  "));
  }

  @Test
  public void testMargin() throws MalformedSentenceException
  {
    assertEquals("p(X) :- q(X), r(X).", SentenceReformatter.reformat("p(X) :-\n   | q(X),\n   | r(X).\n"));
  }

  @Test
  public void testListBar() throws MalformedSentenceException
  {
    assertEquals("p([H, T]).", SentenceReformatter.reformat("p([H | T])"));
    assertEquals("p([H, T]).", SentenceReformatter.reformat("p([H|T])"));
  }

  @Test
  public void testNegationSpellings() throws MalformedSentenceException
  {
    assertEquals("p :- not(q(X)).", SentenceReformatter.reformat("p :- not q(X)."));
    assertEquals("p :- not(q(X)).", SentenceReformatter.reformat("p :- \\+ q(X)."));
    assertEquals("p :- not(q(X)).", SentenceReformatter.reformat("p :- not (q(X))."));
    assertEquals("p :- not(q(X)).", SentenceReformatter.reformat("p :- \\+(q(X))."));
    assertEquals("p :- not(q(X)).", SentenceReformatter.reformat("p :- not(q(X))."));
  }

  @Test
  public void testNegationKeywordInsideWords() throws MalformedSentenceException
  {
    assertEquals("p :- nothing(X), cannot (X).", SentenceReformatter.reformat("p :- nothing(X), cannot (X)."));
  }

  @Test
  public void testEachLineNegatedSeparately() throws MalformedSentenceException
  {
    assertEquals("p :- not(a), not(b).", SentenceReformatter.reformat("p :-\n not a,\n not b."));
  }

  @Test
  public void testNegatedConjunctions() throws PrologException
  {
    Variable lX = new Variable("X");
    Variable lY = new Variable("Y");
    DefiniteClauseConstruct lExpected =
                          new Negation(new Conjunction(new Atom("a", Arrays.<Term>asList(lX)),
                                                       new Atom("b", Arrays.<Term>asList(lY))));

    String lFirst = SentenceReformatter.reformat("not (a(X), b(Y))");
    String lSecond = SentenceReformatter.reformat("\\+ (a(X), b(Y))");
    String lThird = SentenceReformatter.reformat("a(X), b(Y)");
    assertEquals("not(a(X), b(Y)).", lFirst);
    assertEquals(lFirst, lSecond);
    assertEquals("a(X), b(Y).", lThird);

    for (String lText : new String[] {lFirst, lSecond, "not(" + lThird.substring(0, lThird.length() - 1) + ")"})
    {
      DefiniteClauseConstruct lParsed = PrologFactory.parseDefiniteClause(lText);
      assertEquals(lExpected, lParsed);
      assertEquals("not(a(X), b(Y))", lParsed.toText());
    }
  }

  @Test
  public void testMultiline() throws MalformedSentenceException
  {
    assertEquals("p(X) :-\n\tq(X),\n\tnot(r(X)).",
                 SentenceReformatter.reformat("p(X) :- q(X),\n \\+ r(X).", true));

    ParserConfiguration.utOverrideCfgVal(CfgItem.MULTILINE_INDENT, "  ");
    assertEquals("p(X) :-\n  q(X),\n  r(X).", SentenceReformatter.reformat("p(X) :- q(X),\n r(X).", true));
  }

  @Test
  public void testMultilineOutputReformatsToOneLine() throws MalformedSentenceException
  {
    String lMultiline = SentenceReformatter.reformat("p(X) :- q(X),\n r(X), \n s(X).", true);
    assertEquals("p(X) :- q(X), r(X), s(X).", SentenceReformatter.reformat(lMultiline));
  }

  @Test
  public void testTooManySeparators()
  {
    try
    {
      SentenceReformatter.reformat("p :- q :- r.");
      fail("Reformatted a sentence with two separators");
    }
    catch (MalformedSentenceException e)
    {
      assertEquals("p :- q :- r.", e.getSentence());
    }
  }

  @Test
  public void testNothingToReformat()
  {
    for (String lText : new String[] {"", "  \n ", "p :- ", ":- q(X)."})
    {
      try
      {
        SentenceReformatter.reformat(lText);
        fail("Reformatted '" + lText + "'");
      }
      catch (MalformedSentenceException e)
      {
        assertEquals(lText, e.getSentence());
      }
    }
  }
}
