package org.logicreader.base.test;

import org.junit.Assert;
import org.junit.Test;
import org.logicreader.base.apps.utilities.RuleFormatterRunner;
import org.logicreader.base.util.prolog.exceptions.MalformedSentenceException;
import org.logicreader.base.util.prolog.exceptions.PrologException;
import org.logicreader.base.util.prolog.exceptions.PrologFormatException;

public class RuleFormatterRunnerTest extends Assert
{
  @Test
  public void testFormatRule() throws PrologException
  {
    assertEquals("p(X) :- q(X), not(r(X)).", RuleFormatterRunner.format("p(X) :-\n q(X),\n \\+ r(X)."));
    assertEquals("holdsFor(f(X)=v, [H, T]) :- holdsAt(f(X)=v, H).",
                 RuleFormatterRunner.format("holdsFor(f(X)=v, [H | T]) :-\n   holdsAt(f(X)=v, H)."));
  }

  @Test
  public void testFormatAtom() throws PrologException
  {
    assertEquals("greaterThan(X, 3)", RuleFormatterRunner.format("X > 3"));
    assertEquals("happensAt(walking(bob), 10)", RuleFormatterRunner.format("happensAt( walking(bob),10 )."));
  }

  @Test
  public void testFormatFailures() throws PrologException
  {
    try
    {
      RuleFormatterRunner.format("p :- q :- r");
      fail("Formatted a sentence with two separators");
    }
    catch (MalformedSentenceException e)
    {
      assertEquals("p :- q :- r", e.getSentence());
    }

    try
    {
      RuleFormatterRunner.format("p(X) :- Q(X)");
      fail("Formatted a rule with a variable in place of an atom");
    }
    catch (PrologFormatException e)
    {
      assertEquals(PrologFormatException.TargetConstruct.RULE, e.getTarget());
      assertEquals("p(X) :- Q(X).", e.getSource());
    }
  }
}
