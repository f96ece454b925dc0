package org.logicreader.base.test;

import java.util.LinkedList;
import java.util.List;

import org.junit.After;
import org.junit.Assert;
import org.junit.Test;
import org.logicreader.base.util.configuration.ParserConfiguration;
import org.logicreader.base.util.configuration.ParserConfiguration.CfgItem;
import org.logicreader.base.util.prolog.exceptions.PrologException;
import org.logicreader.base.util.prolog.exceptions.PrologFormatException;
import org.logicreader.base.util.prolog.exceptions.PrologFormatException.TargetConstruct;
import org.logicreader.base.util.prolog.factory.PrologFactory;
import org.logicreader.base.util.prolog.grammar.Atom;
import org.logicreader.base.util.prolog.grammar.Conjunction;
import org.logicreader.base.util.prolog.grammar.DefiniteClauseConstruct;
import org.logicreader.base.util.prolog.grammar.Negation;
import org.logicreader.base.util.prolog.grammar.Rule;
import org.logicreader.base.util.prolog.grammar.Term;
import org.logicreader.base.util.prolog.grammar.TermFunction;

/**
 * Entry points of the parser, including how they report failures.
 */
public class PrologFactoryTest extends Assert
{
  @After
  public void tearDown()
  {
    ParserConfiguration.utResetCfgVal(CfgItem.REQUIRE_COMPLETE_INPUT);
  }

  private static PrologFormatException expectFailure(TargetConstruct xiTarget, String xiText) throws PrologException
  {
    try
    {
      switch (xiTarget)
      {
        case TERM:            PrologFactory.parseTerm(xiText);           break;
        case TERM_LIST:       PrologFactory.parseTermList(xiText);       break;
        case FUNCTION:        PrologFactory.parseFunction(xiText);       break;
        case ATOMIC_FORMULA:  PrologFactory.parseAtom(xiText);           break;
        case DEFINITE_CLAUSE: PrologFactory.parseDefiniteClause(xiText); break;
        case RULE:            PrologFactory.parseRule(xiText);           break;
        case RULES:           PrologFactory.parseRules(xiText);          break;
        default:              throw new IllegalArgumentException("Unknown target " + xiTarget);
      }
    }
    catch (PrologFormatException e)
    {
      assertEquals(xiTarget, e.getTarget());
      assertEquals(xiText, e.getSource());
      assertTrue(e.getMessage().contains(xiTarget.getDescription()));
      return e;
    }
    fail("Parsed '" + xiText + "' as " + xiTarget.getDescription());
    return null;
  }

  @Test
  public void testEndToEnd() throws PrologException
  {
    Rule lRule = PrologFactory.parseRule(
                   "initiatedAt(foo(X,Y)=value,T) :- happensAt(a(X),T), not happensAt(b(Y),T).");

    assertEquals("initiatedAt(foo(X, Y)=value, T)", lRule.getHead().toText());
    assertEquals("happensAt(a(X), T), not(happensAt(b(Y), T))", lRule.getBody().toText());
    assertEquals("initiatedAt(foo(X, Y)=value, T) :- happensAt(a(X), T), not(happensAt(b(Y), T)).",
                 lRule.toText());
    assertTrue(lRule.getBody() instanceof Conjunction);
    assertTrue(((Conjunction)lRule.getBody()).getRight() instanceof Negation);
  }

  @Test
  public void testTrailingInputRejected() throws PrologException
  {
    PrologFormatException lFailure = expectFailure(TargetConstruct.ATOMIC_FORMULA, "happensAt(a) extra");
    assertEquals("extra", lFailure.getRemainder());

    lFailure = expectFailure(TargetConstruct.TERM_LIST, "[a, b] [c]");
    assertEquals("[c]", lFailure.getRemainder());
  }

  @Test
  public void testTrailingInputAllowedWhenConfigured() throws PrologException
  {
    ParserConfiguration.utOverrideCfgVal(CfgItem.REQUIRE_COMPLETE_INPUT, false);
    assertEquals("happensAt(a)", PrologFactory.parseAtom("happensAt(a) extra").toText());
  }

  @Test
  public void testTrailingCommentsAllowed() throws PrologException
  {
    assertEquals("happensAt(a)", PrologFactory.parseAtom("happensAt(a) // the end").toText());
    assertEquals("happensAt(a)", PrologFactory.parseAtom("happensAt(a) /* the\nend */ ").toText());
  }

  @Test
  public void testFailures() throws PrologException
  {
    expectFailure(TargetConstruct.TERM, "");
    expectFailure(TargetConstruct.TERM_LIST, "[a, b");
    expectFailure(TargetConstruct.TERM_LIST, "a, b");
    expectFailure(TargetConstruct.FUNCTION, "foo");
    expectFailure(TargetConstruct.FUNCTION, "Foo(a)");
    expectFailure(TargetConstruct.ATOMIC_FORMULA, "Happens(a)");
    expectFailure(TargetConstruct.ATOMIC_FORMULA, "[a]");
    expectFailure(TargetConstruct.DEFINITE_CLAUSE, ", a");
    expectFailure(TargetConstruct.RULE, "p(X) :- q(X)");
    expectFailure(TargetConstruct.RULE, "p(X).");
    expectFailure(TargetConstruct.RULE, ":- q(X).");
    expectFailure(TargetConstruct.RULES, "p(X) :- q(X). r(X)");
  }

  @Test
  public void testFailureRemainder() throws PrologException
  {
    PrologFormatException lFailure = expectFailure(TargetConstruct.RULE, "p(X) :- q(X), .");
    assertEquals(".", lFailure.getRemainder());
    assertTrue(lFailure.getMessage().contains("failed at: '.'"));
  }

  @Test
  public void testUnclosedParenthesisRemainder() throws PrologException
  {
    PrologFormatException lFailure = expectFailure(TargetConstruct.ATOMIC_FORMULA, "foo(X, bar");
    assertEquals("(X, bar", lFailure.getRemainder());

    lFailure = expectFailure(TargetConstruct.RULE, "p(X) :- q(X, Y");
    assertEquals("(X, Y", lFailure.getRemainder());

    lFailure = expectFailure(TargetConstruct.TERM_LIST, "[a, [b, c]");
    assertEquals("[a, [b, c]", lFailure.getRemainder());

    // Nothing is left open, so the rule just ends too soon.
    lFailure = expectFailure(TargetConstruct.RULE, "p(X) :- q(X)");
    assertEquals("", lFailure.getRemainder());
  }

  @Test
  public void testNestedNegation() throws PrologException
  {
    Atom lRaining = new Atom("raining", new LinkedList<Term>());
    Negation lDouble = new Negation(new Negation(lRaining));
    assertEquals("not(not(raining))", lDouble.toText());
    assertEquals(lDouble, PrologFactory.parseDefiniteClause(lDouble.toText()));
    assertEquals(lDouble, PrologFactory.parseDefiniteClause("\\+ (not raining)"));

    Rule lRule = new Rule(new Atom("dry", new LinkedList<Term>()), lDouble);
    assertEquals(lRule, PrologFactory.parseRule(lRule.toText()));

    // The keyword is never the name of an atom.
    expectFailure(TargetConstruct.ATOMIC_FORMULA, "not(raining)");
    expectFailure(TargetConstruct.ATOMIC_FORMULA, "not");
  }

  @Test
  public void testParseRules() throws PrologException
  {
    List<Rule> lRules = PrologFactory.parseRules("p(X) :- q(X).\n" +
                                                 "% A comment between rules\n" +
                                                 "r(Y) :- \\+ s(Y), t(Y).\n");
    assertEquals(2, lRules.size());
    assertEquals("p(X) :- q(X).", lRules.get(0).toText());
    assertEquals("r(Y) :- not(s(Y)), t(Y).", lRules.get(1).toText());

    assertTrue(PrologFactory.parseRules("").isEmpty());
    assertTrue(PrologFactory.parseRules("  // nothing here\n").isEmpty());
  }

  @Test
  public void testParseDefiniteClause() throws PrologException
  {
    DefiniteClauseConstruct lAtom = PrologFactory.parseDefiniteClause("happensAt(a, T)");
    assertTrue(lAtom instanceof Atom);

    DefiniteClauseConstruct lConjunction = PrologFactory.parseDefiniteClause("a, b, c.");
    assertEquals("a, b, c", lConjunction.toText());
    // Conjunctions nest to the left.
    assertEquals("a, b", ((Conjunction)lConjunction).getLeft().toText());
    assertEquals("c", ((Conjunction)lConjunction).getRight().toText());

    DefiniteClauseConstruct lNegation = PrologFactory.parseDefiniteClause("\\+ (a, not b)");
    assertEquals("not(a, not(b))", lNegation.toText());
  }

  @Test
  public void testNegationKeywordPrefix() throws PrologException
  {
    DefiniteClauseConstruct lParsed = PrologFactory.parseDefiniteClause("nothing(X), notable");
    assertEquals("nothing(X), notable", lParsed.toText());
    assertEquals(2, lParsed.getSubFormulas().size());
    assertEquals(new Atom("notable", new LinkedList<Term>()), ((Conjunction)lParsed).getRight());
  }

  @Test
  public void testParseFunction() throws PrologException
  {
    TermFunction lFunction = PrologFactory.parseFunction("f(X)=(a, b)");
    assertEquals(2, lFunction.getValues().size());
    assertEquals("f(X)=(a, b)", lFunction.toText());

    TermFunction lTuple = PrologFactory.parseFunction("(a, B)");
    assertEquals("", lTuple.getSymbol());
    assertEquals("(a, B)", lTuple.toText());
  }
}
