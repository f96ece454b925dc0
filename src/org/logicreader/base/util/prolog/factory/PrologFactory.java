package org.logicreader.base.util.prolog.factory;

import java.util.List;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.logicreader.base.util.configuration.ParserConfiguration;
import org.logicreader.base.util.configuration.ParserConfiguration.CfgItem;
import org.logicreader.base.util.prolog.exceptions.PrologException;
import org.logicreader.base.util.prolog.exceptions.PrologFormatException;
import org.logicreader.base.util.prolog.exceptions.PrologFormatException.TargetConstruct;
import org.logicreader.base.util.prolog.grammar.Atom;
import org.logicreader.base.util.prolog.grammar.DefiniteClauseConstruct;
import org.logicreader.base.util.prolog.grammar.Rule;
import org.logicreader.base.util.prolog.grammar.Term;
import org.logicreader.base.util.prolog.grammar.TermFunction;
import org.logicreader.base.util.prolog.grammar.TermList;

/**
 * Entry points for parsing logic program text.
 *
 * Each method parses the whole of the supplied text as the requested construct.  Trailing whitespace and comments are
 * allowed.  Anything else left over is an error unless {@link CfgItem#REQUIRE_COMPLETE_INPUT} has been disabled, in
 * which case it's ignored.
 *
 * All methods are thread-safe.
 */
public final class PrologFactory
{
  private static final Logger LOGGER = LogManager.getLogger();

  private PrologFactory()
  {
  }

  public static Term parseTerm(String text) throws PrologException
  {
    PrologGrammar grammar = new PrologGrammar(text);
    return complete(grammar, grammar.term(0), TargetConstruct.TERM);
  }

  /**
   * Parse a list, e.g. <code>[a, B, f(c)]</code> or <code>[H | T]</code>.
   */
  public static TermList parseTermList(String text) throws PrologException
  {
    PrologGrammar grammar = new PrologGrammar(text);
    return complete(grammar, grammar.list(0), TargetConstruct.TERM_LIST);
  }

  /**
   * Parse a function, e.g. <code>f(X, a)</code>, <code>f(X)=v</code>, <code>f(X)=(v1, v2)</code> or an unnamed tuple
   * <code>(a, b)</code>.
   */
  public static TermFunction parseFunction(String text) throws PrologException
  {
    PrologGrammar grammar = new PrologGrammar(text);
    return complete(grammar, grammar.function(0), TargetConstruct.FUNCTION);
  }

  /**
   * Parse an arithmetic expression with a single infix operator, e.g. <code>X + 1</code>, as the equivalent function,
   * e.g. <code>plus(X, 1)</code>.
   */
  public static TermFunction parseInfixFunction(String text) throws PrologException
  {
    PrologGrammar grammar = new PrologGrammar(text);
    return complete(grammar, grammar.infixFunction(0), TargetConstruct.FUNCTION);
  }

  /**
   * Parse an atomic formula, e.g. <code>happensAt(a(X), T)</code>, <code>raining</code> or <code>X =&lt; 3</code>.
   */
  public static Atom parseAtom(String text) throws PrologException
  {
    PrologGrammar grammar = new PrologGrammar(text);
    return complete(grammar, grammar.atom(0), TargetConstruct.ATOMIC_FORMULA);
  }

  /**
   * Parse something that can form the body of a rule: an atom, a negation or a conjunction.  A terminating full stop
   * is allowed.
   */
  public static DefiniteClauseConstruct parseDefiniteClause(String text) throws PrologException
  {
    PrologGrammar grammar = new PrologGrammar(text);
    return complete(grammar, grammar.definiteClause(0), TargetConstruct.DEFINITE_CLAUSE);
  }

  /**
   * Parse a rule, e.g. <code>initiatedAt(f(X)=true, T) :- happensAt(a(X), T).</code>
   */
  public static Rule parseRule(String text) throws PrologException
  {
    PrologGrammar grammar = new PrologGrammar(text);
    return complete(grammar, grammar.rule(0), TargetConstruct.RULE);
  }

  /**
   * Parse a sequence of rules.
   *
   * @return the rules, in the order that they appear.  Empty if there aren't any.
   */
  public static List<Rule> parseRules(String text) throws PrologException
  {
    PrologGrammar grammar = new PrologGrammar(text);
    return complete(grammar, grammar.rules(0), TargetConstruct.RULES);
  }

  private static <T> T complete(PrologGrammar grammar,
                                ParseResult<? extends T> result,
                                TargetConstruct target) throws PrologFormatException
  {
    if (result == null)
    {
      throw grammar.failure(target);
    }
    if (!grammar.isComplete(result.end) && ParserConfiguration.getCfgBool(CfgItem.REQUIRE_COMPLETE_INPUT))
    {
      throw grammar.failure(target, result.end);
    }
    LOGGER.debug("Parsed " + target.getDescription() + ": " + result.value);
    return result.value;
  }
}
