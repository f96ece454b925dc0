package org.logicreader.base.util.prolog.factory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.logicreader.base.util.prolog.exceptions.PrologException;
import org.logicreader.base.util.prolog.exceptions.PrologFormatException;
import org.logicreader.base.util.prolog.exceptions.PrologFormatException.TargetConstruct;
import org.logicreader.base.util.prolog.grammar.Atom;
import org.logicreader.base.util.prolog.grammar.Conjunction;
import org.logicreader.base.util.prolog.grammar.DefiniteClauseConstruct;
import org.logicreader.base.util.prolog.grammar.Negation;
import org.logicreader.base.util.prolog.grammar.Rule;
import org.logicreader.base.util.prolog.grammar.Term;
import org.logicreader.base.util.prolog.grammar.TermFunction;
import org.logicreader.base.util.prolog.grammar.TermList;
import org.logicreader.base.util.prolog.grammar.Variable;

/**
 * Recursive descent grammar for rules, atoms and terms.
 *
 * Every production takes the position to start parsing at and returns either a {@link ParseResult} or null.  A null
 * result means that the production doesn't match there, and the caller goes on to try its next alternative from the
 * same position.  Alternatives are tried in order and the first match wins, so the order of the alternatives in each
 * production matters.
 *
 * Whitespace and comments (<code>// ...</code>, <code>% ...</code> and <code>/* ... *&#47;</code>) are skipped before
 * every token.
 *
 * A grammar object holds the text being parsed and the furthest position at which a token failed to match (used to
 * report where parsing went wrong).  It is used for a single parse and isn't thread-safe.
 */
final class PrologGrammar
{
  private static final Logger LOGGER = LogManager.getLogger();

  private static final Pattern WHITESPACE =
                  Pattern.compile("(?:\\s|//[^\\n]*(?:\\n|$)|%[^\\n]*(?:\\n|$)|/\\*(?s:.*?)\\*/)+");

  private static final Pattern BLANKS = Pattern.compile("\\s+");

  private static final String NEGATION_KEYWORD = "not";

  private static final Pattern NEGATION_SYMBOL = Pattern.compile("not(?![a-zA-Z0-9_])|\\\\\\+");

  private static final Pattern NUMBER = Pattern.compile("-?\\d+(?:\\.\\d+)?");

  /**
   * Lexical term alternatives, in the order they're tried (after functions and lists).
   */
  private static final Pattern[] TERM_TOKENS = {TermClassifier.LOWER_CASE,
                                                TermClassifier.UPPER_CASE,
                                                TermClassifier.FLOATING_POINT,
                                                TermClassifier.INTEGER,
                                                TermClassifier.SINGLE_QUOTED,
                                                TermClassifier.DOUBLE_QUOTED};

  private final String input;
  private int          furthestFailure;

  PrologGrammar(String input)
  {
    this.input = input;
    furthestFailure = 0;
  }

  //--------------------------------------------------------------------------------------------------------------------
  // Rules and formulas
  //--------------------------------------------------------------------------------------------------------------------

  /**
   * rules := { rule }
   */
  ParseResult<List<Rule>> rules(int pos) throws PrologException
  {
    List<Rule> rules = new ArrayList<>();
    ParseResult<Rule> rule = rule(pos);
    while (rule != null)
    {
      rules.add(rule.value);
      pos = rule.end;
      rule = rule(pos);
    }
    return new ParseResult<>(rules, pos);
  }

  /**
   * rule := atom ":-" body "."
   */
  ParseResult<Rule> rule(int pos) throws PrologException
  {
    ParseResult<Atom> head = atom(pos);
    if (head == null)
    {
      return null;
    }
    int next = literal(head.end, ":-");
    if (next < 0)
    {
      return null;
    }
    ParseResult<? extends DefiniteClauseConstruct> body = ruleBody(next);
    if (body == null)
    {
      return null;
    }
    next = literal(body.end, ".");
    if (next < 0)
    {
      return null;
    }
    return new ParseResult<>(new Rule(head.value, body.value), next);
  }

  /**
   * A rule body on its own, optionally followed by the full stop that would terminate the rule.
   */
  ParseResult<? extends DefiniteClauseConstruct> definiteClause(int pos) throws PrologException
  {
    ParseResult<? extends DefiniteClauseConstruct> body = ruleBody(pos);
    if (body == null)
    {
      return null;
    }
    int next = literal(body.end, ".");
    return (next < 0) ? body : new ParseResult<>(body.value, next);
  }

  /**
   * body := conjunction | atom | negation
   */
  ParseResult<? extends DefiniteClauseConstruct> ruleBody(int pos) throws PrologException
  {
    ParseResult<? extends DefiniteClauseConstruct> result = conjunction(pos);
    if (result == null)
    {
      result = atom(pos);
    }
    if (result == null)
    {
      result = negation(pos);
    }
    return result;
  }

  /**
   * conjunction := literal { "," literal }, folded to the left.  A single literal is returned as it is.
   */
  private ParseResult<? extends DefiniteClauseConstruct> conjunction(int pos) throws PrologException
  {
    ParseResult<? extends DefiniteClauseConstruct> first = bodyLiteral(pos);
    if (first == null)
    {
      return null;
    }

    DefiniteClauseConstruct result = first.value;
    int end = first.end;
    while (true)
    {
      int next = literal(end, ",");
      if (next < 0)
      {
        break;
      }
      ParseResult<? extends DefiniteClauseConstruct> operand = bodyLiteral(next);
      if (operand == null)
      {
        break;
      }
      result = new Conjunction(result, operand.value);
      end = operand.end;
    }
    return new ParseResult<>(result, end);
  }

  /**
   * literal := negation | atom
   */
  private ParseResult<? extends DefiniteClauseConstruct> bodyLiteral(int pos) throws PrologException
  {
    ParseResult<? extends DefiniteClauseConstruct> result = negation(pos);
    if (result == null)
    {
      result = atom(pos);
    }
    return result;
  }

  /**
   * negation := negSymbol atom | negSymbol "(" atom ")" | negSymbol "(" body ")"
   */
  ParseResult<Negation> negation(int pos) throws PrologException
  {
    ParseResult<String> symbol = token(pos, NEGATION_SYMBOL);
    if (symbol == null)
    {
      return null;
    }

    // not atom(...)
    ParseResult<Atom> atom = atom(symbol.end);
    if (atom != null)
    {
      return new ParseResult<>(new Negation(atom.value), atom.end);
    }

    int open = literal(symbol.end, "(");
    if (open < 0)
    {
      return null;
    }

    // not (atom(...))
    atom = atom(open);
    if (atom != null)
    {
      int close = literal(atom.end, ")");
      if (close >= 0)
      {
        return new ParseResult<>(new Negation(atom.value), close);
      }
    }

    // not (a(...), b(...), ...)
    ParseResult<? extends DefiniteClauseConstruct> body = ruleBody(open);
    if (body != null)
    {
      int close = literal(body.end, ")");
      if (close >= 0)
      {
        return new ParseResult<>(new Negation(body.value), close);
      }
    }

    return null;
  }

  /**
   * atom := infixAtom | typicalAtom
   */
  ParseResult<Atom> atom(int pos) throws PrologException
  {
    ParseResult<Atom> result = infixAtom(pos);
    if (result == null)
    {
      result = typicalAtom(pos);
    }
    return result;
  }

  /**
   * typicalAtom := lowercase [ "(" [ term { "," term } ] ")" ]
   *
   * The negation keyword is never an atom name, so <code>not(not(a))</code> is a double negation.
   */
  ParseResult<Atom> typicalAtom(int pos) throws PrologException
  {
    ParseResult<String> symbol = token(pos, TermClassifier.LOWER_CASE);
    if ((symbol == null) || (symbol.value.equals(NEGATION_KEYWORD)))
    {
      return null;
    }

    ParseResult<List<Term>> args = parenthesised(symbol.end);
    if (args == null)
    {
      return new ParseResult<>(new Atom(symbol.value, Collections.<Term>emptyList()), symbol.end);
    }
    return new ParseResult<>(new Atom(symbol.value, args.value), args.end);
  }

  /**
   * infixAtom := operand relOp operand, rewritten as the atom <code>relSymbol(left, right)</code>.  The rewritten text
   * is parsed again as a typical atom.
   */
  private ParseResult<Atom> infixAtom(int pos) throws PrologException
  {
    ParseResult<String> left = relationalOperand(pos);
    if (left == null)
    {
      return null;
    }

    int start = skipWhitespace(left.end);
    InfixOperator operator = InfixOperator.match(input, start, InfixOperator.Category.RELATIONAL);
    if (operator == null)
    {
      fail(start);
      return null;
    }

    ParseResult<String> right = relationalOperand(start + operator.getToken().length());
    if (right == null)
    {
      return null;
    }

    String rewritten = operator.rewrite(left.value, right.value);
    LOGGER.debug("Rewriting '" + input.substring(skipWhitespace(pos), right.end) + "' as '" + rewritten + "'");

    PrologGrammar grammar = new PrologGrammar(rewritten);
    ParseResult<Atom> atom = grammar.typicalAtom(0);
    if ((atom == null) || (!grammar.isComplete(atom.end)))
    {
      throw (atom == null) ? grammar.failure(TargetConstruct.ATOMIC_FORMULA) :
                            grammar.failure(TargetConstruct.ATOMIC_FORMULA, atom.end);
    }
    return new ParseResult<>(atom.value, right.end);
  }

  /**
   * The text of an operand of a relational operator: a function call (with balanced parentheses), a lowercase word,
   * an uppercase word or a number.
   */
  private ParseResult<String> relationalOperand(int pos)
  {
    int start = skipWhitespace(pos);

    Matcher name = TermClassifier.LOWER_CASE.matcher(input);
    name.region(start, input.length());
    if (name.lookingAt())
    {
      int open = skipWhitespace(name.end());
      if ((open < input.length()) && (input.charAt(open) == '('))
      {
        int close = matchingParenthesis(open);
        if (close >= 0)
        {
          return new ParseResult<>(input.substring(start, close + 1), close + 1);
        }
      }
      return new ParseResult<>(name.group(), name.end());
    }

    ParseResult<String> result = token(start, TermClassifier.UPPER_CASE);
    if (result == null)
    {
      result = token(start, NUMBER);
    }
    return result;
  }

  /**
   * @return the position of the parenthesis closing the one at the specified position, or -1 if it isn't closed.
   */
  private int matchingParenthesis(int open)
  {
    int depth = 0;
    char quote = 0;
    for (int ii = open; ii < input.length(); ii++)
    {
      char c = input.charAt(ii);
      if (quote != 0)
      {
        if (c == quote)
        {
          quote = 0;
        }
      }
      else if ((c == '\'') || (c == '"'))
      {
        quote = c;
      }
      else if (c == '(')
      {
        depth++;
      }
      else if ((c == ')') && (--depth == 0))
      {
        return ii;
      }
    }
    return -1;
  }

  //--------------------------------------------------------------------------------------------------------------------
  // Terms
  //--------------------------------------------------------------------------------------------------------------------

  /**
   * term := function | list | lowercase | uppercase | float | integer | 'quoted' | "quoted"
   */
  ParseResult<? extends Term> term(int pos) throws PrologException
  {
    ParseResult<? extends Term> result = function(pos);
    if (result == null)
    {
      result = list(pos);
    }
    if (result != null)
    {
      return result;
    }

    for (Pattern pattern : TERM_TOKENS)
    {
      ParseResult<String> token = token(pos, pattern);
      if (token != null)
      {
        return new ParseResult<>(TermClassifier.classify(token.value), token.end);
      }
    }
    return null;
  }

  /**
   * function := multiValuedFunction | valuedFunction | simpleFunction | anonymousFunction
   *
   * multiValuedFunction := simpleFunction "=" "(" [ term { "," term } ] ")"
   * valuedFunction      := simpleFunction "=" term
   *
   * The three named forms share their prefix, so it's only parsed once.
   */
  ParseResult<TermFunction> function(int pos) throws PrologException
  {
    ParseResult<TermFunction> function = simpleFunction(pos);
    if (function == null)
    {
      return anonymousFunction(pos);
    }

    int next = literal(function.end, "=");
    if (next < 0)
    {
      return function;
    }

    ParseResult<List<Term>> values = parenthesised(next);
    if (values != null)
    {
      return new ParseResult<>(new TermFunction(function.value.getSymbol(), function.value.getTerms(), values.value),
                               values.end);
    }

    ParseResult<? extends Term> value = term(next);
    if (value != null)
    {
      return new ParseResult<>(new TermFunction(function.value.getSymbol(),
                                                function.value.getTerms(),
                                                Collections.singletonList(value.value)),
                               value.end);
    }

    return function;
  }

  /**
   * simpleFunction := lowercase "(" [ term { "," term } ] ")"
   */
  private ParseResult<TermFunction> simpleFunction(int pos) throws PrologException
  {
    ParseResult<String> symbol = token(pos, TermClassifier.LOWER_CASE);
    if (symbol == null)
    {
      return null;
    }
    ParseResult<List<Term>> args = parenthesised(symbol.end);
    if (args == null)
    {
      return null;
    }
    return new ParseResult<>(new TermFunction(symbol.value, args.value), args.end);
  }

  /**
   * anonymousFunction := "(" [ term { "," term } ] ")"
   */
  private ParseResult<TermFunction> anonymousFunction(int pos) throws PrologException
  {
    ParseResult<List<Term>> args = parenthesised(pos);
    if (args == null)
    {
      return null;
    }
    return new ParseResult<>(new TermFunction("", args.value), args.end);
  }

  /**
   * infixFunction := operand arithOp operand, rewritten as the function <code>arithSymbol(left, right)</code>.  The
   * rewritten text is parsed again as a function.
   *
   * Only blanks are skipped before the operator, since "%" and "/" would otherwise be taken for the start of a
   * comment.
   */
  ParseResult<TermFunction> infixFunction(int pos) throws PrologException
  {
    ParseResult<String> left = arithmeticOperand(pos);
    if (left == null)
    {
      return null;
    }

    int start = skipBlanks(left.end);
    InfixOperator operator = InfixOperator.match(input, start, InfixOperator.Category.ARITHMETIC);
    if (operator == null)
    {
      fail(start);
      return null;
    }

    ParseResult<String> right = arithmeticOperand(start + operator.getToken().length());
    if (right == null)
    {
      return null;
    }

    String rewritten = operator.rewrite(left.value, right.value);
    LOGGER.debug("Rewriting '" + input.substring(skipWhitespace(pos), right.end) + "' as '" + rewritten + "'");

    PrologGrammar grammar = new PrologGrammar(rewritten);
    ParseResult<TermFunction> function = grammar.function(0);
    if ((function == null) || (!grammar.isComplete(function.end)))
    {
      throw (function == null) ? grammar.failure(TargetConstruct.FUNCTION) :
                                grammar.failure(TargetConstruct.FUNCTION, function.end);
    }
    return new ParseResult<>(function.value, right.end);
  }

  /**
   * The text of an operand of an arithmetic operator: a function (printed in canonical form), a word or a number.
   */
  private ParseResult<String> arithmeticOperand(int pos) throws PrologException
  {
    ParseResult<TermFunction> function = function(pos);
    if (function != null)
    {
      return new ParseResult<>(function.value.toText(), function.end);
    }

    ParseResult<String> result = token(pos, TermClassifier.LOWER_CASE);
    if (result == null)
    {
      result = token(pos, TermClassifier.UPPER_CASE);
    }
    if (result == null)
    {
      result = token(pos, NUMBER);
    }
    return result;
  }

  /**
   * list := "[" [ term { "," term } ] ( "]" | "|" ( uppercase | list ) "]" )
   *
   * The elements before the bar are parsed once, whichever form the list takes.  A variable tail is kept as a single
   * (last) element.  A list tail is flattened into the result, so <code>[1, 2 | [3]]</code> is the list
   * <code>[1, 2, 3]</code>.
   */
  ParseResult<TermList> list(int pos) throws PrologException
  {
    int next = literal(pos, "[");
    if (next < 0)
    {
      return null;
    }
    ParseResult<List<Term>> head = termSequence(next);

    next = literal(head.end, "]");
    if (next >= 0)
    {
      return new ParseResult<>(new TermList(head.value), next);
    }

    next = literal(head.end, "|");
    if (next < 0)
    {
      return null;
    }

    List<Term> terms = new ArrayList<>(head.value);
    ParseResult<String> tailVariable = token(next, TermClassifier.UPPER_CASE);
    if (tailVariable != null)
    {
      terms.add(new Variable(tailVariable.value));
      next = tailVariable.end;
    }
    else
    {
      ParseResult<TermList> tailList = list(next);
      if (tailList == null)
      {
        return null;
      }
      terms.addAll(tailList.value.getTerms());
      next = tailList.end;
    }

    next = literal(next, "]");
    if (next < 0)
    {
      return null;
    }
    return new ParseResult<>(new TermList(terms), next);
  }

  /**
   * "(" [ term { "," term } ] ")"
   */
  private ParseResult<List<Term>> parenthesised(int pos) throws PrologException
  {
    int next = literal(pos, "(");
    if (next < 0)
    {
      return null;
    }
    ParseResult<List<Term>> terms = termSequence(next);
    next = literal(terms.end, ")");
    if (next < 0)
    {
      return null;
    }
    return new ParseResult<>(terms.value, next);
  }

  /**
   * [ term { "," term } ] - never fails, but may be empty.
   */
  private ParseResult<List<Term>> termSequence(int pos) throws PrologException
  {
    List<Term> terms = new ArrayList<>();
    ParseResult<? extends Term> term = term(pos);
    if (term == null)
    {
      return new ParseResult<>(terms, pos);
    }

    terms.add(term.value);
    int end = term.end;
    while (true)
    {
      int next = literal(end, ",");
      if (next < 0)
      {
        break;
      }
      term = term(next);
      if (term == null)
      {
        break;
      }
      terms.add(term.value);
      end = term.end;
    }
    return new ParseResult<>(terms, end);
  }

  //--------------------------------------------------------------------------------------------------------------------
  // Tokens
  //--------------------------------------------------------------------------------------------------------------------

  /**
   * Match a fixed token.
   *
   * @return the position after the token, or -1 if the token isn't next.
   */
  private int literal(int pos, String token)
  {
    int start = skipWhitespace(pos);
    if (input.startsWith(token, start))
    {
      return start + token.length();
    }
    fail(start);
    return -1;
  }

  /**
   * Match a token described by a pattern (longest match at the current position).
   */
  private ParseResult<String> token(int pos, Pattern pattern)
  {
    int start = skipWhitespace(pos);
    Matcher matcher = pattern.matcher(input);
    matcher.region(start, input.length());
    if (matcher.lookingAt())
    {
      return new ParseResult<>(matcher.group(), matcher.end());
    }
    fail(start);
    return null;
  }

  private int skipWhitespace(int pos)
  {
    return skip(pos, WHITESPACE);
  }

  private int skipBlanks(int pos)
  {
    return skip(pos, BLANKS);
  }

  private int skip(int pos, Pattern pattern)
  {
    Matcher matcher = pattern.matcher(input);
    matcher.region(pos, input.length());
    return matcher.lookingAt() ? matcher.end() : pos;
  }

  private void fail(int pos)
  {
    if (pos > furthestFailure)
    {
      furthestFailure = pos;
    }
  }

  //--------------------------------------------------------------------------------------------------------------------
  // Outcome
  //--------------------------------------------------------------------------------------------------------------------

  /**
   * @return whether nothing but whitespace and comments follows the specified position.
   */
  boolean isComplete(int end)
  {
    return skipWhitespace(end) == input.length();
  }

  /**
   * @return an exception describing a failure to match the specified construct at the start of the input.
   *
   * The remainder starts where a token last failed to match.  If that was the end of the input, it starts at the
   * innermost bracket left open instead.
   */
  PrologFormatException failure(TargetConstruct target)
  {
    int stuck = furthestFailure;
    if (stuck >= input.length())
    {
      stuck = innermostUnclosedBracket();
    }
    return new PrologFormatException(target, input, input.substring(stuck));
  }

  /**
   * @return an exception describing input left over after the specified construct was matched.
   *
   * @param target - the construct that was parsed.
   * @param end    - the position that parsing got to.
   */
  PrologFormatException failure(TargetConstruct target, int end)
  {
    return new PrologFormatException(target, input, input.substring(skipWhitespace(end)));
  }

  /**
   * @return the position of the innermost "(" or "[" that is never closed, or the length of the input if every
   *         bracket is closed.
   */
  private int innermostUnclosedBracket()
  {
    Deque<Integer> open = new ArrayDeque<>();
    char quote = 0;
    for (int ii = 0; ii < input.length(); ii++)
    {
      char c = input.charAt(ii);
      if (quote != 0)
      {
        if (c == quote)
        {
          quote = 0;
        }
      }
      else if ((c == '\'') || (c == '"'))
      {
        quote = c;
      }
      else if ((c == '(') || (c == '['))
      {
        open.push(ii);
      }
      else if (((c == ')') || (c == ']')) && (!open.isEmpty()))
      {
        open.pop();
      }
    }
    return open.isEmpty() ? input.length() : open.peek();
  }
}
