package org.logicreader.base.util.prolog.factory;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.logicreader.base.util.prolog.exceptions.TermFormatException;
import org.logicreader.base.util.prolog.grammar.BooleanConstant;
import org.logicreader.base.util.prolog.grammar.FloatConstant;
import org.logicreader.base.util.prolog.grammar.IntegerConstant;
import org.logicreader.base.util.prolog.grammar.StringConstant;
import org.logicreader.base.util.prolog.grammar.Term;
import org.logicreader.base.util.prolog.grammar.Variable;

/**
 * Classifies a lexical fragment (already isolated by the grammar) as a variable or constant.
 *
 * <p>Several of the patterns overlap, so they're tried in a fixed order:
 * <ol>
 *   <li>Quoted literal whose content starts with an uppercase letter or a digit (after an optional '-'): a string
 *       constant that keeps its quotes, e.g. <code>'X'</code> or <code>"010101"</code>.
 *   <li>Quoted literal whose content starts with a lowercase letter: a string constant without the quotes, so
 *       <code>'x'</code> is the same constant as <code>x</code>.
 *   <li>Lowercase word: <code>true</code> and <code>false</code> are boolean constants, anything else is a string
 *       constant.
 *   <li>Floating point number, e.g. <code>-10.1</code>.
 *   <li>Integer, e.g. <code>-10</code>.
 *   <li>Uppercase word: a variable.
 * </ol>
 * Anything else is rejected.
 */
public final class TermClassifier
{
  private static final String IDENTIFIER_TAIL = "(?:[a-zA-Z0-9]|_[a-zA-Z0-9])*";

  /**
   * Words starting with a lowercase letter (predicate, function and constant names).
   */
  static final Pattern LOWER_CASE = Pattern.compile("[a-z]" + IDENTIFIER_TAIL);

  /**
   * Words starting with an uppercase letter (variable names).
   */
  static final Pattern UPPER_CASE = Pattern.compile("[A-Z]" + IDENTIFIER_TAIL);

  static final Pattern FLOATING_POINT = Pattern.compile("-?\\d+\\.\\d+");

  static final Pattern INTEGER = Pattern.compile("-?\\d+");

  /**
   * Any single quoted literal.  The content decides (below) what kind of constant it is.
   */
  static final Pattern SINGLE_QUOTED = Pattern.compile("'-?" + IDENTIFIER_TAIL + "'");

  static final Pattern DOUBLE_QUOTED = Pattern.compile("\"-?" + IDENTIFIER_TAIL + "\"");

  private static final Pattern SINGLE_QUOTED_UPPER = Pattern.compile("'-?[A-Z0-9]" + IDENTIFIER_TAIL + "'");

  private static final Pattern SINGLE_QUOTED_LOWER = Pattern.compile("'(-?[a-z]" + IDENTIFIER_TAIL + ")'");

  private static final Pattern DOUBLE_QUOTED_UPPER = Pattern.compile("\"-?[A-Z0-9]" + IDENTIFIER_TAIL + "\"");

  private static final Pattern DOUBLE_QUOTED_LOWER = Pattern.compile("\"(-?[a-z]" + IDENTIFIER_TAIL + ")\"");

  private TermClassifier()
  {
  }

  /**
   * Classify a fragment of text as a term.
   *
   * @param fragment - the fragment, with no surrounding whitespace.
   *
   * @return the variable or constant that the fragment denotes.
   *
   * @throws TermFormatException if the fragment doesn't match any kind of term.
   */
  public static Term classify(String fragment) throws TermFormatException
  {
    if ((SINGLE_QUOTED_UPPER.matcher(fragment).matches()) || (DOUBLE_QUOTED_UPPER.matcher(fragment).matches()))
    {
      return new StringConstant(fragment);
    }

    Matcher quotedLower = SINGLE_QUOTED_LOWER.matcher(fragment);
    if (!quotedLower.matches())
    {
      quotedLower = DOUBLE_QUOTED_LOWER.matcher(fragment);
    }
    if (quotedLower.matches())
    {
      return new StringConstant(quotedLower.group(1));
    }

    if (LOWER_CASE.matcher(fragment).matches())
    {
      if (fragment.equals("true"))
      {
        return new BooleanConstant(true);
      }
      if (fragment.equals("false"))
      {
        return new BooleanConstant(false);
      }
      return new StringConstant(fragment);
    }

    try
    {
      if (FLOATING_POINT.matcher(fragment).matches())
      {
        return new FloatConstant(Double.parseDouble(fragment));
      }

      if (INTEGER.matcher(fragment).matches())
      {
        return new IntegerConstant(Long.parseLong(fragment));
      }
    }
    catch (NumberFormatException e)
    {
      // Integer literal out of the range of a long.
      throw new TermFormatException(fragment, e);
    }

    if (UPPER_CASE.matcher(fragment).matches())
    {
      return new Variable(fragment);
    }

    throw new TermFormatException(fragment);
  }
}
