package org.logicreader.base.util.prolog.grammar;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import org.apache.commons.lang.StringUtils;

/**
 * A term is a <i>variable</i>, a <i>constant</i>, a <i>function</i> or a <i>list</i>.  It's what fills one "slot" in
 * the argument list of an <i>atom</i> or of a <i>function</i>.
 *
 * <ul>
 *   <li><b>Variable</b>: a word starting with an uppercase letter, e.g. <code>X</code> or <code>Time</code>.
 *   <li><b>Constant</b>: a boolean, an integer, a floating point number or a string.  Lowercase words and quoted
 *       literals are string constants.
 *   <li><b>Function</b>: a name followed by a parenthesised body of terms, optionally associated with one or more
 *       values, e.g. <code>foo(X)</code>, <code>foo(X)=bar</code> or <code>foo(X)=(bar, baz)</code>.
 *   <li><b>List</b>: a bracketed sequence of terms, e.g. <code>[a, B, f(c)]</code>.
 * </ul>
 *
 * Terms are immutable.  The sets of variables, constants and functions that are reachable from a compound term are
 * computed on first use and cached.
 *
 * See {@link Formula} for the formulas that are built on top of terms.
 */
@SuppressWarnings("serial")
public abstract class Term implements Serializable
{
  /**
   * The variants of a term.
   */
  public static enum Kind
  {
    VARIABLE,
    CONSTANT,
    FUNCTION,
    LIST
  }

  /**
   * @return which variant of term this is.
   */
  public abstract Kind getKind();

  /**
   * @return whether this term is ground - i.e. no variable is reachable from it.
   */
  public abstract boolean isGround();

  /**
   * @return the canonical textual form of this term.
   */
  public abstract String toText();

  public boolean isVariable()
  {
    return getKind() == Kind.VARIABLE;
  }

  public boolean isConstant()
  {
    return getKind() == Kind.CONSTANT;
  }

  public boolean isFunction()
  {
    return getKind() == Kind.FUNCTION;
  }

  public boolean isList()
  {
    return getKind() == Kind.LIST;
  }

  /**
   * Add the variables reachable from this term to the specified set.
   */
  abstract void addVariablesTo(Set<Variable> variables);

  /**
   * Add the constants reachable from this term to the specified set.
   */
  abstract void addConstantsTo(Set<Constant> constants);

  /**
   * Add the functions reachable from this term (including this term itself, if it is a function) to the specified
   * set.
   */
  abstract void addFunctionsTo(Set<TermFunction> functions);

  /**
   * @return the canonical text of the specified terms, separated by ", ".
   */
  static String toText(List<? extends Term> terms)
  {
    List<String> texts = new ArrayList<>(terms.size());
    for (Term term : terms)
    {
      texts.add(term.toText());
    }
    return StringUtils.join(texts, ", ");
  }
}
