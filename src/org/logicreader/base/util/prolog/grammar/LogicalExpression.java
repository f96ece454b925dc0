package org.logicreader.base.util.prolog.grammar;

import java.io.Serializable;

/**
 * Class at the root of the hierarchy of things that can appear at the top level of a knowledge base: <i>formulas</i>
 * (atoms, rules and the connectives used in rule bodies) and <i>include directives</i>.
 *
 * <h1>The formula hierarchy</h1>
 *
 * <ul>
 *
 * <li><b>Rule</b>: A rule has a head, which is an <i>atom</i>, followed by the <code>:-</code> operator and a body,
 *     which is a <i>definite clause construct</i>.  The rule is terminated by a full stop.
 *
 * <li><b>Definite clause construct</b>: what may appear in the body of a rule.<ul>
 *
 *   <li><b>Atom</b>: A predicate name (starting with a lowercase letter) and, optionally, a parenthesised list of
 *       <i>terms</i>.
 *
 *   <li><b>Conjunction</b>: Two constructs separated by a comma.
 *
 *   <li><b>Negation</b>: A negated construct, written with <code>not</code> or <code>\+</code>.  Either spelling is
 *       printed as <code>not(...)</code>.</ul>
 *
 * </ul>
 *
 * <h1>Worked example</h1>
 *
 * <p><pre>{@code
 * initiatedAt(foo(X, Y)=value, T) :-
 *   happensAt(a(X), T),
 *   not happensAt(b(Y), T).}</pre>
 *
 * <ul>
 *   <li>The whole thing is a <i>rule</i>.
 *   <li><code>initiatedAt(foo(X, Y)=value, T)</code> is the head: an <i>atom</i> of arity 2 whose first argument is
 *       the valued <i>function</i> <code>foo(X, Y)=value</code> (arity 3) and whose second argument is the
 *       <i>variable</i> <code>T</code>.
 *   <li>The body is a <i>conjunction</i> of the atom <code>happensAt(a(X), T)</code> and the <i>negation</i> of the
 *       atom <code>happensAt(b(Y), T)</code>.
 * </ul>
 *
 * The canonical text of the rule is
 * <code>initiatedAt(foo(X, Y)=value, T) :- happensAt(a(X), T), not(happensAt(b(Y), T)).</code>
 */
@SuppressWarnings("serial")
public abstract class LogicalExpression implements Serializable
{
  /**
   * @return the canonical textual form of this expression.
   */
  public abstract String toText();

  @Override
  public String toString()
  {
    return toText();
  }
}
