package org.logicreader.base.util.prolog.grammar;

/**
 * A <i>definite clause construct</i> is what may appear in the body of a <i>rule</i>: an <i>atom</i>, a
 * <i>conjunction</i> or a <i>negation</i>.
 *
 * See {@link LogicalExpression} for a complete description of the formula hierarchy.
 */
@SuppressWarnings("serial")
public abstract class DefiniteClauseConstruct extends Formula
{
  /* Placeholder ancestor class of Atom, Conjunction and Negation. */
}
