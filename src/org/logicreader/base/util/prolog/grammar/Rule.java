package org.logicreader.base.util.prolog.grammar;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * A <i>rule</i> has a head, which is an <i>atom</i>, and a body, which is a {@link DefiniteClauseConstruct}.  It is
 * written <code>head :- body.</code>
 *
 * Both parts are required: headless rules and unit clauses (rules without a body) are rejected.
 *
 * See {@link LogicalExpression} for a complete description of the formula hierarchy.
 */
@SuppressWarnings("serial")
public final class Rule extends Formula
{
  private final Atom                    head;
  private final DefiniteClauseConstruct body;

  public Rule(Atom head, DefiniteClauseConstruct body)
  {
    if (head == null)
    {
      throw new NullPointerException("The head of a rule cannot be null (headless rules are not supported)");
    }
    if (body == null)
    {
      throw new NullPointerException("The body of a rule cannot be null (unit clauses are not supported)");
    }
    this.head = head;
    this.body = body;
  }

  public Atom getHead()
  {
    return head;
  }

  public DefiniteClauseConstruct getBody()
  {
    return body;
  }

  @Override
  public List<Formula> getSubFormulas()
  {
    return Arrays.<Formula>asList(head, body);
  }

  @Override
  public boolean isUnit()
  {
    return false;
  }

  @Override
  protected Set<Variable> computeVariables()
  {
    Set<Variable> result = new LinkedHashSet<>(head.getVariables());
    result.addAll(body.getVariables());
    return Collections.unmodifiableSet(result);
  }

  @Override
  protected Set<Constant> computeConstants()
  {
    Set<Constant> result = new LinkedHashSet<>(head.getConstants());
    result.addAll(body.getConstants());
    return Collections.unmodifiableSet(result);
  }

  @Override
  protected Set<TermFunction> computeFunctions()
  {
    Set<TermFunction> result = new LinkedHashSet<>(head.getFunctions());
    result.addAll(body.getFunctions());
    return Collections.unmodifiableSet(result);
  }

  @Override
  public String toText()
  {
    return head.toText() + " :- " + body.toText() + ".";
  }

  @Override
  public int hashCode()
  {
    return 31 * head.hashCode() + body.hashCode();
  }

  @Override
  public boolean equals(Object other)
  {
    if (!(other instanceof Rule))
    {
      return false;
    }
    Rule rule = (Rule)other;
    return rule.head.equals(head) && rule.body.equals(body);
  }
}
