package org.logicreader.base.util.prolog.exceptions;

/**
 * Abstract class for exceptions that are a result of bad logic program text.
 */
public abstract class PrologException extends Exception
{
  private static final long serialVersionUID = 1L;

  protected PrologException(String message)
  {
    super(message);
  }

  protected PrologException(String message, Throwable cause)
  {
    super(message, cause);
  }
}
