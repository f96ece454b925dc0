package org.logicreader.base.util.prolog.grammar;

/**
 * A directive to include another knowledge base file.  This is data only: the file is never resolved or read here.
 */
@SuppressWarnings("serial")
public final class IncludeFileExpression extends LogicalExpression
{
  private final String filename;

  public IncludeFileExpression(String filename)
  {
    if (filename == null)
    {
      throw new NullPointerException("An include directive must name a file");
    }
    this.filename = filename;
  }

  public String getFilename()
  {
    return filename;
  }

  @Override
  public String toText()
  {
    return "include(\"" + filename + "\").";
  }

  @Override
  public int hashCode()
  {
    return filename.hashCode();
  }

  @Override
  public boolean equals(Object other)
  {
    return (other instanceof IncludeFileExpression) && ((IncludeFileExpression)other).filename.equals(filename);
  }
}
