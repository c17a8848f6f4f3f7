package org.rddl.base.util.rddl.grammar;

/**
 * A top-level block of an RDDL file - a domain, a non-fluents block or an instance.  Blocks are immutable once parsed.
 */
public abstract class RddlBlock
{
  private final String mName;
  private final int    mLine;

  protected RddlBlock(String xiName, int xiLine)
  {
    mName = xiName.intern();
    mLine = xiLine;
  }

  public String getName()
  {
    return mName;
  }

  public int getLine()
  {
    return mLine;
  }

  /**
   * @return the keyword that introduces this kind of block.
   */
  public abstract String getKeyword();

  @Override
  public String toString()
  {
    return getKeyword() + " " + mName;
  }
}
