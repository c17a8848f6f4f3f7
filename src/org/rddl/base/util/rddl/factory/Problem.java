package org.rddl.base.util.rddl.factory;

import org.rddl.base.util.rddl.grammar.RddlDomain;
import org.rddl.base.util.rddl.grammar.RddlInstance;
import org.rddl.base.util.rddl.grammar.RddlNonFluents;
import org.rddl.base.util.symbol.SymbolTable;

/**
 * A loaded and validated problem: the instance and the domain and non-fluents it refers to.
 */
public final class Problem
{
  private final RddlDomain     mDomain;
  private final RddlNonFluents mNonFluents;
  private final RddlInstance   mInstance;
  private final SymbolTable    mSymbols;

  Problem(RddlDomain xiDomain, RddlNonFluents xiNonFluents, RddlInstance xiInstance, SymbolTable xiSymbols)
  {
    mDomain = xiDomain;
    mNonFluents = xiNonFluents;
    mInstance = xiInstance;
    mSymbols = xiSymbols;
  }

  public RddlDomain getDomain()
  {
    return mDomain;
  }

  /**
   * @return the non-fluents block, or null if the instance doesn't use one.
   */
  public RddlNonFluents getNonFluents()
  {
    return mNonFluents;
  }

  public RddlInstance getInstance()
  {
    return mInstance;
  }

  /**
   * @return the symbol table built while validating the problem.
   */
  public SymbolTable getSymbolTable()
  {
    return mSymbols;
  }

  @Override
  public String toString()
  {
    return mInstance.getName() + " (" + mDomain.getName() + ")";
  }
}
