package org.rddl.base.util.rddl.factory;

import java.io.IOException;
import java.io.Reader;
import java.util.Collections;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.rddl.base.util.rddl.factory.exceptions.RddlSyntaxException;
import org.rddl.base.util.rddl.grammar.RddlDescription;
import org.rddl.base.util.rddl.grammar.RddlDomain;
import org.rddl.base.util.rddl.grammar.RddlInstance;
import org.rddl.base.util.rddl.grammar.RddlNonFluents;
import org.rddl.base.util.statemachine.exceptions.ModelDefinitionException;
import org.rddl.base.util.statemachine.exceptions.ModelValidationException;
import org.rddl.base.util.symbol.ModelChecker;
import org.rddl.base.util.symbol.SymbolTable;

import com.google.common.io.CharStreams;

/**
 * Loads a problem from RDDL source: parses it, picks out an instance, resolves the domain and non-fluents that the
 * instance names and validates the lot.
 */
public final class RddlLoader
{
  private static final Logger LOGGER = LogManager.getLogger();

  private RddlLoader()
  {
    // Static methods only.
  }

  /**
   * Load the first instance in the source.
   *
   * @param xiSource - RDDL source containing at least an instance and the domain it refers to.
   *
   * @throws RddlSyntaxException if the source is malformed.
   * @throws ModelValidationException if the source contains no instance or the problem is invalid.
   */
  public static Problem load(String xiSource) throws RddlSyntaxException, ModelValidationException
  {
    return load(RddlFactory.create(xiSource), null);
  }

  /**
   * Load the first instance from a reader.  The reader is not closed.
   *
   * @throws IOException if the source can't be read.
   * @throws RddlSyntaxException if the source is malformed.
   * @throws ModelValidationException if the source contains no instance or the problem is invalid.
   */
  public static Problem load(Reader xiReader) throws IOException, RddlSyntaxException, ModelValidationException
  {
    return load(CharStreams.toString(xiReader));
  }

  /**
   * Load a named instance.
   *
   * @param xiSource       - RDDL source.
   * @param xiInstanceName - the instance to load.
   *
   * @throws RddlSyntaxException if the source is malformed.
   * @throws ModelValidationException if there's no such instance or the problem is invalid.
   */
  public static Problem load(String xiSource, String xiInstanceName)
    throws RddlSyntaxException, ModelValidationException
  {
    return load(RddlFactory.create(xiSource), xiInstanceName);
  }

  /**
   * Load an instance from already-parsed source.
   *
   * @param xiDescription  - the parsed source.
   * @param xiInstanceName - the instance to load, or null for the first.
   *
   * @throws ModelValidationException if there's no such instance or the problem is invalid.
   */
  public static Problem load(RddlDescription xiDescription, String xiInstanceName) throws ModelValidationException
  {
    RddlInstance lInstance;
    if (xiInstanceName == null)
    {
      if (xiDescription.getInstances().isEmpty())
      {
        throw unresolved("<none>", "No instance found", "instance");
      }
      lInstance = xiDescription.getInstances().get(0);
    }
    else
    {
      lInstance = xiDescription.getInstance(xiInstanceName);
      if (lInstance == null)
      {
        throw unresolved(xiInstanceName, "No instance named " + xiInstanceName, xiInstanceName);
      }
    }

    RddlDomain lDomain = xiDescription.getDomain(lInstance.getDomainName());
    if (lDomain == null)
    {
      throw unresolved(lInstance.getName(),
                       "No domain named " + lInstance.getDomainName(),
                       lInstance.getDomainName());
    }

    RddlNonFluents lNonFluents = null;
    if (lInstance.getNonFluentsName() != null)
    {
      lNonFluents = xiDescription.getNonFluents(lInstance.getNonFluentsName());
      if (lNonFluents == null)
      {
        throw unresolved(lInstance.getName(),
                         "No non-fluents named " + lInstance.getNonFluentsName(),
                         lInstance.getNonFluentsName());
      }
    }

    SymbolTable lSymbols = ModelChecker.check(lDomain, lNonFluents, lInstance);
    LOGGER.debug("Loaded instance " + lInstance.getName() + " of domain " + lDomain.getName());
    return new Problem(lDomain, lNonFluents, lInstance, lSymbols);
  }

  private static ModelValidationException unresolved(String xiModelName, String xiMessage, String xiName)
  {
    return new ModelValidationException(xiModelName,
                                        Collections.singletonList(new ModelDefinitionException(xiMessage, xiName, 0)));
  }
}
