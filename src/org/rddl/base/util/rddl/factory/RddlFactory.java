package org.rddl.base.util.rddl.factory;

import java.io.IOException;
import java.io.Reader;
import java.util.List;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.rddl.base.util.rddl.factory.Token.Type;
import org.rddl.base.util.rddl.factory.exceptions.RddlSyntaxException;
import org.rddl.base.util.rddl.grammar.RddlDescription;
import org.rddl.base.util.rddl.grammar.RddlExpression;

import com.google.common.io.CharStreams;

/**
 * Entry point for turning RDDL source text into the grammar objects of {@link org.rddl.base.util.rddl.grammar}.
 *
 * Parsing is purely syntactic.  Use {@link RddlLoader} to resolve references between blocks and validate the result.
 */
public final class RddlFactory
{
  private static final Logger LOGGER = LogManager.getLogger();

  private RddlFactory()
  {
    // Static methods only.
  }

  /**
   * Parse RDDL source text.
   *
   * @param xiSource - the source.
   * @return all blocks found in the source.
   *
   * @throws RddlSyntaxException if the source is malformed.
   */
  public static RddlDescription create(String xiSource) throws RddlSyntaxException
  {
    List<Token> lTokens = RddlLexer.tokenize(xiSource);
    LOGGER.trace("Tokenized source into " + lTokens.size() + " tokens");

    RddlDescription lDescription = new RddlParser(lTokens).parseDescription();
    LOGGER.debug("Parsed " + lDescription.getDomains().size() + " domain(s), " +
                 lDescription.getNonFluents().size() + " non-fluents block(s) and " +
                 lDescription.getInstances().size() + " instance(s)");
    return lDescription;
  }

  /**
   * Parse RDDL source from a reader.  The reader is not closed.
   *
   * @throws IOException if the source can't be read.
   * @throws RddlSyntaxException if the source is malformed.
   */
  public static RddlDescription create(Reader xiReader) throws IOException, RddlSyntaxException
  {
    return create(CharStreams.toString(xiReader));
  }

  /**
   * Parse a single expression.
   *
   * @param xiSource - the expression text.
   * @return the expression.
   *
   * @throws RddlSyntaxException if the text is not exactly one well-formed expression.
   */
  public static RddlExpression createExpression(String xiSource) throws RddlSyntaxException
  {
    List<Token> lTokens = RddlLexer.tokenize(xiSource);
    RddlParser lParser = new RddlParser(lTokens);
    RddlExpression lExpression = lParser.parseExpression();

    Token lTrailing = lParser.peekToken();
    if (lTrailing.getType() != Type.EOF)
    {
      throw new RddlSyntaxException("Unexpected text after expression",
                                    lTrailing.getText(),
                                    lTrailing.getLine(),
                                    lTrailing.getColumn());
    }
    return lExpression;
  }
}
