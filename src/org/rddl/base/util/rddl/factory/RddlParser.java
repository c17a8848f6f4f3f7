package org.rddl.base.util.rddl.factory;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import org.rddl.base.util.rddl.factory.Token.Type;
import org.rddl.base.util.rddl.factory.exceptions.RddlSyntaxException;
import org.rddl.base.util.rddl.factory.exceptions.UnknownBlockException;
import org.rddl.base.util.rddl.grammar.FluentClass;
import org.rddl.base.util.rddl.grammar.RddlAggregation;
import org.rddl.base.util.rddl.grammar.RddlAssignment;
import org.rddl.base.util.rddl.grammar.RddlBinaryExpression;
import org.rddl.base.util.rddl.grammar.RddlConditional;
import org.rddl.base.util.rddl.grammar.RddlConstant;
import org.rddl.base.util.rddl.grammar.RddlCpf;
import org.rddl.base.util.rddl.grammar.RddlDescription;
import org.rddl.base.util.rddl.grammar.RddlDistribution;
import org.rddl.base.util.rddl.grammar.RddlDomain;
import org.rddl.base.util.rddl.grammar.RddlExpression;
import org.rddl.base.util.rddl.grammar.RddlInstance;
import org.rddl.base.util.rddl.grammar.RddlNonFluents;
import org.rddl.base.util.rddl.grammar.RddlObjectDeclaration;
import org.rddl.base.util.rddl.grammar.RddlTypeDefinition;
import org.rddl.base.util.rddl.grammar.RddlTypedParameter;
import org.rddl.base.util.rddl.grammar.RddlUnaryExpression;
import org.rddl.base.util.rddl.grammar.RddlValue;
import org.rddl.base.util.rddl.grammar.RddlValueType;
import org.rddl.base.util.rddl.grammar.RddlVariableDefinition;
import org.rddl.base.util.rddl.grammar.RddlVariableReference;

/**
 * Recursive descent parser for RDDL.  Produces an unresolved {@link RddlDescription} - no checking of names or types
 * is done here.
 *
 * Operator precedence, loosest first: <code>=&gt;</code> and <code>&lt;=&gt;</code> (right associative),
 * <code>|</code>, <code>^</code>, relational (non-associative), additive, multiplicative, unary.
 */
final class RddlParser
{
  private final List<Token> mTokens;
  private int               mPos = 0;

  RddlParser(List<Token> xiTokens)
  {
    mTokens = xiTokens;
  }

  //////////////////////////////////////////////////
  // Blocks.
  //////////////////////////////////////////////////

  RddlDescription parseDescription() throws RddlSyntaxException
  {
    List<RddlDomain> lDomains = new ArrayList<>();
    List<RddlNonFluents> lNonFluents = new ArrayList<>();
    List<RddlInstance> lInstances = new ArrayList<>();

    while (peek().getType() != Type.EOF)
    {
      Token lKeyword = next();
      if (lKeyword.isKeyword("domain"))
      {
        lDomains.add(parseDomain(lKeyword));
      }
      else if (lKeyword.isKeyword("non-fluents"))
      {
        lNonFluents.add(parseNonFluents(lKeyword));
      }
      else if (lKeyword.isKeyword("instance"))
      {
        lInstances.add(parseInstance(lKeyword));
      }
      else
      {
        throw new UnknownBlockException(lKeyword.getText(), lKeyword.getLine(), lKeyword.getColumn());
      }
      accept(Type.SEMICOLON);
    }

    return new RddlDescription(lDomains, lNonFluents, lInstances);
  }

  private RddlDomain parseDomain(Token xiKeyword) throws RddlSyntaxException
  {
    String lName = expect(Type.IDENTIFIER, "domain name").getText();
    expect(Type.LBRACE, "'{'");

    Set<String> lRequirements = new LinkedHashSet<>();
    List<RddlTypeDefinition> lTypes = new ArrayList<>();
    List<RddlVariableDefinition> lVariables = new ArrayList<>();
    List<RddlCpf> lCpfs = new ArrayList<>();
    RddlExpression lReward = null;
    List<RddlExpression> lConstraints = new ArrayList<>();
    List<RddlExpression> lInvariants = new ArrayList<>();

    while (!accept(Type.RBRACE))
    {
      Token lSection = expect(Type.IDENTIFIER, "domain section");
      switch (lSection.getText())
      {
        case "requirements":
          accept(Type.ASSIGN);
          expect(Type.LBRACE, "'{'");
          if (!accept(Type.RBRACE))
          {
            do
            {
              lRequirements.add(expect(Type.IDENTIFIER, "requirement").getText());
            }
            while (accept(Type.COMMA));
            expect(Type.RBRACE, "'}'");
          }
          break;

        case "types":
          expect(Type.LBRACE, "'{'");
          while (!accept(Type.RBRACE))
          {
            lTypes.add(parseTypeDefinition());
          }
          break;

        case "pvariables":
          expect(Type.LBRACE, "'{'");
          while (!accept(Type.RBRACE))
          {
            lVariables.add(parseVariableDefinition());
          }
          break;

        case "cpfs":
        case "cdfs":
          expect(Type.LBRACE, "'{'");
          while (!accept(Type.RBRACE))
          {
            lCpfs.add(parseCpf());
          }
          break;

        case "reward":
          expect(Type.ASSIGN, "'='");
          lReward = parseExpression();
          break;

        case "state-action-constraints":
        case "action-preconditions":
          parseExpressionList(lConstraints);
          break;

        case "state-invariants":
          parseExpressionList(lInvariants);
          break;

        default:
          throw error("Unknown domain section", lSection);
      }
      accept(Type.SEMICOLON);
    }

    return new RddlDomain(lName,
                          lRequirements,
                          lTypes,
                          lVariables,
                          lCpfs,
                          lReward,
                          lConstraints,
                          lInvariants,
                          xiKeyword.getLine());
  }

  private RddlNonFluents parseNonFluents(Token xiKeyword) throws RddlSyntaxException
  {
    String lName = expect(Type.IDENTIFIER, "non-fluents name").getText();
    expect(Type.LBRACE, "'{'");

    String lDomainName = null;
    List<RddlObjectDeclaration> lObjects = new ArrayList<>();
    List<RddlAssignment> lValues = new ArrayList<>();

    while (!accept(Type.RBRACE))
    {
      Token lSection = expect(Type.IDENTIFIER, "non-fluents section");
      switch (lSection.getText())
      {
        case "domain":
          expect(Type.ASSIGN, "'='");
          lDomainName = expect(Type.IDENTIFIER, "domain name").getText();
          break;

        case "objects":
          parseObjects(lObjects);
          break;

        case "non-fluents":
          parseAssignments(lValues);
          break;

        default:
          throw error("Unknown non-fluents section", lSection);
      }
      accept(Type.SEMICOLON);
    }

    if (lDomainName == null)
    {
      throw error("Missing domain reference in non-fluents block", xiKeyword);
    }

    return new RddlNonFluents(lName, lDomainName, lObjects, lValues, xiKeyword.getLine());
  }

  private RddlInstance parseInstance(Token xiKeyword) throws RddlSyntaxException
  {
    String lName = expect(Type.IDENTIFIER, "instance name").getText();
    expect(Type.LBRACE, "'{'");

    String lDomainName = null;
    String lNonFluentsName = null;
    List<RddlObjectDeclaration> lObjects = new ArrayList<>();
    List<RddlAssignment> lInitState = new ArrayList<>();
    int lMaxNondefActions = RddlInstance.UNLIMITED_ACTIONS;
    int lHorizon = -1;
    double lDiscount = 1.0;

    while (!accept(Type.RBRACE))
    {
      Token lSection = expect(Type.IDENTIFIER, "instance section");
      switch (lSection.getText())
      {
        case "domain":
          expect(Type.ASSIGN, "'='");
          lDomainName = expect(Type.IDENTIFIER, "domain name").getText();
          break;

        case "non-fluents":
          expect(Type.ASSIGN, "'='");
          lNonFluentsName = expect(Type.IDENTIFIER, "non-fluents name").getText();
          break;

        case "objects":
          parseObjects(lObjects);
          break;

        case "init-state":
          parseAssignments(lInitState);
          break;

        case "max-nondef-actions":
          expect(Type.ASSIGN, "'='");
          if (peek().isKeyword("pos-inf"))
          {
            next();
            lMaxNondefActions = RddlInstance.UNLIMITED_ACTIONS;
          }
          else
          {
            lMaxNondefActions = parseNonNegativeInt("max-nondef-actions");
          }
          break;

        case "horizon":
          expect(Type.ASSIGN, "'='");
          lHorizon = parseNonNegativeInt("horizon");
          break;

        case "discount":
          expect(Type.ASSIGN, "'='");
          Token lToken = peek();
          RddlValue lValue = parseLiteral();
          if (!lValue.isNumeric())
          {
            throw error("Discount must be a number", lToken);
          }
          lDiscount = lValue.asDouble();
          if ((lDiscount < 0) || (lDiscount > 1))
          {
            throw error("Discount must be in [0, 1]", lToken);
          }
          break;

        default:
          throw error("Unknown instance section", lSection);
      }
      accept(Type.SEMICOLON);
    }

    if (lDomainName == null)
    {
      throw error("Missing domain reference in instance", xiKeyword);
    }
    if (lHorizon < 0)
    {
      throw error("Missing horizon in instance", xiKeyword);
    }

    return new RddlInstance(lName,
                            lDomainName,
                            lNonFluentsName,
                            lObjects,
                            lInitState,
                            lMaxNondefActions,
                            lHorizon,
                            lDiscount,
                            xiKeyword.getLine());
  }

  //////////////////////////////////////////////////
  // Declarations.
  //////////////////////////////////////////////////

  private RddlTypeDefinition parseTypeDefinition() throws RddlSyntaxException
  {
    Token lName = expect(Type.IDENTIFIER, "type name");
    expect(Type.COLON, "':'");

    List<String> lEnumValues = null;
    if (accept(Type.LBRACE))
    {
      lEnumValues = new ArrayList<>();
      do
      {
        lEnumValues.add(expect(Type.ENUM_VALUE, "enumerated value").getText());
      }
      while (accept(Type.COMMA));
      expect(Type.RBRACE, "'}'");
    }
    else
    {
      Token lBase = expect(Type.IDENTIFIER, "'object'");
      if (!lBase.isKeyword("object"))
      {
        throw error("Only object and enumerated types are supported", lBase);
      }
    }
    expect(Type.SEMICOLON, "';'");

    return new RddlTypeDefinition(lName.getText(), lEnumValues, lName.getLine());
  }

  private RddlVariableDefinition parseVariableDefinition() throws RddlSyntaxException
  {
    Token lName = expect(Type.IDENTIFIER, "variable name");

    List<String> lParameterTypes = new ArrayList<>();
    if (accept(Type.LPAREN))
    {
      do
      {
        lParameterTypes.add(expect(Type.IDENTIFIER, "parameter type").getText());
      }
      while (accept(Type.COMMA));
      expect(Type.RPAREN, "')'");
    }

    expect(Type.COLON, "':'");
    expect(Type.LBRACE, "'{'");

    Token lClassToken = expect(Type.IDENTIFIER, "fluent class");
    FluentClass lClass = FluentClass.forKeyword(lClassToken.getText());
    if (lClass == null)
    {
      throw error("Unsupported fluent class", lClassToken);
    }

    expect(Type.COMMA, "','");
    RddlValueType lValueType = RddlValueType.forName(expect(Type.IDENTIFIER, "value type").getText());

    RddlValue lDefault = null;
    int lLevel = 0;
    while (accept(Type.COMMA))
    {
      Token lAttribute = expect(Type.IDENTIFIER, "'default' or 'level'");
      expect(Type.ASSIGN, "'='");
      if (lAttribute.isKeyword("default"))
      {
        lDefault = parseLiteral();
      }
      else if (lAttribute.isKeyword("level"))
      {
        lLevel = parseNonNegativeInt("level");
      }
      else
      {
        throw error("Unknown variable attribute", lAttribute);
      }
    }

    expect(Type.RBRACE, "'}'");
    expect(Type.SEMICOLON, "';'");

    return new RddlVariableDefinition(lName.getText(),
                                      lClass,
                                      lValueType,
                                      lParameterTypes,
                                      lDefault,
                                      lLevel,
                                      lName.getLine());
  }

  private RddlCpf parseCpf() throws RddlSyntaxException
  {
    RddlVariableReference lHead = parseReference(expect(Type.IDENTIFIER, "CPF target"));
    expect(Type.ASSIGN, "'='");
    RddlExpression lBody = parseExpression();
    expect(Type.SEMICOLON, "';'");
    return new RddlCpf(lHead, lBody);
  }

  private void parseExpressionList(List<RddlExpression> xoExpressions) throws RddlSyntaxException
  {
    expect(Type.LBRACE, "'{'");
    while (!accept(Type.RBRACE))
    {
      xoExpressions.add(parseExpression());
      expect(Type.SEMICOLON, "';'");
    }
  }

  private void parseObjects(List<RddlObjectDeclaration> xoObjects) throws RddlSyntaxException
  {
    expect(Type.LBRACE, "'{'");
    while (!accept(Type.RBRACE))
    {
      Token lType = expect(Type.IDENTIFIER, "type name");
      expect(Type.COLON, "':'");
      expect(Type.LBRACE, "'{'");
      List<String> lObjects = new ArrayList<>();
      if (!accept(Type.RBRACE))
      {
        do
        {
          lObjects.add(expect(Type.IDENTIFIER, "object name").getText());
        }
        while (accept(Type.COMMA));
        expect(Type.RBRACE, "'}'");
      }
      expect(Type.SEMICOLON, "';'");
      xoObjects.add(new RddlObjectDeclaration(lType.getText(), lObjects, lType.getLine()));
    }
  }

  private void parseAssignments(List<RddlAssignment> xoAssignments) throws RddlSyntaxException
  {
    expect(Type.LBRACE, "'{'");
    while (!accept(Type.RBRACE))
    {
      // "p(o);" is shorthand for "p(o) = true;" and "~p(o);" for "p(o) = false;".
      boolean lNegated = accept(Type.NOT);
      RddlVariableReference lTarget = parseReference(expect(Type.IDENTIFIER, "variable name"));
      if (lTarget.isPrimed() || !lTarget.isGround())
      {
        throw error("Expected a ground variable", previous());
      }

      RddlValue lValue;
      if (!lNegated && accept(Type.ASSIGN))
      {
        lValue = parseLiteral();
      }
      else
      {
        lValue = RddlValue.ofBool(!lNegated);
      }
      expect(Type.SEMICOLON, "';'");
      xoAssignments.add(new RddlAssignment(lTarget, lValue));
    }
  }

  /**
   * Parse a literal value: a number (optionally negated), true, false, an enumerated value or an object name.
   */
  private RddlValue parseLiteral() throws RddlSyntaxException
  {
    boolean lNegative = accept(Type.MINUS);
    Token lToken = next();

    switch (lToken.getType())
    {
      case INT_LITERAL:
        return RddlValue.ofInt(parseInt(lToken, lNegative));

      case REAL_LITERAL:
        return RddlValue.ofReal(Double.parseDouble(lToken.getText()) * (lNegative ? -1 : 1));

      case ENUM_VALUE:
        if (!lNegative)
        {
          return RddlValue.ofObject(lToken.getText());
        }
        break;

      case IDENTIFIER:
        if (!lNegative)
        {
          if (lToken.isKeyword("true"))
          {
            return RddlValue.TRUE;
          }
          if (lToken.isKeyword("false"))
          {
            return RddlValue.FALSE;
          }
          return RddlValue.ofObject(lToken.getText());
        }
        break;

      default:
        break;
    }

    throw error("Expected a literal value", lToken);
  }

  private int parseNonNegativeInt(String xiWhat) throws RddlSyntaxException
  {
    Token lToken = expect(Type.INT_LITERAL, xiWhat);
    return parseInt(lToken, false);
  }

  /**
   * Parse an integer literal, with its sign, so that the most negative int is accepted.
   */
  private static int parseInt(Token xiToken, boolean xiNegative) throws RddlSyntaxException
  {
    try
    {
      return Integer.parseInt(xiNegative ? "-" + xiToken.getText() : xiToken.getText());
    }
    catch (NumberFormatException lEx)
    {
      throw new RddlSyntaxException("Integer out of range", xiToken.getText(), xiToken.getLine(), xiToken.getColumn());
    }
  }

  //////////////////////////////////////////////////
  // Expressions.
  //////////////////////////////////////////////////

  RddlExpression parseExpression() throws RddlSyntaxException
  {
    return parseImplication();
  }

  private RddlExpression parseImplication() throws RddlSyntaxException
  {
    RddlExpression lLeft = parseDisjunction();
    Token lToken = peek();
    if ((lToken.getType() == Type.IMPLY) || (lToken.getType() == Type.EQUIV))
    {
      next();
      RddlBinaryExpression.Operator lOperator = (lToken.getType() == Type.IMPLY) ? RddlBinaryExpression.Operator.IMPLY :
                                                                                   RddlBinaryExpression.Operator.EQUIV;
      return new RddlBinaryExpression(lOperator, lLeft, parseImplication(), lToken.getLine());
    }
    return lLeft;
  }

  private RddlExpression parseDisjunction() throws RddlSyntaxException
  {
    RddlExpression lExpression = parseConjunction();
    while (peek().getType() == Type.OR)
    {
      Token lToken = next();
      lExpression = new RddlBinaryExpression(RddlBinaryExpression.Operator.OR,
                                             lExpression,
                                             parseConjunction(),
                                             lToken.getLine());
    }
    return lExpression;
  }

  private RddlExpression parseConjunction() throws RddlSyntaxException
  {
    RddlExpression lExpression = parseRelation();
    while (peek().getType() == Type.AND)
    {
      Token lToken = next();
      lExpression = new RddlBinaryExpression(RddlBinaryExpression.Operator.AND,
                                             lExpression,
                                             parseRelation(),
                                             lToken.getLine());
    }
    return lExpression;
  }

  private RddlExpression parseRelation() throws RddlSyntaxException
  {
    RddlExpression lLeft = parseAdditive();
    RddlBinaryExpression.Operator lOperator;
    switch (peek().getType())
    {
      case EQ:  lOperator = RddlBinaryExpression.Operator.EQ;  break;
      case NEQ: lOperator = RddlBinaryExpression.Operator.NEQ; break;
      case LT:  lOperator = RddlBinaryExpression.Operator.LT;  break;
      case LE:  lOperator = RddlBinaryExpression.Operator.LE;  break;
      case GT:  lOperator = RddlBinaryExpression.Operator.GT;  break;
      case GE:  lOperator = RddlBinaryExpression.Operator.GE;  break;
      default:  return lLeft;
    }
    Token lToken = next();
    return new RddlBinaryExpression(lOperator, lLeft, parseAdditive(), lToken.getLine());
  }

  private RddlExpression parseAdditive() throws RddlSyntaxException
  {
    RddlExpression lExpression = parseMultiplicative();
    while ((peek().getType() == Type.PLUS) || (peek().getType() == Type.MINUS))
    {
      Token lToken = next();
      lExpression = new RddlBinaryExpression((lToken.getType() == Type.PLUS) ? RddlBinaryExpression.Operator.PLUS :
                                                                               RddlBinaryExpression.Operator.MINUS,
                                             lExpression,
                                             parseMultiplicative(),
                                             lToken.getLine());
    }
    return lExpression;
  }

  private RddlExpression parseMultiplicative() throws RddlSyntaxException
  {
    RddlExpression lExpression = parseUnary();
    while ((peek().getType() == Type.TIMES) || (peek().getType() == Type.DIVIDE))
    {
      Token lToken = next();
      lExpression = new RddlBinaryExpression((lToken.getType() == Type.TIMES) ? RddlBinaryExpression.Operator.TIMES :
                                                                                RddlBinaryExpression.Operator.DIVIDE,
                                             lExpression,
                                             parseUnary(),
                                             lToken.getLine());
    }
    return lExpression;
  }

  private RddlExpression parseUnary() throws RddlSyntaxException
  {
    Token lToken = peek();
    if (lToken.getType() == Type.MINUS)
    {
      next();
      if (peek().getType() == Type.INT_LITERAL)
      {
        return new RddlConstant(RddlValue.ofInt(parseInt(next(), true)), lToken.getLine());
      }
      RddlExpression lOperand = parseUnary();

      // Fold negative literals so that they round-trip as written.
      if ((lOperand instanceof RddlConstant) && ((RddlConstant)lOperand).getValue().isNumeric())
      {
        RddlValue lValue = ((RddlConstant)lOperand).getValue();
        if (lValue.getKind() == RddlValueType.Kind.INT)
        {
          if (lValue.asInt() == Integer.MIN_VALUE)
          {
            throw error("Integer out of range", lToken);
          }
          return new RddlConstant(RddlValue.ofInt(-lValue.asInt()), lToken.getLine());
        }
        return new RddlConstant(RddlValue.ofReal(-lValue.asDouble()), lToken.getLine());
      }
      return new RddlUnaryExpression(RddlUnaryExpression.Operator.NEGATE, lOperand, lToken.getLine());
    }
    if (lToken.getType() == Type.NOT)
    {
      next();
      return new RddlUnaryExpression(RddlUnaryExpression.Operator.NOT, parseUnary(), lToken.getLine());
    }
    return parsePrimary();
  }

  private RddlExpression parsePrimary() throws RddlSyntaxException
  {
    Token lToken = next();

    switch (lToken.getType())
    {
      case INT_LITERAL:
        return new RddlConstant(RddlValue.ofInt(parseInt(lToken, false)), lToken.getLine());

      case REAL_LITERAL:
        return new RddlConstant(RddlValue.ofReal(Double.parseDouble(lToken.getText())), lToken.getLine());

      case ENUM_VALUE:
        return new RddlConstant(RddlValue.ofObject(lToken.getText()), lToken.getLine());

      case LPAREN:
      {
        RddlExpression lInner = parseExpression();
        expect(Type.RPAREN, "')'");
        return lInner;
      }

      case LBRACKET:
      {
        RddlExpression lInner = parseExpression();
        expect(Type.RBRACKET, "']'");
        return lInner;
      }

      case IDENTIFIER:
        return parseIdentifierExpression(lToken);

      default:
        throw error("Expected an expression", lToken);
    }
  }

  private RddlExpression parseIdentifierExpression(Token xiToken) throws RddlSyntaxException
  {
    String lText = xiToken.getText();

    if (xiToken.isKeyword("true") || xiToken.isKeyword("false"))
    {
      return new RddlConstant(RddlValue.ofBool(xiToken.isKeyword("true")), xiToken.getLine());
    }

    if (xiToken.isKeyword("if"))
    {
      expect(Type.LPAREN, "'('");
      RddlExpression lCondition = parseExpression();
      expect(Type.RPAREN, "')'");
      expectKeyword("then");
      RddlExpression lThen = parseExpression();
      expectKeyword("else");
      RddlExpression lElse = parseExpression();
      return new RddlConditional(lCondition, lThen, lElse, xiToken.getLine());
    }

    RddlAggregation.Operator lAggregation = RddlAggregation.Operator.forKeyword(lText);
    if ((lAggregation != null) && (peek().getType() == Type.LBRACE))
    {
      next();
      List<RddlTypedParameter> lParameters = new ArrayList<>();
      do
      {
        String lParameter = expect(Type.PARAMETER, "parameter").getText();
        expect(Type.COLON, "':'");
        String lType = expect(Type.IDENTIFIER, "type name").getText();
        lParameters.add(new RddlTypedParameter(lParameter, lType));
      }
      while (accept(Type.COMMA));
      expect(Type.RBRACE, "'}'");

      // The body binds as tightly as a unary operand - bracket anything larger.
      RddlExpression lBody = parseUnary();
      return new RddlAggregation(lAggregation, lParameters, lBody, xiToken.getLine());
    }

    RddlDistribution.Kind lDistribution = RddlDistribution.Kind.forName(lText);
    if ((lDistribution != null) && (peek().getType() == Type.LPAREN))
    {
      next();
      List<RddlExpression> lArguments = new ArrayList<>();
      do
      {
        lArguments.add(parseExpression());
      }
      while (accept(Type.COMMA));
      Token lClose = expect(Type.RPAREN, "')'");
      if (lArguments.size() != lDistribution.getArity())
      {
        throw error(lDistribution.getName() + " takes " + lDistribution.getArity() + " argument(s)", lClose);
      }
      return new RddlDistribution(lDistribution, lArguments, xiToken.getLine());
    }

    return parseReference(xiToken);
  }

  /**
   * Parse the remainder of a variable reference whose name has already been consumed.
   */
  private RddlVariableReference parseReference(Token xiName) throws RddlSyntaxException
  {
    boolean lPrimed = accept(Type.PRIME);
    List<String> lArguments = new ArrayList<>();
    if (accept(Type.LPAREN))
    {
      do
      {
        Token lArgument = next();
        if ((lArgument.getType() != Type.PARAMETER) &&
            (lArgument.getType() != Type.IDENTIFIER) &&
            (lArgument.getType() != Type.ENUM_VALUE))
        {
          throw error("Expected a parameter or object", lArgument);
        }
        lArguments.add(lArgument.getText());
      }
      while (accept(Type.COMMA));
      expect(Type.RPAREN, "')'");
    }
    return new RddlVariableReference(xiName.getText(), lPrimed, lArguments, xiName.getLine());
  }

  //////////////////////////////////////////////////
  // Token handling.
  //////////////////////////////////////////////////

  /**
   * @return the next unconsumed token.
   */
  Token peekToken()
  {
    return peek();
  }

  private Token peek()
  {
    return mTokens.get(mPos);
  }

  private Token next()
  {
    Token lToken = mTokens.get(mPos);
    if (lToken.getType() != Type.EOF)
    {
      mPos++;
    }
    return lToken;
  }

  private Token previous()
  {
    return mTokens.get(Math.max(0, mPos - 1));
  }

  private boolean accept(Type xiType)
  {
    if (peek().getType() == xiType)
    {
      next();
      return true;
    }
    return false;
  }

  private Token expect(Type xiType, String xiWhat) throws RddlSyntaxException
  {
    Token lToken = peek();
    if (lToken.getType() != xiType)
    {
      throw error("Expected " + xiWhat, lToken);
    }
    return next();
  }

  private void expectKeyword(String xiKeyword) throws RddlSyntaxException
  {
    Token lToken = peek();
    if (!lToken.isKeyword(xiKeyword))
    {
      throw error("Expected '" + xiKeyword + "'", lToken);
    }
    next();
  }

  private static RddlSyntaxException error(String xiMessage, Token xiToken)
  {
    return new RddlSyntaxException(xiMessage, xiToken.getText(), xiToken.getLine(), xiToken.getColumn());
  }
}
