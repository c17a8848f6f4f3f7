package org.rddl.base.util.rddl.factory;

import java.util.List;

import org.apache.commons.lang.StringUtils;
import org.rddl.base.util.rddl.grammar.FluentClass;
import org.rddl.base.util.rddl.grammar.RddlAssignment;
import org.rddl.base.util.rddl.grammar.RddlCpf;
import org.rddl.base.util.rddl.grammar.RddlDescription;
import org.rddl.base.util.rddl.grammar.RddlDomain;
import org.rddl.base.util.rddl.grammar.RddlExpression;
import org.rddl.base.util.rddl.grammar.RddlInstance;
import org.rddl.base.util.rddl.grammar.RddlNonFluents;
import org.rddl.base.util.rddl.grammar.RddlObjectDeclaration;
import org.rddl.base.util.rddl.grammar.RddlTypeDefinition;
import org.rddl.base.util.rddl.grammar.RddlVariableDefinition;

/**
 * Writes grammar objects back out as RDDL source.  Parsing the output gives back equal declarations.
 *
 * Expressions are written fully bracketed, so the output isn't necessarily what was originally written, but it
 * means the same.
 */
public final class RddlWriter
{
  private static final String INDENT = "  ";

  private RddlWriter()
  {
    // Static methods only.
  }

  /**
   * @return a variable declaration as it would appear in a <code>pvariables</code> section.
   */
  public static String write(RddlVariableDefinition xiVariable)
  {
    StringBuilder lBuilder = new StringBuilder(xiVariable.getName());
    if (xiVariable.arity() > 0)
    {
      lBuilder.append('(').append(StringUtils.join(xiVariable.getParameterTypes(), ", ")).append(')');
    }
    lBuilder.append(" : { ").append(xiVariable.getFluentClass().getKeyword());
    lBuilder.append(", ").append(xiVariable.getValueType().getName());
    if (xiVariable.getDefaultValue() != null)
    {
      lBuilder.append(", default = ").append(xiVariable.getDefaultValue());
    }
    if ((xiVariable.getFluentClass() == FluentClass.DERIVED_FLUENT) && (xiVariable.getLevel() != 0))
    {
      lBuilder.append(", level = ").append(xiVariable.getLevel());
    }
    return lBuilder.append(" };").toString();
  }

  public static String write(RddlDomain xiDomain)
  {
    StringBuilder lBuilder = new StringBuilder();
    lBuilder.append("domain ").append(xiDomain.getName()).append(" {\n");

    if (!xiDomain.getRequirements().isEmpty())
    {
      lBuilder.append(INDENT).append("requirements = {")
              .append(StringUtils.join(xiDomain.getRequirements(), ", ")).append("};\n");
    }

    if (!xiDomain.getTypes().isEmpty())
    {
      lBuilder.append(INDENT).append("types {\n");
      for (RddlTypeDefinition lType : xiDomain.getTypes())
      {
        lBuilder.append(INDENT).append(INDENT).append(lType).append('\n');
      }
      lBuilder.append(INDENT).append("};\n");
    }

    lBuilder.append(INDENT).append("pvariables {\n");
    for (RddlVariableDefinition lVariable : xiDomain.getVariables())
    {
      lBuilder.append(INDENT).append(INDENT).append(write(lVariable)).append('\n');
    }
    lBuilder.append(INDENT).append("};\n");

    lBuilder.append(INDENT).append("cpfs {\n");
    for (RddlCpf lCpf : xiDomain.getCpfs())
    {
      lBuilder.append(INDENT).append(INDENT).append(lCpf).append('\n');
    }
    lBuilder.append(INDENT).append("};\n");

    if (xiDomain.getReward() != null)
    {
      lBuilder.append(INDENT).append("reward = ").append(xiDomain.getReward()).append(";\n");
    }

    writeExpressions("state-action-constraints", xiDomain.getConstraints(), lBuilder);
    writeExpressions("state-invariants", xiDomain.getInvariants(), lBuilder);

    return lBuilder.append("}\n").toString();
  }

  public static String write(RddlNonFluents xiNonFluents)
  {
    StringBuilder lBuilder = new StringBuilder();
    lBuilder.append("non-fluents ").append(xiNonFluents.getName()).append(" {\n");
    lBuilder.append(INDENT).append("domain = ").append(xiNonFluents.getDomainName()).append(";\n");
    writeObjects(xiNonFluents.getObjects(), lBuilder);
    writeAssignments("non-fluents", xiNonFluents.getValues(), lBuilder);
    return lBuilder.append("}\n").toString();
  }

  public static String write(RddlInstance xiInstance)
  {
    StringBuilder lBuilder = new StringBuilder();
    lBuilder.append("instance ").append(xiInstance.getName()).append(" {\n");
    lBuilder.append(INDENT).append("domain = ").append(xiInstance.getDomainName()).append(";\n");
    if (xiInstance.getNonFluentsName() != null)
    {
      lBuilder.append(INDENT).append("non-fluents = ").append(xiInstance.getNonFluentsName()).append(";\n");
    }
    writeObjects(xiInstance.getObjects(), lBuilder);
    writeAssignments("init-state", xiInstance.getInitState(), lBuilder);

    lBuilder.append(INDENT).append("max-nondef-actions = ");
    if (xiInstance.getMaxNondefActions() == RddlInstance.UNLIMITED_ACTIONS)
    {
      lBuilder.append("pos-inf");
    }
    else
    {
      lBuilder.append(xiInstance.getMaxNondefActions());
    }
    lBuilder.append(";\n");
    lBuilder.append(INDENT).append("horizon = ").append(xiInstance.getHorizon()).append(";\n");
    lBuilder.append(INDENT).append("discount = ").append(xiInstance.getDiscount()).append(";\n");
    return lBuilder.append("}\n").toString();
  }

  /**
   * @return every block of a description, domains first.
   */
  public static String write(RddlDescription xiDescription)
  {
    StringBuilder lBuilder = new StringBuilder();
    for (RddlDomain lDomain : xiDescription.getDomains())
    {
      lBuilder.append(write(lDomain)).append('\n');
    }
    for (RddlNonFluents lNonFluents : xiDescription.getNonFluents())
    {
      lBuilder.append(write(lNonFluents)).append('\n');
    }
    for (RddlInstance lInstance : xiDescription.getInstances())
    {
      lBuilder.append(write(lInstance)).append('\n');
    }
    return lBuilder.toString();
  }

  private static void writeExpressions(String xiSection, List<RddlExpression> xiExpressions, StringBuilder xoBuilder)
  {
    if (xiExpressions.isEmpty())
    {
      return;
    }
    xoBuilder.append(INDENT).append(xiSection).append(" {\n");
    for (RddlExpression lExpression : xiExpressions)
    {
      xoBuilder.append(INDENT).append(INDENT).append(lExpression).append(";\n");
    }
    xoBuilder.append(INDENT).append("};\n");
  }

  private static void writeObjects(List<RddlObjectDeclaration> xiObjects, StringBuilder xoBuilder)
  {
    if (xiObjects.isEmpty())
    {
      return;
    }
    xoBuilder.append(INDENT).append("objects {\n");
    for (RddlObjectDeclaration lDeclaration : xiObjects)
    {
      xoBuilder.append(INDENT).append(INDENT).append(lDeclaration).append('\n');
    }
    xoBuilder.append(INDENT).append("};\n");
  }

  private static void writeAssignments(String xiSection, List<RddlAssignment> xiAssignments, StringBuilder xoBuilder)
  {
    if (xiAssignments.isEmpty())
    {
      return;
    }
    xoBuilder.append(INDENT).append(xiSection).append(" {\n");
    for (RddlAssignment lAssignment : xiAssignments)
    {
      xoBuilder.append(INDENT).append(INDENT).append(lAssignment).append('\n');
    }
    xoBuilder.append(INDENT).append("};\n");
  }
}
