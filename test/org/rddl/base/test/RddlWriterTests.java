package org.rddl.base.test;

import java.util.List;

import org.junit.Assert;
import org.junit.Test;
import org.rddl.base.util.rddl.factory.Problem;
import org.rddl.base.util.rddl.factory.RddlFactory;
import org.rddl.base.util.rddl.factory.RddlLoader;
import org.rddl.base.util.rddl.factory.RddlWriter;
import org.rddl.base.util.rddl.grammar.RddlDescription;
import org.rddl.base.util.rddl.grammar.RddlDomain;
import org.rddl.base.util.rddl.grammar.RddlVariableDefinition;

public class RddlWriterTests extends Assert
{
  private final TestModelRepository mRepository = new TestModelRepository();

  @Test
  public void testWriteVariableDefinitions() throws Exception
  {
    RddlDomain lMars = RddlFactory.create(mRepository.getSource("mars_rover_pics3")).getDomains().get(0);
    assertEquals("MAX_TIME : { non-fluent, real, default = 12.0 };", RddlWriter.write(lMars.getVariables().get(0)));
    assertEquals("PICT_VALUE(picture-point) : { non-fluent, real, default = 1.0 };",
                 RddlWriter.write(lMars.getVariables().get(4)));
    assertEquals("snapPicture : { action-fluent, bool, default = false };",
                 RddlWriter.write(lMars.getVariables().get(11)));

    RddlDomain lCounter = RddlFactory.create(mRepository.getSource("counter_grid")).getDomains().get(0);
    assertEquals("heading : { state-fluent, direction, default = @left };",
                 RddlWriter.write(lCounter.getVariables().get(3)));
    assertEquals("full(cell) : { derived-fluent, bool, level = 1 };", RddlWriter.write(lCounter.getVariables().get(7)));
  }

  @Test
  public void testVariableDefinitionsReparse() throws Exception
  {
    for (String lKey : mRepository.getModelKeys())
    {
      List<RddlVariableDefinition> lOriginal = RddlFactory.create(mRepository.getSource(lKey))
                                                          .getDomains().get(0).getVariables();

      StringBuilder lSource = new StringBuilder("domain reparsed {\n  pvariables {\n");
      for (RddlVariableDefinition lVariable : lOriginal)
      {
        lSource.append("    ").append(RddlWriter.write(lVariable)).append('\n');
      }
      lSource.append("  };\n}\n");

      List<RddlVariableDefinition> lReparsed = RddlFactory.create(lSource.toString()).getDomains().get(0).getVariables();
      assertEquals(lKey, lOriginal.size(), lReparsed.size());
      for (int lii = 0; lii < lOriginal.size(); lii++)
      {
        RddlVariableDefinition lBefore = lOriginal.get(lii);
        RddlVariableDefinition lAfter = lReparsed.get(lii);
        assertEquals(lBefore, lAfter);
        assertEquals(lBefore.getValueType(), lAfter.getValueType());
        assertEquals(lBefore.getParameterTypes(), lAfter.getParameterTypes());
        assertEquals(lBefore.getDefaultValue(), lAfter.getDefaultValue());
        assertEquals(lBefore.getLevel(), lAfter.getLevel());
      }
    }
  }

  @Test
  public void testDescriptionsReparse() throws Exception
  {
    for (String lKey : mRepository.getModelKeys())
    {
      RddlDescription lOriginal = RddlFactory.create(mRepository.getSource(lKey));
      String lWritten = RddlWriter.write(lOriginal);

      // Writing is stable and the written source is still a valid problem.
      assertEquals(lKey, lWritten, RddlWriter.write(RddlFactory.create(lWritten)));
      Problem lProblem = RddlLoader.load(lWritten);
      assertEquals(lOriginal.getInstances().get(0).getName(), lProblem.getInstance().getName());
    }
  }
}
