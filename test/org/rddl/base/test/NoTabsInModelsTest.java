package org.rddl.base.test;

import org.junit.Assert;
import org.junit.Test;

/**
 * Model files are indented with spaces, so that line and column numbers in syntax errors match what editors show.
 */
public class NoTabsInModelsTest extends Assert
{
  @Test
  public void testNoTabsInModels() throws Exception
  {
    TestModelRepository lRepository = new TestModelRepository();
    assertFalse(lRepository.getModelKeys().isEmpty());
    for (String lKey : lRepository.getModelKeys())
    {
      assertFalse("Model " + lKey + " contains a tab", lRepository.getSource(lKey).contains("\t"));
    }
  }
}
