package org.rddl.base.util.rddl.grammar;

import org.rddl.base.util.rddl.grammar.RddlValueType.Kind;

/**
 * A tagged value - bool, int, real or object.  Values are immutable.
 *
 * Object values hold the object's name.  Members of enumerated types keep their leading '@'.
 */
public final class RddlValue
{
  public static final RddlValue TRUE      = new RddlValue(Kind.BOOL, true, 0, 0, null);
  public static final RddlValue FALSE     = new RddlValue(Kind.BOOL, false, 0, 0, null);
  public static final RddlValue ZERO      = new RddlValue(Kind.INT, false, 0, 0, null);
  public static final RddlValue REAL_ZERO = new RddlValue(Kind.REAL, false, 0, 0.0, null);

  private final Kind    mKind;
  private final boolean mBool;
  private final int     mInt;
  private final double  mReal;
  private final String  mObject;

  private RddlValue(Kind xiKind, boolean xiBool, int xiInt, double xiReal, String xiObject)
  {
    mKind = xiKind;
    mBool = xiBool;
    mInt = xiInt;
    mReal = xiReal;
    mObject = xiObject;
  }

  public static RddlValue ofBool(boolean xiValue)
  {
    return xiValue ? TRUE : FALSE;
  }

  public static RddlValue ofInt(int xiValue)
  {
    return new RddlValue(Kind.INT, false, xiValue, xiValue, null);
  }

  public static RddlValue ofReal(double xiValue)
  {
    return new RddlValue(Kind.REAL, false, 0, xiValue, null);
  }

  public static RddlValue ofObject(String xiName)
  {
    return new RddlValue(Kind.OBJECT, false, 0, 0, xiName.intern());
  }

  public Kind getKind()
  {
    return mKind;
  }

  public boolean isNumeric()
  {
    return (mKind == Kind.INT) || (mKind == Kind.REAL);
  }

  /**
   * @return the boolean value.  Only valid for bool values.
   */
  public boolean asBoolean()
  {
    assert(mKind == Kind.BOOL);
    return mBool;
  }

  /**
   * @return the integer value.  Only valid for int values.
   */
  public int asInt()
  {
    assert(mKind == Kind.INT);
    return mInt;
  }

  /**
   * @return the numeric value as a double.  Valid for int and real values.
   */
  public double asDouble()
  {
    assert(isNumeric());
    return (mKind == Kind.INT) ? mInt : mReal;
  }

  /**
   * @return the object name.  Only valid for object values.
   */
  public String asObject()
  {
    assert(mKind == Kind.OBJECT);
    return mObject;
  }

  /**
   * @return this value converted for storage in a variable of the specified type (int values widen to real).
   */
  public RddlValue coerceTo(RddlValueType xiType)
  {
    if ((xiType.getKind() == Kind.REAL) && (mKind == Kind.INT))
    {
      return ofReal(mInt);
    }
    return this;
  }

  @Override
  public boolean equals(Object xiOther)
  {
    if (!(xiOther instanceof RddlValue))
    {
      return false;
    }

    RddlValue lOther = (RddlValue)xiOther;
    if (mKind != lOther.mKind)
    {
      return false;
    }

    switch (mKind)
    {
      case BOOL:
        return mBool == lOther.mBool;
      case INT:
        return mInt == lOther.mInt;
      case REAL:
        return Double.compare(mReal, lOther.mReal) == 0;
      default:
        return mObject.equals(lOther.mObject);
    }
  }

  @Override
  public int hashCode()
  {
    switch (mKind)
    {
      case BOOL:
        return mBool ? 1231 : 1237;
      case INT:
        return mInt;
      case REAL:
        return Double.hashCode(mReal);
      default:
        return mObject.hashCode();
    }
  }

  /**
   * @return the value as it would be written in an RDDL file.
   */
  @Override
  public String toString()
  {
    switch (mKind)
    {
      case BOOL:
        return mBool ? "true" : "false";
      case INT:
        return Integer.toString(mInt);
      case REAL:
        return Double.toString(mReal);
      default:
        return mObject;
    }
  }
}
