package org.rddl.base.util.rddl.grammar;

/**
 * The value type of a variable or expression: bool, int, real or a named object/enumerated type.
 *
 * Instances for the three primitive types are shared.  Object types are compared by name.
 */
public final class RddlValueType
{
  /**
   * Kinds of value.
   */
  public enum Kind
  {
    BOOL,
    INT,
    REAL,
    OBJECT;
  }

  public static final RddlValueType BOOL = new RddlValueType(Kind.BOOL, "bool");
  public static final RddlValueType INT  = new RddlValueType(Kind.INT, "int");
  public static final RddlValueType REAL = new RddlValueType(Kind.REAL, "real");

  private final Kind   mKind;
  private final String mName;

  private RddlValueType(Kind xiKind, String xiName)
  {
    mKind = xiKind;
    mName = xiName;
  }

  /**
   * @return the value type for members of the named object or enumerated type.
   *
   * @param xiTypeName - the type name.
   */
  public static RddlValueType ofObject(String xiTypeName)
  {
    return new RddlValueType(Kind.OBJECT, xiTypeName);
  }

  /**
   * @return the value type named in source - one of the primitives, otherwise an object type.
   *
   * @param xiName - the name as written.
   */
  public static RddlValueType forName(String xiName)
  {
    switch (xiName)
    {
      case "bool":
        return BOOL;
      case "int":
        return INT;
      case "real":
        return REAL;
      default:
        return ofObject(xiName);
    }
  }

  public Kind getKind()
  {
    return mKind;
  }

  /**
   * @return the type name (the primitive keyword, or the object type's name).
   */
  public String getName()
  {
    return mName;
  }

  public boolean isNumeric()
  {
    return (mKind == Kind.INT) || (mKind == Kind.REAL);
  }

  public boolean isObject()
  {
    return mKind == Kind.OBJECT;
  }

  /**
   * @return the type of the result of combining numeric values of this type and the other type.  (int only if both are
   *         int, otherwise real.)
   */
  public RddlValueType promote(RddlValueType xiOther)
  {
    return ((mKind == Kind.INT) && (xiOther.mKind == Kind.INT)) ? INT : REAL;
  }

  /**
   * @return whether a value of the specified type may be stored in a variable of this type.
   */
  public boolean accepts(RddlValueType xiOther)
  {
    if (equals(xiOther))
    {
      return true;
    }
    return (mKind == Kind.REAL) && (xiOther.mKind == Kind.INT);
  }

  @Override
  public boolean equals(Object xiOther)
  {
    if (!(xiOther instanceof RddlValueType))
    {
      return false;
    }
    RddlValueType lOther = (RddlValueType)xiOther;
    return (mKind == lOther.mKind) && mName.equals(lOther.mName);
  }

  @Override
  public int hashCode()
  {
    return mKind.hashCode() * 31 + mName.hashCode();
  }

  @Override
  public String toString()
  {
    return mName;
  }
}
