package org.rddl.base.util.rddl.factory;

/**
 * A lexical token.
 */
public final class Token
{
  /**
   * Token types.
   */
  public enum Type
  {
    IDENTIFIER,
    PARAMETER,
    ENUM_VALUE,
    INT_LITERAL,
    REAL_LITERAL,
    LBRACE,
    RBRACE,
    LPAREN,
    RPAREN,
    LBRACKET,
    RBRACKET,
    COMMA,
    SEMICOLON,
    COLON,
    ASSIGN,
    PRIME,
    PLUS,
    MINUS,
    TIMES,
    DIVIDE,
    AND,
    OR,
    NOT,
    IMPLY,
    EQUIV,
    EQ,
    NEQ,
    LT,
    LE,
    GT,
    GE,
    EOF;
  }

  private final Type   mType;
  private final String mText;
  private final int    mLine;
  private final int    mColumn;

  public Token(Type xiType, String xiText, int xiLine, int xiColumn)
  {
    mType = xiType;
    mText = xiText;
    mLine = xiLine;
    mColumn = xiColumn;
  }

  public Type getType()
  {
    return mType;
  }

  public String getText()
  {
    return mText;
  }

  public int getLine()
  {
    return mLine;
  }

  public int getColumn()
  {
    return mColumn;
  }

  /**
   * @return whether this is an identifier with the specified text.
   */
  public boolean isKeyword(String xiKeyword)
  {
    return (mType == Type.IDENTIFIER) && mText.equals(xiKeyword);
  }

  @Override
  public String toString()
  {
    return mType + "(" + mText + ")@" + mLine + ":" + mColumn;
  }
}
