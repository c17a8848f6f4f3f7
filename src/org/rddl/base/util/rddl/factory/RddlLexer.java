package org.rddl.base.util.rddl.factory;

import java.util.ArrayList;
import java.util.List;

import org.rddl.base.util.rddl.factory.Token.Type;
import org.rddl.base.util.rddl.factory.exceptions.RddlSyntaxException;

/**
 * Splits RDDL source text into tokens.
 *
 * Identifiers may contain '-' (as in <code>picture-point</code> or <code>state-fluent</code>) provided it is followed
 * by a letter, so <code>x-1</code> is still a subtraction.  Comments run from <code>//</code> to the end of the line,
 * or between <code>/*</code> and <code>*&#47;</code>.
 */
public final class RddlLexer
{
  private final String mSource;
  private int          mPos    = 0;
  private int          mLine   = 1;
  private int          mColumn = 1;

  private RddlLexer(String xiSource)
  {
    mSource = xiSource;
  }

  /**
   * Tokenize the specified text.  The final token is always of type EOF.
   *
   * @param xiSource - the RDDL source.
   * @return the tokens.
   *
   * @throws RddlSyntaxException if the text contains a character that can't start a token, a malformed number or an
   *                             unterminated comment.
   */
  public static List<Token> tokenize(String xiSource) throws RddlSyntaxException
  {
    return new RddlLexer(xiSource).run();
  }

  private List<Token> run() throws RddlSyntaxException
  {
    List<Token> lTokens = new ArrayList<>();

    while (true)
    {
      skipWhitespaceAndComments();
      if (mPos >= mSource.length())
      {
        lTokens.add(new Token(Type.EOF, "<end of input>", mLine, mColumn));
        return lTokens;
      }
      lTokens.add(nextToken());
    }
  }

  private void skipWhitespaceAndComments() throws RddlSyntaxException
  {
    while (mPos < mSource.length())
    {
      char lChar = mSource.charAt(mPos);
      if (Character.isWhitespace(lChar))
      {
        advance(1);
      }
      else if (lookingAt("//"))
      {
        while ((mPos < mSource.length()) && (mSource.charAt(mPos) != '\n'))
        {
          advance(1);
        }
      }
      else if (lookingAt("/*"))
      {
        int lStartLine = mLine;
        int lStartColumn = mColumn;
        advance(2);
        while (!lookingAt("*/"))
        {
          if (mPos >= mSource.length())
          {
            throw new RddlSyntaxException("Unterminated comment", "/*", lStartLine, lStartColumn);
          }
          advance(1);
        }
        advance(2);
      }
      else
      {
        return;
      }
    }
  }

  private Token nextToken() throws RddlSyntaxException
  {
    int lLine = mLine;
    int lColumn = mColumn;
    char lChar = mSource.charAt(mPos);

    if (Character.isLetter(lChar))
    {
      return new Token(Type.IDENTIFIER, readName(), lLine, lColumn);
    }

    if ((lChar == '?') || (lChar == '@'))
    {
      advance(1);
      if ((mPos >= mSource.length()) || !Character.isLetter(mSource.charAt(mPos)))
      {
        throw new RddlSyntaxException("Expected a name", String.valueOf(lChar), lLine, lColumn);
      }
      return new Token((lChar == '?') ? Type.PARAMETER : Type.ENUM_VALUE, lChar + readName(), lLine, lColumn);
    }

    if (Character.isDigit(lChar) || ((lChar == '.') && (mPos + 1 < mSource.length()) &&
                                      Character.isDigit(mSource.charAt(mPos + 1))))
    {
      return readNumber(lLine, lColumn);
    }

    // Operators and punctuation - longest match first.
    String[] lSymbols = {"<=>", "=>", "==", "<=", ">=", "~=", "!=",
                         "{", "}", "(", ")", "[", "]", ",", ";", ":", "=", "'",
                         "+", "-", "*", "/", "^", "&", "|", "~", "!", "<", ">"};
    Type[] lTypes = {Type.EQUIV, Type.IMPLY, Type.EQ, Type.LE, Type.GE, Type.NEQ, Type.NEQ,
                     Type.LBRACE, Type.RBRACE, Type.LPAREN, Type.RPAREN, Type.LBRACKET, Type.RBRACKET,
                     Type.COMMA, Type.SEMICOLON, Type.COLON, Type.ASSIGN, Type.PRIME,
                     Type.PLUS, Type.MINUS, Type.TIMES, Type.DIVIDE, Type.AND, Type.AND, Type.OR, Type.NOT, Type.NOT,
                     Type.LT, Type.GT};
    for (int lii = 0; lii < lSymbols.length; lii++)
    {
      if (lookingAt(lSymbols[lii]))
      {
        advance(lSymbols[lii].length());
        return new Token(lTypes[lii], lSymbols[lii], lLine, lColumn);
      }
    }

    throw new RddlSyntaxException("Unexpected character", String.valueOf(lChar), lLine, lColumn);
  }

  private String readName()
  {
    int lStart = mPos;
    while (mPos < mSource.length())
    {
      char lChar = mSource.charAt(mPos);
      if (Character.isLetterOrDigit(lChar) || (lChar == '_'))
      {
        advance(1);
      }
      else if ((lChar == '-') && (mPos + 1 < mSource.length()) && Character.isLetter(mSource.charAt(mPos + 1)))
      {
        advance(1);
      }
      else
      {
        break;
      }
    }
    return mSource.substring(lStart, mPos);
  }

  private Token readNumber(int xiLine, int xiColumn) throws RddlSyntaxException
  {
    int lStart = mPos;
    boolean lReal = false;

    while ((mPos < mSource.length()) && Character.isDigit(mSource.charAt(mPos)))
    {
      advance(1);
    }
    if ((mPos < mSource.length()) && (mSource.charAt(mPos) == '.'))
    {
      lReal = true;
      advance(1);
      while ((mPos < mSource.length()) && Character.isDigit(mSource.charAt(mPos)))
      {
        advance(1);
      }
    }
    if ((mPos < mSource.length()) && ((mSource.charAt(mPos) == 'e') || (mSource.charAt(mPos) == 'E')))
    {
      lReal = true;
      advance(1);
      if ((mPos < mSource.length()) && ((mSource.charAt(mPos) == '+') || (mSource.charAt(mPos) == '-')))
      {
        advance(1);
      }
      if ((mPos >= mSource.length()) || !Character.isDigit(mSource.charAt(mPos)))
      {
        throw new RddlSyntaxException("Malformed exponent", mSource.substring(lStart, mPos), xiLine, xiColumn);
      }
      while ((mPos < mSource.length()) && Character.isDigit(mSource.charAt(mPos)))
      {
        advance(1);
      }
    }

    String lText = mSource.substring(lStart, mPos);
    if ((mPos < mSource.length()) && Character.isLetter(mSource.charAt(mPos)))
    {
      throw new RddlSyntaxException("Malformed number", lText + mSource.charAt(mPos), xiLine, xiColumn);
    }
    return new Token(lReal ? Type.REAL_LITERAL : Type.INT_LITERAL, lText, xiLine, xiColumn);
  }

  private boolean lookingAt(String xiText)
  {
    return mSource.startsWith(xiText, mPos);
  }

  private void advance(int xiCount)
  {
    for (int lii = 0; lii < xiCount; lii++)
    {
      if (mSource.charAt(mPos) == '\n')
      {
        mLine++;
        mColumn = 1;
      }
      else
      {
        mColumn++;
      }
      mPos++;
    }
  }
}
