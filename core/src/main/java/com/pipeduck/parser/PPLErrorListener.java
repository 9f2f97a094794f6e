package com.pipeduck.parser;

import org.antlr.v4.runtime.BaseErrorListener;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.Recognizer;
import org.antlr.v4.runtime.Token;

/**
 * Converts the first ANTLR syntax error into a {@link PPLParseException}.
 */
public class PPLErrorListener extends BaseErrorListener {

    @Override
    public void syntaxError(Recognizer<?, ?> recognizer,
                            Object offendingSymbol,
                            int line,
                            int charPositionInLine,
                            String msg,
                            RecognitionException e) {
        String token = "";
        if (offendingSymbol instanceof Token) {
            Token t = (Token) offendingSymbol;
            token = t.getType() == Token.EOF ? "<EOF>" : t.getText();
        }
        throw new PPLParseException(line, charPositionInLine, token, simplify(msg));
    }

    // ANTLR lists every expected token; keep the message short when the set is large.
    private static String simplify(String msg) {
        int idx = msg.indexOf(" expecting {");
        if (idx > 0 && msg.length() - idx > 120) {
            return msg.substring(0, idx);
        }
        return msg;
    }
}
