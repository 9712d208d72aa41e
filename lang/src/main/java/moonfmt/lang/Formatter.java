package moonfmt.lang;

import static moonfmt.lang.Token.Type.*;

import lombok.NonNull;
import lombok.RequiredArgsConstructor;

/**
 * Recursive-descent walk over the reduced token stream that writes the
 * canonical rendition of each construct as it is recognised. Every rule
 * takes the indent of the enclosing block.
 */
@RequiredArgsConstructor
final class Formatter {

    static final int INDENT = 4;

    private final @NonNull TokenStream tokens;
    private final Output output = new Output();

    /**
     * <pre>
     * chunk       :: block EOF
     * </pre>
     */
    String format() {
        deferComments();
        output.flush(0);
        block(0);
        if (!isAtEnd()) {
            throw unexpected(peek());
        }
        return output.finish();
    }

    //// statements ////

    /**
     * <pre>
     * block       :: statement*
     * </pre>
     * Stops before a block terminator, which belongs to the enclosing
     * statement.
     */
    private void block(int indent) {
        while (!isAtEnd() && !isBlockEnd()) {
            statement(indent);
        }
    }

    /**
     * <pre>
     * statement   :: ";" | label | "break" | goto | do | while | repeat | if
     *              | for | function | local | return | exprstat
     * </pre>
     */
    private void statement(int indent) {
        var token = peek();
        var spaced = false;

        if (token.type() == KEYWORD) {
            switch (token.lexeme()) {
                case "break":
                    advance();
                    output.write("break");
                    break;
                case "do":
                    advance();
                    output.write("do");
                    body(indent);
                    break;
                case "while":
                    whileStatement(indent);
                    break;
                case "repeat":
                    repeatStatement(indent);
                    break;
                case "if":
                    ifStatement(indent);
                    break;
                case "for":
                    forStatement(indent);
                    break;
                case "function":
                    functionStatement(indent);
                    spaced = true;
                    break;
                case "local":
                    spaced = localStatement(indent);
                    break;
                case "return":
                    returnStatement(indent);
                    break;
                default:
                    throw unexpected(token);
            }
        } else if (check(";")) {
            advance();
            output.write(";");
        } else if (check("::")) {
            label();
        } else if (isGoto()) {
            advance();
            output.write("goto " + name());
        } else if (binaryPrecedence(token) != null) {
            throw new FormatException(FormatException.Kind.GRAMMAR, token,
                "unexpected operator '" + token.lexeme() + "'");
        } else {
            expressionStatement(indent);
        }

        if (spaced) {
            output.blankLine();
        }
        output.newline(indent);
    }

    /**
     * <pre>
     * while       :: "while" expression "do" block "end"
     * </pre>
     */
    private void whileStatement(int indent) {
        advance();
        output.write("while ");
        expression(indent);
        consume("do");
        output.write(" do");
        body(indent);
    }

    /**
     * <pre>
     * repeat      :: "repeat" block "until" expression
     * </pre>
     */
    private void repeatStatement(int indent) {
        advance();
        output.write("repeat");
        nestedBlock(indent);
        closeBlock(indent, "until");
        output.write(" ");
        expression(indent);
    }

    /**
     * <pre>
     * if          :: "if" expression "then" block
     *                ( "elseif" expression "then" block )*
     *                ( "else" block )? "end"
     * </pre>
     */
    private void ifStatement(int indent) {
        advance();
        output.write("if ");
        expression(indent);
        consume("then");
        output.write(" then");
        nestedBlock(indent);

        while (check("elseif")) {
            closeBlock(indent, "elseif");
            output.write(" ");
            expression(indent);
            consume("then");
            output.write(" then");
            nestedBlock(indent);
        }
        if (check("else")) {
            closeBlock(indent, "else");
            nestedBlock(indent);
        }
        closeBlock(indent, "end");
    }

    /**
     * <pre>
     * for         :: "for" NAME "=" expression "," expression ( "," expression )?
     *                "do" block "end"
     *              | "for" NAME ( "," NAME )* "in" explist "do" block "end"
     * </pre>
     */
    private void forStatement(int indent) {
        advance();
        output.write("for " + name());

        if (match("=")) {
            output.write(" = ");
            expression(indent);
            consume(",");
            output.write(", ");
            expression(indent);
            if (match(",")) {
                output.write(", ");
                expression(indent);
            }
        } else {
            while (match(",")) {
                output.write(", " + name());
            }
            consume("in");
            output.write(" in ");
            expressionList(indent);
        }

        consume("do");
        output.write(" do");
        body(indent);
    }

    /**
     * <pre>
     * function    :: "function" NAME ( ( "." | ":" ) NAME )* funcbody
     * </pre>
     */
    private void functionStatement(int indent) {
        advance();
        output.write("function " + name());
        while (check(".") || check(":")) {
            output.write(advance().lexeme() + name());
        }
        functionBody(indent);
    }

    /**
     * <pre>
     * local       :: "local" "function" NAME funcbody
     *              | "local" attnamelist ( "=" explist )?
     * </pre>
     *
     * @return whether a function was declared
     */
    private boolean localStatement(int indent) {
        advance();
        if (match("function")) {
            output.write("local function " + name());
            functionBody(indent);
            return true;
        }

        output.write("local ");
        attributedName();
        while (match(",")) {
            output.write(", ");
            attributedName();
        }
        if (match("=")) {
            output.write(" = ");
            expressionList(indent);
        }
        return false;
    }

    /**
     * <pre>
     * attname     :: NAME ( "&lt;" NAME "&gt;" )?
     * </pre>
     */
    private void attributedName() {
        output.write(name());
        if (match("<")) {
            output.write(" <" + name() + ">");
            consume(">");
        }
    }

    /**
     * <pre>
     * return      :: "return" explist?
     * </pre>
     */
    private void returnStatement(int indent) {
        advance();
        output.write("return");
        if (!isAtEnd() && !isBlockEnd() && !check(";") && !check("::")) {
            output.write(" ");
            expressionList(indent);
        }
    }

    /**
     * <pre>
     * label       :: "::" NAME "::"
     * </pre>
     */
    private void label() {
        consume("::");
        var label = name();
        consume("::");
        output.write("::" + label + "::");
    }

    /**
     * <pre>
     * exprstat    :: primaryexp ( ( "," primaryexp )* "=" explist )?
     * </pre>
     */
    private void expressionStatement(int indent) {
        primaryExpression(indent);
        if (check(",") || check("=")) {
            while (match(",")) {
                output.write(", ");
                primaryExpression(indent);
            }
            consume("=");
            output.write(" = ");
            expressionList(indent);
        }
    }

    /**
     * <pre>
     * funcbody    :: "(" parlist? ")" block "end"
     * parlist     :: ( NAME | "..." ) ( "," ( NAME | "..." ) )*
     * </pre>
     */
    private void functionBody(int indent) {
        consume("(");
        output.write("(");
        while (!check(")")) {
            var parameter = advance();
            if (parameter.type() != NAME && !parameter.is(Operators.ELLIPSIS)) {
                throw unexpected(parameter);
            }
            output.write(parameter.lexeme());
            if (!check(")")) {
                consume(",");
                output.write(", ");
            }
        }
        advance();
        output.write(")");
        body(indent);
    }

    /** A block one level deeper, closed by {@code end}. */
    private void body(int indent) {
        nestedBlock(indent);
        closeBlock(indent, "end");
    }

    private void nestedBlock(int indent) {
        output.newline(indent + INDENT);
        block(indent + INDENT);
    }

    //// expressions ////

    /**
     * <pre>
     * explist     :: expression ( "," expression )*
     * </pre>
     */
    private void expressionList(int indent) {
        expression(indent);
        while (match(",")) {
            output.write(", ");
            expression(indent);
        }
    }

    private void expression(int indent) {
        subexpression(indent, 0);
    }

    /**
     * <pre>
     * subexpr     :: ( UNOP subexpr | simpleexp ) ( BINOP subexpr )*
     * </pre>
     * Only binary operators binding tighter than {@code limit} on their left
     * are taken; the rest belong to an enclosing call.
     */
    private void subexpression(int indent, int limit) {
        var token = peek();
        if (token.type() == OPERATOR && Operators.UNARY_OPERATORS.contains(token.lexeme())) {
            advance();
            output.write(token.lexeme());
            if (token.is("not") || (token.is("-") && peek().lexeme().startsWith("-"))) {
                output.write(" ");
            }
            subexpression(indent, Operators.UNARY_PRIORITY);
        } else {
            simpleExpression(indent);
        }

        var precedence = binaryPrecedence(peek());
        while (precedence != null && precedence.left() > limit) {
            output.write(" " + advance().lexeme() + " ");
            subexpression(indent, precedence.right());
            precedence = binaryPrecedence(peek());
        }
    }

    /**
     * <pre>
     * simpleexp   :: NUMBER | STRING | "nil" | "true" | "false" | "..."
     *              | table | "function" funcbody | primaryexp
     * </pre>
     */
    private void simpleExpression(int indent) {
        var token = peek();
        switch (token.type()) {
            case NUMBER:
            case STRING:
            case CONSTANT:
                advance();
                output.write(token.lexeme());
                return;
            default:
                break;
        }

        if (check("{")) {
            table(indent);
        } else if (check("function")) {
            advance();
            output.write("function");
            functionBody(indent);
        } else {
            primaryExpression(indent);
        }
    }

    /**
     * <pre>
     * primaryexp  :: ( NAME | "(" expression ")" )
     *                ( "." NAME | ":" NAME | "[" expression "]" | args )*
     * args        :: "(" explist? ")" | table | STRING
     * </pre>
     */
    private void primaryExpression(int indent) {
        var token = peek();
        if (match("(")) {
            output.write("(");
            expression(indent);
            consume(")");
            output.write(")");
        } else if (token.type() == NAME) {
            advance();
            output.write(token.lexeme());
        } else {
            throw unexpected(token);
        }

        for (;;) {
            if (check(".") || check(":")) {
                output.write(advance().lexeme() + name());
            } else if (match("[")) {
                output.write("[");
                expression(indent);
                consume("]");
                output.write("]");
            } else if (match("(")) {
                output.write("(");
                if (!check(")")) {
                    expressionList(indent);
                }
                consume(")");
                output.write(")");
            } else if (check("{")) {
                table(indent);
            } else if (peek().type() == STRING) {
                output.write(" " + advance().lexeme());
            } else {
                return;
            }
        }
    }

    //// tables ////

    /**
     * <pre>
     * table       :: "{" ( field ( ( "," | ";" ) field )* ( "," | ";" )? )? "}"
     * </pre>
     */
    private void table(int indent) {
        consume("{");
        if (match("}")) {
            output.write("{}");
            return;
        }

        var fieldIndent = indent + INDENT;
        output.write("{");
        output.newline(fieldIndent);
        for (;;) {
            field(fieldIndent);
            if (!match(",") && !match(";")) {
                break;
            }
            if (check("}")) {
                break;
            }
            output.write(",");
            output.newline(fieldIndent);
        }
        closeBlock(indent, "}");
    }

    /**
     * <pre>
     * field       :: "[" expression "]" "=" expression
     *              | NAME "=" expression
     *              | expression
     * </pre>
     */
    private void field(int indent) {
        if (match("[")) {
            output.write("[");
            expression(indent);
            consume("]");
            consume("=");
            output.write("] = ");
            expression(indent);
        } else if (peek().type() == NAME && peekNext().is("=")) {
            output.write(advance().lexeme());
            advance();
            output.write(" = ");
            expression(indent);
        } else {
            expression(indent);
        }
    }

    //// utility methods ////

    /**
     * Writes {@code keyword} on its own line at {@code indent}, then consumes
     * it. Comments following the keyword are deferred to the next line.
     */
    private void closeBlock(int indent, String keyword) {
        if (!check(keyword)) {
            throw expected(keyword);
        }
        output.closeBlock(indent, keyword);
        advance();
    }

    private Token advance() {
        var token = tokens.advance();
        deferComments();
        return token;
    }

    private void deferComments() {
        for (var hidden : tokens.skipHidden()) {
            if (hidden.type() == COMMENT) {
                output.defer(hidden.lexeme());
            }
        }
    }

    private boolean match(String lexeme) {
        if (check(lexeme)) {
            advance();
            return true;
        }
        return false;
    }

    private void consume(String lexeme) {
        if (!match(lexeme)) {
            throw expected(lexeme);
        }
    }

    private String name() {
        if (peek().type() != NAME) {
            throw expected("<name>");
        }
        return advance().lexeme();
    }

    private boolean check(String lexeme) {
        var token = peek();
        return token.type() != STRING && token.is(lexeme);
    }

    private boolean isBlockEnd() {
        var token = peek();
        return token.type() == KEYWORD && Operators.isBlockEnd(token.lexeme());
    }

    private boolean isGoto() {
        return peek().type() == NAME && peek().is("goto") && peekNext().type() == NAME;
    }

    private static Operators.Precedence binaryPrecedence(Token token) {
        return token.type() == OPERATOR ? Operators.BINARY_OPERATORS.get(token.lexeme()) : null;
    }

    private boolean isAtEnd() {
        return tokens.isAtEnd();
    }

    private Token peek() {
        return tokens.peek();
    }

    private Token peekNext() {
        return tokens.peekNext();
    }

    private FormatException unexpected(Token token) {
        if (token.type() == EOF) {
            return new FormatException(FormatException.Kind.GRAMMAR, token, "unexpected end of input");
        }
        return new FormatException(FormatException.Kind.GRAMMAR, token, "unexpected '" + token.lexeme() + "'");
    }

    private FormatException expected(String lexeme) {
        var token = peek();
        var near = token.type() == EOF ? "end of input" : "'" + token.lexeme() + "'";
        return new FormatException(FormatException.Kind.GRAMMAR, token, "expected '" + lexeme + "' near " + near);
    }
}
