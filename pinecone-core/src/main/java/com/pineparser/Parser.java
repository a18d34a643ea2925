package com.pineparser;

import com.pineparser.ast.*;

import java.util.ArrayList;
import java.util.List;

/**
 * Recursive descent parser for Pine Script. Expressions use a Pratt loop driven by the
 * binding powers below; statements and blocks are plain descent over the token list.
 *
 * <p>Every recursive rule, type arguments included, goes through the {@link RecursionLimit}
 * given at construction, so deeply nested input fails with
 * {@link RecursionLimitExceededException} instead of exhausting the thread stack.</p>
 */
public class Parser {
    // ========================================================================
    // Binding powers (higher binds tighter), following Pine operator precedence
    // ========================================================================
    private static final int BP_NONE = 0;
    private static final int BP_TERNARY = 1;        // ?: - right-associative
    private static final int BP_OR = 2;
    private static final int BP_AND = 3;
    private static final int BP_EQUALITY = 4;       // == !=
    private static final int BP_RELATIONAL = 5;     // < <= > >=
    private static final int BP_ADDITIVE = 6;
    private static final int BP_MULTIPLICATIVE = 7;
    private static final int BP_UNARY = 8;          // + - not
    private static final int BP_POSTFIX = 9;        // call, attribute, history subscript

    private final List<Token> tokens;
    private final RecursionLimit recursionLimit;
    private int current = 0;
    private boolean parseAll = true;
    private int blockDepth = 0;       // enclosing indented blocks
    private boolean truncated = false; // a top-level statement ended early, see endStatement

    public Parser(String source) {
        this(source, ParseOptions.DEFAULT_TAB_WIDTH, new RecursionLimit(RecursionLimit.DEFAULT_LIMIT));
    }

    public Parser(String source, int tabWidth, RecursionLimit recursionLimit) {
        this.tokens = new Lexer(source, tabWidth).tokenize();
        this.recursionLimit = recursionLimit;
    }

    /**
     * Parses the whole token stream.
     *
     * @param parseAll when true, any statement that cannot be matched is an error; when false,
     *                 parsing stops at the first top-level statement that cannot be matched. A
     *                 statement followed by unmatched text on its own line is kept; one that fails
     *                 earlier is dropped. The statements matched so far are returned
     * @throws RecursionLimitExceededException when the nesting exceeds the recursion limit or the
     *                                         thread stack, whatever {@code parseAll} says
     */
    public Script parse(boolean parseAll) {
        this.parseAll = parseAll;
        List<Statement> body = new ArrayList<>();
        while (!isAtEnd()) {
            int mark = current;
            try {
                body.add(parseStatement());
                if (truncated) {
                    break;
                }
            } catch (RecursionLimitExceededException e) {
                throw e;
            } catch (StackOverflowError e) {
                throw new RecursionLimitExceededException(recursionLimit.limit(), peek());
            } catch (ParseException e) {
                if (parseAll) {
                    throw e;
                }
                current = mark;
                break;
            }
        }
        return new Script(new SourceLocation(1, 1), List.copyOf(body), null);
    }

    public static Script parse(String source) {
        return new Parser(source).parse(true);
    }

    // ========================================================================
    // Statements
    // ========================================================================

    private Statement parseStatement() {
        Token token = peek();
        recursionLimit.enter(token);
        try {
            return switch (token.type()) {
                case VAR, VARIP -> parseDeclaration();
                case IMPORT -> parseImport();
                case BREAK -> {
                    advance();
                    endStatement();
                    yield new Break(loc(token));
                }
                case CONTINUE -> {
                    advance();
                    endStatement();
                    yield new Continue(loc(token));
                }
                case LBRACKET -> isTupleDeclaration() ? parseTupleDeclaration() : parseExpressionStatement();
                case IDENTIFIER -> parseIdentifierStatement(token);
                case INDENT -> throw new ParseException("Unexpected indent", token);
                default -> parseExpressionStatement();
            };
        } finally {
            recursionLimit.exit();
        }
    }

    /**
     * Statements starting with an identifier: definitions introduced by the contextual
     * keywords {@code export}, {@code method} and {@code type}, function definitions,
     * typed declarations and finally plain expression statements.
     */
    private Statement parseIdentifierStatement(Token token) {
        String lexeme = token.lexeme();
        if (lexeme.equals("export") && checkAhead(1, TokenType.IDENTIFIER)) {
            return parseExport();
        }
        if (lexeme.equals("method") && checkAhead(1, TokenType.IDENTIFIER) && checkAhead(2, TokenType.LPAREN)) {
            advance();
            return parseFunctionDef(token, true, false);
        }
        if (lexeme.equals("type") && checkAhead(1, TokenType.IDENTIFIER) && checkAhead(2, TokenType.NEWLINE)) {
            advance();
            return parseTypeDef(token, false);
        }
        if (checkAhead(1, TokenType.LPAREN) && isFunctionDefinition()) {
            return parseFunctionDef(token, false, false);
        }
        if (isTypedDeclaration()) {
            Expression declaredType = parseType();
            return finishDeclaration(token, declaredType, null);
        }
        return parseExpressionStatement();
    }

    private Statement parseExport() {
        Token start = advance();
        Token next = peek();
        if (next.lexeme().equals("method") && checkAhead(1, TokenType.IDENTIFIER)) {
            advance();
            return parseFunctionDef(start, true, true);
        }
        if (next.lexeme().equals("type") && checkAhead(1, TokenType.IDENTIFIER)) {
            advance();
            return parseTypeDef(start, true);
        }
        if (checkAhead(1, TokenType.LPAREN)) {
            return parseFunctionDef(start, false, true);
        }
        throw new ExpectedTokenException("Expected function or type definition after 'export'", next);
    }

    private Statement parseDeclaration() {
        Token start = advance();
        Expression declaredType = isTypedDeclaration() ? parseType() : null;
        return finishDeclaration(start, declaredType, start.lexeme());
    }

    private Statement finishDeclaration(Token start, Expression declaredType, String mode) {
        Token name = consumeIdentifier("Expected variable name");
        consume(TokenType.ASSIGN, "Expected '=' in variable declaration");
        Expression value = parseExpr(BP_NONE);
        endStatement();
        return new Assign(loc(start), new Name(loc(name), name.lexeme()), value, declaredType, mode);
    }

    private Statement parseTupleDeclaration() {
        Token start = advance();
        List<Expression> names = new ArrayList<>();
        do {
            Token name = consumeIdentifier("Expected variable name in tuple declaration");
            names.add(new Name(loc(name), name.lexeme()));
        } while (match(TokenType.COMMA));
        consume(TokenType.RBRACKET, "Expected ']' after tuple declaration");
        consume(TokenType.ASSIGN, "Expected '=' after tuple declaration");
        Expression value = parseExpr(BP_NONE);
        endStatement();
        return new Assign(loc(start), new Tuple(loc(start), List.copyOf(names)), value, null, null);
    }

    private Statement parseExpressionStatement() {
        Token start = peek();
        Expression expr = parseExpr(BP_NONE);
        Token token = peek();

        switch (token.type()) {
            case ASSIGN -> {
                if (!(expr instanceof Name)) {
                    throw new ParseException("Cannot declare " + expr.type() + " as a variable", token);
                }
                advance();
                Expression value = parseExpr(BP_NONE);
                endStatement();
                return new Assign(loc(start), expr, value, null, null);
            }
            case COLON_ASSIGN -> {
                checkAssignable(expr, token);
                advance();
                Expression value = parseExpr(BP_NONE);
                endStatement();
                return new ReAssign(loc(start), expr, value);
            }
            case PLUS_ASSIGN, MINUS_ASSIGN, STAR_ASSIGN, SLASH_ASSIGN, PERCENT_ASSIGN -> {
                checkAssignable(expr, token);
                advance();
                Expression value = parseExpr(BP_NONE);
                endStatement();
                String op = token.lexeme().substring(0, 1);
                return new AugAssign(loc(start), expr, op, value);
            }
            default -> {
                endStatement();
                return new Expr(loc(start), expr);
            }
        }
    }

    private void checkAssignable(Expression target, Token token) {
        if (!(target instanceof Name) && !(target instanceof Attribute)) {
            throw new ParseException("Cannot assign to " + target.type(), token);
        }
    }

    private Statement parseImport() {
        Token start = advance();
        Token namespace = consumeIdentifier("Expected library namespace");
        consume(TokenType.SLASH, "Expected '/' after library namespace");
        Token name = consumeIdentifier("Expected library name");
        consume(TokenType.SLASH, "Expected '/' after library name");
        Token version = consume(TokenType.INT, "Expected library version");
        String alias = null;
        if (match(TokenType.AS)) {
            alias = consumeIdentifier("Expected alias after 'as'").lexeme();
        }
        endStatement();
        return new Import(loc(start), namespace.lexeme(), name.lexeme(), (Long) version.literal(), alias);
    }

    private Statement parseFunctionDef(Token start, boolean method, boolean export) {
        Token name = consumeIdentifier("Expected function name");
        consume(TokenType.LPAREN, "Expected '(' after function name");
        List<Param> params = new ArrayList<>();
        if (!check(TokenType.RPAREN)) {
            do {
                params.add(parseParam());
            } while (match(TokenType.COMMA));
        }
        consume(TokenType.RPAREN, "Expected ')' after parameters");
        consume(TokenType.ARROW, "Expected '=>' after parameters");
        List<Statement> body = parseBody();
        return new FunctionDef(loc(start), name.lexeme(), List.copyOf(params), body, method, export);
    }

    private Param parseParam() {
        Token start = peek();
        Expression declaredType = isTypedParam() ? parseType() : null;
        Token name = consumeIdentifier("Expected parameter name");
        Expression defaultValue = null;
        if (match(TokenType.ASSIGN)) {
            defaultValue = parseExpr(BP_NONE);
        }
        return new Param(loc(start), name.lexeme(), defaultValue, declaredType);
    }

    private Statement parseTypeDef(Token start, boolean export) {
        Token name = consumeIdentifier("Expected type name");
        consume(TokenType.NEWLINE, "Expected end of line after type name");
        consume(TokenType.INDENT, "Expected indented field block");
        List<TypeField> fields = new ArrayList<>();
        blockDepth++;
        try {
            while (!check(TokenType.DEDENT) && !isAtEnd()) {
                Token fieldStart = peek();
                Expression declaredType = parseType();
                Token fieldName = consumeIdentifier("Expected field name");
                Expression defaultValue = null;
                if (match(TokenType.ASSIGN)) {
                    defaultValue = parseExpr(BP_NONE);
                }
                endStatement();
                fields.add(new TypeField(loc(fieldStart), declaredType, fieldName.lexeme(), defaultValue));
            }
        } finally {
            blockDepth--;
        }
        consume(TokenType.DEDENT, "Expected end of field block");
        return new TypeDef(loc(start), name.lexeme(), List.copyOf(fields), export);
    }

    /**
     * Body of a function or switch case: either an indented block or a single expression
     * on the same line.
     */
    private List<Statement> parseBody() {
        if (check(TokenType.NEWLINE)) {
            return parseBlock();
        }
        Token start = peek();
        Expression value = parseExpr(BP_NONE);
        endStatement();
        return List.of(new Expr(loc(start), value));
    }

    private List<Statement> parseBlock() {
        consume(TokenType.NEWLINE, "Expected end of line before block");
        consume(TokenType.INDENT, "Expected indented block");
        List<Statement> statements = new ArrayList<>();
        blockDepth++;
        try {
            while (!check(TokenType.DEDENT) && !isAtEnd()) {
                statements.add(parseStatement());
            }
        } finally {
            blockDepth--;
        }
        consume(TokenType.DEDENT, "Expected end of block");
        return List.copyOf(statements);
    }

    /**
     * Ends a simple statement. Without parseAll, unmatched text after a complete top-level
     * statement ends the parse instead of failing it.
     */
    private void endStatement() {
        if (match(TokenType.NEWLINE)) {
            return;
        }
        if (check(TokenType.EOF) || check(TokenType.DEDENT) || previous().type() == TokenType.DEDENT) {
            return;
        }
        if (!parseAll && blockDepth == 0) {
            truncated = true;
            return;
        }
        throw expected("Expected end of line");
    }

    // ========================================================================
    // Types
    // ========================================================================

    /**
     * Parses a type such as {@code float}, {@code chart.point}, {@code map<string, float>}
     * or {@code int[]}. The array suffix form is normalized to {@code array<T>}.
     */
    private Expression parseType() {
        Token start = peek();
        recursionLimit.enter(start);
        try {
            Token first = consumeIdentifier("Expected type name");
            Expression type = new Name(loc(first), first.lexeme());
            while (check(TokenType.DOT) && checkAhead(1, TokenType.IDENTIFIER)) {
                advance();
                type = new Attribute(loc(start), type, advance().lexeme());
            }
            if (check(TokenType.LT)) {
                advance();
                type = new Specialize(loc(start), type, parseTypeArguments());
            }
            if (check(TokenType.LBRACKET) && checkAhead(1, TokenType.RBRACKET)) {
                advance();
                advance();
                type = new Specialize(loc(start), new Name(loc(start), "array"), List.of(type));
            }
            return type;
        } finally {
            recursionLimit.exit();
        }
    }

    private List<Expression> parseTypeArguments() {
        List<Expression> args = new ArrayList<>();
        do {
            args.add(parseType());
        } while (match(TokenType.COMMA));
        consume(TokenType.GT, "Expected '>' after type arguments");
        return List.copyOf(args);
    }

    // ========================================================================
    // Lookahead
    // ========================================================================

    private boolean isTypedDeclaration() {
        int saved = current;
        try {
            parseType();
            return check(TokenType.IDENTIFIER) && checkAhead(1, TokenType.ASSIGN);
        } catch (RecursionLimitExceededException e) {
            throw e;
        } catch (ParseException e) {
            return false;
        } finally {
            current = saved;
        }
    }

    private boolean isTypedParam() {
        int saved = current;
        try {
            parseType();
            return check(TokenType.IDENTIFIER);
        } catch (RecursionLimitExceededException e) {
            throw e;
        } catch (ParseException e) {
            return false;
        } finally {
            current = saved;
        }
    }

    /**
     * {@code <T, ...>(} after a name: a generic call such as {@code array.new<float>(0)}
     * rather than a comparison.
     */
    private boolean isSpecialization() {
        int saved = current;
        try {
            advance();
            parseTypeArguments();
            return check(TokenType.LPAREN);
        } catch (RecursionLimitExceededException e) {
            throw e;
        } catch (ParseException e) {
            return false;
        } finally {
            current = saved;
        }
    }

    private boolean isTupleDeclaration() {
        int pos = current + 1;
        while (true) {
            if (typeAt(pos) != TokenType.IDENTIFIER) {
                return false;
            }
            pos++;
            if (typeAt(pos) == TokenType.COMMA) {
                pos++;
                continue;
            }
            return typeAt(pos) == TokenType.RBRACKET && typeAt(pos + 1) == TokenType.ASSIGN;
        }
    }

    private boolean isFunctionDefinition() {
        int depth = 0;
        for (int pos = current + 1; pos < tokens.size(); pos++) {
            TokenType type = typeAt(pos);
            if (type == TokenType.LPAREN) {
                depth++;
            } else if (type == TokenType.RPAREN) {
                depth--;
                if (depth == 0) {
                    return typeAt(pos + 1) == TokenType.ARROW;
                }
            } else if (type == TokenType.NEWLINE || type == TokenType.EOF) {
                return false;
            }
        }
        return false;
    }

    // ========================================================================
    // Expressions
    // ========================================================================

    private Expression parseExpr(int minBp) {
        Token startToken = peek();
        recursionLimit.enter(startToken);
        try {
            Expression left = parsePrefix();
            BoolOp chain = null;

            while (true) {
                // A structure expression ends with its block; the next token starts a new statement.
                if (previous().type() == TokenType.DEDENT) {
                    break;
                }
                Token token = peek();
                TokenType type = token.type();

                if (type == TokenType.LT && (left instanceof Name || left instanceof Attribute) && isSpecialization()) {
                    advance();
                    left = new Specialize(left.loc(), left, parseTypeArguments());
                    continue;
                }

                int bp = infixBindingPower(type);
                if (bp <= minBp) {
                    break;
                }
                advance();

                switch (type) {
                    case LPAREN -> left = new Call(left.loc(), left, parseArguments());
                    case DOT -> {
                        Token attr = consumeIdentifier("Expected attribute name after '.'");
                        left = new Attribute(left.loc(), left, attr.lexeme());
                    }
                    case LBRACKET -> {
                        Expression slice = parseExpr(BP_NONE);
                        consume(TokenType.RBRACKET, "Expected ']' after history reference");
                        left = new Subscript(left.loc(), left, slice);
                    }
                    case QUESTION -> {
                        Expression body = parseExpr(BP_NONE);
                        consume(TokenType.COLON, "Expected ':' in conditional expression");
                        Expression orelse = parseExpr(BP_TERNARY - 1);
                        left = new Conditional(left.loc(), left, body, orelse);
                    }
                    case AND, OR -> {
                        Expression right = parseExpr(bp);
                        String op = token.lexeme();
                        if (left == chain && chain.op().equals(op)) {
                            List<Expression> values = new ArrayList<>(chain.values());
                            values.add(right);
                            chain = new BoolOp(chain.loc(), op, List.copyOf(values));
                        } else {
                            chain = new BoolOp(left.loc(), op, List.of(left, right));
                        }
                        left = chain;
                    }
                    case EQ, NE, LT, LE, GT, GE -> left = new Compare(left.loc(), left, token.lexeme(), parseExpr(bp));
                    default -> left = new BinOp(left.loc(), left, token.lexeme(), parseExpr(bp));
                }
            }
            return left;
        } finally {
            recursionLimit.exit();
        }
    }

    private int infixBindingPower(TokenType type) {
        return switch (type) {
            case QUESTION -> BP_TERNARY;
            case OR -> BP_OR;
            case AND -> BP_AND;
            case EQ, NE -> BP_EQUALITY;
            case LT, LE, GT, GE -> BP_RELATIONAL;
            case PLUS, MINUS -> BP_ADDITIVE;
            case STAR, SLASH, PERCENT -> BP_MULTIPLICATIVE;
            case LPAREN, LBRACKET, DOT -> BP_POSTFIX;
            default -> -1;
        };
    }

    private Expression parsePrefix() {
        Token token = peek();
        return switch (token.type()) {
            case INT, FLOAT, STRING -> {
                advance();
                yield new Constant(loc(token), token.literal(), null);
            }
            case COLOR -> {
                advance();
                yield new Constant(loc(token), token.lexeme(), "color");
            }
            case TRUE, FALSE -> {
                advance();
                yield new Constant(loc(token), token.type() == TokenType.TRUE, null);
            }
            case IDENTIFIER -> {
                advance();
                yield new Name(loc(token), token.lexeme());
            }
            case LPAREN -> {
                advance();
                Expression inner = parseExpr(BP_NONE);
                consume(TokenType.RPAREN, "Expected ')' after expression");
                yield inner;
            }
            case LBRACKET -> parseTuple();
            case MINUS, PLUS, NOT -> {
                advance();
                yield new UnaryOp(loc(token), token.lexeme(), parseExpr(BP_UNARY));
            }
            case IF -> parseIf();
            case SWITCH -> parseSwitch();
            case FOR -> parseFor();
            case WHILE -> parseWhile();
            default -> throw new UnexpectedTokenException(token, "expression");
        };
    }

    private Expression parseTuple() {
        Token start = advance();
        List<Expression> elements = new ArrayList<>();
        if (!check(TokenType.RBRACKET)) {
            do {
                elements.add(parseExpr(BP_NONE));
            } while (match(TokenType.COMMA));
        }
        consume(TokenType.RBRACKET, "Expected ']' after tuple elements");
        return new Tuple(loc(start), List.copyOf(elements));
    }

    private List<Arg> parseArguments() {
        List<Arg> args = new ArrayList<>();
        if (!check(TokenType.RPAREN)) {
            do {
                Token start = peek();
                String name = null;
                if (check(TokenType.IDENTIFIER) && checkAhead(1, TokenType.ASSIGN)) {
                    name = advance().lexeme();
                    advance();
                }
                args.add(new Arg(loc(start), parseExpr(BP_NONE), name));
            } while (match(TokenType.COMMA));
        }
        consume(TokenType.RPAREN, "Expected ')' after arguments");
        return List.copyOf(args);
    }

    private Expression parseIf() {
        Token start = advance();
        recursionLimit.enter(start);
        try {
            Expression test = parseExpr(BP_NONE);
            List<Statement> body = parseBlock();
            List<Statement> orelse = List.of();
            if (match(TokenType.ELSE)) {
                if (check(TokenType.IF)) {
                    Expression elseIf = parseIf();
                    orelse = List.of(new Expr(elseIf.loc(), elseIf));
                } else {
                    orelse = parseBlock();
                }
            }
            return new If(loc(start), test, body, orelse);
        } finally {
            recursionLimit.exit();
        }
    }

    private Expression parseSwitch() {
        Token start = advance();
        Expression subject = check(TokenType.NEWLINE) ? null : parseExpr(BP_NONE);
        consume(TokenType.NEWLINE, "Expected end of line after switch");
        consume(TokenType.INDENT, "Expected indented switch cases");
        List<Case> cases = new ArrayList<>();
        blockDepth++;
        try {
            while (!check(TokenType.DEDENT) && !isAtEnd()) {
                Token caseStart = peek();
                Expression pattern = check(TokenType.ARROW) ? null : parseExpr(BP_NONE);
                consume(TokenType.ARROW, "Expected '=>' in switch case");
                cases.add(new Case(loc(caseStart), pattern, parseBody()));
            }
        } finally {
            blockDepth--;
        }
        consume(TokenType.DEDENT, "Expected end of switch cases");
        return new Switch(loc(start), subject, List.copyOf(cases));
    }

    private Expression parseFor() {
        Token start = advance();
        if (check(TokenType.LBRACKET)) {
            Expression target = parseTuple();
            consume(TokenType.IN, "Expected 'in' after loop variables");
            Expression iter = parseExpr(BP_NONE);
            return new ForIn(loc(start), target, iter, parseBlock());
        }

        Token name = consumeIdentifier("Expected loop variable");
        Expression target = new Name(loc(name), name.lexeme());
        if (match(TokenType.IN)) {
            Expression iter = parseExpr(BP_NONE);
            return new ForIn(loc(start), target, iter, parseBlock());
        }
        consume(TokenType.ASSIGN, "Expected '=' or 'in' after loop variable");
        Expression from = parseExpr(BP_NONE);
        consume(TokenType.TO, "Expected 'to' in for loop");
        Expression to = parseExpr(BP_NONE);
        Expression step = match(TokenType.BY) ? parseExpr(BP_NONE) : null;
        return new ForTo(loc(start), target, from, to, step, parseBlock());
    }

    private Expression parseWhile() {
        Token start = advance();
        Expression test = parseExpr(BP_NONE);
        return new While(loc(start), test, parseBlock());
    }

    // ========================================================================
    // Helpers
    // ========================================================================

    private SourceLocation loc(Token token) {
        return new SourceLocation(token.line(), token.column());
    }

    private boolean match(TokenType... types) {
        for (TokenType type : types) {
            if (check(type)) {
                advance();
                return true;
            }
        }
        return false;
    }

    private boolean check(TokenType type) {
        return peek().type() == type;
    }

    private boolean checkAhead(int offset, TokenType type) {
        return typeAt(current + offset) == type;
    }

    private TokenType typeAt(int pos) {
        return pos < tokens.size() ? tokens.get(pos).type() : TokenType.EOF;
    }

    private Token advance() {
        if (!isAtEnd()) current++;
        return previous();
    }

    private boolean isAtEnd() {
        return peek().type() == TokenType.EOF;
    }

    private Token peek() {
        return tokens.get(current);
    }

    private Token previous() {
        return current > 0 ? tokens.get(current - 1) : tokens.get(0);
    }

    private Token consume(TokenType type, String message) {
        if (check(type)) {
            return advance();
        }
        throw expected(message);
    }

    private Token consumeIdentifier(String message) {
        return consume(TokenType.IDENTIFIER, message);
    }

    private ParseException expected(String message) {
        Token token = peek();
        if (token.type() == TokenType.ERROR) {
            return new UnexpectedTokenException(token, message);
        }
        return new ExpectedTokenException(message, token);
    }
}
