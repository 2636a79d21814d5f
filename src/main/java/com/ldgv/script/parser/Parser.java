package com.ldgv.script.parser;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;

import com.ldgv.script.parser.Decl.DeclInterface;
import com.ldgv.script.parser.Decl.Param;
import com.ldgv.script.parser.Expr.Application;
import com.ldgv.script.parser.Expr.Arith;
import com.ldgv.script.parser.Expr.Case;
import com.ldgv.script.parser.Expr.ExprInterface;
import com.ldgv.script.parser.Expr.Fork;
import com.ldgv.script.parser.Expr.Fst;
import com.ldgv.script.parser.Expr.IntLit;
import com.ldgv.script.parser.Expr.Label;
import com.ldgv.script.parser.Expr.Lambda;
import com.ldgv.script.parser.Expr.Let;
import com.ldgv.script.parser.Expr.LetPair;
import com.ldgv.script.parser.Expr.NatRec;
import com.ldgv.script.parser.Expr.Negate;
import com.ldgv.script.parser.Expr.NewChannel;
import com.ldgv.script.parser.Expr.Pair;
import com.ldgv.script.parser.Expr.Recv;
import com.ldgv.script.parser.Expr.Send;
import com.ldgv.script.parser.Expr.Snd;
import com.ldgv.script.parser.Expr.Succ;
import com.ldgv.script.parser.Expr.Variable;

public class Parser {
    private final List<Token> tokens;
    private int current = 0;

    public Parser(List<Token> tokens) { this.tokens = tokens; }

    public List<DeclInterface> parse() {
        List<DeclInterface> declarations = new ArrayList<>();
        while (!isAtEnd()) {
            declarations.add(declaration());
        }
        return declarations;
    }

    /** Parses a single expression covering the whole input (used by hosts and tests). */
    public ExprInterface parseExpression() {
        ExprInterface expr = expression();
        if (!isAtEnd()) throw error(peek(), "Unexpected token after expression.");
        return expr;
    }

    // -------------------------
    // Declarations
    // -------------------------

    private DeclInterface declaration() {
        if (match(TokenType.TYPE)) return typeDeclaration();
        if (match(TokenType.VAL)) return valDeclaration();
        throw error(peek(), "Expect 'val' or 'type' declaration.");
    }

    private DeclInterface typeDeclaration() {
        Token name = consume(TokenType.IDENTIFIER, "Expect type name.");
        consume(TokenType.EQUAL, "Expect '=' after type name.");
        return new Decl.TypeAlias(name.lexeme, type());
    }

    private DeclInterface valDeclaration() {
        Token name = consume(TokenType.IDENTIFIER, "Expect declaration name after 'val'.");

        List<Param> params = new ArrayList<>();
        while (match(TokenType.LEFT_PAREN)) {
            Multiplicity m = match(TokenType.LIN) ? Multiplicity.ONE : Multiplicity.MANY;
            Token pname = consume(TokenType.IDENTIFIER, "Expect parameter name.");
            consume(TokenType.COLON, "Expect ':' after parameter name.");
            TypeExpr ptype = type();
            consume(TokenType.RIGHT_PAREN, "Expect ')' after parameter type.");
            params.add(new Param(m, pname.lexeme, ptype));
        }

        TypeExpr resultType = null;
        if (match(TokenType.COLON)) {
            resultType = type();
            if (params.isEmpty() && !check(TokenType.EQUAL)) {
                return new Decl.Signature(name.lexeme, resultType);
            }
        }

        consume(TokenType.EQUAL, "Expect '=' before declaration body.");
        ExprInterface body = expression();
        return new Decl.Fun(name.lexeme, params, body, resultType);
    }

    // -------------------------
    // Expressions
    // -------------------------

    private ExprInterface expression() {
        if (match(TokenType.LET)) return letExpression();
        if (match(TokenType.FN)) return lambda();
        if (match(TokenType.FORK)) return new Fork(expression());
        if (match(TokenType.CASE)) return caseExpression();
        if (match(TokenType.NATREC)) return natrec();
        return additive();
    }

    private ExprInterface letExpression() {
        if (match(TokenType.LESS)) {
            Token first = consume(TokenType.IDENTIFIER, "Expect first name in pair pattern.");
            consume(TokenType.COMMA, "Expect ',' in pair pattern.");
            Token second = consume(TokenType.IDENTIFIER, "Expect second name in pair pattern.");
            consume(TokenType.GREATER, "Expect '>' after pair pattern.");
            consume(TokenType.EQUAL, "Expect '=' after pair pattern.");
            ExprInterface value = expression();
            consume(TokenType.IN, "Expect 'in' after let value.");
            return new LetPair(first.lexeme, second.lexeme, value, expression());
        }

        Token name = consume(TokenType.IDENTIFIER, "Expect variable name after 'let'.");
        consume(TokenType.EQUAL, "Expect '=' after variable name.");
        ExprInterface value = expression();
        consume(TokenType.IN, "Expect 'in' after let value.");
        return new Let(name.lexeme, value, expression());
    }

    private ExprInterface lambda() {
        consume(TokenType.LEFT_PAREN, "Expect '(' after 'fn'.");
        Multiplicity m = match(TokenType.LIN) ? Multiplicity.ONE : Multiplicity.MANY;
        Token param = consume(TokenType.IDENTIFIER, "Expect parameter name.");
        consume(TokenType.COLON, "Expect ':' after parameter name.");
        TypeExpr ptype = type();
        consume(TokenType.RIGHT_PAREN, "Expect ')' after parameter type.");
        return new Lambda(m, param.lexeme, ptype, expression());
    }

    private ExprInterface caseExpression() {
        ExprInterface scrutinee = expression();
        consume(TokenType.OF, "Expect 'of' after case scrutinee.");
        consume(TokenType.LEFT_BRACE, "Expect '{' before case branches.");

        LinkedHashMap<String, ExprInterface> branches = new LinkedHashMap<>();
        do {
            Token label = consume(TokenType.LABEL, "Expect label in case branch.");
            consume(TokenType.COLON, "Expect ':' after case label.");
            String key = (String) label.literal;
            if (branches.containsKey(key)) throw error(label, "Duplicate case branch for label '" + key + ".");
            branches.put(key, expression());
        } while (match(TokenType.COMMA));

        consume(TokenType.RIGHT_BRACE, "Expect '}' after case branches.");
        return new Case(scrutinee, branches);
    }

    private ExprInterface natrec() {
        ExprInterface index = expression();
        consume(TokenType.LEFT_BRACE, "Expect '{' after natrec index.");
        consume(TokenType.ZERO, "Expect 'zero' branch.");
        consume(TokenType.FAT_ARROW, "Expect '=>' after 'zero'.");
        ExprInterface zeroCase = expression();
        consume(TokenType.COMMA, "Expect ',' after zero branch.");
        consume(TokenType.SUCC, "Expect 'succ' branch.");
        Token indexName = consume(TokenType.IDENTIFIER, "Expect index name after 'succ'.");
        consume(TokenType.DOT, "Expect '.' after index name.");
        Token resultName = consume(TokenType.IDENTIFIER, "Expect result name after '.'.");
        TypeExpr resultType = match(TokenType.COLON) ? type() : null;
        consume(TokenType.FAT_ARROW, "Expect '=>' in succ branch.");
        ExprInterface stepCase = expression();
        consume(TokenType.RIGHT_BRACE, "Expect '}' after natrec branches.");
        return new NatRec(index, zeroCase, indexName.lexeme, resultName.lexeme, resultType, stepCase);
    }

    private ExprInterface additive() {
        ExprInterface expr = multiplicative();
        while (match(TokenType.PLUS, TokenType.MINUS)) {
            BinaryOp op = previous().type == TokenType.PLUS ? BinaryOp.PLUS : BinaryOp.MINUS;
            expr = new Arith(op, expr, multiplicative());
        }
        return expr;
    }

    private ExprInterface multiplicative() {
        ExprInterface expr = unary();
        while (match(TokenType.STAR, TokenType.SLASH)) {
            BinaryOp op = previous().type == TokenType.STAR ? BinaryOp.TIMES : BinaryOp.DIV;
            expr = new Arith(op, expr, unary());
        }
        return expr;
    }

    private ExprInterface unary() {
        if (match(TokenType.MINUS)) return new Negate(unary());
        return application();
    }

    private ExprInterface application() {
        ExprInterface expr = head();
        while (startsAtom()) {
            expr = new Application(expr, atom());
        }
        return expr;
    }

    private ExprInterface head() {
        if (match(TokenType.FST)) return new Fst(atom());
        if (match(TokenType.SND)) return new Snd(atom());
        if (match(TokenType.SUCC)) return new Succ(atom());
        if (match(TokenType.SEND)) return new Send(atom());
        if (match(TokenType.RECV)) return new Recv(atom());
        return atom();
    }

    private boolean startsAtom() {
        if (isAtEnd()) return false;
        switch (peek().type) {
            case LEFT_PAREN:
            case NUMBER:
            case LABEL:
            case IDENTIFIER:
            case NEW:
            case LESS:
                return true;
            default:
                return false;
        }
    }

    private ExprInterface atom() {
        if (match(TokenType.NUMBER)) return new IntLit((Long) previous().literal);
        if (match(TokenType.LABEL)) return new Label((String) previous().literal);
        if (match(TokenType.IDENTIFIER)) return new Variable(previous().lexeme);
        if (match(TokenType.NEW)) return new NewChannel(type());

        if (match(TokenType.LEFT_PAREN)) {
            if (match(TokenType.RIGHT_PAREN)) return Expr.Unit.INSTANCE;
            ExprInterface expr = expression();
            consume(TokenType.RIGHT_PAREN, "Expect ')' after expression.");
            return expr;
        }

        if (match(TokenType.LESS)) return pair();

        throw error(peek(), "Expect expression.");
    }

    private ExprInterface pair() {
        ExprInterface result;
        if (check(TokenType.LIN) || (check(TokenType.IDENTIFIER) && checkNext(TokenType.EQUAL))) {
            Multiplicity m = match(TokenType.LIN) ? Multiplicity.ONE : Multiplicity.MANY;
            Token name = consume(TokenType.IDENTIFIER, "Expect binder name in dependent pair.");
            consume(TokenType.EQUAL, "Expect '=' after pair binder.");
            ExprInterface first = expression();
            consume(TokenType.COMMA, "Expect ',' between pair components.");
            result = new Pair(m, name.lexeme, first, expression());
        } else {
            ExprInterface first = expression();
            consume(TokenType.COMMA, "Expect ',' between pair components.");
            result = new Pair(Multiplicity.MANY, "_", first, expression());
        }
        consume(TokenType.GREATER, "Expect '>' after pair.");
        return result;
    }

    // -------------------------
    // Types
    // -------------------------

    private TypeExpr type() {
        if (match(TokenType.BANG)) return sessionType(true);
        if (match(TokenType.QUESTION)) return sessionType(false);
        if (match(TokenType.TILDE)) return new TypeExpr.Dual(type());

        if (check(TokenType.LEFT_PAREN) && checkNext(TokenType.IDENTIFIER) && checkAt(2, TokenType.COLON)) {
            advance();
            Token binder = advance();
            advance();
            TypeExpr domain = type();
            consume(TokenType.RIGHT_PAREN, "Expect ')' after dependent domain.");
            consume(TokenType.ARROW, "Expect '->' after dependent domain.");
            return new TypeExpr.Function(binder.lexeme, domain, type());
        }

        TypeExpr atom = typeAtom();
        if (match(TokenType.ARROW)) return new TypeExpr.Function(null, atom, type());
        return atom;
    }

    private TypeExpr sessionType(boolean sending) {
        TypeExpr payload = type();
        consume(TokenType.DOT, "Expect '.' after session payload type.");
        return new TypeExpr.Session(sending, payload, type());
    }

    private TypeExpr typeAtom() {
        if (match(TokenType.IDENTIFIER)) return new TypeExpr.Named(previous().lexeme);

        if (match(TokenType.LEFT_BRACE)) {
            List<String> labels = new ArrayList<>();
            do {
                labels.add((String) consume(TokenType.LABEL, "Expect label in label set.").literal);
            } while (match(TokenType.COMMA));
            consume(TokenType.RIGHT_BRACE, "Expect '}' after label set.");
            return new TypeExpr.LabelSet(labels);
        }

        if (match(TokenType.LEFT_BRACKET)) {
            Token binder = consume(TokenType.IDENTIFIER, "Expect binder in pair type.");
            consume(TokenType.COLON, "Expect ':' after pair type binder.");
            TypeExpr first = type();
            consume(TokenType.COMMA, "Expect ',' in pair type.");
            TypeExpr second = type();
            consume(TokenType.RIGHT_BRACKET, "Expect ']' after pair type.");
            return new TypeExpr.Pair(binder.lexeme, first, second);
        }

        if (match(TokenType.LEFT_PAREN)) {
            TypeExpr inner = type();
            consume(TokenType.RIGHT_PAREN, "Expect ')' after type.");
            return inner;
        }

        throw error(peek(), "Expect type.");
    }

    // -------------------------
    // Token helpers
    // -------------------------

    private boolean match(TokenType... types) {
        for (TokenType type : types) {
            if (check(type)) {
                advance();
                return true;
            }
        }
        return false;
    }

    private Token consume(TokenType type, String message) {
        if (check(type)) return advance();
        throw error(peek(), message);
    }

    private boolean check(TokenType type) {
        if (isAtEnd()) return false;
        return peek().type == type;
    }

    private boolean checkNext(TokenType type) {
        return checkAt(1, type);
    }

    private boolean checkAt(int offset, TokenType type) {
        int i = current + offset;
        if (i >= tokens.size()) return false;
        return tokens.get(i).type == type;
    }

    private Token advance() {
        if (!isAtEnd()) current++;
        return previous();
    }

    private boolean isAtEnd() { return peek().type == TokenType.EOF; }
    private Token peek() { return tokens.get(current); }
    private Token previous() { return tokens.get(current - 1); }

    private RuntimeException error(Token token, String message) {
        return new RuntimeException("[line " + token.line + "] " + message);
    }
}
