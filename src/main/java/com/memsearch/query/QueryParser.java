package com.memsearch.query;

import java.util.List;
import java.util.Objects;

/**
 * 布尔查询解析器。
 *
 * <pre>
 * disjunction := conjunction (OR conjunction)*
 * conjunction := operand ((AND | 隐式) operand)*
 * operand     := TERM | '(' disjunction ')'
 * </pre>
 *
 * 相邻的操作数之间没有操作符时按默认操作符组合。解析器本身无状态，可跨线程复用。
 */
public class QueryParser {
    private final QueryLexer lexer;
    private final QueryNode.BoolOp defaultOperator;

    /**
     * @param lexer           与索引共用分词器和规范化器的词法分析器
     * @param defaultOperator 相邻操作数之间没有显式操作符时使用的操作符
     */
    public QueryParser(QueryLexer lexer, QueryNode.BoolOp defaultOperator) {
        this.lexer = Objects.requireNonNull(lexer, "lexer");
        if (defaultOperator == null) {
            throw new IllegalArgumentException("默认布尔操作符不能为null");
        }
        this.defaultOperator = defaultOperator;
    }

    /**
     * 将查询字符串解析为 AST。
     *
     * @throws QueryParseException 查询为空或不合语法时抛出
     */
    public QueryNode parse(String query) {
        Cursor cursor = new Cursor(lexer.tokenize(query), query);
        if (cursor.at(LexToken.Kind.END)) {
            throw cursor.error("查询中没有可检索的词", "请输入至少一个查询词");
        }
        QueryNode root = disjunction(cursor);
        if (!cursor.at(LexToken.Kind.END)) {
            throw cursor.peek().kind() == LexToken.Kind.RPAREN
                ? cursor.error("多余的右括号", "删除多余的右括号，或补全对应的左括号")
                : cursor.error("无法识别的 " + cursor.peek().text(), "检查该位置的布尔操作符");
        }
        return root;
    }

    private QueryNode disjunction(Cursor cursor) {
        QueryNode node = conjunction(cursor);
        while (cursor.accept(LexToken.Kind.OR)) {
            node = new QueryNode.BooleanQuery(QueryNode.BoolOp.OR, node, conjunction(cursor));
        }
        return node;
    }

    private QueryNode conjunction(Cursor cursor) {
        QueryNode node = operand(cursor);
        while (true) {
            if (cursor.accept(LexToken.Kind.AND)) {
                node = new QueryNode.BooleanQuery(QueryNode.BoolOp.AND, node, operand(cursor));
            } else if (cursor.at(LexToken.Kind.TERM) || cursor.at(LexToken.Kind.LPAREN)) {
                node = new QueryNode.BooleanQuery(defaultOperator, node, operand(cursor));
            } else {
                return node;
            }
        }
    }

    private QueryNode operand(Cursor cursor) {
        LexToken token = cursor.peek();
        switch (token.kind()) {
            case TERM:
                cursor.advance();
                return new QueryNode.TermQuery(token.text());
            case LPAREN:
                cursor.advance();
                if (cursor.at(LexToken.Kind.RPAREN)) {
                    throw cursor.error("括号内为空", "括号内至少需要一个查询词");
                }
                QueryNode grouped = disjunction(cursor);
                if (!cursor.accept(LexToken.Kind.RPAREN)) {
                    throw cursor.error("缺少右括号", "请补全与位置 " + token.position() + " 对应的右括号");
                }
                return grouped;
            case END:
                throw cursor.error("操作符后缺少查询词", "请在操作符后补充查询词，或删除多余的操作符");
            default:
                throw cursor.error("此处需要查询词，却遇到 " + token.text(), "检查相邻的操作符与括号");
        }
    }

    /**
     * 单次解析的读取位置。
     */
    private static final class Cursor {
        private final List<LexToken> tokens;
        private final String query;
        private int index;

        Cursor(List<LexToken> tokens, String query) {
            this.tokens = tokens;
            this.query = query;
        }

        LexToken peek() {
            return tokens.get(index);
        }

        boolean at(LexToken.Kind kind) {
            return peek().kind() == kind;
        }

        void advance() {
            if (!at(LexToken.Kind.END)) {
                index++;
            }
        }

        boolean accept(LexToken.Kind kind) {
            if (at(kind)) {
                advance();
                return true;
            }
            return false;
        }

        QueryParseException error(String reason, String suggestion) {
            return new QueryParseException(reason, peek().position(), query, suggestion);
        }
    }
}
