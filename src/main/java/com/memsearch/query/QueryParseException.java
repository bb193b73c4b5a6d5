package com.memsearch.query;

/**
 * 查询语法错误，带出错位置与修改建议。消息末尾两行是查询原文与指向出错位置的 {@code ^}。
 */
public class QueryParseException extends IllegalArgumentException {
    private final int position;
    private final String queryString;
    private final String suggestion;

    public QueryParseException(String reason, int position, String queryString, String suggestion) {
        super(describe(reason, position, queryString));
        this.position = position;
        this.queryString = queryString;
        this.suggestion = suggestion;
    }

    public int getPosition() {
        return position;
    }

    public String getQueryString() {
        return queryString;
    }

    public String getSuggestion() {
        return suggestion;
    }

    private static String describe(String reason, int position, String queryString) {
        String query = queryString == null ? "" : queryString;
        int column = Math.max(0, Math.min(position, query.length()));
        return "位置 " + position + "，" + reason + System.lineSeparator()
            + query + System.lineSeparator()
            + " ".repeat(column) + "^";
    }
}
