package com.satoru.literature.controller;

import com.satoru.literature.exception.WrongQueryException;

final class QueryChecks {

    static final int MAX_PAGE_SIZE = 100;
    static final int MAX_QUERY_LENGTH = 1000;

    private QueryChecks() {
    }

    static String query(String query) {
        if (query == null || query.isBlank()) {
            throw new WrongQueryException("Query too short");
        }
        if (query.length() > MAX_QUERY_LENGTH) {
            throw new WrongQueryException("Query too long");
        }
        return query.trim();
    }

    static void paging(int pageSize, int offset) {
        if (pageSize < 1 || pageSize > MAX_PAGE_SIZE) {
            throw new WrongQueryException("page_size must be between 1 and " + MAX_PAGE_SIZE);
        }
        if (offset < 0) {
            throw new WrongQueryException("offset cannot be negative");
        }
    }
}
