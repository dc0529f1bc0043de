package com.satoru.literature.exception;

public class ArticleNotFoundException extends EntityNotFoundException {

    public ArticleNotFoundException(String pmid) {
        super("Article", pmid);
    }
}
