package io.ainavigator.ingestion.api.exception;

public class ArticleNotFoundException extends RuntimeException {
    public ArticleNotFoundException(String articleId) {
        super("Article not found: " + articleId);
    }
}
