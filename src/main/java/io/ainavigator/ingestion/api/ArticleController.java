package io.ainavigator.ingestion.api;

import io.ainavigator.ingestion.api.dto.ArticleQuery;
import io.ainavigator.ingestion.api.dto.ChatQuery;
import io.ainavigator.ingestion.api.dto.PageContent;
import io.ainavigator.ingestion.api.dto.SummarizeRequest;
import io.ainavigator.ingestion.api.dto.SummaryResult;
import io.ainavigator.ingestion.api.exception.ArticleNotFoundException;
import io.ainavigator.ingestion.api.service.ArticleStore;
import io.ainavigator.ingestion.api.service.HtmlExtractorService;
import io.ainavigator.ingestion.api.service.KnowledgeLevel;
import io.ainavigator.ingestion.api.service.SummarizerService;
import io.ainavigator.ingestion.model.Article;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.Arrays;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/articles")
public class ArticleController {

    private final ArticleStore store;
    private final SummarizerService summarizer;
    private final HtmlExtractorService htmlExtractor;

    public ArticleController(ArticleStore store, SummarizerService summarizer, HtmlExtractorService htmlExtractor) {
        this.store = store;
        this.summarizer = summarizer;
        this.htmlExtractor = htmlExtractor;
    }

    @GetMapping
    public List<Article> getArticles(@RequestParam(defaultValue = "20") int limit,
                                     @RequestParam(defaultValue = "0") int skip,
                                     @RequestParam(required = false) String categories,
                                     @RequestParam(required = false) Boolean trending) {
        List<String> categoryList = categories == null ? List.of() : Arrays.stream(categories.split(","))
                .map(String::trim)
                .filter(category -> !category.isEmpty())
                .toList();
        return store.findArticles(new ArticleQuery(categoryList, trending, skip, limit));
    }

    @GetMapping("/{id}")
    public Article getArticle(@PathVariable String id) {
        return store.findArticle(id).orElseThrow(() -> new ArticleNotFoundException(id));
    }

    /**
     * On-demand summary at the caller's knowledge level, from pasted content or a page URL.
     */
    @PostMapping("/summarize")
    public Map<String, Object> summarize(@RequestBody SummarizeRequest request) {
        String content = request.content();

        if ((content == null || content.isBlank()) && request.url() != null && !request.url().isBlank()) {
            PageContent page = htmlExtractor.extract(request.url(), null);
            if (page.isDegraded()) {
                throw new IllegalArgumentException("Failed to fetch article content: " + request.url());
            }
            content = page.text();
        }

        if (content == null || content.isBlank()) {
            throw new IllegalArgumentException("Either URL or content must be provided");
        }

        KnowledgeLevel level = KnowledgeLevel.fromString(request.knowledgeLevel());
        SummaryResult summary = summarizer.summarize(content, level);
        return Map.of(
                "summary", summary.text(),
                "status", summary.status(),
                "knowledgeLevel", level.displayName()
        );
    }

    @PostMapping("/ask")
    public Map<String, String> ask(@RequestBody ChatQuery query) {
        if (query.query() == null || query.query().isBlank()) {
            throw new IllegalArgumentException("Query must not be empty");
        }

        String context = query.context();
        if ((context == null || context.isBlank()) && query.articleId() != null) {
            Article article = store.findArticle(query.articleId())
                    .orElseThrow(() -> new ArticleNotFoundException(query.articleId()));
            context = article.content();
        }

        return Map.of("answer", summarizer.answerQuestion(query.query(), context));
    }
}
