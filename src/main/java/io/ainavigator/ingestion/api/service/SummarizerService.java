package io.ainavigator.ingestion.api.service;

import io.ainavigator.ingestion.api.dto.SummaryResult;
import io.ainavigator.ingestion.config.NewsConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class SummarizerService {

    private static final Logger logger = LoggerFactory.getLogger(SummarizerService.class);

    static final String QUESTION_FALLBACK = "I'm sorry, I couldn't process that question at the moment.";

    private final LanguageModelClient languageModel;
    private final int maxInputChars;

    public SummarizerService(LanguageModelClient languageModel, NewsConfig newsConfig) {
        this.languageModel = languageModel;
        this.maxInputChars = newsConfig.summarizer().maxInputChars();
    }

    /**
     * Summarizes {@code text} for a reader at {@code level}. Input beyond the configured
     * character cap is cut off. Failures come back as {@link SummaryResult#fallback()}.
     */
    public SummaryResult summarize(String text, KnowledgeLevel level) {
        try {
            return SummaryResult.generated(languageModel.generate(summaryPrompt(truncate(text), level)));
        } catch (Exception e) {
            logger.error("Error in summarization: {}", e.getMessage());
            return SummaryResult.fallback();
        }
    }

    public String answerQuestion(String query, String context) {
        try {
            return languageModel.generate(questionPrompt(query, context));
        } catch (Exception e) {
            logger.error("Error answering question: {}", e.getMessage());
            return QUESTION_FALLBACK;
        }
    }

    String truncate(String text) {
        if (text == null) {
            return "";
        }
        return text.length() > maxInputChars ? text.substring(0, maxInputChars) : text;
    }

    static String summaryPrompt(String content, KnowledgeLevel level) {
        return """
                Please summarize the following article.
                Knowledge level: %s.
                If the reader is a Beginner, make it more accessible with simple explanations.
                If the reader is an Expert, you can use technical terminology where appropriate.
                Keep the summary clear and concise (2-5 sentences).

                Article content:
                %s
                """.formatted(level.displayName(), content);
    }

    static String questionPrompt(String query, String context) {
        String prompt = """
                Please answer the following question about AI or technology.
                Be accurate, helpful, and concise.

                Question: %s
                """.formatted(query);
        if (context != null && !context.isBlank()) {
            prompt += "\nContext (use this information to help with your answer):\n" + context;
        }
        return prompt;
    }
}
