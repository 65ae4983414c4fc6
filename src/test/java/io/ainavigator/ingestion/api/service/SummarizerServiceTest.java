package io.ainavigator.ingestion.api.service;

import io.ainavigator.ingestion.api.dto.SummaryResult;
import io.ainavigator.ingestion.config.NewsConfig;
import io.ainavigator.ingestion.model.SummaryStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class SummarizerServiceTest {

    @Mock
    private LanguageModelClient languageModel;

    private SummarizerService service;

    @BeforeEach
    void setUp() {
        service = new SummarizerService(languageModel, new NewsConfig(null, null, null, null));
    }

    @Test
    @DisplayName("Should return generated summary with requested level in prompt")
    void shouldSummarizeAtLevel() {
        when(languageModel.generate(anyString())).thenReturn("A short summary.");

        SummaryResult result = service.summarize("Article body", KnowledgeLevel.BEGINNER);

        assertThat(result.text()).isEqualTo("A short summary.");
        assertThat(result.status()).isEqualTo(SummaryStatus.GENERATED);

        ArgumentCaptor<String> prompt = ArgumentCaptor.forClass(String.class);
        verify(languageModel).generate(prompt.capture());
        assertThat(prompt.getValue())
                .contains("Knowledge level: Beginner.")
                .contains("Article content:\nArticle body");
    }

    @Test
    @DisplayName("Should send at most 4000 characters of content")
    void shouldTruncateInput() {
        when(languageModel.generate(anyString())).thenReturn("ok");
        String longText = "a".repeat(4000) + "TAIL";

        service.summarize(longText, KnowledgeLevel.EXPERT);

        ArgumentCaptor<String> prompt = ArgumentCaptor.forClass(String.class);
        verify(languageModel).generate(prompt.capture());
        assertThat(prompt.getValue()).contains("a".repeat(4000)).doesNotContain("TAIL");
        assertThat(service.truncate(longText)).hasSize(4000);
        assertThat(service.truncate(null)).isEmpty();
    }

    @Test
    @DisplayName("Should return tagged fallback when the model fails")
    void shouldFallBackOnFailure() {
        when(languageModel.generate(anyString())).thenThrow(new LanguageModelException("quota exceeded"));

        SummaryResult result = service.summarize("Article body", KnowledgeLevel.INTERMEDIATE);

        assertThat(result.text()).isEqualTo("An error occurred during summarization.");
        assertThat(result.isFallback()).isTrue();
    }

    @Test
    @DisplayName("Should answer questions with optional context")
    void shouldAnswerQuestion() {
        when(languageModel.generate(anyString())).thenReturn("Transformers use attention.");

        String answer = service.answerQuestion("How do transformers work?", "Paper excerpt");

        assertThat(answer).isEqualTo("Transformers use attention.");
        ArgumentCaptor<String> prompt = ArgumentCaptor.forClass(String.class);
        verify(languageModel).generate(prompt.capture());
        assertThat(prompt.getValue()).contains("Question: How do transformers work?").contains("Paper excerpt");
    }

    @Test
    @DisplayName("Should return apology when question cannot be answered")
    void shouldFallBackOnQuestionFailure() {
        when(languageModel.generate(anyString())).thenThrow(new LanguageModelException("down"));

        assertThat(service.answerQuestion("Anything?", null)).isEqualTo(SummarizerService.QUESTION_FALLBACK);
    }

    @Test
    @DisplayName("Question prompt omits context section when none given")
    void shouldOmitEmptyContext() {
        assertThat(SummarizerService.questionPrompt("Why?", " ")).doesNotContain("Context");
    }
}
