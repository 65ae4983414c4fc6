package io.ainavigator.ingestion.api;

import io.ainavigator.ingestion.api.exception.SourceNotFoundException;
import io.ainavigator.ingestion.api.service.ArticleStore;
import io.ainavigator.ingestion.model.NewsSource;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/v1/sources")
public class SourceController {

    private final ArticleStore store;

    public SourceController(ArticleStore store) {
        this.store = store;
    }

    @GetMapping
    public List<NewsSource> getSources() {
        return store.findAllSources();
    }

    @PatchMapping("/{id}")
    public ResponseEntity<Void> setEnabled(@PathVariable String id, @RequestParam boolean enabled) {
        if (!store.setSourceEnabled(id, enabled)) {
            throw new SourceNotFoundException(id);
        }
        return ResponseEntity.noContent().build();
    }
}
