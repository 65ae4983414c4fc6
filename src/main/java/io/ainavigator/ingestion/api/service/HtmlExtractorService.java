package io.ainavigator.ingestion.api.service;

import io.ainavigator.ingestion.api.dto.PageContent;
import io.ainavigator.ingestion.config.HttpConfig;
import io.ainavigator.ingestion.config.NewsConfig;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.TextNode;
import org.jsoup.select.NodeTraversor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Locale;
import java.util.StringJoiner;

/**
 * Pulls readable text and a lead image out of an article page.
 */
@Service
public class HtmlExtractorService {

    private static final Logger logger = LoggerFactory.getLogger(HtmlExtractorService.class);

    private static final List<String> LEAD_IMAGE_CLASS_HINTS = List.of("hero", "featured", "main");
    private static final int MIN_IMAGE_SIZE = 200;

    private final HttpConfig http;

    public HtmlExtractorService(NewsConfig newsConfig) {
        this.http = newsConfig.http();
    }

    /**
     * Never throws: when the page cannot be fetched or parsed the feed description
     * (or a fixed placeholder) stands in for the text and no image is returned.
     */
    public PageContent extract(String url, String fallbackDescription) {
        try {
            Document doc = Jsoup.connect(url)
                    .userAgent(http.userAgents().get(0))
                    .timeout(http.pageTimeout())
                    .followRedirects(true)
                    .get();

            return extract(doc);

        } catch (Exception e) {
            logger.warn("Error extracting article content from {}: {}", url, e.getMessage());
            return PageContent.fallback(fallbackDescription);
        }
    }

    PageContent extract(Document doc) {
        doc.select("script, style").remove();
        return PageContent.fromPage(extractText(doc), selectImage(doc));
    }

    static String extractText(Document doc) {
        StringJoiner text = new StringJoiner("\n");
        NodeTraversor.traverse((node, depth) -> {
            if (node instanceof TextNode textNode) {
                String chunk = textNode.text().trim();
                if (!chunk.isEmpty()) {
                    text.add(chunk);
                }
            }
        }, doc);
        return text.toString().trim();
    }

    /**
     * First image whose class hints at a lead image; otherwise the first non-icon image
     * that is either larger than 200x200 or carries no size at all. A width or height that
     * is not a whole number (e.g. {@code 100%}) rules out only that image; the search goes on
     * and the page text is kept.
     */
    static String selectImage(Document doc) {
        List<Element> images = doc.select("img");

        for (Element img : images) {
            String cssClass = img.attr("class").toLowerCase(Locale.ROOT);
            if (LEAD_IMAGE_CLASS_HINTS.stream().anyMatch(cssClass::contains) && hasSource(img)) {
                return img.attr("src");
            }
        }

        for (Element img : images) {
            if (!hasSource(img)) {
                continue;
            }
            String src = img.attr("src");
            if (src.endsWith(".ico") || src.endsWith(".svg")) {
                continue;
            }
            String width = img.attr("width");
            String height = img.attr("height");
            if (width.isEmpty() || height.isEmpty()) {
                return src;
            }
            if (dimension(width) > MIN_IMAGE_SIZE && dimension(height) > MIN_IMAGE_SIZE) {
                return src;
            }
        }

        return null;
    }

    private static boolean hasSource(Element img) {
        return !img.attr("src").isEmpty();
    }

    private static int dimension(String value) {
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            return -1;
        }
    }
}
