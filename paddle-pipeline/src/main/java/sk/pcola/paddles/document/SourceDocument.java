package sk.pcola.paddles.document;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.Node;
import org.jsoup.nodes.TextNode;
import org.jsoup.select.Elements;
import sk.pcola.paddles.common.util.TextUtil;

import java.net.URI;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Jedna stiahnutá stránka v podobe, ktorú sa dá dopytovať CSS selektormi.
 * Extrakcia stránku len číta, nikdy ju nemení.
 *
 * Región {@code null}, prázdny alebo "body" znamená celé telo stránky.
 */
public final class SourceDocument {

    private final String url;
    private final Instant fetchedAt;
    private final Document document;

    private SourceDocument(String url, Instant fetchedAt, Document document) {
        this.url = url;
        this.fetchedAt = fetchedAt;
        this.document = document;
    }

    public static SourceDocument parse(String html, String url, Instant fetchedAt) {
        String baseUri = url == null ? "" : url;
        return new SourceDocument(url, fetchedAt, Jsoup.parse(html == null ? "" : html, baseUri));
    }

    public String url() {
        return url;
    }

    public Instant fetchedAt() {
        return fetchedAt;
    }

    /**
     * Text z hlavičky stránky ({@code <title>}).
     */
    public Optional<String> headTitle() {
        return Optional.ofNullable(TextUtil.emptyToNull(TextUtil.normalize(document.title())));
    }

    /**
     * Text prvého elementu pre selektor, ktorý nie je prázdny.
     */
    public Optional<String> firstText(String selector) {
        for (Element element : document.select(selector)) {
            String text = TextUtil.emptyToNull(TextUtil.normalize(element.text()));
            if (text != null) {
                return Optional.of(text);
            }
        }
        return Optional.empty();
    }

    /**
     * Hodnota atribútu prvého elementu, ktorý ho má neprázdny (surová, bez úprav URL).
     */
    public Optional<String> firstAttribute(String selector, String attribute) {
        List<String> values = attributes(selector, attribute);
        return values.isEmpty() ? Optional.empty() : Optional.of(values.get(0));
    }

    public List<String> attributes(String selector, String attribute) {
        List<String> values = new ArrayList<>();
        for (Element element : document.select(selector)) {
            String value = TextUtil.emptyToNull(element.attr(attribute));
            if (value != null) {
                values.add(value);
            }
        }
        return values;
    }

    /**
     * Relatívnu URL (odkaz, obrázok) prevedie na absolútnu voči URL stránky.
     */
    public String resolveUrl(String value) {
        if (value == null || value.isBlank()) {
            return value;
        }
        String trimmed = value.trim();
        if (url == null || url.isBlank()) {
            return trimmed;
        }
        try {
            return URI.create(url).resolve(trimmed).toString();
        } catch (IllegalArgumentException e) {
            return trimmed;
        }
    }

    /**
     * Riadky viditeľného textu v regióne. Blokové elementy a {@code <br>} začínajú nový riadok,
     * inline elementy ostávajú v riadku ("<b>Weight:</b> 8 oz" je jeden riadok).
     */
    public List<String> lines(String region) {
        List<String> lines = new ArrayList<>();
        for (Element element : region(region)) {
            StringBuilder sb = new StringBuilder();
            appendText(element, sb);
            for (String line : sb.toString().split("\\R")) {
                String normalized = TextUtil.emptyToNull(TextUtil.normalize(line));
                if (normalized != null) {
                    lines.add(normalized);
                }
            }
        }
        return lines;
    }

    /**
     * Celý text regiónu, riadky oddelené '\n'.
     */
    public String text(String region) {
        return String.join("\n", lines(region));
    }

    /**
     * Text regiónu zlúčený do jedného odstavca (pre hľadanie viet).
     */
    public String flatText(String region) {
        StringBuilder sb = new StringBuilder();
        for (Element element : region(region)) {
            if (!sb.isEmpty()) {
                sb.append(' ');
            }
            sb.append(element.text());
        }
        return TextUtil.normalize(sb.toString());
    }

    public boolean exists(String selector) {
        return !document.select(selector).isEmpty();
    }

    private Elements region(String region) {
        if (region == null || region.isBlank() || "body".equalsIgnoreCase(region.trim())) {
            return new Elements(document.body());
        }
        return document.select(region);
    }

    private static void appendText(Node node, StringBuilder sb) {
        for (Node child : node.childNodes()) {
            if (child instanceof TextNode textNode) {
                sb.append(textNode.getWholeText());
            } else if (child instanceof Element element) {
                String tag = element.normalName();
                if ("script".equals(tag) || "style".equals(tag) || "noscript".equals(tag)) {
                    continue;
                }
                boolean breaksLine = element.isBlock() || "br".equals(tag);
                if (breaksLine) {
                    sb.append('\n');
                }
                appendText(element, sb);
                if (breaksLine) {
                    sb.append('\n');
                }
            }
        }
    }
}
