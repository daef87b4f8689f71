package com.scratchodds.infrastructure.scraper;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.Node;
import org.jsoup.nodes.TextNode;
import org.jsoup.select.NodeTraversor;
import org.jsoup.select.NodeVisitor;

import java.util.Arrays;
import java.util.List;
import java.util.regex.Pattern;

/**
 * A parsed detail page together with the two text views the strategies search:
 * the whitespace-collapsed body text and the body text split into trimmed, non-empty lines
 * (block elements and {@code <br>} end a line).
 */
public final class PageText {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private final Document document;
    private final String flatText;
    private final List<String> lines;

    private PageText(Document document) {
        this.document = document;
        this.flatText = document.body().text();
        this.lines = splitLines(document.body());
    }

    public static PageText parse(String html) {
        return new PageText(Jsoup.parse(html == null ? "" : html));
    }

    public Document getDocument() {
        return document;
    }

    public String getFlatText() {
        return flatText;
    }

    public List<String> getLines() {
        return lines;
    }

    private static List<String> splitLines(Element body) {
        StringBuilder text = new StringBuilder();
        NodeTraversor.traverse(new NodeVisitor() {
            @Override
            public void head(Node node, int depth) {
                if (node instanceof TextNode textNode) {
                    // source newlines are not line breaks
                    text.append(WHITESPACE.matcher(textNode.getWholeText()).replaceAll(" "));
                } else if (node instanceof Element element && breaksLine(element)) {
                    text.append('\n');
                }
            }

            @Override
            public void tail(Node node, int depth) {
                if (node instanceof Element element && breaksLine(element)) {
                    text.append('\n');
                }
            }
        }, body);

        return Arrays.stream(text.toString().split("\n"))
            .map(line -> WHITESPACE.matcher(line.replace('\u00A0', ' ')).replaceAll(" ").trim())
            .filter(line -> !line.isEmpty())
            .toList();
    }

    private static boolean breaksLine(Element element) {
        return element.isBlock() || element.normalName().equals("br");
    }
}
