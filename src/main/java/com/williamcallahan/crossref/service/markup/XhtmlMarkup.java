package com.williamcallahan.crossref.service.markup;

import com.williamcallahan.crossref.support.AsciiTextNormalizer;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.Entities;
import org.jsoup.nodes.Node;
import org.jsoup.parser.Parser;
import org.jsoup.select.NodeTraversor;
import org.jsoup.select.NodeVisitor;

/**
 * Parsing and serialization of chunk markup.
 *
 * Chunks go through jsoup's XML tree builder: it keeps fragments as fragments, keeps the
 * XML declaration and doctype, and tolerates unbalanced tags. Nodes are addressed by their
 * document-order position, so a chunk parsed twice yields the same positions.
 */
public final class XhtmlMarkup {

    private XhtmlMarkup() {}

    /**
     * Parses a chunk. A fresh parser is created per call; jsoup parsers are not thread-safe.
     *
     * @param markup chunk markup
     * @return parsed document with XHTML output settings
     */
    public static Document parse(String markup) {
        Document document = Jsoup.parse(markup == null ? "" : markup, "", Parser.xmlParser());
        applyOutputSettings(document);
        return document;
    }

    /**
     * Serializes a document without pretty printing so untouched markup survives as written.
     */
    public static String serialize(Document document) {
        applyOutputSettings(document);
        return document.outerHtml();
    }

    /**
     * Lists every node in document order; index 0 is the document itself.
     */
    public static List<Node> nodesInOrder(Document document) {
        List<Node> nodes = new ArrayList<>();
        NodeTraversor.traverse(new NodeVisitor() {
            @Override
            public void head(Node node, int depth) {
                nodes.add(node);
            }
        }, document);
        return Collections.unmodifiableList(nodes);
    }

    /**
     * Number of nodes below {@code node}; they follow it directly in document order.
     */
    public static int descendantCount(Node node) {
        int[] count = {0};
        NodeTraversor.traverse(new NodeVisitor() {
            @Override
            public void head(Node visited, int depth) {
                if (depth > 0) {
                    count[0]++;
                }
            }
        }, node);
        return count[0];
    }

    /**
     * Markup-free text with whitespace collapsed.
     */
    public static String plainText(Element element) {
        return AsciiTextNormalizer.collapseWhitespace(element.text());
    }

    /**
     * Case-insensitive (ASCII) class check, so {@code Footnote} and {@code footnote} match.
     */
    public static boolean hasClass(Element element, String className) {
        String wanted = AsciiTextNormalizer.toLowerAscii(className);
        for (String candidate : element.classNames()) {
            if (AsciiTextNormalizer.toLowerAscii(candidate).equals(wanted)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Lowercased tag name; the XML tree builder preserves case.
     */
    public static String tagName(Element element) {
        return AsciiTextNormalizer.toLowerAscii(element.tagName());
    }

    /**
     * Lowercased value of {@code epub:type}, empty when absent.
     */
    public static String epubType(Element element) {
        return AsciiTextNormalizer.toLowerAscii(element.attr("epub:type")).trim();
    }

    /**
     * Parses a markup fragment (note content) into a throwaway document.
     */
    public static Document parseFragment(String markup) {
        return parse(markup);
    }

    /**
     * Parses markup with the XML tree builder and moves the resulting nodes under {@code target}.
     */
    public static void appendMarkup(Element target, String markup) {
        Document fragment = parseFragment(markup);
        for (Node node : new ArrayList<>(fragment.childNodes())) {
            target.appendChild(node);
        }
    }

    /**
     * Serializes the children of a fragment document.
     */
    public static String serializeFragment(Document fragment) {
        applyOutputSettings(fragment);
        return fragment.html();
    }

    private static void applyOutputSettings(Document document) {
        document.outputSettings()
            .prettyPrint(false)
            .syntax(Document.OutputSettings.Syntax.xml)
            .escapeMode(Entities.EscapeMode.xhtml)
            .charset("UTF-8");
    }
}
