package com.williamcallahan.crossref.service.markup;

import org.jsoup.nodes.Document;
import org.jsoup.nodes.DocumentType;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.Entities;
import org.jsoup.nodes.XmlDeclaration;

/**
 * Builds the skeleton of a standalone XHTML page (index page, notes page).
 */
public final class XhtmlPageBuilder {

    private static final String XHTML_NAMESPACE = "http://www.w3.org/1999/xhtml";
    private static final String EPUB_NAMESPACE = "http://www.idpf.org/2007/ops";

    private final Document document;
    private final Element body;

    private XhtmlPageBuilder(String title, String stylesheet) {
        document = new Document("");
        XmlDeclaration declaration = new XmlDeclaration("xml", false);
        declaration.attr("version", "1.0");
        declaration.attr("encoding", "UTF-8");
        document.appendChild(declaration);
        document.appendChild(new DocumentType("html", "", ""));

        Element html = document.appendElement("html")
            .attr("xmlns", XHTML_NAMESPACE)
            .attr("xmlns:epub", EPUB_NAMESPACE);
        Element head = html.appendElement("head");
        head.appendElement("title").text(title);
        head.appendElement("meta").attr("charset", "UTF-8");
        if (stylesheet != null && !stylesheet.isBlank()) {
            head.appendElement("link").attr("rel", "stylesheet").attr("href", stylesheet);
        }
        body = html.appendElement("body");
    }

    /**
     * Starts a page with the given title and optional stylesheet href.
     */
    public static XhtmlPageBuilder page(String title, String stylesheet) {
        return new XhtmlPageBuilder(title, stylesheet);
    }

    public Element body() {
        return body;
    }

    /**
     * Serializes the page with indentation; generated pages have no authored whitespace to keep.
     */
    public String render() {
        document.outputSettings()
            .prettyPrint(true)
            .indentAmount(2)
            .syntax(Document.OutputSettings.Syntax.xml)
            .escapeMode(Entities.EscapeMode.xhtml)
            .charset("UTF-8");
        return document.outerHtml();
    }
}
