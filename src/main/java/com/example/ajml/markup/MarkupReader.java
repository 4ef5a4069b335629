package com.example.ajml.markup;

import org.xml.sax.Attributes;
import org.xml.sax.InputSource;
import org.xml.sax.Locator;
import org.xml.sax.SAXException;
import org.xml.sax.SAXParseException;
import org.xml.sax.helpers.DefaultHandler;

import javax.xml.XMLConstants;
import javax.xml.parsers.ParserConfigurationException;
import javax.xml.parsers.SAXParser;
import javax.xml.parsers.SAXParserFactory;
import java.io.IOException;
import java.io.StringReader;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Turns AJML text into a {@link MarkupElement} tree.
 * <p>
 * Text is pre-processed by {@link MarkupPreprocessor} and parsed with a namespace-unaware SAX parser
 * that refuses DOCTYPE declarations. Element line numbers come from the parser's locator.
 * </p>
 */
public final class MarkupReader {

    private MarkupReader() {
    }

    public static MarkupElement read(String raw) {
        String sanitised = MarkupPreprocessor.preprocess(raw);
        TreeBuilder builder = new TreeBuilder();
        try {
            newParser().parse(new InputSource(new StringReader(sanitised)), builder);
        } catch (SAXParseException e) {
            throw new MarkupSyntaxException(e.getMessage(), Math.max(e.getLineNumber(), 0), e);
        } catch (SAXException | IOException e) {
            throw new MarkupSyntaxException(e.getMessage(), 0, e);
        }
        if (builder.root == null) {
            throw new MarkupSyntaxException("Document has no root element", 0, null);
        }
        return builder.root;
    }

    private static SAXParser newParser() throws SAXException {
        try {
            SAXParserFactory factory = SAXParserFactory.newInstance();
            factory.setNamespaceAware(false);
            factory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
            factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
            return factory.newSAXParser();
        } catch (ParserConfigurationException e) {
            throw new IllegalStateException("SAX parser unavailable", e);
        }
    }

    private static final class TreeBuilder extends DefaultHandler {

        private final Deque<PendingElement> open = new ArrayDeque<>();
        private Locator locator;
        private MarkupElement root;

        @Override
        public void setDocumentLocator(Locator locator) {
            this.locator = locator;
        }

        @Override
        public void startElement(String uri, String localName, String qName, Attributes attributes) {
            Map<String, String> attrs = new LinkedHashMap<>();
            for (int i = 0; i < attributes.getLength(); i++) {
                attrs.put(attributes.getQName(i), attributes.getValue(i));
            }
            open.push(new PendingElement(qName, attrs, locator != null ? locator.getLineNumber() : 0));
        }

        @Override
        public void characters(char[] ch, int start, int length) {
            PendingElement current = open.peek();
            if (current != null) {
                current.text.append(ch, start, length);
            }
        }

        @Override
        public void endElement(String uri, String localName, String qName) {
            PendingElement done = open.pop();
            MarkupElement element = new MarkupElement(
                    done.tag, done.attributes, done.children, done.text.toString().strip(), done.line);
            PendingElement parent = open.peek();
            if (parent != null) {
                parent.children.add(element);
            } else {
                root = element;
            }
        }
    }

    private static final class PendingElement {
        private final String tag;
        private final Map<String, String> attributes;
        private final int line;
        private final List<MarkupElement> children = new ArrayList<>();
        private final StringBuilder text = new StringBuilder();

        private PendingElement(String tag, Map<String, String> attributes, int line) {
            this.tag = tag;
            this.attributes = attributes;
            this.line = line;
        }
    }
}
