package info.isaksson.erland.androidtoflutter.markup;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Document;
import org.xml.sax.ErrorHandler;
import org.xml.sax.InputSource;
import org.xml.sax.SAXException;
import org.xml.sax.SAXParseException;
import org.xml.sax.helpers.DefaultHandler;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import javax.xml.parsers.SAXParser;
import javax.xml.parsers.SAXParserFactory;
import java.io.IOException;
import java.io.StringReader;

/**
 * Namespace-aware XML parsing with DOCTYPE declarations and external entities disabled.
 * DOM for values files; SAX where attribute order matters.
 */
public final class XmlDocuments {

    private static final Logger log = LoggerFactory.getLogger(XmlDocuments.class);

    private static final String DISALLOW_DOCTYPE = "http://apache.org/xml/features/disallow-doctype-decl";
    private static final String EXTERNAL_GENERAL = "http://xml.org/sax/features/external-general-entities";
    private static final String EXTERNAL_PARAMETER = "http://xml.org/sax/features/external-parameter-entities";

    private XmlDocuments() {}

    public static Document parse(String xml, String documentId) throws MarkupParseException {
        if (xml == null) throw new IllegalArgumentException("xml is null");
        try {
            DocumentBuilder builder = newDomFactory().newDocumentBuilder();
            builder.setErrorHandler(strictHandler(documentId));
            return builder.parse(new InputSource(new StringReader(xml)));
        } catch (SAXParseException e) {
            throw new MarkupParseException(documentId, "line " + e.getLineNumber() + ": " + e.getMessage(), e);
        } catch (SAXException | IOException e) {
            throw new MarkupParseException(documentId, String.valueOf(e.getMessage()), e);
        } catch (ParserConfigurationException e) {
            throw new IllegalStateException("XML parser not available", e);
        }
    }

    /** Streams {@code xml} through {@code handler}; warnings are logged, errors are fatal. */
    public static void parse(String xml, String documentId, DefaultHandler handler) throws MarkupParseException {
        if (xml == null) throw new IllegalArgumentException("xml is null");
        try {
            SAXParser parser = newSaxFactory().newSAXParser();
            var reader = parser.getXMLReader();
            reader.setContentHandler(handler);
            reader.setErrorHandler(strictHandler(documentId));
            reader.parse(new InputSource(new StringReader(xml)));
        } catch (SAXParseException e) {
            throw new MarkupParseException(documentId, "line " + e.getLineNumber() + ": " + e.getMessage(), e);
        } catch (SAXException | IOException e) {
            throw new MarkupParseException(documentId, String.valueOf(e.getMessage()), e);
        } catch (ParserConfigurationException e) {
            throw new IllegalStateException("XML parser not available", e);
        }
    }

    private static ErrorHandler strictHandler(String documentId) {
        return new ErrorHandler() {
            @Override
            public void warning(SAXParseException e) {
                log.debug("{}: XML warning at line {}: {}", documentId, e.getLineNumber(), e.getMessage());
            }

            @Override
            public void error(SAXParseException e) throws SAXException {
                throw e;
            }

            @Override
            public void fatalError(SAXParseException e) throws SAXException {
                throw e;
            }
        };
    }

    private static DocumentBuilderFactory newDomFactory() throws ParserConfigurationException {
        DocumentBuilderFactory dbf = DocumentBuilderFactory.newInstance();
        dbf.setNamespaceAware(true);
        dbf.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
        dbf.setFeature(DISALLOW_DOCTYPE, true);
        dbf.setFeature(EXTERNAL_GENERAL, false);
        dbf.setFeature(EXTERNAL_PARAMETER, false);
        dbf.setXIncludeAware(false);
        dbf.setExpandEntityReferences(false);
        return dbf;
    }

    private static SAXParserFactory newSaxFactory() throws ParserConfigurationException, SAXException {
        SAXParserFactory spf = SAXParserFactory.newInstance();
        spf.setNamespaceAware(true);
        spf.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
        spf.setFeature(DISALLOW_DOCTYPE, true);
        spf.setFeature(EXTERNAL_GENERAL, false);
        spf.setFeature(EXTERNAL_PARAMETER, false);
        spf.setXIncludeAware(false);
        return spf;
    }
}
