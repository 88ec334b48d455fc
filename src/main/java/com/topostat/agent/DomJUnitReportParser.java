package com.topostat.agent;

import com.topostat.core.model.CaseResult;
import com.topostat.core.model.TestCase;
import org.springframework.stereotype.Component;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;
import org.xml.sax.SAXException;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;

/**
 * {@link JUnitReportParser} on the JDK DOM parser.
 * <p>
 * Accepts a {@code <testsuites>} root, a single {@code <testsuite>} root or a bare
 * {@code <testcase>}. Nested suites are flattened. Each case's {@code <failure>},
 * {@code <error>} and {@code <skipped>} children become a list of {@link CaseResult}s.
 * Document type declarations are refused.
 */
@Component
public class DomJUnitReportParser implements JUnitReportParser {

    @Override
    public List<TestCase> parse(InputStream report) throws IOException {
        Document document;
        try {
            document = newBuilder().parse(report);
        } catch (SAXException e) {
            throw new IOException("Malformed JUnit report: " + e.getMessage(), e);
        }
        List<TestCase> cases = new ArrayList<>();
        collect(document.getDocumentElement(), cases);
        return cases;
    }

    private static DocumentBuilder newBuilder() throws IOException {
        try {
            DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
            factory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
            factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
            factory.setXIncludeAware(false);
            factory.setExpandEntityReferences(false);
            return factory.newDocumentBuilder();
        } catch (ParserConfigurationException e) {
            throw new IOException("XML parser unavailable", e);
        }
    }

    private static void collect(Element element, List<TestCase> cases) {
        if ("testcase".equals(element.getTagName())) {
            cases.add(toCase(element));
            return;
        }
        NodeList children = element.getChildNodes();
        for (int i = 0; i < children.getLength(); i++) {
            Node child = children.item(i);
            if (child instanceof Element nested
                    && ("testsuite".equals(nested.getTagName()) || "testcase".equals(nested.getTagName()))) {
                collect(nested, cases);
            }
        }
    }

    private static TestCase toCase(Element element) {
        List<CaseResult> results = new ArrayList<>();
        NodeList children = element.getChildNodes();
        for (int i = 0; i < children.getLength(); i++) {
            if (children.item(i) instanceof Element child) {
                CaseResult.Tag tag = tagOf(child.getTagName());
                if (tag != null) {
                    results.add(new CaseResult(tag, child.getAttribute("message")));
                }
            }
        }
        return new TestCase(element.getAttribute("classname"), element.getAttribute("name"),
                parseTime(element.getAttribute("time")), results);
    }

    private static CaseResult.Tag tagOf(String name) {
        return switch (name) {
            case "failure" -> CaseResult.Tag.FAILURE;
            case "error" -> CaseResult.Tag.ERROR;
            case "skipped" -> CaseResult.Tag.SKIPPED;
            default -> null;
        };
    }

    /** Missing time reads as zero; an unparseable one as NaN, which fails record validation. */
    private static double parseTime(String time) {
        if (time == null || time.isBlank()) {
            return 0.0;
        }
        try {
            return Double.parseDouble(time.strip().replace(",", ""));
        } catch (NumberFormatException e) {
            return Double.NaN;
        }
    }
}
