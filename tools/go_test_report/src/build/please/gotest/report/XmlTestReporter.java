package build.please.gotest.report;

import build.please.gotest.result.CaseStatus;
import build.please.gotest.result.TestCaseResult;
import build.please.gotest.result.TestSuiteResult;
import build.please.gotest.result.XmlText;
import org.w3c.dom.Document;
import org.w3c.dom.Element;

import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.util.List;

/**
 * Renders parsed suites as a JUnit-style report: one <testsuites> root, a <testsuite> per suite
 * and a <testcase> per case, in the order they were parsed.
 */
public class XmlTestReporter {
  private final boolean indent;

  public XmlTestReporter() {
    this(false);
  }

  /**
   * @param indent pretty-print the report. Whitespace-only failure messages may not survive indentation
   *               byte for byte, so this is off by default.
   */
  public XmlTestReporter(boolean indent) {
    this.indent = indent;
  }

  public Document buildDocument(List<TestSuiteResult> suiteResults) {
    Document doc = newDocument();
    doc.setXmlVersion("1.0");

    Element root = doc.createElement("testsuites");
    doc.appendChild(root);

    for (TestSuiteResult suiteResult : suiteResults) {
      Element suite = createTestSuiteElement(doc, suiteResult);
      for (TestCaseResult result : suiteResult.getCaseResults()) {
        Element test = doc.createElement("testcase");
        result.renderToXml(doc, test);
        suite.appendChild(test);
      }
      root.appendChild(suite);
    }
    return doc;
  }

  public void write(List<TestSuiteResult> suiteResults, OutputStream output) throws IOException {
    PrettyPrintingXmlWriter.writeXMLDocument(buildDocument(suiteResults), output, indent);
  }

  public byte[] toBytes(List<TestSuiteResult> suiteResults) throws IOException {
    ByteArrayOutputStream output = new ByteArrayOutputStream();
    write(suiteResults, output);
    return output.toByteArray();
  }

  private static Element createTestSuiteElement(Document doc, TestSuiteResult result) {
    Element suite = doc.createElement("testsuite");
    suite.setAttribute("name", XmlText.sanitize(result.getName()));
    // Cases that never reported a result count as tests but in none of the other totals.
    suite.setAttribute("errors", Integer.toString(result.count(CaseStatus.ERROR)));
    suite.setAttribute("failures", Integer.toString(result.count(CaseStatus.FAILURE)));
    suite.setAttribute("skipped", Integer.toString(result.count(CaseStatus.SKIPPED)));
    suite.setAttribute("tests", Integer.toString(result.getCaseResults().size()));
    suite.setAttribute("time", TestCaseResult.formatSeconds(result.getDuration()));
    return suite;
  }

  private static Document newDocument() {
    try {
      DocumentBuilder docBuilder = DocumentBuilderFactory.newInstance().newDocumentBuilder();
      return docBuilder.newDocument();
    } catch (ParserConfigurationException e) {
      throw new IllegalStateException("No XML document builder available", e);
    }
  }
}
