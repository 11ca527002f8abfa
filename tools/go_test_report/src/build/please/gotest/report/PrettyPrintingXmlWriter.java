package build.please.gotest.report;

import org.w3c.dom.Document;

import javax.xml.transform.OutputKeys;
import javax.xml.transform.Transformer;
import javax.xml.transform.TransformerException;
import javax.xml.transform.TransformerFactory;
import javax.xml.transform.dom.DOMSource;
import javax.xml.transform.stream.StreamResult;
import java.io.BufferedOutputStream;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.OutputStream;

public class PrettyPrintingXmlWriter {
  public static void writeXMLDocumentToFile(String filename, Document doc, boolean indent) throws IOException {
    try (OutputStream output = new BufferedOutputStream(new FileOutputStream(filename))) {
      writeXMLDocument(doc, output, indent);
    }
  }

  /**
   * Writes the document as UTF-8 to the given stream, which is flushed but left open.
   */
  public static void writeXMLDocument(Document doc, OutputStream output, boolean indent) throws IOException {
    try {
      // Pretty-prints with a 2-space indent when asked to.
      Transformer trans = TransformerFactory.newInstance().newTransformer();
      trans.setOutputProperty(OutputKeys.OMIT_XML_DECLARATION, "no");
      trans.setOutputProperty(OutputKeys.ENCODING, "UTF-8");
      if (indent) {
        trans.setOutputProperty(OutputKeys.INDENT, "yes");
        trans.setOutputProperty("{http://xml.apache.org/xslt}indent-amount", "2");
      } else {
        trans.setOutputProperty(OutputKeys.INDENT, "no");
      }
      trans.transform(new DOMSource(doc), new StreamResult(output));
    } catch (TransformerException e) {
      if (e.getCause() instanceof IOException) {
        throw (IOException) e.getCause();
      }
      throw new IOException("Failed to write XML report", e);
    }
    output.flush();
  }
}
