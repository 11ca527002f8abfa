package build.please.gotest.result;

import org.w3c.dom.Document;
import org.w3c.dom.Element;

import java.time.Duration;

public final class FailureCaseResult extends TestCaseResult {
  FailureCaseResult(String name, Duration duration, String output) {
    super(name, duration, output);
  }

  @Override
  public CaseStatus getStatus() {
    return CaseStatus.FAILURE;
  }

  /**
   * The failure message is the whole of the output captured for the case.
   */
  public String getMessage() {
    return getOutput();
  }

  @Override
  public void renderToXml(Document doc, Element testCaseElement) {
    super.renderToXml(doc, testCaseElement);
    Element failure = doc.createElement("failure");
    Element message = doc.createElement("message");
    message.setTextContent(XmlText.sanitize(getMessage()));
    failure.appendChild(message);
    testCaseElement.appendChild(failure);
  }
}
