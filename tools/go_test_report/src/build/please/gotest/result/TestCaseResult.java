package build.please.gotest.result;

import org.w3c.dom.Document;
import org.w3c.dom.Element;

import java.math.BigDecimal;
import java.time.Duration;

/**
 * The result of one test case, as reconstructed from the runner's transcript.
 */
public abstract class TestCaseResult {
  private final String name;
  private final Duration duration;
  private final String output;

  TestCaseResult(String name, Duration duration, String output) {
    this.name = name == null ? "" : name;
    this.duration = duration == null ? Duration.ZERO : duration;
    this.output = output == null ? "" : output;
  }

  /**
   * Creates the result subclass matching the given status.
   */
  public static TestCaseResult create(CaseStatus status, String name, Duration duration, String output) {
    switch (status) {
      case SUCCESS:
        return new SuccessCaseResult(name, duration, output);
      case FAILURE:
        return new FailureCaseResult(name, duration, output);
      case ERROR:
        return new ErrorCaseResult(name, duration, output);
      case SKIPPED:
        return new SkippedCaseResult(name, duration, output);
      default:
        return new UnsetCaseResult(name, duration, output);
    }
  }

  public abstract CaseStatus getStatus();

  public void renderToXml(Document doc, Element testCaseElement) {
    testCaseElement.setAttribute("name", XmlText.sanitize(name));
    testCaseElement.setAttribute("time", formatSeconds(duration));
  }

  public String getName() {
    return name;
  }

  public Duration getDuration() {
    return duration;
  }

  /**
   * @return every unrecognised line captured while this case was running, each terminated by a newline.
   */
  public String getOutput() {
    return output;
  }

  /**
   * Formats a duration as fractional seconds in the shortest plain decimal form,
   * e.g. "0.03", "2" or "0.0001"; never in exponent notation.
   */
  public static String formatSeconds(Duration duration) {
    BigDecimal nanos = BigDecimal.valueOf(duration.getSeconds()).movePointRight(9)
        .add(BigDecimal.valueOf(duration.getNano()));
    return nanos.movePointLeft(9).stripTrailingZeros().toPlainString();
  }
}
