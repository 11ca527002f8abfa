package build.please.gotest.parse;

import build.please.gotest.result.CaseStatus;
import build.please.gotest.result.TestSuiteResult;
import org.junit.Test;

import java.time.Duration;

import static org.junit.Assert.assertEquals;

public class ParserStateTest {

  @Test
  public void testOutputWithoutCaseGoesToPlaceholder() {
    ParserState state = new ParserState();
    state.appendOutput("stray");
    state.markResult(CaseStatus.FAILURE, Duration.ofSeconds(1));
    assertEquals("stray\n", state.placeholderOutput());
    assertEquals(0, state.openCaseCount());
  }

  @Test
  public void testEndSuiteResets() {
    ParserState state = new ParserState();
    state.startCase("TestA");
    state.appendOutput("first");
    state.endSuite("pkg", Duration.ofMillis(5));
    state.appendOutput("second");

    assertEquals(0, state.openCaseCount());
    assertEquals("second\n", state.placeholderOutput());
    TestSuiteResult suite = state.getSuites().get(0);
    assertEquals("first\n", suite.getCaseResults().get(0).getOutput());
  }

  @Test
  public void testResultWithoutDurationKeepsEarlierOne() {
    ParserState state = new ParserState();
    state.startCase("TestA");
    state.markResult(CaseStatus.SUCCESS, Duration.ofMillis(7));
    state.markResult(CaseStatus.FAILURE, null);
    state.endSuite("pkg", Duration.ZERO);

    assertEquals(CaseStatus.FAILURE, state.getSuites().get(0).getCaseResults().get(0).getStatus());
    assertEquals(Duration.ofMillis(7), state.getSuites().get(0).getCaseResults().get(0).getDuration());
  }
}
