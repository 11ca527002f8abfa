package build.please.gotest.result;

import java.time.Duration;

/**
 * A case that was started but never reported PASS or FAIL, e.g. because the run panicked or timed out.
 * It counts as a test but towards none of the failure, error or skipped totals.
 */
public final class UnsetCaseResult extends TestCaseResult {
  UnsetCaseResult(String name, Duration duration, String output) {
    super(name, duration, output);
  }

  @Override
  public CaseStatus getStatus() {
    return CaseStatus.UNSET;
  }
}
