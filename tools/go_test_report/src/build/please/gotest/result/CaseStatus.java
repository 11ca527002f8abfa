package build.please.gotest.result;

/**
 * Outcome of a single test case.
 * UNSET is what a case keeps if no result line was ever seen for it; it is not a success.
 */
public enum CaseStatus {
  UNSET,
  SUCCESS,
  FAILURE,
  ERROR,
  SKIPPED
}
