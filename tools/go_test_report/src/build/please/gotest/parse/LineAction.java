package build.please.gotest.parse;

import build.please.gotest.result.CaseStatus;

import java.time.Duration;

/**
 * What a single line of runner output asks the parser to do.
 * Produced by {@link LineClassifier} without touching any state, then applied to a {@link ParserState}.
 */
public abstract class LineAction {
  private static final LineAction IGNORE = new Ignore();

  LineAction() {
  }

  abstract void applyTo(ParserState state);

  public static LineAction ignore() {
    return IGNORE;
  }

  public static final class Ignore extends LineAction {
    private Ignore() {
    }

    @Override
    void applyTo(ParserState state) {
    }
  }

  public static final class StartCase extends LineAction {
    private final String name;

    StartCase(String name) {
      this.name = name;
    }

    public String getName() {
      return name;
    }

    @Override
    void applyTo(ParserState state) {
      state.startCase(name);
    }
  }

  public static final class MarkResult extends LineAction {
    private final CaseStatus status;
    private final Duration duration;

    MarkResult(CaseStatus status, Duration duration) {
      this.status = status;
      this.duration = duration;
    }

    public CaseStatus getStatus() {
      return status;
    }

    /**
     * @return the case duration, or null if the line had no duration field at all.
     */
    public Duration getDuration() {
      return duration;
    }

    @Override
    void applyTo(ParserState state) {
      state.markResult(status, duration);
    }
  }

  public static final class EndSuite extends LineAction {
    private final String name;
    private final Duration duration;

    EndSuite(String name, Duration duration) {
      this.name = name;
      this.duration = duration;
    }

    public String getName() {
      return name;
    }

    public Duration getDuration() {
      return duration;
    }

    @Override
    void applyTo(ParserState state) {
      state.endSuite(name, duration);
    }
  }

  public static final class AppendOutput extends LineAction {
    private final String text;

    AppendOutput(String text) {
      this.text = text;
    }

    public String getText() {
      return text;
    }

    @Override
    void applyTo(ParserState state) {
      state.appendOutput(text);
    }
  }
}
