package com.gentoro.specminer.exception;

/** Helpers for turning throwables into single-line log material. */
public final class ExceptionUtil {
  private ExceptionUtil() {}

  /**
   * Produce a compact, single-line representation of a throwable's top stack frames, joined in
   * call order.
   *
   * <p>Example output: {@code com.example.Foo.bar (Foo.java:42) > com.example.App.main (App.java:10)}
   *
   * @param t the throwable whose stack should be summarized (null returns empty string)
   * @param maxFrames maximum number of top stack frames to include; if <= 0, includes all frames
   * @return a single-line compact stack trace string
   */
  public static String formatCompactStackTrace(Throwable t, int maxFrames) {
    if (t == null) return "";
    StackTraceElement[] elements = t.getStackTrace();
    if (elements == null || elements.length == 0) return "";

    int limit = maxFrames <= 0 ? elements.length : Math.min(elements.length, maxFrames);
    StringBuilder sb = new StringBuilder();
    for (int i = 0; i < limit; i++) {
      StackTraceElement e = elements[i];
      sb.append(e.getClassName())
          .append('.')
          .append(e.getMethodName())
          .append(" (")
          .append(e.getFileName() == null ? "Unknown Source" : e.getFileName());
      if (e.getLineNumber() >= 0) {
        sb.append(':').append(e.getLineNumber());
      }
      sb.append(')');
      if (i < limit - 1) sb.append(" > ");
    }
    return sb.toString();
  }

  /** Convenience overload using a default of 5 frames. */
  public static String formatCompactStackTrace(Throwable t) {
    return formatCompactStackTrace(t, 5);
  }

  /** Exception class name plus message, truncated to {@code maxLength} characters. */
  public static String shortReason(Throwable t, int maxLength) {
    if (t == null) return "";
    String message = t.getMessage() == null ? "" : t.getMessage().replaceAll("\\s+", " ").trim();
    String reason =
        message.isEmpty()
            ? t.getClass().getSimpleName()
            : t.getClass().getSimpleName() + ": " + message;
    if (maxLength > 0 && reason.length() > maxLength) {
      return reason.substring(0, maxLength) + "...";
    }
    return reason;
  }
}
