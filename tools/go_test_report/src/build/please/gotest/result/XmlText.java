package build.please.gotest.result;

/**
 * Helpers for text that ends up in XML attributes and element bodies.
 */
public final class XmlText {
  private static final String REPLACEMENT = "\uFFFD";

  private XmlText() {
  }

  /**
   * Replaces every character XML 1.0 cannot represent with U+FFFD.
   * Test output is full of terminal escape sequences and the transformer would otherwise
   * write them as character references that no parser accepts.
   */
  public static String sanitize(String text) {
    int i = 0;
    while (i < text.length()) {
      int cp = text.codePointAt(i);
      if (!isXmlChar(cp)) {
        break;
      }
      i += Character.charCount(cp);
    }
    if (i == text.length()) {
      return text;
    }
    StringBuilder sb = new StringBuilder(text.length());
    sb.append(text, 0, i);
    while (i < text.length()) {
      int cp = text.codePointAt(i);
      if (isXmlChar(cp)) {
        sb.appendCodePoint(cp);
      } else {
        sb.append(REPLACEMENT);
      }
      i += Character.charCount(cp);
    }
    return sb.toString();
  }

  static boolean isXmlChar(int cp) {
    return cp == 0x9 || cp == 0xA || cp == 0xD
        || (cp >= 0x20 && cp <= 0xD7FF)
        || (cp >= 0xE000 && cp <= 0xFFFD)
        || (cp >= 0x10000 && cp <= 0x10FFFF);
  }
}
