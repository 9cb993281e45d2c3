package dev.ecodata.text;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;
import org.jspecify.annotations.Nullable;
import org.springframework.stereotype.Component;

/**
 * Splits row text into an ordered, addressable sequence of {@link Sentence}s.
 *
 * <p>A boundary is terminal punctuation ({@code . ! ?}, optionally followed by closing quotes or
 * brackets) that is followed either by the end of the text or by whitespace and an upper-case
 * letter. A period ending a known abbreviation ({@code Dr.}, {@code Inc.}, ...), a single
 * initial ({@code J.}) or a dotted acronym ({@code e.g.}, {@code U.S.}) never ends a sentence.
 *
 * <p>Ambiguous cases are left unsplit: a longer cited span loses nothing, while a wrong split can
 * separate a value from its context. Output is a pure function of the input text, so repeated
 * enumeration yields identical ids and texts.
 */
@Component
public class SentenceEnumerator {

  static final Set<String> ABBREVIATIONS =
      Set.of(
          "Dr.", "Mr.", "Mrs.", "Ms.", "Prof.", "Sr.", "Jr.", "St.", "Mt.", "Gen.", "Gov.",
          "Sen.", "Rep.", "Rev.", "Inc.", "Ltd.", "Co.", "Corp.", "Bros.", "LLC.", "vs.", "etc.",
          "approx.", "est.", "ca.", "cf.", "al.", "Fig.", "Figs.", "No.", "Nos.", "Vol.", "pp.",
          "Jan.", "Feb.", "Mar.", "Apr.", "Jun.", "Jul.", "Aug.", "Sep.", "Sept.", "Oct.",
          "Nov.", "Dec.");

  private static final Pattern DOTTED_ACRONYM = Pattern.compile("(?:\\p{L}\\.){2,}");
  private static final Pattern INITIAL = Pattern.compile("\\p{Lu}\\.");

  /**
   * Enumerates the sentences of a text.
   *
   * @param text the raw row text; {@code null} or blank yields an empty list
   * @return sentences with contiguous ids {@code 1..N} in document order
   * @throws EnumerationException if the text contains control characters or broken surrogates
   */
  public List<Sentence> enumerate(@Nullable String text) {
    if (text == null || text.isBlank()) {
      return List.of();
    }
    checkWellFormed(text);

    List<Sentence> sentences = new ArrayList<>();
    int length = text.length();
    int start = 0;
    int i = 0;
    while (i < length) {
      if (!isTerminal(text.charAt(i))) {
        i++;
        continue;
      }
      int end = i + 1;
      while (end < length && (isTerminal(text.charAt(end)) || isClosing(text.charAt(end)))) {
        end++;
      }
      if (isBoundary(text, start, i, end)) {
        append(sentences, text.substring(start, end));
        start = end;
      }
      i = end;
    }
    append(sentences, text.substring(start));
    return List.copyOf(sentences);
  }

  private boolean isBoundary(String text, int start, int terminalAt, int runEnd) {
    if (runEnd < text.length()) {
      if (!Character.isWhitespace(text.charAt(runEnd))) {
        return false;
      }
      int next = runEnd;
      while (next < text.length() && Character.isWhitespace(text.charAt(next))) {
        next++;
      }
      if (next < text.length() && !Character.isUpperCase(text.charAt(next))) {
        return false;
      }
    }
    boolean singlePeriod = text.charAt(terminalAt) == '.' && runEnd - terminalAt == 1;
    return !(singlePeriod && endsWithAbbreviation(text, start, terminalAt));
  }

  private boolean endsWithAbbreviation(String text, int start, int periodAt) {
    int tokenStart = periodAt;
    while (tokenStart > start && !Character.isWhitespace(text.charAt(tokenStart - 1))) {
      tokenStart--;
    }
    String token = stripOpening(text.substring(tokenStart, periodAt + 1));
    return ABBREVIATIONS.contains(token)
        || INITIAL.matcher(token).matches()
        || DOTTED_ACRONYM.matcher(token).matches();
  }

  private static String stripOpening(String token) {
    int from = 0;
    while (from < token.length() && "(\"'[“‘".indexOf(token.charAt(from)) >= 0) {
      from++;
    }
    return token.substring(from);
  }

  private static void append(List<Sentence> sentences, String fragment) {
    String stripped = fragment.strip();
    if (!stripped.isEmpty()) {
      sentences.add(new Sentence(sentences.size() + 1, stripped));
    }
  }

  private static boolean isTerminal(char c) {
    return c == '.' || c == '!' || c == '?';
  }

  private static boolean isClosing(char c) {
    return c == ')' || c == ']' || c == '"' || c == '\'' || c == '”' || c == '’';
  }

  private static void checkWellFormed(String text) {
    for (int i = 0; i < text.length(); i++) {
      char c = text.charAt(i);
      if (Character.isISOControl(c) && !Character.isWhitespace(c)) {
        throw new EnumerationException(
            "Text contains control character U+%04X at offset %d".formatted((int) c, i));
      }
      if (Character.isHighSurrogate(c)) {
        if (i + 1 >= text.length() || !Character.isLowSurrogate(text.charAt(i + 1))) {
          throw new EnumerationException("Unpaired high surrogate at offset " + i);
        }
        i++;
      } else if (Character.isLowSurrogate(c)) {
        throw new EnumerationException("Unpaired low surrogate at offset " + i);
      }
    }
  }
}
