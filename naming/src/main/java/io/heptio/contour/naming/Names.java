package io.heptio.contour.naming;

import static com.google.common.base.Strings.nullToEmpty;

import com.google.common.base.Joiner;
import com.google.common.base.Strings;
import com.google.common.hash.HashFunction;
import com.google.common.hash.Hashing;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import javax.annotation.Nullable;

/**
 * {@code Names} builds length-bounded Envoy resource names out of arbitrary text segments. Every
 * method is a pure function of its arguments.
 */
public class Names {

  /**
   * Digest used to disambiguate truncated segments. Changing it changes every name that needed
   * truncation.
   */
  public static final HashFunction SEGMENT_HASH = Hashing.sha256();

  /** Number of hex characters of {@link #SEGMENT_HASH} kept per truncated segment. */
  public static final int SHORT_HASH_LENGTH = 6;

  static final String SEPARATOR = "/";

  private static final Joiner JOINER = Joiner.on(SEPARATOR);

  /**
   * Returns {@code text} if it fits in {@code maxLength}, otherwise a prefix of {@code text}
   * followed by {@code -} and {@code disambiguator}. When not even the disambiguator fits, returns
   * its first {@code maxLength} characters.
   *
   * @param maxLength the maximum length of the result, non-positive values yield an empty string
   * @param text the text to shorten
   * @param disambiguator the token appended to a shortened text
   */
  public static String truncate(int maxLength, @Nullable String text, @Nullable String disambiguator) {
    String s = nullToEmpty(text);
    String suffix = nullToEmpty(disambiguator);
    if (maxLength <= 0) {
      return "";
    }
    if (s.length() <= maxLength) {
      return s;
    }
    if (maxLength <= suffix.length()) {
      return suffix.substring(0, maxLength);
    }
    return s.substring(0, maxLength - suffix.length() - 1) + "-" + suffix;
  }

  /**
   * Joins {@code segments} with {@code /}, shortening each segment that exceeds its share of
   * {@code maxLength}.
   *
   * <p>A single segment may use the whole budget and is disambiguated with the full hex digest. With
   * several segments every one gets {@code maxLength / segments.length} characters, independently of
   * the others, and overflowing segments carry the first {@value #SHORT_HASH_LENGTH} hex characters
   * of the digest. The digest is computed over the joined, untruncated segments.
   *
   * @param maxLength the length budget for the joined name
   * @param segments the segments in order, null entries are treated as empty
   */
  public static String hashName(int maxLength, @Nullable String... segments) {
    if (segments == null || segments.length == 0) {
      return "";
    }

    String[] parts = Arrays.stream(segments).map(Strings::nullToEmpty).toArray(String[]::new);
    String hash = SEGMENT_HASH.hashString(JOINER.join(parts), StandardCharsets.UTF_8).toString();

    if (parts.length == 1) {
      return truncate(maxLength, parts[0], hash);
    }

    int budget = maxLength / parts.length;
    String shortHash = hash.substring(0, SHORT_HASH_LENGTH);
    for (int i = 0; i < parts.length; i++) {
      if (parts[i].length() > budget) {
        parts[i] = truncate(budget, parts[i], shortHash);
      }
    }
    return JOINER.join(parts);
  }

  private Names() {}
}
