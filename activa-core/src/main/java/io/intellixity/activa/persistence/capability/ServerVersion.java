package io.intellixity.activa.persistence.capability;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/** Backend server version; drives which capabilities a dialect advertises. */
public record ServerVersion(int major, int minor, int patch) implements Comparable<ServerVersion> {
  private static final Pattern DOTTED = Pattern.compile("(\\d+)\\.(\\d+)(?:\\.(\\d+))?");
  private static final Pattern NUMBERS = Pattern.compile("(\\d+)(?:\\.(\\d+))?(?:\\.(\\d+))?");

  public ServerVersion {
    if (major < 0 || minor < 0 || patch < 0) throw new IllegalArgumentException("version parts must be >= 0");
  }

  public static ServerVersion of(int major, int minor) {
    return new ServerVersion(major, minor, 0);
  }

  public static ServerVersion of(int major, int minor, int patch) {
    return new ServerVersion(major, minor, patch);
  }

  /**
   * Parses the first dotted number found, falling back to a bare number, so vendor strings like
   * {@code "8.0.36-0ubuntu0.22.04.1"} or {@code "Oracle Database 11g ... Release 11.2.0.4.0"} work.
   */
  public static ServerVersion parse(String text) {
    if (text == null) throw new IllegalArgumentException("version text is required");
    Matcher m = DOTTED.matcher(text);
    if (!m.find()) {
      m = NUMBERS.matcher(text);
      if (!m.find()) throw new IllegalArgumentException("No version number in '" + text + "'");
    }
    return new ServerVersion(
        Integer.parseInt(m.group(1)),
        m.group(2) == null ? 0 : Integer.parseInt(m.group(2)),
        m.group(3) == null ? 0 : Integer.parseInt(m.group(3)));
  }

  public boolean atLeast(int major, int minor) {
    return atLeast(major, minor, 0);
  }

  public boolean atLeast(int major, int minor, int patch) {
    return compareTo(new ServerVersion(major, minor, patch)) >= 0;
  }

  @Override
  public int compareTo(ServerVersion o) {
    if (major != o.major) return Integer.compare(major, o.major);
    if (minor != o.minor) return Integer.compare(minor, o.minor);
    return Integer.compare(patch, o.patch);
  }

  @Override
  public String toString() {
    return major + "." + minor + "." + patch;
  }
}
