package com.foo.ledger.util;

/**
 * Inclusive span of 0-based sheet columns, configured in letter notation ({@code "B".."CF"}).
 */
public record ColumnRange(int first, int last) {

  private static final int RADIX = 26;

  public ColumnRange {
    if (first < 0 || last < first) {
      throw new IllegalArgumentException("Invalid column range: %d..%d".formatted(first, last));
    }
  }

  public static ColumnRange of(String firstLetters, String lastLetters) {
    return new ColumnRange(indexOf(firstLetters), indexOf(lastLetters));
  }

  /** {@code A -> 0}, {@code Z -> 25}, {@code AA -> 26}; case-insensitive. */
  public static int indexOf(String letters) {
    if (letters == null || letters.isBlank()) {
      throw new IllegalArgumentException("Column letters must not be blank");
    }
    int number = 0;
    for (char c : letters.trim().toUpperCase().toCharArray()) {
      if (c < 'A' || c > 'Z') {
        throw new IllegalArgumentException("Invalid column letters: " + letters);
      }
      number = number * RADIX + (c - 'A' + 1);
    }
    return number - 1;
  }

  public static String lettersOf(int index) {
    if (index < 0) {
      throw new IllegalArgumentException("Column index must be non-negative: " + index);
    }
    StringBuilder letters = new StringBuilder();
    for (int n = index + 1; n > 0; n = (n - 1) / RADIX) {
      letters.append((char) ('A' + (n - 1) % RADIX));
    }
    return letters.reverse().toString();
  }

  public int width() {
    return last - first + 1;
  }

  public boolean contains(int column) {
    return column >= first && column <= last;
  }

  @Override
  public String toString() {
    return lettersOf(first) + ".." + lettersOf(last);
  }
}
