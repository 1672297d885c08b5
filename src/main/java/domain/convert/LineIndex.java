package domain.convert;

import java.util.Arrays;

/**
 * Maps character offsets to 1-based line numbers.
 */
final class LineIndex {

    // offsets of '\n'
    private final int[] breaks;

    LineIndex(String text) {
        String t = (text == null) ? "" : text;
        int[] tmp = new int[16];
        int n = 0;
        for (int i = 0; i < t.length(); i++) {
            if (t.charAt(i) != '\n') continue;
            if (n == tmp.length) tmp = Arrays.copyOf(tmp, n * 2);
            tmp[n++] = i;
        }
        this.breaks = Arrays.copyOf(tmp, n);
    }

    int lineOf(int offset) {
        int idx = Arrays.binarySearch(breaks, offset);
        // a '\n' belongs to the line it ends
        int before = (idx >= 0) ? idx : -idx - 1;
        return before + 1;
    }
}
