package domain.text;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

class SqlTextCleanerTest {

    private final SqlTextCleaner cleaner = new SqlTextCleaner();

    @Test
    void should_normalize_line_endings_and_trim_line_ends() {
        assertEquals("SELECT 1\nFROM t\n\nWHERE a = 1", cleaner.clean("SELECT 1  \r\nFROM t\t\r\r\nWHERE a = 1 "));
    }

    @Test
    void should_convert_tableau_slash_comments_outside_literals() {
        String raw = "SELECT 'http://x' AS u, [a//b] // note\n/* keep // this */ -- and // this";
        assertEquals("SELECT 'http://x' AS u, [a//b] -- note\n/* keep // this */ -- and // this", cleaner.clean(raw));
    }

    @Test
    void should_be_idempotent() {
        String once = cleaner.clean("SELECT 1 // c \r\n  FROM t  ");
        assertEquals(once, cleaner.clean(once));
    }

    @Test
    void should_return_empty_for_null() {
        assertEquals("", cleaner.clean(null));
    }
}
