package domain.format;

import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Keyword lookup tables used by {@link SqlFormatter}.
 *
 * <p>Entries are stored uppercased and never change after construction, so one
 * instance can be shared by any number of concurrent format calls.</p>
 */
public final class KeywordVocabulary {

    private static final List<String> STANDARD_KEYWORDS = List.of(
            // DML / DDL
            "SELECT", "FROM", "WHERE", "AND", "OR", "NOT", "IN", "EXISTS",
            "JOIN", "INNER", "LEFT", "RIGHT", "OUTER", "FULL", "CROSS", "ON",
            "GROUP", "BY", "HAVING", "ORDER", "ASC", "DESC", "NULLS", "FIRST", "LAST",
            "INSERT", "INTO", "VALUES", "UPDATE", "SET", "DELETE",
            "CREATE", "TABLE", "INDEX", "VIEW", "DROP", "ALTER", "ADD", "COLUMN",
            "PRIMARY", "KEY", "FOREIGN", "REFERENCES", "UNIQUE", "CHECK", "DEFAULT",
            "NULL", "CONSTRAINT", "CASCADE", "RESTRICT",
            // set operations
            "UNION", "ALL", "INTERSECT", "EXCEPT",
            // expressions
            "CASE", "WHEN", "THEN", "ELSE", "END", "AS", "DISTINCT",
            "TOP", "LIMIT", "OFFSET", "FETCH", "NEXT", "ROWS", "ONLY",
            // transactions / control flow
            "BEGIN", "COMMIT", "ROLLBACK", "TRANSACTION", "SAVEPOINT",
            "DECLARE", "CURSOR", "OPEN", "CLOSE", "DEALLOCATE",
            "IF", "WHILE", "RETURN", "EXEC", "EXECUTE", "PROCEDURE", "FUNCTION",
            "WITH", "RECURSIVE", "CTE",
            // predicates
            "LIKE", "BETWEEN", "IS", "SOME", "ANY",
            // functions
            "COUNT", "SUM", "AVG", "MIN", "MAX", "COALESCE", "NULLIF", "CAST", "CONVERT",
            "OVER", "PARTITION", "ROW_NUMBER", "RANK", "DENSE_RANK"
    );

    private static final Set<String> BLOCK_START_KEYWORDS = Set.of(
            "SELECT", "FROM", "WHERE", "GROUP", "HAVING", "ORDER",
            "JOIN", "INNER", "LEFT", "RIGHT", "FULL", "CROSS",
            "SET", "VALUES"
    );

    private static final KeywordVocabulary STANDARD = new KeywordVocabulary(STANDARD_KEYWORDS);

    private final Set<String> keywords;

    private KeywordVocabulary(Collection<String> words) {
        Set<String> s = new HashSet<>(Math.max(16, words.size() * 2));
        for (String w : words) {
            if (w == null) continue;
            String t = w.trim();
            if (t.isEmpty()) continue;
            s.add(KeywordCase.UPPER.apply(t));
        }
        this.keywords = Collections.unmodifiableSet(s);
    }

    /** The built-in vocabulary. */
    public static KeywordVocabulary standard() {
        return STANDARD;
    }

    /**
     * Custom vocabulary. Entries are trimmed and uppercased; blank entries are skipped.
     */
    public static KeywordVocabulary of(Collection<String> words) {
        if (words == null) return new KeywordVocabulary(List.of());
        return new KeywordVocabulary(words);
    }

    /** @param upperToken token already uppercased by the caller */
    public boolean isKeyword(String upperToken) {
        return upperToken != null && keywords.contains(upperToken);
    }

    /**
     * Block-start keywords force a line break before they are emitted.
     * The subset is fixed; a word only counts when the vocabulary also knows it.
     */
    public boolean isBlockStart(String upperToken) {
        return isKeyword(upperToken) && BLOCK_START_KEYWORDS.contains(upperToken);
    }

    public int size() {
        return keywords.size();
    }

    public Set<String> keywords() {
        return keywords;
    }

    static Set<String> blockStartKeywords() {
        return BLOCK_START_KEYWORDS;
    }
}
