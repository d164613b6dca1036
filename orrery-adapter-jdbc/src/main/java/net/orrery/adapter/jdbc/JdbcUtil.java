package net.orrery.adapter.jdbc;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.UUID;

public final class JdbcUtil {
    /** Upper bound of bind parameters per IN-list. */
    public static final int IN_CHUNK = 500;

    private JdbcUtil() {}

    public static Timestamp ts(Instant i) { return i == null ? null : Timestamp.from(i); }

    public static Instant toInstant(Timestamp ts) { return ts == null ? null : ts.toInstant(); }

    public static UUID uuid(String s) { return s == null ? null : UUID.fromString(s); }

    public static String yn(boolean b) { return b ? "Y" : "N"; }

    public static boolean isY(String s) { return "Y".equals(s); }

    /** "?, ?, ?" */
    public static String placeholders(int n) {
        if (n <= 0) throw new IllegalArgumentException("at least one placeholder required");
        return String.join(", ", java.util.Collections.nCopies(n, "?"));
    }

    public static <T> List<List<T>> chunks(Collection<T> items, int size) {
        List<List<T>> out = new ArrayList<>();
        List<T> cur = new ArrayList<>(Math.min(size, items.size()));
        for (T item : items) {
            cur.add(item);
            if (cur.size() == size) {
                out.add(cur);
                cur = new ArrayList<>(size);
            }
        }
        if (!cur.isEmpty()) out.add(cur);
        return out;
    }
}
