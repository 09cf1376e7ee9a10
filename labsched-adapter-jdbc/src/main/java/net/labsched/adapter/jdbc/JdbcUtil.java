package net.labsched.adapter.jdbc;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.StringJoiner;

public final class JdbcUtil {
    /** Oracle rejects IN lists longer than this (ORA-01795). */
    public static final int MAX_IN_LIST = 1000;

    private JdbcUtil() {}

    public static Timestamp ts(Instant i) { return i == null ? null : Timestamp.from(i); }

    public static Instant toInstant(Timestamp ts) { return ts == null ? null : ts.toInstant(); }

    public static String yn(boolean b) { return b ? "Y" : "N"; }

    public static boolean isY(String s) { return "Y".equals(s); }

    /** "?,?,?" for n binds. */
    public static String placeholders(int n) {
        var j = new StringJoiner(",");
        for (int i = 0; i < n; i++) j.add("?");
        return j.toString();
    }

    /** Splits ids into IN-list sized chunks, preserving iteration order. */
    public static <T> List<List<T>> chunks(Collection<T> values) {
        if (values.isEmpty()) return Collections.emptyList();
        var src = new ArrayList<>(values);
        var out = new ArrayList<List<T>>();
        for (int i = 0; i < src.size(); i += MAX_IN_LIST) {
            out.add(src.subList(i, Math.min(src.size(), i + MAX_IN_LIST)));
        }
        return out;
    }
}
