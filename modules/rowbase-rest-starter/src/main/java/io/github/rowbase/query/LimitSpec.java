package io.github.rowbase.query;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Row limit with optional page, written as {@code n}, {@code n page p} or {@code n.p}.
 * Pages start at 1.
 */
public final class LimitSpec {

    private static final Pattern LIMIT_PATTERN = Pattern.compile("^(\\d+)(\\spage\\s|\\.)?(\\d+)?$",
            Pattern.CASE_INSENSITIVE);

    private static final LimitSpec NONE = new LimitSpec(-1, -1);

    private final int limit;
    private final int page;

    public LimitSpec(int limit, int page) {
        this.limit = limit;
        this.page = page;
    }

    public static LimitSpec none() {
        return NONE;
    }

    /**
     * Parse a limit string. Anything not matching the limit syntax means no limit.
     */
    public static LimitSpec parse(String limit) {
        if (limit == null) {
            return NONE;
        }
        Matcher matcher = LIMIT_PATTERN.matcher(limit.trim());
        if (!matcher.matches()) {
            return NONE;
        }
        try {
            int rows = Integer.parseInt(matcher.group(1));
            int page = matcher.group(2) != null && matcher.group(3) != null ? Integer.parseInt(matcher.group(3)) : -1;
            return new LimitSpec(rows, page);
        } catch (NumberFormatException e) {
            return NONE;
        }
    }

    public int getLimit() {
        return limit;
    }

    public int getPage() {
        return page;
    }

    /**
     * Render the value of a LIMIT clause, {@code n} or {@code n OFFSET m}. A limit that is
     * not positive renders as an empty string.
     */
    public String toSql() {
        if (limit <= 0) {
            return "";
        }
        if (page > 0) {
            long offset = (long) limit * (page - 1);
            return limit + " OFFSET " + offset;
        }
        return Integer.toString(limit);
    }
}
