package com.funnelanalytics.domain.query;

/**
 * Snippets shared by the query renderers.
 */
public final class SqlFragments {

    private SqlFragments() {
    }

    /**
     * SQL equivalent of {@link com.funnelanalytics.domain.pattern.UrlPathNormalizer#normalize(String)}.
     */
    public static String normalizedUrl(String column) {
        String stripped = "RTRIM(REGEXP_REPLACE(REGEXP_REPLACE(" + column + ", r'[?#].*', ''), r'//+', '/'), '/')";
        return "CASE WHEN " + stripped + " = '' THEN '/' ELSE " + stripped + " END";
    }

    public static String table(String qualifiedName) {
        return "`" + qualifiedName + "`";
    }
}
