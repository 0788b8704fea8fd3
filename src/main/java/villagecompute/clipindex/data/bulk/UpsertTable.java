package villagecompute.clipindex.data.bulk;

import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Tables written by scans, with the column layout used to build their multi-row upserts.
 *
 * <p>
 * Every table is keyed by {@code id}. {@code updateColumns} are overwritten on conflict; all other columns keep their
 * stored value (a clip's thumbnail status survives a re-index, a user's {@code created_at} never moves).
 */
public enum UpsertTable {

    CHAT_USERS("chat_users",
            List.of(col("id", "TEXT"), col("username", "TEXT"), col("discriminator", "TEXT"),
                    col("avatar_url", "TEXT"), col("created_at", "TIMESTAMPTZ"), col("updated_at", "TIMESTAMPTZ")),
            Set.of("id", "username"), List.of("username", "discriminator", "avatar_url", "updated_at")),

    MESSAGES("messages",
            List.of(col("id", "TEXT"), col("guild_id", "TEXT"), col("channel_id", "TEXT"), col("author_id", "TEXT"),
                    col("content", "TEXT"), col("timestamp", "TIMESTAMPTZ"), col("created_at", "TIMESTAMPTZ"),
                    col("updated_at", "TIMESTAMPTZ")),
            Set.of("id", "guild_id", "channel_id", "author_id", "timestamp"),
            List.of("content", "timestamp", "updated_at")),

    CLIPS("clips",
            List.of(col("id", "TEXT"), col("message_id", "TEXT"), col("guild_id", "TEXT"), col("channel_id", "TEXT"),
                    col("author_id", "TEXT"), col("filename", "TEXT"), col("file_size", "BIGINT"),
                    col("mime_type", "TEXT"), col("cdn_url", "TEXT"), col("expires_at", "TIMESTAMPTZ"),
                    col("thumbnail_status", "TEXT"), col("settings_hash", "TEXT"), col("created_at", "TIMESTAMPTZ"),
                    col("updated_at", "TIMESTAMPTZ")),
            Set.of("id", "message_id", "guild_id", "channel_id", "author_id", "filename", "file_size", "mime_type",
                    "cdn_url", "expires_at"),
            List.of("filename", "file_size", "mime_type", "cdn_url", "expires_at", "settings_hash", "updated_at"));

    /**
     * A column name with the SQL type its bind parameter is cast to.
     */
    public record Column(String name, String sqlType) {
    }

    private final String tableName;
    private final List<Column> columns;
    private final Set<String> requiredColumns;
    private final List<String> updateColumns;

    UpsertTable(String tableName, List<Column> columns, Set<String> requiredColumns, List<String> updateColumns) {
        this.tableName = tableName;
        this.columns = columns;
        this.requiredColumns = requiredColumns;
        this.updateColumns = updateColumns;
    }

    public String getTableName() {
        return tableName;
    }

    public List<Column> getColumns() {
        return columns;
    }

    public Set<String> getRequiredColumns() {
        return requiredColumns;
    }

    public List<String> getUpdateColumns() {
        return updateColumns;
    }

    /**
     * {@code INSERT ... ON CONFLICT (id) DO UPDATE} for {@code rowCount} rows. Parameters are named
     * {@code r{row}_{column}}.
     */
    public String upsertSql(int rowCount) {
        StringBuilder sql = new StringBuilder("INSERT INTO ").append(tableName).append(" (")
                .append(columns.stream().map(Column::name).collect(Collectors.joining(", "))).append(") VALUES ");
        for (int row = 0; row < rowCount; row++) {
            if (row > 0) {
                sql.append(", ");
            }
            sql.append('(');
            for (int c = 0; c < columns.size(); c++) {
                if (c > 0) {
                    sql.append(", ");
                }
                Column column = columns.get(c);
                sql.append("CAST(:").append(parameterName(row, c)).append(" AS ").append(column.sqlType())
                        .append(')');
            }
            sql.append(')');
        }
        sql.append(" ON CONFLICT (id) DO UPDATE SET ")
                .append(updateColumns.stream().map(c -> c + " = EXCLUDED." + c).collect(Collectors.joining(", ")));
        return sql.toString();
    }

    static String parameterName(int row, int column) {
        return "r" + row + "_" + column;
    }

    private static Column col(String name, String sqlType) {
        return new Column(name, sqlType);
    }
}
