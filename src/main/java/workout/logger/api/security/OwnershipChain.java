package workout.logger.api.security;

import java.util.List;

/**
 * The closed set of ownership paths from a resource up to the user that owns it.
 * Each constant names the terminal table and the foreign-key hops to the root table,
 * whose {@code user_id} column identifies the owner. The access query is derived from that data.
 */
public enum OwnershipChain {
    WORKOUT_ROUTINE("workout routine", "workout_routines"),
    EXERCISE_ROUTINE("exercise routine", "exercise_routines",
            new Link("workout_routine_id", "workout_routines")),
    WORKOUT_SESSION("workout session", "workout_sessions"),
    EXERCISE("exercise", "exercises",
            new Link("workout_session_id", "workout_sessions")),
    SET_ENTRY("set", "set_entries",
            new Link("exercise_id", "exercises"),
            new Link("workout_session_id", "workout_sessions"));

    private static final String OWNER_COLUMN = "user_id";
    private static final String DELETED_COLUMN = "deleted_at";

    private final String resourceName;
    private final String table;
    private final List<Link> links;
    private final String accessQuery;

    OwnershipChain(String resourceName, String table, Link... links) {
        this.resourceName = resourceName;
        this.table = table;
        this.links = List.of(links);
        this.accessQuery = buildAccessQuery(table, this.links);
    }

    public String getResourceName() {
        return resourceName;
    }

    public String getTable() {
        return table;
    }

    public List<Link> getLinks() {
        return links;
    }

    public int getHops() {
        return links.size();
    }

    /**
     * Single statement with two parameters, the terminal id then the principal id.
     * Yields one row when every row on the path is live and the root belongs to the principal.
     */
    public String getAccessQuery() {
        return accessQuery;
    }

    private static String buildAccessQuery(String table, List<Link> links) {
        StringBuilder from = new StringBuilder(table).append(" t0");
        StringBuilder live = new StringBuilder("t0.").append(DELETED_COLUMN).append(" IS NULL");
        for (int i = 0; i < links.size(); i++) {
            Link link = links.get(i);
            String child = "t" + i;
            String parent = "t" + (i + 1);
            from.append(" JOIN ").append(link.getParentTable()).append(' ').append(parent)
                    .append(" ON ").append(parent).append(".id = ")
                    .append(child).append('.').append(link.getForeignKey());
            live.append(" AND ").append(parent).append('.').append(DELETED_COLUMN).append(" IS NULL");
        }
        String root = "t" + links.size();
        return "SELECT t0.id FROM " + from
                + " WHERE t0.id = ? AND " + root + "." + OWNER_COLUMN + " = ? AND " + live;
    }

    /**
     * One hop: the foreign key on the child table and the parent table it points to.
     */
    public static final class Link {
        private final String foreignKey;
        private final String parentTable;

        Link(String foreignKey, String parentTable) {
            this.foreignKey = foreignKey;
            this.parentTable = parentTable;
        }

        public String getForeignKey() {
            return foreignKey;
        }

        public String getParentTable() {
            return parentTable;
        }
    }
}
