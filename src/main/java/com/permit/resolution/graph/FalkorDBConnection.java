package com.permit.resolution.graph;

import com.falkordb.Driver;
import com.falkordb.FalkorDB;
import com.falkordb.Graph;
import com.falkordb.Record;
import com.falkordb.ResultSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * FalkorDB connection using the JFalkorDB client.
 */
public class FalkorDBConnection implements GraphConnection {
    private static final Logger log = LoggerFactory.getLogger(FalkorDBConnection.class);

    private final Driver driver;
    private final Graph graph;
    private final String graphName;

    public FalkorDBConnection(String host, int port, String graphName) {
        this.driver = FalkorDB.driver(host, port);
        this.graphName = graphName;
        this.graph = driver.graph(graphName);
        log.info("graph.connection.opened host={} port={} graph={}", host, port, graphName);
    }

    @Override
    public void execute(String query, Map<String, Object> params) {
        String cypher = bind(query, params);
        log.debug("graph.execute query={}", cypher);
        graph.query(cypher);
    }

    @Override
    public List<Map<String, Object>> query(String query, Map<String, Object> params) {
        String cypher = bind(query, params);
        log.debug("graph.query query={}", cypher);

        ResultSet resultSet = graph.query(cypher);
        List<Map<String, Object>> rows = new ArrayList<>();
        for (Record record : resultSet) {
            Map<String, Object> row = new HashMap<>();
            for (String key : record.keys()) {
                row.put(key, record.getValue(key));
            }
            rows.add(row);
        }
        return rows;
    }

    @Override
    public boolean isConnected() {
        try {
            graph.query("RETURN 1");
            return true;
        } catch (Exception e) {
            log.warn("graph.connection.check.failed graph={} error={}", graphName, e.getMessage());
            return false;
        }
    }

    @Override
    public String getGraphName() {
        return graphName;
    }

    @Override
    public void createIndexes() {
        createIndex("CREATE INDEX FOR (c:Contact) ON (c.id)");
        createIndex("CREATE INDEX FOR (c:Contact) ON (c.normalizedKey)");
        log.info("graph.indexes.ready graph={}", graphName);
    }

    private void createIndex(String statement) {
        try {
            graph.query(statement);
        } catch (Exception e) {
            // FalkorDB rejects an index that already exists
            log.debug("graph.index.skipped statement='{}' reason={}", statement, e.getMessage());
        }
    }

    /**
     * Inlines {@code $name} parameters as Cypher literals. Longer names are bound
     * first so that {@code $ab} is not clobbered by {@code $a}.
     */
    static String bind(String query, Map<String, Object> params) {
        String result = query;
        List<String> names = new ArrayList<>(params.keySet());
        names.sort((x, y) -> Integer.compare(y.length(), x.length()));
        for (String name : names) {
            result = result.replace("$" + name, literal(params.get(name)));
        }
        return result;
    }

    static String literal(Object value) {
        if (value == null) {
            return "null";
        }
        if (value instanceof Number || value instanceof Boolean) {
            return value.toString();
        }
        if (value instanceof Collection<?> values) {
            return values.stream().map(FalkorDBConnection::literal).collect(Collectors.joining(", ", "[", "]"));
        }
        return "'" + value.toString().replace("\\", "\\\\").replace("'", "\\'") + "'";
    }

    @Override
    public void close() {
        try {
            driver.close();
        } catch (Exception e) {
            log.warn("graph.connection.close.failed graph={} error={}", graphName, e.getMessage());
        }
        log.info("graph.connection.closed graph={}", graphName);
    }
}
