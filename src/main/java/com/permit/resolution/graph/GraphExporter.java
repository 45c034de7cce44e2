package com.permit.resolution.graph;

import com.permit.resolution.core.model.ContactIdentifier;
import com.permit.resolution.core.model.EdgeKey;
import com.permit.resolution.core.model.EdgeKind;
import com.permit.resolution.core.model.Entity;
import com.permit.resolution.core.model.RelationshipEdge;
import com.permit.resolution.core.model.SourceTag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Mirrors committed entities and relationship rows into a graph database as
 * {@code Contact} nodes joined by {@code CO_OCCURS_WITH} and {@code INTERACTS_WITH}
 * relationships. Statements are MERGEs, so re-exporting the same rows is harmless.
 */
public class GraphExporter {
    private static final Logger log = LoggerFactory.getLogger(GraphExporter.class);

    private static final String UPSERT_CONTACT = """
            MERGE (c:Contact {id: $id})
            SET c.canonicalName = $canonicalName,
                c.canonicalFirm = $canonicalFirm,
                c.normalizedKey = $normalizedKey,
                c.sources = $sources,
                c.identifiers = $identifiers,
                c.permitCount = $permitCount,
                c.lastActivityAt = $lastActivityAt,
                c.qualityScore = $qualityScore
            """;

    private static final String UPSERT_EDGE = """
            MATCH (a:Contact {id: $entityIdA}), (b:Contact {id: $entityIdB})
            MERGE (a)-[r:%s]->(b)
            SET r.sharedPermitCount = $sharedPermitCount,
                r.permitIds = $permitIds,
                r.neighborhoods = $neighborhoods
            """;

    private static final String DELETE_EDGE = """
            MATCH (a:Contact {id: $entityIdA})-[r:%s]->(b:Contact {id: $entityIdB})
            DELETE r
            """;

    private final GraphConnection connection;

    public GraphExporter(GraphConnection connection) {
        this.connection = connection;
    }

    /**
     * Writes one run's published changes. Entities go first so edge MATCHes find both ends.
     *
     * @return number of statements executed
     */
    public int export(Collection<Entity> entities, Collection<RelationshipEdge> edges, Collection<EdgeKey> removedEdges) {
        int statements = 0;
        for (Entity entity : entities) {
            connection.execute(UPSERT_CONTACT, contactParams(entity));
            statements++;
        }
        for (EdgeKey key : removedEdges) {
            connection.execute(DELETE_EDGE.formatted(relationshipType(key.kind())), Map.of(
                    "entityIdA", key.entityIdA(),
                    "entityIdB", key.entityIdB()));
            statements++;
        }
        for (RelationshipEdge edge : edges) {
            connection.execute(UPSERT_EDGE.formatted(relationshipType(edge.kind())), Map.of(
                    "entityIdA", edge.entityIdA(),
                    "entityIdB", edge.entityIdB(),
                    "sharedPermitCount", edge.sharedPermitCount(),
                    "permitIds", List.copyOf(edge.permitIds()),
                    "neighborhoods", List.copyOf(edge.neighborhoods())));
            statements++;
        }
        log.info("graph.exported graph={} entities={} edges={} removedEdges={}",
                connection.getGraphName(), entities.size(), edges.size(), removedEdges.size());
        return statements;
    }

    static String relationshipType(EdgeKind kind) {
        return switch (kind) {
            case CO_OCCURRENCE -> "CO_OCCURS_WITH";
            case INTERACTION -> "INTERACTS_WITH";
        };
    }

    private static Map<String, Object> contactParams(Entity entity) {
        Map<String, Object> params = new HashMap<>();
        params.put("id", entity.getEntityId());
        params.put("canonicalName", entity.getCanonicalName());
        params.put("canonicalFirm", entity.getCanonicalFirm().orElse(null));
        params.put("normalizedKey", entity.getNormalizedKey());
        params.put("sources", entity.getSourceTags().stream().map(SourceTag::getLabel).toList());
        params.put("identifiers", entity.getIdentifiers().stream().map(ContactIdentifier::toString).toList());
        params.put("permitCount", entity.getPermitCount());
        params.put("lastActivityAt", entity.getLastActivityAt().toString());
        params.put("qualityScore", entity.getQualityScore());
        return params;
    }
}
