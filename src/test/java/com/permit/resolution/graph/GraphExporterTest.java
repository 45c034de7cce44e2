package com.permit.resolution.graph;

import com.permit.resolution.core.model.ContactIdentifier;
import com.permit.resolution.core.model.EdgeKey;
import com.permit.resolution.core.model.EdgeKind;
import com.permit.resolution.core.model.Entity;
import com.permit.resolution.core.model.IdentifierKind;
import com.permit.resolution.core.model.RelationshipEdge;
import com.permit.resolution.core.model.SourceTag;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("GraphExporter Tests")
class GraphExporterTest {

    @Mock
    private GraphConnection connection;

    private GraphExporter exporter;

    @BeforeEach
    void setUp() {
        lenient().when(connection.getGraphName()).thenReturn("permits");
        exporter = new GraphExporter(connection);
    }

    private static Entity entity(String id) {
        return Entity.builder()
                .entityId(id)
                .canonicalName("Jane Doe")
                .normalizedKey("jane doe")
                .blockKey("j|doe")
                .addSourceTag(SourceTag.BUILDING)
                .addPermitId("P1")
                .addSpelling("Jane Doe")
                .lastActivityAt(Instant.parse("2024-01-01T00:00:00Z"))
                .canonicalSource(SourceTag.BUILDING)
                .canonicalObservedAt(Instant.parse("2024-01-01T00:00:00Z"))
                .qualityScore(70)
                .build();
    }

    @Test
    @DisplayName("Entities are written before edges")
    @SuppressWarnings("unchecked")
    void entitiesFirst() {
        RelationshipEdge edge = RelationshipEdge.of(EdgeKey.of("ent-a", "ent-b", EdgeKind.INTERACTION),
                new TreeSet<>(List.of("P1")), new TreeSet<>(List.of("Mission")));

        int statements = exporter.export(List.of(entity("ent-a"), entity("ent-b")), List.of(edge), List.of());

        assertEquals(3, statements);
        InOrder order = inOrder(connection);
        order.verify(connection, times(2)).execute(contains("MERGE (c:Contact"), anyMap());
        ArgumentCaptor<Map<String, Object>> params = ArgumentCaptor.forClass(Map.class);
        order.verify(connection).execute(contains("INTERACTS_WITH"), params.capture());
        assertEquals(1, params.getValue().get("sharedPermitCount"));
        assertEquals(List.of("P1"), params.getValue().get("permitIds"));
    }

    @Test
    @DisplayName("Contact nodes carry upstream identifiers")
    @SuppressWarnings("unchecked")
    void writesIdentifiers() {
        Entity licensed = entity("ent-a").toBuilder()
                .identifiers(List.of(new ContactIdentifier(IdentifierKind.LICENSE_NUMBER, "C-10 123")))
                .build();

        exporter.export(List.of(licensed), List.of(), List.of());

        ArgumentCaptor<Map<String, Object>> params = ArgumentCaptor.forClass(Map.class);
        verify(connection).execute(contains("c.identifiers = $identifiers"), params.capture());
        assertEquals(List.of("license_number:C-10 123"), params.getValue().get("identifiers"));
        assertEquals("ent-a", params.getValue().get("id"));
    }

    @Test
    @DisplayName("Removed edges are deleted by relationship type")
    void deletesRemovedEdges() {
        exporter.export(List.of(), List.of(), List.of(EdgeKey.of("ent-a", "ent-b", EdgeKind.CO_OCCURRENCE)));

        verify(connection).execute(contains("CO_OCCURS_WITH"), eq(Map.of("entityIdA", "ent-a", "entityIdB", "ent-b")));
    }

    @Test
    @DisplayName("Relationship types map from edge kinds")
    void relationshipTypes() {
        assertEquals("CO_OCCURS_WITH", GraphExporter.relationshipType(EdgeKind.CO_OCCURRENCE));
        assertEquals("INTERACTS_WITH", GraphExporter.relationshipType(EdgeKind.INTERACTION));
    }
}
