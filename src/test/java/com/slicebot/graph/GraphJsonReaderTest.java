package com.slicebot.graph;

import com.slicebot.coverage.OtherPolicy;
import com.slicebot.model.ParamSlot;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class GraphJsonReaderTest {
    private static final String GRAPH = "{"
            + "\"nodes\":["
            + "{\"id\":\"landing\",\"label\":\"Landing\",\"event_id\":\"page_view\"},"
            + "{\"id\":\"checkout\",\"event_id\":\"checkout_start\","
            + "\"case\":{\"id\":\"checkout-test\",\"connection\":\"statsig\"}}],"
            + "\"edges\":[{\"id\":\"e1\",\"from\":\"landing\",\"to\":\"checkout\","
            + "\"p\":{\"id\":\"landing-to-checkout\",\"connection\":\"amplitude-prod\",\"t95\":12.5},"
            + "\"cost_gbp\":{\"id\":\"checkout-cost\"},"
            + "\"conditional_p\":[{\"condition\":\"visited(pricing)\","
            + "\"p\":{\"id\":\"landing-to-checkout-pricing\",\"connection\":\"amplitude-prod\"}}],"
            + "\"ignored\":true}],"
            + "\"contexts\":[{\"id\":\"channel\",\"values\":[\"google\",{\"id\":\"meta\"}],\"other_policy\":\"computed\"},"
            + "{\"id\":\"device\",\"values\":[\"ios\",\"android\"]}],"
            + "\"connections\":[{\"name\":\"sheets-readonly\",\"requires_event_ids\":false},{\"name\":\"statsig\"}]"
            + "}";

    private final GraphJsonReader reader = new GraphJsonReader();

    @Test
    void parseShouldReadNodesEdgesAndBindings() {
        GraphDocument doc = reader.parse(GRAPH);

        Graph graph = doc.graph;
        assertEquals(2, graph.nodes.size());
        GraphNode checkout = graph.findNode("checkout").orElseThrow();
        assertEquals("checkout-test", checkout.caseBinding.objectId);
        assertEquals("statsig", checkout.caseBinding.connection);
        assertEquals("", checkout.label);

        GraphEdge edge = graph.edges.get(0);
        ParameterBinding p = edge.parameter(ParamSlot.P);
        assertEquals("landing-to-checkout", p.objectId);
        assertEquals(Double.valueOf(12.5), p.t95Days);
        assertFalse(edge.parameter(ParamSlot.COST_GBP).hasConnection());
        assertNull(edge.parameter(ParamSlot.LABOUR_COST));
        assertEquals(1, edge.conditionals.size());
        assertEquals("visited(pricing)", edge.conditionals.get(0).condition);
        assertEquals("landing-to-checkout-pricing", edge.conditionals.get(0).parameter.objectId);
    }

    @Test
    void parseShouldReadContextsAndConnectionFlags() {
        GraphDocument doc = reader.parse(GRAPH);

        assertEquals(2, doc.contexts.size());
        assertEquals("channel", doc.contexts.get(0).id);
        assertTrue(doc.contexts.get(0).values.contains("meta"));
        assertEquals(OtherPolicy.COMPUTED, doc.contexts.get(0).otherPolicy);
        assertEquals(OtherPolicy.UNDEFINED, doc.contexts.get(1).otherPolicy);
        assertEquals(1, doc.requiresEventIds.size());
        assertEquals(Boolean.FALSE, doc.requiresEventIds.get("sheets-readonly"));
    }

    @Test
    void structuralErrorsShouldNameTheLocation() {
        IllegalArgumentException missingTo = assertThrows(IllegalArgumentException.class,
                () -> reader.parse("{\"edges\":[{\"id\":\"e1\",\"from\":\"a\"}]}"));
        IllegalArgumentException negative = assertThrows(IllegalArgumentException.class,
                () -> reader.parse("{\"edges\":[{\"id\":\"e1\",\"from\":\"a\",\"to\":\"b\",\"p\":{\"id\":\"x\",\"t95\":-1}}]}"));

        assertEquals("edges[0].to is required", missingTo.getMessage());
        assertTrue(negative.getMessage().startsWith("edges[0].p.t95"));
        assertThrows(IllegalArgumentException.class, () -> reader.parse("[1,2]"));
    }
}
