package com.vidnyan.causeway.intervention;

import com.vidnyan.causeway.domain.error.InterventionParseException;
import com.vidnyan.causeway.domain.intervention.*;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class InterventionParserTest {

    private final InterventionParser parser = new InterventionParser();

    @Test
    void parse_DslAndMapAreEquivalent() {
        InterventionSpec fromDsl = parser.parse("do(x=5)");
        InterventionSpec fromMap = parser.parse(Map.of("type", "hard", "node", "x", "value", 5));
        InterventionSpec fromObject = parser.parse(new HardIntervention("x", 5.0));

        assertEquals(List.of(new HardIntervention("x", 5.0)), fromDsl.interventions());
        assertEquals(fromDsl, fromMap);
        assertEquals(fromDsl, fromObject);
        assertEquals(InterventionSpec.DEFAULT_NUM_SAMPLES, fromDsl.numSamples());
        assertNull(fromDsl.queryNodes());
    }

    @Test
    void parseDsl_SoftTransforms() {
        assertEquals(SoftIntervention.shift("x", 2.0), parser.parse("do(x=x+2)").interventions().get(0));
        assertEquals(SoftIntervention.shift("x", -3.0), parser.parse("do(x = x - 3)").interventions().get(0));
        assertEquals(SoftIntervention.scale("x", 1.5), parser.parse("do(x=x*1.5)").interventions().get(0));
        assertEquals(SoftIntervention.scale("x", 0.25), parser.parse("do(x=x/4)").interventions().get(0));
        assertEquals(SoftIntervention.custom("x", "2*x+1"), parser.parse("do(x=2*x+1)").interventions().get(0));
    }

    @Test
    void parseDsl_NegativeLiteralIsHard() {
        assertEquals(new HardIntervention("x", -3.0), parser.parse("do(x=-3)").interventions().get(0));
    }

    @Test
    void parseDsl_NodeMentionNeedsWordBoundary() {
        // "xy" does not mention x, so the value must be a number
        assertThrows(InterventionParseException.class, () -> parser.parse("do(x=xy+1)"));
    }

    @Test
    void parseDsl_MultipleInterventions() {
        InterventionSpec spec = parser.parse("do(x=5, y=y*0.5)");

        assertEquals(2, spec.interventions().size());
        assertEquals(List.of("x := 5", "y := y * 0.5"),
                spec.interventions().stream().map(Intervention::describe).toList());
    }

    @Test
    void parseDsl_Errors() {
        assertThrows(InterventionParseException.class, () -> parser.parse("x=5"));
        assertThrows(InterventionParseException.class, () -> parser.parse("do()"));
        assertThrows(InterventionParseException.class, () -> parser.parse("do(5)"));
        assertThrows(InterventionParseException.class, () -> parser.parse("do(=5)"));
        assertThrows(InterventionParseException.class, () -> parser.parse("do(x=abc)"));
        assertThrows(InterventionParseException.class, () -> parser.parse("do(x=x/0)"));
    }

    @Test
    void parseMap_FullSpec() {
        Map<String, Object> request = Map.of(
                "interventions", List.of(
                        Map.of("type", "hard", "node", "x", "value", 1),
                        Map.of("type", "soft", "node", "y", "transform", "scale", "param", 2.0)),
                "query_nodes", List.of("z"),
                "num_samples", 50);

        InterventionSpec spec = parser.parse(request);

        assertEquals(List.of(new HardIntervention("x", 1.0), SoftIntervention.scale("y", 2.0)),
                spec.interventions());
        assertEquals(List.of("z"), spec.queryNodes());
        assertEquals(50, spec.numSamples());
    }

    @Test
    void parseMap_InfersTypeFromFields() {
        assertEquals(SoftIntervention.shift("x", 2.0),
                parser.parse(Map.of("node", "x", "transform", "shift", "param", 2)).interventions().get(0));
        assertEquals(new HardIntervention("x", 7.0),
                parser.parse(Map.of("node", "x", "value", "7")).interventions().get(0));
    }

    @Test
    void parseMap_Errors() {
        assertThrows(InterventionParseException.class,
                () -> parser.parse(Map.of("type", "weird", "node", "x")));
        assertThrows(InterventionParseException.class,
                () -> parser.parse(Map.of("type", "soft", "node", "x", "transform", "custom")));
        assertThrows(InterventionParseException.class,
                () -> parser.parse(Map.of("type", "soft", "node", "x", "transform", "rotate", "param", 1)));
        assertThrows(InterventionParseException.class,
                () -> parser.parse(Map.of("type", "hard", "value", 1)));
        assertThrows(InterventionParseException.class,
                () -> parser.parse(Map.of("interventions", "x")));
    }

    @Test
    void parse_ListOfInterventions() {
        InterventionSpec spec = parser.parse(List.of(new HardIntervention("x", 1.0), SoftIntervention.shift("y", 1.0)));

        assertEquals(2, spec.interventions().size());
    }

    @Test
    void parse_UnsupportedType() {
        assertThrows(InterventionParseException.class, () -> parser.parse(42));
        assertThrows(InterventionParseException.class, () -> parser.parse(null));
    }

    @Test
    void parse_RejectsNonFiniteValues() {
        assertThrows(InterventionParseException.class, () -> parser.parse("do(x=NaN)"));
        assertThrows(InterventionParseException.class, () -> parser.parse("do(x=-Infinity)"));
        assertThrows(InterventionParseException.class, () -> parser.parse("do(x=x+Infinity)"));
        assertThrows(InterventionParseException.class,
                () -> parser.parse(Map.of("type", "hard", "node", "x", "value", Double.NaN)));
    }
}
