package org.puneet.searchspace.unit;

import org.junit.jupiter.api.Test;
import org.puneet.searchspace.core.SearchSpace;
import org.puneet.searchspace.parameter.ChoiceParameter;
import org.puneet.searchspace.parameter.ParameterType;
import org.puneet.searchspace.parameter.RangeParameter;
import org.puneet.searchspace.report.SearchSpaceSummary;
import static org.junit.jupiter.api.Assertions.*;
import java.io.StringWriter;
import java.util.List;

class SearchSpaceSummaryTest {

    private static SearchSpace space() throws Exception {
        return new SearchSpace(List.of(
                new RangeParameter("x", ParameterType.FLOAT, 0.0, 1.0),
                new ChoiceParameter("c", ParameterType.STRING, List.of("a", "b"))));
    }

    @Test
    void testWriteCsv() throws Exception {
        StringWriter out = new StringWriter();
        SearchSpaceSummary.writeCsv(space(), out);
        String[] lines = out.toString().split("\n");
        assertEquals(3, lines.length);
        assertEquals("Name,Type,Domain,Datatype,Flags", lines[0]);
        assertEquals("x,Range,\"range=[0.0, 1.0]\",float,None", lines[1]);
        assertEquals("c,Choice,\"values=[a, b]\",string,ordered", lines[2]);
    }

    @Test
    void testWriteCsvLeavesDestinationOpen() throws Exception {
        StringWriter out = new StringWriter();
        SearchSpaceSummary.writeCsv(space(), out);
        out.write("trailer");
        assertTrue(out.toString().endsWith("trailer"));
    }

    @Test
    void testEmptySpace() throws Exception {
        SearchSpace empty = new SearchSpace(List.of());
        StringWriter out = new StringWriter();
        SearchSpaceSummary.writeCsv(empty, out);
        assertEquals("", out.toString());
        assertEquals("", SearchSpaceSummary.format(empty));
    }

    @Test
    void testFormat() throws Exception {
        String[] lines = SearchSpaceSummary.format(space()).split("\n");
        assertEquals(4, lines.length);
        assertEquals("Name  Type    Domain            Datatype  Flags", lines[0]);
        assertTrue(lines[1].matches("[- ]+"));
        assertEquals("x     Range   range=[0.0, 1.0]  float     None", lines[2]);
        assertEquals("c     Choice  values=[a, b]     string    ordered", lines[3]);
    }
}
