package com.tidypipe.backend.source;

import java.util.List;

import org.junit.jupiter.api.Test;

import com.google.gson.JsonParser;
import com.tidypipe.Fixtures;
import com.tidypipe.backend.value.Missing;
import com.tidypipe.backend.value.Table;
import com.tidypipe.common.ErrorKind;
import com.tidypipe.common.PipelineException;

import static org.junit.jupiter.api.Assertions.*;

public class InMemoryDataSourceTest {

    @Test
    public void testBuiltins() throws PipelineException {
        InMemoryDataSource source = InMemoryDataSource.withBuiltins();
        assertTrue(source.contains("colors"));
        assertEquals(Fixtures.colors(), source.load("colors"));
    }

    @Test
    public void testUnknownDataset() {
        PipelineException e = assertThrows(PipelineException.class, () -> new InMemoryDataSource().load("penguins"));
        assertEquals(ErrorKind.UNKNOWN_DATASET, e.getKind());
    }

    @Test
    public void testParseRows() {
        Table table = InMemoryDataSource.parseRows(JsonParser.parseString(
                "[{\"species\":\"Adelie\",\"mass\":3750,\"tagged\":true},"
                        + "{\"species\":\"Gentoo\",\"mass\":null,\"tagged\":false}]"));
        assertEquals(List.of("species", "mass", "tagged"), table.getColumns());
        assertEquals(3750.0, table.getRows().get(0).get("mass"));
        assertEquals(Missing.MISSING, table.getRows().get(1).get("mass"));
        assertEquals(Boolean.FALSE, table.getRows().get(1).get("tagged"));
    }

    @Test
    public void testRegisterOverwrites() throws PipelineException {
        InMemoryDataSource source = new InMemoryDataSource();
        source.register("t", Fixtures.single());
        source.register("t", Fixtures.pair());
        assertEquals(Fixtures.pair(), source.load("t"));
        assertEquals(1, source.names().size());
    }
}
