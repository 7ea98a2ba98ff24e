package com.tidypipe.backend.parser;

import java.util.List;
import java.util.Set;

import org.junit.jupiter.api.Test;

import com.google.gson.JsonParser;
import com.tidypipe.backend.aggregator.AggregateFunc;
import com.tidypipe.backend.expr.Expr;
import com.tidypipe.backend.expr.ExprKind;
import com.tidypipe.backend.parser.statement.Data;
import com.tidypipe.backend.parser.statement.Filter;
import com.tidypipe.backend.parser.statement.Join;
import com.tidypipe.backend.parser.statement.Pipeline;
import com.tidypipe.backend.parser.statement.Program;
import com.tidypipe.backend.parser.statement.Summarize;
import com.tidypipe.backend.parser.statement.Transform;
import com.tidypipe.common.ErrorKind;
import com.tidypipe.common.PipelineException;

import static org.junit.jupiter.api.Assertions.*;

public class PipelineParserTest {

    private static final String COLORS_PIPELINE = "["
            + "[\"@transform\",\"data\",\"colors\"],"
            + "[\"@transform\",\"filter\",[\"@expr\",\"notEqual\",[\"@expr\",\"column\",\"red\"],[\"@expr\",\"number\",0]]],"
            + "[\"@transform\",\"groupBy\",\"blue\"],"
            + "[\"@transform\",\"summarize\",[[\"mean\",\"green\"],[\"count\",\"name\"]]],"
            + "[\"@transform\",\"notify\",\"left\"]"
            + "]";

    @Test
    public void testParsePipeline() throws Exception {
        Pipeline pipeline = PipelineParser.parsePipeline(COLORS_PIPELINE);
        assertEquals(5, pipeline.size());
        assertEquals("data -> filter -> groupBy -> summarize -> notify", pipeline.toString());
        assertEquals("colors", ((Data) pipeline.getTransforms().get(0)).dataset);
        assertEquals(Expr.binary(ExprKind.NOT_EQUAL, Expr.column("red"), Expr.number(0)),
                ((Filter) pipeline.getTransforms().get(1)).predicate);
        Summarize summarize = (Summarize) pipeline.getTransforms().get(3);
        assertEquals(AggregateFunc.MEAN, summarize.items.get(0).func);
        assertEquals("name_count", summarize.items.get(1).label());
        assertEquals(Set.of("left"), pipeline.produces());
    }

    @Test
    public void testSerializeRoundTrip() throws Exception {
        Pipeline pipeline = PipelineParser.parsePipeline(COLORS_PIPELINE);
        assertEquals(JsonParser.parseString(COLORS_PIPELINE), PipelineParser.serialize(pipeline));

        Pipeline all = Pipeline.of(
                Transform.sequence("n", 3),
                Transform.mutate("double", Expr.binary(ExprKind.MULTIPLY, Expr.column("n"), Expr.number(2))),
                Transform.select(List.of("double", "n")),
                Transform.sort(List.of("n"), true),
                Transform.groupBy("n"),
                Transform.ungroup(),
                Transform.publish("seq"),
                Transform.join("seq", "n", "seq", "n"));
        Pipeline copy = PipelineParser.parsePipeline(PipelineParser.toJson(all));
        assertEquals(PipelineParser.serialize(all), PipelineParser.serialize(copy));
    }

    @Test
    public void testParseProgramForms() throws Exception {
        String tagged = "[\"@program\"," + COLORS_PIPELINE + ",[[\"@transform\",\"sequence\",\"n\",2]]]";
        String bare = "[" + COLORS_PIPELINE + ",[[\"@transform\",\"sequence\",\"n\",2]]]";
        Program fromTagged = PipelineParser.parseProgram(tagged);
        Program fromBare = PipelineParser.parseProgram(bare);
        Program single = PipelineParser.parseProgram(COLORS_PIPELINE);
        assertEquals(2, fromTagged.getPipelines().size());
        assertEquals(2, fromBare.getPipelines().size());
        assertEquals(1, single.getPipelines().size());
        assertEquals(JsonParser.parseString(tagged), PipelineParser.serialize(fromBare));
    }

    @Test
    public void testRequiresSkipsNamesPublishedEarlier() throws Exception {
        Pipeline pipeline = Pipeline.of(
                Transform.join("a", "x", "b", "y"),
                Transform.publish("c"),
                Transform.join("c", "_join_", "d", "z"));
        assertEquals(List.of("a", "b", "d"), List.copyOf(pipeline.requires()));
        Join first = (Join) pipeline.getTransforms().get(0);
        assertTrue(first.isSource());
    }

    @Test
    public void testMalformedPipelines() {
        assertMalformed("");
        assertMalformed("{}");
        assertMalformed("[[\"@expr\",\"data\",\"colors\"]]");
        assertMalformed("[[\"@transform\",\"explode\"]]");
        assertMalformed("[[\"@transform\",\"data\"]]");
        assertMalformed("[[\"@transform\",\"data\",\"colors\",\"extra\"]]");
        assertMalformed("[[\"@transform\",\"sequence\",\"n\",-1]]");
        assertMalformed("[[\"@transform\",\"sequence\",\"n\",1.5]]");
        assertMalformed("[[\"@transform\",\"select\",[]]]");
        assertMalformed("[[\"@transform\",\"select\",[\"a\",\"a\"]]]");
        assertMalformed("[[\"@transform\",\"sort\",[\"a\"],\"yes\"]]");
        assertMalformed("[[\"@transform\",\"summarize\",[[\"mode\",\"a\"]]]]");
        assertMalformed("[[\"@transform\",\"summarize\",[[\"sum\",\"a\"],[\"sum\",\"a\"]]]]");
        assertMalformed("[[\"@transform\",\"notify\",\"\"]]");
    }

    @Test
    public void testMalformedExpressionInsideOperation() {
        PipelineException e = assertThrows(PipelineException.class, () -> PipelineParser.parsePipeline(
                "[[\"@transform\",\"filter\",[\"@expr\",\"nope\"]]]"));
        assertEquals(ErrorKind.MALFORMED_EXPRESSION, e.getKind());
    }

    private static void assertMalformed(String json) {
        PipelineException e = assertThrows(PipelineException.class, () -> PipelineParser.parseProgram(json), json);
        assertEquals(ErrorKind.MALFORMED_PIPELINE, e.getKind(), json);
    }
}
