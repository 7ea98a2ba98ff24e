package com.tidypipe.backend.engine;

import java.time.Instant;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.tidypipe.Fixtures;
import com.tidypipe.backend.aggregator.AggregateFunc;
import com.tidypipe.backend.expr.Expr;
import com.tidypipe.backend.expr.ExprKind;
import com.tidypipe.backend.manager.PipelineManager;
import com.tidypipe.backend.parser.PipelineParser;
import com.tidypipe.backend.parser.statement.Pipeline;
import com.tidypipe.backend.parser.statement.Transform;
import com.tidypipe.backend.source.InMemoryDataSource;
import com.tidypipe.backend.value.Missing;
import com.tidypipe.backend.value.Table;
import com.tidypipe.common.ErrorKind;
import com.tidypipe.common.PipelineException;
import com.tidypipe.common.RunResult;

import static org.junit.jupiter.api.Assertions.*;

public class PipelineExecutorTest {

    private PipelineExecutor executor;
    private PipelineManager manager;

    @BeforeEach
    public void setUp() {
        InMemoryDataSource source = new InMemoryDataSource();
        source.register("colors", Fixtures.colors());
        source.register("single", Fixtures.single());
        source.register("pair", Fixtures.pair());
        executor = new PipelineExecutor(source, EngineConfig.defaults());
        manager = new PipelineManager("test");
    }

    private static Expr notZero(String column) throws PipelineException {
        return Expr.binary(ExprKind.NOT_EQUAL, Expr.column(column), Expr.number(0));
    }

    private RunResult run(Transform... transforms) {
        return executor.run(Pipeline.of(transforms), manager);
    }

    @Test
    public void testFilterThenGroup() throws Exception {
        RunResult result = run(Transform.data("colors"), Transform.filter(notZero("red")), Transform.groupBy("blue"));
        assertTrue(result.isSuccess());
        assertEquals("", result.getError());
        assertEquals(5, result.getTable().size());
        assertEquals(PipelineManager.RunState.SUCCESS, manager.getState());
        assertSame(result, manager.getLastResult());
    }

    @Test
    public void testGroupSizes() throws Exception {
        RunResult result = run(Transform.data("colors"), Transform.groupBy("blue"),
                Transform.summarize(AggregateFunc.COUNT, "blue"));
        assertEquals(List.of(6.0, 4.0, 1.0), result.getTable().column("blue_count"));
    }

    @Test
    public void testJoinGolden() throws Exception {
        RunResult left = run(Transform.data("colors"), Transform.filter(notZero("red")), Transform.publish("left"));
        RunResult right = run(Transform.data("colors"), Transform.filter(notZero("green")), Transform.publish("right"));
        assertTrue(left.isSuccess());
        assertTrue(right.isSuccess());

        RunResult joined = run(Transform.join("left", "red", "right", "green"),
                Transform.filter(notZero("left_blue")),
                Transform.filter(notZero("right_blue")));
        assertTrue(joined.isSuccess(), joined.getError());
        Table table = joined.getTable();
        assertEquals(List.of("_join_", "left_name", "left_green", "left_blue",
                "right_name", "right_red", "right_blue"), table.getColumns());
        assertEquals(List.of("fuchsia", "fuchsia", "white", "white"), table.column("left_name"));
        assertEquals(List.of("aqua", "white", "aqua", "white"), table.column("right_name"));
        assertEquals(List.of(255.0, 255.0, 255.0, 255.0), table.column("_join_"));
    }

    @Test
    public void testJoinSingleRows() throws Exception {
        run(Transform.data("single"), Transform.publish("left"));
        run(Transform.data("pair"), Transform.publish("right"));
        RunResult joined = run(Transform.join("left", "first", "right", "first"));
        assertEquals(Table.builder(List.of("_join_", "right_second")).addRow(1, 100).build(), joined.getTable());
    }

    @Test
    public void testJoinUnknownName() {
        RunResult result = run(Transform.join("left", "first", "right", "first"));
        assertFalse(result.isSuccess());
        assertEquals(ErrorKind.UNKNOWN_REGISTRY_NAME, result.getErrorKind());
        assertTrue(result.getTable().isEmpty());
        assertEquals(PipelineManager.RunState.FAILED, manager.getState());
    }

    @Test
    public void testInvalidDateIsNotAnError() throws Exception {
        RunResult result = run(Transform.sequence("n", 1),
                Transform.mutate("when", Expr.unary(ExprKind.TO_DATETIME, Expr.text("abc"))));
        assertTrue(result.isSuccess());
        assertEquals("", result.getError());
        assertSame(Missing.MISSING, result.getTable().getRow(0).get("when"));
    }

    @Test
    public void testWeekday() throws Exception {
        RunResult result = run(Transform.sequence("n", 1),
                Transform.mutate("day", Expr.unary(ExprKind.TO_WEEKDAY,
                        Expr.datetime(Instant.parse("1984-01-01T00:00:00Z")))));
        assertEquals(7.0, result.getTable().getRow(0).get("day"));
    }

    @Test
    public void testSequence() throws Exception {
        RunResult result = run(Transform.sequence("n", 4));
        assertEquals(List.of(1.0, 2.0, 3.0, 4.0), result.getTable().column("n"));
        assertTrue(run(Transform.sequence("n", 0)).getTable().isEmpty());
    }

    @Test
    public void testFailureStopsRunButKeepsEarlierNotify() throws Exception {
        RunResult result = run(Transform.data("colors"), Transform.publish("before"),
                Transform.mutate("bad", Expr.binary(ExprKind.ADD, Expr.column("name"), Expr.number(1))),
                Transform.publish("after"));
        assertFalse(result.isSuccess());
        assertEquals(ErrorKind.TYPE_ERROR, result.getErrorKind());
        assertEquals("Require number for add", result.getError());
        assertTrue(manager.contains("before"));
        assertFalse(manager.contains("after"));
    }

    @Test
    public void testUnknownColumnMessage() throws Exception {
        RunResult result = run(Transform.data("colors"), Transform.select(List.of("purple")));
        assertEquals(ErrorKind.UNKNOWN_COLUMN, result.getErrorKind());
        assertEquals("Unknown column \"purple\"", result.getError());
    }

    @Test
    public void testPipelineMustStartWithSource() throws Exception {
        RunResult result = run(Transform.filter(notZero("red")));
        assertEquals(ErrorKind.MALFORMED_PIPELINE, result.getErrorKind());
        result = run(Transform.data("colors"), Transform.data("colors"));
        assertEquals(ErrorKind.MALFORMED_PIPELINE, result.getErrorKind());
        result = executor.run(Pipeline.of(), manager);
        assertEquals(ErrorKind.MALFORMED_PIPELINE, result.getErrorKind());
    }

    @Test
    public void testDataFallsBackToRegistry() throws Exception {
        run(Transform.sequence("n", 3), Transform.publish("numbers"));
        RunResult result = run(Transform.data("numbers"));
        assertEquals(3, result.getTable().size());
        RunResult unknown = run(Transform.data("nothing"));
        assertEquals(ErrorKind.UNKNOWN_DATASET, unknown.getErrorKind());
    }

    @Test
    public void testRunParsedPipeline() throws Exception {
        Pipeline pipeline = PipelineParser.parsePipeline("["
                + "[\"@transform\",\"data\",\"colors\"],"
                + "[\"@transform\",\"mutate\",\"bright\",[\"@expr\",\"greaterEqual\",[\"@expr\",\"column\",\"red\"],[\"@expr\",\"column\",\"green\"]]],"
                + "[\"@transform\",\"filter\",[\"@expr\",\"column\",\"bright\"]],"
                + "[\"@transform\",\"sort\",[\"name\"],false],"
                + "[\"@transform\",\"select\",[\"name\"]]"
                + "]");
        RunResult result = executor.run(pipeline, manager);
        assertEquals(List.of("black", "blue", "fuchsia", "maroon", "navy", "red", "white", "yellow"),
                result.getTable().column("name"));
    }

    @Test
    public void testSeededRandomIsReproducible() throws Exception {
        EngineConfig config = new EngineConfig();
        config.setRandomSeed(42L);
        Pipeline pipeline = Pipeline.of(Transform.sequence("n", 5), Transform.mutate("r", Expr.uniform(0, 1)));
        InMemoryDataSource source = new InMemoryDataSource();
        RunResult first = new PipelineExecutor(source, config).run(pipeline, new PipelineManager());
        RunResult second = new PipelineExecutor(source, config).run(pipeline, new PipelineManager());
        assertEquals(first.getTable(), second.getTable());
    }

    @Test
    public void testBuiltinColors() throws Exception {
        InMemoryDataSource builtins = InMemoryDataSource.withBuiltins();
        assertEquals(Fixtures.colors(), builtins.load("colors"));
    }
}
