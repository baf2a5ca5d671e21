package com.wp.verifier.processor;

import com.wp.verifier.VerifierOptions;
import com.wp.verifier.ast.FunctionDecl;
import com.wp.verifier.report.FunctionReport;
import com.wp.verifier.report.FunctionVerdict;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SourceProcessorTest {

    static final String CALC = "import com.wp.verifier.annotations.*;\n"
            + "class Calc {\n"
            + "    @Requires(\"x > 0\")\n"
            + "    @Ensures(\"result > x\")\n"
            + "    int inc(int x) { return x + 1; }\n"
            + "\n"
            + "    @Ensures(\"result > x\")\n"
            + "    int dec(int x) { return x - 1; }\n"
            + "}\n";

    static final String SUM = "class Sum {\n"
            + "    int sum(int n) {\n"
            + "        pre(n >= 1);\n"
            + "        post(\"2 * result == n * (n - 1)\");\n"
            + "        int s = 0;\n"
            + "        int i = 1;\n"
            + "        invariant(\"2 * s == i * (i - 1) && i <= n\");\n"
            + "        while (i < n) {\n"
            + "            s = s + i;\n"
            + "            i = i + 1;\n"
            + "        }\n"
            + "        return s;\n"
            + "    }\n"
            + "}\n";

    @TempDir
    Path dir;

    private static VerifierOptions options() {
        return new VerifierOptions().setCollectMetrics(false).setParallelism(2);
    }

    @Test
    void verifiesEveryMethodOfADirectory() throws IOException {
        Files.writeString(dir.resolve("Calc.java"), CALC);
        Files.writeString(dir.resolve("Sum.java"), SUM);

        List<FunctionReport> reports = new SourceProcessor(options()).process(List.of(dir));

        assertEquals(3, reports.size());
        assertEquals("Calc.inc", reports.get(0).getFunctionName());
        assertEquals(FunctionVerdict.VERIFIED, reports.get(0).getVerdict());
        assertEquals("Calc.dec", reports.get(1).getFunctionName());
        assertEquals(FunctionVerdict.FAILED, reports.get(1).getVerdict());
        assertEquals("Sum.sum", reports.get(2).getFunctionName());
        assertEquals(FunctionVerdict.VERIFIED, reports.get(2).getVerdict());
    }

    @Test
    void unparseableFileIsSkipped() throws IOException {
        Files.writeString(dir.resolve("Broken.java"), "class Broken { int f( }");
        Files.writeString(dir.resolve("Calc.java"), CALC);

        List<FunctionReport> reports = new SourceProcessor(options()).process(List.of(dir));

        assertEquals(2, reports.size());
    }

    @Test
    void extractFunctionsRejectsUnparseableFile() throws IOException {
        Path broken = dir.resolve("Broken.java");
        Files.writeString(broken, "class Broken { int f( }");

        assertThrows(IOException.class, () -> new SourceProcessor(options()).extractFunctions(broken));
    }

    @Test
    void extractFunctionsUsesFileNameAsOrigin() throws IOException {
        Path calc = dir.resolve("Calc.java");
        Files.writeString(calc, CALC);

        List<FunctionDecl> functions = new SourceProcessor(options()).extractFunctions(calc);

        assertEquals(2, functions.size());
        assertEquals("Calc.java", functions.get(0).getSpan().getOrigin());
    }

    @Test
    void missingPathFails() {
        assertThrows(IOException.class,
                () -> new SourceProcessor(options()).process(List.of(dir.resolve("missing"))));
    }

    @Test
    void externalContractsSummariseCalls() throws IOException {
        Path contracts = dir.resolve("contracts.json");
        Files.writeString(contracts, "{\"externalMethods\": [{\"name\": \"clamp\", \"parameters\": [{\"name\": \"v\"}],"
                + " \"returns\": \"int\", \"postconditions\": [\"result >= 0 && result <= 10\"]}]}");
        Path source = dir.resolve("User.java");
        Files.writeString(source, "class User {\n"
                + "    @Ensures(\"result <= 10\")\n"
                + "    int use(int x) { return clamp(x); }\n"
                + "}\n");

        List<FunctionReport> reports = new SourceProcessor(options().setContractsFile(contracts)).process(List.of(source));

        assertEquals(1, reports.size());
        assertEquals(FunctionVerdict.VERIFIED, reports.get(0).getVerdict());
    }

    @Test
    void divisionAndRemainderFollowJava() throws IOException {
        Path source = dir.resolve("Halves.java");
        Files.writeString(source, "class Halves {\n"
                + "    int half(int x) { post(\"2 * result <= x\"); return x / 2; }\n"
                + "    int rem(int x) { post(\"result >= 0\"); return x % 2; }\n"
                + "    int halfOfNatural(int x) { pre(x >= 0); post(\"2 * result <= x\"); return x / 2; }\n"
                + "    int remSign(int x) { post(\"result <= 0 || x > 0\"); return x % 2; }\n"
                + "}\n");

        List<FunctionReport> reports = new SourceProcessor(options()).process(List.of(source));

        assertEquals(4, reports.size());
        assertEquals(FunctionVerdict.FAILED, reports.get(0).getVerdict());
        assertEquals(FunctionVerdict.FAILED, reports.get(1).getVerdict());
        assertEquals(FunctionVerdict.VERIFIED, reports.get(2).getVerdict());
        assertEquals(FunctionVerdict.VERIFIED, reports.get(3).getVerdict());
    }

    @Test
    void contractOfAnotherTypeDoesNotSummariseLocalCall() throws IOException {
        Files.writeString(dir.resolve("A.java"), "class A {\n"
                + "    @Ensures(\"result > 0\")\n"
                + "    int f(int x) { return 1; }\n"
                + "}\n");
        Files.writeString(dir.resolve("B.java"), "class B {\n"
                + "    int f(int x) { return -1; }\n"
                + "\n"
                + "    @Ensures(\"result > 0\")\n"
                + "    int g(int x) { int y = f(x); return y; }\n"
                + "\n"
                + "    @Ensures(\"result > 0\")\n"
                + "    int h(int x) { int y = k(x); return y; }\n"
                + "\n"
                + "    @Ensures(\"result > 0\")\n"
                + "    int k(int x) { return 5; }\n"
                + "}\n");

        List<FunctionReport> reports = new SourceProcessor(options()).process(List.of(dir));

        assertEquals(5, reports.size());
        assertEquals("A.f", reports.get(0).getFunctionName());
        assertEquals(FunctionVerdict.VERIFIED, reports.get(0).getVerdict());
        FunctionReport g = reports.get(2);
        assertEquals("B.g", g.getFunctionName());
        assertNotEquals(FunctionVerdict.VERIFIED, g.getVerdict());
        assertEquals("B.h", reports.get(3).getFunctionName());
        assertEquals(FunctionVerdict.VERIFIED, reports.get(3).getVerdict());
    }

    @Test
    void sameMethodNameInTwoTypesIsReportedSeparately() throws IOException {
        Files.writeString(dir.resolve("Up.java"), "package acme;\n"
                + "class Up { @Ensures(\"result > x\") int step(int x) { return x + 1; } }\n");
        Files.writeString(dir.resolve("Down.java"), "package acme;\n"
                + "class Down { @Ensures(\"result > x\") int step(int x) { return x - 1; } }\n");

        List<FunctionReport> reports = new SourceProcessor(options()).process(List.of(dir));

        assertEquals(2, reports.size());
        assertEquals("acme.Down.step", reports.get(0).getFunctionName());
        assertEquals(FunctionVerdict.FAILED, reports.get(0).getVerdict());
        assertEquals("acme.Up.step", reports.get(1).getFunctionName());
        assertEquals(FunctionVerdict.VERIFIED, reports.get(1).getVerdict());
    }

    @Test
    void writesMetricsNextToSources() throws IOException {
        Files.writeString(dir.resolve("Calc.java"), CALC);

        new SourceProcessor(options().setCollectMetrics(true)).process(List.of(dir));

        assertTrue(Files.exists(dir.resolve(SourceProcessor.METRICS_FILE)));
    }
}
