package io.expandcheck.report;

import io.expandcheck.EngineConfig;
import io.expandcheck.ExpansionEngine;
import io.expandcheck.analysis.AnalysisReport;
import io.expandcheck.analysis.UnitAnalyzer;
import io.expandcheck.unit.CompilationUnit;
import io.expandcheck.unit.UnitLoader;

import java.io.IOException;
import java.io.InputStream;

final class ReportFixtures {

    private ReportFixtures() {
    }

    static AnalysisReport analyzeResource(String name) throws IOException {
        CompilationUnit unit;
        try (InputStream in = ReportFixtures.class.getResourceAsStream("/units/" + name)) {
            unit = new UnitLoader().load(in, name);
        }
        EngineConfig config = EngineConfig.loadDefault();
        return new UnitAnalyzer(ExpansionEngine.standard(unit.symbols(), config), config).analyze(unit);
    }
}
